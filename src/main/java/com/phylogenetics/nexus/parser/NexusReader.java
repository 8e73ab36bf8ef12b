package com.phylogenetics.nexus.parser;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.phylogenetics.nexus.handler.BlockHandler;
import com.phylogenetics.nexus.handler.HandlerRegistry;
import com.phylogenetics.nexus.model.NexusDocument;
import com.phylogenetics.nexus.util.FileWriteUtil;

/**
 * Entry point for reading NEXUS text into a {@link NexusDocument}.
 *
 * Each block found by {@link NexusBlockSplitter} is handed to the handler the
 * registry provides for its name. Errors propagate immediately; there is no
 * partial document.
 */
public class NexusReader {
    private static final Logger log = LoggerFactory.getLogger(NexusReader.class);

    private final HandlerRegistry registry;

    public NexusReader() {
        this(HandlerRegistry.defaults());
    }

    public NexusReader(HandlerRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * Load and parse a NEXUS file.
     */
    public NexusDocument read(Path path) throws IOException {
        Objects.requireNonNull(path, "path");
        String content = FileWriteUtil.readString(path);
        log.info("Parsing NEXUS file: {}", path);
        return parse(content, new NexusDocument(path));
    }

    /**
     * Parse NEXUS text held in memory.
     */
    public NexusDocument parse(String text) {
        return parse(text, new NexusDocument());
    }

    private NexusDocument parse(String text, NexusDocument document) {
        List<RawBlock> rawBlocks = new NexusBlockSplitter(text).split();

        for (RawBlock raw : rawBlocks) {
            BlockHandler handler = registry.create(raw.getName());
            log.debug("Read block: {} with {} lines, parsing with {}",
                    raw.getName(), raw.getLines().size(), handler.getClass().getSimpleName());
            handler.parse(raw.getLines());
            document.addBlock(raw.getName(), handler);
        }
        return document;
    }
}
