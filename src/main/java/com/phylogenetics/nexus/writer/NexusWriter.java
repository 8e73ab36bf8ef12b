package com.phylogenetics.nexus.writer;

import java.io.IOException;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.phylogenetics.nexus.handler.BlockHandler;
import com.phylogenetics.nexus.model.NexusDocument;
import com.phylogenetics.nexus.util.FileWriteUtil;

/**
 * Serializes a document: the {@code #NEXUS} header followed by each block's own text.
 */
public class NexusWriter {
    private static final Logger log = LoggerFactory.getLogger(NexusWriter.class);

    public static final String HEADER = "#NEXUS";

    public String write(NexusDocument document) {
        StringBuilder sb = new StringBuilder(HEADER).append('\n');
        for (BlockHandler handler : document.getBlocks().values()) {
            sb.append('\n').append(handler.write());
        }
        return sb.toString();
    }

    public void writeToFile(NexusDocument document, Path path) throws IOException {
        FileWriteUtil.safeWriteString(path, write(document));
        log.info("Wrote {} block(s) to {}", document.getBlocks().size(), path);
    }
}
