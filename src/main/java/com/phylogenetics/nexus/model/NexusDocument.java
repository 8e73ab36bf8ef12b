package com.phylogenetics.nexus.model;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.phylogenetics.nexus.handler.BlockHandler;
import com.phylogenetics.nexus.handler.DataHandler;
import com.phylogenetics.nexus.handler.TaxaHandler;
import com.phylogenetics.nexus.handler.TreesHandler;
import com.phylogenetics.nexus.writer.NexusWriter;

import lombok.Getter;

/**
 * A parsed NEXUS file: its blocks keyed by lower-case name, in file order.
 *
 * The container itself is fixed after parsing; manipulation happens by mutating
 * the handlers it holds.
 */
public class NexusDocument {

    private final Map<String, BlockHandler> blocks = new LinkedHashMap<>();
    private final Set<String> rawBlockNames = new LinkedHashSet<>();

    /** File the document was read from, if any. */
    @Getter
    private final Path source;

    public NexusDocument(Path source) {
        this.source = source;
    }

    public NexusDocument() {
        this(null);
    }

    /**
     * Add a block under its lower-cased name. Used by the reader.
     */
    public void addBlock(String rawName, BlockHandler handler) {
        rawBlockNames.add(rawName);
        blocks.put(rawName.toLowerCase(Locale.ROOT), handler);
    }

    public Map<String, BlockHandler> getBlocks() {
        return Collections.unmodifiableMap(blocks);
    }

    /** Block names with the casing used in the file. */
    public Set<String> getRawBlockNames() {
        return Collections.unmodifiableSet(rawBlockNames);
    }

    public boolean hasBlock(String name) {
        return blocks.containsKey(name.toLowerCase(Locale.ROOT));
    }

    public Optional<BlockHandler> getBlock(String name) {
        return Optional.ofNullable(blocks.get(name.toLowerCase(Locale.ROOT)));
    }

    /**
     * The data block, or the characters block when there is no data block.
     */
    public DataHandler getData() {
        BlockHandler handler = blocks.containsKey("data") ? blocks.get("data") : blocks.get("characters");
        return handler instanceof DataHandler data ? data : null;
    }

    public TreesHandler getTrees() {
        return blocks.get("trees") instanceof TreesHandler trees ? trees : null;
    }

    public TaxaHandler getTaxa() {
        return blocks.get("taxa") instanceof TaxaHandler taxa ? taxa : null;
    }

    public String write() {
        return new NexusWriter().write(this);
    }

    public void writeToFile(Path path) throws IOException {
        new NexusWriter().writeToFile(this, path);
    }

    @Override
    public String toString() {
        return "<NexusDocument " + (source != null ? source + " " : "") + blocks.values() + ">";
    }
}
