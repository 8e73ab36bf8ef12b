package com.phylogenetics.nexus.handler;

import java.util.ArrayList;
import java.util.List;

import com.phylogenetics.nexus.writer.BlockTextBuilder;

import lombok.Getter;

/**
 * Fallback for block types without a dedicated handler: keeps the lines verbatim.
 */
public class GenericHandler extends AbstractBlockHandler {

    @Getter
    private final List<String> storage = new ArrayList<>();

    public GenericHandler(String blockName) {
        super(blockName);
    }

    @Override
    public void parse(List<String> lines) {
        storage.addAll(lines);
    }

    @Override
    public String write() {
        BlockTextBuilder out = new BlockTextBuilder(getBlockName());
        storage.forEach(out::statement);
        return out.end();
    }
}
