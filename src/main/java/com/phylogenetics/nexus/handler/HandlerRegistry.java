package com.phylogenetics.nexus.handler;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Maps lower-cased block names to handler factories.
 *
 * A registry is an ordinary value handed to the reader, so each caller decides
 * which block types it understands. Unregistered names get a {@link GenericHandler}.
 *
 * <pre>
 * HandlerRegistry registry = HandlerRegistry.defaults()
 *         .register("r8s", R8sHandler::new);
 * NexusDocument doc = new NexusReader(registry).read(path);
 * </pre>
 */
public class HandlerRegistry {

    private final Map<String, BlockHandlerFactory> factories = new LinkedHashMap<>();

    /**
     * An empty registry: every block is read by {@link GenericHandler}.
     */
    public static HandlerRegistry empty() {
        return new HandlerRegistry();
    }

    /**
     * A fresh registry with the built-in data, characters, trees and taxa handlers.
     */
    public static HandlerRegistry defaults() {
        return new HandlerRegistry()
                .register("data", DataHandler::new)
                .register("characters", CharactersHandler::new)
                .register("trees", TreesHandler::new)
                .register("taxa", TaxaHandler::new);
    }

    public HandlerRegistry register(String blockName, BlockHandlerFactory factory) {
        Objects.requireNonNull(blockName, "blockName");
        Objects.requireNonNull(factory, "factory");
        factories.put(blockName.toLowerCase(Locale.ROOT), factory);
        return this;
    }

    public HandlerRegistry unregister(String blockName) {
        factories.remove(blockName.toLowerCase(Locale.ROOT));
        return this;
    }

    public boolean isRegistered(String blockName) {
        return factories.containsKey(blockName.toLowerCase(Locale.ROOT));
    }

    public Set<String> getRegisteredNames() {
        return Set.copyOf(factories.keySet());
    }

    /**
     * Instantiate the handler for a block, falling back to {@link GenericHandler}.
     */
    public BlockHandler create(String blockName) {
        String key = blockName.toLowerCase(Locale.ROOT);
        return factories.getOrDefault(key, GenericHandler::new).create(key);
    }
}
