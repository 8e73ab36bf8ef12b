package com.phylogenetics.nexus.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Options of a {@code format} statement, in declaration order.
 *
 * Keys are lower-case. A bare keyword such as {@code interleave} is a flag and
 * reads back as the value "true". Any key is kept, recognised or not.
 */
public class DataFormat {

    public static final String DATATYPE = "datatype";
    public static final String SYMBOLS = "symbols";
    public static final String GAP = "gap";
    public static final String MISSING = "missing";
    public static final String INTERLEAVE = "interleave";
    public static final String LABELS = "labels";

    private static final String FLAG_VALUE = Boolean.TRUE.toString();

    private final Map<String, String> options = new LinkedHashMap<>();
    private final Set<String> flags = new LinkedHashSet<>();

    public void put(String key, String value) {
        String k = key.toLowerCase(Locale.ROOT);
        flags.remove(k);
        options.put(k, value);
    }

    public void setFlag(String key) {
        String k = key.toLowerCase(Locale.ROOT);
        flags.add(k);
        options.put(k, FLAG_VALUE);
    }

    public void remove(String key) {
        String k = key.toLowerCase(Locale.ROOT);
        flags.remove(k);
        options.remove(k);
    }

    public Optional<String> get(String key) {
        return Optional.ofNullable(options.get(key.toLowerCase(Locale.ROOT)));
    }

    public boolean contains(String key) {
        return options.containsKey(key.toLowerCase(Locale.ROOT));
    }

    public boolean isFlag(String key) {
        return flags.contains(key.toLowerCase(Locale.ROOT));
    }

    public boolean isEmpty() {
        return options.isEmpty();
    }

    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(options);
    }

    public Optional<String> getDatatype() {
        return get(DATATYPE);
    }

    public Optional<String> getSymbols() {
        return get(SYMBOLS);
    }

    public Optional<String> getGap() {
        return get(GAP);
    }

    public Optional<String> getMissing() {
        return get(MISSING);
    }

    public boolean isInterleave() {
        return isFlag(INTERLEAVE) || get(INTERLEAVE).map(v -> v.equalsIgnoreCase("yes")).orElse(false);
    }

    public boolean hasLabels() {
        return isFlag(LABELS);
    }

    /**
     * Render as the body of a format statement, e.g. {@code datatype=standard gap=- symbols="01"}.
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> option : options.entrySet()) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            String key = option.getKey();
            if (flags.contains(key)) {
                sb.append(key);
                continue;
            }
            String value = option.getValue();
            boolean quote = SYMBOLS.equals(key) || value.isEmpty() || value.chars().anyMatch(Character::isWhitespace);
            sb.append(key).append('=').append(quote ? '"' + value + '"' : value);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return render();
    }
}
