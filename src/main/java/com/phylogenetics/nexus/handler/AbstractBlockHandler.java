package com.phylogenetics.nexus.handler;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import lombok.Getter;

/**
 * Shared state and keyword helpers for the built-in handlers.
 */
public abstract class AbstractBlockHandler implements BlockHandler {

    private static final Pattern KEYWORD_PATTERN = Pattern.compile("^([A-Za-z_]+)");

    @Getter
    private final String blockName;

    /** Declarations the handler does not interpret (TITLE, LINK, ...), in order. */
    @Getter
    protected final List<String> attributes = new ArrayList<>();

    protected AbstractBlockHandler(String blockName) {
        this.blockName = blockName;
    }

    /**
     * Lower-cased leading word of a statement, or "" when it starts with something else.
     */
    protected static String keywordOf(String line) {
        Matcher m = KEYWORD_PATTERN.matcher(line);
        return m.find() ? m.group(1).toLowerCase(Locale.ROOT) : "";
    }

    /**
     * Remainder of a statement after its keyword, without the trailing ';'.
     */
    protected static String payloadOf(String line, String keyword) {
        String rest = line.substring(Math.min(keyword.length(), line.length())).strip();
        return stripTerminator(rest);
    }

    protected static String stripTerminator(String text) {
        String s = text.strip();
        return s.endsWith(";") ? s.substring(0, s.length() - 1).strip() : s;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + blockName + "]";
    }
}
