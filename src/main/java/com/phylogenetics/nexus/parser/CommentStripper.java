package com.phylogenetics.nexus.parser;

import java.util.regex.Pattern;

import lombok.experimental.UtilityClass;

/**
 * Removes bracketed NEXUS comments from a single line.
 *
 * Comments are matched non-greedily, so nested brackets are not understood and
 * brackets inside quoted labels are stripped like any other comment.
 */
@UtilityClass
public class CommentStripper {

    private static final Pattern COMMENT_PATTERN = Pattern.compile("\\[.*?\\]");

    /**
     * Strip every {@code [...]} span, keeping all remaining characters as they were.
     * Example: "He[bite]ll[me]o" -> "Hello"
     */
    public static String strip(String line) {
        if (line == null || line.indexOf('[') < 0) {
            return line;
        }
        return COMMENT_PATTERN.matcher(line).replaceAll("");
    }

    /**
     * True when the trimmed line is nothing but one comment, e.g. "[written by PAUP]".
     */
    public static boolean isWholeLineComment(String trimmedLine) {
        return trimmedLine.startsWith("[") && trimmedLine.endsWith("]");
    }
}
