package com.phylogenetics.nexus.model;

import lombok.experimental.UtilityClass;

/**
 * Quoting rules for NEXUS tokens such as taxon names.
 */
@UtilityClass
public class NexusNames {

    // '-' and '.' are left out: names like "four-1" or "De.Ang" are written bare in practice
    private static final String PUNCTUATION = "()[]{}/\\,;:=*'\"`+<>";

    public static boolean needsQuoting(String name) {
        if (name.isEmpty()) {
            return true;
        }
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (Character.isWhitespace(c) || PUNCTUATION.indexOf(c) >= 0) {
                return true;
            }
        }
        return false;
    }

    /**
     * Wrap in single quotes (doubling embedded quotes) only when the bare name would
     * not survive re-parsing.
     */
    public static String quoteIfNeeded(String name) {
        return needsQuoting(name) ? quote(name) : name;
    }

    public static String quote(String name) {
        return "'" + name.replace("'", "''") + "'";
    }

    /**
     * Remove one level of single or double quotes, undoing doubled single quotes.
     */
    public static String unquote(String token) {
        if (token.length() >= 2) {
            char first = token.charAt(0);
            char last = token.charAt(token.length() - 1);
            if (first == '\'' && last == '\'') {
                return token.substring(1, token.length() - 1).replace("''", "'");
            }
            if (first == '"' && last == '"') {
                return token.substring(1, token.length() - 1);
            }
        }
        return token;
    }
}
