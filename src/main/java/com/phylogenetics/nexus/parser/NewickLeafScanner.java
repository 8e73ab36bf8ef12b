package com.phylogenetics.nexus.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Walks the Newick part of a tree statement and visits its leaf labels.
 *
 * A token counts as a leaf label only when it directly follows '(' or ',' (or
 * starts the Newick string). Branch lengths after ':', internal node labels
 * after ')', and bracketed comments are copied untouched, so a label such as
 * {@code 4} never matches inside {@code 40}, {@code :4} or {@code four-1}.
 */
public class NewickLeafScanner {

    private static final String DELIMITERS = "(),:;[";

    private final String statement;
    private final int newickStart;

    public NewickLeafScanner(String statement) {
        this.statement = statement;
        this.newickStart = findNewickStart(statement);
    }

    /**
     * Rewrite every leaf label with {@code rewriter}, which receives the raw token
     * (quotes included) and returns its replacement.
     */
    public String rewriteLeaves(UnaryOperator<String> rewriter) {
        StringBuilder out = new StringBuilder(statement.length() + 16);
        out.append(statement, 0, newickStart);
        scan(out, rewriter);
        return out.toString();
    }

    /**
     * Raw leaf tokens in the order they appear.
     */
    public List<String> leafLabels() {
        List<String> labels = new ArrayList<>();
        scan(new StringBuilder(), token -> {
            labels.add(token);
            return token;
        });
        return labels;
    }

    private void scan(StringBuilder out, UnaryOperator<String> rewriter) {
        boolean leafPosition = true;
        int pos = newickStart;
        int length = statement.length();

        while (pos < length) {
            char c = statement.charAt(pos);

            if (c == '[') {
                int close = statement.indexOf(']', pos);
                int end = close < 0 ? length : close + 1;
                out.append(statement, pos, end);
                pos = end;
            } else if (Character.isWhitespace(c)) {
                out.append(c);
                pos++;
            } else if (c == '(' || c == ',') {
                out.append(c);
                leafPosition = true;
                pos++;
            } else if (c == ')' || c == ':' || c == ';') {
                out.append(c);
                leafPosition = false;
                pos++;
            } else {
                int end = c == '\'' ? quotedTokenEnd(pos) : plainTokenEnd(pos);
                String token = statement.substring(pos, end);
                out.append(leafPosition ? rewriter.apply(token) : token);
                leafPosition = false;
                pos = end;
            }
        }
    }

    private int plainTokenEnd(int start) {
        int pos = start;
        while (pos < statement.length()) {
            char c = statement.charAt(pos);
            if (Character.isWhitespace(c) || DELIMITERS.indexOf(c) >= 0) {
                break;
            }
            pos++;
        }
        return pos;
    }

    private int quotedTokenEnd(int start) {
        int pos = start + 1;
        while (pos < statement.length()) {
            if (statement.charAt(pos) == '\'') {
                // '' is an escaped quote inside the label
                if (pos + 1 < statement.length() && statement.charAt(pos + 1) == '\'') {
                    pos += 2;
                    continue;
                }
                return pos + 1;
            }
            pos++;
        }
        return statement.length();
    }

    /**
     * Index just after the '=' of "tree name = ...", skipping comments and quoted
     * tree names. A bare Newick string starts at 0.
     */
    private static int findNewickStart(String statement) {
        boolean quoted = false;
        boolean comment = false;
        for (int i = 0; i < statement.length(); i++) {
            char c = statement.charAt(i);
            if (comment) {
                comment = c != ']';
            } else if (c == '\'') {
                quoted = !quoted;
            } else if (!quoted && c == '[') {
                comment = true;
            } else if (!quoted && c == '=') {
                return i + 1;
            } else if (!quoted && c == '(') {
                return 0;
            }
        }
        return 0;
    }
}
