package com.phylogenetics.nexus.parser;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.phylogenetics.nexus.exception.DuplicateBlockException;
import com.phylogenetics.nexus.exception.UnterminatedBlockException;

/**
 * Splits NEXUS source text into raw blocks.
 *
 * Splitting only:
 * - Trims lines and drops blank lines and whole-line comments
 * - Groups the lines between {@code begin <name>;} and {@code end;}
 * - Rejects duplicate block names
 *
 * Statements written on the same line as {@code begin <name>;} become separate block
 * lines, and {@code end;} closes a block when it is the last statement of a line, so
 * {@code Begin data; Dimensions ntax=1 nchar=1; Matrix} and {@code ; End;} are both read.
 * Comments inside lines are kept; handlers strip them where they need to.
 */
public class NexusBlockSplitter {
    private static final Logger log = LoggerFactory.getLogger(NexusBlockSplitter.class);

    private static final Pattern BEGIN_PATTERN = Pattern.compile("^begin\\s+(\\w+)\\s*;", Pattern.CASE_INSENSITIVE);
    private static final Pattern END_PATTERN = Pattern.compile(
            "(?:^|(?<=[\\s;]))end(?:block)?\\s*;\\s*(?:\\[[^\\]]*\\]\\s*)*$", Pattern.CASE_INSENSITIVE);
    private static final String TERMINATOR = ";";

    private final String source;

    public NexusBlockSplitter(String source) {
        this.source = source == null ? "" : source;
    }

    /**
     * Split the whole source into blocks, in the order they appear.
     */
    public List<RawBlock> split() {
        Map<String, RawBlock> blocks = new LinkedHashMap<>();
        OpenBlock open = null;

        String[] lines = source.split("\\r?\\n|\\r");
        for (int i = 0; i < lines.length; i++) {
            int lineNo = i + 1;
            String line = lines[i].strip();

            if (line.isEmpty() || CommentStripper.isWholeLineComment(line)) {
                continue;
            }

            Matcher begin = BEGIN_PATTERN.matcher(line);
            if (begin.find()) {
                if (open != null) {
                    // a bare ';' may legitimately be the last thing a block says
                    if (!open.endsWithTerminator()) {
                        throw new UnterminatedBlockException(open.name, open.startLine);
                    }
                    close(blocks, open);
                }
                open = new OpenBlock(begin.group(1), lineNo);
                if (blocks.containsKey(normalizeName(open.name))) {
                    throw new DuplicateBlockException(normalizeName(open.name), lineNo);
                }
                for (String statement : splitStatements(line.substring(begin.end()))) {
                    if (open.accept(statement)) {
                        close(blocks, open);
                        open = null;
                        break;
                    }
                }
                continue;
            }

            if (open == null) {
                log.trace("Ignoring line {} outside any block: {}", lineNo, line);
                continue;
            }

            if (open.accept(line)) {
                close(blocks, open);
                open = null;
            }
        }

        if (open != null) {
            if (!open.endsWithTerminator()) {
                throw new UnterminatedBlockException(open.name, open.startLine);
            }
            log.debug("Block '{}' closed by a bare ';' at end of input", open.name);
            close(blocks, open);
        }

        return new ArrayList<>(blocks.values());
    }

    private void close(Map<String, RawBlock> blocks, OpenBlock block) {
        blocks.put(normalizeName(block.name), new RawBlock(block.name, block.startLine, List.copyOf(block.lines)));
        log.debug("Read block '{}' with {} lines", block.name, block.lines.size());
    }

    /**
     * Split text into ';'-terminated statements. Semicolons inside quotes or brackets do
     * not end a statement; a trailing unterminated statement is kept as is.
     */
    static List<String> splitStatements(String text) {
        List<String> statements = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        char quote = 0;
        int depth = 0;

        for (char c : text.toCharArray()) {
            current.append(c);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == '[') {
                depth++;
            } else if (c == ']' && depth > 0) {
                depth--;
            } else if (c == ';' && depth == 0) {
                addStatement(statements, current);
            }
        }
        addStatement(statements, current);
        return statements;
    }

    private static void addStatement(List<String> statements, StringBuilder current) {
        String statement = current.toString().strip();
        if (!statement.isEmpty()) {
            statements.add(statement);
        }
        current.setLength(0);
    }

    static String normalizeName(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    private static final class OpenBlock {
        private final String name;
        private final int startLine;
        private final List<String> lines = new ArrayList<>();

        private OpenBlock(String name, int startLine) {
            this.name = name;
            this.startLine = startLine;
        }

        /**
         * Add a line to the block. Returns true when the line ends with the block's
         * {@code end;}, keeping whatever came before it on the line.
         */
        private boolean accept(String line) {
            Matcher end = END_PATTERN.matcher(line);
            if (!end.find()) {
                lines.add(line);
                return false;
            }
            String before = line.substring(0, end.start()).strip();
            if (!before.isEmpty()) {
                lines.add(before);
            }
            return true;
        }

        private boolean endsWithTerminator() {
            return !lines.isEmpty() && TERMINATOR.equals(lines.get(lines.size() - 1));
        }
    }
}
