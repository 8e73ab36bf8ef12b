package com.phylogenetics.nexus.handler;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.phylogenetics.nexus.model.NexusNames;
import com.phylogenetics.nexus.parser.CommentStripper;
import com.phylogenetics.nexus.parser.NewickLeafScanner;
import com.phylogenetics.nexus.writer.BlockTextBuilder;

import lombok.Getter;

/**
 * Handler for {@code trees} blocks: an optional translate table and a list of tree
 * statements kept verbatim.
 *
 * Trees stay in their translated (numeric label) form until {@link #detranslate()}
 * is called.
 */
public class TreesHandler extends AbstractBlockHandler {
    private static final Logger log = LoggerFactory.getLogger(TreesHandler.class);

    private static final String TRANSLATE = "translate";

    /** Label to taxon name, in table order. */
    @Getter
    private final Map<String, String> translators = new LinkedHashMap<>();

    /** Raw tree statements, e.g. {@code tree t1 = (1,2,3);}. */
    @Getter
    private final List<String> trees = new ArrayList<>();

    @Getter
    private boolean wasTranslated;

    @Getter
    private boolean beenDetranslated;

    public TreesHandler(String blockName) {
        super(blockName);
    }

    public TreesHandler() {
        this("trees");
    }

    @Override
    public void parse(List<String> lines) {
        StringBuilder pending = null;
        boolean pendingIsTranslate = false;

        for (String raw : lines) {
            String line = raw.strip();

            if (pending == null) {
                String keyword = keywordOf(CommentStripper.strip(line).strip());
                if (keyword.equals(TRANSLATE)) {
                    pendingIsTranslate = true;
                } else if (keyword.equals("tree") || keyword.equals("utree")) {
                    pendingIsTranslate = false;
                } else {
                    attributes.add(line);
                    continue;
                }
                pending = new StringBuilder(line);
            } else {
                pending.append(' ').append(line);
            }

            if (isComplete(pending)) {
                finishStatement(pending.toString(), pendingIsTranslate);
                pending = null;
            }
        }

        if (pending != null) {
            log.warn("Block '{}' ends inside an unterminated {} statement", getBlockName(),
                    pendingIsTranslate ? TRANSLATE : "tree");
            finishStatement(pending.toString(), pendingIsTranslate);
        }
        log.debug("Parsed block '{}': {} trees, {} translations", getBlockName(), trees.size(), translators.size());
    }

    private static boolean isComplete(StringBuilder statement) {
        return CommentStripper.strip(statement.toString()).strip().endsWith(";");
    }

    private void finishStatement(String statement, boolean translate) {
        if (translate) {
            parseTranslate(statement);
        } else {
            trees.add(statement);
        }
    }

    /**
     * Parse {@code translate 1 A, 2 'B c', 3 C;}. Trailing commas are tolerated and
     * quoted names are unquoted.
     */
    private void parseTranslate(String statement) {
        String body = stripTerminator(CommentStripper.strip(statement).strip().substring(TRANSLATE.length()));

        for (String entry : splitOutsideQuotes(body, ',')) {
            String pair = entry.strip();
            if (pair.isEmpty()) {
                continue;
            }
            String[] parts = pair.split("\\s+", 2);
            if (parts.length < 2) {
                log.warn("Ignoring translate entry without a taxon name: '{}'", pair);
                continue;
            }
            translators.put(NexusNames.unquote(parts[0]), NexusNames.unquote(parts[1].strip()));
        }
        wasTranslated = true;
    }

    private static List<String> splitOutsideQuotes(String text, char separator) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        for (char c : text.toCharArray()) {
            if (c == '\'') {
                quoted = !quoted;
            }
            if (c == separator && !quoted) {
                parts.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        parts.add(current.toString());
        return parts;
    }

    public int getNtrees() {
        return trees.size();
    }

    public String get(int index) {
        return trees.get(index);
    }

    /**
     * Taxa named by this block: the translate table's names when there is one,
     * otherwise the leaf labels of the trees.
     */
    public Set<String> getTaxa() {
        if (!translators.isEmpty()) {
            return new LinkedHashSet<>(translators.values());
        }
        Set<String> taxa = new LinkedHashSet<>();
        for (String tree : trees) {
            for (String label : new NewickLeafScanner(tree).leafLabels()) {
                taxa.add(NexusNames.unquote(label));
            }
        }
        return taxa;
    }

    /**
     * Replace translated leaf labels with taxon names in every tree. Does nothing when
     * there is no translate table or the trees were already detranslated.
     */
    public void detranslate() {
        if (beenDetranslated || translators.isEmpty()) {
            return;
        }
        trees.replaceAll(tree -> relabel(tree, translators));
        beenDetranslated = true;
    }

    /**
     * Inverse of {@link #detranslate()}: put the translate table's labels back.
     */
    public void retranslate() {
        if (!beenDetranslated) {
            return;
        }
        Map<String, String> inverse = new LinkedHashMap<>();
        translators.forEach((label, taxon) -> inverse.put(taxon, label));
        trees.replaceAll(tree -> relabel(tree, inverse));
        beenDetranslated = false;
    }

    private static String relabel(String tree, Map<String, String> mapping) {
        return new NewickLeafScanner(tree).rewriteLeaves(token -> {
            String replacement = mapping.get(NexusNames.unquote(token));
            return replacement == null ? token : NexusNames.quoteIfNeeded(replacement);
        });
    }

    /**
     * Strip bracketed comments such as {@code [&lnP=-15795.47]} from every tree.
     */
    public void removeComments() {
        trees.replaceAll(CommentStripper::strip);
    }

    /**
     * Rename a taxon in the translate table, or in the tree strings when untranslated.
     */
    public void renameTaxon(String oldName, String newName) {
        if (!translators.isEmpty()) {
            translators.replaceAll((label, taxon) -> taxon.equals(oldName) ? newName : taxon);
        }
        if (translators.isEmpty() || beenDetranslated) {
            trees.replaceAll(tree -> relabel(tree, Map.of(oldName, newName)));
        }
    }

    @Override
    public String write() {
        BlockTextBuilder out = new BlockTextBuilder(getBlockName());
        out.attributes(attributes);

        if (!translators.isEmpty() && !beenDetranslated) {
            out.statement(TRANSLATE);
            Iterator<Map.Entry<String, String>> it = translators.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<String, String> entry = it.next();
                String pair = entry.getKey() + " " + NexusNames.quoteIfNeeded(entry.getValue());
                out.statement(BlockTextBuilder.INDENT + pair + (it.hasNext() ? "," : ";"));
            }
        }
        trees.forEach(out::statement);
        return out.end();
    }

    @Override
    public String toString() {
        return "<NexusTreeBlock: " + trees.size() + " trees>";
    }
}
