package com.phylogenetics.nexus.handler;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.phylogenetics.nexus.exception.MalformedDimensionsException;
import com.phylogenetics.nexus.exception.UnsupportedConstructException;
import com.phylogenetics.nexus.model.DataFormat;
import com.phylogenetics.nexus.model.NexusNames;
import com.phylogenetics.nexus.parser.CommentStripper;
import com.phylogenetics.nexus.writer.BlockTextBuilder;

import lombok.Getter;
import lombok.Setter;

/**
 * Handler for {@code data} blocks: dimensions, format options and the character matrix.
 *
 * Each matrix line contributes one fragment to its taxon, so an interleaved matrix
 * ends up with one fragment per pass; {@link #getSequence(String)} joins them.
 */
public class DataHandler extends AbstractBlockHandler {
    private static final Logger log = LoggerFactory.getLogger(DataHandler.class);

    private static final Pattern NTAX_PATTERN = Pattern.compile("ntax\\s*=\\s*(\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern NCHAR_PATTERN = Pattern.compile("nchar\\s*=\\s*(\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Set<String> MISSING_STATES = Set.of("-", "?");

    @Getter
    @Setter
    private int ntaxa;

    @Getter
    @Setter
    private int nchar;

    @Getter
    private final DataFormat format = new DataFormat();

    /** Taxon to its sequence fragments, one per matrix pass. */
    @Getter
    private final Map<String, List<String>> matrix = new LinkedHashMap<>();

    /** Taxa in first-seen order. */
    @Getter
    private final List<String> taxa = new ArrayList<>();

    /** Inconsistencies between the declared dimensions and the matrix, found while parsing. */
    @Getter
    private final List<String> warnings = new ArrayList<>();

    private boolean ntaxDeclared;
    private boolean dimensionsSeen;

    public DataHandler(String blockName) {
        super(blockName);
    }

    public DataHandler() {
        this("data");
    }

    /**
     * Whether a dimensions statement must carry ntax. A characters block may take its
     * taxa from a linked taxa block instead.
     */
    protected boolean requiresNtax() {
        return true;
    }

    @Override
    public void parse(List<String> lines) {
        boolean inMatrix = false;

        for (String raw : lines) {
            String line = CommentStripper.strip(raw).strip();
            if (line.isEmpty()) {
                continue;
            }

            if (inMatrix) {
                if (line.equals(";")) {
                    inMatrix = false;
                } else {
                    inMatrix = !readMatrixLine(line);
                }
                continue;
            }

            String keyword = keywordOf(line);
            switch (keyword) {
                case "dimensions":
                    parseDimensions(line);
                    break;
                case "format":
                    parseFormat(payloadOf(line, keyword));
                    break;
                case "matrix":
                    inMatrix = true;
                    String rest = line.substring(keyword.length()).strip();
                    if (!rest.isEmpty()) {
                        inMatrix = !rest.equals(";") && !readMatrixLine(rest);
                    }
                    break;
                case "charstatelabels":
                    throw new UnsupportedConstructException(
                            "charstatelabels in block '" + getBlockName() + "' is not supported");
                default:
                    attributes.add(raw.strip());
                    break;
            }
        }

        if (!dimensionsSeen) {
            throw new MalformedDimensionsException(getBlockName(), "dimensions statement", "<none>");
        }
        if (!ntaxDeclared) {
            ntaxa = taxa.size();
        }
        if (ntaxa != taxa.size()) {
            warn("Block '" + getBlockName() + "' declares ntax=" + ntaxa + " but the matrix has " + taxa.size() + " taxa");
        }
        for (String taxon : taxa) {
            int sites = getSites(taxon).size();
            if (sites != nchar) {
                warn("Taxon '" + taxon + "' in block '" + getBlockName() + "' has " + sites
                        + " sites but nchar=" + nchar);
            }
        }
        log.debug("Parsed block '{}': {} characters from {} taxa", getBlockName(), nchar, ntaxa);
    }

    private void warn(String message) {
        log.warn(message);
        warnings.add(message);
    }

    private void parseDimensions(String line) {
        dimensionsSeen = true;

        Matcher ntax = NTAX_PATTERN.matcher(line);
        if (ntax.find()) {
            ntaxa = Integer.parseInt(ntax.group(1));
            ntaxDeclared = true;
        } else if (requiresNtax()) {
            throw new MalformedDimensionsException(getBlockName(), "ntax", line);
        }

        Matcher nc = NCHAR_PATTERN.matcher(line);
        if (!nc.find()) {
            throw new MalformedDimensionsException(getBlockName(), "nchar", line);
        }
        nchar = Integer.parseInt(nc.group(1));
    }

    /**
     * Tokenize a format payload such as {@code datatype=RNA missing=? symbols="ACGU" interleave}.
     * Keys and values are lower-cased and quotes removed; bare keywords become flags.
     */
    void parseFormat(String payload) {
        int pos = 0;
        int length = payload.length();

        while (pos < length) {
            while (pos < length && Character.isWhitespace(payload.charAt(pos))) {
                pos++;
            }
            if (pos >= length) {
                break;
            }

            int keyStart = pos;
            while (pos < length && payload.charAt(pos) != '=' && !Character.isWhitespace(payload.charAt(pos))) {
                pos++;
            }
            String key = payload.substring(keyStart, pos);
            if (key.isEmpty()) {
                pos++;
                continue;
            }

            int afterKey = pos;
            while (pos < length && Character.isWhitespace(payload.charAt(pos))) {
                pos++;
            }
            if (pos >= length || payload.charAt(pos) != '=') {
                format.setFlag(key);
                pos = afterKey;
                continue;
            }

            pos++;
            while (pos < length && Character.isWhitespace(payload.charAt(pos))) {
                pos++;
            }

            String value;
            if (pos < length && (payload.charAt(pos) == '"' || payload.charAt(pos) == '\'')) {
                char quote = payload.charAt(pos);
                int close = payload.indexOf(quote, pos + 1);
                int end = close < 0 ? length : close;
                value = payload.substring(pos + 1, end);
                pos = close < 0 ? length : close + 1;
            } else {
                int valueStart = pos;
                while (pos < length && !Character.isWhitespace(payload.charAt(pos))) {
                    pos++;
                }
                value = payload.substring(valueStart, pos);
            }
            format.put(key, value.toLowerCase(Locale.ROOT));
        }
    }

    /**
     * Read one matrix row. Returns true when the row ends the matrix statement.
     */
    private boolean readMatrixLine(String line) {
        boolean terminated = line.endsWith(";");
        String body = terminated ? line.substring(0, line.length() - 1).strip() : line;

        String[] row = splitRow(body);
        if (row == null) {
            log.debug("Skipping matrix line without sequence data: '{}'", line);
            return terminated;
        }
        appendFragment(row[0], row[1]);
        return terminated;
    }

    /**
     * Split a row into taxon and fragment on the first whitespace run. Quoted taxa may
     * contain spaces. Whitespace inside the fragment is dropped.
     */
    private static String[] splitRow(String body) {
        String taxon;
        String rest;

        if (body.startsWith("'")) {
            int close = body.indexOf('\'', 1);
            while (close > 0 && close + 1 < body.length() && body.charAt(close + 1) == '\'') {
                close = body.indexOf('\'', close + 2);
            }
            if (close < 0) {
                return null;
            }
            taxon = NexusNames.unquote(body.substring(0, close + 1));
            rest = body.substring(close + 1);
        } else {
            String[] parts = body.split("\\s+", 2);
            if (parts.length < 2) {
                return null;
            }
            taxon = parts[0];
            rest = parts[1];
        }

        String fragment = rest.replaceAll("\\s+", "");
        if (taxon.isEmpty() || fragment.isEmpty()) {
            return null;
        }
        return new String[] { taxon, fragment };
    }

    private void appendFragment(String taxon, String fragment) {
        if (!matrix.containsKey(taxon)) {
            taxa.add(taxon);
            matrix.put(taxon, new ArrayList<>());
        }
        matrix.get(taxon).add(fragment);
    }

    /**
     * Full sequence of a taxon: its fragments joined in pass order.
     */
    public String getSequence(String taxon) {
        List<String> fragments = matrix.get(taxon);
        if (fragments == null) {
            throw new IllegalArgumentException("Unknown taxon: " + taxon);
        }
        return String.join("", fragments);
    }

    /**
     * Taxon to full sequence, in taxon order.
     */
    public Map<String, String> getSequences() {
        Map<String, String> sequences = new LinkedHashMap<>();
        for (String taxon : taxa) {
            sequences.put(taxon, getSequence(taxon));
        }
        return sequences;
    }

    /**
     * Site states of a taxon. A polymorphic group such as {@code (01)} or {@code {01}}
     * counts as one site.
     */
    public List<String> getSites(String taxon) {
        return splitSites(getSequence(taxon));
    }

    static List<String> splitSites(String sequence) {
        List<String> sites = new ArrayList<>(sequence.length());
        int pos = 0;
        while (pos < sequence.length()) {
            char c = sequence.charAt(pos);
            char close = c == '(' ? ')' : c == '{' ? '}' : 0;
            if (close != 0) {
                int end = sequence.indexOf(close, pos);
                end = end < 0 ? sequence.length() : end + 1;
                sites.add(sequence.substring(pos, end));
                pos = end;
            } else {
                sites.add(String.valueOf(c));
                pos++;
            }
        }
        return sites;
    }

    /**
     * Column view of the matrix: site index (0-based) to taxon to state.
     */
    public Map<Integer, Map<String, String>> getCharacters() {
        Map<Integer, Map<String, String>> characters = new LinkedHashMap<>();
        for (String taxon : taxa) {
            List<String> sites = getSites(taxon);
            for (int i = 0; i < sites.size(); i++) {
                characters.computeIfAbsent(i, k -> new LinkedHashMap<>()).put(taxon, sites.get(i));
            }
        }
        return characters;
    }

    /**
     * Declared symbols, or the states observed in the matrix when none are declared.
     * Gap and missing states are not symbols.
     */
    public Set<String> getSymbols() {
        Set<String> symbols = new TreeSet<>();
        if (format.getSymbols().isPresent()) {
            for (char c : format.getSymbols().get().replaceAll("\\s+", "").toCharArray()) {
                symbols.add(String.valueOf(c));
            }
            return symbols;
        }
        Set<String> excluded = new HashSet<>(MISSING_STATES);
        format.getGap().ifPresent(excluded::add);
        format.getMissing().ifPresent(excluded::add);
        for (String taxon : taxa) {
            for (String site : getSites(taxon)) {
                if (!excluded.contains(site)) {
                    symbols.add(site);
                }
            }
        }
        return symbols;
    }

    public void addTaxon(String taxon, String sequence) {
        if (matrix.containsKey(taxon)) {
            throw new IllegalArgumentException("Taxon already present: " + taxon);
        }
        taxa.add(taxon);
        matrix.put(taxon, new ArrayList<>(List.of(sequence)));
        ntaxa = taxa.size();
    }

    public void removeTaxon(String taxon) {
        if (matrix.remove(taxon) == null) {
            throw new IllegalArgumentException("Unknown taxon: " + taxon);
        }
        taxa.remove(taxon);
        ntaxa = taxa.size();
    }

    /**
     * Rename a taxon, keeping its position in the matrix.
     */
    public void renameTaxon(String oldName, String newName) {
        int index = taxa.indexOf(oldName);
        if (index < 0) {
            throw new IllegalArgumentException("Unknown taxon: " + oldName);
        }
        if (!oldName.equals(newName) && matrix.containsKey(newName)) {
            throw new IllegalArgumentException("Taxon already present: " + newName);
        }
        taxa.set(index, newName);

        Map<String, List<String>> renamed = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : matrix.entrySet()) {
            renamed.put(entry.getKey().equals(oldName) ? newName : entry.getKey(), entry.getValue());
        }
        matrix.clear();
        matrix.putAll(renamed);
    }

    /**
     * Delete the given sites (0-based) from every taxon and reduce nchar to match.
     * Indices outside the matrix are ignored.
     */
    public void removeSites(Collection<Integer> siteIndices) {
        Set<Integer> doomed = new HashSet<>(siteIndices);
        for (String taxon : taxa) {
            List<String> sites = getSites(taxon);
            StringBuilder kept = new StringBuilder(sites.size());
            for (int i = 0; i < sites.size(); i++) {
                if (!doomed.contains(i)) {
                    kept.append(sites.get(i));
                }
            }
            matrix.put(taxon, new ArrayList<>(List.of(kept.toString())));
        }
        long removed = doomed.stream().filter(i -> i >= 0 && i < nchar).count();
        nchar -= (int) removed;
        log.debug("Removed {} site(s) from block '{}', nchar is now {}", removed, getBlockName(), nchar);
    }

    protected String dimensionsStatement() {
        return "dimensions ntax=" + ntaxa + " nchar=" + nchar + ";";
    }

    protected boolean isNtaxDeclared() {
        return ntaxDeclared;
    }

    @Override
    public String write() {
        BlockTextBuilder out = new BlockTextBuilder(getBlockName());
        out.attributes(attributes);
        out.statement(dimensionsStatement());
        if (!format.isEmpty()) {
            out.statement("format " + format.render() + ";");
        }
        out.line("matrix");

        int width = 0;
        for (String taxon : taxa) {
            width = Math.max(width, NexusNames.quoteIfNeeded(taxon).length());
        }
        for (String taxon : taxa) {
            String label = NexusNames.quoteIfNeeded(taxon);
            out.line(label + " ".repeat(width - label.length() + 4) + getSequence(taxon));
        }
        out.statement(";");
        return out.end();
    }

    @Override
    public String toString() {
        return "<NexusDataBlock: " + nchar + " characters from " + ntaxa + " taxa>";
    }
}
