package com.phylogenetics.nexus.handler;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.phylogenetics.nexus.exception.MalformedDimensionsException;
import com.phylogenetics.nexus.model.NexusNames;
import com.phylogenetics.nexus.parser.CommentStripper;
import com.phylogenetics.nexus.writer.BlockTextBuilder;

import lombok.Getter;

/**
 * Handler for {@code taxa} blocks.
 *
 * Labels may be listed one per line or several to a line; bracketed prefixes such
 * as {@code [1]} are comments and are ignored on input.
 */
public class TaxaHandler extends AbstractBlockHandler {
    private static final Logger log = LoggerFactory.getLogger(TaxaHandler.class);

    private static final Pattern NTAX_PATTERN = Pattern.compile("ntax\\s*=\\s*(\\d+)", Pattern.CASE_INSENSITIVE);

    @Getter
    private final List<String> taxa = new ArrayList<>();

    private int declaredNtax = -1;

    public TaxaHandler(String blockName) {
        super(blockName);
    }

    public TaxaHandler() {
        this("taxa");
    }

    @Override
    public void parse(List<String> lines) {
        boolean inLabels = false;

        for (String raw : lines) {
            String line = CommentStripper.strip(raw).strip();
            if (line.isEmpty()) {
                continue;
            }

            if (inLabels) {
                inLabels = !readLabels(line);
                continue;
            }

            String keyword = keywordOf(line);
            if (keyword.equals("dimensions")) {
                Matcher m = NTAX_PATTERN.matcher(line);
                if (!m.find()) {
                    throw new MalformedDimensionsException(getBlockName(), "ntax", line);
                }
                declaredNtax = Integer.parseInt(m.group(1));
            } else if (keyword.equals("taxlabels")) {
                String rest = line.substring(keyword.length()).strip();
                inLabels = rest.isEmpty() || !readLabels(rest);
            } else {
                attributes.add(raw.strip());
            }
        }

        if (declaredNtax >= 0 && declaredNtax != taxa.size()) {
            log.warn("Block '{}' declares ntax={} but lists {} taxa", getBlockName(), declaredNtax, taxa.size());
        }
        log.debug("Parsed block '{}': {} taxa", getBlockName(), taxa.size());
    }

    /**
     * Add the labels on one line. Returns true when the line ends the taxlabels statement.
     */
    private boolean readLabels(String line) {
        boolean terminated = line.endsWith(";");
        String body = terminated ? line.substring(0, line.length() - 1) : line;

        StringBuilder token = new StringBuilder();
        boolean quoted = false;
        for (char c : body.toCharArray()) {
            if (c == '\'') {
                quoted = !quoted;
            }
            if (!quoted && Character.isWhitespace(c)) {
                addLabel(token);
            } else {
                token.append(c);
            }
        }
        addLabel(token);
        return terminated;
    }

    private void addLabel(StringBuilder token) {
        if (token.length() > 0) {
            taxa.add(NexusNames.unquote(token.toString()));
            token.setLength(0);
        }
    }

    public int getNtaxa() {
        return taxa.size();
    }

    public void renameTaxon(String oldName, String newName) {
        int index = taxa.indexOf(oldName);
        if (index < 0) {
            throw new IllegalArgumentException("Unknown taxon: " + oldName);
        }
        taxa.set(index, newName);
    }

    @Override
    public String write() {
        BlockTextBuilder out = new BlockTextBuilder(getBlockName());
        out.attributes(attributes);
        out.statement("dimensions ntax=" + getNtaxa() + ";");
        out.statement("taxlabels");
        for (int i = 0; i < taxa.size(); i++) {
            out.statement("[" + (i + 1) + "] " + NexusNames.quote(taxa.get(i)));
        }
        out.line(";");
        return out.end();
    }

    @Override
    public String toString() {
        return "<NexusTaxaBlock: " + taxa.size() + " taxa>";
    }
}
