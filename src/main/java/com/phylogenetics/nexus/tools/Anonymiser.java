package com.phylogenetics.nexus.tools;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.phylogenetics.nexus.exception.UnsupportedConstructException;
import com.phylogenetics.nexus.handler.BlockHandler;
import com.phylogenetics.nexus.handler.DataHandler;
import com.phylogenetics.nexus.handler.TaxaHandler;
import com.phylogenetics.nexus.handler.TreesHandler;
import com.phylogenetics.nexus.model.NexusDocument;

/**
 * Replaces taxon names with salted hashes across taxa, data/characters and trees blocks.
 *
 * Every block of the document must be one of those types, and trees must carry a
 * translate table; anything else is rejected rather than left half-anonymised.
 */
public class Anonymiser {
    private static final Logger log = LoggerFactory.getLogger(Anonymiser.class);

    private Anonymiser() {
        // Utility class
    }

    /**
     * Lower-case hex MD5 of {@code salt + "-" + taxon}.
     */
    public static String hash(String salt, String taxon) {
        try {
            MessageDigest md = MessageDigest.getInstance("MD5");
            byte[] digest = md.digest((salt + "-" + taxon).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }

    /**
     * Anonymise the document in place. A {@code null} salt is replaced by a random one.
     */
    public static NexusDocument anonymise(NexusDocument document, String salt) {
        String effectiveSalt = salt != null ? salt : UUID.randomUUID().toString();

        for (Map.Entry<String, BlockHandler> block : document.getBlocks().entrySet()) {
            BlockHandler handler = block.getValue();

            if (handler instanceof TaxaHandler taxa) {
                for (String taxon : new ArrayList<>(taxa.getTaxa())) {
                    taxa.renameTaxon(taxon, hash(effectiveSalt, taxon));
                }
            } else if (handler instanceof DataHandler data) {
                for (String taxon : new ArrayList<>(data.getTaxa())) {
                    data.renameTaxon(taxon, hash(effectiveSalt, taxon));
                }
            } else if (handler instanceof TreesHandler trees) {
                if (!trees.isWasTranslated()) {
                    throw new UnsupportedConstructException("Unable to anonymise untranslated trees");
                }
                List<String> taxa = new ArrayList<>(new LinkedHashSet<>(trees.getTranslators().values()));
                for (String taxon : taxa) {
                    trees.renameTaxon(taxon, hash(effectiveSalt, taxon));
                }
            } else {
                throw new UnsupportedConstructException("Unable to anonymise '" + block.getKey() + "' blocks");
            }
            log.debug("Anonymised block '{}'", block.getKey());
        }
        return document;
    }
}
