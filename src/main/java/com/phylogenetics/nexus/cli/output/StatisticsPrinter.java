package com.phylogenetics.nexus.cli.output;

import java.io.IOException;
import java.io.Writer;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

import com.phylogenetics.nexus.tools.CharacterStateTally;
import com.phylogenetics.nexus.tools.SiteValueCount;

import freemarker.template.Configuration;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Renders the character reports of the "manip" command through the templates under
 * {@code /templates}. Site numbers are printed 1-based.
 */
public class StatisticsPrinter {

    private final Configuration freemarker = createFreemarkerConfig();

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setLocale(Locale.ROOT);
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    /**
     * Per-taxon counts of the given states, sorted by taxon, with a grand total.
     */
    public void printSiteValues(Writer out, String source, Collection<String> states, List<SiteValueCount> counts)
            throws IOException {
        Map<String, SiteValueCount> byTaxon = new TreeMap<>();
        counts.forEach(c -> byTaxon.put(c.getTaxon(), c));

        int totalCount = counts.stream().mapToInt(SiteValueCount::getCount).sum();
        int totalData = counts.stream().mapToInt(SiteValueCount::getTotal).sum();

        Map<String, Object> model = new HashMap<>();
        model.put("source", source);
        model.put("states", String.join(",", states));
        model.put("rows", List.copyOf(byTaxon.values()));
        model.put("totalCount", totalCount);
        model.put("totalData", totalData);
        model.put("totalPercent", totalData == 0 ? 0.0 : (totalCount * 100.0) / totalData);
        render("site-values.ftl", model, out);
    }

    /**
     * One line per site listing each state with the number of taxa holding it.
     */
    public void printCharacterStats(Writer out, List<CharacterStateTally> tallies) throws IOException {
        render("character-stats.ftl", Map.of("tallies", tallies), out);
    }

    /**
     * A labelled list of sites, given 0-based.
     */
    public void printSites(Writer out, String label, List<Integer> sites) throws IOException {
        List<Integer> numbers = sites.stream().map(i -> i + 1).toList();
        render("site-list.ftl", Map.of("label", label, "sites", numbers), out);
    }

    private void render(String templateName, Map<String, Object> model, Writer out) throws IOException {
        try {
            freemarker.getTemplate(templateName).process(model, out);
            out.flush();
        } catch (TemplateException e) {
            throw new IllegalStateException("Failed to render report template " + templateName, e);
        }
    }
}
