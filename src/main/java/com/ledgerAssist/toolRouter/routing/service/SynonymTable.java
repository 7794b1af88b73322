package com.ledgerAssist.toolRouter.routing.service;

import com.ledgerAssist.toolRouter.routing.dto.SynonymGroupDefinition;
import com.ledgerAssist.toolRouter.routing.exception.RoutingConfigurationException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Bilingual synonym table.
 *
 * Maps English and Indonesian surface forms onto one canonical business term, and each
 * canonical term onto the tools known to serve it. Canonical terms are self-mapped so the
 * fuzzy corrector can reach them. Immutable after construction.
 */
@Slf4j
public final class SynonymTable {

    private final Map<String, String> termToCanonical;
    private final Map<String, List<String>> termToTools;
    private final List<String> vocabulary;
    private final List<String> phraseForms;

    private SynonymTable(Map<String, String> termToCanonical, Map<String, List<String>> termToTools) {
        this.termToCanonical = Collections.unmodifiableMap(termToCanonical);
        this.termToTools = Collections.unmodifiableMap(termToTools);
        this.vocabulary = List.copyOf(termToCanonical.keySet());
        this.phraseForms = termToCanonical.keySet().stream()
                .filter(term -> term.contains(" "))
                .sorted(Comparator.comparingInt(String::length).reversed())
                .toList();
    }

    /**
     * Builds the table from synonym groups.
     *
     * @param groups Synonym groups in registration order
     * @return Immutable synonym table
     * @throws RoutingConfigurationException if a surface form is registered more than once
     */
    public static SynonymTable fromGroups(List<SynonymGroupDefinition> groups) {
        Map<String, String> termToCanonical = new LinkedHashMap<>();
        Map<String, List<String>> termToTools = new LinkedHashMap<>();

        for (SynonymGroupDefinition group : groups) {
            String canonical = clean(group.getCanonical());
            if (canonical.isEmpty()) {
                throw new RoutingConfigurationException("Synonym group without canonical term");
            }
            if (termToTools.containsKey(canonical)) {
                throw new RoutingConfigurationException("Canonical term declared twice: " + canonical);
            }
            register(termToCanonical, canonical, canonical);
            for (String form : group.getForms()) {
                register(termToCanonical, clean(form), canonical);
            }
            termToTools.put(canonical, List.copyOf(new LinkedHashSet<>(group.getTools())));
        }

        log.info("Synonym table loaded - canonical terms: {}, surface forms: {}",
                termToTools.size(), termToCanonical.size());
        return new SynonymTable(termToCanonical, termToTools);
    }

    private static void register(Map<String, String> termToCanonical, String form, String canonical) {
        if (form.isEmpty()) {
            throw new RoutingConfigurationException("Empty surface form for canonical term: " + canonical);
        }
        String existing = termToCanonical.putIfAbsent(form, canonical);
        if (existing != null) {
            throw new RoutingConfigurationException(
                    "Surface form '" + form + "' is mapped to both '" + existing + "' and '" + canonical + "'");
        }
    }

    private static String clean(String value) {
        return value == null ? "" : value.trim().toLowerCase();
    }

    /**
     * Normalizes a token or short phrase to its canonical term.
     *
     * @param term Input term in either language
     * @return Canonical term, or null if the term is unknown
     */
    public String normalize(String term) {
        if (term == null) {
            return null;
        }
        return termToCanonical.get(clean(term));
    }

    public boolean containsKey(String term) {
        return term != null && termToCanonical.containsKey(clean(term));
    }

    /**
     * All keys (surface forms and canonical terms) in registration order.
     */
    public List<String> vocabulary() {
        return vocabulary;
    }

    /**
     * Multi-word keys, longest first.
     */
    public List<String> phraseForms() {
        return phraseForms;
    }

    public Set<String> canonicalTerms() {
        return termToTools.keySet();
    }

    /**
     * Tools registered for a canonical term; empty when the term is unknown.
     */
    public List<String> toolsFor(String canonicalTerm) {
        return termToTools.getOrDefault(clean(canonicalTerm), List.of());
    }

    /**
     * Canonical terms whose tool list names the given tool.
     */
    public List<String> termsForTool(String toolName) {
        List<String> terms = new ArrayList<>();
        termToTools.forEach((term, tools) -> {
            if (tools.contains(toolName)) {
                terms.add(term);
            }
        });
        return terms;
    }
}
