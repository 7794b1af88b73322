package com.ledgerAssist.toolRouter.routing.service;

import com.ledgerAssist.toolRouter.routing.dto.PatternDefinition;
import com.ledgerAssist.toolRouter.routing.exception.RoutingConfigurationException;
import com.ledgerAssist.toolRouter.routing.model.Confidence;
import com.ledgerAssist.toolRouter.routing.model.PatternMatch;
import com.ledgerAssist.toolRouter.routing.model.RoutePattern;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Library of idiomatic business expressions ("who owes me money", "saldo kas").
 *
 * Matching is case-insensitive phrase containment. When several phrases occur in the
 * query the longest one wins; equal lengths fall back to registration order.
 */
@Slf4j
public final class PatternLibrary {

    private final List<RoutePattern> patterns;

    private PatternLibrary(List<RoutePattern> patterns) {
        this.patterns = List.copyOf(patterns);
    }

    /**
     * Builds the library from pattern definitions.
     *
     * @param definitions Pattern definitions in registration order
     * @return Immutable pattern library
     * @throws RoutingConfigurationException if a phrase is registered twice, or a pattern has no tool or phrases
     */
    public static PatternLibrary fromDefinitions(List<PatternDefinition> definitions) {
        Map<String, String> phraseOwners = new HashMap<>();
        List<RoutePattern> patterns = new ArrayList<>();

        for (int i = 0; i < definitions.size(); i++) {
            PatternDefinition definition = definitions.get(i);
            String id = definition.getId() != null ? definition.getId() : "pattern-" + i;

            if (definition.getTool() == null || definition.getTool().isBlank()) {
                throw new RoutingConfigurationException("Pattern '" + id + "' has no target tool");
            }
            if (definition.getPhrases() == null || definition.getPhrases().isEmpty()) {
                throw new RoutingConfigurationException("Pattern '" + id + "' has no phrases");
            }

            List<String> phrases = new ArrayList<>();
            for (String rawPhrase : definition.getPhrases()) {
                String phrase = normalizeText(rawPhrase);
                if (phrase.isEmpty()) {
                    throw new RoutingConfigurationException("Pattern '" + id + "' contains an empty phrase");
                }
                String owner = phraseOwners.putIfAbsent(phrase, id);
                if (owner != null) {
                    throw new RoutingConfigurationException(
                            "Phrase '" + phrase + "' is registered by both '" + owner + "' and '" + id + "'");
                }
                phrases.add(phrase);
            }

            Map<String, Object> params = definition.getParams() == null
                    ? Map.of()
                    : Collections.unmodifiableMap(new LinkedHashMap<>(definition.getParams()));

            patterns.add(RoutePattern.builder()
                    .id(id)
                    .phrases(List.copyOf(phrases))
                    .tool(definition.getTool().trim())
                    .params(params)
                    .defaultPeriod(definition.getDefaultPeriod())
                    .confidence(definition.getConfidence() != null ? definition.getConfidence() : Confidence.DEFINITIVE)
                    .build());
        }

        log.info("Pattern library loaded - patterns: {}, phrases: {}", patterns.size(), phraseOwners.size());
        return new PatternLibrary(patterns);
    }

    /**
     * Finds the pattern whose phrase is the longest substring of the query.
     *
     * @param query Free-text query
     * @return The matching pattern and phrase, or null when no phrase occurs in the query
     */
    public PatternMatch match(String query) {
        String text = normalizeText(query);
        if (text.isEmpty()) {
            return null;
        }

        PatternMatch best = null;
        for (RoutePattern pattern : patterns) {
            for (String phrase : pattern.getPhrases()) {
                if (text.contains(phrase)
                        && (best == null || phrase.length() > best.getMatchedPhrase().length())) {
                    best = new PatternMatch(pattern, phrase);
                }
            }
        }
        return best;
    }

    public List<RoutePattern> patterns() {
        return patterns;
    }

    /**
     * Lower-cases, folds typographic apostrophes and collapses whitespace.
     */
    static String normalizeText(String value) {
        if (value == null) {
            return "";
        }
        return value.toLowerCase()
                .replace('\u2019', '\'')
                .replace('\u2018', '\'')
                .replaceAll("\\s+", " ")
                .trim();
    }
}
