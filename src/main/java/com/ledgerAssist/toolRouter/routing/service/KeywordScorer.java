package com.ledgerAssist.toolRouter.routing.service;

import com.ledgerAssist.toolRouter.routing.model.ToolMetadata;
import com.ledgerAssist.toolRouter.routing.util.RoutingVocabulary;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tokenizes queries and scores catalog tools by keyword overlap.
 *
 * Score = number of subject tokens shared by query and tool, plus {@value #ACTION_VERB_BONUS}
 * when the query holds an action verb matching the tool's name ("list" favours *_list*).
 * Action verbs never count as overlap, so the bonus only re-ranks tools that already share
 * subject-matter keywords with the query.
 */
public final class KeywordScorer {

    public static final double ACTION_VERB_BONUS = 0.5;

    private static final Pattern TOKEN_SEPARATOR = Pattern.compile("[^\\p{L}\\p{N}_]+");
    private static final int MIN_TOKEN_LENGTH = 2;

    private final SynonymTable synonymTable;
    private final Map<String, Pattern> phrasePatterns;

    public KeywordScorer(SynonymTable synonymTable) {
        this.synonymTable = synonymTable;
        Map<String, Pattern> patterns = new LinkedHashMap<>();
        for (String phrase : synonymTable.phraseForms()) {
            patterns.put(phrase, Pattern.compile(
                    "(?<=[^\\p{L}\\p{N}_])" + Pattern.quote(phrase) + "(?=[^\\p{L}\\p{N}_])"));
        }
        this.phrasePatterns = Collections.unmodifiableMap(patterns);
    }

    /**
     * Splits text into lower-case keyword tokens.
     *
     * Multi-word synonym forms ("jatuh tempo", "sales rep") are kept whole; the rest is split on
     * anything that is not a letter, digit or underscore. Stop-words and one-character tokens are dropped.
     *
     * @param text Query or hint text
     * @return Distinct tokens, phrase forms first, then single words in order of appearance
     */
    public Set<String> tokenize(String text) {
        Set<String> tokens = new LinkedHashSet<>();
        if (text == null || text.isBlank()) {
            return tokens;
        }

        String remaining = " " + text.toLowerCase().replaceAll("\\s+", " ") + " ";
        for (Map.Entry<String, Pattern> phrase : phrasePatterns.entrySet()) {
            Matcher matcher = phrase.getValue().matcher(remaining);
            if (matcher.find()) {
                tokens.add(phrase.getKey());
                remaining = matcher.replaceAll(" ");
            }
        }

        for (String token : TOKEN_SEPARATOR.split(remaining)) {
            if (token.length() >= MIN_TOKEN_LENGTH && !RoutingVocabulary.STOP_WORDS.contains(token)) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    /**
     * Action verbs present in the text, including those that are also stop-words ("show", "cari").
     */
    public Set<String> actionVerbsIn(String text) {
        Set<String> verbs = new LinkedHashSet<>();
        if (text == null || text.isBlank()) {
            return verbs;
        }
        for (String token : TOKEN_SEPARATOR.split(text.toLowerCase())) {
            if (RoutingVocabulary.ACTION_VERBS.containsKey(token)) {
                verbs.add(token);
            }
        }
        return verbs;
    }

    public boolean isActionVerb(String token) {
        return RoutingVocabulary.ACTION_VERBS.containsKey(token);
    }

    /**
     * Synonym normalization with raw-token fallback.
     */
    public String normalize(String token) {
        String canonical = synonymTable.normalize(token);
        return canonical != null ? canonical : token;
    }

    /**
     * Tokenizes and normalizes free text, used for tool hints.
     */
    public Set<String> keywordsOf(String text) {
        Set<String> keywords = new LinkedHashSet<>();
        for (String token : tokenize(text)) {
            keywords.add(normalize(token));
        }
        return keywords;
    }

    /**
     * Scores one tool against the normalized query tokens.
     *
     * @param queryTokens Normalized query tokens, action verbs included
     * @param tool Catalog tool
     * @return Relevance score; 0 when no subject keyword overlaps
     */
    public double score(Set<String> queryTokens, ToolMetadata tool) {
        long overlap = queryTokens.stream()
                .filter(token -> !isActionVerb(token))
                .filter(tool.getKeywords()::contains)
                .count();
        if (overlap == 0) {
            return 0;
        }

        double score = overlap;
        if (hasActionVerbMatch(queryTokens, tool.getName())) {
            score += ACTION_VERB_BONUS;
        }
        return score;
    }

    private boolean hasActionVerbMatch(Set<String> queryTokens, String toolName) {
        String name = toolName.toLowerCase();
        for (String token : queryTokens) {
            List<String> suffixes = RoutingVocabulary.ACTION_VERBS.get(token);
            if (suffixes == null) {
                continue;
            }
            for (String suffix : suffixes) {
                if (name.endsWith(suffix) || name.contains(suffix + "_")) {
                    return true;
                }
            }
        }
        return false;
    }
}
