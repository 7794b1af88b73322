package com.ledgerAssist.toolRouter.routing.service;

import com.ledgerAssist.toolRouter.routing.exception.RoutingConfigurationException;
import com.ledgerAssist.toolRouter.routing.model.Confidence;
import com.ledgerAssist.toolRouter.routing.model.DateRange;
import com.ledgerAssist.toolRouter.routing.model.PatternMatch;
import com.ledgerAssist.toolRouter.routing.model.RoutePattern;
import com.ledgerAssist.toolRouter.routing.model.RoutingResult;
import com.ledgerAssist.toolRouter.routing.model.RoutingState;
import com.ledgerAssist.toolRouter.routing.model.ToolMetadata;
import com.ledgerAssist.toolRouter.routing.model.ToolSuggestion;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Routes a free-text query to the catalog tools that can answer it.
 *
 * Flow:
 * 1. Resolve the date phrase, if any
 * 2. Literal pattern match - a hit returns one suggestion immediately
 * 3. Tokenize, normalize via synonyms, fuzzy-correct unknown tokens
 * 4. Score every tool and rank
 * 5. Nothing scored - ask the user to clarify
 *
 * Stateless apart from the immutable tables it was built with, so one instance serves all threads.
 */
@Slf4j
public final class ToolRouter {

    public static final double PATTERN_SCORE = 10.0;
    public static final int DEFAULT_MAX_SUGGESTIONS = 5;

    static final String DATE_FROM = "date_from";
    static final String DATE_TO = "date_to";

    private static final Pattern NUMBER = Pattern.compile("\\d+");

    private static final Comparator<ToolSuggestion> RANKING = Comparator
            .comparingDouble(ToolSuggestion::getScore).reversed()
            .thenComparing(ToolSuggestion::getToolName);

    // any fixed date works; only checks that the phrase is understood at all
    private static final LocalDate PROBE_DATE = LocalDate.of(2000, 1, 1);

    private final SynonymTable synonymTable;
    private final PatternLibrary patternLibrary;
    private final FuzzyCorrector fuzzyCorrector;
    private final DateInterpreter dateInterpreter;
    private final KeywordScorer keywordScorer;
    private final ToolCatalog toolCatalog;
    private final ClarificationService clarificationService;
    private final int maxSuggestions;

    public ToolRouter(SynonymTable synonymTable,
                      PatternLibrary patternLibrary,
                      FuzzyCorrector fuzzyCorrector,
                      DateInterpreter dateInterpreter,
                      KeywordScorer keywordScorer,
                      ToolCatalog toolCatalog,
                      ClarificationService clarificationService,
                      int maxSuggestions) {
        if (maxSuggestions < 1) {
            throw new RoutingConfigurationException("Maximum number of suggestions must be positive: " + maxSuggestions);
        }
        this.synonymTable = synonymTable;
        this.patternLibrary = patternLibrary;
        this.fuzzyCorrector = fuzzyCorrector;
        this.dateInterpreter = dateInterpreter;
        this.keywordScorer = keywordScorer;
        this.toolCatalog = toolCatalog;
        this.clarificationService = clarificationService;
        this.maxSuggestions = maxSuggestions;
        validatePatterns();
    }

    private void validatePatterns() {
        for (RoutePattern pattern : patternLibrary.patterns()) {
            if (!toolCatalog.contains(pattern.getTool())) {
                throw new RoutingConfigurationException(
                        "Pattern '" + pattern.getId() + "' targets unknown tool: " + pattern.getTool());
            }
            if (pattern.getDefaultPeriod() != null
                    && dateInterpreter.parse(pattern.getDefaultPeriod(), PROBE_DATE) == null) {
                throw new RoutingConfigurationException(
                        "Pattern '" + pattern.getId() + "' has an unrecognized default period: " + pattern.getDefaultPeriod());
            }
        }
    }

    /**
     * Routes a query.
     *
     * @param query Free-text query in English or Indonesian
     * @param today Reference date for relative date phrases
     * @return Routing result; never null
     */
    public RoutingResult route(String query, LocalDate today) {
        Objects.requireNonNull(today, "today");
        String text = query == null ? "" : query.trim();

        String dateExpression = dateInterpreter.extractExpression(text);
        DateRange dateRange = dateExpression == null ? null : dateInterpreter.parse(dateExpression, today);
        if (dateRange == null) {
            dateExpression = null;
        }
        log.debug("Date resolution - expression: '{}', range: {}", dateExpression, dateRange);

        PatternMatch match = patternLibrary.match(text);
        if (match != null) {
            return patternResult(text, match, dateRange, dateExpression, today);
        }
        log.debug("Routing state: {} - query: '{}'", RoutingState.NO_PATTERN_HIT, text);

        Set<String> queryTokens = queryTokens(removeDateExpression(text, dateExpression));
        List<ToolSuggestion> ranked = rank(queryTokens, dateRange);

        if (ranked.isEmpty()) {
            log.debug("No tool scored - tokens: {}", queryTokens);
            return RoutingResult.builder()
                    .query(text)
                    .state(RoutingState.CLARIFY)
                    .clarificationPrompt(clarificationService.buildPrompt(text, dateRange))
                    .dateRange(dateRange)
                    .dateExpression(dateExpression)
                    .build();
        }

        log.debug("Ranked tools - tokens: {}, top: {} ({})",
                queryTokens, ranked.get(0).getToolName(), ranked.get(0).getScore());
        return RoutingResult.builder()
                .query(text)
                .state(RoutingState.RANKED)
                .suggestions(ranked)
                .dateRange(dateRange)
                .dateExpression(dateExpression)
                .build();
    }

    private RoutingResult patternResult(String text, PatternMatch match, DateRange dateRange,
                                        String dateExpression, LocalDate today) {
        RoutePattern pattern = match.getPattern();
        ToolMetadata tool = toolCatalog.get(pattern.getTool());

        Map<String, Object> parameters = new LinkedHashMap<>(pattern.getParams());
        DateRange period = dateRange;
        if (period == null && pattern.getDefaultPeriod() != null) {
            period = dateInterpreter.parse(pattern.getDefaultPeriod(), today);
        }
        addDateParameters(parameters, tool, period);

        ToolSuggestion suggestion = ToolSuggestion.builder()
                .toolName(tool.getName())
                .purpose(tool.getPurpose())
                .keyParameters(tool.getParameters())
                .suggestedParameters(Collections.unmodifiableMap(parameters))
                .score(PATTERN_SCORE)
                .confidence(pattern.getConfidence())
                .build();

        log.debug("Routing state: {} - pattern: '{}', phrase: '{}', tool: {}",
                RoutingState.PATTERN_HIT, pattern.getId(), match.getMatchedPhrase(), tool.getName());
        return RoutingResult.builder()
                .query(text)
                .state(RoutingState.PATTERN_HIT)
                .suggestions(List.of(suggestion))
                .dateRange(dateRange)
                .dateExpression(dateExpression)
                .build();
    }

    /**
     * Normalized query tokens: synonym lookup first, then fuzzy correction, else the raw token.
     * Action verbs are added from the raw text since some of them are stop-words.
     */
    Set<String> queryTokens(String text) {
        Set<String> tokens = new LinkedHashSet<>();
        for (String token : keywordScorer.tokenize(text)) {
            if (keywordScorer.isActionVerb(token) || NUMBER.matcher(token).matches()) {
                tokens.add(token);
                continue;
            }
            String canonical = synonymTable.normalize(token);
            if (canonical == null) {
                canonical = fuzzyCorrector.correct(token);
            }
            tokens.add(canonical != null ? canonical : token);
        }
        tokens.addAll(keywordScorer.actionVerbsIn(text));
        return tokens;
    }

    private List<ToolSuggestion> rank(Set<String> queryTokens, DateRange dateRange) {
        List<ToolSuggestion> scored = new ArrayList<>();
        for (ToolMetadata tool : toolCatalog.tools()) {
            double score = keywordScorer.score(queryTokens, tool);
            if (score <= 0) {
                continue;
            }
            Map<String, Object> parameters = new LinkedHashMap<>();
            addDateParameters(parameters, tool, dateRange);
            scored.add(ToolSuggestion.builder()
                    .toolName(tool.getName())
                    .purpose(tool.getPurpose())
                    .keyParameters(tool.getParameters())
                    .suggestedParameters(Collections.unmodifiableMap(parameters))
                    .score(score)
                    .confidence(Confidence.CONTEXT_DEPENDENT)
                    .build());
        }
        scored.sort(RANKING);
        return List.copyOf(scored.subList(0, Math.min(maxSuggestions, scored.size())));
    }

    private static void addDateParameters(Map<String, Object> parameters, ToolMetadata tool, DateRange period) {
        if (period != null && tool.acceptsParameter(DATE_FROM)) {
            parameters.put(DATE_FROM, period.getStart().toString());
            parameters.put(DATE_TO, period.getEnd().toString());
        }
    }

    private static String removeDateExpression(String text, String dateExpression) {
        String normalized = text.toLowerCase().replaceAll("\\s+", " ");
        if (dateExpression == null) {
            return normalized;
        }
        return normalized.replace(dateExpression, " ");
    }

    public int getMaxSuggestions() {
        return maxSuggestions;
    }
}
