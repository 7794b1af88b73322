package com.ledgerAssist.toolRouter.routing.config;

import com.ledgerAssist.toolRouter.routing.dto.PatternDefinition;
import com.ledgerAssist.toolRouter.routing.dto.SynonymGroupDefinition;
import com.ledgerAssist.toolRouter.routing.dto.ToolDefinition;
import com.ledgerAssist.toolRouter.routing.service.ClarificationService;
import com.ledgerAssist.toolRouter.routing.service.DateInterpreter;
import com.ledgerAssist.toolRouter.routing.service.FuzzyCorrector;
import com.ledgerAssist.toolRouter.routing.service.KeywordScorer;
import com.ledgerAssist.toolRouter.routing.service.PatternLibrary;
import com.ledgerAssist.toolRouter.routing.service.SynonymTable;
import com.ledgerAssist.toolRouter.routing.service.ToolCatalog;
import com.ledgerAssist.toolRouter.routing.service.ToolRouter;
import com.ledgerAssist.toolRouter.routing.util.WeightedRatio;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Wires the routing engine. All tables are loaded once at startup; a broken resource
 * file stops the application context from starting.
 */
@Configuration
public class RoutingConfig {

    @Value("${routing.synonyms-resource:routing/synonyms.json}")
    private String synonymsResource;

    @Value("${routing.patterns-resource:routing/patterns.json}")
    private String patternsResource;

    @Value("${routing.catalog-resource:routing/tool-catalog.json}")
    private String catalogResource;

    @Value("${routing.max-suggestions:5}")
    private int maxSuggestions;

    @Value("${routing.fuzzy.threshold:80}")
    private double fuzzyThreshold;

    @Value("${routing.timezone:Asia/Jakarta}")
    private String timezone;

    @Bean
    public SynonymTable synonymTable() {
        return SynonymTable.fromGroups(RoutingResourceLoader.load(synonymsResource, SynonymGroupDefinition.class));
    }

    @Bean
    public PatternLibrary patternLibrary() {
        return PatternLibrary.fromDefinitions(RoutingResourceLoader.load(patternsResource, PatternDefinition.class));
    }

    @Bean
    public KeywordScorer keywordScorer(SynonymTable synonymTable) {
        return new KeywordScorer(synonymTable);
    }

    @Bean
    public ToolCatalog toolCatalog(SynonymTable synonymTable, KeywordScorer keywordScorer) {
        return ToolCatalog.fromDefinitions(
                RoutingResourceLoader.load(catalogResource, ToolDefinition.class), synonymTable, keywordScorer);
    }

    @Bean
    public FuzzyCorrector fuzzyCorrector(SynonymTable synonymTable) {
        return new FuzzyCorrector(synonymTable, new WeightedRatio(), fuzzyThreshold);
    }

    @Bean
    public DateInterpreter dateInterpreter() {
        return new DateInterpreter();
    }

    @Bean
    public ToolRouter toolRouter(SynonymTable synonymTable,
                                 PatternLibrary patternLibrary,
                                 FuzzyCorrector fuzzyCorrector,
                                 DateInterpreter dateInterpreter,
                                 KeywordScorer keywordScorer,
                                 ToolCatalog toolCatalog,
                                 ClarificationService clarificationService) {
        return new ToolRouter(synonymTable, patternLibrary, fuzzyCorrector, dateInterpreter,
                keywordScorer, toolCatalog, clarificationService, maxSuggestions);
    }

    /**
     * Clock used by the gateway when the request has no reference date.
     */
    @Bean
    public Clock routingClock() {
        return Clock.system(ZoneId.of(timezone));
    }
}
