package com.ledgerAssist.toolRouter.routing.service;

import com.ledgerAssist.toolRouter.routing.RoutingFixtures;
import com.ledgerAssist.toolRouter.routing.dto.PatternDefinition;
import com.ledgerAssist.toolRouter.routing.dto.SynonymGroupDefinition;
import com.ledgerAssist.toolRouter.routing.dto.ToolDefinition;
import com.ledgerAssist.toolRouter.routing.exception.RoutingConfigurationException;
import com.ledgerAssist.toolRouter.routing.model.Confidence;
import com.ledgerAssist.toolRouter.routing.model.DateRange;
import com.ledgerAssist.toolRouter.routing.model.RoutingResult;
import com.ledgerAssist.toolRouter.routing.model.RoutingState;
import com.ledgerAssist.toolRouter.routing.model.ToolSuggestion;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static com.ledgerAssist.toolRouter.routing.RoutingFixtures.TODAY;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ToolRouterTest {

    private final ToolRouter router = RoutingFixtures.router();

    @Test
    void patternHitReturnsSingleSuggestion() {
        RoutingResult result = router.route("unpaid invoices", TODAY);

        assertThat(result.getState()).isEqualTo(RoutingState.PATTERN_HIT);
        assertThat(result.getSuggestions()).hasSize(1);
        ToolSuggestion suggestion = result.getSuggestions().get(0);
        assertThat(suggestion.getToolName()).isEqualTo("invoice_list_sales");
        assertThat(suggestion.getScore()).isEqualTo(ToolRouter.PATTERN_SCORE);
        assertThat(suggestion.getConfidence()).isEqualTo(Confidence.DEFINITIVE);
        assertThat(suggestion.getSuggestedParameters()).isEqualTo(Map.of("status_id", 2));
        assertThat(result.needsClarification()).isFalse();
    }

    @Test
    void longestPatternWinsOverShorterOne() {
        RoutingResult result = router.route("siapa yang hutang ke kita", TODAY);

        ToolSuggestion suggestion = result.getSuggestions().get(0);
        assertThat(suggestion.getToolName()).isEqualTo("invoice_get_totals");
        assertThat(suggestion.getConfidence()).isEqualTo(Confidence.CONTEXT_DEPENDENT);
        assertThat(suggestion.getSuggestedParameters()).isEmpty();
    }

    @Test
    void patternHitCarriesQueryDateIntoParameters() {
        RoutingResult result = router.route("unpaid invoices last month", TODAY);

        assertThat(result.getState()).isEqualTo(RoutingState.PATTERN_HIT);
        assertThat(result.getDateRange())
                .isEqualTo(DateRange.calendar(LocalDate.of(2025, 12, 1), LocalDate.of(2025, 12, 31)));
        assertThat(result.getDateExpression()).isEqualTo("last month");
        assertThat(result.getSuggestions().get(0).getSuggestedParameters())
                .containsEntry("status_id", 2)
                .containsEntry("date_from", "2025-12-01")
                .containsEntry("date_to", "2025-12-31");
    }

    @Test
    void patternDefaultPeriodFillsDatesWhenQueryHasNone() {
        RoutingResult result = router.route("sales per person", TODAY);

        assertThat(result.getDateRange()).isNull();
        ToolSuggestion suggestion = result.getSuggestions().get(0);
        assertThat(suggestion.getToolName()).isEqualTo("financial_sales_by_person");
        assertThat(suggestion.getSuggestedParameters())
                .containsEntry("date_from", "2026-01-01")
                .containsEntry("date_to", "2026-01-22");
    }

    @Test
    void indonesianPatternWithDatePhrase() {
        RoutingResult result = router.route("Pendapatan bulan ini", TODAY);

        assertThat(result.getSuggestions()).extracting(ToolSuggestion::getToolName)
                .containsExactly("financial_sales_summary");
        assertThat(result.getDateRange()).isEqualTo(DateRange.calendar(LocalDate.of(2026, 1, 1), TODAY));
    }

    @Test
    void keywordRankingUsesActionVerbBonus() {
        RoutingResult result = router.route("cari produk by sku", TODAY);

        assertThat(result.getState()).isEqualTo(RoutingState.RANKED);
        ToolSuggestion top = result.getSuggestions().get(0);
        assertThat(top.getToolName()).isEqualTo("product_search_by_sku");
        assertThat(top.getScore()).isEqualTo(2.5);
        assertThat(top.getConfidence()).isEqualTo(Confidence.CONTEXT_DEPENDENT);
    }

    @Test
    void typosAreCorrectedBeforeScoring() {
        RoutingResult result = router.route("invoce totals", TODAY);

        assertThat(result.getSuggestions()).extracting(ToolSuggestion::getToolName)
                .containsExactly("invoice_get_totals", "invoice_get_detail", "invoice_list_purchase", "invoice_list_sales");
        assertThat(result.getSuggestions().get(0).getScore()).isEqualTo(1.5);
    }

    @Test
    void indonesianTypoWithListVerb() {
        RoutingResult result = router.route("daftar pelangan", TODAY);

        assertThat(result.getSuggestions().get(0).getToolName()).isEqualTo("contact_list");
        assertThat(result.getSuggestions().get(0).getScore()).isEqualTo(1.5);
    }

    @Test
    void equalScoresAreOrderedByToolName() {
        RoutingResult result = router.route("penjualan 30 hari terakhir", TODAY);

        assertThat(result.getState()).isEqualTo(RoutingState.RANKED);
        assertThat(result.getSuggestions()).extracting(ToolSuggestion::getToolName)
                .containsExactly("financial_sales_by_person", "financial_sales_summary",
                        "invoice_list_sales", "order_list_sales");
        assertThat(result.getSuggestions()).allSatisfy(suggestion -> {
            assertThat(suggestion.getScore()).isEqualTo(1.0);
            assertThat(suggestion.getSuggestedParameters())
                    .containsEntry("date_from", "2025-12-23")
                    .containsEntry("date_to", "2026-01-22");
        });
        assertThat(result.getDateExpression()).isEqualTo("30 hari terakhir");
    }

    @Test
    void suggestionsAreCappedAtMaximum() {
        RoutingResult result = RoutingFixtures.router(2).route("penjualan", TODAY);

        assertThat(result.getSuggestions()).extracting(ToolSuggestion::getToolName)
                .containsExactly("financial_sales_by_person", "financial_sales_summary");
    }

    @Test
    void vagueQueryAsksForClarification() {
        RoutingResult result = router.route("show me data", TODAY);

        assertThat(result.getState()).isEqualTo(RoutingState.CLARIFY);
        assertThat(result.getSuggestions()).isEmpty();
        assertThat(result.needsClarification()).isTrue();
        assertThat(result.getClarificationPrompt()).startsWith("What would you like to know?");
        assertThat(result.getDateRange()).isNull();
    }

    @Test
    void clarificationStillCarriesResolvedDate() {
        RoutingResult result = router.route("show me data last week", TODAY);

        assertThat(result.getState()).isEqualTo(RoutingState.CLARIFY);
        assertThat(result.getDateRange())
                .isEqualTo(DateRange.calendar(LocalDate.of(2026, 1, 12), LocalDate.of(2026, 1, 18)));
        assertThat(result.getClarificationPrompt()).contains("2026-01-12", "2026-01-18");
    }

    @Test
    void indonesianQueryGetsIndonesianPrompt() {
        RoutingResult result = router.route("tolong tampilkan data", TODAY);

        assertThat(result.getState()).isEqualTo(RoutingState.CLARIFY);
        assertThat(result.getClarificationPrompt()).startsWith("Informasi apa");
    }

    @Test
    void blankQueryAsksForClarification() {
        assertThat(router.route("   ", TODAY).getState()).isEqualTo(RoutingState.CLARIFY);
        assertThat(router.route(null, TODAY).getState()).isEqualTo(RoutingState.CLARIFY);
    }

    @Test
    void overlongDayCountLeavesDateUnresolved() {
        RoutingResult result = router.route("invoices 99999999999 days", TODAY);

        assertThat(result.getState()).isEqualTo(RoutingState.RANKED);
        assertThat(result.getDateRange()).isNull();
        assertThat(result.getDateExpression()).isNull();
    }

    @Test
    void modalMayIsNotReadAsMonth() {
        RoutingResult result = router.route("may I see unpaid invoices", TODAY);

        assertThat(result.getState()).isEqualTo(RoutingState.PATTERN_HIT);
        assertThat(result.getDateRange()).isNull();
        assertThat(result.getSuggestions().get(0).getSuggestedParameters()).isEqualTo(Map.of("status_id", 2));
    }

    @Test
    void quarterWithYearWordResolvesToQuarter() {
        RoutingResult result = router.route("penjualan kuartal 1 tahun 2025", TODAY);

        assertThat(result.getState()).isEqualTo(RoutingState.RANKED);
        assertThat(result.getDateRange())
                .isEqualTo(DateRange.calendar(LocalDate.of(2025, 1, 1), LocalDate.of(2025, 3, 31)));
        assertThat(result.getSuggestions().get(0).getSuggestedParameters())
                .containsEntry("date_from", "2025-01-01")
                .containsEntry("date_to", "2025-03-31");
    }

    @Test
    void monthWithYearWordResolvesToMonth() {
        RoutingResult result = router.route("penjualan bulan oktober tahun 2025", TODAY);

        assertThat(result.getDateRange())
                .isEqualTo(DateRange.calendar(LocalDate.of(2025, 10, 1), LocalDate.of(2025, 10, 31)));
    }

    @Test
    void wordsStartingWithShortKeyDoNotProduceSuggestions() {
        assertThat(router.route("perlu data", TODAY).getState()).isEqualTo(RoutingState.CLARIFY);
    }

    @Test
    void tieBreakDoesNotDependOnCatalogOrder() {
        ToolDefinition beta = tool("beta_report", "faktur");
        ToolDefinition alpha = tool("alpha_report", "faktur");

        assertThat(smallRouter(List.of(beta, alpha), List.of()).route("faktur", TODAY).getSuggestions())
                .extracting(ToolSuggestion::getToolName)
                .containsExactly("alpha_report", "beta_report");
        assertThat(smallRouter(List.of(alpha, beta), List.of()).route("faktur", TODAY).getSuggestions())
                .extracting(ToolSuggestion::getToolName)
                .containsExactly("alpha_report", "beta_report");
    }

    @Test
    void rejectsPatternTargetingUnknownTool() {
        PatternDefinition ghost = PatternDefinition.builder()
                .id("ghost")
                .phrases(List.of("ghost phrase"))
                .tool("ghost_tool")
                .build();

        assertThatThrownBy(() -> smallRouter(List.of(tool("alpha_report", "faktur")), List.of(ghost)))
                .isInstanceOf(RoutingConfigurationException.class)
                .hasMessageContaining("ghost_tool");
    }

    @Test
    void rejectsPatternWithUnknownDefaultPeriod() {
        PatternDefinition pattern = PatternDefinition.builder()
                .id("someday")
                .phrases(List.of("report someday"))
                .tool("alpha_report")
                .defaultPeriod("someday")
                .build();

        assertThatThrownBy(() -> smallRouter(List.of(tool("alpha_report", "faktur")), List.of(pattern)))
                .isInstanceOf(RoutingConfigurationException.class)
                .hasMessageContaining("someday");
    }

    @Test
    void rejectsNonPositiveMaximum() {
        assertThatThrownBy(() -> RoutingFixtures.router(0))
                .isInstanceOf(RoutingConfigurationException.class);
    }

    private static ToolDefinition tool(String name, String hint) {
        return ToolDefinition.builder()
                .name(name)
                .purpose(name)
                .hints(List.of(hint))
                .build();
    }

    private static ToolRouter smallRouter(List<ToolDefinition> tools, List<PatternDefinition> patterns) {
        SynonymTable synonymTable = SynonymTable.fromGroups(List.of(SynonymGroupDefinition.builder()
                .canonical("invoice")
                .forms(List.of("faktur"))
                .build()));
        KeywordScorer keywordScorer = new KeywordScorer(synonymTable);
        return new ToolRouter(synonymTable,
                PatternLibrary.fromDefinitions(patterns),
                new FuzzyCorrector(synonymTable),
                new DateInterpreter(),
                keywordScorer,
                ToolCatalog.fromDefinitions(tools, synonymTable, keywordScorer),
                RoutingFixtures.clarificationService(),
                ToolRouter.DEFAULT_MAX_SUGGESTIONS);
    }
}
