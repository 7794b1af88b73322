package com.ledgerAssist.toolRouter.routing.service;

import com.ledgerAssist.toolRouter.routing.RoutingFixtures;
import com.ledgerAssist.toolRouter.routing.dto.ToolDefinition;
import com.ledgerAssist.toolRouter.routing.exception.RoutingConfigurationException;
import com.ledgerAssist.toolRouter.routing.model.ToolMetadata;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ToolCatalogTest {

    private final SynonymTable synonymTable = RoutingFixtures.synonymTable();
    private final ToolCatalog catalog = RoutingFixtures.toolCatalog(synonymTable);

    @Test
    void loadsEveryToolFromCatalogFile() {
        assertThat(catalog.size()).isEqualTo(26);
        assertThat(catalog.contains("product_search_by_sku")).isTrue();
        assertThat(catalog.get("no_such_tool")).isNull();
    }

    @Test
    void keywordsComeFromHintsNameAndSynonymGroups() {
        ToolMetadata tool = catalog.get("invoice_list_sales");

        assertThat(tool.getKeywords())
                // hints
                .contains("unpaid", "status")
                // name segments
                .contains("invoice", "list", "sales")
                // synonym groups naming the tool
                .contains("receivable", "outstanding");
    }

    @Test
    void hintKeywordsAreNormalized() {
        assertThat(catalog.get("product_search_by_sku").getKeywords())
                .contains("product", "sku")
                .doesNotContain("barang", "by");
    }

    @Test
    void parametersKeepDeclaredOrder() {
        ToolMetadata tool = catalog.get("invoice_list_sales");

        assertThat(tool.getParameters()).containsExactly("search", "contact_id", "status_id", "date_from", "date_to");
        assertThat(tool.acceptsParameter("date_from")).isTrue();
        assertThat(catalog.get("financial_bank_balances").acceptsParameter("date_from")).isFalse();
    }

    @Test
    void rejectsDuplicateToolName() {
        List<ToolDefinition> definitions = List.of(
                ToolDefinition.builder().name("contact_list").build(),
                ToolDefinition.builder().name("contact_list").build());

        assertThatThrownBy(() -> ToolCatalog.fromDefinitions(definitions, synonymTable, new KeywordScorer(synonymTable)))
                .isInstanceOf(RoutingConfigurationException.class)
                .hasMessageContaining("contact_list");
    }

    @Test
    void rejectsToolWithoutName() {
        List<ToolDefinition> definitions = List.of(ToolDefinition.builder().purpose("nameless").build());

        assertThatThrownBy(() -> ToolCatalog.fromDefinitions(definitions, synonymTable, new KeywordScorer(synonymTable)))
                .isInstanceOf(RoutingConfigurationException.class);
    }
}
