package com.ledgerAssist.toolRouter.routing.service;

import com.ledgerAssist.toolRouter.routing.dto.ToolDefinition;
import com.ledgerAssist.toolRouter.routing.exception.RoutingConfigurationException;
import com.ledgerAssist.toolRouter.routing.model.ToolMetadata;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-only index of the tools the router may suggest.
 *
 * Each tool's keyword set is the normalized union of its hint tokens, its name segments
 * ("invoice_list_sales" -> invoice, list, sales) and the canonical terms whose synonym group
 * lists the tool.
 */
@Slf4j
public final class ToolCatalog {

    private final Map<String, ToolMetadata> tools;

    private ToolCatalog(Map<String, ToolMetadata> tools) {
        this.tools = Collections.unmodifiableMap(tools);
    }

    /**
     * Builds the catalog index.
     *
     * @param definitions Tool definitions from the external catalog
     * @param synonymTable Synonym table used to normalize keywords
     * @param keywordScorer Tokenizer shared with query processing
     * @return Immutable catalog
     * @throws RoutingConfigurationException if a tool name is missing or declared twice
     */
    public static ToolCatalog fromDefinitions(List<ToolDefinition> definitions,
                                              SynonymTable synonymTable,
                                              KeywordScorer keywordScorer) {
        Map<String, ToolMetadata> tools = new LinkedHashMap<>();

        for (ToolDefinition definition : definitions) {
            String name = definition.getName() == null ? "" : definition.getName().trim();
            if (name.isEmpty()) {
                throw new RoutingConfigurationException("Tool definition without a name");
            }
            if (tools.containsKey(name)) {
                throw new RoutingConfigurationException("Tool declared twice in catalog: " + name);
            }

            Set<String> keywords = new LinkedHashSet<>();
            for (String hint : definition.getHints()) {
                keywords.addAll(keywordScorer.keywordsOf(hint));
            }
            keywords.addAll(keywordScorer.keywordsOf(name.replace('_', ' ')));
            keywords.addAll(synonymTable.termsForTool(name));

            tools.put(name, ToolMetadata.builder()
                    .name(name)
                    .purpose(definition.getPurpose() == null ? "" : definition.getPurpose())
                    .keywords(Collections.unmodifiableSet(keywords))
                    .parameters(List.copyOf(definition.getParameters()))
                    .build());
        }

        warnAboutUnknownTools(synonymTable, tools);
        log.info("Tool catalog loaded - tools: {}", tools.size());
        return new ToolCatalog(tools);
    }

    private static void warnAboutUnknownTools(SynonymTable synonymTable, Map<String, ToolMetadata> tools) {
        for (String term : synonymTable.canonicalTerms()) {
            for (String tool : synonymTable.toolsFor(term)) {
                if (!tools.containsKey(tool)) {
                    log.warn("Synonym term '{}' references tool '{}' which is not in the catalog - ignored", term, tool);
                }
            }
        }
    }

    /**
     * @return Tool metadata, or null if the catalog has no such tool
     */
    public ToolMetadata get(String name) {
        return tools.get(name);
    }

    public boolean contains(String name) {
        return tools.containsKey(name);
    }

    public Collection<ToolMetadata> tools() {
        return tools.values();
    }

    public int size() {
        return tools.size();
    }
}
