package com.ledgerAssist.toolRouter.routing.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of routing a single query.
 *
 * An empty suggestion list together with a clarification prompt is a successful result:
 * it means the caller should ask the user for more detail.
 */
@Value
@Builder
public class RoutingResult {

    String query;

    RoutingState state;

    /**
     * Ordered by score descending, tool name ascending.
     */
    @Builder.Default
    List<ToolSuggestion> suggestions = List.of();

    String clarificationPrompt;

    /**
     * Date span found in the query, attached whatever the tool-matching outcome was.
     */
    DateRange dateRange;

    /**
     * The literal phrase the date range was resolved from.
     */
    String dateExpression;

    public boolean needsClarification() {
        return clarificationPrompt != null;
    }
}
