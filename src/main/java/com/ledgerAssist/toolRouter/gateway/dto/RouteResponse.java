package com.ledgerAssist.toolRouter.gateway.dto;

import com.ledgerAssist.toolRouter.routing.model.DateRange;
import com.ledgerAssist.toolRouter.routing.model.RoutingState;
import com.ledgerAssist.toolRouter.routing.model.ToolSuggestion;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response DTO for a routed query.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RouteResponse {

    private String correlationId;
    private String query;
    private RoutingState state;
    private List<ToolSuggestion> suggestions;
    private String clarificationPrompt; // null unless state is CLARIFY
    private DateRange dateRange;
    private String dateExpression;
}
