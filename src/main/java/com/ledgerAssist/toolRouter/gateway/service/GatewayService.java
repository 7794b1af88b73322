package com.ledgerAssist.toolRouter.gateway.service;

import com.ledgerAssist.toolRouter.gateway.dto.RouteRequest;
import com.ledgerAssist.toolRouter.gateway.dto.RouteResponse;
import com.ledgerAssist.toolRouter.routing.model.RoutingResult;
import com.ledgerAssist.toolRouter.routing.service.ToolRouter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Gateway service - handles the request-level concerns around the router.
 *
 * Responsibilities:
 * - Generate correlationId
 * - Resolve the reference date (request value or today in the configured time zone)
 * - Delegate to the router and map the result
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GatewayService {

    private final CorrelationIdService correlationIdService;
    private final ToolRouter toolRouter;
    private final Clock routingClock;

    /**
     * Routes a query received over HTTP.
     *
     * @param request Route request containing the query
     * @return Route response with ranked suggestions or a clarification prompt
     */
    public RouteResponse processRouteRequest(RouteRequest request) {
        String correlationId = correlationIdService.generateCorrelationId();
        LocalDate today = request.getReferenceDate() != null
                ? request.getReferenceDate()
                : LocalDate.now(routingClock);

        log.info("Route request received - correlationId: {}, referenceDate: {}", correlationId, today);

        RoutingResult result = toolRouter.route(request.getQuery(), today);

        log.info("Route request completed - correlationId: {}, state: {}, suggestions: {}",
                correlationId, result.getState(), result.getSuggestions().size());

        return RouteResponse.builder()
                .correlationId(correlationId)
                .query(result.getQuery())
                .state(result.getState())
                .suggestions(result.getSuggestions())
                .clarificationPrompt(result.getClarificationPrompt())
                .dateRange(result.getDateRange())
                .dateExpression(result.getDateExpression())
                .build();
    }
}
