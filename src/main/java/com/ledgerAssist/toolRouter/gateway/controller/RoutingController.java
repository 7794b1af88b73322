package com.ledgerAssist.toolRouter.gateway.controller;

import com.ledgerAssist.toolRouter.gateway.dto.RouteRequest;
import com.ledgerAssist.toolRouter.gateway.dto.RouteResponse;
import com.ledgerAssist.toolRouter.gateway.service.GatewayService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Routing REST controller - thin HTTP layer over the tool router.
 */
@RestController
@RequestMapping("/api/v1/route")
@RequiredArgsConstructor
public class RoutingController {

    private final GatewayService gatewayService;

    /**
     * Routes a free-text query to candidate tools.
     *
     * @param request Route request containing the query and an optional reference date
     * @return Suggestions, or a clarification prompt when the query is too vague
     */
    @PostMapping
    public ResponseEntity<RouteResponse> route(@Valid @RequestBody RouteRequest request) {
        return ResponseEntity.ok(gatewayService.processRouteRequest(request));
    }
}
