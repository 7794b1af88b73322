package com.ledgerAssist.toolRouter.routing.model;

/**
 * States of the routing pipeline.
 *
 * PATTERN_HIT -> END
 * NO_PATTERN_HIT -> RANKED -> END
 * NO_PATTERN_HIT -> CLARIFY -> END
 */
public enum RoutingState {
    PATTERN_HIT,
    NO_PATTERN_HIT,
    RANKED,
    CLARIFY
}
