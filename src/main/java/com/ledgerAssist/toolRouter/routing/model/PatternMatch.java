package com.ledgerAssist.toolRouter.routing.model;

import lombok.Value;

/**
 * A pattern together with the phrase that matched the query.
 */
@Value
public class PatternMatch {

    RoutePattern pattern;
    String matchedPhrase;
}
