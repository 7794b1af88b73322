package com.ledgerAssist.toolRouter.routing.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * An idiomatic expression bound directly to one tool.
 * All phrases are lower-case paraphrases of each other, in either language.
 */
@Value
@Builder
public class RoutePattern {

    String id;
    List<String> phrases;
    String tool;
    Map<String, Object> params;

    /**
     * Date phrase used to fill date parameters when the query has no date of its own. May be null.
     */
    String defaultPeriod;

    Confidence confidence;
}
