package com.ledgerAssist.toolRouter.routing.util;

/**
 * String similarity on a 0-100 scale.
 */
@FunctionalInterface
public interface SimilarityScorer {

    double score(String query, String choice);
}
