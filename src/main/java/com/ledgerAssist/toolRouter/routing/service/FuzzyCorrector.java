package com.ledgerAssist.toolRouter.routing.service;

import com.ledgerAssist.toolRouter.routing.util.SimilarityScorer;
import com.ledgerAssist.toolRouter.routing.util.WeightedRatio;
import lombok.extern.slf4j.Slf4j;

/**
 * Typo-tolerant lookup against the synonym vocabulary.
 */
@Slf4j
public final class FuzzyCorrector {

    public static final double DEFAULT_THRESHOLD = 80;

    /**
     * Tokens shorter than this produce spurious high scores and are never corrected.
     */
    public static final int MIN_TOKEN_LENGTH = 3;

    /**
     * Vocabulary keys shorter than this are only reachable by exact lookup. A partial match
     * against "per" would otherwise turn "perlu" or "periode" into a canonical term.
     */
    public static final int MIN_CANDIDATE_LENGTH = 4;

    private final SynonymTable synonymTable;
    private final SimilarityScorer scorer;
    private final double threshold;

    public FuzzyCorrector(SynonymTable synonymTable) {
        this(synonymTable, new WeightedRatio(), DEFAULT_THRESHOLD);
    }

    public FuzzyCorrector(SynonymTable synonymTable, SimilarityScorer scorer, double threshold) {
        this.synonymTable = synonymTable;
        this.scorer = scorer;
        this.threshold = threshold;
    }

    /**
     * Corrects a possibly misspelled token to a canonical term.
     *
     * @param token Single token from the query
     * @return Canonical term of the closest vocabulary entry scoring at or above the threshold, or null
     */
    public String correct(String token) {
        if (token == null || token.length() < MIN_TOKEN_LENGTH) {
            return null;
        }
        String exact = synonymTable.normalize(token);
        if (exact != null) {
            return exact;
        }

        String bestTerm = null;
        double bestScore = -1;
        for (String candidate : synonymTable.vocabulary()) {
            if (candidate.length() < MIN_CANDIDATE_LENGTH) {
                continue;
            }
            double score = scorer.score(token, candidate);
            if (score > bestScore) {
                bestScore = score;
                bestTerm = candidate;
            }
        }

        if (bestTerm == null || bestScore < threshold) {
            return null;
        }
        log.debug("Fuzzy correction - token: '{}', matched: '{}', score: {}", token, bestTerm, bestScore);
        return synonymTable.normalize(bestTerm);
    }

    public double getThreshold() {
        return threshold;
    }
}
