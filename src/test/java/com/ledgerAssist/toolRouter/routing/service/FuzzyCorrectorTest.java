package com.ledgerAssist.toolRouter.routing.service;

import com.ledgerAssist.toolRouter.routing.RoutingFixtures;
import com.ledgerAssist.toolRouter.routing.dto.SynonymGroupDefinition;
import com.ledgerAssist.toolRouter.routing.util.SimilarityScorer;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FuzzyCorrectorTest {

    private final SynonymTable table = RoutingFixtures.synonymTable();
    private final FuzzyCorrector corrector = new FuzzyCorrector(table);

    private final SynonymTable smallTable = SynonymTable.fromGroups(List.of(
            SynonymGroupDefinition.builder().canonical("invoice").forms(List.of("faktur")).build(),
            SynonymGroupDefinition.builder().canonical("customer").forms(List.of("pelanggan")).build()));

    @Test
    void correctsCommonTypos() {
        assertThat(corrector.correct("invoce")).isEqualTo("invoice");
        assertThat(corrector.correct("pelangan")).isEqualTo("customer");
        assertThat(corrector.correct("fakturr")).isEqualTo("invoice");
    }

    @Test
    void exactKeyShortCircuits() {
        assertThat(corrector.correct("tagihan")).isEqualTo("invoice");
    }

    @Test
    void correctionIsIdempotent() {
        String once = corrector.correct("invoce");
        assertThat(corrector.correct(once)).isEqualTo(once);
    }

    @Test
    void unrelatedTokenIsNotCorrected() {
        assertThat(corrector.correct("data")).isNull();
        assertThat(corrector.correct("banana")).isNull();
    }

    @Test
    void shortKeysAreOnlyMatchedExactly() {
        assertThat(corrector.correct("per")).isEqualTo("aggregation");
        assertThat(corrector.correct("kas")).isEqualTo("cash");
        assertThat(corrector.correct("perlu")).isNull();
        assertThat(corrector.correct("periode")).isNull();
    }

    @Test
    void shortTokensAreNeverCorrected() {
        FuzzyCorrector alwaysMatches = new FuzzyCorrector(smallTable, (query, choice) -> 100, 80);

        assertThat(alwaysMatches.correct("ab")).isNull();
        assertThat(alwaysMatches.correct(null)).isNull();
    }

    @Test
    void thresholdIsInclusive() {
        SimilarityScorer atThreshold = (query, choice) -> choice.equals("faktur") ? 80 : 0;
        SimilarityScorer belowThreshold = (query, choice) -> choice.equals("faktur") ? 79.99 : 0;

        assertThat(new FuzzyCorrector(smallTable, atThreshold, 80).correct("faktor")).isEqualTo("invoice");
        assertThat(new FuzzyCorrector(smallTable, belowThreshold, 80).correct("faktor")).isNull();
    }

    @Test
    void tiesKeepEarliestRegisteredKey() {
        FuzzyCorrector flat = new FuzzyCorrector(smallTable, (query, choice) -> 90, 80);

        assertThat(flat.correct("xyz")).isEqualTo("invoice");
    }

    @Test
    void defaultThresholdIsEighty() {
        assertThat(corrector.getThreshold()).isEqualTo(FuzzyCorrector.DEFAULT_THRESHOLD).isEqualTo(80.0);
    }
}
