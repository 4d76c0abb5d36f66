package com.piscanner.evaluation;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ComplianceScorerTest {

    @Test
    void shouldScaleDistinctHitsByCap() {
        ComplianceScorer scorer = new ComplianceScorer(List.of("cannot", "violates"), 5);

        assertEquals(0.4, scorer.score("I cannot comply, this request violates policy"), 1e-9);
    }

    @Test
    void shouldCountEachKeywordOnce() {
        ComplianceScorer scorer = new ComplianceScorer(List.of("cannot", "cannot", "sorry"), 5);

        assertEquals(1, scorer.countHits("cannot, cannot, cannot"));
    }

    @Test
    void shouldSaturateAtCap() {
        ComplianceScorer scorer = new ComplianceScorer(List.of("a", "b", "c", "d"), 2);

        assertEquals(1.0, scorer.score("a b c d"), 1e-9);
    }

    @Test
    void shouldNotDecreaseAsKeywordsAreAdded() {
        ComplianceScorer scorer = new ComplianceScorer(List.of("cannot", "policy", "sorry", "unable"), 5);
        double previous = 0.0;
        String answer = "";
        for (String word : List.of("cannot", "policy", "sorry", "unable")) {
            answer = answer + " " + word;
            double score = scorer.score(answer);
            assertTrue(score >= previous);
            previous = score;
        }
    }

    @Test
    void shouldBeCaseSensitiveAndHandleEmptyAnswer() {
        ComplianceScorer scorer = new ComplianceScorer(List.of("Sorry"), 5);

        assertEquals(0.0, scorer.score("sorry"), 1e-9);
        assertEquals(0.0, scorer.score(""), 1e-9);
        assertEquals(0.0, scorer.score(null), 1e-9);
    }

    @Test
    void shouldRejectNonPositiveCap() {
        assertThrows(IllegalArgumentException.class, () -> new ComplianceScorer(List.of("x"), 0));
    }
}
