package io.conclave.goal;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AlignmentScorerTest {
    private final AlignmentScorer scorer = AlignmentScorer.defaults();

    @Test
    void extractsLongAlphabeticLowerCasedTokens() {
        assertEquals(List.of("build", "fast", "with", "response"),
                List.copyOf(AlignmentScorer.builder().stopWords(Set.of()).build()
                        .extractKeywords("Build a FAST api with Sub-100ms response")));
        assertEquals(List.of("build", "fast", "response"),
                List.copyOf(scorer.extractKeywords("Build a FAST api with Sub-100ms response")));
        assertTrue(scorer.extractKeywords(null).isEmpty());
    }

    @Test
    void buildFastApiScenario() {
        RepositoryGoal goal = RepositoryGoal.builder("Build fast API")
                .constraint("performance", "Sub-100ms response")
                .build();

        AlignmentResult result = scorer.computeAlignment(goal, "optimize the api response time");

        assertTrue(result.matchingKeywords().contains("response"));
        assertTrue(result.confidence() > 0.3);
        assertTrue(result.aligned());
        assertEquals("Keyword match: 1/3 (33.3%)", result.reason());
    }

    @Test
    void neutralConfidenceWhenGoalHasNoKeywords() {
        RepositoryGoal goal = RepositoryGoal.builder("Do it").build();

        for (String request : List.of("add caching layer", "rewrite everything", "")) {
            AlignmentResult result = scorer.computeAlignment(goal, request);

            assertEquals(0.5, result.confidence());
            assertTrue(result.aligned());
        }
    }

    @Test
    void disjointRequestScoresZero() {
        RepositoryGoal goal = RepositoryGoal.builder("Build fast API").build();

        AlignmentResult result = scorer.computeAlignment(goal, "paint the office walls");

        assertEquals(0.0, result.confidence());
        assertFalse(result.aligned());
        assertTrue(result.matchingKeywords().isEmpty());
    }

    @Test
    void excludedScopeOverridesOverlap() {
        RepositoryGoal goal = RepositoryGoal.builder("Build fast mobile API")
                .scope(new GoalScope("", "Mobile clients"))
                .build();

        AlignmentResult result = scorer.computeAlignment(goal, "build fast mobile screens");

        assertFalse(result.aligned());
        assertEquals(0.9, result.confidence());
        assertEquals(Set.of("mobile"), result.matchingKeywords());
        assertTrue(result.reason().startsWith("Request may fall under excluded scope"));
    }

    @Test
    void excludedScopeIgnoredWithoutSharedKeyword() {
        RepositoryGoal goal = RepositoryGoal.builder("Build fast API")
                .scope(new GoalScope("", "Mobile clients"))
                .build();

        AlignmentResult result = scorer.computeAlignment(goal, "build the fast path");

        assertTrue(result.aligned());
    }

    @Test
    void missingGoalIsAlignedWithZeroConfidence() {
        AlignmentResult result = scorer.computeAlignment(null, "anything");

        assertTrue(result.aligned());
        assertEquals(0.0, result.confidence());
        assertEquals("No goal defined", result.reason());
    }

    @Test
    void constantsAreOverridable() {
        AlignmentScorer strict = AlignmentScorer.builder()
                .alignmentThreshold(0.5)
                .neutralConfidence(0.2)
                .build();
        RepositoryGoal goal = RepositoryGoal.builder("Build fast API")
                .constraint("performance", "Sub-100ms response")
                .build();

        assertFalse(strict.computeAlignment(goal, "optimize the api response time").aligned());
        assertFalse(strict.computeAlignment(RepositoryGoal.builder("Do it").build(), "x").aligned());
        assertThrows(IllegalArgumentException.class, () -> AlignmentScorer.builder().alignmentThreshold(1.5).build());
    }
}
