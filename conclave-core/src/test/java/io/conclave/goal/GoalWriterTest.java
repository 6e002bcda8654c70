package io.conclave.goal;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GoalWriterTest {
    private final GoalWriter writer = new GoalWriter();
    private final GoalParser parser = new GoalParser();

    private static RepositoryGoal sample(String primary, List<String> criteria) {
        return RepositoryGoal.builder(primary)
                .description("First line\nSecond line with \"quotes\"")
                .successCriteria(criteria)
                .constraints(Map.of("performance", "Sub-100ms response"))
                .stakeholders(Map.of("primary", "API consumers"))
                .scope(new GoalScope("HTTP endpoints", "Mobile clients\nDesktop apps"))
                .metadata(new GoalMetadata("2024-05-01 10:00:00", "2024-05-02 11:30:00", "1.0"))
                .build();
    }

    @Test
    void parseWriteParsePreservesGoal() {
        List<RepositoryGoal> goals = List.of(
                sample("Build fast API", List.of("p99 under 100ms", "Zero data loss")),
                sample("Primary: with a colon", List.of("criterion: with colon", "# not a comment")),
                sample("Back\\slash and \"quotes\"", List.of()),
                sample("Ünïcode goal", List.of("single")));

        for (RepositoryGoal goal : goals) {
            RepositoryGoal reparsed = parser.parse(writer.write(goal));

            assertNotNull(reparsed, goal.primary());
            assertEquals(goal.primary(), reparsed.primary());
            assertEquals(goal.successCriteria(), reparsed.successCriteria());
            assertEquals(goal, reparsed);
        }
    }

    @Test
    void outputIsAcceptedByLineParser() throws Exception {
        String text = writer.write(sample("Build fast API", List.of("a", "b")));

        Map<String, Object> tree = new FallbackGoalParser().parse(GoalParser.clean(text));

        assertEquals(List.of("a", "b"), tree.get("success_criteria"));
        assertEquals("1.0", tree.get("version"));
    }

    @Test
    void multiLineCriterionKeepsLineBreaks() throws Exception {
        String text = "goal:\n"
                + "  primary: Build fast API\n"
                + "success_criteria:\n"
                + "  - |\n"
                + "    p99 under 100ms\n"
                + "    on cold start\n"
                + "  - zero downtime\n";

        RepositoryGoal first = parser.parse(text);
        String written = writer.write(first);
        RepositoryGoal second = parser.parse(written);

        assertEquals(List.of("p99 under 100ms\non cold start", "zero downtime"), first.successCriteria());
        assertEquals(first.successCriteria(), second.successCriteria());
        Map<String, Object> tree = new FallbackGoalParser().parse(GoalParser.clean(written));
        assertEquals(List.of("p99 under 100ms\non cold start\n", "zero downtime"), tree.get("success_criteria"));
    }

    @Test
    void lineParserReadsFoldedListItems() throws Exception {
        Map<String, Object> tree = new FallbackGoalParser().parse("items:\n  - >\n    one\n    two\n  - three\n");

        assertEquals(List.of("one two\n", "three"), tree.get("items"));
    }

    @Test
    void writesMetadataAfterMarker() {
        String text = writer.write(sample("Build fast API", List.of()));

        int marker = text.indexOf("# Metadata");
        assertTrue(marker > 0);
        assertTrue(text.indexOf("last_updated: \"2024-05-02 11:30:00\"") > marker);
    }
}
