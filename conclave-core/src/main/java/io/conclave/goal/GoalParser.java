package io.conclave.goal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Two-tier parser for goal files.
 *
 * <ol>
 *   <li>Clean: drop comment lines and the commented example block that starts at
 *       {@value #EXAMPLE_START} and ends before {@value #EXAMPLE_END}.</li>
 *   <li>Parse the cleaned text as YAML. The root must be a mapping.</li>
 *   <li>If YAML parsing fails, parse with {@link FallbackGoalParser}.</li>
 *   <li>Fold the result into a {@link RepositoryGoal}.</li>
 * </ol>
 *
 * <p>Returns {@code null} when both tiers fail or {@code goal.primary} is empty. Metadata is
 * read from a {@code metadata:} mapping or, as written by {@link GoalWriter}, from top-level
 * {@code created}, {@code last_updated} and {@code version} keys.
 */
public final class GoalParser {
    static final String EXAMPLE_START = "# Example Configuration:";
    static final String EXAMPLE_END = "# Metadata";

    private static final TypeReference<Map<String, Object>> ROOT_TYPE = new TypeReference<>() {
    };

    private final Logger logger = Logger.getLogger(GoalParser.class.getName());
    private final YAMLMapper yamlMapper;
    private final FallbackGoalParser fallback;

    public GoalParser() {
        this(new YAMLMapper(), new FallbackGoalParser());
    }

    public GoalParser(YAMLMapper yamlMapper, FallbackGoalParser fallback) {
        this.yamlMapper = yamlMapper;
        this.fallback = fallback;
    }

    /**
     * Reads and parses a goal file.
     *
     * @param file the goal file
     * @return the goal, or {@code null} if the file is missing, unreadable or invalid
     */
    public RepositoryGoal parseFile(Path file) {
        if (!Files.exists(file)) {
            return null;
        }
        String text;
        try {
            text = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            logger.log(Level.WARNING, "Cannot read goal file " + file, e);
            return null;
        }
        return parse(text);
    }

    /**
     * Parses goal text.
     *
     * @param rawText the goal file contents
     * @return the goal, or {@code null} if neither tier can parse it or {@code primary} is empty
     */
    public RepositoryGoal parse(String rawText) {
        if (rawText == null) {
            return null;
        }
        Map<String, Object> tree = parseTree(clean(rawText));
        if (tree == null) {
            return null;
        }
        return fold(tree);
    }

    Map<String, Object> parseTree(String cleaned) {
        try {
            Map<String, Object> tree = yamlMapper.readValue(cleaned, ROOT_TYPE);
            return tree != null ? tree : Map.of();
        } catch (JsonProcessingException e) {
            logger.fine("YAML parse failed (" + e.getOriginalMessage() + "); trying line parser");
        }
        try {
            return fallback.parse(cleaned);
        } catch (GoalParseException e) {
            logger.warning("Goal text could not be parsed: " + e.getMessage());
            return null;
        }
    }

    /**
     * Removes comment lines and the example block.
     *
     * @param rawText the goal file contents
     * @return the cleaned text
     */
    public static String clean(String rawText) {
        StringBuilder out = new StringBuilder();
        boolean inExample = false;
        for (String line : rawText.replace("\r\n", "\n").split("\n", -1)) {
            String trimmed = line.strip();
            if (trimmed.startsWith(EXAMPLE_START)) {
                inExample = true;
                continue;
            }
            if (inExample) {
                if (!trimmed.startsWith(EXAMPLE_END)) {
                    continue;
                }
                inExample = false;
            }
            if (trimmed.startsWith("#")) {
                continue;
            }
            out.append(line).append('\n');
        }
        return out.toString();
    }

    private RepositoryGoal fold(Map<String, Object> tree) {
        Map<String, String> goal = stringMap(tree.get("goal"));
        String primary = goal.getOrDefault("primary", "").strip();
        if (primary.isEmpty()) {
            logger.warning("Goal has no primary objective");
            return null;
        }
        Map<String, String> scope = stringMap(tree.get("scope"));
        Map<String, String> metadata = stringMap(tree.get("metadata"));
        return RepositoryGoal.builder(primary)
                .description(goal.get("description"))
                .successCriteria(stringList(tree.get("success_criteria")))
                .constraints(stringMap(tree.get("constraints")))
                .stakeholders(stringMap(tree.get("stakeholders")))
                .scope(new GoalScope(scope.get("included"), scope.get("excluded")))
                .metadata(new GoalMetadata(
                        metadata.getOrDefault("created", text(tree.get("created"))),
                        metadata.getOrDefault("last_updated", text(tree.get("last_updated"))),
                        metadata.getOrDefault("version", text(tree.get("version")))))
                .build();
    }

    private static Map<String, String> stringMap(Object value) {
        Map<String, String> result = new LinkedHashMap<>();
        if (value instanceof Map<?, ?> map) {
            map.forEach((k, v) -> result.put(String.valueOf(k), text(v)));
        }
        return result;
    }

    private static List<String> stringList(Object value) {
        List<String> result = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object item : list) {
                if (item != null) {
                    result.add(text(item));
                }
            }
        }
        return result;
    }

    private static String text(Object value) {
        return value == null ? "" : String.valueOf(value);
    }
}
