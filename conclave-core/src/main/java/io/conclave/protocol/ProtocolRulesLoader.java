package io.conclave.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.conclave.config.ConfigurationException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads and writes protocol rules files.
 */
public final class ProtocolRulesLoader {
    private final Logger logger = Logger.getLogger(ProtocolRulesLoader.class.getName());
    private final ObjectMapper mapper;

    public ProtocolRulesLoader() {
        this(new ObjectMapper());
    }

    public ProtocolRulesLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Loads the rules, returning {@link ProtocolRules#empty()} when the file is missing or
     * malformed.
     *
     * @param file the rules file
     * @return the rules
     */
    public ProtocolRules loadOrEmpty(Path file) {
        if (!Files.exists(file)) {
            logger.info("No protocol rules at " + file);
            return ProtocolRules.empty();
        }
        try {
            return load(file);
        } catch (ConfigurationException e) {
            logger.log(Level.WARNING, "Invalid protocol rules; continuing without rules", e);
            return ProtocolRules.empty();
        }
    }

    /**
     * @throws ConfigurationException if the file cannot be read or is not a rules object
     */
    public ProtocolRules load(Path file) {
        JsonNode root;
        try {
            root = mapper.readTree(file.toFile());
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read " + file, e);
        }
        if (root == null || !root.isObject()) {
            throw new ConfigurationException("Expected a JSON object in " + file);
        }
        JsonNode rulesNode = root.path("rules");
        if (!rulesNode.isMissingNode() && !rulesNode.isObject()) {
            throw new ConfigurationException("'rules' must be an object in " + file);
        }
        Map<String, String> rules = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = rulesNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            rules.put(field.getKey(), field.getValue().asText());
        }
        Map<String, Boolean> autoFix = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> flags = root.path("auto_fix_patterns").fields();
        while (flags.hasNext()) {
            Map.Entry<String, JsonNode> flag = flags.next();
            autoFix.put(flag.getKey(), flag.getValue().asBoolean(false));
        }
        try {
            return new ProtocolRules(
                    root.path("version").asText(ProtocolRules.DEFAULT_VERSION),
                    root.path("created").asText(""),
                    root.path("repository_goal_focus").asBoolean(true),
                    root.path("max_rules_limit").asInt(ProtocolRules.DEFAULT_MAX_RULES),
                    rules,
                    autoFix);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid protocol rules in " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Writes rules as pretty-printed JSON.
     *
     * @throws ConfigurationException if the file cannot be written
     */
    public void write(Path file, ProtocolRules rules) {
        ObjectNode root = mapper.createObjectNode();
        root.put("version", rules.version());
        root.put("created", rules.created());
        root.put("repository_goal_focus", rules.repositoryGoalFocus());
        root.put("max_rules_limit", rules.maxRulesLimit());
        ObjectNode rulesNode = root.putObject("rules");
        rules.rules().forEach(rulesNode::put);
        ObjectNode autoFix = root.putObject("auto_fix_patterns");
        rules.autoFixPatterns().forEach(autoFix::put);
        try {
            Files.writeString(file, mapper.writer().with(SerializationFeature.INDENT_OUTPUT)
                    .writeValueAsString(root) + System.lineSeparator());
        } catch (IOException e) {
            throw new ConfigurationException("Cannot write " + file, e);
        }
    }
}
