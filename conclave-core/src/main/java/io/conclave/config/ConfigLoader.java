package io.conclave.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.conclave.Role;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads and writes the communication config file.
 *
 * <pre>{@code
 * {
 *   "broker": {
 *     "host": "localhost", "port": 5672, "virtual_host": "/",
 *     "username": "guest", "password": "guest",
 *     "connection_timeout_ms": 5000, "handshake_timeout_ms": 5000, "rpc_timeout_ms": 10000,
 *     "prefetch_count": 50, "heartbeat_seconds": 60,
 *     "exchanges": { "agent.activities": "topic", ... }
 *   },
 *   "agents": {
 *     "hub": { "title": "Conclave-Dev-Interactive", "command": [ ... ] },
 *     ...
 *   }
 * }
 * }</pre>
 *
 * <p>Every key is optional; missing keys take their default value.
 */
public final class ConfigLoader {
    private final Logger logger = Logger.getLogger(ConfigLoader.class.getName());
    private final ObjectMapper mapper;

    public ConfigLoader() {
        this(new ObjectMapper());
    }

    public ConfigLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Loads the config file, falling back to {@link CommunicationConfig#defaults()} when the
     * file is missing or malformed.
     *
     * @param file the config file
     * @return the loaded or default configuration
     */
    public CommunicationConfig loadOrDefault(Path file) {
        if (!Files.exists(file)) {
            logger.info("No communication config at " + file + "; using defaults");
            return CommunicationConfig.defaults();
        }
        try {
            return load(file);
        } catch (ConfigurationException e) {
            logger.log(Level.WARNING, "Invalid communication config; using defaults", e);
            return CommunicationConfig.defaults();
        }
    }

    /**
     * Loads the config file.
     *
     * @param file the config file
     * @return the configuration
     * @throws ConfigurationException if the file cannot be read or holds invalid values
     */
    public CommunicationConfig load(Path file) {
        JsonNode root;
        try {
            root = mapper.readTree(file.toFile());
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read " + file, e);
        }
        if (root == null || !root.isObject()) {
            throw new ConfigurationException("Expected a JSON object in " + file);
        }
        try {
            return new CommunicationConfig(readBroker(root.path("broker")), readAgents(root.path("agents")));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new ConfigurationException("Invalid value in " + file + ": " + e.getMessage(), e);
        }
    }

    private BrokerSettings readBroker(JsonNode node) {
        BrokerSettings.Builder builder = BrokerSettings.builder();
        if (!node.isObject()) {
            return builder.build();
        }
        if (node.has("host")) builder.host(node.get("host").asText());
        if (node.has("port")) builder.port(intValue(node, "port"));
        if (node.has("virtual_host")) builder.virtualHost(node.get("virtual_host").asText());
        if (node.has("username")) builder.username(node.get("username").asText());
        if (node.has("password")) builder.password(node.get("password").asText());
        if (node.has("connection_timeout_ms")) builder.connectionTimeoutMs(intValue(node, "connection_timeout_ms"));
        if (node.has("handshake_timeout_ms")) builder.handshakeTimeoutMs(intValue(node, "handshake_timeout_ms"));
        if (node.has("rpc_timeout_ms")) builder.rpcTimeoutMs(intValue(node, "rpc_timeout_ms"));
        if (node.has("prefetch_count")) builder.prefetchCount(intValue(node, "prefetch_count"));
        if (node.has("heartbeat_seconds")) builder.heartbeatSeconds(intValue(node, "heartbeat_seconds"));
        JsonNode exchanges = node.get("exchanges");
        if (exchanges != null && exchanges.isObject()) {
            Map<String, String> map = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = exchanges.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                map.put(field.getKey(), field.getValue().asText());
            }
            builder.exchanges(map);
        }
        return builder.build();
    }

    private Map<Role, AgentSettings> readAgents(JsonNode node) {
        Map<Role, AgentSettings> agents = new EnumMap<>(Role.class);
        if (!node.isObject()) {
            return agents;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            Role role;
            try {
                role = Role.fromId(field.getKey());
            } catch (IllegalArgumentException e) {
                logger.warning("Ignoring settings for unknown agent '" + field.getKey() + "'");
                continue;
            }
            JsonNode agent = field.getValue();
            String title = agent.path("title").asText(role.title());
            List<String> command = new ArrayList<>();
            JsonNode commandNode = agent.get("command");
            if (commandNode != null && commandNode.isArray()) {
                for (JsonNode part : commandNode) {
                    command.add(part.asText());
                }
            }
            agents.put(role, new AgentSettings(title, command));
        }
        return agents;
    }

    private static int intValue(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (!value.canConvertToInt()) {
            throw new IllegalArgumentException(field + " must be an integer");
        }
        return value.asInt();
    }

    /**
     * Writes a configuration as pretty-printed JSON.
     *
     * @param file   target file; parent directories must exist
     * @param config the configuration
     * @throws ConfigurationException if the file cannot be written
     */
    public void write(Path file, CommunicationConfig config) {
        ObjectNode root = mapper.createObjectNode();
        BrokerSettings broker = config.broker();
        ObjectNode brokerNode = root.putObject("broker");
        brokerNode.put("host", broker.host());
        brokerNode.put("port", broker.port());
        brokerNode.put("virtual_host", broker.virtualHost());
        brokerNode.put("username", broker.username());
        brokerNode.put("password", broker.password());
        brokerNode.put("connection_timeout_ms", broker.connectionTimeoutMs());
        brokerNode.put("handshake_timeout_ms", broker.handshakeTimeoutMs());
        brokerNode.put("rpc_timeout_ms", broker.rpcTimeoutMs());
        brokerNode.put("prefetch_count", broker.prefetchCount());
        brokerNode.put("heartbeat_seconds", broker.heartbeatSeconds());
        ObjectNode exchanges = brokerNode.putObject("exchanges");
        broker.exchanges().forEach(exchanges::put);

        ObjectNode agents = root.putObject("agents");
        config.agents().forEach((role, settings) -> {
            ObjectNode agent = agents.putObject(role.id());
            agent.put("title", settings.title());
            if (!settings.command().isEmpty()) {
                ArrayNode command = agent.putArray("command");
                settings.command().forEach(command::add);
            }
        });

        try {
            Files.writeString(file, mapper.writer().with(SerializationFeature.INDENT_OUTPUT)
                    .writeValueAsString(root) + System.lineSeparator());
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Cannot serialize communication config", e);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot write " + file, e);
        }
    }
}
