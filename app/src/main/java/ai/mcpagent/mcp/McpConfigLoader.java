package ai.mcpagent.mcp;

import ai.mcpagent.exception.McpConfigException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Reads server configuration from a {@code .mcprc} file and the {@code MCP_SERVERS} environment variable.
 *
 * <p>Both sources hold a JSON object mapping server name to a record of {@code command}, {@code args}, {@code env},
 * {@code description}, {@code transport} ({@code stdio} by default, or {@code sse}), {@code url} and
 * {@code reconnect}. The workspace {@code .mcprc} is preferred over the one in the user's home directory; only the
 * first one found is read. Entries from the environment variable are merged afterwards, replacing file entries of the
 * same name.
 */
public final class McpConfigLoader {
    private static final Logger logger = LogManager.getLogger(McpConfigLoader.class);
    private static final ObjectMapper OBJECT_MAPPER =
            new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public static final String MCPRC_FILE_NAME = ".mcprc";
    public static final String MCP_SERVERS_ENV = "MCP_SERVERS";

    private final Path workspaceRoot;
    private final @Nullable Path homeDir;
    private final Map<String, String> environment;

    public McpConfigLoader(Path workspaceRoot) {
        this(workspaceRoot, Path.of(System.getProperty("user.home")), System.getenv());
    }

    public McpConfigLoader(Path workspaceRoot, @Nullable Path homeDir, Map<String, String> environment) {
        this.workspaceRoot = workspaceRoot;
        this.homeDir = homeDir;
        this.environment = environment;
    }

    /**
     * Loads and validates the merged configuration.
     *
     * @throws McpConfigException if a source exists but cannot be read or parsed, or the merged result is invalid
     */
    public McpConfig load() {
        var merged = new LinkedHashMap<String, McpServer>();

        var rcFile = findMcprc();
        if (rcFile != null) {
            var servers = loadFile(rcFile);
            servers.forEach(s -> merged.put(s.name(), s));
            logger.info("Loaded {} MCP server(s) from {}", servers.size(), rcFile);
        }

        var fromEnv = environment.get(MCP_SERVERS_ENV);
        if (fromEnv != null && !fromEnv.isBlank()) {
            var servers = parseServers(fromEnv, MCP_SERVERS_ENV + " environment variable");
            for (var server : servers) {
                if (merged.containsKey(server.name())) {
                    logger.debug("{} overrides MCP server '{}'", MCP_SERVERS_ENV, server.name());
                    // keep the file's position, take the environment's definition
                }
                merged.put(server.name(), server);
            }
            logger.info("Loaded {} MCP server(s) from {}", servers.size(), MCP_SERVERS_ENV);
        }

        var config = new McpConfig(new ArrayList<>(merged.values()));
        config.validate();
        return config;
    }

    /** Returns the {@code .mcprc} that {@link #load()} would read, or null when there is none. */
    public @Nullable Path findMcprc() {
        var candidates = new ArrayList<Path>();
        candidates.add(workspaceRoot.resolve(MCPRC_FILE_NAME));
        if (homeDir != null) {
            candidates.add(homeDir.resolve(MCPRC_FILE_NAME));
        }
        return candidates.stream().filter(Files::isRegularFile).findFirst().orElse(null);
    }

    /** Reads a single {@code .mcprc}-shaped file. */
    public static List<McpServer> loadFile(Path file) {
        String json;
        try {
            json = Files.readString(file);
        } catch (IOException e) {
            throw new McpConfigException("Unable to read " + file + ": " + e.getMessage(), e);
        }
        return parseServers(json, file.toString());
    }

    /** Parses a JSON object of name to server record, preserving declaration order. */
    public static List<McpServer> parseServers(String json, String source) {
        JsonNode root;
        try {
            root = OBJECT_MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new McpConfigException("Malformed MCP configuration in " + source + ": " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new McpConfigException("MCP configuration in " + source + " must be a JSON object");
        }

        var result = new ArrayList<McpServer>();
        var fields = root.fields();
        while (fields.hasNext()) {
            var entry = fields.next();
            if (!entry.getValue().isObject()) {
                throw new McpConfigException(
                        "MCP server '%s' in %s must be a JSON object".formatted(entry.getKey(), source));
            }
            var node = ((ObjectNode) entry.getValue()).deepCopy();
            node.put("name", entry.getKey());
            if (!node.hasNonNull("transport")) {
                node.put("transport", "stdio");
            }
            try {
                result.add(OBJECT_MAPPER.treeToValue(node, McpServer.class));
            } catch (JsonProcessingException | IllegalArgumentException e) {
                throw new McpConfigException(
                        "Invalid MCP server '%s' in %s: %s".formatted(entry.getKey(), source, e.getMessage()), e);
            }
        }
        return result;
    }
}
