package ai.mcpagent.cli;

import ai.mcpagent.agents.ExecutionLoop;
import ai.mcpagent.agents.SubAgentTool;
import ai.mcpagent.agents.TaskOutcome;
import ai.mcpagent.agents.TaskRequest;
import ai.mcpagent.agents.TerminationReason;
import ai.mcpagent.agents.TurnEvent;
import ai.mcpagent.exception.McpConfigException;
import ai.mcpagent.llm.ModelClient;
import ai.mcpagent.llm.ModelClients;
import ai.mcpagent.mcp.McpConfig;
import ai.mcpagent.mcp.McpConfigLoader;
import ai.mcpagent.mcp.McpServerRegistry;
import ai.mcpagent.tools.FileTools;
import ai.mcpagent.tools.PermissionMode;
import ai.mcpagent.tools.ShellTools;
import ai.mcpagent.tools.TodoTools;
import ai.mcpagent.tools.ToolRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Callable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import picocli.CommandLine;

@CommandLine.Command(
        name = "mcp-agent",
        mixinStandardHelpOptions = true,
        version = "mcp-agent 0.1.0",
        description = "Runs an agent task against native tools and the MCP servers configured in .mcprc.")
public final class McpAgentCli implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(McpAgentCli.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    @CommandLine.Option(names = "--workspace", description = "Workspace root for file tools and .mcprc lookup.")
    @Nullable
    private Path workspace;

    @CommandLine.Option(names = "--mcprc", description = "Read MCP servers from this file instead of the default search.")
    @Nullable
    private Path mcprc;

    @CommandLine.Option(names = "--model", description = "Model name to use (default: ${DEFAULT-VALUE}).")
    private String modelName = ModelClients.DEFAULT_MODEL;

    @CommandLine.Option(names = "--prompt", description = "Task prompt, or @file to read it from a file.")
    @Nullable
    private String prompt;

    @CommandLine.Option(
            names = "--full-permissions",
            description = "Expose side-effecting tools (file writes, shell, side-effecting MCP tools).")
    private boolean fullPermissions = false;

    @CommandLine.Option(names = "--max-turns", description = "Turn limit (default: ${DEFAULT-VALUE}).")
    private int maxTurns = TaskRequest.DEFAULT_MAX_TURNS;

    @CommandLine.Option(
            names = "--max-wall-clock-seconds",
            description = "Wall-clock limit in seconds (default: ${DEFAULT-VALUE}).")
    private long maxWallClockSeconds = TaskRequest.DEFAULT_MAX_WALL_CLOCK.toSeconds();

    @CommandLine.Option(
            names = "--max-thinking-tokens",
            description = "Reasoning token budget per model call (default: ${DEFAULT-VALUE}).")
    private int maxThinkingTokens = 0;

    @CommandLine.Option(names = "--status", description = "Start every configured server, print their status as JSON and exit.")
    private boolean status = false;

    @CommandLine.Option(names = "--list-tools", description = "Print the merged tool catalog as JSON and exit.")
    private boolean listTools = false;

    public static void main(String[] args) {
        logger.info("Starting mcp-agent CLI...");
        int exitCode = new CommandLine(new McpAgentCli()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        var root = (workspace == null ? Path.of(".") : workspace).toAbsolutePath().normalize();
        if (!Files.isDirectory(root)) {
            System.err.println("Workspace is not a directory: " + root);
            return 1;
        }
        var mode = fullPermissions ? PermissionMode.FULL : PermissionMode.RESTRICTED;

        McpConfig config;
        try {
            config = loadConfig(root);
        } catch (McpConfigException e) {
            System.err.println("Invalid MCP configuration: " + e.getMessage());
            return 1;
        }

        try (var servers = new McpServerRegistry(
                McpServerRegistry.defaultTransportFactory(root),
                McpServerRegistry.DEFAULT_HANDSHAKE_TIMEOUT,
                McpServerRegistry.DEFAULT_DISCOVERY_TIMEOUT)) {
            servers.initialize(config);
            var tools = new ToolRegistry(servers);
            tools.register(new FileTools(root));
            tools.register(new ShellTools(root));
            tools.register(new TodoTools());

            if (status) {
                servers.startAll();
                System.out.println(OBJECT_MAPPER.writeValueAsString(servers.exportStatus()));
                return 0;
            }
            if (listTools) {
                System.out.println(OBJECT_MAPPER.writeValueAsString(tools.exportCatalog(mode)));
                for (var shadowed : tools.shadowedTools()) {
                    System.err.printf("Shadowed: %s from server %s%n", shadowed.name(), shadowed.serverName());
                }
                return 0;
            }

            try {
                prompt = maybeLoadFromFile(prompt);
            } catch (IOException e) {
                System.err.println("Error reading prompt file: " + e.getMessage());
                return 1;
            }
            if (prompt == null || prompt.isBlank()) {
                System.err.println("Error: --prompt is required unless --status or --list-tools is given.");
                return 1;
            }

            ModelClient model;
            try {
                model = ModelClients.openAi(modelName);
            } catch (IllegalStateException e) {
                System.err.println("Error: " + e.getMessage());
                return 1;
            }
            var wallClock = Duration.ofSeconds(maxWallClockSeconds);
            tools.register(new SubAgentTool(
                    tools,
                    model,
                    mode,
                    SubAgentTool.DEFAULT_MAX_TURNS,
                    SubAgentTool.DEFAULT_MAX_WALL_CLOCK,
                    ExecutionLoop.Options.DEFAULT));

            var request = new TaskRequest(prompt, null, mode, maxTurns, wallClock, maxThinkingTokens);
            try (var loop = new ExecutionLoop(tools, model);
                    var events = loop.stream(request)) {
                TaskOutcome outcome = null;
                for (var event : events) {
                    outcome = report(event, outcome);
                }
                return outcome == null ? 1 : exitCode(outcome);
            }
        }
    }

    private McpConfig loadConfig(Path root) {
        if (mcprc != null) {
            var config = new McpConfig(McpConfigLoader.loadFile(mcprc));
            config.validate();
            return config;
        }
        return new McpConfigLoader(root).load();
    }

    private static @Nullable TaskOutcome report(TurnEvent event, @Nullable TaskOutcome outcome) {
        if (event instanceof TurnEvent.ModelResponded responded) {
            var text = responded.response().message().text();
            if (text != null && !text.isBlank() && responded.response().message().hasToolExecutionRequests()) {
                System.err.println(text);
            }
        } else if (event instanceof TurnEvent.ToolStarted started) {
            System.err.printf(
                    "[turn %d] %s %s%n",
                    started.turn(),
                    started.invocation().toolName(),
                    started.invocation().arguments());
        } else if (event instanceof TurnEvent.ToolFinished finished) {
            var result = finished.result();
            if (!result.success()) {
                System.err.printf(
                        "[turn %d] %s failed (%s): %s%n",
                        finished.turn(),
                        result.toolName(),
                        result.errorKind(),
                        result.payload());
            }
        } else if (event instanceof TurnEvent.Finished done) {
            var result = done.outcome();
            if (result.finalAnswer() != null) {
                System.out.println(result.finalAnswer());
            }
            System.err.printf("%s: %s%nCost: %s%n", result.reason(), result.explanation(), result.cost().format());
            return result;
        }
        return outcome;
    }

    private static int exitCode(TaskOutcome outcome) {
        if (outcome.reason() == TerminationReason.COMPLETED) {
            return 0;
        }
        return outcome.reason() == TerminationReason.CANCELLED ? 130 : 2;
    }

    private static @Nullable String maybeLoadFromFile(@Nullable String prompt) throws IOException {
        if (prompt == null || prompt.isBlank() || prompt.charAt(0) != '@') {
            return prompt;
        }
        return Files.readString(Path.of(prompt.substring(1)));
    }
}
