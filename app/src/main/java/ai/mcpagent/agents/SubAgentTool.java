package ai.mcpagent.agents;

import ai.mcpagent.llm.ModelClient;
import ai.mcpagent.tools.PermissionMode;
import ai.mcpagent.tools.ToolRegistry;
import dev.langchain4j.agent.tool.P;
import dev.langchain4j.agent.tool.Tool;
import java.time.Duration;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Provides the {@code Task} tool, which hands a self-contained piece of work to a nested agent. The nested agent sees
 * the parent registry without {@code Task} itself, so sub-agents cannot spawn further sub-agents, and it is charged
 * to its own cost ledger.
 */
public class SubAgentTool {
    private static final Logger logger = LogManager.getLogger(SubAgentTool.class);

    public static final String TOOL_NAME = "Task";
    public static final int DEFAULT_MAX_TURNS = 15;
    public static final Duration DEFAULT_MAX_WALL_CLOCK = Duration.ofMinutes(5);

    static final String SYSTEM_PROMPT =
            """
            You are a sub-agent working on one well-defined task for another agent.
            Use the tools available to you to complete it, then reply with a concise, self-contained report.
            Your final message is returned verbatim to the agent that launched you.
            """;

    private final ToolRegistry parent;
    private final ModelClient model;
    private final PermissionMode mode;
    private final int maxTurns;
    private final Duration maxWallClock;
    private final ExecutionLoop.Options options;

    public SubAgentTool(ToolRegistry parent, ModelClient model) {
        this(parent, model, PermissionMode.RESTRICTED, DEFAULT_MAX_TURNS, DEFAULT_MAX_WALL_CLOCK, ExecutionLoop.Options.DEFAULT);
    }

    public SubAgentTool(
            ToolRegistry parent,
            ModelClient model,
            PermissionMode mode,
            int maxTurns,
            Duration maxWallClock,
            ExecutionLoop.Options options) {
        this.parent = parent;
        this.model = model;
        this.mode = mode;
        this.maxTurns = maxTurns;
        this.maxWallClock = maxWallClock;
        this.options = options;
    }

    @Tool(
            name = TOOL_NAME,
            value =
                    """
    Launches a sub-agent to carry out a self-contained task, such as an open-ended search across many files.
    The sub-agent has the same tools as you (except this one) and reports back once. Give it a complete,
    detailed prompt: it cannot see your conversation. Launch several at once to work in parallel.
    """)
    public String task(
            @P("A short (3-5 word) description of the task") String description,
            @P("The task for the sub-agent to perform") String prompt)
            throws InterruptedException {
        var registry = ToolRegistry.fromBase(parent).exclude(TOOL_NAME).build();
        var request = new TaskRequest(prompt, SYSTEM_PROMPT, mode, maxTurns, maxWallClock, 0);

        logger.info("Sub-agent started: {}", description);
        TaskOutcome outcome;
        try (var loop = new ExecutionLoop(registry, model, options)) {
            outcome = loop.run(request);
        }
        if (outcome.reason() == TerminationReason.CANCELLED && Thread.interrupted()) {
            throw new InterruptedException("Sub-agent '" + description + "' cancelled");
        }
        logger.info("Sub-agent '{}' finished: {}", description, outcome.reason());

        if (!outcome.completed()) {
            throw new IllegalStateException(
                    "Sub-agent '%s' stopped early (%s): %s".formatted(description, outcome.reason(), outcome.explanation()));
        }
        var answer = outcome.finalAnswer() == null ? "(no answer)" : outcome.finalAnswer();
        return "%s\n\n[sub-agent cost: %s]".formatted(answer, outcome.cost().format());
    }
}
