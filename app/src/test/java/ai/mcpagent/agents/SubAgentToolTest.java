package ai.mcpagent.agents;

import static ai.mcpagent.testutil.ScriptedModelClient.call;
import static org.junit.jupiter.api.Assertions.*;

import ai.mcpagent.exception.ErrorKind;
import ai.mcpagent.testutil.ScriptedModelClient;
import ai.mcpagent.testutil.TestTools;
import ai.mcpagent.tools.PermissionMode;
import ai.mcpagent.tools.ToolRegistry;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.SystemMessage;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

@Timeout(15)
class SubAgentToolTest {

    private ToolRegistry registry;
    private ScriptedModelClient model;

    @BeforeEach
    void setup() {
        registry = ToolRegistry.empty();
        registry.register(new TestTools());
        model = new ScriptedModelClient();
    }

    private static List<String> toolNames(List<ToolSpecification> specs) {
        return specs.stream().map(ToolSpecification::name).toList();
    }

    @Test
    void subAgentRunsWithoutTheTaskToolAndReportsItsCost() throws Exception {
        registry.register(new SubAgentTool(registry, model));
        model.thenCall(call("Task", "{\"description\": \"shout\", \"prompt\": \"upper-case abc\"}"))
                // the nested agent's turns
                .thenCall(call("upper", "{\"text\": \"abc\"}"))
                .thenAnswer("ABC it is")
                // back in the parent
                .thenAnswer("parent done");

        try (var loop = new ExecutionLoop(registry, model)) {
            var outcome = loop.run(TaskRequest.of("delegate"));

            assertTrue(outcome.completed());
            assertEquals("parent done", outcome.finalAnswer());
            var report = outcome.transcript().get(0).results().get(0);
            assertTrue(report.success(), report.payload());
            assertTrue(report.payload().startsWith("ABC it is\n\n[sub-agent cost: $"), report.payload());
            // the parent is charged only for its own calls
            assertEquals(2, outcome.cost().modelCalls());
        }

        var requests = model.requests();
        assertTrue(toolNames(requests.get(0).tools()).contains("Task"));
        var nested = requests.get(1);
        assertFalse(toolNames(nested.tools()).contains("Task"));
        assertTrue(toolNames(nested.tools()).contains("upper"));
        var system = assertInstanceOf(SystemMessage.class, nested.messages().get(0));
        assertEquals(SubAgentTool.SYSTEM_PROMPT, system.text());
    }

    @Test
    void subAgentThatStopsEarlyFailsTheToolCall() {
        registry.register(new SubAgentTool(
                registry,
                model,
                PermissionMode.RESTRICTED,
                1,
                Duration.ofSeconds(10),
                ExecutionLoop.Options.DEFAULT));
        model.thenCall(call("Task", "{\"description\": \"loop\", \"prompt\": \"never finish\"}"))
                .thenCall(call("upper", "{\"text\": \"x\"}"))
                .thenAnswer("parent saw the failure");

        try (var loop = new ExecutionLoop(registry, model)) {
            var outcome = loop.run(TaskRequest.of("delegate"));

            assertTrue(outcome.completed());
            var result = outcome.transcript().get(0).results().get(0);
            assertEquals(ErrorKind.TOOL_EXECUTION, result.errorKind());
            assertTrue(result.payload().contains("stopped early (MAX_TURNS)"), result.payload());
        }
    }

    @Test
    void subAgentUsesItsOwnPermissionMode() throws Exception {
        var tool = new SubAgentTool(
                registry, model, PermissionMode.FULL, 5, Duration.ofSeconds(10), ExecutionLoop.Options.DEFAULT);
        model.thenCall(call("erase", "{\"target\": \"tmp\"}")).thenAnswer("erased");

        var report = tool.task("cleanup", "erase tmp");

        assertTrue(report.startsWith("erased\n\n"));
        assertTrue(toolNames(model.requests().get(0).tools()).contains("erase"));
    }
}
