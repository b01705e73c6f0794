package ai.mcpagent.testutil;

import ai.mcpagent.exception.LlmException;
import ai.mcpagent.llm.ModelClient;
import ai.mcpagent.llm.ModelRequest;
import ai.mcpagent.llm.ModelTurn;
import ai.mcpagent.llm.RichTokenUsage;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.data.message.AiMessage;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/** A model that replays a fixed script of replies and records the requests it saw. */
public class ScriptedModelClient implements ModelClient {

    @FunctionalInterface
    public interface Step {
        AiMessage reply(ModelRequest request) throws InterruptedException;
    }

    public static final RichTokenUsage USAGE = new RichTokenUsage(100, 20, 0, 10);

    private final String modelName;
    private final Deque<Step> script = new ArrayDeque<>();
    private final List<ModelRequest> requests = new CopyOnWriteArrayList<>();
    private final AtomicInteger callIds = new AtomicInteger();

    public ScriptedModelClient() {
        this("scripted-model");
    }

    public ScriptedModelClient(String modelName) {
        this.modelName = modelName;
    }

    public synchronized ScriptedModelClient then(Step step) {
        script.add(step);
        return this;
    }

    public ScriptedModelClient thenAnswer(String text) {
        return then(request -> AiMessage.from(text));
    }

    /** A turn requesting the given tools, with ids call-1, call-2, ... in order. */
    public ScriptedModelClient thenCall(ToolCall... calls) {
        return then(request -> AiMessage.from(Arrays.stream(calls)
                .map(c -> ToolExecutionRequest.builder()
                        .id("call-" + callIds.incrementAndGet())
                        .name(c.name())
                        .arguments(c.arguments())
                        .build())
                .toList()));
    }

    public ScriptedModelClient thenFail(LlmException error) {
        return then(request -> {
            throw error;
        });
    }

    /** A reply that never comes; the call only ends by interruption. */
    public ScriptedModelClient thenHang() {
        return then(request -> {
            Thread.sleep(Long.MAX_VALUE);
            throw new AssertionError("unreachable");
        });
    }

    public record ToolCall(String name, String arguments) {}

    public static ToolCall call(String name, String arguments) {
        return new ToolCall(name, arguments);
    }

    @Override
    public ModelTurn call(ModelRequest request) throws InterruptedException {
        requests.add(request);
        Step step;
        synchronized (this) {
            step = script.poll();
        }
        var reply = step == null ? AiMessage.from("done") : step.reply(request);
        return new ModelTurn(reply, USAGE, 1, modelName);
    }

    @Override
    public String modelName() {
        return modelName;
    }

    public List<ModelRequest> requests() {
        return List.copyOf(requests);
    }

    public int callCount() {
        return requests.size();
    }
}
