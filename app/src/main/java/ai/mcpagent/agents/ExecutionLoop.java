package ai.mcpagent.agents;

import ai.mcpagent.agents.TurnEvent.Finished;
import ai.mcpagent.agents.TurnEvent.ModelResponded;
import ai.mcpagent.agents.TurnEvent.ToolFinished;
import ai.mcpagent.agents.TurnEvent.ToolStarted;
import ai.mcpagent.exception.ErrorKind;
import ai.mcpagent.exception.LlmException;
import ai.mcpagent.llm.CostLedger;
import ai.mcpagent.llm.ModelClient;
import ai.mcpagent.llm.ModelRequest;
import ai.mcpagent.llm.ModelTurn;
import ai.mcpagent.tools.ToolExecutionResult;
import ai.mcpagent.tools.ToolInvocation;
import ai.mcpagent.tools.ToolRegistry;
import ai.mcpagent.util.ExecutorServiceUtil;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Blocking;
import org.jetbrains.annotations.Nullable;

/**
 * Runs agent tasks: the model is called with the transcript and the visible tool catalog, the tools it requests are
 * dispatched, their results are appended, and the cycle repeats until the model answers without tool calls or a limit
 * is reached.
 *
 * <p>The tool calls of one turn run concurrently, at most {@link Options#maxInFlight()} at a time per task. Their
 * results enter the transcript in the order the model requested them, whatever order they complete in. Every call
 * gets a deadline of the default tool timeout or the remaining wall-clock budget, whichever is sooner.
 *
 * <p>Tasks are independent: cancelling one interrupts only its own model call and dispatches, even when other tasks
 * use the same MCP connections.
 */
public class ExecutionLoop implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(ExecutionLoop.class);

    /** Slack allowed past a call's deadline before the loop gives up on it, covering the transport's own timeout. */
    static final long TIMEOUT_GRACE_MS = 250;

    public record Options(int maxInFlight, Duration toolTimeout) {
        public static final int DEFAULT_MAX_IN_FLIGHT = 5;
        public static final Duration DEFAULT_TOOL_TIMEOUT = Duration.ofSeconds(60);
        public static final Options DEFAULT = new Options(DEFAULT_MAX_IN_FLIGHT, DEFAULT_TOOL_TIMEOUT);

        public Options {
            if (maxInFlight < 1) {
                throw new IllegalArgumentException("maxInFlight must be >= 1");
            }
            if (toolTimeout.isNegative() || toolTimeout.isZero()) {
                throw new IllegalArgumentException("toolTimeout must be positive");
            }
        }
    }

    private final ToolRegistry tools;
    private final ModelClient model;
    private final Options options;
    private final ExecutorService taskExecutor;
    private final ExecutorService dispatchExecutor;
    private final ExecutorService modelExecutor;

    public ExecutionLoop(ToolRegistry tools, ModelClient model) {
        this(tools, model, Options.DEFAULT);
    }

    public ExecutionLoop(ToolRegistry tools, ModelClient model, Options options) {
        this.tools = tools;
        this.model = model;
        this.options = options;
        this.taskExecutor = ExecutorServiceUtil.newCachedDaemonExecutor("agent-task");
        this.dispatchExecutor = ExecutorServiceUtil.newCachedDaemonExecutor("tool-dispatch");
        this.modelExecutor = ExecutorServiceUtil.newCachedDaemonExecutor("model-call");
    }

    /** Starts the task on a background thread. */
    public TaskHandle submit(TaskRequest request) {
        return submit(request, event -> {});
    }

    /**
     * Starts the task on a background thread. {@code listener} receives every {@link TurnEvent}; it may be called from
     * dispatch threads and must be thread-safe.
     */
    public TaskHandle submit(TaskRequest request, Consumer<TurnEvent> listener) {
        var handle = new TaskHandle(request);
        taskExecutor.execute(() -> handle.run(() -> run(request, listener)));
        return handle;
    }

    /** A lazily started, single-use sequence of the task's events. */
    public TurnEventStream stream(TaskRequest request) {
        return new TurnEventStream(this, request);
    }

    /** Runs the task on the calling thread. */
    @Blocking
    public TaskOutcome run(TaskRequest request) {
        return run(request, event -> {});
    }

    /**
     * Runs the task on the calling thread. Interrupting the thread cancels the task; the outcome is then
     * {@link TerminationReason#CANCELLED} and the thread's interrupt flag is left set.
     */
    @Blocking
    public TaskOutcome run(TaskRequest request, Consumer<TurnEvent> listener) {
        var task = new RunningTask(request, listener);
        TaskOutcome outcome;
        try {
            outcome = task.loop();
        } catch (InterruptedException e) {
            outcome = task.finish(TerminationReason.CANCELLED, "Task was cancelled");
            Thread.currentThread().interrupt();
        }
        task.emit(new Finished(outcome));
        return outcome;
    }

    @Override
    public void close() {
        taskExecutor.shutdownNow();
        dispatchExecutor.shutdownNow();
        modelExecutor.shutdownNow();
    }

    private record PendingDispatch(ToolInvocation invocation, Future<ToolExecutionResult> future, long startNanos) {}

    private record TurnResults(List<ToolExecutionResult> results, boolean interrupted) {}

    /** State of one task; confined to the task's thread apart from the listener. */
    private class RunningTask {
        private final TaskRequest request;
        private final Consumer<TurnEvent> listener;
        private final CostLedger ledger = new CostLedger();
        private final Instant deadline;
        private final List<ChatMessage> messages = new ArrayList<>();
        private final List<ExecutionTurn> turns = new ArrayList<>();
        private @Nullable String lastText;

        RunningTask(TaskRequest request, Consumer<TurnEvent> listener) {
            this.request = request;
            this.listener = listener;
            this.deadline = Instant.now().plus(request.maxWallClock());
        }

        TaskOutcome loop() throws InterruptedException {
            logger.info("Starting task in {} mode: {}", request.mode(), abbreviate(request.prompt()));
            if (request.systemPrompt() != null && !request.systemPrompt().isBlank()) {
                messages.add(SystemMessage.from(request.systemPrompt()));
            }
            messages.add(UserMessage.from(request.prompt()));

            for (int turn = 1; ; turn++) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new InterruptedException();
                }
                if (turn > request.maxTurns()) {
                    return finish(
                            TerminationReason.MAX_TURNS,
                            "Stopped after %d turns without a final answer".formatted(request.maxTurns()));
                }
                var remaining = remaining();
                if (remaining.isZero()) {
                    return finish(TerminationReason.WALL_CLOCK, wallClockExplanation());
                }

                var specs = tools.toolSpecifications(request.mode());
                ModelTurn response;
                try {
                    response = callModel(new ModelRequest(messages, specs, request.maxThinkingTokens()), remaining);
                } catch (TimeoutException e) {
                    return finish(TerminationReason.WALL_CLOCK, wallClockExplanation());
                } catch (LlmException e) {
                    logger.warn("Model call failed on turn {}", turn, e);
                    var cause = e.getCause() == null ? "" : ": " + e.getCause().getMessage();
                    return finish(TerminationReason.MODEL_FAILURE, e.getMessage() + cause);
                }
                ledger.record(response);
                emit(new ModelResponded(turn, response));

                var ai = ToolRegistry.removeDuplicateToolRequests(response.message());
                messages.add(ai);
                if (ai.text() != null && !ai.text().isBlank()) {
                    lastText = ai.text();
                }
                if (!ai.hasToolExecutionRequests()) {
                    turns.add(new ExecutionTurn(turn, ai, List.of()));
                    return finish(
                            TerminationReason.COMPLETED, "Model answered after %d turn(s)".formatted(turn));
                }

                logger.debug("Turn {}: dispatching {} tool call(s)", turn, ai.toolExecutionRequests().size());
                var dispatched = dispatchAll(turn, ai.toolExecutionRequests());
                turns.add(new ExecutionTurn(turn, ai, dispatched.results()));
                dispatched.results().forEach(r -> messages.add(r.toExecutionResultMessage()));
                if (dispatched.interrupted()) {
                    throw new InterruptedException();
                }
            }
        }

        private ModelTurn callModel(ModelRequest modelRequest, Duration remaining)
                throws InterruptedException, TimeoutException {
            var future = modelExecutor.submit(() -> model.call(modelRequest));
            try {
                return future.get(remaining.toMillis(), TimeUnit.MILLISECONDS);
            } catch (ExecutionException e) {
                var cause = e.getCause();
                if (cause instanceof LlmException le) {
                    throw le;
                }
                throw new LlmException("calling " + model.modelName(), cause, false);
            } catch (TimeoutException | InterruptedException e) {
                future.cancel(true);
                throw e;
            }
        }

        private TurnResults dispatchAll(int turn, List<ToolExecutionRequest> requests) {
            var slots = new Semaphore(options.maxInFlight());
            var callDeadline = earliest(Instant.now().plus(options.toolTimeout()), deadline);
            var pending = new ArrayList<PendingDispatch>(requests.size());
            for (var toolRequest : requests) {
                var invocation = ToolInvocation.from(toolRequest, callDeadline);
                long startNanos = System.nanoTime();
                var future = dispatchExecutor.submit(() -> {
                    slots.acquire();
                    try {
                        emit(new ToolStarted(turn, invocation));
                        return tools.execute(invocation, request.mode());
                    } finally {
                        slots.release();
                    }
                });
                pending.add(new PendingDispatch(invocation, future, startNanos));
            }

            // Collect in request order
            var results = new ArrayList<ToolExecutionResult>(pending.size());
            boolean interrupted = false;
            for (var p : pending) {
                ToolExecutionResult result;
                if (interrupted) {
                    result = collectAfterCancel(p);
                } else {
                    try {
                        result = await(p);
                    } catch (InterruptedException e) {
                        logger.debug("Task interrupted while waiting for tool '{}'", p.invocation().toolName());
                        interrupted = true;
                        pending.forEach(q -> q.future().cancel(true));
                        result = collectAfterCancel(p);
                    }
                }
                results.add(result);
                emit(new ToolFinished(turn, result));
            }
            return new TurnResults(results, interrupted);
        }

        private ToolExecutionResult await(PendingDispatch p) throws InterruptedException {
            var invocation = p.invocation();
            long waitMs = Math.max(0, Duration.between(Instant.now(), invocation.deadline()).toMillis())
                    + TIMEOUT_GRACE_MS;
            try {
                return p.future().get(waitMs, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                p.future().cancel(true);
                logger.debug("Tool '{}' missed its deadline", invocation.toolName());
                return ToolExecutionResult.failure(
                        invocation,
                        ErrorKind.TIMEOUT,
                        "Tool '%s' did not finish before its deadline".formatted(invocation.toolName()),
                        elapsedMillis(p));
            } catch (CancellationException e) {
                return ToolExecutionResult.cancelled(invocation, elapsedMillis(p));
            } catch (ExecutionException e) {
                return failedDispatch(p, e.getCause());
            }
        }

        private ToolExecutionResult collectAfterCancel(PendingDispatch p) {
            if (!p.future().isDone() || p.future().isCancelled()) {
                return ToolExecutionResult.cancelled(p.invocation(), elapsedMillis(p));
            }
            try {
                // already complete, so this does not block
                return p.future().get();
            } catch (ExecutionException e) {
                return failedDispatch(p, e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return ToolExecutionResult.cancelled(p.invocation(), elapsedMillis(p));
            }
        }

        private ToolExecutionResult failedDispatch(PendingDispatch p, Throwable cause) {
            if (cause instanceof InterruptedException) {
                return ToolExecutionResult.cancelled(p.invocation(), elapsedMillis(p));
            }
            logger.warn("Dispatch of tool '{}' failed", p.invocation().toolName(), cause);
            var message = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
            return ToolExecutionResult.failure(p.invocation(), ErrorKind.TOOL_EXECUTION, message, elapsedMillis(p));
        }

        TaskOutcome finish(TerminationReason reason, String explanation) {
            var cost = ledger.snapshot();
            logger.info("Task finished: {} ({}); cost {}", reason, explanation, cost.format());
            return new TaskOutcome(reason, lastText, turns, cost, explanation);
        }

        void emit(TurnEvent event) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                logger.warn("Turn event listener failed on {}", event.getClass().getSimpleName(), e);
            }
        }

        private Duration remaining() {
            var left = Duration.between(Instant.now(), deadline);
            return left.isNegative() ? Duration.ZERO : left;
        }

        private String wallClockExplanation() {
            return "Wall-clock limit of %d s exceeded".formatted(request.maxWallClock().toSeconds());
        }
    }

    private static long elapsedMillis(PendingDispatch p) {
        return (System.nanoTime() - p.startNanos()) / 1_000_000;
    }

    private static Instant earliest(Instant a, Instant b) {
        return a.isBefore(b) ? a : b;
    }

    private static String abbreviate(String text) {
        var firstLine = text.lines().findFirst().orElse("");
        return firstLine.length() > 80 ? firstLine.substring(0, 77) + "..." : firstLine;
    }
}
