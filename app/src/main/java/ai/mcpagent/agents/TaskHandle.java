package ai.mcpagent.agents;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.jetbrains.annotations.Blocking;
import org.jetbrains.annotations.Nullable;

/** A task submitted to an {@link ExecutionLoop}. */
public class TaskHandle {
    private final TaskRequest request;
    private final CompletableFuture<TaskOutcome> outcome = new CompletableFuture<>();

    // guarded by this
    private @Nullable Thread runner;
    private boolean cancelRequested;

    TaskHandle(TaskRequest request) {
        this.request = request;
    }

    public TaskRequest request() {
        return request;
    }

    /**
     * Interrupts the task. In-flight tool calls are cancelled and recorded as CANCELLED results, and the outcome
     * becomes {@link TerminationReason#CANCELLED}. Has no effect once the task has finished.
     */
    public synchronized void cancel() {
        if (outcome.isDone()) {
            return;
        }
        cancelRequested = true;
        if (runner != null) {
            runner.interrupt();
        }
    }

    public synchronized boolean isCancelRequested() {
        return cancelRequested;
    }

    public boolean isDone() {
        return outcome.isDone();
    }

    /** Blocks until the task finishes. */
    @Blocking
    public TaskOutcome outcome() throws InterruptedException {
        try {
            return outcome.get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Task failed unexpectedly", e.getCause());
        }
    }

    @Blocking
    public TaskOutcome outcome(Duration timeout) throws InterruptedException, TimeoutException {
        try {
            return outcome.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Task failed unexpectedly", e.getCause());
        }
    }

    /** Runs the task body on the calling thread, which becomes the target of {@link #cancel()}. */
    void run(Supplier<TaskOutcome> body) {
        synchronized (this) {
            runner = Thread.currentThread();
            if (cancelRequested) {
                runner.interrupt();
            }
        }
        try {
            outcome.complete(body.get());
        } catch (RuntimeException | Error e) {
            outcome.completeExceptionally(e);
            throw e;
        } finally {
            synchronized (this) {
                runner = null;
            }
            // pool threads must not carry a stale interrupt into the next task
            Thread.interrupted();
        }
    }
}
