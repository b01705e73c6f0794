package ai.mcpagent.agents;

import ai.mcpagent.agents.TurnEvent.Finished;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import org.jetbrains.annotations.Nullable;

/**
 * The events of one task as a blocking sequence. The task is submitted when the sequence is first pulled, the
 * sequence ends after {@link Finished}, and it can be iterated only once. Closing the stream cancels the task.
 */
public final class TurnEventStream implements Iterable<TurnEvent>, AutoCloseable {
    private final ExecutionLoop loop;
    private final TaskRequest request;
    private final BlockingQueue<TurnEvent> events = new LinkedBlockingQueue<>();
    private final AtomicBoolean iterated = new AtomicBoolean();
    private volatile @Nullable TaskHandle handle;

    TurnEventStream(ExecutionLoop loop, TaskRequest request) {
        this.loop = loop;
        this.request = request;
    }

    /** The running task, once the stream has been pulled. */
    public Optional<TaskHandle> handle() {
        return Optional.ofNullable(handle);
    }

    @Override
    public Iterator<TurnEvent> iterator() {
        if (!iterated.compareAndSet(false, true)) {
            throw new IllegalStateException("TurnEventStream can only be iterated once");
        }
        return new Iterator<>() {
            private @Nullable TurnEvent next;
            private boolean finished;

            @Override
            public boolean hasNext() {
                if (finished) {
                    return false;
                }
                if (next != null) {
                    return true;
                }
                var running = start();
                try {
                    next = events.take();
                } catch (InterruptedException e) {
                    running.cancel();
                    Thread.currentThread().interrupt();
                    throw new CancellationException("Interrupted while waiting for the next turn event");
                }
                return true;
            }

            @Override
            public TurnEvent next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                var event = next;
                next = null;
                if (event instanceof Finished) {
                    finished = true;
                }
                return event;
            }
        };
    }

    private synchronized TaskHandle start() {
        var running = handle;
        if (running == null) {
            running = loop.submit(request, events::add);
            handle = running;
        }
        return running;
    }

    @Override
    public void close() {
        var running = handle;
        if (running != null) {
            running.cancel();
        }
    }
}
