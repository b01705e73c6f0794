package ai.mcpagent.util;

import ai.mcpagent.exception.GlobalExceptionHandler;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

public final class ExecutorServiceUtil {

    private ExecutorServiceUtil() {}

    public static ExecutorService newFixedThreadExecutor(int parallelism, String threadPrefix) {
        assert parallelism >= 1 : "parallelism must be >= 1";
        return Executors.newFixedThreadPool(parallelism, createNamedThreadFactory(threadPrefix));
    }

    /** Unbounded pool of daemon threads. Callers that need a concurrency cap enforce it themselves. */
    public static ExecutorService newCachedDaemonExecutor(String threadPrefix) {
        return Executors.newCachedThreadPool(createNamedThreadFactory(threadPrefix));
    }

    public static ThreadFactory createNamedThreadFactory(String prefix) {
        var counter = new AtomicInteger(0);
        return r -> {
            var thread = new Thread(r);
            thread.setName(prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            thread.setUncaughtExceptionHandler((thr, ex) -> GlobalExceptionHandler.handle(thr, ex, s -> {}));
            return thread;
        };
    }

    /** Starts a single named daemon thread, used for transport readers and stderr drains. */
    public static Thread startDaemon(String name, Runnable body) {
        var thread = new Thread(body, name);
        thread.setDaemon(true);
        thread.setUncaughtExceptionHandler((thr, ex) -> GlobalExceptionHandler.handle(thr, ex, s -> {}));
        thread.start();
        return thread;
    }
}
