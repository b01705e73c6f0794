package ai.mcpagent.exception;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.concurrent.CancellationException;
import java.util.function.Consumer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

public class GlobalExceptionHandler implements UncaughtExceptionHandler {
    private static final Logger logger = LogManager.getLogger(GlobalExceptionHandler.class);

    @Override
    public void uncaughtException(Thread thread, Throwable throwable) {
        handle(thread, throwable, st -> {});
    }

    /**
     * 1. Log exception
     * 2. Call notifier
     *
     * Note: InterruptedException and CancellationException are suppressed here. Task cancellation raises both
     * routinely on worker threads.
     */
    public static void handle(Thread thread, Throwable th, Consumer<String> notifier) {
        if (isCausedBy(th, InterruptedException.class) || isCausedBy(th, CancellationException.class)) {
            logger.debug("Suppressing cancellation/interrupt on thread %s".formatted(thread.getName()), th);
            return;
        }

        logger.error("Uncaught exception on thread %s".formatted(thread), th);

        notifier.accept("Internal error %s%s"
                .formatted(th.getClass().getName(), th.getMessage() == null ? "" : ": " + th.getMessage()));
    }

    /**
     * @return true if the given Class is part of the throwable cause chain.
     */
    public static boolean isCausedBy(Throwable th, Class<? extends Throwable> cls) {
        if (cls.isInstance(th)) return true;
        else if (th.getCause() == null) return false;
        else return isCausedBy(th.getCause(), cls);
    }
}
