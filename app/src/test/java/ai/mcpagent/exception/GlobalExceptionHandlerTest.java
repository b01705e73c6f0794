package ai.mcpagent.exception;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.concurrent.CancellationException;
import org.junit.jupiter.api.Test;

class GlobalExceptionHandlerTest {

    @Test
    void notifiesAboutUnexpectedErrors() {
        var notes = new ArrayList<String>();
        GlobalExceptionHandler.handle(Thread.currentThread(), new IllegalStateException("broken"), notes::add);
        assertEquals(1, notes.size());
        assertEquals("Internal error java.lang.IllegalStateException: broken", notes.get(0));
    }

    @Test
    void suppressesCancellation() {
        var notes = new ArrayList<String>();
        GlobalExceptionHandler.handle(
                Thread.currentThread(), new RuntimeException(new InterruptedException()), notes::add);
        GlobalExceptionHandler.handle(Thread.currentThread(), new CancellationException(), notes::add);
        assertTrue(notes.isEmpty());
    }

    @Test
    void findsCausesDeepInTheChain() {
        var error = new RuntimeException(new IllegalStateException(new McpConfigException("bad")));
        assertTrue(GlobalExceptionHandler.isCausedBy(error, McpConfigException.class));
        assertFalse(GlobalExceptionHandler.isCausedBy(error, InterruptedException.class));
    }
}
