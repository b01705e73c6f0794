package ai.mcpagent.tools;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

@DisabledOnOs(OS.WINDOWS)
class ShellToolsTest {

    @TempDir
    Path root;

    @Test
    void reportsExitCodeAndCombinedOutput() throws Exception {
        var shell = new ShellTools(root);
        var out = shell.bash("echo out; echo err 1>&2; exit 4", null);
        assertTrue(out.startsWith("Exit code: 4\n"), out);
        assertTrue(out.contains("out"));
        assertTrue(out.contains("err"));
    }

    @Test
    void runsInTheWorkspaceRoot() throws Exception {
        Files.writeString(root.resolve("marker.txt"), "found");
        var out = new ShellTools(root).bash("cat marker.txt", null);
        assertEquals("Exit code: 0\nfound", out);
    }

    @Test
    void commandsTimeOut() throws Exception {
        var shell = new ShellTools(root, Duration.ofMillis(200));
        var out = shell.bash("sleep 5", null);
        assertTrue(out.startsWith("Command timed out after 200 ms"), out);
    }

    @Test
    void hugeOutputKeepsOnlyItsEnds() throws Exception {
        var out = new ShellTools(root).bash("seq 1 500000", null);

        assertTrue(out.startsWith("Exit code: 0\n1\n2\n"), out.substring(0, 40));
        assertTrue(out.endsWith("499999\n500000\n"));
        assertTrue(out.contains("lines truncated"));
        assertTrue(out.length() < ShellTools.MAX_OUTPUT_CHARS + 200, "length " + out.length());
    }

    @Test
    void outputBufferStaysBoundedWhileCopying() {
        var output = new ShellTools.BoundedOutput(1_000);
        var chunk = "0123456789\n".getBytes(StandardCharsets.UTF_8);
        for (int i = 0; i < 10_000; i++) {
            output.write(chunk, chunk.length);
        }

        assertEquals(2_000, output.retainedBytes());
        var text = output.render();
        assertTrue(text.startsWith("0123456789\n"));
        assertTrue(text.endsWith("0123456789\n"));
        assertTrue(text.contains("lines truncated"));
    }

    @Test
    void timeoutAlsoKillsBackgroundJobs() throws Exception {
        var marker = root.resolve("late.txt");
        var shell = new ShellTools(root, Duration.ofMillis(300));

        var out = shell.bash("(sleep 1; touch late.txt) & wait", null);

        assertTrue(out.startsWith("Command timed out after 300 ms"), out);
        Thread.sleep(1_500);
        assertFalse(Files.exists(marker), "background job outlived the timeout");
    }

    @Test
    void rejectsBlankCommandsAndExcessiveTimeouts() {
        var shell = new ShellTools(root);
        assertThrows(IllegalArgumentException.class, () -> shell.bash("  ", null));
        assertThrows(IllegalArgumentException.class, () -> shell.bash("true", 700_000));
    }

    @Test
    void truncatesLongOutputInTheMiddle() {
        var sb = new StringBuilder();
        for (int i = 0; i < 5_000; i++) {
            sb.append("line ").append(i).append('\n');
        }
        var truncated = ShellTools.truncate(sb.toString());
        assertTrue(truncated.length() < sb.length());
        assertTrue(truncated.startsWith("line 0\n"));
        assertTrue(truncated.endsWith("line 4999\n"));
        assertTrue(truncated.contains("lines truncated"));

        assertEquals("short", ShellTools.truncate("short"));
    }
}
