package ai.mcpagent.util;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import org.junit.jupiter.api.Test;

class EnvironmentTest {
    private static final Map<String, String> ENV = Map.of("HOME", "/home/me", "TOKEN", "secret");

    @Test
    void expandsLeadingVariableInBothForms() {
        assertEquals("/home/me/bin/server", Environment.expandLeadingEnvVar("$HOME/bin/server", ENV));
        assertEquals("/home/me/bin", Environment.expandLeadingEnvVar("${HOME}/bin", ENV));
    }

    @Test
    void leavesOtherTextUnchanged() {
        assertEquals("$UNSET/x", Environment.expandLeadingEnvVar("$UNSET/x", ENV));
        assertEquals("bin/$HOME", Environment.expandLeadingEnvVar("bin/$HOME", ENV));
        assertNull(Environment.expandLeadingEnvVar(null, ENV));
    }

    @Test
    void expandsMapValues() {
        var expanded = Environment.expandEnvMap(Map.of("API_KEY", "$TOKEN", "PLAIN", "value"), ENV);
        assertEquals(Map.of("API_KEY", "secret", "PLAIN", "value"), expanded);
        assertTrue(Environment.expandEnvMap(Map.of(), ENV).isEmpty());
    }
}
