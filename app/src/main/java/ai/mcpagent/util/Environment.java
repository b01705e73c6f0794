package ai.mcpagent.util;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jetbrains.annotations.Nullable;

public final class Environment {
    private Environment() {}

    private static final Pattern LEADING_ENV_VAR_PATTERN =
            Pattern.compile("^\\$(?:\\{([a-zA-Z_][a-zA-Z0-9_]*)}|([a-zA-Z_][a-zA-Z0-9_]*))");

    public static boolean isWindows() {
        return System.getProperty("os.name").toLowerCase(Locale.ROOT).contains("win");
    }

    /**
     * Expands a leading environment variable reference in the provided text, if defined; otherwise returns the input
     * unchanged.
     */
    public static @Nullable String expandLeadingEnvVar(@Nullable String text) {
        return expandLeadingEnvVar(text, System.getenv());
    }

    static @Nullable String expandLeadingEnvVar(@Nullable String text, Map<String, String> environment) {
        if (text == null) return null;
        Matcher m = LEADING_ENV_VAR_PATTERN.matcher(text);
        if (!m.find()) return text;
        String varName = m.group(1) != null ? m.group(1) : m.group(2);
        String value = environment.get(varName);
        if (value == null) return text;
        return value + text.substring(m.end());
    }

    /** Returns a copy of the given map with leading env var references expanded in the values, when defined. */
    public static Map<String, String> expandEnvMap(Map<String, String> env) {
        return expandEnvMap(env, System.getenv());
    }

    public static Map<String, String> expandEnvMap(Map<String, String> env, Map<String, String> environment) {
        if (env.isEmpty()) return env;
        var result = new HashMap<String, String>(env.size());
        for (var e : env.entrySet()) {
            String v = e.getValue();
            result.put(e.getKey(), Objects.requireNonNullElse(expandLeadingEnvVar(v, environment), v));
        }
        return result;
    }
}
