package ai.mcpagent.tools;

import ai.mcpagent.exception.ErrorKind;
import ai.mcpagent.exception.McpException;
import ai.mcpagent.mcp.McpServerRegistry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import dev.langchain4j.agent.tool.P;
import dev.langchain4j.agent.tool.Tool;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.agent.tool.ToolSpecifications;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Parameter;
import java.lang.reflect.ParameterizedType;
import java.util.*;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Blocking;
import org.jetbrains.annotations.Nullable;

/**
 * Merges in-process tools with the tools discovered on MCP servers into one catalog, and dispatches calls to either.
 * In-process tools are methods annotated with @Tool on registered object instances.
 *
 * <p>Names are unique across the merged catalog. An in-process tool wins over a discovered tool of the same name; the
 * hidden entry is reported by {@link #shadowedTools()}.
 *
 * <p>Dispatch validates before it routes: an unknown name, or arguments that do not match the schema, fail without any
 * traffic to a server.
 *
 * Builder pattern:
 * - Create per-task registries via ToolRegistry.fromBase(base).register(...).exclude(...).build()
 */
public class ToolRegistry {
    private static final Logger logger = LogManager.getLogger(ToolRegistry.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    // Synchronized LinkedHashMap keeps registration order for the catalog while remaining thread-safe.
    private final Map<String, ToolInvocationTarget> toolMap;
    private final @Nullable McpServerRegistry servers;
    private final Set<String> excluded;

    private record ToolInvocationTarget(Method method, Object instance, ToolDescriptor descriptor) {}

    /** Where a resolved tool name is executed. */
    public sealed interface DispatchTarget permits Native, Remote {
        ToolDescriptor descriptor();
    }

    public record Native(Method method, Object instance, ToolDescriptor descriptor) implements DispatchTarget {}

    public record Remote(String serverName, ToolDescriptor descriptor) implements DispatchTarget {}

    public record ValidatedInvocation(DispatchTarget target, JsonNode arguments) {}

    /** Dispatch rejected before execution; {@link #kind()} is UNKNOWN_TOOL or SCHEMA_VALIDATION. */
    public static class ToolValidationException extends RuntimeException {
        private final ErrorKind kind;

        public ToolValidationException(ErrorKind kind, String message) {
            super(message);
            this.kind = kind;
        }

        public ErrorKind kind() {
            return kind;
        }
    }

    /** Creates a root registry without MCP servers and self-registers internal tools. */
    public ToolRegistry() {
        this((McpServerRegistry) null);
    }

    /** Creates a root registry backed by the given servers and self-registers internal tools. */
    public ToolRegistry(@Nullable McpServerRegistry servers) {
        this(new LinkedHashMap<>(), servers, Set.of());
        // Root-only registration of builtin tools (like 'think') happens only for the root registry.
        register(this);
    }

    private ToolRegistry(
            Map<String, ToolInvocationTarget> initialMap, @Nullable McpServerRegistry servers, Set<String> excluded) {
        this.toolMap = Collections.synchronizedMap(new LinkedHashMap<>(initialMap));
        this.servers = servers;
        this.excluded = Set.copyOf(excluded);
    }

    /** Returns an empty registry with no builtin tools and no servers (primarily for tests). */
    public static ToolRegistry empty() {
        return new ToolRegistry(Map.of(), null, Set.of());
    }

    /** Builder for creating a derived registry based on a base registry. */
    public static Builder fromBase(ToolRegistry base) {
        return new Builder(base);
    }

    public static final class Builder {
        private final Map<String, ToolInvocationTarget> entries;
        private final Set<String> excluded;
        private final @Nullable McpServerRegistry servers;

        private Builder(ToolRegistry base) {
            synchronized (base.toolMap) {
                this.entries = new LinkedHashMap<>(base.toolMap);
            }
            this.excluded = new HashSet<>(base.excluded);
            this.servers = base.servers;
        }

        /** Register @Tool methods from the given instance; last registration wins on name conflicts. */
        public Builder register(Object toolProviderInstance) {
            for (var target : scan(toolProviderInstance)) {
                var toolName = target.descriptor().name();
                var existing = entries.get(toolName);
                if (existing != null) {
                    logger.debug(
                            "Overriding tool {} provided by {} with {}",
                            toolName,
                            existing.instance().getClass().getName(),
                            toolProviderInstance.getClass().getName());
                }
                entries.put(toolName, target);
            }
            return this;
        }

        /** Hide tools by name, whether in-process or discovered. */
        public Builder exclude(String... toolNames) {
            excluded.addAll(Arrays.asList(toolNames));
            return this;
        }

        public ToolRegistry build() {
            return new ToolRegistry(entries, servers, excluded);
        }
    }

    /** Register @Tool methods from the given instance. */
    public void register(Object toolProviderInstance) {
        for (var target : scan(toolProviderInstance)) {
            var toolName = target.descriptor().name();
            synchronized (toolMap) {
                var existing = toolMap.get(toolName);
                if (existing != null) {
                    var existingClass = existing.instance().getClass().getName();
                    var providerClass = toolProviderInstance.getClass().getName();
                    logger.debug("Overriding tool {} provided by {} with {}", toolName, existingClass, providerClass);
                } else {
                    logger.trace(
                            "Registering tool: '{}' from class {}",
                            toolName,
                            toolProviderInstance.getClass().getName());
                }
                toolMap.put(toolName, target);
            }
        }
    }

    private static List<ToolInvocationTarget> scan(Object toolProviderInstance) {
        var result = new ArrayList<ToolInvocationTarget>();
        for (Method method : toolProviderInstance.getClass().getMethods()) {
            if (!method.isAnnotationPresent(Tool.class)) continue;
            result.add(new ToolInvocationTarget(method, toolProviderInstance, describe(method)));
        }
        return result;
    }

    private static ToolDescriptor describe(Method method) {
        ToolSpecification spec = ToolSpecifications.toolSpecificationFrom(method);
        var parameters = spec.parameters() != null
                ? spec.parameters()
                : JsonObjectSchema.builder().build();
        return new ToolDescriptor(
                spec.name(),
                Objects.requireNonNullElse(spec.description(), ""),
                parameters,
                null,
                null,
                method.isAnnotationPresent(SideEffecting.class));
    }

    // ---- catalog ----

    /**
     * The merged catalog visible in {@code mode}: in-process tools in registration order, then discovered tools in
     * server configuration order. Servers that have not been started yet are started first.
     */
    @Blocking
    public List<ToolDescriptor> catalog(PermissionMode mode) throws InterruptedException {
        if (servers != null) {
            servers.startAll();
        }
        return currentCatalog().stream().filter(mode::allows).toList();
    }

    private List<ToolDescriptor> currentCatalog() {
        var result = new ArrayList<ToolDescriptor>();
        synchronized (toolMap) {
            for (var target : toolMap.values()) {
                if (!excluded.contains(target.descriptor().name())) {
                    result.add(target.descriptor());
                }
            }
        }
        if (servers != null) {
            for (var remote : servers.catalog()) {
                if (!excluded.contains(remote.name()) && !toolMap.containsKey(remote.name())) {
                    result.add(remote);
                }
            }
        }
        return result;
    }

    /**
     * Discovered tools hidden by a same-named tool: either an in-process one, or one from a server configured
     * earlier.
     */
    public List<ToolDescriptor> shadowedTools() {
        if (servers == null) {
            return List.of();
        }
        var result = new ArrayList<ToolDescriptor>();
        for (var remote : servers.catalog()) {
            if (toolMap.containsKey(remote.name())) {
                result.add(remote);
            }
        }
        result.addAll(servers.shadowedTools());
        return result;
    }

    /** Specifications to offer the model for the given mode. */
    @Blocking
    public List<ToolSpecification> toolSpecifications(PermissionMode mode) throws InterruptedException {
        return catalog(mode).stream().map(ToolDescriptor::toToolSpecification).collect(Collectors.toList());
    }

    /** Ordered {@code [{name, description, inputSchema}]}. */
    @Blocking
    public ArrayNode exportCatalog(PermissionMode mode) throws InterruptedException {
        var array = OBJECT_MAPPER.createArrayNode();
        for (var tool : catalog(mode)) {
            var node = array.addObject();
            node.put("name", tool.name());
            node.put("description", tool.description());
            node.set("inputSchema", JsonSchemas.toJson(tool.inputSchema()));
        }
        return array;
    }

    /** Returns true if a tool with the given name is currently in the catalog, ignoring permission mode. */
    public boolean isRegistered(String toolName) {
        return findTarget(toolName) != null;
    }

    /**
     * Resolves a name to its dispatch target. If the name is unknown and some servers were never started, they are
     * started and the lookup is repeated.
     *
     * @throws ToolValidationException with UNKNOWN_TOOL
     */
    @Blocking
    public DispatchTarget resolve(String toolName) throws InterruptedException {
        var target = findTarget(toolName);
        if (target == null && servers != null) {
            servers.startAll();
            target = findTarget(toolName);
        }
        if (target == null) {
            throw new ToolValidationException(ErrorKind.UNKNOWN_TOOL, "Tool not found: " + toolName);
        }
        return target;
    }

    private @Nullable DispatchTarget findTarget(String toolName) {
        if (excluded.contains(toolName)) {
            return null;
        }
        var local = toolMap.get(toolName);
        if (local != null) {
            return new Native(local.method(), local.instance(), local.descriptor());
        }
        if (servers != null) {
            var remote = servers.lookup(toolName);
            if (remote != null && remote.serverName() != null) {
                return new Remote(remote.serverName(), remote);
            }
        }
        return null;
    }

    /** Input schema of a tool in the catalog. */
    @Blocking
    public JsonObjectSchema schemaFor(String toolName) throws InterruptedException {
        return resolve(toolName).descriptor().inputSchema();
    }

    // ---- dispatch ----

    /**
     * Resolves, permission-checks and schema-validates an invocation. A side-effecting tool requested in
     * {@link PermissionMode#RESTRICTED} is reported as unknown, since it is not in that mode's catalog.
     */
    @Blocking
    public ValidatedInvocation validate(ToolInvocation invocation, PermissionMode mode) throws InterruptedException {
        String toolName = invocation.toolName();
        if (toolName == null || toolName.isBlank()) {
            throw new ToolValidationException(ErrorKind.UNKNOWN_TOOL, "Tool name cannot be empty");
        }
        var target = resolve(toolName);
        if (!mode.allows(target.descriptor())) {
            throw new ToolValidationException(
                    ErrorKind.UNKNOWN_TOOL, "Tool not available in %s mode: %s".formatted(mode, toolName));
        }

        JsonNode args;
        try {
            args = invocation.arguments().isBlank()
                    ? OBJECT_MAPPER.createObjectNode()
                    : OBJECT_MAPPER.readTree(invocation.arguments());
        } catch (JsonProcessingException e) {
            throw new ToolValidationException(
                    ErrorKind.SCHEMA_VALIDATION, "Error parsing arguments json: " + e.getOriginalMessage());
        }
        if (args == null || !args.isObject()) {
            throw new ToolValidationException(ErrorKind.SCHEMA_VALIDATION, "Arguments must be a JSON object");
        }
        var violations = SchemaValidator.validate(target.descriptor().inputSchema(), args);
        if (!violations.isEmpty()) {
            throw new ToolValidationException(
                    ErrorKind.SCHEMA_VALIDATION,
                    "Invalid arguments for '%s': %s".formatted(toolName, String.join("; ", violations)));
        }
        return new ValidatedInvocation(target, args);
    }

    /**
     * Validates and runs one invocation. Every failure comes back as a tagged result; only interruption propagates.
     */
    @Blocking
    public ToolExecutionResult execute(ToolInvocation invocation, PermissionMode mode) throws InterruptedException {
        long start = System.nanoTime();
        ValidatedInvocation validated;
        try {
            validated = validate(invocation, mode);
        } catch (ToolValidationException e) {
            logger.debug("Rejected tool call {}: {}", invocation.toolName(), e.getMessage());
            return ToolExecutionResult.failure(invocation, e.kind(), e.getMessage(), elapsedMillis(start));
        }

        var target = validated.target();
        if (target instanceof Native local) {
            return executeNative(invocation, local, validated.arguments(), start);
        }
        var remote = (Remote) target;
        try {
            logger.debug("Invoking tool '{}' on MCP server '{}'", invocation.toolName(), remote.serverName());
            var result = servers()
                    .invoke(remote.serverName(), remote.descriptor().name(), validated.arguments(), invocation.deadline());
            if (result.isError()) {
                return ToolExecutionResult.failure(
                        invocation, ErrorKind.TOOL_EXECUTION, result.text(), elapsedMillis(start));
            }
            return ToolExecutionResult.success(invocation, result.text(), elapsedMillis(start));
        } catch (McpException e) {
            logger.debug("Tool '{}' failed: {}", invocation.toolName(), e.toString());
            return ToolExecutionResult.failure(invocation, e.kind(), e.getMessage(), elapsedMillis(start));
        }
    }

    private McpServerRegistry servers() {
        return Objects.requireNonNull(servers, "no MCP servers configured");
    }

    private ToolExecutionResult executeNative(ToolInvocation invocation, Native target, JsonNode args, long start)
            throws InterruptedException {
        List<Object> parameters;
        try {
            parameters = parseArguments(args, target.method());
        } catch (ToolValidationException e) {
            return ToolExecutionResult.failure(invocation, e.kind(), e.getMessage(), elapsedMillis(start));
        }

        try {
            logger.debug("Invoking tool '{}' with args: {}", invocation.toolName(), parameters);
            Object resultObject = target.method().invoke(target.instance(), parameters.toArray());
            String resultString = resultObject != null ? resultObject.toString() : "";
            return ToolExecutionResult.success(invocation, resultString, elapsedMillis(start));
        } catch (InvocationTargetException e) {
            for (var e2 = (Throwable) e; e2 != null; e2 = e2.getCause()) {
                if (e2 instanceof InterruptedException ie) {
                    throw ie;
                }
            }
            var cause = e.getCause() == null ? e : e.getCause();
            logger.debug("Tool '{}' threw", invocation.toolName(), cause);
            var message = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
            return ToolExecutionResult.failure(invocation, ErrorKind.TOOL_EXECUTION, message, elapsedMillis(start));
        } catch (IllegalArgumentException e) {
            return ToolExecutionResult.failure(
                    invocation, ErrorKind.SCHEMA_VALIDATION, "Bad arguments: " + e.getMessage(), elapsedMillis(start));
        } catch (IllegalAccessException e) {
            throw new RuntimeException(e);
        }
    }

    private static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    /** Remove duplicate tool requests from an AiMessage while preserving order. */
    public static AiMessage removeDuplicateToolRequests(AiMessage message) {
        if (!message.hasToolExecutionRequests()) {
            return message;
        }
        var deduplicated = List.copyOf(new LinkedHashSet<>(message.toolExecutionRequests()));
        if (deduplicated.size() == message.toolExecutionRequests().size()) {
            return message;
        }
        return AiMessage.from(message.text(), deduplicated);
    }

    @Tool(
            """
    Think carefully step by step about a complex problem. Use this tool to reason through difficult questions
    or break problems into smaller pieces. Call it concurrently with other tools.
    """)
    public String think(@P("The step-by-step reasoning to work through") String reasoning) {
        return "Good thinking.";
    }

    private static List<Object> parseArguments(JsonNode arguments, Method method) {
        Parameter[] jsonParams = method.getParameters();
        if (jsonParams.length == 0) {
            return List.of();
        }

        try {
            Map<String, Object> argumentsMap =
                    OBJECT_MAPPER.convertValue(arguments, new TypeReference<HashMap<String, Object>>() {});
            var parameters = new ArrayList<Object>(jsonParams.length);
            var typeFactory = OBJECT_MAPPER.getTypeFactory();

            for (Parameter param : jsonParams) {
                var pAnnotation = param.getAnnotation(P.class);
                boolean required = pAnnotation == null || pAnnotation.required();
                if (!argumentsMap.containsKey(param.getName())) {
                    if (required) {
                        throw new ToolValidationException(
                                ErrorKind.SCHEMA_VALIDATION,
                                "Missing required parameter: '%s' in arguments: %s".formatted(param.getName(), arguments));
                    }
                    parameters.add(null);
                    continue;
                }

                Object argValue = argumentsMap.get(param.getName());
                Object converted;

                var paramType = param.getParameterizedType();
                if (paramType instanceof ParameterizedType) {
                    JavaType javaType = typeFactory.constructType(paramType);
                    try {
                        converted = OBJECT_MAPPER.convertValue(argValue, javaType);
                    } catch (IllegalArgumentException e) {
                        // Models occasionally send a bare string where a one-element list is expected
                        if (javaType.isCollectionLikeType() && !(argValue instanceof Collection)) {
                            logger.debug(
                                    "Retrying conversion of '{}' to {} by wrapping in list", param.getName(), javaType);
                            converted = OBJECT_MAPPER.convertValue(List.of(argValue), javaType);
                        } else {
                            throw e;
                        }
                    }
                } else {
                    converted = OBJECT_MAPPER.convertValue(argValue, param.getType());
                }

                parameters.add(converted);
            }
            return parameters;
        } catch (IllegalArgumentException e) {
            throw new ToolValidationException(
                    ErrorKind.SCHEMA_VALIDATION, "Error converting arguments: " + e.getMessage());
        }
    }
}
