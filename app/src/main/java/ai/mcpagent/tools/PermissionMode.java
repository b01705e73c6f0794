package ai.mcpagent.tools;

/** Which tools a task may see and call. */
public enum PermissionMode {
    /** Only tools that do not modify anything outside the agent. */
    RESTRICTED,
    /** Every tool in the catalog. */
    FULL;

    public boolean allows(ToolDescriptor tool) {
        return this == FULL || !tool.sideEffecting();
    }
}
