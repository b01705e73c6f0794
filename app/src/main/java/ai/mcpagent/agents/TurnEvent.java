package ai.mcpagent.agents;

import ai.mcpagent.llm.ModelTurn;
import ai.mcpagent.tools.ToolExecutionResult;
import ai.mcpagent.tools.ToolInvocation;

/** Progress of a running task, in the order it happens. {@link Finished} is always the last event. */
public sealed interface TurnEvent {

    record ModelResponded(int turn, ModelTurn response) implements TurnEvent {}

    /** Emitted from the dispatch thread once the call holds an in-flight slot. */
    record ToolStarted(int turn, ToolInvocation invocation) implements TurnEvent {}

    /** Emitted in request order once the turn's results are collected. */
    record ToolFinished(int turn, ToolExecutionResult result) implements TurnEvent {}

    record Finished(TaskOutcome outcome) implements TurnEvent {}
}
