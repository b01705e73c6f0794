package ai.mcpagent.tools;

import dev.langchain4j.agent.tool.P;
import dev.langchain4j.agent.tool.Tool;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * The task list of one session. Each run of the agent registers its own instance, so the list starts empty and is
 * shared by the main loop and any sub-agents of that run. Writing the list touches no files and is allowed in every
 * permission mode.
 */
public class TodoTools {
    private static final Logger logger = LogManager.getLogger(TodoTools.class);

    public enum Status {
        PENDING,
        IN_PROGRESS,
        COMPLETED
    }

    public enum Priority {
        HIGH,
        MEDIUM,
        LOW
    }

    public record TodoItem(String id, String content, Status status, Priority priority) {}

    private List<TodoItem> todos = List.of();

    @Tool(
            name = "todo_read",
            value =
                    """
    Returns the current session's to-do list with each item's status and priority.
    Read it at the start of a task, before picking the next step, and after finishing one.
    Returns a note saying the list is empty if no todos have been written yet.
    """)
    public String todoRead() {
        var current = snapshot();
        if (current.isEmpty()) {
            return "No todos yet. Use todo_write to plan the task.";
        }
        return current.stream().map(TodoTools::format).collect(Collectors.joining("\n"));
    }

    @Tool(
            name = "todo_write",
            value =
                    """
    Replaces the session's to-do list with the given items. Send the whole list every time: items left out are removed.
    Each item needs a unique id, a non-empty content, a status (PENDING, IN_PROGRESS, COMPLETED) and a priority
    (HIGH, MEDIUM, LOW). Keep at most one item IN_PROGRESS and mark items COMPLETED as soon as they are done.
    """)
    public String todoWrite(@P("The complete, updated to-do list") List<TodoItem> todos) {
        var ids = new HashSet<String>();
        for (var item : todos) {
            if (item.id() == null || item.id().isBlank()) {
                throw new IllegalArgumentException("Every todo needs an id");
            }
            if (!ids.add(item.id())) {
                throw new IllegalArgumentException("Duplicate todo id '%s'".formatted(item.id()));
            }
            if (item.content() == null || item.content().isBlank()) {
                throw new IllegalArgumentException("Todo '%s' has no content".formatted(item.id()));
            }
            if (item.status() == null || item.priority() == null) {
                throw new IllegalArgumentException("Todo '%s' needs both a status and a priority".formatted(item.id()));
            }
        }

        var updated = List.copyOf(todos);
        synchronized (this) {
            this.todos = updated;
        }
        long done = updated.stream().filter(t -> t.status() == Status.COMPLETED).count();
        long active = updated.stream().filter(t -> t.status() == Status.IN_PROGRESS).count();
        logger.debug("Todo list now has {} items ({} in progress, {} completed)", updated.size(), active, done);
        return "Todo list updated: %d item(s), %d in progress, %d completed".formatted(updated.size(), active, done);
    }

    public synchronized List<TodoItem> snapshot() {
        return todos;
    }

    private static String format(TodoItem item) {
        var mark =
                switch (item.status()) {
                    case COMPLETED -> "[x]";
                    case IN_PROGRESS -> "[~]";
                    case PENDING -> "[ ]";
                };
        return "%s %s (%s, %s) %s"
                .formatted(
                        mark,
                        item.id(),
                        item.status().name().toLowerCase(Locale.ROOT),
                        item.priority().name().toLowerCase(Locale.ROOT),
                        item.content());
    }
}
