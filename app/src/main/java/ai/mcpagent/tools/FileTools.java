package ai.mcpagent.tools;

import dev.langchain4j.agent.tool.P;
import dev.langchain4j.agent.tool.Tool;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.MalformedInputException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * File system tools confined to a workspace root. Paths may be absolute or relative to the root, but must resolve to
 * a location inside it.
 */
public class FileTools {
    private static final Logger logger = LogManager.getLogger(FileTools.class);

    static final int DEFAULT_READ_LIMIT = 2000;
    static final int MAX_LINE_LENGTH = 2000;
    static final int MAX_LISTED_ENTRIES = 1000;
    static final int MAX_SEARCH_RESULTS = 100;

    private final Path root;

    public FileTools(Path workspaceRoot) {
        this.root = workspaceRoot.toAbsolutePath().normalize();
    }

    Path resolve(String path) {
        var candidate = Path.of(path);
        var resolved = (candidate.isAbsolute() ? candidate : root.resolve(candidate)).normalize();
        if (!resolved.startsWith(root)) {
            throw new IllegalArgumentException(
                    "Path %s is outside the workspace root %s".formatted(path, root));
        }
        return resolved;
    }

    private String display(Path path) {
        var relative = root.relativize(path).toString();
        return relative.isEmpty() ? "." : relative;
    }

    @Tool(
            name = "read_file",
            value =
                    """
    Reads a file from the workspace. Output is numbered like `cat -n`, starting at line 1.
    By default up to 2000 lines are returned; use offset and limit for long files.
    Lines longer than 2000 characters are truncated.
    """)
    public String readFile(
            @P("Path of the file, absolute or relative to the workspace root") String filePath,
            @P(value = "Line number to start reading from (1-based)", required = false) @Nullable Integer offset,
            @P(value = "Maximum number of lines to read", required = false) @Nullable Integer limit)
            throws IOException {
        var path = resolve(filePath);
        if (!Files.exists(path)) {
            throw new IllegalArgumentException("File %s does not exist".formatted(filePath));
        }
        if (Files.isDirectory(path)) {
            throw new IllegalArgumentException("%s is a directory, not a file".formatted(filePath));
        }

        List<String> lines;
        try {
            lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (MalformedInputException e) {
            throw new IllegalArgumentException("Cannot read %s: file appears to be binary".formatted(filePath));
        }
        if (lines.isEmpty()) {
            return "(file is empty)";
        }

        int start = offset == null || offset < 1 ? 0 : offset - 1;
        int count = limit == null || limit < 1 ? DEFAULT_READ_LIMIT : limit;
        if (start >= lines.size()) {
            throw new IllegalArgumentException(
                    "Offset %d is past the end of %s (%d lines)".formatted(start + 1, filePath, lines.size()));
        }
        int end = Math.min(lines.size(), start + count);

        var sb = new StringBuilder();
        for (int i = start; i < end; i++) {
            var line = lines.get(i);
            if (line.length() > MAX_LINE_LENGTH) {
                line = line.substring(0, MAX_LINE_LENGTH) + "... (line truncated)";
            }
            sb.append("%6d\t%s\n".formatted(i + 1, line));
        }
        if (end < lines.size()) {
            sb.append("\n(Showing lines %d-%d of %d)".formatted(start + 1, end, lines.size()));
        }
        return sb.toString();
    }

    @Tool(
            name = "list_directory",
            value = "Lists the entries of a workspace directory. Directories are shown with a trailing '/'.")
    public String listDirectory(
            @P(value = "Directory to list, absolute or relative to the workspace root; defaults to the root",
                            required = false)
                    @Nullable String path)
            throws IOException {
        var dir = resolve(path == null || path.isBlank() ? "." : path);
        if (!Files.isDirectory(dir)) {
            throw new IllegalArgumentException("%s is not a directory".formatted(path));
        }
        List<String> entries;
        try (Stream<Path> children = Files.list(dir)) {
            entries = children.sorted()
                    .map(p -> p.getFileName() + (Files.isDirectory(p) ? "/" : ""))
                    .limit(MAX_LISTED_ENTRIES + 1L)
                    .collect(Collectors.toCollection(ArrayList::new));
        }
        if (entries.isEmpty()) {
            return "(empty directory)";
        }
        boolean truncated = entries.size() > MAX_LISTED_ENTRIES;
        if (truncated) {
            entries.remove(entries.size() - 1);
        }
        var result = "- " + display(dir) + "/\n" + entries.stream().map(e -> "  - " + e).collect(Collectors.joining("\n"));
        return truncated ? result + "\n(Listing truncated at " + MAX_LISTED_ENTRIES + " entries)" : result;
    }

    @Tool(
            name = "glob",
            value = "Finds files whose workspace-relative path matches a glob pattern such as **/*.java.")
    public String glob(
            @P("Glob pattern, matched against paths relative to the search directory") String pattern,
            @P(value = "Directory to search in; defaults to the workspace root", required = false) @Nullable
                    String path)
            throws IOException {
        var base = resolve(path == null || path.isBlank() ? "." : path);
        var matcher = FileSystems.getDefault().getPathMatcher("glob:" + pattern);
        List<Path> matches;
        try (Stream<Path> walk = Files.walk(base)) {
            matches = walk.filter(Files::isRegularFile)
                    .filter(p -> matcher.matches(base.relativize(p)))
                    .sorted(Comparator.comparing(Path::toString))
                    .limit(MAX_SEARCH_RESULTS + 1L)
                    .toList();
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
        return formatFileList(matches);
    }

    @Tool(
            name = "grep",
            value =
                    """
    Searches file contents with a regular expression and returns the files that contain a match.
    Optionally restrict the files searched with a glob such as *.py.
    """)
    public String grep(
            @P("Java regular expression to search for") String pattern,
            @P(value = "Directory to search in; defaults to the workspace root", required = false) @Nullable
                    String path,
            @P(value = "Glob restricting which file names are searched", required = false) @Nullable String include)
            throws IOException {
        Pattern regex;
        try {
            regex = Pattern.compile(pattern);
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("Invalid regular expression: " + e.getDescription());
        }
        var base = resolve(path == null || path.isBlank() ? "." : path);
        var nameMatcher = include == null || include.isBlank()
                ? null
                : FileSystems.getDefault().getPathMatcher("glob:" + include);

        List<Path> matches;
        try (Stream<Path> walk = Files.walk(base)) {
            matches = walk.filter(Files::isRegularFile)
                    .filter(p -> nameMatcher == null || nameMatcher.matches(p.getFileName()))
                    .filter(p -> containsMatch(p, regex))
                    .sorted(Comparator.comparing(Path::toString))
                    .limit(MAX_SEARCH_RESULTS + 1L)
                    .toList();
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
        return formatFileList(matches);
    }

    private static boolean containsMatch(Path file, Pattern regex) {
        try (Stream<String> lines = Files.lines(file, StandardCharsets.UTF_8)) {
            return lines.anyMatch(line -> regex.matcher(line).find());
        } catch (IOException | UncheckedIOException e) {
            // unreadable or binary files simply do not match
            logger.trace("Skipping {} during grep: {}", file, e.getMessage());
            return false;
        }
    }

    private String formatFileList(List<Path> matches) {
        if (matches.isEmpty()) {
            return "No files found";
        }
        boolean truncated = matches.size() > MAX_SEARCH_RESULTS;
        var shown = truncated ? matches.subList(0, MAX_SEARCH_RESULTS) : matches;
        var sb = new StringBuilder("Found %d file(s)\n".formatted(shown.size()));
        shown.forEach(p -> sb.append(display(p)).append('\n'));
        if (truncated) {
            sb.append("(Results are truncated. Consider using a more specific path or pattern.)");
        }
        return sb.toString();
    }

    @SideEffecting
    @Tool(name = "write_file", value = "Writes a file in the workspace, replacing it if it exists.")
    public String writeFile(
            @P("Path of the file, absolute or relative to the workspace root") String filePath,
            @P("The full content to write") String content)
            throws IOException {
        var path = resolve(filePath);
        if (Files.isDirectory(path)) {
            throw new IllegalArgumentException("%s is a directory".formatted(filePath));
        }
        boolean existed = Files.exists(path);
        var parent = path.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(path, content, StandardCharsets.UTF_8);
        logger.debug("Wrote {} chars to {}", content.length(), path);
        return (existed ? "Updated " : "Created ") + display(path);
    }

    @SideEffecting
    @Tool(
            name = "edit_file",
            value =
                    """
    Performs an exact string replacement in a file. The edit fails if oldString is not unique in the file,
    unless replaceAll is set.
    """)
    public String editFile(
            @P("Path of the file, absolute or relative to the workspace root") String filePath,
            @P("The text to replace") String oldString,
            @P("The text to replace it with (must be different from oldString)") String newString,
            @P(value = "Replace all occurrences of oldString (default false)", required = false) @Nullable
                    Boolean replaceAll)
            throws IOException {
        var path = resolve(filePath);
        if (!Files.isRegularFile(path)) {
            throw new IllegalArgumentException("File %s does not exist".formatted(filePath));
        }

        var content = Files.readString(path, StandardCharsets.UTF_8);
        var applied = applyEdit(content, new FileEdit(oldString, newString, replaceAll), filePath);
        Files.writeString(path, applied.content(), StandardCharsets.UTF_8);
        return "Replaced %d occurrence(s) in %s".formatted(applied.replacements(), display(path));
    }

    /** One find-and-replace step of {@link #multiEditFile}. */
    public record FileEdit(String oldString, String newString, @Nullable Boolean replaceAll) {}

    private record AppliedEdit(String content, int replacements) {}

    @SideEffecting
    @Tool(
            name = "multi_edit_file",
            value =
                    """
    Makes several exact string replacements in one file. Edits are applied in order, each to the result of the
    previous one, and follow the same rules as edit_file. If any edit fails, none are applied and the file is unchanged.
    To create a new file, give an empty oldString in the first edit and the file's content as its newString.
    """)
    public String multiEditFile(
            @P("Path of the file, absolute or relative to the workspace root") String filePath,
            @P("Edits to apply in order; each has oldString, newString and optionally replaceAll") List<FileEdit> edits)
            throws IOException {
        if (edits == null || edits.isEmpty()) {
            throw new IllegalArgumentException("edits cannot be empty");
        }
        var path = resolve(filePath);
        if (Files.isDirectory(path)) {
            throw new IllegalArgumentException("%s is a directory".formatted(filePath));
        }

        boolean existed = Files.isRegularFile(path);
        String content;
        int first;
        if (existed) {
            content = Files.readString(path, StandardCharsets.UTF_8);
            first = 0;
        } else if (edits.get(0).oldString().isEmpty()) {
            content = edits.get(0).newString();
            first = 1;
        } else {
            throw new IllegalArgumentException(
                    "File %s does not exist. To create it, leave the first edit's oldString empty".formatted(filePath));
        }

        int replacements = 0;
        for (int i = first; i < edits.size(); i++) {
            try {
                var applied = applyEdit(content, edits.get(i), filePath);
                content = applied.content();
                replacements += applied.replacements();
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(
                        "Edit %d of %d failed, no changes were made: %s".formatted(i + 1, edits.size(), e.getMessage()));
            }
        }

        var parent = path.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(path, content, StandardCharsets.UTF_8);
        logger.debug("Applied {} edits to {}", edits.size(), path);
        return existed
                ? "Applied %d edit(s) to %s (%d replacement(s))".formatted(edits.size(), display(path), replacements)
                : "Created %s with %d edit(s)".formatted(display(path), edits.size());
    }

    private static AppliedEdit applyEdit(String content, FileEdit edit, String filePath) {
        var oldString = edit.oldString();
        var newString = edit.newString();
        if (oldString == null || newString == null) {
            throw new IllegalArgumentException("oldString and newString are required");
        }
        if (oldString.equals(newString)) {
            throw new IllegalArgumentException("oldString and newString cannot be the same");
        }
        if (oldString.isEmpty()) {
            throw new IllegalArgumentException("oldString cannot be empty");
        }
        int occurrences = countOccurrences(content, oldString);
        if (occurrences == 0) {
            throw new IllegalArgumentException("The string to replace was not found in " + filePath);
        }
        boolean all = Boolean.TRUE.equals(edit.replaceAll());
        if (occurrences > 1 && !all) {
            throw new IllegalArgumentException(
                    "Found %d occurrences of the string in %s. Use replaceAll, or provide more context to make it unique"
                            .formatted(occurrences, filePath));
        }
        return all
                ? new AppliedEdit(content.replace(oldString, newString), occurrences)
                : new AppliedEdit(replaceFirstLiteral(content, oldString, newString), 1);
    }

    static int countOccurrences(String content, String needle) {
        int count = 0;
        for (int idx = content.indexOf(needle); idx >= 0; idx = content.indexOf(needle, idx + needle.length())) {
            count++;
        }
        return count;
    }

    private static String replaceFirstLiteral(String content, String needle, String replacement) {
        int idx = content.indexOf(needle);
        return content.substring(0, idx) + replacement + content.substring(idx + needle.length());
    }
}
