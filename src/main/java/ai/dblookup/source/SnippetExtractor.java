package ai.dblookup.source;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

import ai.dblookup.model.FunctionRecord;
import ai.dblookup.model.MalformedRecordException;
import ai.dblookup.model.Names;
import ai.dblookup.scan.DatabaseAccessException;

/**
 * Reads a resolved function's source file out of the database archive and
 * renders line-numbered snippets.
 */
public final class SnippetExtractor {

    /**
     * Loads the file holding {@code function}. The stored path starts with a
     * marker character that is not part of the archive entry name, so it is
     * dropped.
     * <p>
     * The returned lines are the whole file; callers slice to the function range.
     *
     * @throws DatabaseAccessException  when the archive or the entry is missing or unreadable
     * @throws MalformedRecordException when the record's line range is not numeric
     */
    public ExtractedSource extractFunctionLines(Path databaseDir, FunctionRecord function)
            throws DatabaseAccessException {
        Objects.requireNonNull(databaseDir, "databaseDir");
        Objects.requireNonNull(function, "function");

        final String file = Names.unquote(function.file());
        final String filePath = file.isEmpty() ? file : file.substring(1);
        final int start = requireLine(function.startLineNumber(), "start_line", function.startLine());
        final int end = requireLine(function.endLineNumber(), "end_line", function.endLine());

        final String text = SourceArchive.of(databaseDir).readText(filePath);
        final List<String> lines = Arrays.asList(text.split("\n", -1));
        return new ExtractedSource(filePath, start, end, lines);
    }

    /**
     * {@code file: <path>} followed by one {@code <n>: <text>} line per input line,
     * numbered from {@code startLine}.
     */
    public static String formatNumberedSnippet(String filePath, int startLine, List<String> snippetLines) {
        final StringBuilder sb = new StringBuilder();
        sb.append("file: ").append(filePath).append('\n');
        for (int i = 0; i < snippetLines.size(); i++) {
            if (i > 0) {
                sb.append('\n');
            }
            sb.append(startLine + i).append(": ").append(snippetLines.get(i));
        }
        return sb.toString();
    }

    private static int requireLine(OptionalInt parsed, String column, String raw) {
        if (parsed.isEmpty()) {
            throw new MalformedRecordException("Function record has a non-numeric " + column + ": " + raw);
        }
        return parsed.getAsInt();
    }
}
