package ai.dblookup.source;

import java.util.List;

/**
 * A function's source file as read from the archive.
 * <p>
 * {@code lines} holds the whole file, not just the function; {@link #functionLines()}
 * does the slicing for callers that want only the function body.
 *
 * @param filePath  archive path of the file
 * @param startLine first line of the function, 1-based
 * @param endLine   last line of the function, inclusive
 * @param lines     every line of the file
 */
public record ExtractedSource(
        String filePath,
        int startLine,
        int endLine,
        List<String> lines
) {

    public ExtractedSource {
        lines = List.copyOf(lines);
    }

    /**
     * Lines {@code startLine..endLine}, clamped to the file.
     */
    public List<String> functionLines() {
        final int from = Math.max(0, startLine - 1);
        final int to = Math.min(lines.size(), endLine);
        if (from >= to) {
            return List.of();
        }
        return lines.subList(from, to);
    }

    public String numberedSnippet() {
        return SnippetExtractor.formatNumberedSnippet(filePath, Math.max(1, startLine), functionLines());
    }
}
