package ai.dblookup.scan;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Splits one raw table row into named fields.
 * <p>
 * Commas inside double quotes do not split; {@code ""} inside a quoted run is
 * an escaped quote. Field text is kept exactly as exported, quotes included,
 * so that returned records show what the table holds.
 */
public final class RowParser {

    private RowParser() {
    }

    /**
     * @return the fields keyed in order, or empty when the row is blank or its
     *         field count does not match {@code keys}
     */
    public static Optional<Map<String, String>> parse(String row, List<String> keys) {
        if (row == null || keys == null || keys.isEmpty()) {
            return Optional.empty();
        }
        final String line = stripTerminator(row);
        if (line.isBlank()) {
            return Optional.empty();
        }

        final List<String> fields = split(line);
        if (fields.size() != keys.size()) {
            return Optional.empty();
        }

        final Map<String, String> out = new LinkedHashMap<>();
        for (int i = 0; i < keys.size(); i++) {
            out.put(keys.get(i), fields.get(i));
        }
        return Optional.of(out);
    }

    static List<String> split(String line) {
        final List<String> fields = new ArrayList<>();
        final StringBuilder current = new StringBuilder(line.length());
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            final char c = line.charAt(i);
            if (c == '"') {
                quoted = !quoted;
            } else if (c == ',' && !quoted) {
                fields.add(current.toString());
                current.setLength(0);
                continue;
            }
            current.append(c);
        }
        fields.add(current.toString());
        return fields;
    }

    private static String stripTerminator(String row) {
        int end = row.length();
        while (end > 0 && (row.charAt(end - 1) == '\n' || row.charAt(end - 1) == '\r')) {
            end--;
        }
        return row.substring(0, end);
    }
}
