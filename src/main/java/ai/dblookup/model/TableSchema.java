package ai.dblookup.model;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The four tabular exports of a database directory: file name, the label used
 * in access diagnostics, and the ordered column keys.
 */
public enum TableSchema {

    FUNCTION_TREE("FunctionTree.csv", "Function tree file",
            List.of("function_name", "file", "start_line", "function_id", "end_line", "caller_id")),
    MACROS("Macros.csv", "Macros CSV",
            List.of("macro_name", "body")),
    GLOBAL_VARS("GlobalVars.csv", "GlobalVars CSV",
            List.of("global_var_name", "file", "start_line", "end_line")),
    CLASSES("Classes.csv", "Classes CSV",
            List.of("type", "class_name", "file", "start_line", "end_line", "simple_name"));

    private final String fileName;
    private final String label;
    private final List<String> keys;

    TableSchema(String fileName, String label, List<String> keys) {
        this.fileName = fileName;
        this.label = label;
        this.keys = keys;
    }

    public String fileName() {
        return fileName;
    }

    public String label() {
        return label;
    }

    public List<String> keys() {
        return keys;
    }

    public Path in(Path databaseDir) {
        Objects.requireNonNull(databaseDir, "databaseDir");
        return databaseDir.resolve(fileName);
    }

    /**
     * True for the column header row exported above the data: every unquoted
     * field equals its own key.
     */
    public boolean isHeader(Map<String, String> fields) {
        for (String key : keys) {
            if (!key.equals(Names.normalizeId(fields.get(key)))) {
                return false;
            }
        }
        return true;
    }
}
