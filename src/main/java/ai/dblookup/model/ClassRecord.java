package ai.dblookup.model;

import java.util.Map;

/**
 * Row of Classes.csv.
 */
public record ClassRecord(
        String type,        // class | struct | union | ...
        String className,   // possibly qualified
        String file,
        String startLine,
        String endLine,
        String simpleName
) {

    public static ClassRecord fromRow(Map<String, String> row) {
        return new ClassRecord(
                row.get("type"),
                row.get("class_name"),
                row.get("file"),
                row.get("start_line"),
                row.get("end_line"),
                row.get("simple_name")
        );
    }
}
