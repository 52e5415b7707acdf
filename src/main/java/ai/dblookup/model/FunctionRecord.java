package ai.dblookup.model;

import java.util.Map;
import java.util.OptionalInt;

/**
 * Row of FunctionTree.csv. Every component is the raw field text, quotes
 * included.
 */
public record FunctionRecord(
        String functionName,
        String file,
        String startLine,
        String functionId,
        String endLine,
        String callerId    // another function_id, or an encoded "file:line"
) {

    public static FunctionRecord fromRow(Map<String, String> row) {
        return new FunctionRecord(
                row.get("function_name"),
                row.get("file"),
                row.get("start_line"),
                row.get("function_id"),
                row.get("end_line"),
                row.get("caller_id")
        );
    }

    public OptionalInt startLineNumber() {
        return Names.parseLine(startLine);
    }

    public OptionalInt endLineNumber() {
        return Names.parseLine(endLine);
    }
}
