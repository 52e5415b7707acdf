package ai.dblookup.model;

import java.util.Map;

/**
 * Row of GlobalVars.csv.
 */
public record GlobalVarRecord(
        String globalVarName,
        String file,
        String startLine,
        String endLine
) {

    public static GlobalVarRecord fromRow(Map<String, String> row) {
        return new GlobalVarRecord(
                row.get("global_var_name"),
                row.get("file"),
                row.get("start_line"),
                row.get("end_line")
        );
    }
}
