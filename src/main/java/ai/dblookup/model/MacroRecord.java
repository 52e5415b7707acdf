package ai.dblookup.model;

import java.util.Map;

/**
 * Row of Macros.csv.
 */
public record MacroRecord(String macroName, String body) {

    public static MacroRecord fromRow(Map<String, String> row) {
        return new MacroRecord(row.get("macro_name"), row.get("body"));
    }
}
