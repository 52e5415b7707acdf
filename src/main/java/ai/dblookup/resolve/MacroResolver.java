package ai.dblookup.resolve;

import java.util.Map;

import ai.dblookup.model.MacroRecord;
import ai.dblookup.model.TableSchema;

public final class MacroResolver extends NameResolver<MacroRecord> {

    public MacroResolver() {
        super(TableSchema.MACROS);
    }

    @Override
    protected boolean matches(Map<String, String> row, String term, MatchPhase phase) {
        return phase.accepts(row.get("macro_name"), term);
    }

    @Override
    protected MacroRecord toRecord(Map<String, String> row) {
        return MacroRecord.fromRow(row);
    }

    @Override
    protected String notFoundMessage(String name) {
        return "Macro '" + name + "' not found. Make sure you're using the correct tool with correct args.";
    }
}
