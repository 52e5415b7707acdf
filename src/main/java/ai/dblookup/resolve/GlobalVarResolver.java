package ai.dblookup.resolve;

import java.util.Map;

import ai.dblookup.model.GlobalVarRecord;
import ai.dblookup.model.TableSchema;

public final class GlobalVarResolver extends NameResolver<GlobalVarRecord> {

    public GlobalVarResolver() {
        super(TableSchema.GLOBAL_VARS);
    }

    @Override
    protected boolean matches(Map<String, String> row, String term, MatchPhase phase) {
        return phase.accepts(row.get("global_var_name"), term);
    }

    @Override
    protected GlobalVarRecord toRecord(Map<String, String> row) {
        return GlobalVarRecord.fromRow(row);
    }

    @Override
    protected String notFoundMessage(String name) {
        return "Global var '" + name + "' not found. Could it be a macro or should you use another tool?";
    }
}
