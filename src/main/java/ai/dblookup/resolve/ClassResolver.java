package ai.dblookup.resolve;

import java.util.Map;

import ai.dblookup.model.ClassRecord;
import ai.dblookup.model.TableSchema;

/**
 * Classes, structs and unions. A row matches on its qualified name or on its
 * simple name, in either pass.
 */
public final class ClassResolver extends NameResolver<ClassRecord> {

    public ClassResolver() {
        super(TableSchema.CLASSES);
    }

    @Override
    protected boolean matches(Map<String, String> row, String term, MatchPhase phase) {
        return phase.accepts(row.get("class_name"), term)
                || phase.accepts(row.get("simple_name"), term);
    }

    @Override
    protected ClassRecord toRecord(Map<String, String> row) {
        return ClassRecord.fromRow(row);
    }

    @Override
    protected String notFoundMessage(String name) {
        return "Class '" + name + "' not found. Could it be a Namespace?";
    }
}
