package ai.dblookup.resolve;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.dblookup.model.FunctionMatch;
import ai.dblookup.model.FunctionRecord;
import ai.dblookup.model.Lookup;
import ai.dblookup.model.Names;
import ai.dblookup.model.TableSchema;
import ai.dblookup.scan.DatabaseAccessException;

/**
 * Lookups against FunctionTree.csv. All of them scan the table from the top,
 * so the first row in file order wins any tie.
 */
public final class FunctionResolver {

    private static final Logger LOG = LoggerFactory.getLogger(FunctionResolver.class);

    private static final TableSchema SCHEMA = TableSchema.FUNCTION_TREE;

    /**
     * Function whose line range contains {@code line} in a file whose path
     * contains {@code file}. Single pass, no fallback.
     */
    public Optional<FunctionRecord> byLine(Path functionTree, String file, int line) throws DatabaseAccessException {
        Objects.requireNonNull(functionTree, "functionTree");
        Objects.requireNonNull(file, "file");

        return TableScan.firstRow(functionTree, SCHEMA, file, row -> covers(row, line))
                .map(FunctionRecord::fromRow);
    }

    /**
     * Function whose unquoted, trimmed id equals {@code functionId}.
     */
    public Optional<FunctionRecord> byId(Path functionTree, String functionId) throws DatabaseAccessException {
        Objects.requireNonNull(functionTree, "functionTree");
        Objects.requireNonNull(functionId, "functionId");

        return TableScan.firstRow(functionTree, SCHEMA, functionId,
                        row -> Names.normalizeId(row.get("function_id")).equals(functionId))
                .map(FunctionRecord::fromRow);
    }

    public Lookup<FunctionMatch> byName(Path functionTree,
                                        String functionName,
                                        List<FunctionRecord> knownFunctions) throws DatabaseAccessException {
        return byName(functionTree, functionName, knownFunctions, false);
    }

    /**
     * Searches the rows related to each known function (rows whose text contains
     * the known function's id) for one named {@code functionName}. Known functions
     * are tried in order and the table is rescanned for each of them.
     */
    public Lookup<FunctionMatch> byName(Path functionTree,
                                        String functionName,
                                        List<FunctionRecord> knownFunctions,
                                        boolean lessStrict) throws DatabaseAccessException {
        Objects.requireNonNull(functionTree, "functionTree");
        Objects.requireNonNull(functionName, "functionName");
        Objects.requireNonNull(knownFunctions, "knownFunctions");

        final String term = Names.stripNamespace(functionName);
        for (MatchPhase phase : MatchPhase.sequence(lessStrict)) {
            for (FunctionRecord known : knownFunctions) {
                final String knownId = known.functionId();
                if (knownId == null) {
                    continue;
                }
                final Optional<Map<String, String>> row = TableScan.firstRow(functionTree, SCHEMA, knownId,
                        r -> phase.accepts(r.get("function_name"), term));
                if (row.isPresent()) {
                    return Lookup.found(new FunctionMatch(FunctionRecord.fromRow(row.get()), known));
                }
            }
            LOG.debug("{} pass found no function '{}' near {} known function(s)",
                    phase, term, knownFunctions.size());
        }
        return Lookup.notFound(
                "Function '" + functionName + "' not found. Make sure you're using the correct tool and args.");
    }

    private static boolean covers(Map<String, String> row, int line) {
        final OptionalInt start = Names.parseLine(row.get("start_line"));
        final OptionalInt end = Names.parseLine(row.get("end_line"));
        if (start.isEmpty() || end.isEmpty()) {
            return false;
        }
        return start.getAsInt() <= line && line <= end.getAsInt();
    }
}
