package ai.dblookup.resolve;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.dblookup.model.FunctionRecord;
import ai.dblookup.model.Lookup;
import ai.dblookup.model.Names;
import ai.dblookup.model.SourceLocation;
import ai.dblookup.scan.DatabaseAccessException;

/**
 * Follows a function's caller_id to the calling function.
 * <p>
 * The id normally names another row's function_id. When the caller has no row
 * of its own the exporter writes its location instead, as {@code "<file>:<line>"}
 * with a marker character in front of the path; that form is resolved by line
 * containment.
 */
public final class CallerWalker {

    private static final Logger LOG = LoggerFactory.getLogger(CallerWalker.class);

    static final String CALLER_NOT_FOUND =
            "Caller function was not found. Make sure you are using the correct tool with the correct args.";

    private final FunctionResolver functions;

    public CallerWalker() {
        this(new FunctionResolver());
    }

    public CallerWalker(FunctionResolver functions) {
        this.functions = Objects.requireNonNull(functions, "functions");
    }

    /**
     * @param function a function row carrying a caller_id
     * @throws NullPointerException if {@code function} has no caller_id
     */
    public Lookup<FunctionRecord> findCaller(Path functionTree, FunctionRecord function)
            throws DatabaseAccessException {
        Objects.requireNonNull(functionTree, "functionTree");
        Objects.requireNonNull(function, "function");
        final String callerId = Names.normalizeId(Objects.requireNonNull(function.callerId(), "callerId"));

        final Optional<FunctionRecord> byId = functions.byId(functionTree, callerId);
        if (byId.isPresent()) {
            return Lookup.found(byId.get());
        }

        final Optional<SourceLocation> location = decodeLocation(callerId);
        if (location.isPresent()) {
            LOG.debug("Caller id {} has no row, resolving {} by line", callerId, location.get());
            final Optional<FunctionRecord> byLine =
                    functions.byLine(functionTree, location.get().file(), location.get().line());
            if (byLine.isPresent()) {
                return Lookup.found(byLine.get());
            }
        }
        return Lookup.notFound(CALLER_NOT_FOUND);
    }

    /**
     * Decodes a normalized caller id of the form {@code <marker><file>:<line>}.
     * Ids with more or fewer than one colon, or a non-numeric line, do not decode.
     * An empty file part decodes to an empty file, which any row contains.
     */
    static Optional<SourceLocation> decodeLocation(String callerId) {
        final String[] parts = callerId.split(":", -1);
        if (parts.length != 2) {
            return Optional.empty();
        }
        final OptionalInt line = Names.parseLine(parts[1]);
        if (line.isEmpty()) {
            return Optional.empty();
        }
        final String file = parts[0].isEmpty() ? "" : parts[0].substring(1);
        return Optional.of(new SourceLocation(file, line.getAsInt()));
    }
}
