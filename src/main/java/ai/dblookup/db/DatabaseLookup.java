package ai.dblookup.db;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import ai.dblookup.model.ClassRecord;
import ai.dblookup.model.FunctionMatch;
import ai.dblookup.model.FunctionRecord;
import ai.dblookup.model.GlobalVarRecord;
import ai.dblookup.model.Lookup;
import ai.dblookup.model.MacroRecord;
import ai.dblookup.model.TableSchema;
import ai.dblookup.resolve.CallerWalker;
import ai.dblookup.resolve.ClassResolver;
import ai.dblookup.resolve.FunctionResolver;
import ai.dblookup.resolve.GlobalVarResolver;
import ai.dblookup.resolve.MacroResolver;
import ai.dblookup.scan.DatabaseAccessException;
import ai.dblookup.source.ExtractedSource;
import ai.dblookup.source.SnippetExtractor;

/**
 * All lookups bound to one database directory. Holds no state besides the
 * directory; every call reads the tables afresh, so instances can be shared
 * between threads.
 */
public final class DatabaseLookup {

    private final Path databaseDir;
    private final FunctionResolver functions = new FunctionResolver();
    private final CallerWalker callers = new CallerWalker(functions);
    private final MacroResolver macros = new MacroResolver();
    private final GlobalVarResolver globals = new GlobalVarResolver();
    private final ClassResolver classes = new ClassResolver();
    private final SnippetExtractor snippets = new SnippetExtractor();

    public DatabaseLookup(Path databaseDir) {
        this.databaseDir = Objects.requireNonNull(databaseDir, "databaseDir");
    }

    public Path databaseDir() {
        return databaseDir;
    }

    public Path functionTreeFile() {
        return TableSchema.FUNCTION_TREE.in(databaseDir);
    }

    public Optional<FunctionRecord> functionAt(String file, int line) throws DatabaseAccessException {
        return functions.byLine(functionTreeFile(), file, line);
    }

    public Optional<FunctionRecord> functionById(String functionId) throws DatabaseAccessException {
        return functions.byId(functionTreeFile(), functionId);
    }

    public Lookup<FunctionMatch> functionByName(String name, List<FunctionRecord> knownFunctions)
            throws DatabaseAccessException {
        return functions.byName(functionTreeFile(), name, knownFunctions);
    }

    public Lookup<FunctionMatch> functionByName(String name, List<FunctionRecord> knownFunctions, boolean lessStrict)
            throws DatabaseAccessException {
        return functions.byName(functionTreeFile(), name, knownFunctions, lessStrict);
    }

    public Lookup<FunctionRecord> caller(FunctionRecord function) throws DatabaseAccessException {
        return callers.findCaller(functionTreeFile(), function);
    }

    public Lookup<MacroRecord> macro(String name, boolean lessStrict) throws DatabaseAccessException {
        return macros.find(databaseDir, name, lessStrict);
    }

    public Lookup<GlobalVarRecord> globalVar(String name, boolean lessStrict) throws DatabaseAccessException {
        return globals.find(databaseDir, name, lessStrict);
    }

    public Lookup<ClassRecord> classInfo(String name, boolean lessStrict) throws DatabaseAccessException {
        return classes.find(databaseDir, name, lessStrict);
    }

    public ExtractedSource source(FunctionRecord function) throws DatabaseAccessException {
        return snippets.extractFunctionLines(databaseDir, function);
    }
}
