package ai.dblookup;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import ai.dblookup.db.DatabaseLayout;
import ai.dblookup.db.DatabaseLookup;
import ai.dblookup.io.ResultWriter;
import ai.dblookup.model.FunctionRecord;
import ai.dblookup.model.Lookup;
import ai.dblookup.model.MalformedRecordException;

public final class Main {

    private static final Set<String> COMMANDS = Set.of(
            "function-at", "function-id", "function", "macro", "global", "class", "caller", "snippet", "databases");

    static final String NO_FUNCTION_AT = "No function covers the given file and line.";
    static final String NO_FUNCTION_WITH_ID = "No function with the given id.";

    public static void main(String[] args) {
        final int code = run(args, System.out, System.err);
        if (code != 0) {
            System.exit(code);
        }
    }

    static int run(String[] args, PrintStream stdout, PrintStream stderr) {
        if (args.length == 0) {
            printUsage(stdout);
            return 2;
        }
        final String command = args[0];
        if ("--help".equals(command) || "-h".equals(command)) {
            printUsage(stdout);
            return 0;
        }

        if (!COMMANDS.contains(command)) {
            stderr.println("ERROR: unknown command: " + command);
            printUsage(stderr);
            return 2;
        }

        final Map<String, String> options = new LinkedHashMap<>();
        for (String arg : Arrays.copyOfRange(args, 1, args.length)) {
            if ("--help".equals(arg) || "-h".equals(arg)) {
                printUsage(stdout);
                return 0;
            }
            final int eq = arg.indexOf('=');
            if (!arg.startsWith("--") || eq < 0) {
                stderr.println("ERROR: unexpected argument: " + arg);
                printUsage(stderr);
                return 2;
            }
            options.put(arg.substring(2, eq), arg.substring(eq + 1));
        }

        final Writer out = new OutputStreamWriter(stdout, StandardCharsets.UTF_8);
        final ResultWriter writer = new ResultWriter();
        try {
            if ("databases".equals(command)) {
                listDatabases(Paths.get(require(options, "root")),
                        parseIds(options.get("databases")), writer, out);
            } else {
                final DatabaseLookup db = new DatabaseLookup(Paths.get(require(options, "db")));
                runLookup(command, options, db, writer, out);
            }
            out.write(System.lineSeparator());
            out.flush();
            return 0;
        } catch (MalformedRecordException ex) {
            stderr.println("ERROR: malformed record: " + safeMsg(ex.getMessage()));
            return 1;
        } catch (IllegalArgumentException ex) {
            stderr.println("ERROR: " + safeMsg(ex.getMessage()));
            return 2;
        } catch (IOException ex) {
            stderr.println("ERROR: IO failure: " + safeMsg(ex.getMessage()));
            return 2;
        } catch (Exception ex) {
            stderr.println("ERROR: lookup failed: "
                    + ex.getClass().getSimpleName() + ": " + safeMsg(ex.getMessage()));
            return 1;
        }
    }

    private static void runLookup(String command,
                                  Map<String, String> options,
                                  DatabaseLookup db,
                                  ResultWriter writer,
                                  Writer out) throws IOException {
        final boolean lessStrict = Boolean.parseBoolean(options.getOrDefault("lessStrict", "false"));
        switch (command) {
            case "function-at" -> writer.write(
                    db.functionAt(require(options, "file"), intOption(options, "line")), NO_FUNCTION_AT, out);
            case "function-id" -> writer.write(db.functionById(require(options, "id")), NO_FUNCTION_WITH_ID, out);
            case "function" -> writer.write(
                    db.functionByName(require(options, "name"), knownFunctions(db, require(options, "known")),
                            lessStrict), out);
            case "macro" -> writer.write(db.macro(require(options, "name"), lessStrict), out);
            case "global" -> writer.write(db.globalVar(require(options, "name"), lessStrict), out);
            case "class" -> writer.write(db.classInfo(require(options, "name"), lessStrict), out);
            case "caller" -> {
                final Optional<FunctionRecord> function = db.functionById(require(options, "id"));
                if (function.isEmpty()) {
                    writer.write(Lookup.notFound(NO_FUNCTION_WITH_ID), out);
                } else {
                    writer.write(db.caller(function.get()), out);
                }
            }
            case "snippet" -> {
                final Optional<FunctionRecord> function = db.functionById(require(options, "id"));
                if (function.isEmpty()) {
                    writer.write(Lookup.notFound(NO_FUNCTION_WITH_ID), out);
                } else {
                    out.write(db.source(function.get()).numberedSnippet());
                }
            }
            default -> throw new IllegalStateException("unhandled command: " + command);
        }
    }

    private static List<FunctionRecord> knownFunctions(DatabaseLookup db, String ids) throws IOException {
        final List<FunctionRecord> known = new ArrayList<>();
        for (String id : ids.split(",")) {
            final String t = id.trim();
            if (t.isEmpty()) {
                continue;
            }
            final Optional<FunctionRecord> function = db.functionById(t);
            if (function.isEmpty()) {
                throw new IllegalArgumentException("unknown function id: " + t);
            }
            known.add(function.get());
        }
        return known;
    }

    private static Set<String> parseIds(String csv) {
        final Set<String> ids = new LinkedHashSet<>();
        if (csv == null) {
            return ids;
        }
        for (String id : csv.split(",")) {
            final String t = id.trim();
            if (!t.isEmpty()) {
                ids.add(t);
            }
        }
        return ids;
    }

    private static void listDatabases(Path root, Set<String> ids, ResultWriter writer, Writer out)
            throws IOException {
        final DatabaseLayout layout = DatabaseLayout.load(root).filterDatabases(ids);
        final List<ResultWriter.DatabaseEntry> entries = new ArrayList<>();
        for (var e : layout.databaseDirsById().entrySet()) {
            entries.add(new ResultWriter.DatabaseEntry(
                    e.getKey(),
                    e.getValue().toString(),
                    DatabaseLayout.availableTables(e.getValue()),
                    DatabaseLayout.hasSourceArchive(e.getValue())));
        }
        writer.writeDatabases(layout.root(), entries, out);
    }

    private static String require(Map<String, String> options, String key) {
        final String value = options.get(key);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("missing required option --" + key + "=<value>");
        }
        return value;
    }

    private static int intOption(Map<String, String> options, String key) {
        final String value = require(options, key);
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("--" + key + " must be an integer: " + value);
        }
    }

    private static void printUsage(PrintStream out) {
        out.println("Usage: ai-db-lookup <command> [options]");
        out.println("Commands:");
        out.println("  function-at --db=<dir> --file=<path> --line=<n>   Function covering a source line");
        out.println("  function-id --db=<dir> --id=<function_id>         Function by id");
        out.println("  function    --db=<dir> --name=<name> --known=<id,...> [--lessStrict=<bool>]");
        out.println("  macro       --db=<dir> --name=<name> [--lessStrict=<bool>]");
        out.println("  global      --db=<dir> --name=<name> [--lessStrict=<bool>]");
        out.println("  class       --db=<dir> --name=<name> [--lessStrict=<bool>]");
        out.println("  caller      --db=<dir> --id=<function_id>         Function calling the given one");
        out.println("  snippet     --db=<dir> --id=<function_id>         Numbered source of a function");
        out.println("  databases   --root=<dir> [--databases=<id,...>]   Databases found under a root");
        out.println("  --help, -h                                        Show this help");
    }

    private static String safeMsg(String msg) {
        if (msg == null) {
            return "";
        }
        return msg.length() > 200 ? msg.substring(0, 200) + "..." : msg;
    }
}
