package ai.dblookup.db;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.dblookup.model.TableSchema;
import ai.dblookup.source.SourceArchive;

/**
 * Finds the databases under a root directory. Databases are laid out as
 * {@code <root>/<repo>/<db>/}, optionally under one grouping directory
 * ({@code <root>/<group>/<repo>/<db>/}), and are recognized by their
 * {@code codeql-database.yml} marker. Ids are root-relative paths with
 * {@code /} separators.
 */
public final class DatabaseLayout {

    private static final Logger LOG = LoggerFactory.getLogger(DatabaseLayout.class);

    public static final String DATABASE_MARKER = "codeql-database.yml";

    // deepest database dir is <root>/<group>/<repo>/<db>; the walk only pre-visits dirs above its max depth
    private static final int DATABASE_DEPTH = 3;
    private static final int MAX_DEPTH = DATABASE_DEPTH + 1;

    private final Path root;
    private final Map<String, Path> databaseDirsById;

    private DatabaseLayout(Path root, Map<String, Path> databaseDirsById) {
        this.root = Objects.requireNonNull(root, "root");
        this.databaseDirsById = Collections.unmodifiableMap(new TreeMap<>(databaseDirsById));
    }

    public static DatabaseLayout load(Path root) throws IOException {
        Objects.requireNonNull(root, "root");
        final Path absRoot = root.toAbsolutePath().normalize();
        if (!Files.isDirectory(absRoot)) {
            LOG.warn("Database root {} is not a directory", absRoot);
            return new DatabaseLayout(absRoot, Map.of());
        }

        final Map<String, Path> out = new TreeMap<>();
        Files.walkFileTree(absRoot, Set.of(), MAX_DEPTH, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (Files.isRegularFile(dir.resolve(DATABASE_MARKER))) {
                    out.put(idOf(absRoot, dir), dir);
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                LOG.warn("Cannot access {}: {}", file, exc.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });
        return new DatabaseLayout(absRoot, out);
    }

    private static String idOf(Path root, Path dir) {
        final String rel = root.relativize(dir).toString().replace('\\', '/');
        return rel.isEmpty() ? "." : rel;
    }

    public Path root() {
        return root;
    }

    public Map<String, Path> databaseDirsById() {
        return databaseDirsById;
    }

    public List<String> databaseIdsSorted() {
        return new ArrayList<>(databaseDirsById.keySet());
    }

    public DatabaseLayout filterDatabases(Set<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return this;
        }
        final Map<String, Path> filtered = new TreeMap<>();
        for (String id : ids) {
            final Path dir = databaseDirsById.get(id);
            if (dir != null) {
                filtered.put(id, dir);
            }
        }
        return new DatabaseLayout(root, filtered);
    }

    /**
     * Tables present in {@code databaseDir}, in schema order.
     */
    public static Set<TableSchema> availableTables(Path databaseDir) {
        final Set<TableSchema> present = EnumSet.noneOf(TableSchema.class);
        for (TableSchema schema : TableSchema.values()) {
            if (Files.isRegularFile(schema.in(databaseDir))) {
                present.add(schema);
            }
        }
        return present;
    }

    public static boolean hasSourceArchive(Path databaseDir) {
        return Files.isRegularFile(databaseDir.resolve(SourceArchive.FILE_NAME));
    }
}
