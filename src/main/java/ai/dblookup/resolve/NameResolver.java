package ai.dblookup.resolve;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.dblookup.model.Lookup;
import ai.dblookup.model.Names;
import ai.dblookup.model.TableSchema;
import ai.dblookup.scan.DatabaseAccessException;

/**
 * Two-phase lookup of a named symbol in one table of a database directory:
 * an exact pass, then a substring pass only if the exact pass found nothing.
 *
 * @param <T> record type produced for a matching row
 */
public abstract class NameResolver<T> {

    private static final Logger LOG = LoggerFactory.getLogger(NameResolver.class);

    private final TableSchema schema;

    protected NameResolver(TableSchema schema) {
        this.schema = Objects.requireNonNull(schema, "schema");
    }

    public Lookup<T> find(Path databaseDir, String name) throws DatabaseAccessException {
        return find(databaseDir, name, false);
    }

    /**
     * @param lessStrict skip the exact pass and match by substring right away
     */
    public Lookup<T> find(Path databaseDir, String name, boolean lessStrict) throws DatabaseAccessException {
        Objects.requireNonNull(databaseDir, "databaseDir");
        Objects.requireNonNull(name, "name");

        final Path table = schema.in(databaseDir);
        final String term = Names.stripNamespace(name);
        for (MatchPhase phase : MatchPhase.sequence(lessStrict)) {
            final Optional<T> hit = scan(table, term, phase);
            if (hit.isPresent()) {
                return Lookup.found(hit.get());
            }
            LOG.debug("{} pass found no '{}' in {}", phase, term, table);
        }
        return Lookup.notFound(notFoundMessage(name));
    }

    protected Optional<T> scan(Path table, String term, MatchPhase phase) throws DatabaseAccessException {
        return TableScan.firstRow(table, schema, term, row -> matches(row, term, phase))
                .map(this::toRecord);
    }

    protected abstract boolean matches(Map<String, String> row, String term, MatchPhase phase);

    protected abstract T toRecord(Map<String, String> row);

    /**
     * @param name the search term as the caller gave it, namespace included
     */
    protected abstract String notFoundMessage(String name);
}
