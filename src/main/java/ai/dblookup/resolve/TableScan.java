package ai.dblookup.resolve;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.dblookup.model.TableSchema;
import ai.dblookup.scan.DatabaseAccessException;
import ai.dblookup.scan.RowParser;
import ai.dblookup.scan.RowScanner;

/**
 * One linear pass over a table. Rows not containing {@code needle} are never
 * parsed; malformed and header rows are skipped. The first accepted row in file
 * order wins.
 */
final class TableScan {

    private static final Logger LOG = LoggerFactory.getLogger(TableScan.class);

    private TableScan() {
    }

    static Optional<Map<String, String>> firstRow(Path table,
                                                  TableSchema schema,
                                                  String needle,
                                                  Predicate<Map<String, String>> accept)
            throws DatabaseAccessException {

        int skipped = 0;
        try (RowScanner rows = RowScanner.open(table, schema.label())) {
            String row;
            while ((row = rows.nextRow()) != null) {
                if (!row.contains(needle)) {
                    continue;
                }
                final var parsed = RowParser.parse(row, schema.keys());
                if (parsed.isEmpty() || schema.isHeader(parsed.get())) {
                    skipped++;
                    continue;
                }
                if (accept.test(parsed.get())) {
                    return parsed;
                }
            }
        } finally {
            if (skipped > 0) {
                LOG.debug("Skipped {} unparsable row(s) in {}", skipped, table);
            }
        }
        return Optional.empty();
    }
}
