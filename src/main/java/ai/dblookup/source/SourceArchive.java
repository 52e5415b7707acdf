package ai.dblookup.source;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Objects;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

import ai.dblookup.scan.DatabaseAccessException;

/**
 * The packaged source tree of a database, {@code <db>/src.zip}, one entry per
 * source file keyed by its path.
 */
public final class SourceArchive {

    public static final String FILE_NAME = "src.zip";

    static final String ARCHIVE_LABEL = "Source archive";
    static final String ENTRY_LABEL = "Source archive entry";

    private final Path zip;

    public SourceArchive(Path zip) {
        this.zip = Objects.requireNonNull(zip, "zip");
    }

    public static SourceArchive of(Path databaseDir) {
        Objects.requireNonNull(databaseDir, "databaseDir");
        return new SourceArchive(databaseDir.resolve(FILE_NAME));
    }

    public Path path() {
        return zip;
    }

    /**
     * Full UTF-8 text of one entry.
     */
    public String readText(String entryPath) throws DatabaseAccessException {
        Objects.requireNonNull(entryPath, "entryPath");
        final ZipFile archive;
        try {
            archive = new ZipFile(zip.toFile(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw DatabaseAccessException.of(ex, ARCHIVE_LABEL, zip);
        }
        try (archive) {
            final ZipEntry entry = archive.getEntry(entryPath);
            if (entry == null || entry.isDirectory()) {
                throw new DatabaseAccessException(DatabaseAccessException.Reason.NOT_FOUND,
                        ENTRY_LABEL, zip.resolve(entryPath), null);
            }
            try (InputStream in = archive.getInputStream(entry)) {
                return new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
        } catch (DatabaseAccessException ex) {
            throw ex;
        } catch (IOException ex) {
            throw DatabaseAccessException.of(ex, ARCHIVE_LABEL, zip);
        }
    }
}
