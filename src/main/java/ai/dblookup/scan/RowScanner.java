package ai.dblookup.scan;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Forward-only reader over the raw rows of one table file. Rows keep their
 * line terminator. Every open/read failure surfaces as a
 * {@link DatabaseAccessException} carrying the file type label.
 */
public final class RowScanner implements Closeable {

    private final Path file;
    private final String fileType;
    private final BufferedReader reader;
    private final StringBuilder row = new StringBuilder(256);
    private long rowsRead;

    private RowScanner(Path file, String fileType, BufferedReader reader) {
        this.file = file;
        this.fileType = fileType;
        this.reader = reader;
    }

    public static RowScanner open(Path file, String fileType) throws DatabaseAccessException {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(fileType, "fileType");
        try {
            return new RowScanner(file, fileType, Files.newBufferedReader(file, StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw DatabaseAccessException.of(ex, fileType, file);
        }
    }

    /**
     * @return the next row including its terminator, or {@code null} at end of file
     */
    public String nextRow() throws DatabaseAccessException {
        row.setLength(0);
        try {
            int c;
            while ((c = reader.read()) != -1) {
                row.append((char) c);
                if (c == '\n') {
                    break;
                }
            }
        } catch (IOException ex) {
            throw DatabaseAccessException.of(ex, fileType, file);
        }
        if (row.length() == 0) {
            return null;
        }
        rowsRead++;
        return row.toString();
    }

    public long rowsRead() {
        return rowsRead;
    }

    public Path file() {
        return file;
    }

    @Override
    public void close() throws DatabaseAccessException {
        try {
            reader.close();
        } catch (IOException ex) {
            throw DatabaseAccessException.of(ex, fileType, file);
        }
    }
}
