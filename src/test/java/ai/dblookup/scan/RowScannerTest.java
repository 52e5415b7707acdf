package ai.dblookup.scan;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeFalse;

@Tag("unit")
class RowScannerTest {

    @TempDir
    Path tempDir;

    @Test
    void nextRow_returnsRowsWithTerminators() throws IOException {
        final Path file = tempDir.resolve("Macros.csv");
        Files.writeString(file, "a\nb\r\nc", StandardCharsets.UTF_8);

        final List<String> rows = new ArrayList<>();
        try (RowScanner scanner = RowScanner.open(file, "Macros CSV")) {
            String row;
            while ((row = scanner.nextRow()) != null) {
                rows.add(row);
            }
            assertThat(scanner.rowsRead()).isEqualTo(3);
        }

        assertThat(rows).containsExactly("a\n", "b\r\n", "c");
    }

    @Test
    void nextRow_returnsNullForEmptyFile() throws IOException {
        final Path file = tempDir.resolve("empty.csv");
        Files.createFile(file);

        try (RowScanner scanner = RowScanner.open(file, "Classes CSV")) {
            assertThat(scanner.nextRow()).isNull();
        }
    }

    @Test
    void open_missingFile_reportsNotFoundWithLabelAndPath() {
        final Path file = tempDir.resolve("FunctionTree.csv");

        assertThatThrownBy(() -> RowScanner.open(file, "Function tree file"))
                .isInstanceOfSatisfying(DatabaseAccessException.class, ex -> {
                    assertThat(ex.reason()).isEqualTo(DatabaseAccessException.Reason.NOT_FOUND);
                    assertThat(ex.fileType()).isEqualTo("Function tree file");
                    assertThat(ex.path()).isEqualTo(file);
                    assertThat(ex.getCause()).isInstanceOf(NoSuchFileException.class);
                })
                .hasMessage("Function tree file not found: " + file);
    }

    @Test
    void readingADirectory_reportsOsError() throws IOException {
        final Path dir = Files.createDirectory(tempDir.resolve("GlobalVars.csv"));

        assertThatThrownBy(() -> {
            try (RowScanner scanner = RowScanner.open(dir, "GlobalVars CSV")) {
                while (scanner.nextRow() != null) {
                    // drain
                }
            }
        })
                .isInstanceOfSatisfying(DatabaseAccessException.class,
                        ex -> assertThat(ex.reason()).isEqualTo(DatabaseAccessException.Reason.OS_ERROR))
                .hasMessage("OS error while reading GlobalVars CSV: " + dir);
    }

    @Test
    void open_unreadableFile_reportsPermissionDenied() throws IOException {
        final Path file = tempDir.resolve("Classes.csv");
        Files.writeString(file, "x\n", StandardCharsets.UTF_8);
        try {
            Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("---------"));
        } catch (UnsupportedOperationException ex) {
            assumeFalse(true, "POSIX permissions not supported");
        }
        assumeFalse(Files.isReadable(file), "running with privileges that ignore file modes");

        assertThatThrownBy(() -> RowScanner.open(file, "Classes CSV"))
                .isInstanceOfSatisfying(DatabaseAccessException.class,
                        ex -> assertThat(ex.reason()).isEqualTo(DatabaseAccessException.Reason.PERMISSION_DENIED))
                .hasMessage("Permission denied reading Classes CSV: " + file);
    }

    @Test
    void of_mapsIoExceptionsToReasons() {
        final Path path = tempDir.resolve("x.csv");

        assertThat(DatabaseAccessException.of(new NoSuchFileException("x"), "T", path).reason())
                .isEqualTo(DatabaseAccessException.Reason.NOT_FOUND);
        assertThat(DatabaseAccessException.of(new FileNotFoundException("x"), "T", path).reason())
                .isEqualTo(DatabaseAccessException.Reason.NOT_FOUND);
        assertThat(DatabaseAccessException.of(new AccessDeniedException("x"), "T", path).reason())
                .isEqualTo(DatabaseAccessException.Reason.PERMISSION_DENIED);
        assertThat(DatabaseAccessException.of(new IOException("disk"), "T", path).reason())
                .isEqualTo(DatabaseAccessException.Reason.OS_ERROR);
    }
}
