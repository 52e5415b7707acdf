package ai.dblookup.scan;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * A database file (table or source archive) could not be read. The message
 * always names the file type label and the path, whichever file failed.
 */
public final class DatabaseAccessException extends IOException {

    private static final long serialVersionUID = 1L;

    public enum Reason {
        NOT_FOUND,
        PERMISSION_DENIED,
        OS_ERROR
    }

    private final Reason reason;
    private final String fileType;
    private final transient Path path;

    public DatabaseAccessException(Reason reason, String fileType, Path path, Throwable cause) {
        super(message(reason, fileType, path), cause);
        this.reason = Objects.requireNonNull(reason, "reason");
        this.fileType = fileType;
        this.path = path;
    }

    /**
     * Maps an I/O failure on {@code path} to its reason.
     */
    public static DatabaseAccessException of(IOException cause, String fileType, Path path) {
        final Reason reason;
        if (cause instanceof NoSuchFileException || cause instanceof FileNotFoundException) {
            reason = Reason.NOT_FOUND;
        } else if (cause instanceof AccessDeniedException) {
            reason = Reason.PERMISSION_DENIED;
        } else {
            reason = Reason.OS_ERROR;
        }
        return new DatabaseAccessException(reason, fileType, path, cause);
    }

    private static String message(Reason reason, String fileType, Path path) {
        return switch (reason) {
            case NOT_FOUND -> fileType + " not found: " + path;
            case PERMISSION_DENIED -> "Permission denied reading " + fileType + ": " + path;
            case OS_ERROR -> "OS error while reading " + fileType + ": " + path;
        };
    }

    public Reason reason() {
        return reason;
    }

    public String fileType() {
        return fileType;
    }

    public Path path() {
        return path;
    }
}
