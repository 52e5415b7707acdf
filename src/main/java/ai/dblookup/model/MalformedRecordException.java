package ai.dblookup.model;

/**
 * A record whose fields cannot be used for the requested operation,
 * such as a non-numeric line range.
 */
public class MalformedRecordException extends RuntimeException {

    public MalformedRecordException(String message) {
        super(message);
    }
}
