package im.arun.linktree.exception;

/** Exception thrown when the record CSV cannot be read or written. */
public class RecordSourceException extends RuntimeException {

    public RecordSourceException(String message) {
        super(message);
    }

    public RecordSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
