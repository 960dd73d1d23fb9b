package im.arun.linktree.exception;

/** Exception thrown when a record is added under a code that already exists. */
public class DuplicateCodeException extends RuntimeException {

    private final String code;

    public DuplicateCodeException(String code) {
        super("Procedure code already exists: " + code);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
