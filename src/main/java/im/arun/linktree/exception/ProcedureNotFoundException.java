package im.arun.linktree.exception;

/** Exception thrown when an operation names a record code that is not in the collection. */
public class ProcedureNotFoundException extends RuntimeException {

    private final String code;

    public ProcedureNotFoundException(String code) {
        super("Procedure not found: " + code);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
