package im.arun.linktree.exception;

/**
 * Exception thrown when a tree source cannot be turned into text at all.
 * Indentation problems never raise this; the parser recovers from them.
 */
public class TreeParseException extends RuntimeException {

    private final String source;

    public TreeParseException(String source, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
