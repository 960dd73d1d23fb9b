package im.arun.linktree.model;

public enum WarningType {
    /** Indentation jumped more than one level and was pulled back. */
    INDENT_CLAMPED,
    /** Leading whitespace was not a multiple of the indent unit. */
    INDENT_MISALIGNED,
    /** Node path collided with an existing id and was suffixed. */
    DUPLICATE_NODE_ID,
    /** A later record replaced an earlier one with the same code. */
    DUPLICATE_CODE,
    /** Record tags matched no node. */
    UNBOUND_RECORD
}
