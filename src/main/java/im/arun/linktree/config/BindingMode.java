package im.arun.linktree.config;

/**
 * How a record tag is compared against a keyword node.
 */
public enum BindingMode {
    /** Tag equals the node's keyword; repeated keywords all receive the record. */
    KEYWORD,
    /** Tag equals the node's full path id, e.g. {@code Root/ChildA}. */
    PATH
}
