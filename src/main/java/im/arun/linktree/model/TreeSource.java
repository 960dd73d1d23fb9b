package im.arun.linktree.model;

/**
 * Which tree text a keyword node was parsed from.
 */
public enum TreeSource {
    PRIMARY,
    OTHER
}
