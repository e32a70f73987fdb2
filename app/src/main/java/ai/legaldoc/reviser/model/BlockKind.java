package ai.legaldoc.reviser.model;

/**
 * Tag distinguishing the two kinds of body blocks a document is made of.
 */
public enum BlockKind {
    PARAGRAPH,
    TABLE
}
