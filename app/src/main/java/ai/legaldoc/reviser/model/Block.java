package ai.legaldoc.reviser.model;

/**
 * A top-level body element of a {@link Document}. The kind is fixed when the block is created.
 */
public interface Block {

    BlockKind kind();

    default boolean isParagraph() {
        return kind() == BlockKind.PARAGRAPH;
    }

    default Paragraph asParagraph() {
        if (kind() != BlockKind.PARAGRAPH) {
            throw new IllegalStateException("Block is a " + kind() + ", not a paragraph");
        }
        return (Paragraph) this;
    }

    default Table asTable() {
        if (kind() != BlockKind.TABLE) {
            throw new IllegalStateException("Block is a " + kind() + ", not a table");
        }
        return (Table) this;
    }
}
