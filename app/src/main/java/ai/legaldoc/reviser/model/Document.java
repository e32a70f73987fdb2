package ai.legaldoc.reviser.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * In-memory body of a document: blocks in document order. A block's position is its index.
 * Blocks are only ever inserted, removed or replaced as whole units, never reordered.
 */
public class Document {

    private final List<Block> blocks = new ArrayList<>();

    public Document() {
    }

    public Document(List<? extends Block> initialBlocks) {
        blocks.addAll(Objects.requireNonNull(initialBlocks, "initialBlocks"));
    }

    /**
     * Read-only live view of the blocks in document order.
     */
    public List<Block> blocks() {
        return Collections.unmodifiableList(blocks);
    }

    public Stream<Block> stream() {
        return blocks.stream();
    }

    public List<Paragraph> paragraphs() {
        return blocks.stream()
                .filter(Block::isParagraph)
                .map(Block::asParagraph)
                .collect(Collectors.toList());
    }

    public int size() {
        return blocks.size();
    }

    public Block get(int index) {
        return blocks.get(index);
    }

    public Paragraph addParagraph() {
        Paragraph paragraph = new Paragraph();
        blocks.add(paragraph);
        return paragraph;
    }

    public Paragraph addParagraph(String text) {
        Paragraph paragraph = new Paragraph(text);
        blocks.add(paragraph);
        return paragraph;
    }

    public Table addTable(int rows, int columns) {
        Table table = new Table(rows, columns);
        blocks.add(table);
        return table;
    }

    public void add(Block block) {
        blocks.add(Objects.requireNonNull(block, "block"));
    }

    public void insert(int index, Block block) {
        blocks.add(index, Objects.requireNonNull(block, "block"));
    }

    /**
     * Replaces the half-open range {@code [start, end)} with {@code replacement}.
     */
    public void replaceRange(int start, int end, List<? extends Block> replacement) {
        if (start < 0 || end > blocks.size() || start > end) {
            throw new IndexOutOfBoundsException("Invalid range [" + start + ", " + end + ") for size " + blocks.size());
        }
        blocks.subList(start, end).clear();
        blocks.addAll(start, replacement);
    }
}
