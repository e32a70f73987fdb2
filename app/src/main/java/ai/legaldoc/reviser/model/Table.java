package ai.legaldoc.reviser.model;

/**
 * A table block with a fixed rectangular grid of cells.
 */
public class Table implements Block {

    private final Cell[][] cells;
    private boolean bordered;

    public Table(int rows, int columns) {
        if (rows < 0 || columns < 0) {
            throw new IllegalArgumentException("Table dimensions must not be negative");
        }
        this.cells = new Cell[rows][columns];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < columns; c++) {
                cells[r][c] = new Cell();
            }
        }
    }

    @Override
    public BlockKind kind() {
        return BlockKind.TABLE;
    }

    public int rowCount() {
        return cells.length;
    }

    public int columnCount() {
        return cells.length == 0 ? 0 : cells[0].length;
    }

    public Cell cell(int row, int column) {
        return cells[row][column];
    }

    public boolean bordered() {
        return bordered;
    }

    public Table setBordered(boolean bordered) {
        this.bordered = bordered;
        return this;
    }

    @Override
    public String toString() {
        return "Table[" + rowCount() + "x" + columnCount() + "]";
    }
}
