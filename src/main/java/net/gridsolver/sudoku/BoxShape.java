// Copyright 2018 Colin Smith. MIT License.
package net.gridsolver.sudoku;

import com.google.common.base.Splitter;

import java.util.List;

/**
 * Geometry of a grid whose N×N cells are divided into boxes of boxRows×boxCols cells,
 * where N = boxRows * boxCols. Values 1..N are represented as bits 0..N-1 of an int,
 * which bounds N at 31.
 */
public final class BoxShape {
    public static final int MAX_SIZE = 31;
    public static final BoxShape STANDARD = new BoxShape(3, 3);

    private static final Splitter xSplitter = Splitter.on('x').trimResults();

    private final int boxRows;
    private final int boxCols;
    private final int size;

    private BoxShape(int boxRows, int boxCols) {
        this.boxRows = boxRows;
        this.boxCols = boxCols;
        this.size = boxRows * boxCols;
    }

    public static BoxShape of(int boxRows, int boxCols) {
        if (boxRows < 1 || boxCols < 1) {
            throw new InvalidPuzzleException(String.format("box dimensions must be positive: %dx%d", boxRows, boxCols));
        }
        if ((long) boxRows * boxCols > MAX_SIZE) {
            throw new InvalidPuzzleException(String.format("%dx%d boxes exceed the maximum size %d", boxRows, boxCols, MAX_SIZE));
        }
        if (boxRows == 3 && boxCols == 3) return STANDARD;
        return new BoxShape(boxRows, boxCols);
    }

    /**
     * @param s box dimensions written as "RxC", e.g. "2x3" for a 6×6 grid of two-row boxes
     * @return the corresponding shape
     */
    public static BoxShape parse(String s) {
        List<String> parts = xSplitter.splitToList(s.toLowerCase());
        if (parts.size() != 2) throw new InvalidPuzzleException("box shape must look like RxC: " + s);
        try {
            return of(Integer.parseInt(parts.get(0)), Integer.parseInt(parts.get(1)));
        } catch (NumberFormatException e) {
            throw new InvalidPuzzleException("box shape must look like RxC: " + s);
        }
    }

    public int boxRows() { return boxRows; }
    public int boxCols() { return boxCols; }

    /** Side length of the grid, which is also the number of distinct values. */
    public int size() { return size; }

    public int cellCount() { return size * size; }

    /** Mask with one bit set for each of the values 1..N. */
    public int fullMask() { return (1 << size) - 1; }

    public int boxIndex(int r, int c) {
        return (r / boxRows) * (size / boxCols) + c / boxCols;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BoxShape)) return false;
        BoxShape that = (BoxShape) o;
        return boxRows == that.boxRows && boxCols == that.boxCols;
    }

    @Override
    public int hashCode() {
        return 31 * boxRows + boxCols;
    }

    @Override
    public String toString() {
        return boxRows + "x" + boxCols;
    }
}
