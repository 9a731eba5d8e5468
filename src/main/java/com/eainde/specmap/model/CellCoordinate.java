package com.eainde.specmap.model;

import java.util.Comparator;

/**
 * Zero-based cell position inside a template workbook.
 */
public record CellCoordinate(String sheetName, int row, int column) implements Comparable<CellCoordinate> {

    private static final Comparator<CellCoordinate> ORDER =
            Comparator.comparing(CellCoordinate::sheetName)
                    .thenComparingInt(CellCoordinate::row)
                    .thenComparingInt(CellCoordinate::column);

    /** A1-style reference, e.g. {@code B12}. */
    public String a1() {
        StringBuilder letters = new StringBuilder();
        int col = column + 1;
        while (col > 0) {
            int rem = (col - 1) % 26;
            letters.insert(0, (char) ('A' + rem));
            col = (col - 1) / 26;
        }
        return letters.toString() + (row + 1);
    }

    @Override
    public int compareTo(CellCoordinate other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return sheetName + "!" + a1();
    }
}
