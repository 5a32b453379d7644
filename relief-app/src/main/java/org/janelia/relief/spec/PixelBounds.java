package org.janelia.relief.spec;

import java.io.Serializable;

/**
 * Integral row/column bounds of a raster region.
 * Rows {@link #getMinRow()} through {@link #getMaxRow()} and columns {@link #getMinColumn()}
 * through {@link #getMaxColumn()} enclose a fractional pixel range.
 *
 * Bounds enclosing a quad of a J x I raster satisfy 0 &lt;= j0 &lt; jF &lt;= J and 0 &lt;= i0 &lt; iF &lt;= I.
 * Because jF and iF may equal J and I (at the south pole and antimeridian), callers
 * clamp them through {@link org.janelia.relief.mapper.CoordinateMapper} before indexing.
 */
public class PixelBounds implements Serializable {

    private final int minRow;
    private final int maxRow;
    private final int minColumn;
    private final int maxColumn;

    public PixelBounds(final int minRow,
                       final int maxRow,
                       final int minColumn,
                       final int maxColumn) {
        this.minRow = minRow;
        this.maxRow = maxRow;
        this.minColumn = minColumn;
        this.maxColumn = maxColumn;
    }

    /**
     * @return bounds that enclose the specified fractional range
     *         (minimums are floored, maximums are ceiled).
     */
    public static PixelBounds enclosing(final double y0,
                                        final double yF,
                                        final double x0,
                                        final double xF) {
        return new PixelBounds((int) Math.floor(y0),
                               (int) Math.ceil(yF),
                               (int) Math.floor(x0),
                               (int) Math.ceil(xF));
    }

    /** @return j0 */
    public int getMinRow() {
        return minRow;
    }

    /** @return jF */
    public int getMaxRow() {
        return maxRow;
    }

    /** @return i0 */
    public int getMinColumn() {
        return minColumn;
    }

    /** @return iF */
    public int getMaxColumn() {
        return maxColumn;
    }

    public int getRowCount() {
        return maxRow - minRow + 1;
    }

    public int getColumnCount() {
        return maxColumn - minColumn + 1;
    }

    /**
     * @return sequential row indices from j0 to jF.
     */
    public int[] getRowIndices() {
        return range(minRow, maxRow);
    }

    /**
     * @return sequential column indices from i0 to iF.
     */
    public int[] getColumnIndices() {
        return range(minColumn, maxColumn);
    }

    public boolean encloses(final double y0,
                            final double yF,
                            final double x0,
                            final double xF) {
        return (minRow <= y0) && (maxRow >= yF) && (minColumn <= x0) && (maxColumn >= xF);
    }

    @Override
    public String toString() {
        return "rows [" + minRow + "," + maxRow + "] and columns [" + minColumn + "," + maxColumn + "]";
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final PixelBounds that = (PixelBounds) o;
        return (minRow == that.minRow) && (maxRow == that.maxRow) &&
               (minColumn == that.minColumn) && (maxColumn == that.maxColumn);
    }

    @Override
    public int hashCode() {
        int result = minRow;
        result = 31 * result + maxRow;
        result = 31 * result + minColumn;
        result = 31 * result + maxColumn;
        return result;
    }

    private static int[] range(final int first,
                               final int last) {
        final int[] indices = new int[Math.max(0, last - first + 1)];
        for (int i = 0; i < indices.length; i++) {
            indices[i] = first + i;
        }
        return indices;
    }
}
