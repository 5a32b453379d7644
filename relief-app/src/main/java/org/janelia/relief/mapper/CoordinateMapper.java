package org.janelia.relief.mapper;

import java.io.Serializable;

/**
 * Maps between geographic coordinates (degrees) and fractional pixel coordinates
 * of a global raster with the fixed extent latitude [+90, -90] by longitude [-180, +180].
 *
 * Latitude +90 maps to row 0 and latitude -90 maps to row count,
 * so rows increase southward.  Longitude -180 maps to column 0 and
 * longitude +180 maps to column count.  Mapped values at the poles or
 * antimeridian therefore need to be clamped (see {@link #clampRow} and
 * {@link #clampColumn}) before they can be used as array indices.
 */
public class CoordinateMapper implements Serializable {

    public static final double NORTH_LATITUDE = 90.0;
    public static final double SOUTH_LATITUDE = -90.0;
    public static final double WEST_LONGITUDE = -180.0;
    public static final double EAST_LONGITUDE = 180.0;

    private final int rowCount;
    private final int columnCount;

    /**
     * @param  rowCount     number of raster rows (J).
     * @param  columnCount  number of raster columns (I).
     *
     * @throws IllegalArgumentException
     *   if either count is not positive.
     */
    public CoordinateMapper(final int rowCount,
                            final int columnCount)
            throws IllegalArgumentException {
        if ((rowCount < 1) || (columnCount < 1)) {
            throw new IllegalArgumentException("raster dimensions " + rowCount + " x " + columnCount +
                                               " must both be positive");
        }
        this.rowCount = rowCount;
        this.columnCount = columnCount;
    }

    public int getRowCount() {
        return rowCount;
    }

    public int getColumnCount() {
        return columnCount;
    }

    public double toRow(final double latitude) {
        return interpolate(NORTH_LATITUDE, SOUTH_LATITUDE, 0, rowCount, latitude);
    }

    public double toColumn(final double longitude) {
        return interpolate(WEST_LONGITUDE, EAST_LONGITUDE, 0, columnCount, longitude);
    }

    public double toLatitude(final double row) {
        return interpolate(0, rowCount, NORTH_LATITUDE, SOUTH_LATITUDE, row);
    }

    public double toLongitude(final double column) {
        return interpolate(0, columnCount, WEST_LONGITUDE, EAST_LONGITUDE, column);
    }

    /**
     * @return [row, column] for the specified geographic location.
     */
    public double[] toPixel(final double latitude,
                            final double longitude) {
        return new double[] { toRow(latitude), toColumn(longitude) };
    }

    /**
     * @return [latitude, longitude] for the specified fractional pixel location.
     */
    public double[] toGeo(final double row,
                          final double column) {
        return new double[] { toLatitude(row), toLongitude(column) };
    }

    public int clampRow(final double row) {
        return clamp(row, rowCount);
    }

    public int clampColumn(final double column) {
        return clamp(column, columnCount);
    }

    @Override
    public String toString() {
        return "{ rowCount: " + rowCount + ", columnCount: " + columnCount + " }";
    }

    /**
     * Basic linear interpolation of x from the range [x0, x1] onto the range [y0, y1].
     * Whole degree locations map to exact pixel indices (and vice versa).
     */
    public static double interpolate(final double x0,
                                     final double x1,
                                     final double y0,
                                     final double y1,
                                     final double x) {
        // multiply before dividing so that integral inputs stay integral
        return y0 + (x - x0) * (y1 - y0) / (x1 - x0);
    }

    private static int clamp(final double index,
                             final int count) {
        return (int) Math.max(0, Math.min(count - 1, Math.floor(index)));
    }
}
