package org.janelia.relief;

import ij.measure.Calibration;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;

import org.janelia.relief.mapper.CoordinateMapper;

/**
 * Global elevation raster with the fixed geographic extent described by {@link CoordinateMapper}.
 * Rows run along the latitude axis (row 0 is the north pole) and columns along the longitude axis.
 *
 * Samples are read directly from the wrapped ImageJ processor so that large 16-bit rasters
 * do not need to be converted.  Calibration functions (e.g. the offset ImageJ applies to
 * signed 16-bit TIFFs) are applied on access.
 */
public class GeoRaster {

    private final ImageProcessor processor;
    private final Calibration calibration;
    private final CoordinateMapper mapper;

    public GeoRaster(final ImageProcessor processor) {
        this(processor, null);
    }

    /**
     * @param  processor    raster pixels (width is the column count, height is the row count).
     * @param  calibration  optional value calibration (null for raw pixel values).
     */
    public GeoRaster(final ImageProcessor processor,
                     final Calibration calibration) {
        this.processor = processor;
        this.calibration = ((calibration != null) && calibration.calibrated()) ? calibration : null;
        this.mapper = new CoordinateMapper(processor.getHeight(), processor.getWidth());
    }

    /**
     * Samples are stored in a 32-bit {@link FloatProcessor} like every other loaded raster,
     * so each value is narrowed to the nearest float (exact for integral values up to 2^24).
     *
     * @param  rows  sample values indexed as [row][column], all rows must have the same length.
     *
     * @return raster containing a float copy of the specified values.
     *
     * @throws IllegalArgumentException
     *   if the rows are empty or ragged.
     */
    public static GeoRaster fromArray(final double[][] rows)
            throws IllegalArgumentException {

        if ((rows == null) || (rows.length == 0) || (rows[0].length == 0)) {
            throw new IllegalArgumentException("raster must contain at least one sample");
        }

        final int height = rows.length;
        final int width = rows[0].length;
        final float[] pixels = new float[width * height];
        for (int row = 0; row < height; row++) {
            if (rows[row].length != width) {
                throw new IllegalArgumentException("row " + row + " has " + rows[row].length +
                                                   " samples but row 0 has " + width);
            }
            for (int column = 0; column < width; column++) {
                pixels[row * width + column] = (float) rows[row][column];
            }
        }

        return new GeoRaster(new FloatProcessor(width, height, pixels));
    }

    /** @return J */
    public int getRowCount() {
        return processor.getHeight();
    }

    /** @return I */
    public int getColumnCount() {
        return processor.getWidth();
    }

    public CoordinateMapper getMapper() {
        return mapper;
    }

    public double getSample(final int row,
                            final int column) {
        final double value = processor.getf(column, row);
        return calibration == null ? value : calibration.getCValue(value);
    }

    @Override
    public String toString() {
        return "{ rows: " + getRowCount() + ", columns: " + getColumnCount() +
               ", type: " + processor.getClass().getSimpleName() + " }";
    }
}
