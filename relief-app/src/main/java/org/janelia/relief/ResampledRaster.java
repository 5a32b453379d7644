package org.janelia.relief;

import ij.ImagePlus;
import ij.process.FloatProcessor;

import org.janelia.relief.spec.Quad;
import org.janelia.relief.spec.RasterMetadata;

/**
 * Elevation samples on a regular latitude/longitude grid produced by resampling a {@link GeoRaster}.
 * Row 0 holds the northernmost samples and column 0 the westernmost samples.
 */
public class ResampledRaster {

    private final FloatProcessor processor;
    private final Quad extent;
    private final double pointsPerDegree;

    /**
     * @param  processor        sample values (width is the column count, height is the row count).
     * @param  extent           locations of the first and last sample points.
     * @param  pointsPerDegree  sample density.
     */
    public ResampledRaster(final FloatProcessor processor,
                           final Quad extent,
                           final double pointsPerDegree) {
        this.processor = processor;
        this.extent = extent;
        this.pointsPerDegree = pointsPerDegree;
    }

    /**
     * @param  rows  sample values indexed as [row][column], narrowed to 32-bit floats
     *               (the precision of the saved TIFF).
     */
    public static ResampledRaster fromArray(final double[][] rows,
                                            final Quad extent,
                                            final double pointsPerDegree) {
        final int height = rows.length;
        final int width = height == 0 ? 0 : rows[0].length;
        final float[] pixels = new float[width * height];
        for (int row = 0; row < height; row++) {
            for (int column = 0; column < width; column++) {
                pixels[row * width + column] = (float) rows[row][column];
            }
        }
        return new ResampledRaster(new FloatProcessor(width, height, pixels), extent, pointsPerDegree);
    }

    public FloatProcessor getProcessor() {
        return processor;
    }

    public Quad getExtent() {
        return extent;
    }

    public double getPointsPerDegree() {
        return pointsPerDegree;
    }

    public int getRowCount() {
        return processor.getHeight();
    }

    public int getColumnCount() {
        return processor.getWidth();
    }

    public long getPointCount() {
        return (long) getRowCount() * getColumnCount();
    }

    public double getSample(final int row,
                            final int column) {
        return processor.getf(column, row);
    }

    /**
     * @return [min, max] of all sample values.
     */
    public double[] getValueRange() {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        final float[] pixels = (float[]) processor.getPixels();
        for (final float value : pixels) {
            min = Math.min(min, value);
            max = Math.max(max, value);
        }
        return new double[] { min, max };
    }

    public RasterMetadata getMetadata() {
        return new RasterMetadata(extent, pointsPerDegree, getRowCount(), getColumnCount());
    }

    public ImagePlus toImagePlus(final String title) {
        return new ImagePlus(title, processor);
    }

    @Override
    public String toString() {
        return getRowCount() + " [px] x " + getColumnCount() + " [px] sampled at " + pointsPerDegree +
               " [points/degree] covering " + extent;
    }
}
