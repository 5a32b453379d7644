package org.janelia.relief.sample;

import org.janelia.relief.mapper.CoordinateMapper;
import org.janelia.relief.spec.PixelBounds;

/**
 * Samples extracted from a global raster along with the fractional pixel range they enclose.
 *
 * The enclosing bounds may reach the raster row or column count at the south pole
 * or antimeridian while the sampled bounds always stay inside the raster.
 */
public class Subgrid {

    private final CoordinateMapper mapper;
    private final PixelBounds bounds;
    private final PixelBounds sampledBounds;
    private final double y0;
    private final double yF;
    private final double x0;
    private final double xF;
    private final double[][] values;

    /**
     * @param  mapper  coordinate mapper for the source raster.
     * @param  bounds         integral bounds enclosing the target range.
     * @param  sampledBounds  bounds of the sampled rows and columns (clamped into the raster).
     * @param  y0      first fractional target row.
     * @param  yF      (exclusive) last fractional target row.
     * @param  x0      first fractional target column.
     * @param  xF      (exclusive) last fractional target column.
     * @param  values  sampled values indexed as [row - j0][column - i0].
     */
    public Subgrid(final CoordinateMapper mapper,
                   final PixelBounds bounds,
                   final PixelBounds sampledBounds,
                   final double y0,
                   final double yF,
                   final double x0,
                   final double xF,
                   final double[][] values) {
        this.mapper = mapper;
        this.bounds = bounds;
        this.sampledBounds = sampledBounds;
        this.y0 = y0;
        this.yF = yF;
        this.x0 = x0;
        this.xF = xF;
        this.values = values;
    }

    public CoordinateMapper getMapper() {
        return mapper;
    }

    public PixelBounds getBounds() {
        return bounds;
    }

    public PixelBounds getSampledBounds() {
        return sampledBounds;
    }

    public double getY0() {
        return y0;
    }

    public double getYF() {
        return yF;
    }

    public double getX0() {
        return x0;
    }

    public double getXF() {
        return xF;
    }

    /**
     * @return (exclusive) end of the evaluated rows, which is yF unless the sampled rows
     *         were clamped, in which case the last sampled row is still evaluated.
     */
    public double getRowStop() {
        return Math.min(yF, Math.nextUp((double) sampledBounds.getMaxRow()));
    }

    /**
     * @return (exclusive) end of the evaluated columns (see {@link #getRowStop()}).
     */
    public double getColumnStop() {
        return Math.min(xF, Math.nextUp((double) sampledBounds.getMaxColumn()));
    }

    public double[][] getValues() {
        return values;
    }

    public double[] getRowIndices() {
        return toDoubles(sampledBounds.getRowIndices());
    }

    public double[] getColumnIndices() {
        return toDoubles(sampledBounds.getColumnIndices());
    }

    @Override
    public String toString() {
        return "{ bounds: " + bounds + ", sampledBounds: " + sampledBounds + ", y: [" + y0 + "," + yF + "), x: [" + x0 + "," + xF + ") }";
    }

    private static double[] toDoubles(final int[] indices) {
        final double[] values = new double[indices.length];
        for (int i = 0; i < indices.length; i++) {
            values[i] = indices[i];
        }
        return values;
    }
}
