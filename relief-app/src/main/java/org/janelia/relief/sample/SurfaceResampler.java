package org.janelia.relief.sample;

import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.janelia.relief.ResampledRaster;
import org.janelia.relief.mapper.CoordinateMapper;
import org.janelia.relief.spec.Quad;
import org.janelia.relief.spline.BicubicSplineFunction;
import org.janelia.relief.spline.BicubicSplineInterpolator;
import org.janelia.relief.spline.KnotSystem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fits a bicubic interpolating spline to a {@link Subgrid} and evaluates it
 * on a regular grid with a fixed number of points per degree.
 *
 * Output rows start at the subgrid's first fractional target row and stop before its last,
 * stepping by one over the density.  Columns are handled the same way.
 */
public class SurfaceResampler {

    public static final int MIN_SAMPLES_PER_AXIS = KnotSystem.MIN_KNOT_COUNT;

    private final double pointsPerDegree;
    private final int numberOfThreads;

    public SurfaceResampler(final double pointsPerDegree) {
        this(pointsPerDegree, 1);
    }

    /**
     * @throws IllegalArgumentException
     *   if the density is not a positive finite number.
     */
    public SurfaceResampler(final double pointsPerDegree,
                            final int numberOfThreads)
            throws IllegalArgumentException {

        if ((! Double.isFinite(pointsPerDegree)) || (pointsPerDegree <= 0)) {
            throw new IllegalArgumentException("points per degree must be positive but is " + pointsPerDegree);
        }

        this.pointsPerDegree = pointsPerDegree;
        this.numberOfThreads = Math.max(1, numberOfThreads);
    }

    public double getPointsPerDegree() {
        return pointsPerDegree;
    }

    /**
     * @throws InsufficientSamplesException
     *   if the subgrid has fewer than {@link #MIN_SAMPLES_PER_AXIS} samples along either axis
     *   or the target range produces an empty output grid.
     *
     * @throws InterruptedException
     *   if multi-threaded evaluation is interrupted.
     */
    public ResampledRaster resample(final Subgrid subgrid)
            throws InsufficientSamplesException, InterruptedException {

        final double[] rowIndices = subgrid.getRowIndices();
        final double[] columnIndices = subgrid.getColumnIndices();

        if ((rowIndices.length < MIN_SAMPLES_PER_AXIS) || (columnIndices.length < MIN_SAMPLES_PER_AXIS)) {
            throw new InsufficientSamplesException(
                    "subgrid " + subgrid.getBounds() + " has " + rowIndices.length + " rows and " +
                    columnIndices.length + " columns but a cubic fit requires at least " +
                    MIN_SAMPLES_PER_AXIS + " samples along each axis");
        }

        final CoordinateMapper mapper = subgrid.getMapper();

        final double step = 1.0 / pointsPerDegree;

        final double[] ys = arange(subgrid.getY0(), subgrid.getRowStop(), step);
        final double[] xs = arange(subgrid.getX0(), subgrid.getColumnStop(), step);

        if ((ys.length == 0) || (xs.length == 0)) {
            throw new InsufficientSamplesException(
                    "target range " + subgrid + " produces an empty " + ys.length + " x " + xs.length +
                    " grid at " + pointsPerDegree + " points per degree");
        }

        LOG.debug("resample: fitting {} x {} samples for {} x {} output grid",
                  rowIndices.length, columnIndices.length, ys.length, xs.length);

        final BicubicSplineFunction surface;
        try {
            surface = new BicubicSplineInterpolator().interpolate(rowIndices, columnIndices, subgrid.getValues());
        } catch (final MathIllegalArgumentException e) {
            throw new SamplingException(SamplingException.Stage.RESAMPLING,
                                        "failed to fit spline to subgrid " + subgrid.getBounds(), e);
        }

        final double[][] values = surface.valueGrid(ys, xs, numberOfThreads);

        final Quad extent = new Quad(mapper.toLatitude(ys[ys.length - 1]),
                                     mapper.toLatitude(ys[0]),
                                     mapper.toLongitude(xs[0]),
                                     mapper.toLongitude(xs[xs.length - 1]));

        return ResampledRaster.fromArray(values, extent, pointsPerDegree);
    }

    /**
     * @return evenly spaced values within the half-open interval [start, stop).
     */
    public static double[] arange(final double start,
                                  final double stop,
                                  final double step) {
        int count = (int) Math.max(0, Math.ceil((stop - start) / step));
        // rounding in the division can add a value at (or just past) stop
        while ((count > 0) && (start + (count - 1) * step >= stop)) {
            count--;
        }
        final double[] values = new double[count];
        for (int k = 0; k < count; k++) {
            values[k] = start + k * step;
        }
        return values;
    }

    private static final Logger LOG = LoggerFactory.getLogger(SurfaceResampler.class);
}
