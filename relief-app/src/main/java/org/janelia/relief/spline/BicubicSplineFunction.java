package org.janelia.relief.spline;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.apache.commons.math3.analysis.BivariateFunction;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import org.apache.commons.math3.exception.OutOfRangeException;

/**
 * Tensor product of not-a-knot cubic splines created by {@link BicubicSplineInterpolator}.
 * Evaluation outside the sampled grid is rejected with an {@link OutOfRangeException}.
 */
public class BicubicSplineFunction
        implements BivariateFunction {

    private final KnotSystem xKnots;
    private final PolynomialSplineFunction[] ySplines;

    /**
     * @param  xKnots    factored first axis knots.
     * @param  ySplines  second axis spline for each first axis knot.
     */
    BicubicSplineFunction(final KnotSystem xKnots,
                          final PolynomialSplineFunction[] ySplines) {
        this.xKnots = xKnots;
        this.ySplines = ySplines;
    }

    @Override
    public double value(final double x,
                        final double y)
            throws OutOfRangeException {
        return xKnots.fit(valuesAt(y)).value(x);
    }

    /**
     * Evaluates this function at every (x, y) combination of the specified coordinates.
     *
     * @return values indexed as [x index][y index].
     *
     * @throws OutOfRangeException
     *   if any coordinate lies outside the sampled grid.
     */
    public double[][] valueGrid(final double[] xs,
                                final double[] ys)
            throws OutOfRangeException {
        final double[][] grid = new double[xs.length][ys.length];
        for (int b = 0; b < ys.length; b++) {
            fillColumn(xs, ys[b], b, grid);
        }
        return grid;
    }

    /**
     * Evaluates the grid with second axis columns distributed across a pool of threads.
     * Each column is computed independently and written to its own slot,
     * so the result is identical to {@link #valueGrid(double[], double[])}.
     *
     * @throws OutOfRangeException
     *   if any coordinate lies outside the sampled grid.
     *
     * @throws InterruptedException
     *   if evaluation is interrupted.
     */
    public double[][] valueGrid(final double[] xs,
                                final double[] ys,
                                final int numberOfThreads)
            throws OutOfRangeException, InterruptedException {

        if ((numberOfThreads < 2) || (ys.length < 2)) {
            return valueGrid(xs, ys);
        }

        final double[][] grid = new double[xs.length][ys.length];

        final ExecutorService exec = Executors.newFixedThreadPool(numberOfThreads);
        try {
            final List<Future<?>> futures = new ArrayList<>(ys.length);
            for (int b = 0; b < ys.length; b++) {
                final int columnIndex = b;
                futures.add(exec.submit(() -> fillColumn(xs, ys[columnIndex], columnIndex, grid)));
            }

            for (final Future<?> future : futures) {
                future.get();
            }

        } catch (final ExecutionException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("failed to evaluate spline grid", cause);
        } finally {
            exec.shutdownNow();
        }

        return grid;
    }

    public double getMinX() {
        return xKnots.getFirstKnot();
    }

    public double getMaxX() {
        return xKnots.getLastKnot();
    }

    public double getMinY() {
        return ySplines[0].getKnots()[0];
    }

    public double getMaxY() {
        final double[] knots = ySplines[0].getKnots();
        return knots[knots.length - 1];
    }

    private double[] valuesAt(final double y) {
        final double[] values = new double[ySplines.length];
        for (int i = 0; i < ySplines.length; i++) {
            values[i] = ySplines[i].value(y);
        }
        return values;
    }

    private void fillColumn(final double[] xs,
                            final double y,
                            final int columnIndex,
                            final double[][] grid) {
        final PolynomialSplineFunction xSpline = xKnots.fit(valuesAt(y));
        for (int a = 0; a < xs.length; a++) {
            grid[a][columnIndex] = xSpline.value(xs[a]);
        }
    }
}
