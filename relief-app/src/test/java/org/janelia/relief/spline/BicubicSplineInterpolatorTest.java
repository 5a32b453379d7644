package org.janelia.relief.spline;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.exception.OutOfRangeException;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link BicubicSplineInterpolator} and {@link BicubicSplineFunction} classes.
 */
public class BicubicSplineInterpolatorTest {

    @Test
    public void testGridSamplesAreInterpolated() {

        final double[] xval = { 10.0, 11.0, 12.0, 13.0, 14.0 };
        final double[] yval = { 0.0, 1.0, 2.0, 3.0, 4.0, 5.0 };
        final double[][] fval = new double[xval.length][yval.length];
        for (int i = 0; i < xval.length; i++) {
            for (int j = 0; j < yval.length; j++) {
                // arbitrary non-polynomial relief
                fval[i][j] = 100.0 * Math.sin(i * 0.7 + j * j * 0.3) - 25.0 * Math.cos(j);
            }
        }

        final BicubicSplineFunction surface = new BicubicSplineInterpolator().interpolate(xval, yval, fval);

        for (int i = 0; i < xval.length; i++) {
            for (int j = 0; j < yval.length; j++) {
                Assert.assertEquals("invalid value at (" + xval[i] + ", " + yval[j] + ")",
                                    fval[i][j], surface.value(xval[i], yval[j]), 1e-9);
            }
        }

        Assert.assertEquals("invalid min x", 10.0, surface.getMinX(), 0.0);
        Assert.assertEquals("invalid max x", 14.0, surface.getMaxX(), 0.0);
        Assert.assertEquals("invalid min y", 0.0, surface.getMinY(), 0.0);
        Assert.assertEquals("invalid max y", 5.0, surface.getMaxY(), 0.0);
    }

    @Test
    public void testBicubicIsReproduced() {

        final double[] xval = { 0.0, 1.0, 2.0, 3.0, 4.0, 5.0 };
        final double[] yval = { 0.0, 0.5, 1.0, 2.0, 3.0 };

        final BicubicSplineFunction surface =
                new BicubicSplineInterpolator().interpolate(xval, yval, sample(xval, yval));

        final double[] xs = { 0.0, 0.3, 1.7, 2.5, 4.9 };
        final double[] ys = { 0.1, 0.75, 1.5, 2.99 };
        final double[][] grid = surface.valueGrid(xs, ys);

        for (int a = 0; a < xs.length; a++) {
            for (int b = 0; b < ys.length; b++) {
                Assert.assertEquals("invalid value at (" + xs[a] + ", " + ys[b] + ")",
                                    bicubic(xs[a], ys[b]), grid[a][b], 1e-9);
            }
        }
    }

    @Test
    public void testParallelEvaluationMatchesSequential() throws Exception {

        final double[] xval = new double[12];
        final double[] yval = new double[15];
        for (int i = 0; i < xval.length; i++) {
            xval[i] = i;
        }
        for (int j = 0; j < yval.length; j++) {
            yval[j] = j;
        }
        final double[][] fval = new double[xval.length][yval.length];
        for (int i = 0; i < xval.length; i++) {
            for (int j = 0; j < yval.length; j++) {
                fval[i][j] = Math.sqrt(i * 3.0 + j) * ((i + j) % 3 - 1);
            }
        }

        final BicubicSplineFunction surface = new BicubicSplineInterpolator().interpolate(xval, yval, fval);

        final double[] xs = new double[40];
        final double[] ys = new double[50];
        for (int a = 0; a < xs.length; a++) {
            xs[a] = a * 0.25;
        }
        for (int b = 0; b < ys.length; b++) {
            ys[b] = b * 0.25;
        }

        final double[][] sequential = surface.valueGrid(xs, ys);
        final double[][] parallel = surface.valueGrid(xs, ys, 4);

        for (int a = 0; a < xs.length; a++) {
            Assert.assertArrayEquals("row " + a + " differs", sequential[a], parallel[a], 0.0);
        }
    }

    @Test(expected = OutOfRangeException.class)
    public void testEvaluationOutsideGrid() {
        final double[] xval = { 0.0, 1.0, 2.0, 3.0 };
        final double[] yval = { 0.0, 1.0, 2.0, 3.0 };
        final BicubicSplineFunction surface =
                new BicubicSplineInterpolator().interpolate(xval, yval, sample(xval, yval));
        surface.value(1.0, 3.5);
    }

    @Test(expected = DimensionMismatchException.class)
    public void testValueRowMismatch() {
        final double[] xval = { 0.0, 1.0, 2.0, 3.0 };
        final double[] yval = { 0.0, 1.0, 2.0, 3.0 };
        new BicubicSplineInterpolator().interpolate(xval, yval, new double[3][4]);
    }

    private static double[][] sample(final double[] xval,
                                     final double[] yval) {
        final double[][] fval = new double[xval.length][yval.length];
        for (int i = 0; i < xval.length; i++) {
            for (int j = 0; j < yval.length; j++) {
                fval[i][j] = bicubic(xval[i], yval[j]);
            }
        }
        return fval;
    }

    private static double bicubic(final double x,
                                  final double y) {
        return 1.0 + 2.0 * x - y + 0.5 * x * x * y - 0.1 * x * x * x + 0.05 * y * y * y + 0.01 * x * x * x * y * y * y;
    }

}
