package org.janelia.relief.spline;

import org.apache.commons.math3.analysis.interpolation.BivariateGridInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.exception.NoDataException;
import org.apache.commons.math3.exception.NonMonotonicSequenceException;
import org.apache.commons.math3.exception.NumberIsTooSmallException;

/**
 * Generates a {@link BicubicSplineFunction bicubic interpolating function} on a rectilinear grid.
 * <p>
 * The surface is the tensor product of not-a-knot cubic splines:
 * a spline along the second axis is fitted for every first axis sample and,
 * at evaluation time, those splines are combined with a spline along the first axis.
 * The result passes through every grid sample exactly and matches the bicubic
 * B-spline interpolant with knots placed at the interior sample coordinates.
 * </p>
 */
public class BicubicSplineInterpolator
        implements BivariateGridInterpolator {

    /**
     * @param  xval  strictly increasing first axis coordinates (at least 4).
     * @param  yval  strictly increasing second axis coordinates (at least 4).
     * @param  fval  grid values indexed as [x index][y index].
     */
    @Override
    public BicubicSplineFunction interpolate(final double[] xval,
                                             final double[] yval,
                                             final double[][] fval)
            throws NoDataException, DimensionMismatchException,
                   NonMonotonicSequenceException, NumberIsTooSmallException {

        if (xval.length == 0 || yval.length == 0 || fval.length == 0) {
            throw new NoDataException();
        }
        if (xval.length != fval.length) {
            throw new DimensionMismatchException(xval.length, fval.length);
        }

        final KnotSystem xKnots = new KnotSystem(xval);
        final KnotSystem yKnots = new KnotSystem(yval);

        final PolynomialSplineFunction[] ySplines = new PolynomialSplineFunction[xval.length];
        for (int i = 0; i < xval.length; i++) {
            ySplines[i] = yKnots.fit(fval[i]);
        }

        return new BicubicSplineFunction(xKnots, ySplines);
    }

}
