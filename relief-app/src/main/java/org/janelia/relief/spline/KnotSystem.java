package org.janelia.relief.spline;

import org.apache.commons.math3.analysis.polynomials.PolynomialFunction;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.exception.NonMonotonicSequenceException;
import org.apache.commons.math3.exception.NumberIsTooSmallException;
import org.apache.commons.math3.exception.util.LocalizedFormats;
import org.apache.commons.math3.util.MathArrays;

/**
 * Factored linear system for not-a-knot cubic spline interpolation over a fixed set of knots.
 *
 * <p>
 * The spline second derivatives M<sub>0</sub> ... M<sub>n-1</sub> satisfy the usual
 * continuity equations at the n-2 interior knots.  The not-a-knot end conditions
 * (continuous third derivative at the second and second-to-last knots) are used to
 * eliminate M<sub>0</sub> and M<sub>n-1</sub>, which leaves a tridiagonal system that
 * only depends on the knot spacing.  That system is factored once here so that
 * many value sets sharing the same knots (e.g. every row of a raster sub-grid)
 * can be fitted in linear time.
 * </p>
 *
 * <p>
 * With four knots the result is the single cubic through all four points.
 * </p>
 */
public class KnotSystem {

    /** Minimum number of knots needed to determine a not-a-knot cubic spline. */
    public static final int MIN_KNOT_COUNT = 4;

    private final double[] knots;
    private final double[] h;

    // Thomas algorithm factors for the reduced system
    private final double[] lower;
    private final double[] upperPrime;
    private final double[] pivot;

    /**
     * @param  knots  strictly increasing knot values.
     *
     * @throws NumberIsTooSmallException
     *   if fewer than {@link #MIN_KNOT_COUNT} knots are specified.
     *
     * @throws NonMonotonicSequenceException
     *   if the knots are not strictly increasing.
     */
    public KnotSystem(final double[] knots)
            throws NumberIsTooSmallException, NonMonotonicSequenceException {

        if (knots.length < MIN_KNOT_COUNT) {
            throw new NumberIsTooSmallException(LocalizedFormats.NUMBER_OF_POINTS,
                                                knots.length, MIN_KNOT_COUNT, true);
        }

        MathArrays.checkOrder(knots);

        this.knots = knots.clone();

        final int n = knots.length;
        this.h = new double[n - 1];
        for (int i = 0; i < h.length; i++) {
            h[i] = knots[i + 1] - knots[i];
        }

        // row k of the reduced system corresponds to interior knot i = k + 1
        final int m = n - 2;
        final double[] diagonal = new double[m];
        final double[] upper = new double[m];
        this.lower = new double[m];

        for (int k = 0; k < m; k++) {
            final int i = k + 1;
            lower[k] = h[i - 1];
            diagonal[k] = 2.0 * (h[i - 1] + h[i]);
            upper[k] = h[i];
        }

        // substitute M0 = ((h0 + h1) * M1 - h0 * M2) / h1
        diagonal[0] += h[0] * (h[0] + h[1]) / h[1];
        upper[0] -= h[0] * h[0] / h[1];
        lower[0] = 0.0;

        // substitute Mn-1 = ((hn-3 + hn-2) * Mn-2 - hn-2 * Mn-3) / hn-3
        final double hLast = h[n - 2];
        final double hPrior = h[n - 3];
        diagonal[m - 1] += hLast * (hPrior + hLast) / hPrior;
        lower[m - 1] -= hLast * hLast / hPrior;
        upper[m - 1] = 0.0;

        this.upperPrime = new double[m];
        this.pivot = new double[m];
        pivot[0] = diagonal[0];
        upperPrime[0] = upper[0] / pivot[0];
        for (int k = 1; k < m; k++) {
            pivot[k] = diagonal[k] - lower[k] * upperPrime[k - 1];
            upperPrime[k] = upper[k] / pivot[k];
        }
    }

    public int getKnotCount() {
        return knots.length;
    }

    public double getFirstKnot() {
        return knots[0];
    }

    public double getLastKnot() {
        return knots[knots.length - 1];
    }

    /**
     * @param  values  function values at each knot.
     *
     * @return the not-a-knot cubic spline that passes through every (knot, value) pair.
     *
     * @throws DimensionMismatchException
     *   if the number of values differs from the number of knots.
     */
    public PolynomialSplineFunction fit(final double[] values)
            throws DimensionMismatchException {

        final int n = knots.length;
        if (values.length != n) {
            throw new DimensionMismatchException(values.length, n);
        }

        final double[] slopes = new double[n - 1];
        for (int i = 0; i < slopes.length; i++) {
            slopes[i] = (values[i + 1] - values[i]) / h[i];
        }

        // forward sweep
        final int m = n - 2;
        final double[] rhsPrime = new double[m];
        rhsPrime[0] = 6.0 * (slopes[1] - slopes[0]) / pivot[0];
        for (int k = 1; k < m; k++) {
            final double rhs = 6.0 * (slopes[k + 1] - slopes[k]);
            rhsPrime[k] = (rhs - lower[k] * rhsPrime[k - 1]) / pivot[k];
        }

        // back substitution into M1 ... Mn-2
        final double[] m2 = new double[n];
        m2[m] = rhsPrime[m - 1];
        for (int k = m - 2; k >= 0; k--) {
            m2[k + 1] = rhsPrime[k] - upperPrime[k] * m2[k + 2];
        }

        m2[0] = ((h[0] + h[1]) * m2[1] - h[0] * m2[2]) / h[1];
        m2[n - 1] = ((h[n - 3] + h[n - 2]) * m2[n - 2] - h[n - 2] * m2[n - 3]) / h[n - 3];

        final PolynomialFunction[] polynomials = new PolynomialFunction[n - 1];
        for (int i = 0; i < polynomials.length; i++) {
            final double[] coefficients = {
                    values[i],
                    slopes[i] - h[i] * (2.0 * m2[i] + m2[i + 1]) / 6.0,
                    m2[i] / 2.0,
                    (m2[i + 1] - m2[i]) / (6.0 * h[i])
            };
            polynomials[i] = new PolynomialFunction(coefficients);
        }

        return new PolynomialSplineFunction(knots, polynomials);
    }

}
