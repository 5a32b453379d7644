package org.janelia.relief.color;

/**
 * Colors negative elevations from black (at the raster minimum) to blue (at sea level)
 * and non-negative elevations from green (at sea level) to white (at the raster maximum).
 */
public class DefaultColorMap
        implements ColorMap {

    /** Shareable instance of this map. */
    public static final DefaultColorMap INSTANCE = new DefaultColorMap();

    @Override
    public float[] toRgb(final double elevation,
                         final double min,
                         final double max) {
        final float[] rgb;
        if (elevation < 0) {
            final float pct = fraction(min, 0, elevation);
            rgb = new float[] { 0.0f, 0.0f, pct };
        } else {
            final float pct = fraction(0, max, elevation);
            rgb = new float[] { pct, 1.0f, pct };
        }
        return rgb;
    }

    /**
     * @return relative position of value within [from, to], clamped to [0, 1] (0 for an empty range).
     */
    static float fraction(final double from,
                          final double to,
                          final double value) {
        final double range = to - from;
        if (range == 0) {
            return 0.0f;
        }
        final double pct = (value - from) / range;
        return (float) Math.max(0.0, Math.min(1.0, pct));
    }
}
