package org.janelia.relief.color;

/**
 * Maps an elevation to an RGB triplet.
 */
@FunctionalInterface
public interface ColorMap {

    /**
     * @param  elevation  elevation to map (meters).
     * @param  min        lowest elevation of the raster being colored.
     * @param  max        highest elevation of the raster being colored.
     *
     * @return red, green, and blue intensities, each within [0, 1].
     */
    float[] toRgb(final double elevation,
                  final double min,
                  final double max);

}
