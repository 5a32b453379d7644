package org.janelia.relief.color;

import ij.process.ColorProcessor;
import ij.process.ImageProcessor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies a {@link ColorMap} to every pixel of an elevation raster.
 * The raster's own minimum and maximum values are passed to the map as the elevation range.
 */
public class ReliefColorizer {

    private final ColorMap colorMap;

    public ReliefColorizer() {
        this(DefaultColorMap.INSTANCE);
    }

    public ReliefColorizer(final ColorMap colorMap) {
        this.colorMap = colorMap;
    }

    /**
     * @param  elevations  elevation values (e.g. a 32-bit float raster).
     *
     * @return 8-bit per channel RGB image with the same dimensions as the source.
     */
    public ColorProcessor colorize(final ImageProcessor elevations) {

        final int width = elevations.getWidth();
        final int height = elevations.getHeight();

        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                final double value = elevations.getf(x, y);
                min = Math.min(min, value);
                max = Math.max(max, value);
            }
        }

        LOG.debug("colorize: mapping {} x {} pixels with elevation range [{}, {}]", width, height, min, max);

        final ColorProcessor rgbProcessor = new ColorProcessor(width, height);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                final float[] rgb = colorMap.toRgb(elevations.getf(x, y), min, max);
                rgbProcessor.set(x, y, toPackedRgb(rgb));
            }
        }

        return rgbProcessor;
    }

    /**
     * @return packed 0xRRGGBB value where each [0, 1] intensity is scaled by 255 and truncated.
     */
    static int toPackedRgb(final float[] rgb) {
        final int red = toByte(rgb[0]);
        final int green = toByte(rgb[1]);
        final int blue = toByte(rgb[2]);
        return (red << 16) | (green << 8) | blue;
    }

    private static int toByte(final float intensity) {
        return Math.max(0, Math.min(255, (int) (intensity * 255)));
    }

    private static final Logger LOG = LoggerFactory.getLogger(ReliefColorizer.class);
}
