package org.janelia.relief.loader;

import ij.ImagePlus;
import ij.io.Opener;

import java.io.File;

import org.janelia.relief.GeoRaster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads global elevation rasters (e.g. the ETOPO1 GeoTIFF) with ImageJ's {@link Opener}.
 * Only the first image band is used, geo-referencing tags are ignored
 * because every raster is assumed to cover the whole globe.
 */
public class GeoRasterLoader {

    /** Shareable instance of this loader. */
    public static final GeoRasterLoader INSTANCE = new GeoRasterLoader();

    /**
     * @throws IllegalArgumentException
     *   if the raster cannot be opened.
     */
    public GeoRaster load(final String path)
            throws IllegalArgumentException {

        final File file = new File(path);
        if (! file.canRead()) {
            throw new IllegalArgumentException("raster " + file.getAbsolutePath() + " is not readable");
        }

        LOG.info("load: entry, path={}", file.getAbsolutePath());

        // openers keep state about the file being opened, so we need to create a new opener for each load
        final Opener opener = new Opener();
        opener.setSilentMode(true);

        final ImagePlus imagePlus;
        try {
            imagePlus = opener.openImage(file.getAbsolutePath());
        } catch (final Throwable t) {
            throw new IllegalArgumentException(getErrorMessage(path), t);
        }

        if (imagePlus == null) {
            throw new IllegalArgumentException(getErrorMessage(path));
        }

        final GeoRaster raster = new GeoRaster(imagePlus.getProcessor(), imagePlus.getCalibration());

        LOG.info("load: exit, loaded {}", raster);

        return raster;
    }

    private String getErrorMessage(final String path) {
        return "failed to create imagePlus instance for '" + path + "'";
    }

    private static final Logger LOG = LoggerFactory.getLogger(GeoRasterLoader.class);
}
