package org.janelia.relief.client;

import java.io.File;

import org.janelia.relief.Utils;

/**
 * File system helpers shared by the command line clients.
 */
public class FileUtil {

    public static final String JSON_EXTENSION = "json";

    private FileUtil() {
    }

    /**
     * Creates the specified directory (and any missing parents) if it does not already exist.
     *
     * @throws IllegalArgumentException
     *   if the directory cannot be created or is not writable.
     */
    public static void ensureWritableDirectory(final File directory)
            throws IllegalArgumentException {
        // try twice to work around concurrent access issues
        if (! directory.exists()) {
            if (! directory.mkdirs()) {
                if (! directory.exists()) {
                    throw new IllegalArgumentException("failed to create " + directory);
                }
            }
        }
        if (! directory.isDirectory()) {
            throw new IllegalArgumentException(directory + " is not a directory");
        }
        if (! directory.canWrite()) {
            throw new IllegalArgumentException("not allowed to write to " + directory);
        }
    }

    /**
     * @return path of the metadata file written next to the specified raster
     *         (e.g. "out/catalina.json" for "out/catalina.tif").
     */
    public static String getMetadataPath(final String rasterPath) {
        return Utils.replaceExtension(rasterPath, JSON_EXTENSION);
    }

}
