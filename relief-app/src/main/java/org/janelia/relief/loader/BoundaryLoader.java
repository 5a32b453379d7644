package org.janelia.relief.loader;

import java.util.Locale;

import org.janelia.relief.sample.MalformedBoundaryException;
import org.janelia.relief.spec.Boundary;

/**
 * Describes methods required for all boundary loaders and
 * provides convenience {@link #build} and {@link #forPath} methods to construct loader instances.
 */
public interface BoundaryLoader {

    enum LoaderType {
        KML_POLYGON, JSON
    }

    /**
     * @return boundary vertices read from the specified file.
     *
     * @throws IllegalArgumentException
     *   if the file cannot be read.
     *
     * @throws MalformedBoundaryException
     *   if the file does not contain a parseable boundary.
     */
    Boundary load(final String path)
            throws IllegalArgumentException, MalformedBoundaryException;

    /**
     * @return loader instance for the specified type (null type returns the KML loader).
     */
    static BoundaryLoader build(final LoaderType loaderType) {

        BoundaryLoader loader = KmlPolygonLoader.INSTANCE;

        if (loaderType != null) {
            switch (loaderType) {
                case KML_POLYGON:
                    break;
                case JSON:
                    loader = JsonBoundaryLoader.INSTANCE;
                    break;
            }
        }

        return loader;
    }

    /**
     * @return loader instance appropriate for the specified file's extension
     *         (.json files are loaded as JSON, everything else as KML).
     */
    static BoundaryLoader forPath(final String path) {
        final LoaderType loaderType = path.toLowerCase(Locale.US).endsWith(".json") ?
                                      LoaderType.JSON : LoaderType.KML_POLYGON;
        return build(loaderType);
    }

}
