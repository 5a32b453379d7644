package org.janelia.relief.sample;

/**
 * This exception is thrown when a quad extends beyond the geographic extent of a raster.
 */
public class OutOfBoundsException
        extends SamplingException {

    public OutOfBoundsException(final String message) {
        super(Stage.BOUNDS, message);
    }
}
