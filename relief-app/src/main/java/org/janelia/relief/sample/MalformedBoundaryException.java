package org.janelia.relief.sample;

/**
 * This exception is thrown when a boundary cannot be parsed or has too few vertices.
 */
public class MalformedBoundaryException
        extends SamplingException {

    public MalformedBoundaryException(final String message) {
        super(Stage.BOUNDARY, message);
    }

    public MalformedBoundaryException(final String message,
                                      final Throwable cause) {
        super(Stage.BOUNDARY, message, cause);
    }
}
