package org.janelia.relief.sample;

/**
 * This exception is thrown when a sub-grid has too few samples for a cubic spline fit.
 */
public class InsufficientSamplesException
        extends SamplingException {

    public InsufficientSamplesException(final String message) {
        super(Stage.RESAMPLING, message);
    }
}
