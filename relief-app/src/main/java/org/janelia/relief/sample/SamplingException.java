package org.janelia.relief.sample;

/**
 * This exception class serves as the base class for all failures of the sampling pipeline.
 * Each failure identifies the pipeline {@link Stage} that detected it.
 */
public class SamplingException
        extends RuntimeException {

    public enum Stage {
        /** Boundary parsing and quad extraction. */
        BOUNDARY,
        /** Mapping of the quad onto raster pixel bounds. */
        BOUNDS,
        /** Spline fitting and evaluation. */
        RESAMPLING
    }

    private final Stage stage;

    public SamplingException(final Stage stage,
                             final String message) {
        this(stage, message, null);
    }

    public SamplingException(final Stage stage,
                             final String message,
                             final Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public Stage getStage() {
        return stage;
    }

    @Override
    public String getMessage() {
        return stage + " stage failed: " + super.getMessage();
    }
}
