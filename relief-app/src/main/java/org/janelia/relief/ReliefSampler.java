package org.janelia.relief;

import org.janelia.relief.sample.BoundaryExtractor;
import org.janelia.relief.sample.SamplingException;
import org.janelia.relief.sample.Subgrid;
import org.janelia.relief.sample.SubgridExtractor;
import org.janelia.relief.sample.SurfaceResampler;
import org.janelia.relief.spec.Boundary;
import org.janelia.relief.spec.Quad;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Samples the region of a {@link GeoRaster} bounded by a polygon {@link Boundary}
 * at a fixed number of points per degree.
 *
 * The pipeline runs in a single pass:
 * boundary -> quad -> pixel bounds -> sub-grid -> fitted surface -> resampled raster.
 * Any stage failure is reported as a {@link SamplingException} and aborts the whole invocation.
 * Instances hold only configuration, so one sampler can be reused for any number of rasters.
 */
public class ReliefSampler {

    /** Default output density. */
    public static final double DEFAULT_POINTS_PER_DEGREE = 50.0;

    private final SurfaceResampler resampler;

    public ReliefSampler() {
        this(DEFAULT_POINTS_PER_DEGREE);
    }

    public ReliefSampler(final double pointsPerDegree) {
        this(pointsPerDegree, 1);
    }

    /**
     * @param  pointsPerDegree  output density.
     * @param  numberOfThreads  number of threads to use for spline evaluation.
     *
     * @throws IllegalArgumentException
     *   if the density is not a positive finite number.
     */
    public ReliefSampler(final double pointsPerDegree,
                         final int numberOfThreads)
            throws IllegalArgumentException {
        this.resampler = new SurfaceResampler(pointsPerDegree, numberOfThreads);
    }

    public double getPointsPerDegree() {
        return resampler.getPointsPerDegree();
    }

    /**
     * @return the boundary's region of the raster resampled at this sampler's density.
     *
     * @throws SamplingException
     *   if the boundary is malformed, its quad lies outside the raster, or too few samples are available.
     *
     * @throws InterruptedException
     *   if multi-threaded evaluation is interrupted.
     */
    public ResampledRaster sample(final Boundary boundary,
                                  final GeoRaster raster)
            throws SamplingException, InterruptedException {

        final Quad quad = BoundaryExtractor.extract(boundary);

        LOG.info("sample: sampling for quad between {} [deg]", quad);

        return sample(quad, raster);
    }

    /**
     * @return the quad's region of the raster resampled at this sampler's density.
     *
     * @throws SamplingException
     *   if the quad lies outside the raster or too few samples are available.
     *
     * @throws InterruptedException
     *   if multi-threaded evaluation is interrupted.
     */
    public ResampledRaster sample(final Quad quad,
                                  final GeoRaster raster)
            throws SamplingException, InterruptedException {

        final Subgrid subgrid = SubgridExtractor.extract(quad, raster);
        final ResampledRaster resampled = resampler.resample(subgrid);

        LOG.info("sample: result sampled at {} [points/degree] for a final resolution of {} [px] x {} [px] ({} points)",
                 resampler.getPointsPerDegree(),
                 resampled.getRowCount(),
                 resampled.getColumnCount(),
                 resampled.getPointCount());

        return resampled;
    }

    private static final Logger LOG = LoggerFactory.getLogger(ReliefSampler.class);
}
