package org.janelia.relief.client;

import com.beust.jcommander.Parameter;

import java.io.File;
import java.io.IOException;

import org.janelia.relief.GeoRaster;
import org.janelia.relief.ReliefSampler;
import org.janelia.relief.ResampledRaster;
import org.janelia.relief.Utils;
import org.janelia.relief.client.parameter.CommandLineParameters;
import org.janelia.relief.loader.BoundaryLoader;
import org.janelia.relief.loader.GeoRasterLoader;
import org.janelia.relief.sample.SamplingException;
import org.janelia.relief.spec.Boundary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Java client for sampling the region of a global relief raster bounded by a KML (or JSON) polygon.
 * The resampled elevations are saved as a 32-bit TIFF along with a JSON file describing their
 * geographic extent and density:
 * <pre>
 *   [output].tif
 *   [output].json
 * </pre>
 */
public class SampleClient {

    public static final String DEFAULT_STORE_DIRECTORY = "store";

    public static final String DEFAULT_RASTER_PATH = DEFAULT_STORE_DIRECTORY + "/ETOPO1_Bed_g_geotiff.tif";

    public static class Parameters extends CommandLineParameters {

        @Parameter(
                names = "--boundary",
                description = "Path of KML (or .json) file containing the boundary polygon",
                required = true)
        public String boundary;

        @Parameter(
                names = "--pointsPerDegree",
                description = "Number of output samples per degree of latitude and longitude")
        public Double pointsPerDegree = ReliefSampler.DEFAULT_POINTS_PER_DEGREE;

        @Parameter(
                names = "--raster",
                description = "Path of the global relief raster to sample")
        public String raster = DEFAULT_RASTER_PATH;

        @Parameter(
                names = "--output",
                description = "Path for the resampled TIFF.  Omit to use the boundary path with a .tif extension")
        public String output;

        @Parameter(
                names = "--numberOfThreads",
                description = "Number of threads to use for spline evaluation")
        public Integer numberOfThreads = 1;

        public String getOutputPath() {
            return output == null ? Utils.replaceExtension(boundary, Utils.TIF_FORMAT) : output;
        }
    }

    /**
     * @param  args  see {@link Parameters} for command line argument details.
     */
    public static void main(final String[] args) {
        final ClientRunner clientRunner = new ClientRunner(args) {
            @Override
            public void runClient(final String[] args) throws Exception {

                final Parameters parameters = new Parameters();
                parameters.parse(args);

                LOG.info("runClient: entry, parameters={}", parameters);

                final SampleClient client = new SampleClient(parameters);
                client.sampleAndSave();
            }
        };
        clientRunner.run();
    }

    private final Parameters parameters;

    public SampleClient(final Parameters parameters) {
        this.parameters = parameters;
    }

    /**
     * Loads the boundary and raster, samples the bounded region, and saves the result.
     *
     * @return the saved raster.
     *
     * @throws SamplingException
     *   if any sampling stage fails (nothing is written in that case).
     */
    public ResampledRaster sampleAndSave()
            throws SamplingException, InterruptedException, IOException {

        final Boundary boundary = BoundaryLoader.forPath(parameters.boundary).load(parameters.boundary);
        final GeoRaster raster = GeoRasterLoader.INSTANCE.load(parameters.raster);

        final ResampledRaster resampled = sample(boundary, raster);

        save(resampled);

        return resampled;
    }

    /**
     * @return the boundary's region of the raster resampled at the configured density.
     */
    public ResampledRaster sample(final Boundary boundary,
                                  final GeoRaster raster)
            throws SamplingException, InterruptedException {

        final ReliefSampler sampler = new ReliefSampler(parameters.pointsPerDegree,
                                                        parameters.numberOfThreads);

        final ResampledRaster resampled = sampler.sample(boundary, raster);

        LOG.info("sample: final resolution is {} [px] x {} [px]",
                 resampled.getRowCount(), resampled.getColumnCount());

        return resampled;
    }

    private void save(final ResampledRaster resampled)
            throws IOException {

        final String outputPath = parameters.getOutputPath();
        final File outputFile = new File(outputPath).getAbsoluteFile();

        Utils.saveTiff(resampled.toImagePlus(outputFile.getName()), outputFile.getAbsolutePath());

        final File metadataFile = new File(FileUtil.getMetadataPath(outputFile.getAbsolutePath()));
        resampled.getMetadata().saveJson(metadataFile);

        LOG.info("save: wrote {} and {}", outputFile.getAbsolutePath(), metadataFile.getAbsolutePath());
    }

    private static final Logger LOG = LoggerFactory.getLogger(SampleClient.class);
}
