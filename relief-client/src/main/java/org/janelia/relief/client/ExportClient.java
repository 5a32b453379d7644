package org.janelia.relief.client;

import com.beust.jcommander.Parameter;

import ij.ImagePlus;
import ij.process.ColorProcessor;

import java.io.IOException;

import org.janelia.relief.Utils;
import org.janelia.relief.client.parameter.CommandLineParameters;
import org.janelia.relief.color.ReliefColorizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Java client for exporting a resampled elevation TIFF as a colorized PNG.
 * Elevations below sea level are shaded from black to blue,
 * elevations above it from green to white.
 */
public class ExportClient {

    public static class Parameters extends CommandLineParameters {

        @Parameter(
                names = "--tif",
                description = "Path of the elevation TIFF to export",
                required = true)
        public String tif;

        @Parameter(
                names = "--png",
                description = "Path for the exported PNG.  Omit to use the TIFF path with a .png extension")
        public String png;

        public String getPngPath() {
            return png == null ? Utils.replaceExtension(tif, Utils.PNG_FORMAT) : png;
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

                final ExportClient client = new ExportClient(parameters);
                client.export();
            }
        };
        clientRunner.run();
    }

    private final Parameters parameters;

    public ExportClient(final Parameters parameters) {
        this.parameters = parameters;
    }

    /**
     * @return the colorized image that was saved.
     *
     * @throws IllegalArgumentException
     *   if the TIFF cannot be opened.
     *
     * @throws IOException
     *   if the PNG cannot be written.
     */
    public ColorProcessor export()
            throws IllegalArgumentException, IOException {

        final ImagePlus elevations = Utils.openImagePlus(parameters.tif);

        final ColorProcessor colorized = new ReliefColorizer().colorize(elevations.getProcessor());

        Utils.saveImage(colorized.getBufferedImage(), parameters.getPngPath());

        LOG.info("export: exported {} [px] x {} [px] to {}",
                 colorized.getHeight(), colorized.getWidth(), parameters.getPngPath());

        return colorized;
    }

    private static final Logger LOG = LoggerFactory.getLogger(ExportClient.class);
}
