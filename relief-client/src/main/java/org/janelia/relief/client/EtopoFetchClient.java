package org.janelia.relief.client;

import com.beust.jcommander.Parameter;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

import org.apache.commons.io.IOUtils;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.janelia.relief.client.parameter.CommandLineParameters;
import org.janelia.relief.client.response.FileResponseHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Java client for fetching the global relief GeoTIFF used by the {@link SampleClient}.
 * By default this is NOAA's ETOPO1 bedrock (no ice caps), grid-registered dataset.
 * The downloaded archive is written to a store directory, its GeoTIFF entry is extracted
 * next to it, and the archive is then deleted.
 */
public class EtopoFetchClient {

    public static final String DEFAULT_URL =
            "https://ngdc.noaa.gov/mgg/global/relief/ETOPO1/data/bedrock/grid_registered/georeferenced_tiff/" +
            "ETOPO1_Bed_g_geotiff.zip";

    public static class Parameters extends CommandLineParameters {

        @Parameter(
                names = "--url",
                description = "URL of the zip archive containing the relief GeoTIFF")
        public String url = DEFAULT_URL;

        @Parameter(
                names = "--storeDirectory",
                description = "Directory where the relief GeoTIFF should be stored")
        public String storeDirectory = SampleClient.DEFAULT_STORE_DIRECTORY;
    }

    public static void main(final String[] args) {
        final ClientRunner clientRunner = new ClientRunner(args) {
            @Override
            public void runClient(final String[] args) throws Exception {

                final Parameters parameters = new Parameters();
                parameters.parse(args);

                LOG.info("runClient: entry, parameters={}", parameters);

                final EtopoFetchClient client = new EtopoFetchClient(parameters);
                final File tifFile = client.fetch();

                LOG.info("runClient: topography written to {}", tifFile.getAbsolutePath());
            }
        };
        clientRunner.run();
    }

    private final Parameters parameters;

    public EtopoFetchClient(final Parameters parameters) {
        this.parameters = parameters;
    }

    /**
     * @return the extracted GeoTIFF file.
     *
     * @throws IOException
     *   if the archive cannot be downloaded or extracted.
     */
    public File fetch()
            throws IOException {

        final File storeDirectory = new File(parameters.storeDirectory).getAbsoluteFile();
        FileUtil.ensureWritableDirectory(storeDirectory);

        final String zipName = getArchiveName(parameters.url);
        final File zipFile = new File(storeDirectory, zipName);
        final File tifFile = new File(storeDirectory, getGeoTiffName(zipName));

        download(parameters.url, zipFile);
        extractEntry(zipFile, tifFile.getName(), tifFile);

        if (! zipFile.delete()) {
            LOG.warn("fetch: failed to delete {}", zipFile.getAbsolutePath());
        }

        return tifFile;
    }

    private void download(final String url,
                          final File toFile)
            throws IOException {

        LOG.info("download: entry, url={}", url);

        final HttpGet httpGet = new HttpGet(url);
        final String requestContext = "GET " + url;
        final FileResponseHandler responseHandler = new FileResponseHandler(requestContext, toFile);

        try (final CloseableHttpClient httpClient = HttpClients.createDefault()) {
            httpClient.execute(httpGet, responseHandler);
        }

        LOG.info("download: exit, wrote {} bytes to {}", toFile.length(), toFile.getAbsolutePath());
    }

    /**
     * @return file name component of the specified URL (e.g. "ETOPO1_Bed_g_geotiff.zip").
     */
    public static String getArchiveName(final String url) {
        final int queryIndex = url.indexOf('?');
        final String path = queryIndex > -1 ? url.substring(0, queryIndex) : url;
        return path.substring(path.lastIndexOf('/') + 1);
    }

    /**
     * @return name of the GeoTIFF entry within the specified archive (e.g. "ETOPO1_Bed_g_geotiff.tif").
     */
    public static String getGeoTiffName(final String archiveName) {
        return archiveName.replace(".zip", ".tif");
    }

    /**
     * Copies the named entry from a zip archive to the specified file.
     *
     * @throws IOException
     *   if the archive cannot be read, does not contain the entry, or the file cannot be written.
     */
    public static void extractEntry(final File zipFile,
                                    final String entryName,
                                    final File toFile)
            throws IOException {

        try (final ZipFile archive = new ZipFile(zipFile)) {

            final ZipEntry entry = archive.getEntry(entryName);
            if (entry == null) {
                throw new IOException("entry " + entryName + " not found in " + zipFile.getAbsolutePath());
            }

            try (final InputStream in = archive.getInputStream(entry);
                 final OutputStream out = new FileOutputStream(toFile)) {
                IOUtils.copyLarge(in, out);
            }
        }

        LOG.info("extractEntry: extracted {} from {}", toFile.getAbsolutePath(), zipFile.getAbsolutePath());
    }

    private static final Logger LOG = LoggerFactory.getLogger(EtopoFetchClient.class);
}
