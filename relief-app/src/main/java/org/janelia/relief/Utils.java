package org.janelia.relief;

import ij.ImagePlus;
import ij.io.FileInfo;
import ij.io.FileSaver;
import ij.io.Opener;
import ij.io.TiffEncoder;

import java.awt.image.BufferedImage;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Iterator;
import java.util.Locale;

import javax.imageio.ImageIO;
import javax.imageio.ImageWriter;
import javax.imageio.stream.FileImageOutputStream;
import javax.imageio.stream.ImageOutputStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Image reading and writing utilities.
 */
public class Utils {

    public static final String PNG_FORMAT = "png";
    public static final String TIFF_FORMAT = "tiff";
    public static final String TIF_FORMAT = "tif";

    private Utils() {
    }

    /**
     * Writes the specified image using ImageIO.
     */
    public static void writeImage(final BufferedImage image,
                                  final String format,
                                  final ImageOutputStream outputStream)
            throws IOException {

        final Iterator<ImageWriter> writersForFormat = ImageIO.getImageWritersByFormatName(format);

        if ((writersForFormat != null) && writersForFormat.hasNext()) {
            final ImageWriter writer = writersForFormat.next();
            try {
                writer.setOutput(outputStream);
                writer.write(image);
            } finally {
                writer.dispose();
            }
        } else {
            throw new IOException("no ImageIO writers exist for the '" + format + "' format");
        }
    }

    /**
     * Writes {@link FileInfo} to the specified {@link OutputStream} using ImageJ's {@link TiffEncoder}.
     *
     * @param  fileInfo          file information (including pixels).
     * @param  outputStream      target stream.
     *
     * @throws IOException
     *   if any errors occur.
     */
    public static void writeTiffImage(final FileInfo fileInfo,
                                      final OutputStream outputStream)
            throws IOException {
        final TiffEncoder tiffEncoder = new TiffEncoder(fileInfo);
        tiffEncoder.write(outputStream);
    }

    public static File prepareFileForWrite(final String path) {
        final File file = new File(path).getAbsoluteFile();

        final File parentDirectory = file.getParentFile();
        if ((parentDirectory != null) && (!parentDirectory.exists())) {
            if (!parentDirectory.mkdirs()) {
                // check for existence again in case another parallel process already created the directory
                if (! parentDirectory.exists()) {
                    throw new IllegalArgumentException("failed to create directory " +
                                                       parentDirectory.getAbsolutePath());
                }
            }
        }

        return file;
    }

    /**
     * Saves the specified image (typically 32-bit float elevations) to a TIFF file
     * using ImageJ's {@link TiffEncoder}.
     */
    public static void saveTiff(final ImagePlus imagePlus,
                                final String path)
            throws IOException {

        final File file = prepareFileForWrite(path);

        final FileInfo fileInfo = imagePlus.getFileInfo();
        final FileSaver fileSaver = new FileSaver(imagePlus);
        fileInfo.description = fileSaver.getDescriptionString();

        try (final FileOutputStream outputStream = new FileOutputStream(file)) {
            writeTiffImage(fileInfo, outputStream);
        }

        LOG.info("saveTiff: exit, saved {}", file.getAbsolutePath());
    }

    /**
     * Saves the specified image to a file using ImageIO (or ImageJ for TIFF formats).
     * The format is derived from the path's extension.
     */
    public static void saveImage(final BufferedImage image,
                                 final String path)
            throws IOException {

        final String format = getExtension(path);

        if (TIFF_FORMAT.equals(format) || TIF_FORMAT.equals(format)) {

            saveTiff(new ImagePlus("", image), path);

        } else {

            final File file = prepareFileForWrite(path);
            try (final FileImageOutputStream outputStream = new FileImageOutputStream(file)) {
                writeImage(image, format, outputStream);
            }

            LOG.info("saveImage: exit, saved {}", file.getAbsolutePath());
        }
    }

    /**
     * Open an ImagePlus from a file.
     *
     * @throws IllegalArgumentException
     *   if the file cannot be opened.
     */
    public static ImagePlus openImagePlus(final String path)
            throws IllegalArgumentException {
        final Opener opener = new Opener();
        opener.setSilentMode(true);
        final ImagePlus imagePlus = opener.openImage(path);
        if (imagePlus == null) {
            throw new IllegalArgumentException("failed to open image '" + path + "'");
        }
        return imagePlus;
    }

    /**
     * @return lower case extension of the specified path (without the dot) or an empty string.
     */
    public static String getExtension(final String path) {
        final int dotIndex = path.lastIndexOf('.');
        final int separatorIndex = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        return dotIndex > separatorIndex ? path.substring(dotIndex + 1).toLowerCase(Locale.US) : "";
    }

    /**
     * @return the specified path with its extension replaced (or appended if it has none).
     *         For example, replaceExtension("a/b.kml", "tif") returns "a/b.tif".
     */
    public static String replaceExtension(final String path,
                                          final String extension) {
        final int dotIndex = path.lastIndexOf('.');
        final int separatorIndex = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        final String base = dotIndex > separatorIndex ? path.substring(0, dotIndex) : path;
        return base + "." + extension;
    }

    private static final Logger LOG = LoggerFactory.getLogger(Utils.class);
}
