package org.janelia.relief.sample;

import org.janelia.relief.GeoRaster;
import org.janelia.relief.mapper.CoordinateMapper;
import org.janelia.relief.spec.PixelBounds;
import org.janelia.relief.spec.Quad;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Selects the smallest integral sub-grid of a {@link GeoRaster} that encloses a {@link Quad}.
 *
 * The quad corners are mapped to fractional pixel coordinates
 * (latMax maps to the smaller row because rows increase southward).
 * Minimum bounds are floored and maximum bounds are ceiled, giving bounds with
 * 0 &lt;= j0, jF &lt;= J, 0 &lt;= i0 and iF &lt;= I.
 *
 * Rows j0 through jF and columns i0 through iF are sampled so that every target
 * coordinate lies within the sampled grid and the fitted surface never needs to be
 * extrapolated.  A quad touching the south pole or the antimeridian maps to jF = J
 * or iF = I, so the last sampled row or column is clamped into the raster and the
 * target range is cut at that row or column (see {@link Subgrid#getRowStop()}).
 */
public class SubgridExtractor {

    private SubgridExtractor() {
    }

    /**
     * @throws OutOfBoundsException
     *   if the quad extends beyond the raster's geographic extent.
     */
    public static Subgrid extract(final Quad quad,
                                  final GeoRaster raster)
            throws OutOfBoundsException {

        final CoordinateMapper mapper = raster.getMapper();

        final double y0 = mapper.toRow(quad.getLatMax());
        final double yF = mapper.toRow(quad.getLatMin());
        final double x0 = mapper.toColumn(quad.getLonMin());
        final double xF = mapper.toColumn(quad.getLonMax());

        final PixelBounds bounds = PixelBounds.enclosing(y0, yF, x0, xF);

        final int rowCount = raster.getRowCount();
        final int columnCount = raster.getColumnCount();

        validate("j0", bounds.getMinRow(), quad.getLatMax(), 0, rowCount - 1);
        validate("jF", bounds.getMaxRow(), quad.getLatMin(), 0, rowCount);
        validate("i0", bounds.getMinColumn(), quad.getLonMin(), 0, columnCount - 1);
        validate("iF", bounds.getMaxColumn(), quad.getLonMax(), 0, columnCount);

        final PixelBounds sampledBounds = new PixelBounds(bounds.getMinRow(),
                                                          mapper.clampRow(bounds.getMaxRow()),
                                                          bounds.getMinColumn(),
                                                          mapper.clampColumn(bounds.getMaxColumn()));

        final int[] rows = sampledBounds.getRowIndices();
        final int[] columns = sampledBounds.getColumnIndices();
        final double[][] values = new double[rows.length][columns.length];
        for (int j = 0; j < rows.length; j++) {
            for (int i = 0; i < columns.length; i++) {
                values[j][i] = raster.getSample(rows[j], columns[i]);
            }
        }

        final Subgrid subgrid = new Subgrid(mapper, bounds, sampledBounds, y0, yF, x0, xF, values);

        LOG.debug("extract: extracted {} for quad between {}", subgrid, quad);

        return subgrid;
    }

    private static void validate(final String boundName,
                                 final int index,
                                 final double degrees,
                                 final int min,
                                 final int max)
            throws OutOfBoundsException {
        if ((index < min) || (index > max)) {
            throw new OutOfBoundsException(boundName + " index " + index + " derived from " + degrees +
                                           " degrees is outside the raster range [" + min + "," + max + "]");
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(SubgridExtractor.class);
}
