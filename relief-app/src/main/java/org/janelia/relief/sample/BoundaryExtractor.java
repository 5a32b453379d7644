package org.janelia.relief.sample;

import java.util.ArrayList;
import java.util.List;

import org.janelia.relief.spec.Boundary;
import org.janelia.relief.spec.Quad;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives the bounding {@link Quad} of a polygon {@link Boundary}.
 * The quad is the axis-aligned box of the vertices, not the true polygon extent,
 * and no closure or self-intersection checks are made.
 */
public class BoundaryExtractor {

    public static final int MIN_VERTEX_COUNT = 3;

    private BoundaryExtractor() {
    }

    /**
     * @return the bounding quad of the specified boundary's vertices.
     *
     * @throws MalformedBoundaryException
     *   if the boundary has fewer than {@link #MIN_VERTEX_COUNT} vertices
     *   or any vertex coordinate is missing or not finite.
     */
    public static Quad extract(final Boundary boundary)
            throws MalformedBoundaryException {

        if (boundary == null) {
            throw new MalformedBoundaryException("boundary is not defined");
        }

        final int vertexCount = boundary.getVertexCount();
        if (vertexCount < MIN_VERTEX_COUNT) {
            throw new MalformedBoundaryException("boundary has " + vertexCount + " vertices but at least " +
                                                 MIN_VERTEX_COUNT + " are required");
        }

        double latMin = Double.POSITIVE_INFINITY;
        double latMax = Double.NEGATIVE_INFINITY;
        double lonMin = Double.POSITIVE_INFINITY;
        double lonMax = Double.NEGATIVE_INFINITY;

        int i = 0;
        for (final double[] vertex : boundary.getVertices()) {

            if ((vertex == null) || (vertex.length < 2)) {
                throw new MalformedBoundaryException("vertex " + i + " does not have longitude and latitude values");
            }

            final double lon = vertex[0];
            final double lat = vertex[1];
            if ((! Double.isFinite(lon)) || (! Double.isFinite(lat))) {
                throw new MalformedBoundaryException("vertex " + i + " has non-numeric coordinates (" +
                                                     lon + ", " + lat + ")");
            }

            latMin = Math.min(latMin, lat);
            latMax = Math.max(latMax, lat);
            lonMin = Math.min(lonMin, lon);
            lonMax = Math.max(lonMax, lon);
            i++;
        }

        final Quad quad = new Quad(latMin, latMax, lonMin, lonMax);

        LOG.debug("extract: derived quad between {} from {} vertices", quad, vertexCount);

        return quad;
    }

    /**
     * Parses KML style coordinates text where each vertex is a comma separated
     * "longitude,latitude[,altitude]" tuple and tuples are separated by whitespace.
     *
     * @throws MalformedBoundaryException
     *   if the text is empty or any tuple cannot be parsed.
     */
    public static Boundary parseCoordinates(final String coordinatesText)
            throws MalformedBoundaryException {

        final String trimmedText = coordinatesText == null ? "" : coordinatesText.trim();
        if (trimmedText.isEmpty()) {
            throw new MalformedBoundaryException("coordinates text is empty");
        }

        final String[] tuples = trimmedText.split("\\s+");
        final List<double[]> vertices = new ArrayList<>(tuples.length);
        for (final String tuple : tuples) {
            final String[] values = tuple.split(",");
            if (values.length < 2) {
                throw new MalformedBoundaryException("coordinate tuple '" + tuple +
                                                     "' does not contain longitude and latitude values");
            }
            try {
                vertices.add(new double[] { Double.parseDouble(values[0]), Double.parseDouble(values[1]) });
            } catch (final NumberFormatException e) {
                throw new MalformedBoundaryException("coordinate tuple '" + tuple + "' is not numeric", e);
            }
        }

        return new Boundary(vertices);
    }

    private static final Logger LOG = LoggerFactory.getLogger(BoundaryExtractor.class);
}
