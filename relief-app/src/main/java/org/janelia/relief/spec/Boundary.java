package org.janelia.relief.spec;

import java.io.Reader;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.janelia.relief.json.JsonUtils;

/**
 * Ordered polygon vertices, each stored as a [longitude, latitude] pair in degrees.
 * Only the vertex extrema matter for sampling, the polygon shape itself is ignored.
 */
public class Boundary implements Serializable {

    private final List<double[]> vertices;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private Boundary() {
        this.vertices = new ArrayList<>();
    }

    public Boundary(final List<double[]> vertices) {
        this.vertices = new ArrayList<>(vertices);
    }

    public static Boundary fromLonLatPairs(final double... lonLatPairs) {
        final List<double[]> list = new ArrayList<>(lonLatPairs.length / 2);
        for (int i = 1; i < lonLatPairs.length; i += 2) {
            list.add(new double[] { lonLatPairs[i - 1], lonLatPairs[i] });
        }
        return new Boundary(list);
    }

    public List<double[]> getVertices() {
        return Collections.unmodifiableList(vertices);
    }

    public int getVertexCount() {
        return vertices.size();
    }

    public double getLongitude(final int index) {
        return vertices.get(index)[0];
    }

    public double getLatitude(final int index) {
        return vertices.get(index)[1];
    }

    @Override
    public String toString() {
        return "{ vertexCount: " + vertices.size() + " }";
    }

    public String toJson() {
        return JSON_HELPER.toJson(this);
    }

    public static Boundary fromJson(final Reader json) {
        return JSON_HELPER.fromJson(json);
    }

    public static Boundary fromJson(final String json) {
        return JSON_HELPER.fromJson(json);
    }

    private static final JsonUtils.Helper<Boundary> JSON_HELPER =
            new JsonUtils.Helper<>(Boundary.class);
}
