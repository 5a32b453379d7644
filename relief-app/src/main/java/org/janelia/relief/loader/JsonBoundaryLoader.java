package org.janelia.relief.loader;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;

import org.janelia.relief.spec.Boundary;

/**
 * Loads {@link Boundary} JSON documents, e.g. <code>{ "vertices": [ [-118.6, 33.2], ... ] }</code>.
 */
public class JsonBoundaryLoader
        implements BoundaryLoader {

    /** Shareable instance of this loader. */
    public static final JsonBoundaryLoader INSTANCE = new JsonBoundaryLoader();

    @Override
    public Boundary load(final String path)
            throws IllegalArgumentException {
        try (final Reader reader = Files.newBufferedReader(Paths.get(path), StandardCharsets.UTF_8)) {
            return Boundary.fromJson(reader);
        } catch (final IOException e) {
            throw new IllegalArgumentException("failed to read boundary from " + path, e);
        }
    }

}
