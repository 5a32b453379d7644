package org.janelia.relief.loader;

import java.io.File;
import java.io.IOException;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.janelia.relief.sample.BoundaryExtractor;
import org.janelia.relief.sample.MalformedBoundaryException;
import org.janelia.relief.spec.Boundary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

/**
 * Loads the vertices of the first <code>Polygon</code> element in a KML document.
 * Element lookups ignore namespaces so that both KML 2.2 and un-namespaced documents work.
 */
public class KmlPolygonLoader
        implements BoundaryLoader {

    /** Shareable instance of this loader. */
    public static final KmlPolygonLoader INSTANCE = new KmlPolygonLoader();

    @Override
    public Boundary load(final String path)
            throws IllegalArgumentException, MalformedBoundaryException {

        final Document document;
        try {
            final DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            final DocumentBuilder builder = factory.newDocumentBuilder();
            document = builder.parse(new File(path));
        } catch (final ParserConfigurationException | IOException e) {
            throw new IllegalArgumentException("failed to read KML from " + path, e);
        } catch (final SAXException e) {
            throw new MalformedBoundaryException("failed to parse KML from " + path, e);
        }

        final NodeList polygons = document.getElementsByTagNameNS("*", "Polygon");
        if (polygons.getLength() == 0) {
            throw new MalformedBoundaryException("no Polygon element found in " + path);
        }

        final Element polygon = (Element) polygons.item(0);
        final NodeList coordinates = polygon.getElementsByTagNameNS("*", "coordinates");
        if (coordinates.getLength() == 0) {
            throw new MalformedBoundaryException("first Polygon element in " + path + " has no coordinates");
        }

        final Boundary boundary = BoundaryExtractor.parseCoordinates(coordinates.item(0).getTextContent());

        LOG.debug("load: loaded {} vertices from {}", boundary.getVertexCount(), path);

        return boundary;
    }

    private static final Logger LOG = LoggerFactory.getLogger(KmlPolygonLoader.class);
}
