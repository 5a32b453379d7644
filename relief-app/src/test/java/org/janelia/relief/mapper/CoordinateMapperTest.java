package org.janelia.relief.mapper;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link CoordinateMapper} class.
 */
public class CoordinateMapperTest {

    @Test
    public void testExtentCorners() {
        final CoordinateMapper mapper = new CoordinateMapper(10800, 21600);

        Assert.assertEquals("invalid north pole row", 0.0, mapper.toRow(90.0), 0.0);
        Assert.assertEquals("invalid south pole row", 10800.0, mapper.toRow(-90.0), 0.0);
        Assert.assertEquals("invalid western column", 0.0, mapper.toColumn(-180.0), 0.0);
        Assert.assertEquals("invalid eastern column", 21600.0, mapper.toColumn(180.0), 0.0);
    }

    @Test
    public void testWholeDegreesMapToWholePixels() {
        final CoordinateMapper mapper = new CoordinateMapper(180, 360);
        for (int lat = -90; lat <= 90; lat++) {
            final double row = mapper.toRow(lat);
            Assert.assertEquals("row for latitude " + lat + " is not integral", Math.rint(row), row, 0.0);
        }
        for (int lon = -180; lon <= 180; lon++) {
            final double column = mapper.toColumn(lon);
            Assert.assertEquals("column for longitude " + lon + " is not integral", Math.rint(column), column, 0.0);
        }
        Assert.assertEquals("invalid column for 40 degrees", 220.0, mapper.toColumn(40.0), 0.0);
    }

    @Test
    public void testRoundTripMapping() {
        final CoordinateMapper mapper = new CoordinateMapper(10801, 21601);

        final double[][] locations = {
                { 33.34, -118.33 }, { -45.5, 170.25 }, { 0.0, 0.0 }, { 89.99, -179.99 }
        };

        for (final double[] location : locations) {
            final double[] pixel = mapper.toPixel(location[0], location[1]);
            final double[] geo = mapper.toGeo(pixel[0], pixel[1]);
            Assert.assertEquals("invalid latitude for " + pixel[0], location[0], geo[0], 1e-9);
            Assert.assertEquals("invalid longitude for " + pixel[1], location[1], geo[1], 1e-9);
        }
    }

    @Test
    public void testClamp() {
        final CoordinateMapper mapper = new CoordinateMapper(180, 360);
        Assert.assertEquals("south pole row should be clamped", 179, mapper.clampRow(mapper.toRow(-90.0)));
        Assert.assertEquals("negative row should be clamped", 0, mapper.clampRow(-0.5));
        Assert.assertEquals("antimeridian column should be clamped", 359, mapper.clampColumn(mapper.toColumn(180.0)));
        Assert.assertEquals("interior column should be floored", 210, mapper.clampColumn(210.7));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEmptyRaster() {
        new CoordinateMapper(0, 360);
    }

}
