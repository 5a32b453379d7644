package org.janelia.relief;

import org.janelia.relief.sample.InsufficientSamplesException;
import org.janelia.relief.sample.MalformedBoundaryException;
import org.janelia.relief.sample.OutOfBoundsException;
import org.janelia.relief.sample.SamplingException;
import org.janelia.relief.spec.Boundary;
import org.janelia.relief.spec.Quad;
import org.janelia.relief.spec.RasterMetadata;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link ReliefSampler} class.
 */
public class ReliefSamplerTest {

    @Test
    public void testSample() throws Exception {

        final GeoRaster raster = buildLinearRaster(180, 360);
        final Boundary boundary = Boundary.fromLonLatPairs(30.0, 10.0, 40.0, 10.0, 40.0, 20.0, 30.0, 20.0);

        final ReliefSampler sampler = new ReliefSampler(1.0);
        final ResampledRaster resampled = sampler.sample(boundary, raster);

        Assert.assertEquals("invalid row count", 10, resampled.getRowCount());
        Assert.assertEquals("invalid column count", 10, resampled.getColumnCount());
        Assert.assertEquals("invalid point count", 100, resampled.getPointCount());

        // northwest corner is raster row 70 and column 210
        Assert.assertEquals("invalid first sample", elevation(70, 210), resampled.getSample(0, 0), 1e-3);
        Assert.assertEquals("invalid last sample", elevation(79, 219), resampled.getSample(9, 9), 1e-3);

        final RasterMetadata metadata = resampled.getMetadata();
        Assert.assertEquals("invalid extent", new Quad(11.0, 20.0, 30.0, 39.0), metadata.getExtent());
        Assert.assertEquals("invalid density", 1.0, metadata.getPointsPerDegree(), 0.0);
    }

    @Test
    public void testSouthPoleAndAntimeridian() throws Exception {

        final GeoRaster raster = buildLinearRaster(180, 360);

        final ResampledRaster resampled = new ReliefSampler(1.0).sample(new Quad(-90.0, -80.0, 170.0, 180.0), raster);

        Assert.assertEquals("invalid row count", 10, resampled.getRowCount());
        Assert.assertEquals("invalid column count", 10, resampled.getColumnCount());
        Assert.assertEquals("invalid first sample", elevation(170, 350), resampled.getSample(0, 0), 1e-3);
        Assert.assertEquals("invalid last sample", elevation(179, 359), resampled.getSample(9, 9), 1e-3);
        Assert.assertEquals("invalid extent", new Quad(-89.0, -80.0, 170.0, 179.0), resampled.getExtent());
    }

    @Test
    public void testNorthPoleAndWesternEdge() throws Exception {

        final GeoRaster raster = buildLinearRaster(180, 360);

        final ResampledRaster resampled = new ReliefSampler(2.0).sample(new Quad(80.0, 90.0, -180.0, -170.0), raster);

        Assert.assertEquals("invalid row count", 20, resampled.getRowCount());
        Assert.assertEquals("invalid column count", 20, resampled.getColumnCount());
        Assert.assertEquals("invalid first sample", elevation(0, 0), resampled.getSample(0, 0), 1e-3);
        Assert.assertEquals("invalid extent", new Quad(80.5, 90.0, -180.0, -170.5), resampled.getExtent());
    }

    @Test
    public void testDefaultDensity() throws Exception {

        final GeoRaster raster = buildLinearRaster(180, 360);
        final ReliefSampler sampler = new ReliefSampler();
        final ResampledRaster resampled = sampler.sample(new Quad(10.0, 13.0, 30.0, 33.0), raster);

        Assert.assertEquals("invalid default density",
                            ReliefSampler.DEFAULT_POINTS_PER_DEGREE, sampler.getPointsPerDegree(), 0.0);
        Assert.assertEquals("invalid row count", 150, resampled.getRowCount());
        Assert.assertEquals("invalid column count", 150, resampled.getColumnCount());
    }

    @Test
    public void testParallelSamplingMatchesSequential() throws Exception {

        final GeoRaster raster = buildWavyRaster(180, 360);
        final Quad quad = new Quad(-12.5, -3.25, 100.75, 112.0);

        final ResampledRaster sequential = new ReliefSampler(7.0, 1).sample(quad, raster);
        final ResampledRaster parallel = new ReliefSampler(7.0, 4).sample(quad, raster);

        Assert.assertEquals("row counts differ", sequential.getRowCount(), parallel.getRowCount());
        Assert.assertEquals("column counts differ", sequential.getColumnCount(), parallel.getColumnCount());
        for (int row = 0; row < sequential.getRowCount(); row++) {
            for (int column = 0; column < sequential.getColumnCount(); column++) {
                Assert.assertEquals("sample (" + row + ", " + column + ") differs",
                                    sequential.getSample(row, column), parallel.getSample(row, column), 0.0);
            }
        }
    }

    @Test
    public void testStageFailures() throws Exception {

        final GeoRaster raster = buildLinearRaster(180, 360);
        final ReliefSampler sampler = new ReliefSampler(1.0);

        validateFailure(sampler, Boundary.fromLonLatPairs(30.0, 10.0, 40.0, 20.0), raster,
                        MalformedBoundaryException.class, SamplingException.Stage.BOUNDARY);

        validateFailure(sampler, Boundary.fromLonLatPairs(190.0, 10.0, 200.0, 10.0, 200.0, 20.0), raster,
                        OutOfBoundsException.class, SamplingException.Stage.BOUNDS);

        validateFailure(sampler, Boundary.fromLonLatPairs(30.0, 10.0, 31.0, 10.0, 31.0, 11.0), raster,
                        InsufficientSamplesException.class, SamplingException.Stage.RESAMPLING);
    }

    private void validateFailure(final ReliefSampler sampler,
                                 final Boundary boundary,
                                 final GeoRaster raster,
                                 final Class<? extends SamplingException> expectedClass,
                                 final SamplingException.Stage expectedStage)
            throws InterruptedException {
        try {
            sampler.sample(boundary, raster);
            Assert.fail("sampling should have failed in " + expectedStage + " stage");
        } catch (final SamplingException e) {
            Assert.assertEquals("invalid exception class", expectedClass, e.getClass());
            Assert.assertEquals("invalid stage", expectedStage, e.getStage());
            Assert.assertTrue("message should identify stage", e.getMessage().startsWith(expectedStage.toString()));
        }
    }

    private static double elevation(final double row,
                                    final double column) {
        return 2.0 * row - column;
    }

    private static GeoRaster buildLinearRaster(final int rowCount,
                                               final int columnCount) {
        final double[][] rows = new double[rowCount][columnCount];
        for (int row = 0; row < rowCount; row++) {
            for (int column = 0; column < columnCount; column++) {
                rows[row][column] = elevation(row, column);
            }
        }
        return GeoRaster.fromArray(rows);
    }

    private static GeoRaster buildWavyRaster(final int rowCount,
                                             final int columnCount) {
        final double[][] rows = new double[rowCount][columnCount];
        for (int row = 0; row < rowCount; row++) {
            for (int column = 0; column < columnCount; column++) {
                rows[row][column] = 3000.0 * Math.sin(row / 7.0) * Math.cos(column / 11.0) - 1500.0;
            }
        }
        return GeoRaster.fromArray(rows);
    }

}
