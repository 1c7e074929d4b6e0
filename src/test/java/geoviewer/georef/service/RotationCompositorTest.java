package geoviewer.georef.service;

import static org.junit.jupiter.api.Assertions.*;

import geoviewer.georef.model.FeatureGeometry;
import geoviewer.georef.model.GeoRaster;
import geoviewer.georef.model.PixelBuffer;
import geoviewer.georef.model.RotationState;
import geoviewer.georef.utilities.GeoTransform;
import geoviewer.georef.utilities.TransformationFunctions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;

import java.awt.geom.Point2D;
import java.nio.file.Path;
import java.util.List;

/**
 * Unit tests for RotationCompositor.
 *
 * <p>Tests focus on:
 * <ul>
 *   <li>Pivot selection order</li>
 *   <li>Rasters and vectors rotating in lock-step</li>
 *   <li>Repeated application of the same angle</li>
 *   <li>Unreferenced rasters left out of the frame</li>
 * </ul>
 */
class RotationCompositorTest {

    private static final double TOLERANCE = 1e-6;

    private final RotationCompositor compositor = new RotationCompositor();

    // 100 x 100 pixels of 10 m, upper-left corner at (200000, 701000)
    private static GeoRaster orthophoto() {
        GeoTransform transform = new GeoTransform(10, 0, 0, -10, 200000, 701000);
        return GeoRaster.georeferenced(PixelBuffer.filled(100, 100, 128), transform, "EPSG:2039",
                Path.of("ortho.jpg"));
    }

    private static GeoRaster scan() {
        return GeoRaster.unreferenced(PixelBuffer.filled(40, 30, 0), Path.of("scan.png"));
    }

    // ==================== Pivot Tests ====================

    @Test
    @DisplayName("Pivot is the center of the first georeferenced raster")
    void testPivotFromRaster() {
        Point2D.Double pivot = compositor.pivotFor(List.of(scan(), orthophoto()),
                List.of(FeatureGeometry.point(0, 0)));

        assertEquals(200500, pivot.x, TOLERANCE);
        assertEquals(700500, pivot.y, TOLERANCE);
    }

    @Test
    @DisplayName("Without a georeferenced raster the pivot is the vector center")
    void testPivotFromVectors() {
        Point2D.Double pivot = compositor.pivotFor(List.of(scan()),
                List.of(FeatureGeometry.point(10, 20), FeatureGeometry.point(30, 60)));

        assertEquals(20, pivot.x, TOLERANCE);
        assertEquals(40, pivot.y, TOLERANCE);
    }

    @Test
    @DisplayName("Nothing georeferenced rotates about the origin")
    void testPivotOrigin() {
        Point2D.Double pivot = compositor.pivotFor(List.of(), List.of());

        assertEquals(0, pivot.x);
        assertEquals(0, pivot.y);
    }

    // ==================== Composite Tests ====================

    @Test
    @DisplayName("Rotated raster pixel and rotated vector point coincide")
    void testLockStep() {
        GeoRaster raster = orthophoto();
        GeoTransform canonical = raster.getTransform().orElseThrow();
        Point2D.Double world = canonical.apply(12.5, 70.5);
        FeatureGeometry marker = FeatureGeometry.point(world.x, world.y);
        RotationState state = new RotationState(33, compositor.pivotFor(List.of(raster), List.of(marker)));

        CompositeFrame frame = compositor.composite(state, List.of(raster), List.of(marker));

        Point2D.Double rasterPixel = frame.rasterTransforms().get(raster).apply(12.5, 70.5);
        Point2D.Double vectorPoint = frame.rotatedGeometries().get(0).representativePoint();
        assertEquals(rasterPixel.x, vectorPoint.x, TOLERANCE);
        assertEquals(rasterPixel.y, vectorPoint.y, TOLERANCE);

        double[] viaOperator = new double[2];
        frame.vectorOperator().transform(new double[]{world.x, world.y}, 0, viaOperator, 0, 1);
        assertEquals(vectorPoint.x, viaOperator[0], TOLERANCE);
        assertEquals(vectorPoint.y, viaOperator[1], TOLERANCE);
    }

    @Test
    @DisplayName("The pivot stays fixed under rotation")
    void testPivotFixed() {
        GeoRaster raster = orthophoto();
        Point2D.Double pivot = raster.bounds().orElseThrow().getCenter();

        CompositeFrame frame = compositor.composite(new RotationState(77, pivot), List.of(raster), List.of());

        GeoTransform rotated = frame.rasterTransforms().get(raster);
        Point2D.Double center = rotated.apply(50, 50);
        assertEquals(pivot.x, center.x, TOLERANCE);
        assertEquals(pivot.y, center.y, TOLERANCE);
    }

    @Test
    @DisplayName("Compositing the same angle twice gives the same frame")
    void testIdempotent() {
        GeoRaster raster = orthophoto();
        List<FeatureGeometry> geometries = List.of(FeatureGeometry.point(200300, 700400));
        RotationState state = new RotationState(15, new Point2D.Double(200500, 700500));

        CompositeFrame first = compositor.composite(state, List.of(raster), geometries);
        CompositeFrame second = compositor.composite(state, List.of(raster), geometries);

        assertEquals(first.rasterTransforms().get(raster), second.rasterTransforms().get(raster));
        assertEquals(first.rotatedGeometries(), second.rotatedGeometries());
        assertEquals(new GeoTransform(10, 0, 0, -10, 200000, 701000), raster.getTransform().orElseThrow());
    }

    @Test
    @DisplayName("Zero angle leaves transforms and geometries unchanged")
    void testIdentity() {
        GeoRaster raster = orthophoto();
        GeometryFactory factory = new GeometryFactory();
        FeatureGeometry line = FeatureGeometry.of(factory.createLineString(new Coordinate[]{
                new Coordinate(200100, 700100), new Coordinate(200900, 700900)}));

        CompositeFrame frame = compositor.composite(
                new RotationState(0, new Point2D.Double(200500, 700500)), List.of(raster), List.of(line));

        GeoTransform transform = frame.rasterTransforms().get(raster);
        double[] expected = raster.getTransform().orElseThrow().getCoefficients();
        assertArrayEquals(expected, transform.getCoefficients(), TOLERANCE);
        assertSame(line, frame.rotatedGeometries().get(0));
    }

    @Test
    @DisplayName("Unreferenced rasters are not composited")
    void testUnreferencedSkipped() {
        GeoRaster ortho = orthophoto();
        GeoRaster scan = scan();

        CompositeFrame frame = compositor.composite(new RotationState(10, new Point2D.Double(0, 0)),
                List.of(scan, ortho), List.of());

        assertEquals(1, frame.rasterTransforms().size());
        assertTrue(frame.rasterTransforms().containsKey(ortho));
        assertFalse(frame.rasterTransforms().containsKey(scan));
    }

    @Test
    @DisplayName("Changing the returned operator does not change the frame")
    void testOperatorCopy() {
        CompositeFrame frame = compositor.composite(new RotationState(30, new Point2D.Double(1, 1)),
                List.of(), List.of());

        frame.vectorOperator().translate(1000, 1000);

        assertEquals(TransformationFunctions.createRotationTransform(30, new Point2D.Double(1, 1)),
                frame.vectorOperator());
    }
}
