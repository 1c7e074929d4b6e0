package geoviewer.georef.utilities;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.awt.geom.AffineTransform;
import java.awt.geom.Point2D;
import java.util.List;

/**
 * Unit tests for GeoTransform.
 *
 * <p>Tests focus on:
 * <ul>
 *   <li>Half-pixel correction from world files</li>
 *   <li>Four-corner bounds of rotated rasters</li>
 *   <li>Rotation composition and its idempotence</li>
 *   <li>Rejection of degenerate transforms</li>
 * </ul>
 */
class GeoTransformTest {

    private static final double TOLERANCE = 1e-9;

    private static GeoTransform exampleTransform() {
        return GeoTransform.fromWorldFile(new WorldFileRecord(10, 0, 0, -10, 200005, 700005));
    }

    // ==================== World File Conversion Tests ====================

    @Test
    @DisplayName("Half-pixel correction moves the origin to the outer corner")
    void testHalfPixelCorrection() {
        GeoTransform transform = exampleTransform();

        assertEquals(200000.0, transform.getX0(), TOLERANCE);
        assertEquals(700010.0, transform.getY0(), TOLERANCE);
        assertEquals(10.0, transform.getA());
        assertEquals(-10.0, transform.getE());
    }

    @Test
    @DisplayName("Center of the upper-left pixel maps back to the world file C, F")
    void testPixelCenterRoundTrip() {
        GeoTransform transform = exampleTransform();

        Point2D.Double center = transform.apply(0.5, 0.5);

        assertEquals(200005.0, center.x, TOLERANCE);
        assertEquals(700005.0, center.y, TOLERANCE);
    }

    @Test
    @DisplayName("Rotation terms enter the half-pixel correction")
    void testHalfPixelWithRotationTerms() {
        // A=2, D=1, B=0.5, E=-3, C=100, F=50
        GeoTransform transform = GeoTransform.fromWorldFile(new WorldFileRecord(2, 1, 0.5, -3, 100, 50));

        assertEquals(100 - 0.5 * 2 - 0.5 * 0.5, transform.getX0(), TOLERANCE);
        assertEquals(50 - 0.5 * 1 - 0.5 * -3, transform.getY0(), TOLERANCE);
        assertEquals(0.5, transform.getB());
        assertEquals(1.0, transform.getD());

        Point2D.Double center = transform.apply(0.5, 0.5);
        assertEquals(100.0, center.x, TOLERANCE);
        assertEquals(50.0, center.y, TOLERANCE);
    }

    // ==================== Bounds Tests ====================

    @Test
    @DisplayName("Axis-aligned raster bounds match the example")
    void testAxisAlignedBounds() {
        BoundingBox bounds = exampleTransform().bounds(100, 100);

        assertEquals(200000.0, bounds.getMinX(), TOLERANCE);
        assertEquals(201000.0, bounds.getMaxX(), TOLERANCE);
        assertEquals(699010.0, bounds.getMinY(), TOLERANCE);
        assertEquals(700010.0, bounds.getMaxY(), TOLERANCE);
    }

    @Test
    @DisplayName("45 degree raster: four-corner bounds differ from two-corner bounds")
    void testRotatedBoundsUseAllCorners() {
        double c = Math.cos(Math.toRadians(45));
        GeoTransform transform = new GeoTransform(c, -c, c, c, 0, 0);

        List<Point2D.Double> corners = transform.footprint(100, 100);
        BoundingBox fourCorner = transform.bounds(100, 100);
        BoundingBox twoCorner = BoundingBox.enclosing(List.of(corners.get(0), corners.get(2)));

        assertNotEquals(twoCorner, fourCorner);
        assertEquals(100 * c * 2, fourCorner.getHeight(), 1e-6);
        assertEquals(0.0, twoCorner.getWidth(), 1e-6);
        assertEquals(-100 * c, fourCorner.getMinX(), 1e-6);
        assertEquals(100 * c, fourCorner.getMaxX(), 1e-6);
    }

    @Test
    @DisplayName("Footprint corners are in (0,0), (w,0), (w,h), (0,h) order")
    void testFootprintOrder() {
        List<Point2D.Double> corners = exampleTransform().footprint(100, 50);

        assertEquals(new Point2D.Double(200000, 700010), corners.get(0));
        assertEquals(new Point2D.Double(201000, 700010), corners.get(1));
        assertEquals(new Point2D.Double(201000, 699510), corners.get(2));
        assertEquals(new Point2D.Double(200000, 699510), corners.get(3));
    }

    // ==================== Inverse Tests ====================

    @ParameterizedTest
    @CsvSource({
            "0, 0",
            "12.5, 77.25",
            "100, 100",
            "-3, 250"
    })
    @DisplayName("Inverse maps world coordinates back to pixels")
    void testInverse(double col, double row) {
        GeoTransform transform = new GeoTransform(0.5, 0.2, -0.1, -0.5, 1000, 2000);

        Point2D.Double world = transform.apply(col, row);
        Point2D.Double pixel = transform.inverse(world.x, world.y);

        assertEquals(col, pixel.x, 1e-9);
        assertEquals(row, pixel.y, 1e-9);
    }

    // ==================== Degenerate Transform Tests ====================

    @Test
    @DisplayName("Zero pixel size is rejected")
    void testZeroPixelSizeRejected() {
        WorldFileRecord record = new WorldFileRecord(0, 0, 0, -10, 200005, 700005);

        assertThrows(DegenerateTransformException.class, () -> GeoTransform.fromWorldFile(record));
    }

    @Test
    @DisplayName("Collinear pixel axes are rejected")
    void testCollinearAxesRejected() {
        assertThrows(DegenerateTransformException.class, () -> new GeoTransform(1, 2, 2, 4, 0, 0));
    }

    @ParameterizedTest
    @ValueSource(doubles = {Double.NaN, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY})
    @DisplayName("Non-finite coefficients are rejected")
    void testNonFiniteRejected(double bad) {
        assertThrows(DegenerateTransformException.class, () -> new GeoTransform(1, 0, 0, -1, bad, 0));
        assertThrows(DegenerateTransformException.class, () -> new GeoTransform(bad, 0, 0, -1, 0, 0));
    }

    @Test
    @DisplayName("DegenerateTransformException is an IllegalArgumentException")
    void testExceptionType() {
        assertTrue(IllegalArgumentException.class.isAssignableFrom(DegenerateTransformException.class));
    }

    // ==================== Rotation Tests ====================

    @Test
    @DisplayName("Rotation keeps the pivot fixed and leaves the original untouched")
    void testComposeRotationAboutPivot() {
        GeoTransform transform = exampleTransform();
        Point2D.Double pivot = transform.bounds(100, 100).getCenter();

        GeoTransform rotated = transform.composeRotation(90, pivot);

        // Pixel that maps to the pivot still maps there
        Point2D.Double pivotPixel = transform.inverse(pivot.x, pivot.y);
        Point2D.Double moved = rotated.apply(pivotPixel.x, pivotPixel.y);
        assertEquals(pivot.x, moved.x, 1e-6);
        assertEquals(pivot.y, moved.y, 1e-6);

        assertEquals(200000.0, transform.getX0(), TOLERANCE);
        assertNotEquals(transform, rotated);
    }

    @Test
    @DisplayName("Positive angles rotate counter-clockwise")
    void testCounterClockwise() {
        GeoTransform identity = new GeoTransform(1, 0, 0, 1, 0, 0);

        Point2D.Double p = identity.composeRotation(90, new Point2D.Double(0, 0)).apply(1, 0);

        assertEquals(0.0, p.x, 1e-12);
        assertEquals(1.0, p.y, 1e-12);
    }

    @Test
    @DisplayName("Rotation composes as R * T")
    void testRotationOrder() {
        GeoTransform transform = new GeoTransform(2, 0, 0, -3, 10, 20);
        Point2D.Double pivot = new Point2D.Double(5, 5);

        GeoTransform rotated = transform.composeRotation(30, pivot);

        AffineTransform expected = AffineTransform.getRotateInstance(Math.toRadians(30), 5, 5);
        Point2D.Double world = transform.apply(7, 3);
        Point2D.Double expectedPoint = new Point2D.Double();
        expected.transform(world, expectedPoint);
        Point2D.Double actual = rotated.apply(7, 3);
        assertEquals(expectedPoint.x, actual.x, 1e-9);
        assertEquals(expectedPoint.y, actual.y, 1e-9);
    }

    @Test
    @DisplayName("Recomputing the same angle 1000 times does not drift")
    void testRotationIdempotent() {
        GeoTransform canonical = exampleTransform();
        Point2D.Double pivot = canonical.bounds(100, 100).getCenter();

        GeoTransform first = canonical.composeRotation(37.5, pivot);
        GeoTransform latest = first;
        for (int i = 0; i < 1000; i++) {
            latest = canonical.composeRotation(37.5, pivot);
        }

        assertArrayEquals(first.getCoefficients(), latest.getCoefficients(), 0.0);
    }

    @Test
    @DisplayName("Four accumulated quarter turns return to the canonical placement")
    void testFullTurnReturnsToCanonical() {
        GeoTransform canonical = exampleTransform();
        Point2D.Double pivot = canonical.bounds(100, 100).getCenter();

        GeoTransform accumulated = canonical;
        for (int i = 0; i < 4; i++) {
            accumulated = accumulated.composeRotation(90, pivot);
        }

        assertArrayEquals(canonical.getCoefficients(), accumulated.getCoefficients(), 1e-6);
    }

    // ==================== Conversion Tests ====================

    @Test
    @DisplayName("AWT conversion keeps every coefficient in place")
    void testAffineTransformConversion() {
        GeoTransform transform = new GeoTransform(1.5, 0.25, -0.75, -2.0, 300, 400);

        AffineTransform awt = transform.toAffineTransform();

        assertEquals(1.5, awt.getScaleX());
        assertEquals(0.25, awt.getShearX());
        assertEquals(-0.75, awt.getShearY());
        assertEquals(-2.0, awt.getScaleY());
        assertEquals(300.0, awt.getTranslateX());
        assertEquals(400.0, awt.getTranslateY());
        assertEquals(transform, GeoTransform.fromAffineTransform(awt));
    }

    @Test
    @DisplayName("Determinant is a*e - b*d")
    void testDeterminant() {
        assertEquals(-100.0, exampleTransform().getDeterminant(), TOLERANCE);
    }
}
