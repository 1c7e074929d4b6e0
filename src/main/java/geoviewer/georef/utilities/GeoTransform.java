package geoviewer.georef.utilities;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.geom.AffineTransform;
import java.awt.geom.NoninvertibleTransformException;
import java.awt.geom.Point2D;
import java.util.Arrays;
import java.util.List;

/**
 * Pixel-to-world affine mapping of a raster.
 *
 * <p>Coefficients follow the pixel-corner convention:
 * <pre>
 * x = a * col + b * row + x0
 * y = d * col + e * row + y0
 * </pre>
 * so {@code apply(0, 0)} is the outer corner of the upper-left pixel, not its center.
 *
 * <p>Instances are immutable values. Every operation that changes the mapping
 * ({@link #composeRotation(double, Point2D)}) returns a new transform. A transform with a
 * zero determinant or a non-finite coefficient cannot be constructed.
 *
 * <p>Composition is delegated to {@link AffineTransform}; {@link #toAffineTransform()} and
 * {@link #fromAffineTransform(AffineTransform)} convert between the two.
 *
 * @since 0.1.0
 */
public final class GeoTransform {
    private static final Logger logger = LoggerFactory.getLogger(GeoTransform.class);

    private final double a;
    private final double b;
    private final double d;
    private final double e;
    private final double x0;
    private final double y0;

    /**
     * Creates a transform from its six coefficients.
     *
     * @throws DegenerateTransformException if the transform is not invertible or a
     *         coefficient is NaN or infinite
     */
    public GeoTransform(double a, double b, double d, double e, double x0, double y0) {
        for (double v : new double[]{a, b, d, e, x0, y0}) {
            if (!Double.isFinite(v)) {
                throw new DegenerateTransformException(String.format(
                        "Transform coefficients must be finite: [%s, %s, %s, %s, %s, %s]",
                        a, b, d, e, x0, y0));
            }
        }
        double det = a * e - b * d;
        if (det == 0.0) {
            throw new DegenerateTransformException(String.format(
                    "Transform is not invertible (zero-area pixel): a=%s, b=%s, d=%s, e=%s", a, b, d, e));
        }
        this.a = a;
        this.b = b;
        this.d = d;
        this.e = e;
        this.x0 = x0;
        this.y0 = y0;
    }

    /**
     * Builds the transform described by a world file.
     *
     * <p>World files place the center of the upper-left pixel; the corner origin is half a
     * pixel back along both pixel axes:
     * <pre>
     * x0 = C - 0.5*A - 0.5*B
     * y0 = F - 0.5*D - 0.5*E
     * </pre>
     */
    public static GeoTransform fromWorldFile(WorldFileRecord record) {
        double a = record.pixelSizeX();
        double b = record.rotationX();
        double d = record.rotationY();
        double e = record.pixelSizeY();
        double x0 = record.upperLeftX() - 0.5 * a - 0.5 * b;
        double y0 = record.upperLeftY() - 0.5 * d - 0.5 * e;
        GeoTransform transform = new GeoTransform(a, b, d, e, x0, y0);
        logger.debug("World file {} -> corner origin ({}, {})", record, x0, y0);
        return transform;
    }

    public static GeoTransform fromAffineTransform(AffineTransform transform) {
        return new GeoTransform(
                transform.getScaleX(), transform.getShearX(),
                transform.getShearY(), transform.getScaleY(),
                transform.getTranslateX(), transform.getTranslateY());
    }

    /**
     * Returns a fresh {@link AffineTransform} with the same mapping.
     */
    public AffineTransform toAffineTransform() {
        // AffineTransform takes m00, m10, m01, m11, m02, m12
        return new AffineTransform(a, d, b, e, x0, y0);
    }

    /**
     * Maps a pixel position (column, row) to world coordinates.
     */
    public Point2D.Double apply(double col, double row) {
        return new Point2D.Double(a * col + b * row + x0, d * col + e * row + y0);
    }

    /**
     * Maps a world position back to fractional pixel coordinates (column, row).
     */
    public Point2D.Double inverse(double x, double y) {
        try {
            Point2D.Double dst = new Point2D.Double();
            toAffineTransform().createInverse().transform(new Point2D.Double(x, y), dst);
            return dst;
        } catch (NoninvertibleTransformException ex) {
            // Unreachable for a constructed instance
            throw new IllegalStateException("Cannot invert transform " + this, ex);
        }
    }

    /**
     * Maps the four pixel-space corners {@code (0,0), (w,0), (w,h), (0,h)} to world
     * coordinates, in that order. After a rotation or shear the result is not
     * axis-aligned.
     */
    public List<Point2D.Double> footprint(int width, int height) {
        return List.of(
                apply(0, 0),
                apply(width, 0),
                apply(width, height),
                apply(0, height));
    }

    /**
     * Axis-aligned world envelope of a {@code width x height} raster, taken over all four
     * footprint corners.
     */
    public BoundingBox bounds(int width, int height) {
        return BoundingBox.enclosing(footprint(width, height));
    }

    /**
     * Rotates the mapping about a world point.
     *
     * <p>The rotation is applied after this transform ({@code R * T}), so pixels are first
     * placed in the world and then rotated. Positive angles are counter-clockwise.
     *
     * @param angleDegrees rotation angle in degrees
     * @param pivot world point held fixed by the rotation
     * @return a new transform; this one is unchanged
     */
    public GeoTransform composeRotation(double angleDegrees, Point2D pivot) {
        AffineTransform rotation = TransformationFunctions.createRotationTransform(angleDegrees, pivot);
        rotation.concatenate(toAffineTransform());
        return fromAffineTransform(rotation);
    }

    public double getDeterminant() {
        return a * e - b * d;
    }

    public double getA() { return a; }
    public double getB() { return b; }
    public double getD() { return d; }
    public double getE() { return e; }
    public double getX0() { return x0; }
    public double getY0() { return y0; }

    /**
     * Coefficients in the order {@code a, b, d, e, x0, y0}.
     */
    public double[] getCoefficients() {
        return new double[]{a, b, d, e, x0, y0};
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GeoTransform other)) return false;
        return Arrays.equals(getCoefficients(), other.getCoefficients());
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(getCoefficients());
    }

    @Override
    public String toString() {
        return TransformationFunctions.formatTransformMatrix(toAffineTransform());
    }
}
