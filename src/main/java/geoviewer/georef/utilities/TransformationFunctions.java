package geoviewer.georef.utilities;

import org.locationtech.jts.geom.util.AffineTransformation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.geom.AffineTransform;
import java.awt.geom.Point2D;
import java.util.ArrayList;
import java.util.List;

/**
 * TransformationFunctions - shared rotation and point-mapping helpers.
 *
 * <p>Coordinate systems:
 * <ul>
 *   <li><b>Pixel:</b> column/row of the raster, origin at the outer corner of the upper-left pixel</li>
 *   <li><b>World:</b> the raster's CRS (e.g. Israeli grid metres)</li>
 *   <li><b>Draw:</b> world coordinates after the shared view rotation</li>
 * </ul>
 *
 * <p>Transform chain:
 * <pre>
 * Pixel --GeoTransform--> World --rotation about pivot--> Draw
 * </pre>
 *
 * @since 0.1.0
 */
public class TransformationFunctions {
    private static final Logger logger = LoggerFactory.getLogger(TransformationFunctions.class);

    private TransformationFunctions() {
    }

    /**
     * Creates a counter-clockwise rotation about a world point.
     *
     * @param angleDegrees Rotation angle in degrees
     * @param pivot Point held fixed; the origin when null
     * @return a new rotation transform
     */
    public static AffineTransform createRotationTransform(double angleDegrees, Point2D pivot) {
        double px = pivot != null ? pivot.getX() : 0.0;
        double py = pivot != null ? pivot.getY() : 0.0;
        return AffineTransform.getRotateInstance(Math.toRadians(angleDegrees), px, py);
    }

    /**
     * Applies a transform to a single [x, y] coordinate.
     *
     * @param coords Coordinates [x, y]
     * @param transform Transform to apply
     * @return transformed coordinates [x, y]
     */
    public static double[] transformPoint(double[] coords, AffineTransform transform) {
        if (coords == null || coords.length != 2) {
            throw new IllegalArgumentException("Coordinates must be [x, y]");
        }

        Point2D.Double src = new Point2D.Double(coords[0], coords[1]);
        Point2D.Double dst = new Point2D.Double();
        transform.transform(src, dst);

        logger.trace("({}, {}) -> ({}, {})", coords[0], coords[1], dst.x, dst.y);
        return new double[]{dst.x, dst.y};
    }

    /**
     * Rotates points about a pivot; the input list is not modified.
     */
    public static List<Point2D.Double> rotatePoints(List<? extends Point2D> points,
                                                    double angleDegrees, Point2D pivot) {
        AffineTransform rotation = createRotationTransform(angleDegrees, pivot);
        List<Point2D.Double> out = new ArrayList<>(points.size());
        for (Point2D p : points) {
            Point2D.Double dst = new Point2D.Double();
            rotation.transform(p, dst);
            out.add(dst);
        }
        return out;
    }

    /**
     * Converts an AWT transform into the JTS equivalent used to move geometry coordinates.
     */
    public static AffineTransformation toJts(AffineTransform transform) {
        return new AffineTransformation(
                transform.getScaleX(), transform.getShearX(), transform.getTranslateX(),
                transform.getShearY(), transform.getScaleY(), transform.getTranslateY());
    }

    /**
     * Maps an angle onto [0, 360) for display.
     */
    public static double normalizeAngle(double angleDegrees) {
        if (!Double.isFinite(angleDegrees)) {
            throw new IllegalArgumentException("Angle must be finite: " + angleDegrees);
        }
        double normalized = angleDegrees % 360.0;
        if (normalized < 0) {
            normalized += 360.0;
        }
        // -0.0 and 360 rounding artefacts
        return normalized == 360.0 ? 0.0 : normalized + 0.0;
    }

    /**
     * Formats transform matrix for readable logging.
     */
    public static String formatTransformMatrix(AffineTransform transform) {
        return String.format("[%.3f, %.3f, %.3f, %.3f, %.3f, %.3f]",
                transform.getScaleX(), transform.getShearX(), transform.getShearY(),
                transform.getScaleY(), transform.getTranslateX(), transform.getTranslateY());
    }
}
