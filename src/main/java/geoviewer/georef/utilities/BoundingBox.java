package geoviewer.georef.utilities;

import java.awt.geom.Point2D;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * Represents an axis-aligned rectangle defined by two corner points.
 *
 * <p>This immutable value is used for raster envelopes, feature extents and the visible
 * view window handed to the renderer as axis limits. Corner order does not matter; the
 * min/max accessors normalize it.
 *
 * <h3>Usage Examples</h3>
 * <pre>{@code
 * // Envelope of a rotated raster footprint
 * BoundingBox bounds = BoundingBox.enclosing(transform.footprint(width, height));
 *
 * // Window around a point
 * BoundingBox window = BoundingBox.centeredAt(x, y, 500.0, 500.0);
 * double left = window.getMinX();
 * }</pre>
 *
 * <h3>Constraints</h3>
 * <ul>
 *   <li><strong>No validation:</strong> coordinates are not checked for units or ranges</li>
 *   <li><strong>Coordinate system agnostic:</strong> works with world or pixel units</li>
 *   <li><strong>Immutable:</strong> every transformation returns a new box</li>
 * </ul>
 *
 * @since 0.1.0
 */
public class BoundingBox {
    private final double x1;
    private final double y1;
    private final double x2;
    private final double y2;

    /**
     * Creates a new bounding box from two corner points, given in any order.
     *
     * @param x1 X-coordinate of first corner
     * @param y1 Y-coordinate of first corner
     * @param x2 X-coordinate of second corner
     * @param y2 Y-coordinate of second corner
     */
    public BoundingBox(double x1, double y1, double x2, double y2) {
        this.x1 = x1;
        this.y1 = y1;
        this.x2 = x2;
        this.y2 = y2;
    }

    /**
     * Smallest box containing every point. Callers computing raster bounds must pass all
     * four footprint corners; two opposite corners are not enough once the raster is
     * rotated or sheared.
     *
     * @throws IllegalArgumentException if no points are given
     */
    public static BoundingBox enclosing(Collection<? extends Point2D> points) {
        if (points == null || points.isEmpty()) {
            throw new IllegalArgumentException("Cannot build a bounding box from no points");
        }
        double minX = Double.POSITIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY;
        double maxY = Double.NEGATIVE_INFINITY;
        for (Point2D p : points) {
            minX = Math.min(minX, p.getX());
            maxX = Math.max(maxX, p.getX());
            minY = Math.min(minY, p.getY());
            maxY = Math.max(maxY, p.getY());
        }
        return new BoundingBox(minX, minY, maxX, maxY);
    }

    /**
     * Box of the given full width and height centered on {@code (cx, cy)}.
     */
    public static BoundingBox centeredAt(double cx, double cy, double width, double height) {
        return new BoundingBox(cx - width / 2.0, cy - height / 2.0, cx + width / 2.0, cy + height / 2.0);
    }

    public double getMinX() { return Math.min(x1, x2); }

    public double getMaxX() { return Math.max(x1, x2); }

    public double getMinY() { return Math.min(y1, y2); }

    public double getMaxY() { return Math.max(y1, y2); }

    /**
     * @return the absolute width (|x2 - x1|)
     */
    public double getWidth() { return Math.abs(x2 - x1); }

    /**
     * @return the absolute height (|y2 - y1|)
     */
    public double getHeight() { return Math.abs(y2 - y1); }

    public Point2D.Double getCenter() {
        return new Point2D.Double((getMinX() + getMaxX()) / 2.0, (getMinY() + getMaxY()) / 2.0);
    }

    /**
     * The four corners in the order lower-left, upper-left, upper-right, lower-right
     * (with y growing upwards).
     */
    public List<Point2D.Double> getCorners() {
        return List.of(
                new Point2D.Double(getMinX(), getMinY()),
                new Point2D.Double(getMinX(), getMaxY()),
                new Point2D.Double(getMaxX(), getMaxY()),
                new Point2D.Double(getMaxX(), getMinY()));
    }

    /**
     * Grows each axis by a fraction of its own extent on both sides, plus a fixed
     * absolute amount.
     *
     * @param fraction share of the width (height) added left and right (top and bottom)
     * @param absolute extra amount added on every side
     */
    public BoundingBox pad(double fraction, double absolute) {
        double padX = getWidth() * fraction + absolute;
        double padY = getHeight() * fraction + absolute;
        return new BoundingBox(getMinX() - padX, getMinY() - padY, getMaxX() + padX, getMaxY() + padY);
    }

    public boolean contains(double x, double y) {
        return x >= getMinX() && x <= getMaxX() && y >= getMinY() && y <= getMaxY();
    }

    /**
     * Axis limits as {@code [xmin, xmax, ymin, ymax]}.
     */
    public double[] toLimits() {
        return new double[]{getMinX(), getMaxX(), getMinY(), getMaxY()};
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BoundingBox other)) return false;
        return Double.compare(getMinX(), other.getMinX()) == 0
                && Double.compare(getMaxX(), other.getMaxX()) == 0
                && Double.compare(getMinY(), other.getMinY()) == 0
                && Double.compare(getMaxY(), other.getMaxY()) == 0;
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(toLimits());
    }

    @Override
    public String toString() {
        return String.format("BoundingBox[x: %.3f..%.3f, y: %.3f..%.3f]",
                getMinX(), getMaxX(), getMinY(), getMaxY());
    }
}
