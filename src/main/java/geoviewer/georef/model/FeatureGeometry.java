package geoviewer.georef.model;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.util.AffineTransformation;

import java.awt.geom.Point2D;
import java.util.Objects;

/**
 * Geometry of one vector feature.
 *
 * <p>Two variants exist: {@link Point} for point features and {@link Shape} for lines,
 * polygons and multi-geometries. Both expose {@link #representativePoint()}, which is where
 * the viewer centers when the feature is selected: the point itself, or the centroid.
 *
 * <p>The private constructor keeps the set of variants closed. Instances wrap an immutable
 * JTS geometry; transformations return new instances.
 */
public abstract class FeatureGeometry {

    static final GeometryFactory GEOMETRY_FACTORY = new GeometryFactory();

    protected final Geometry geometry;

    private FeatureGeometry(Geometry geometry) {
        this.geometry = Objects.requireNonNull(geometry, "geometry");
    }

    /**
     * Wraps a JTS geometry in the matching variant.
     */
    public static FeatureGeometry of(Geometry geometry) {
        if (geometry instanceof org.locationtech.jts.geom.Point p) {
            return new Point(p);
        }
        return new Shape(geometry);
    }

    public static FeatureGeometry point(double x, double y) {
        return new Point(GEOMETRY_FACTORY.createPoint(new Coordinate(x, y)));
    }

    public abstract Point2D.Double representativePoint();

    public Geometry getGeometry() {
        return geometry;
    }

    public Envelope getEnvelope() {
        return geometry.getEnvelopeInternal();
    }

    public boolean isEmpty() {
        return geometry.isEmpty();
    }

    /**
     * Applies an affine transformation to every coordinate.
     */
    public FeatureGeometry transform(AffineTransformation transformation) {
        return of(transformation.transform(geometry));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FeatureGeometry other)) return false;
        return geometry.equalsExact(other.geometry);
    }

    @Override
    public int hashCode() {
        return geometry.getEnvelopeInternal().hashCode();
    }

    @Override
    public String toString() {
        return geometry.toText();
    }

    public static final class Point extends FeatureGeometry {
        private Point(org.locationtech.jts.geom.Point point) {
            super(point);
        }

        public double getX() {
            return ((org.locationtech.jts.geom.Point) geometry).getX();
        }

        public double getY() {
            return ((org.locationtech.jts.geom.Point) geometry).getY();
        }

        @Override
        public Point2D.Double representativePoint() {
            return new Point2D.Double(getX(), getY());
        }
    }

    public static final class Shape extends FeatureGeometry {
        private Shape(Geometry geometry) {
            super(geometry);
        }

        @Override
        public Point2D.Double representativePoint() {
            org.locationtech.jts.geom.Point centroid = geometry.getCentroid();
            if (centroid.isEmpty()) {
                // centroid of an empty shape
                return new Point2D.Double(Double.NaN, Double.NaN);
            }
            return new Point2D.Double(centroid.getX(), centroid.getY());
        }
    }
}
