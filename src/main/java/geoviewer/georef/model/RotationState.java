package geoviewer.georef.model;

import geoviewer.georef.utilities.TransformationFunctions;

import java.awt.geom.Point2D;

/**
 * The single view rotation shared by every layer.
 *
 * @param angleDegrees rotation in degrees, counter-clockwise; any finite value
 * @param pivot        world point held fixed by the rotation
 */
public record RotationState(double angleDegrees, Point2D.Double pivot) {

    public static final RotationState NONE = new RotationState(0.0, new Point2D.Double(0, 0));

    public RotationState {
        if (!Double.isFinite(angleDegrees)) {
            throw new IllegalArgumentException("Rotation angle must be finite: " + angleDegrees);
        }
        pivot = pivot == null ? new Point2D.Double(0, 0) : new Point2D.Double(pivot.x, pivot.y);
    }

    /**
     * Angle mapped into [0, 360) for display.
     */
    public double displayAngle() {
        return TransformationFunctions.normalizeAngle(angleDegrees);
    }

    public boolean isIdentity() {
        return displayAngle() == 0.0;
    }

    public RotationState withAngle(double newAngle) {
        return new RotationState(newAngle, pivot);
    }

    public RotationState withPivot(Point2D newPivot) {
        return new RotationState(angleDegrees, newPivot == null ? null
                : new Point2D.Double(newPivot.getX(), newPivot.getY()));
    }

    @Override
    public Point2D.Double pivot() {
        return new Point2D.Double(pivot.x, pivot.y);
    }
}
