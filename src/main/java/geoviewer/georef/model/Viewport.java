package geoviewer.georef.model;

import geoviewer.georef.utilities.BoundingBox;

import java.awt.geom.Point2D;

/**
 * What the renderer should show: the axis limits in rotated world coordinates plus the
 * rotation they were computed under. Recomputed on every navigation, zoom or rotation
 * event.
 *
 * @param window       axis limits {@code xmin, xmax, ymin, ymax}
 * @param angleDegrees display rotation in [0, 360)
 * @param pivot        rotation pivot in world coordinates
 */
public record Viewport(BoundingBox window, double angleDegrees, Point2D.Double pivot) {

    public double xmin() { return window.getMinX(); }

    public double xmax() { return window.getMaxX(); }

    public double ymin() { return window.getMinY(); }

    public double ymax() { return window.getMaxY(); }
}
