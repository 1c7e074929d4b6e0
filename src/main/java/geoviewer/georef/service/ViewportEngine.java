package geoviewer.georef.service;

import geoviewer.georef.utilities.BoundingBox;
import geoviewer.georef.utilities.TransformationFunctions;
import geoviewer.georef.utilities.ViewerConfigManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.geom.Point2D;
import java.util.List;

/**
 * ViewportEngine - derives the axis limits the renderer should show.
 *
 * <p>Zoom windows have a fixed base size per axis, divided by the zoom factor and floored at
 * a minimum size so very large zoom factors never collapse the window. Windows for rotated
 * rasters enclose the rotated footprint plus a margin.
 *
 * @since 0.1.0
 */
public class ViewportEngine {
    private static final Logger logger = LoggerFactory.getLogger(ViewportEngine.class);

    /** Added to every side of a rotated-footprint window on top of the fractional margin. */
    static final double ABSOLUTE_MARGIN = 1e-6;

    private final double baseRangeX;
    private final double baseRangeY;
    private final double minRange;
    private final double marginFraction;
    private final double minZoomFactor;
    private final double sliderDivisor;

    public ViewportEngine(ViewerConfigManager config) {
        this(config.getBaseRangeX(), config.getBaseRangeY(), config.getMinRange(),
                config.getMarginFraction(), config.getMinZoomFactor(), config.getSliderDivisor());
    }

    public ViewportEngine(double baseRangeX, double baseRangeY, double minRange,
                          double marginFraction, double minZoomFactor, double sliderDivisor) {
        this.baseRangeX = baseRangeX;
        this.baseRangeY = baseRangeY;
        this.minRange = minRange;
        this.marginFraction = marginFraction;
        this.minZoomFactor = minZoomFactor;
        this.sliderDivisor = sliderDivisor;
    }

    /**
     * Window centered at {@code (x, y)} of size {@code max(base / zoomFactor, minRange)} per
     * axis.
     *
     * @throws InvalidViewportInputException if {@code zoomFactor} is not a positive finite
     *         number, or {@code x}/{@code y} is not finite
     */
    public BoundingBox zoomToPoint(double x, double y, double zoomFactor) {
        if (!Double.isFinite(zoomFactor) || zoomFactor <= 0) {
            throw new InvalidViewportInputException("Zoom factor must be a positive number, got " + zoomFactor);
        }
        if (!Double.isFinite(x) || !Double.isFinite(y)) {
            throw new InvalidViewportInputException("View center must be finite, got (" + x + ", " + y + ")");
        }
        double rangeX = Math.max(baseRangeX / zoomFactor, minRange);
        double rangeY = Math.max(baseRangeY / zoomFactor, minRange);
        BoundingBox window = BoundingBox.centeredAt(x, y, rangeX, rangeY);
        logger.debug("Zoom {}x at ({}, {}) -> {}", zoomFactor, x, y, window);
        return window;
    }

    /**
     * Axis-aligned window enclosing {@code bounds} after rotation about {@code pivot}, padded
     * by the configured fraction of each axis extent plus a tiny absolute margin.
     *
     * @throws InvalidViewportInputException if the angle, the pivot or a bounds limit is not
     *         finite
     */
    public BoundingBox visibleWindowForRotatedFootprint(BoundingBox bounds, double angleDegrees, Point2D pivot) {
        if (!Double.isFinite(angleDegrees)) {
            throw new InvalidViewportInputException("Rotation angle must be finite, got " + angleDegrees);
        }
        if (pivot == null || !Double.isFinite(pivot.getX()) || !Double.isFinite(pivot.getY())) {
            throw new InvalidViewportInputException("Rotation pivot must be finite, got " + pivot);
        }
        for (double limit : bounds.toLimits()) {
            if (!Double.isFinite(limit)) {
                throw new InvalidViewportInputException("Footprint bounds must be finite, got " + bounds);
            }
        }
        List<Point2D.Double> rotated = TransformationFunctions.rotatePoints(bounds.getCorners(), angleDegrees, pivot);
        return BoundingBox.enclosing(rotated).pad(marginFraction, ABSOLUTE_MARGIN);
    }

    /**
     * Zoom factor for a slider position: {@code value / divisor}, never below the minimum
     * zoom factor.
     */
    public double zoomFactorFromSlider(int sliderValue) {
        return Math.max(sliderValue / sliderDivisor, minZoomFactor);
    }

    public double getBaseRangeX() {
        return baseRangeX;
    }

    public double getBaseRangeY() {
        return baseRangeY;
    }

    public double getMinRange() {
        return minRange;
    }
}
