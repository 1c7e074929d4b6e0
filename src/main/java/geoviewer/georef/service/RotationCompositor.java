package geoviewer.georef.service;

import geoviewer.georef.model.FeatureGeometry;
import geoviewer.georef.model.GeoRaster;
import geoviewer.georef.model.RotationState;
import geoviewer.georef.utilities.BoundingBox;
import geoviewer.georef.utilities.GeoTransform;
import geoviewer.georef.utilities.TransformationFunctions;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.util.AffineTransformation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.geom.AffineTransform;
import java.awt.geom.Point2D;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Applies the one shared view rotation to every raster and to the vector layer.
 *
 * <p>Raster transforms are always rebuilt from their canonical (unrotated) transform, and
 * vectors from their display geometries, so applying the same angle any number of times
 * gives the same frame. Unreferenced rasters are skipped: they live in pixel space and are
 * never composited with world coordinates.
 */
public class RotationCompositor {
    private static final Logger logger = LoggerFactory.getLogger(RotationCompositor.class);

    /**
     * Rotation pivot: the center of the first georeferenced raster's bounds, otherwise the
     * center of the vector geometries, otherwise the origin.
     */
    public Point2D.Double pivotFor(List<GeoRaster> rasters, List<FeatureGeometry> geometries) {
        for (GeoRaster raster : rasters) {
            Optional<BoundingBox> bounds = raster.bounds();
            if (bounds.isPresent()) {
                return bounds.get().getCenter();
            }
        }
        Envelope envelope = new Envelope();
        if (geometries != null) {
            for (FeatureGeometry geometry : geometries) {
                if (!geometry.isEmpty()) {
                    envelope.expandToInclude(geometry.getEnvelope());
                }
            }
        }
        if (!envelope.isNull()) {
            return new Point2D.Double(envelope.centre().x, envelope.centre().y);
        }
        logger.debug("No georeferenced layer; rotating about the origin");
        return new Point2D.Double(0, 0);
    }

    /**
     * Builds the rotated frame.
     *
     * @param state      angle and pivot
     * @param rasters    loaded rasters in layer order
     * @param geometries vector geometries in display coordinates (after CRS reconciliation)
     */
    public CompositeFrame composite(RotationState state, List<GeoRaster> rasters, List<FeatureGeometry> geometries) {
        Point2D.Double pivot = state.pivot();
        double angle = state.angleDegrees();

        Map<GeoRaster, GeoTransform> transforms = new LinkedHashMap<>();
        for (GeoRaster raster : rasters) {
            raster.getTransform().ifPresent(canonical ->
                    transforms.put(raster, canonical.composeRotation(angle, pivot)));
        }

        AffineTransform operator = TransformationFunctions.createRotationTransform(angle, pivot);
        List<FeatureGeometry> rotated = new ArrayList<>();
        if (geometries != null) {
            if (state.isIdentity()) {
                rotated.addAll(geometries);
            } else {
                AffineTransformation jts = TransformationFunctions.toJts(operator);
                for (FeatureGeometry geometry : geometries) {
                    rotated.add(geometry.transform(jts));
                }
            }
        }

        logger.debug("Composited {} rasters and {} geometries at {} degrees about ({}, {})",
                transforms.size(), rotated.size(), state.displayAngle(), pivot.x, pivot.y);
        return new CompositeFrame(state, transforms, operator, rotated);
    }
}
