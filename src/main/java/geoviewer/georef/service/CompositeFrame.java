package geoviewer.georef.service;

import geoviewer.georef.model.FeatureGeometry;
import geoviewer.georef.model.GeoRaster;
import geoviewer.georef.model.RotationState;
import geoviewer.georef.utilities.GeoTransform;

import java.awt.geom.AffineTransform;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything the renderer needs to draw one rotated frame.
 *
 * @param rotation            the rotation the frame was computed under
 * @param rasterTransforms    effective (rotated) transform per georeferenced raster, in layer order
 * @param vectorOperator      rotation applied to vector draw coordinates; a fresh copy per call
 * @param rotatedGeometries   display geometries after rotation
 */
public record CompositeFrame(RotationState rotation,
                             Map<GeoRaster, GeoTransform> rasterTransforms,
                             AffineTransform vectorOperator,
                             List<FeatureGeometry> rotatedGeometries) {

    public CompositeFrame {
        rasterTransforms = Collections.unmodifiableMap(new LinkedHashMap<>(rasterTransforms));
        vectorOperator = new AffineTransform(vectorOperator);
        rotatedGeometries = List.copyOf(rotatedGeometries);
    }

    @Override
    public AffineTransform vectorOperator() {
        return new AffineTransform(vectorOperator);
    }
}
