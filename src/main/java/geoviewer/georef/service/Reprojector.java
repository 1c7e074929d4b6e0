package geoviewer.georef.service;

import geoviewer.georef.model.FeatureGeometry;

import java.util.List;

/**
 * Moves feature geometries between coordinate reference systems.
 */
public interface Reprojector {

    /**
     * Reprojects every geometry from {@code sourceCrs} to {@code targetCrs}.
     *
     * @param geometries geometries in {@code sourceCrs}; not modified
     * @param sourceCrs  CRS identifier such as {@code EPSG:4326}
     * @param targetCrs  CRS identifier such as {@code EPSG:2039}
     * @return new geometries in the same order
     * @throws ReprojectionException if either CRS is unknown or a coordinate cannot be transformed
     */
    List<FeatureGeometry> reproject(List<FeatureGeometry> geometries, String sourceCrs, String targetCrs)
            throws ReprojectionException;
}
