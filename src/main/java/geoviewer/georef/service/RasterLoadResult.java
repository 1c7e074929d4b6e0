package geoviewer.georef.service;

import geoviewer.georef.model.GeoRaster;

import java.util.List;

/**
 * A loaded raster plus the messages the user should see about it, e.g. that no world file
 * was found.
 */
public record RasterLoadResult(GeoRaster raster, List<String> messages) {

    public RasterLoadResult {
        messages = List.copyOf(messages);
    }

    public boolean isGeoreferenced() {
        return raster.isGeoreferenced();
    }
}
