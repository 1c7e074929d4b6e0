package geoviewer.georef.model;

import geoviewer.georef.utilities.BoundingBox;
import geoviewer.georef.utilities.CrsIds;
import geoviewer.georef.utilities.GeoTransform;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * A raster image together with its georeferencing.
 *
 * <p>Pixels and transform travel together so replacing an image always replaces both.
 * A raster without a transform is "unreferenced": its CRS is {@link CrsIds#UNKNOWN}, it has
 * no world bounds and it is drawn in pixel space.
 *
 * <p>World bounds are computed from the four-corner footprint on every call and never
 * stored.
 */
public final class GeoRaster {

    private final PixelBuffer pixels;
    private final GeoTransform transform;
    private final String crs;
    private final Path sourcePath;

    private GeoRaster(PixelBuffer pixels, GeoTransform transform, String crs, Path sourcePath) {
        this.pixels = Objects.requireNonNull(pixels, "pixels");
        this.transform = transform;
        this.crs = crs;
        this.sourcePath = sourcePath;
    }

    /**
     * A raster placed in the world by {@code transform}.
     *
     * @param crs CRS identifier of the world coordinates; must name a real CRS
     */
    public static GeoRaster georeferenced(PixelBuffer pixels, GeoTransform transform, String crs, Path sourcePath) {
        Objects.requireNonNull(transform, "transform");
        if (!CrsIds.isKnown(crs)) {
            throw new IllegalArgumentException("A georeferenced raster needs a CRS, got " + crs);
        }
        return new GeoRaster(pixels, transform, CrsIds.normalize(crs), sourcePath);
    }

    public static GeoRaster unreferenced(PixelBuffer pixels, Path sourcePath) {
        return new GeoRaster(pixels, null, CrsIds.UNKNOWN, sourcePath);
    }

    public PixelBuffer getPixels() {
        return pixels;
    }

    public Optional<GeoTransform> getTransform() {
        return Optional.ofNullable(transform);
    }

    public boolean isGeoreferenced() {
        return transform != null;
    }

    /**
     * CRS identifier, or {@code "unknown"} for an unreferenced raster.
     */
    public String crs() {
        return crs;
    }

    public Optional<Path> getSourcePath() {
        return Optional.ofNullable(sourcePath);
    }

    public int getWidth() {
        return pixels.getWidth();
    }

    public int getHeight() {
        return pixels.getHeight();
    }

    /**
     * World envelope of the footprint, or empty when unreferenced.
     */
    public Optional<BoundingBox> bounds() {
        return getTransform().map(t -> t.bounds(getWidth(), getHeight()));
    }

    /**
     * Extent in pixel space: {@code (0, 0)} to {@code (width, height)}.
     */
    public BoundingBox pixelBounds() {
        return new BoundingBox(0, 0, getWidth(), getHeight());
    }

    /**
     * Same georeferencing with different pixels, e.g. after display adjustments.
     */
    public GeoRaster withPixels(PixelBuffer newPixels) {
        if (newPixels.getWidth() != getWidth() || newPixels.getHeight() != getHeight()) {
            throw new IllegalArgumentException("Replacement pixels must keep the raster size "
                    + getWidth() + "x" + getHeight() + ", got " + newPixels);
        }
        return new GeoRaster(newPixels, transform, crs, sourcePath);
    }

    @Override
    public String toString() {
        return "GeoRaster[" + (sourcePath != null ? sourcePath.getFileName() : "<memory>")
                + ", " + pixels + ", crs=" + crs
                + (transform != null ? ", transform=" + transform : "") + "]";
    }
}
