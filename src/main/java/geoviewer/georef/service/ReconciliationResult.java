package geoviewer.georef.service;

import geoviewer.georef.model.FeatureGeometry;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of aligning a vector layer with a raster's CRS.
 *
 * @param action           what was done
 * @param displayGeometries geometries to draw, in the raster's CRS when {@code action} is
 *                         {@link Action#REPROJECTED}, otherwise as stored
 * @param displayCrs       CRS of {@code displayGeometries}, or null when unknown
 * @param warning          message for the user when the layers may be misaligned, or null
 */
public record ReconciliationResult(Action action, List<FeatureGeometry> displayGeometries,
                                   String displayCrs, String warning) {

    public enum Action {
        /** No raster, or a raster without CRS; vectors are drawn in their own coordinates. */
        RASTER_UNREFERENCED,
        /** The vector layer has no CRS; it is assumed to share the raster's CRS. */
        VECTOR_CRS_MISSING,
        /** Both layers already share a CRS. */
        SAME_CRS,
        /** Vectors were reprojected into the raster's CRS. */
        REPROJECTED,
        /** Reprojection was attempted and failed; vectors are drawn as stored. */
        REPROJECTION_FAILED
    }

    public ReconciliationResult {
        displayGeometries = List.copyOf(displayGeometries);
    }

    public Optional<String> getWarning() {
        return Optional.ofNullable(warning);
    }

    /**
     * True when vectors and raster are known to share coordinates.
     */
    public boolean isAligned() {
        return action == Action.SAME_CRS || action == Action.REPROJECTED;
    }
}
