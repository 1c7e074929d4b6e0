package geoviewer.georef.service;

import geoviewer.georef.model.FeatureCollection;
import geoviewer.georef.model.FeatureGeometry;
import geoviewer.georef.model.GeoRaster;
import geoviewer.georef.utilities.CrsIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.ResourceBundle;

/**
 * CrsReconciler - brings a vector layer into the coordinate system of the raster it is
 * drawn over.
 *
 * <p>Decision order:
 * <ol>
 *   <li>no raster, or a raster without CRS: nothing to align to</li>
 *   <li>vector layer without CRS: assumed to match the raster</li>
 *   <li>equal identifiers after {@link CrsIds#normalize(String)}: nothing to do</li>
 *   <li>otherwise reproject once through the {@link Reprojector}</li>
 * </ol>
 * A reprojection failure never aborts: the stored coordinates are kept and the result
 * carries a warning. The feature collection itself is never modified, so recorded
 * attribute values always stay with the original features.
 */
public class CrsReconciler {
    private static final Logger logger = LoggerFactory.getLogger(CrsReconciler.class);

    private final Reprojector reprojector;
    private final ResourceBundle res = ResourceBundle.getBundle("geoviewer.georef.ui.strings");

    public CrsReconciler(Reprojector reprojector) {
        this.reprojector = Objects.requireNonNull(reprojector, "reprojector");
    }

    /**
     * @param raster   the raster to align to, or null when none is loaded
     * @param features the vector layer
     */
    public ReconciliationResult reconcile(GeoRaster raster, FeatureCollection features) {
        List<FeatureGeometry> stored = features.getGeometries();
        String vectorCrs = features.getCrs().orElse(null);

        if (raster == null || !CrsIds.isKnown(raster.crs())) {
            logger.info(res.getString("reconcile.rasterUnreferenced"));
            return new ReconciliationResult(ReconciliationResult.Action.RASTER_UNREFERENCED, stored, vectorCrs,
                    raster == null ? null : "Raster has no georeferencing; features may not line up with it");
        }

        String rasterCrs = raster.crs();
        if (!CrsIds.isKnown(vectorCrs)) {
            logger.warn(res.getString("reconcile.vectorCrsMissing"), rasterCrs);
            return new ReconciliationResult(ReconciliationResult.Action.VECTOR_CRS_MISSING, stored, rasterCrs,
                    "Feature layer has no CRS; assuming " + rasterCrs);
        }

        if (CrsIds.same(vectorCrs, rasterCrs)) {
            logger.debug("Feature layer already in {}", rasterCrs);
            return new ReconciliationResult(ReconciliationResult.Action.SAME_CRS, stored, rasterCrs, null);
        }

        try {
            List<FeatureGeometry> reprojected = reprojector.reproject(stored, vectorCrs, rasterCrs);
            logger.info(res.getString("reconcile.reprojected"), reprojected.size(), vectorCrs, rasterCrs);
            return new ReconciliationResult(ReconciliationResult.Action.REPROJECTED, reprojected, rasterCrs, null);
        } catch (ReprojectionException e) {
            logger.warn(res.getString("reconcile.failed"), vectorCrs, rasterCrs, e);
            return new ReconciliationResult(ReconciliationResult.Action.REPROJECTION_FAILED, stored, vectorCrs,
                    "Could not reproject features from " + vectorCrs + " to " + rasterCrs + ": " + e.getMessage());
        }
    }
}
