package geoviewer.georef.service;

import geoviewer.georef.model.FeatureGeometry;
import geoviewer.georef.utilities.CrsIds;
import org.locationtech.jts.geom.CoordinateSequence;
import org.locationtech.jts.geom.CoordinateSequenceFilter;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.proj4j.CRSFactory;
import org.locationtech.proj4j.CoordinateReferenceSystem;
import org.locationtech.proj4j.CoordinateTransform;
import org.locationtech.proj4j.CoordinateTransformFactory;
import org.locationtech.proj4j.ProjCoordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link Reprojector} backed by proj4j.
 *
 * <p>CRS identifiers are resolved with {@link CRSFactory#createFromName(String)}, so any
 * {@code EPSG:xxxx} code known to the proj4j EPSG registry works. Geographic CRSs take
 * coordinates as (longitude, latitude). Transforms are built once per (source, target) pair
 * and cached.
 *
 * <p>Not thread-safe; the viewer reprojects on the UI thread only.
 */
public class Proj4jReprojector implements Reprojector {
    private static final Logger logger = LoggerFactory.getLogger(Proj4jReprojector.class);

    private final CRSFactory crsFactory = new CRSFactory();
    private final CoordinateTransformFactory ctf = new CoordinateTransformFactory();
    // Tiny cache so we don't rebuild transforms on every load event
    private final Map<String, CoordinateTransform> transformCache = new HashMap<>();

    @Override
    public List<FeatureGeometry> reproject(List<FeatureGeometry> geometries, String sourceCrs, String targetCrs)
            throws ReprojectionException {
        String from = CrsIds.normalize(sourceCrs);
        String to = CrsIds.normalize(targetCrs);
        if (!CrsIds.isKnown(from) || !CrsIds.isKnown(to)) {
            throw new ReprojectionException(sourceCrs, targetCrs,
                    "Cannot reproject between " + sourceCrs + " and " + targetCrs);
        }

        CoordinateTransform transform = transformFor(from, to);
        List<FeatureGeometry> result = new ArrayList<>(geometries.size());
        for (int i = 0; i < geometries.size(); i++) {
            Geometry copy = geometries.get(i).getGeometry().copy();
            ProjFilter filter = new ProjFilter(transform);
            try {
                copy.apply(filter);
            } catch (RuntimeException e) {
                throw new ReprojectionException(from, to,
                        "Failed to reproject feature " + i + " from " + from + " to " + to + ": " + e.getMessage(), e);
            }
            if (filter.failure != null) {
                throw new ReprojectionException(from, to,
                        "Feature " + i + " has a coordinate outside the domain of " + to + ": " + filter.failure);
            }
            result.add(FeatureGeometry.of(copy));
        }
        logger.debug("Reprojected {} geometries {} -> {}", result.size(), from, to);
        return result;
    }

    /** Build or fetch the transform for a CRS pair. */
    private CoordinateTransform transformFor(String from, String to) throws ReprojectionException {
        String key = from + "->" + to;
        CoordinateTransform cached = transformCache.get(key);
        if (cached != null) {
            return cached;
        }
        try {
            CoordinateReferenceSystem src = crsFactory.createFromName(from);
            CoordinateReferenceSystem dst = crsFactory.createFromName(to);
            CoordinateTransform transform = ctf.createTransform(src, dst);
            transformCache.put(key, transform);
            logger.info("Created CRS transform {} -> {}", from, to);
            return transform;
        } catch (RuntimeException e) {
            // proj4j reports unknown codes and bad parameters as unchecked exceptions
            throw new ReprojectionException(from, to,
                    "Cannot create transform " + from + " -> " + to + ": " + e.getMessage(), e);
        }
    }

    private static final class ProjFilter implements CoordinateSequenceFilter {
        private final CoordinateTransform transform;
        private final ProjCoordinate src = new ProjCoordinate();
        private final ProjCoordinate dst = new ProjCoordinate();
        private String failure;

        ProjFilter(CoordinateTransform transform) {
            this.transform = transform;
        }

        @Override
        public void filter(CoordinateSequence seq, int i) {
            src.x = seq.getX(i);
            src.y = seq.getY(i);
            transform.transform(src, dst);
            if (!Double.isFinite(dst.x) || !Double.isFinite(dst.y)) {
                failure = "(" + src.x + ", " + src.y + ")";
                return;
            }
            seq.setOrdinate(i, CoordinateSequence.X, dst.x);
            seq.setOrdinate(i, CoordinateSequence.Y, dst.y);
        }

        @Override
        public boolean isDone() {
            return failure != null;
        }

        @Override
        public boolean isGeometryChanged() {
            return true;
        }
    }
}
