package geoviewer.georef.controller;

import geoviewer.georef.model.FeatureCollection;
import geoviewer.georef.model.FeatureGeometry;
import geoviewer.georef.model.GeoRaster;
import geoviewer.georef.model.PixelBuffer;
import geoviewer.georef.model.RotationState;
import geoviewer.georef.model.Viewport;
import geoviewer.georef.service.CompositeFrame;
import geoviewer.georef.service.CrsReconciler;
import geoviewer.georef.service.GeoJsonFeatureIO;
import geoviewer.georef.service.GeoRasterLoader;
import geoviewer.georef.service.InvalidViewportInputException;
import geoviewer.georef.service.RasterLoadResult;
import geoviewer.georef.service.ReconciliationResult;
import geoviewer.georef.service.Reprojector;
import geoviewer.georef.service.RotationCompositor;
import geoviewer.georef.service.ViewportEngine;
import geoviewer.georef.utilities.AdjustmentParams;
import geoviewer.georef.utilities.BoundingBox;
import geoviewer.georef.utilities.ImageAdjustments;
import geoviewer.georef.utilities.TransformationFunctions;
import geoviewer.georef.utilities.ViewerConfigManager;
import geoviewer.georef.utilities.WorldFileParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.geom.Point2D;
import java.io.IOException;
import java.nio.file.Path;
import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.ResourceBundle;

/**
 * AnnotationSession
 *
 * <p>Drives the point annotation workflow for a UI:
 * <ol>
 *   <li>load one or more rasters and a vector layer; every load re-aligns the layers</li>
 *   <li>step through features with next / previous / go-to</li>
 *   <li>record values for the current feature, optionally moving on</li>
 *   <li>rotate and zoom the shared view</li>
 * </ol>
 * Every command returns plain data (status text, viewport) instead of touching widgets.
 *
 * <p>The session holds the only mutable state of the viewer. It is meant to be called from a
 * single UI thread.
 */
public class AnnotationSession {
    private static final Logger logger = LoggerFactory.getLogger(AnnotationSession.class);

    private final ViewerConfigManager config;
    private final GeoRasterLoader loader;
    private final CrsReconciler reconciler;
    private final RotationCompositor compositor;
    private final ViewportEngine viewportEngine;
    private final GeoJsonFeatureIO featureIO;
    private final ResourceBundle res = ResourceBundle.getBundle("geoviewer.georef.ui.strings");

    private final List<GeoRaster> rasters = new ArrayList<>();
    private final Map<Path, Boolean> visibility = new HashMap<>();
    private FeatureCollection features;
    private ReconciliationResult reconciliation;
    private RotationState rotation = RotationState.NONE;
    private double zoomFactor;

    public AnnotationSession(ViewerConfigManager config, Reprojector reprojector) {
        this(config,
                new GeoRasterLoader(new WorldFileParser(), config),
                new CrsReconciler(reprojector),
                new RotationCompositor(),
                new ViewportEngine(config),
                new GeoJsonFeatureIO());
    }

    public AnnotationSession(ViewerConfigManager config, GeoRasterLoader loader, CrsReconciler reconciler,
                             RotationCompositor compositor, ViewportEngine viewportEngine,
                             GeoJsonFeatureIO featureIO) {
        this.config = config;
        this.loader = loader;
        this.reconciler = reconciler;
        this.compositor = compositor;
        this.viewportEngine = viewportEngine;
        this.featureIO = featureIO;
        this.zoomFactor = config.getDefaultZoomFactor();
    }

    // ==================== Loading ====================

    /**
     * Reads an image and its world file and adds it as a layer.
     */
    public RasterLoadResult loadRaster(Path imagePath) throws IOException {
        Objects.requireNonNull(imagePath, "imagePath");
        return addRaster(loader.load(imagePath));
    }

    /**
     * Adds already decoded pixels as a layer, georeferenced from the sidecar of
     * {@code imagePath}. A layer loaded earlier from the same path is replaced.
     */
    public RasterLoadResult loadRaster(PixelBuffer pixels, Path imagePath) {
        Objects.requireNonNull(imagePath, "imagePath");
        return addRaster(loader.load(pixels, imagePath));
    }

    private RasterLoadResult addRaster(RasterLoadResult result) {
        GeoRaster raster = result.raster();
        Path key = layerKey(raster.getSourcePath().orElseThrow());
        int existing = indexOfLayer(key);
        if (existing >= 0) {
            rasters.set(existing, raster);
            logger.info("Replaced raster layer {}", key);
        } else {
            rasters.add(raster);
            visibility.put(key, Boolean.TRUE);
        }
        realign();
        return result;
    }

    /**
     * Replaces the vector layer. The cursor starts at the first feature.
     */
    public ReconciliationResult loadFeatures(FeatureCollection collection) {
        if (!collection.isEmpty()) {
            collection.moveToIndex(0);
        }
        this.features = collection;
        realign();
        return reconciliation;
    }

    public ReconciliationResult loadFeatures(Path geoJson) throws IOException {
        return loadFeatures(featureIO.read(geoJson));
    }

    /**
     * Writes the vector layer with the recorded values.
     *
     * @throws IllegalStateException when no vector layer is loaded
     */
    public void saveFeatures(Path geoJson) throws IOException {
        if (features == null) {
            throw new IllegalStateException(res.getString("status.noData"));
        }
        featureIO.write(features, geoJson);
    }

    /**
     * Re-runs CRS reconciliation and moves the rotation pivot to the new layer set.
     */
    private void realign() {
        if (features != null) {
            reconciliation = reconciler.reconcile(referenceRaster().orElse(null), features);
            reconciliation.getWarning().ifPresent(w -> logger.warn("Layer alignment: {}", w));
        } else {
            reconciliation = null;
        }
        rotation = rotation.withPivot(compositor.pivotFor(rasters, displayGeometries()));
        logger.debug("Rotation pivot now ({}, {})", rotation.pivot().x, rotation.pivot().y);
    }

    /**
     * The raster vectors are aligned to: the first georeferenced layer, else the first layer.
     */
    private Optional<GeoRaster> referenceRaster() {
        return rasters.stream().filter(GeoRaster::isGeoreferenced).findFirst()
                .or(() -> rasters.stream().findFirst());
    }

    private List<FeatureGeometry> displayGeometries() {
        return reconciliation != null ? reconciliation.displayGeometries() : List.of();
    }

    // ==================== Navigation ====================

    public NavigationResult next() {
        if (features == null || !features.moveNext()) {
            return refused(res.getString("status.noData"));
        }
        return positionResult();
    }

    public NavigationResult previous() {
        if (features == null || !features.movePrevious()) {
            return refused(res.getString("status.noData"));
        }
        return positionResult();
    }

    /**
     * Moves to a zero-based feature index; out-of-range indices leave the cursor unchanged.
     */
    public NavigationResult goTo(int index) {
        if (features == null || features.isEmpty()) {
            return refused(res.getString("status.noData"));
        }
        if (!features.moveToIndex(index)) {
            return refused(MessageFormat.format(res.getString("status.indexOutOfRange"),
                    String.valueOf(index), String.valueOf(features.size() - 1)));
        }
        return positionResult();
    }

    private NavigationResult positionResult() {
        String message = MessageFormat.format(res.getString("status.position"),
                String.valueOf(features.getCurrentIndex() + 1), String.valueOf(features.size()));
        return new NavigationResult(true, features.getCurrentIndex(), message, currentViewport().orElse(null));
    }

    private NavigationResult refused(String message) {
        logger.info(message);
        return new NavigationResult(false, currentIndex(), message, currentViewport().orElse(null));
    }

    private int currentIndex() {
        return features == null || features.isEmpty() ? -1 : features.getCurrentIndex();
    }

    // ==================== Recording values ====================

    /**
     * Stores {@code value} (trimmed) in {@code column} for the current feature.
     *
     * @param column   exact column name
     * @param moveNext advance to the next feature after storing
     */
    public NavigationResult assignValue(String column, String value, boolean moveNext) {
        if (features == null || features.isEmpty()) {
            return refused(res.getString("status.noData"));
        }
        if (column == null || column.isBlank()) {
            return refused(res.getString("status.noColumn"));
        }
        if (!features.hasColumn(column)) {
            return refused(MessageFormat.format(res.getString("status.columnNotFound"), column));
        }

        int row = features.getCurrentIndex();
        String stored = value == null ? "" : value.strip();
        features.setValue(column, row, stored);
        String message = MessageFormat.format(res.getString("status.assigned"), stored, column, String.valueOf(row));
        if (moveNext) {
            features.moveNext();
            message += res.getString("status.movedNext");
        }
        logger.info(message);
        return new NavigationResult(true, features.getCurrentIndex(), message, currentViewport().orElse(null));
    }

    /**
     * Stores an ID in the configured ID column (matched ignoring case) and moves on.
     */
    public NavigationResult recordIdAndNext(String idValue) {
        if (features == null || features.isEmpty()) {
            return refused(res.getString("status.noData"));
        }
        String idField = config.getIdFieldName();
        Optional<String> column = features.findColumnIgnoreCase(idField);
        if (column.isEmpty()) {
            return refused(MessageFormat.format(res.getString("status.noIdColumn"), idField));
        }
        int row = features.getCurrentIndex();
        String stored = idValue == null ? "" : idValue.strip();
        features.setValue(column.get(), row, stored);
        features.moveNext();
        String message = MessageFormat.format(res.getString("status.recordedId"), stored, String.valueOf(row));
        logger.info(message);
        return new NavigationResult(true, features.getCurrentIndex(), message, currentViewport().orElse(null));
    }

    // ==================== View ====================

    /**
     * Sets the shared rotation for every layer; any finite angle is accepted.
     */
    public NavigationResult setRotation(double angleDegrees) {
        rotation = rotation.withAngle(angleDegrees);
        String message = MessageFormat.format(res.getString("status.angle"),
                String.format(Locale.ROOT, "%.1f", rotation.displayAngle()));
        return new NavigationResult(true, currentIndex(), message, currentViewport().orElse(null));
    }

    /**
     * @throws InvalidViewportInputException if the factor is not a positive finite number
     */
    public NavigationResult setZoomFactor(double factor) {
        if (!Double.isFinite(factor) || factor <= 0) {
            throw new InvalidViewportInputException("Zoom factor must be a positive number, got " + factor);
        }
        this.zoomFactor = factor;
        String message = MessageFormat.format(res.getString("status.zoom"),
                String.format(Locale.ROOT, "%.1f", factor));
        return new NavigationResult(true, currentIndex(), message, currentViewport().orElse(null));
    }

    public NavigationResult setZoomSlider(int sliderValue) {
        return setZoomFactor(viewportEngine.zoomFactorFromSlider(sliderValue));
    }

    /**
     * Window for the current state: around the current feature when there is one, otherwise
     * the whole rotated extent of the loaded layers.
     */
    public Optional<Viewport> currentViewport() {
        Optional<FeatureGeometry> current = currentDisplayGeometry();
        if (current.isPresent()) {
            Point2D.Double point = current.get().representativePoint();
            if (Double.isFinite(point.x) && Double.isFinite(point.y)) {
                double[] rotated = TransformationFunctions.transformPoint(new double[]{point.x, point.y},
                        TransformationFunctions.createRotationTransform(rotation.angleDegrees(), rotation.pivot()));
                BoundingBox window = viewportEngine.zoomToPoint(rotated[0], rotated[1], zoomFactor);
                return Optional.of(toViewport(window));
            }
        }
        return overviewViewport();
    }

    /**
     * Window enclosing the rotated extent of the reference raster, or of the vector layer
     * when no raster is georeferenced. An unreferenced raster alone is shown in pixel space.
     */
    public Optional<Viewport> overviewViewport() {
        Optional<BoundingBox> extent = rasters.stream()
                .map(GeoRaster::bounds)
                .flatMap(Optional::stream)
                .findFirst();
        if (extent.isEmpty() && reconciliation != null) {
            extent = new FeatureCollection(reconciliation.displayGeometries(), null).bounds();
        }
        if (extent.isPresent()) {
            return Optional.of(toViewport(viewportEngine.visibleWindowForRotatedFootprint(
                    extent.get(), rotation.angleDegrees(), rotation.pivot())));
        }
        return rasters.stream().findFirst().map(r -> toViewport(r.pixelBounds()));
    }

    private Viewport toViewport(BoundingBox window) {
        return new Viewport(window, rotation.displayAngle(), rotation.pivot());
    }

    private Optional<FeatureGeometry> currentDisplayGeometry() {
        if (features == null || features.isEmpty() || reconciliation == null) {
            return Optional.empty();
        }
        return Optional.of(reconciliation.displayGeometries().get(features.getCurrentIndex()));
    }

    /**
     * Rotated transforms and geometries for every visible layer.
     */
    public CompositeFrame compositeFrame() {
        return compositor.composite(rotation, visibleRasters(), displayGeometries());
    }

    public PixelBuffer adjustedPixels(GeoRaster raster, AdjustmentParams params) {
        return ImageAdjustments.adjust(raster.getPixels(), params);
    }

    // ==================== Layers ====================

    /**
     * Shows or hides the raster loaded from {@code imagePath}.
     *
     * @return false when no layer was loaded from that path
     */
    public boolean setLayerVisible(Path imagePath, boolean visible) {
        Path key = layerKey(imagePath);
        if (indexOfLayer(key) < 0) {
            logger.warn(MessageFormat.format(res.getString("status.layerNotFound"), imagePath));
            return false;
        }
        visibility.put(key, visible);
        logger.debug(MessageFormat.format(res.getString("status.layerVisibility"),
                key.getFileName(), visible ? "shown" : "hidden"));
        return true;
    }

    public List<GeoRaster> visibleRasters() {
        List<GeoRaster> visible = new ArrayList<>();
        for (GeoRaster raster : rasters) {
            Path key = layerKey(raster.getSourcePath().orElseThrow());
            if (visibility.getOrDefault(key, Boolean.TRUE)) {
                visible.add(raster);
            }
        }
        return visible;
    }

    private int indexOfLayer(Path key) {
        for (int i = 0; i < rasters.size(); i++) {
            if (layerKeyAt(i).equals(key)) {
                return i;
            }
        }
        return -1;
    }

    private Path layerKeyAt(int i) {
        return layerKey(rasters.get(i).getSourcePath().orElseThrow());
    }

    private static Path layerKey(Path path) {
        return path.toAbsolutePath().normalize();
    }

    // ==================== Accessors ====================

    public List<GeoRaster> getRasters() {
        return List.copyOf(rasters);
    }

    public Optional<FeatureCollection> getFeatures() {
        return Optional.ofNullable(features);
    }

    public Optional<ReconciliationResult> getReconciliation() {
        return Optional.ofNullable(reconciliation);
    }

    public RotationState getRotation() {
        return rotation;
    }

    public double getZoomFactor() {
        return zoomFactor;
    }
}
