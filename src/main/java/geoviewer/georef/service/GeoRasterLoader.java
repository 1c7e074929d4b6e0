package geoviewer.georef.service;

import geoviewer.georef.model.GeoRaster;
import geoviewer.georef.model.PixelBuffer;
import geoviewer.georef.utilities.BoundingBox;
import geoviewer.georef.utilities.CrsIds;
import geoviewer.georef.utilities.GeoTransform;
import geoviewer.georef.utilities.ViewerConfigManager;
import geoviewer.georef.utilities.WorldFileFormatException;
import geoviewer.georef.utilities.WorldFileParser;
import geoviewer.georef.utilities.WorldFileRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.ResourceBundle;

/**
 * Builds {@link GeoRaster}s from images and their world files.
 *
 * <p>Failure policy:
 * <ul>
 *   <li>no world file: unreferenced raster, "loaded without georeferencing"</li>
 *   <li>malformed world file: unreferenced raster plus the parse error</li>
 *   <li>world file with a zero pixel size: {@link geoviewer.georef.utilities.DegenerateTransformException}
 *       propagates</li>
 * </ul>
 * An origin outside the configured expected envelope is logged and reported but never
 * rejected.
 */
public class GeoRasterLoader {
    private static final Logger logger = LoggerFactory.getLogger(GeoRasterLoader.class);

    public static final String NO_GEOREFERENCING = "loaded without georeferencing";

    private final WorldFileParser parser;
    private final ViewerConfigManager config;
    private final ResourceBundle res = ResourceBundle.getBundle("geoviewer.georef.ui.strings");

    public GeoRasterLoader(WorldFileParser parser, ViewerConfigManager config) {
        this.parser = parser;
        this.config = config;
    }

    /**
     * Reads the image with {@link ImageIO} and georeferences it from its sidecar.
     *
     * @throws IOException if the image cannot be read or its format is not supported
     */
    public RasterLoadResult load(Path imagePath) throws IOException {
        if (!Files.isRegularFile(imagePath)) {
            throw new IOException("Image not found: " + imagePath);
        }
        BufferedImage image = ImageIO.read(imagePath.toFile());
        if (image == null) {
            throw new IOException("Unsupported image format: " + imagePath);
        }
        return load(PixelBuffer.fromBufferedImage(image), imagePath);
    }

    /**
     * Georeferences already decoded pixels using the configured default CRS.
     */
    public RasterLoadResult load(PixelBuffer pixels, Path imagePath) {
        return load(pixels, imagePath, null);
    }

    /**
     * @param crs CRS of the world file coordinates; null selects the configured default
     */
    public RasterLoadResult load(PixelBuffer pixels, Path imagePath, String crs) {
        List<String> messages = new ArrayList<>();

        Optional<WorldFileRecord> record;
        try {
            record = parser.read(imagePath);
        } catch (WorldFileFormatException e) {
            logger.warn("Ignoring malformed world file {}: {}", e.getWorldFile(), e.getMessage());
            messages.add(NO_GEOREFERENCING);
            messages.add(e.getMessage());
            return new RasterLoadResult(GeoRaster.unreferenced(pixels, imagePath), messages);
        }

        if (record.isEmpty()) {
            logger.info(res.getString("loader.noWorldFile"), imagePath);
            messages.add(NO_GEOREFERENCING);
            return new RasterLoadResult(GeoRaster.unreferenced(pixels, imagePath), messages);
        }

        // DegenerateTransformException is a hard error and propagates
        GeoTransform transform = GeoTransform.fromWorldFile(record.get());
        String rasterCrs = CrsIds.isKnown(crs) ? CrsIds.normalize(crs) : config.getDefaultCrs();

        checkEnvelope(transform, imagePath).ifPresent(messages::add);

        GeoRaster raster = GeoRaster.georeferenced(pixels, transform, rasterCrs, imagePath);
        logger.info(res.getString("loader.loaded"), imagePath, pixels.getWidth(), pixels.getHeight(), rasterCrs);
        return new RasterLoadResult(raster, messages);
    }

    /**
     * Advisory check of the world file origin against the expected coordinate domain.
     */
    Optional<String> checkEnvelope(GeoTransform transform, Path imagePath) {
        BoundingBox envelope = config.getExpectedEnvelope();
        if (envelope == null) {
            return Optional.empty();
        }
        double x = transform.getX0();
        double y = transform.getY0();
        if (envelope.contains(x, y)) {
            return Optional.empty();
        }
        logger.warn(res.getString("loader.outsideEnvelope"), x, y, imagePath, envelope);
        return Optional.of(String.format("Upper-left corner (%.3f, %.3f) is outside the expected area %s",
                x, y, envelope));
    }
}
