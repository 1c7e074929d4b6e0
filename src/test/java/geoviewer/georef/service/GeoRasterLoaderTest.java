package geoviewer.georef.service;

import static org.junit.jupiter.api.Assertions.*;

import geoviewer.georef.model.GeoRaster;
import geoviewer.georef.model.PixelBuffer;
import geoviewer.georef.utilities.DegenerateTransformException;
import geoviewer.georef.utilities.GeoTransform;
import geoviewer.georef.utilities.ViewerConfigManager;
import geoviewer.georef.utilities.WorldFileParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Unit tests for GeoRasterLoader.
 *
 * <p>Tests focus on:
 * <ul>
 *   <li>Georeferencing from a world file</li>
 *   <li>Missing, malformed and degenerate world files</li>
 *   <li>CRS selection</li>
 *   <li>The advisory envelope check</li>
 * </ul>
 */
class GeoRasterLoaderTest {

    private static final String VALID_WORLD_FILE = "10\n0\n0\n-10\n200005\n700005\n";

    @TempDir
    Path tempDir;

    private GeoRasterLoader loader;
    private PixelBuffer pixels;

    @BeforeEach
    void setUp() {
        loader = new GeoRasterLoader(new WorldFileParser(), ViewerConfigManager.loadDefaults());
        pixels = PixelBuffer.filled(100, 100, 200);
    }

    // ==================== Georeferencing Tests ====================

    @Test
    @DisplayName("World file georeferences the raster in the default CRS")
    void testGeoreferenced() throws IOException {
        Path image = tempDir.resolve("ortho.jpg");
        Files.writeString(image.resolveSibling("ortho.jgw"), VALID_WORLD_FILE);

        RasterLoadResult result = loader.load(pixels, image);

        GeoRaster raster = result.raster();
        assertTrue(result.isGeoreferenced());
        assertEquals("EPSG:2039", raster.crs());
        assertEquals(new GeoTransform(10, 0, 0, -10, 200000, 700010), raster.getTransform().orElseThrow());
        assertEquals(200000, raster.bounds().orElseThrow().getMinX(), 1e-9);
        assertEquals(201000, raster.bounds().orElseThrow().getMaxX(), 1e-9);
        assertEquals(699010, raster.bounds().orElseThrow().getMinY(), 1e-9);
        assertEquals(700010, raster.bounds().orElseThrow().getMaxY(), 1e-9);
        assertTrue(result.messages().isEmpty());
    }

    @Test
    @DisplayName("An explicit CRS overrides the default")
    void testExplicitCrs() throws IOException {
        Path image = tempDir.resolve("web.png");
        Files.writeString(image.resolveSibling("web.pgw"), "1\n0\n0\n-1\n0.5\n-0.5\n");

        RasterLoadResult result = loader.load(pixels, image, "epsg:3857");

        assertEquals("EPSG:3857", result.raster().crs());
    }

    // ==================== Failure Policy Tests ====================

    @Test
    @DisplayName("Missing world file gives an unreferenced raster")
    void testMissingWorldFile() {
        RasterLoadResult result = loader.load(pixels, tempDir.resolve("plain.png"));

        assertFalse(result.isGeoreferenced());
        assertEquals("unknown", result.raster().crs());
        assertEquals(List.of(GeoRasterLoader.NO_GEOREFERENCING), result.messages());
    }

    @Test
    @DisplayName("Malformed world file gives an unreferenced raster and the parse error")
    void testMalformedWorldFile() throws IOException {
        Path image = tempDir.resolve("broken.tif");
        Files.writeString(image.resolveSibling("broken.tfw"), "10\n0\n0\n");

        RasterLoadResult result = loader.load(pixels, image);

        assertFalse(result.isGeoreferenced());
        assertEquals(2, result.messages().size());
        assertEquals(GeoRasterLoader.NO_GEOREFERENCING, result.messages().get(0));
        assertTrue(result.messages().get(1).contains("non-blank lines"), result.messages().get(1));
    }

    @Test
    @DisplayName("NaN in a world file is treated as malformed, not as a degenerate transform")
    void testNaNWorldFile() throws IOException {
        Path image = tempDir.resolve("nan.jpg");
        Files.writeString(image.resolveSibling("nan.jgw"), "10\n0\n0\n-10\nNaN\n700005\n");

        RasterLoadResult result = loader.load(pixels, image);

        assertFalse(result.isGeoreferenced());
        assertEquals(GeoRasterLoader.NO_GEOREFERENCING, result.messages().get(0));
        assertTrue(result.messages().get(1).contains("line 5"), result.messages().get(1));
    }

    @Test
    @DisplayName("Zero pixel size is a hard error")
    void testDegenerateWorldFile() throws IOException {
        Path image = tempDir.resolve("flat.jpg");
        Files.writeString(image.resolveSibling("flat.jgw"), "0\n0\n0\n-10\n200005\n700005\n");

        assertThrows(DegenerateTransformException.class, () -> loader.load(pixels, image));
    }

    // ==================== Envelope Tests ====================

    @Test
    @DisplayName("Origin outside the expected envelope is reported, not rejected")
    void testOutsideEnvelope() throws IOException {
        Path image = tempDir.resolve("wgs.jpg");
        Files.writeString(image.resolveSibling("wgs.jgw"), "0.0001\n0\n0\n-0.0001\n34.78\n32.08\n");

        RasterLoadResult result = loader.load(pixels, image);

        assertTrue(result.isGeoreferenced());
        assertEquals(1, result.messages().size());
        assertTrue(result.messages().get(0).contains("outside the expected area"));
    }

    @Test
    @DisplayName("Envelope check is skipped when no envelope is configured")
    void testNoEnvelopeConfigured() throws IOException {
        Path configFile = tempDir.resolve("config.yml");
        Files.writeString(configFile, """
                crs:
                  expected_envelope: null
                """);
        GeoRasterLoader unchecked = new GeoRasterLoader(new WorldFileParser(), ViewerConfigManager.load(configFile));

        assertTrue(unchecked.checkEnvelope(new GeoTransform(1, 0, 0, -1, 0, 0), tempDir).isEmpty());
    }

    // ==================== Image IO Tests ====================

    @Test
    @DisplayName("Reads a PNG from disk together with its world file")
    void testLoadFromDisk() throws IOException {
        Path image = tempDir.resolve("tile.png");
        BufferedImage rgb = new BufferedImage(8, 6, BufferedImage.TYPE_INT_RGB);
        rgb.setRGB(0, 0, 0xFF0000);
        ImageIO.write(rgb, "png", image.toFile());
        Files.writeString(tempDir.resolve("tile.pgw"), VALID_WORLD_FILE);

        RasterLoadResult result = loader.load(image);

        assertEquals(8, result.raster().getWidth());
        assertEquals(6, result.raster().getHeight());
        assertEquals(255, result.raster().getPixels().getSample(0, 0, 0));
        assertTrue(result.isGeoreferenced());
    }

    @Test
    @DisplayName("Missing or unreadable images are IOExceptions")
    void testUnreadableImage() throws IOException {
        assertThrows(IOException.class, () -> loader.load(tempDir.resolve("absent.png")));

        Path notAnImage = tempDir.resolve("notes.png");
        Files.writeString(notAnImage, "not an image");
        assertThrows(IOException.class, () -> loader.load(notAnImage));
    }
}
