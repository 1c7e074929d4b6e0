package geoviewer.georef.utilities;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.ResourceBundle;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * ViewerConfigManager
 *
 * <p>Read-only access to viewer settings kept in YAML. The bundled
 * {@code geoviewer/georef/viewer-config.yml} supplies every default; a user file passed to
 * {@link #load(Path)} is merged on top of it section by section, so it only needs the keys
 * it changes.
 *
 * <p>Values are looked up by key path, e.g. {@code getDouble("viewport", "base_range_x")}.
 * The typed getters below fall back to built-in constants when a key is missing or has the
 * wrong type, so a broken user file never leaves the viewer without a setting.
 */
public class ViewerConfigManager {
    private static final Logger logger = LoggerFactory.getLogger(ViewerConfigManager.class);

    static final String DEFAULTS_RESOURCE = "geoviewer/georef/viewer-config.yml";

    public static final double DEFAULT_BASE_RANGE = 500.0;
    public static final double DEFAULT_MIN_RANGE = 1.0;
    public static final double DEFAULT_MARGIN_FRACTION = 0.05;
    public static final double DEFAULT_MIN_ZOOM_FACTOR = 0.1;
    public static final double DEFAULT_SLIDER_DIVISOR = 10.0;
    public static final String DEFAULT_CRS = "EPSG:2039";
    public static final String DEFAULT_ID_FIELD = "ID";

    /** Key paths every configuration should define; missing ones fall back to the constants above. */
    public static final Set<String[]> REQUIRED_KEYS = Set.of(
            new String[]{"viewport", "base_range_x"},
            new String[]{"viewport", "base_range_y"},
            new String[]{"viewport", "min_range"},
            new String[]{"viewport", "margin_fraction"},
            new String[]{"zoom", "min_factor"},
            new String[]{"zoom", "slider_divisor"},
            new String[]{"crs", "default"},
            new String[]{"workflow", "id_field_name"});

    private final Map<String, Object> configData;
    private final ResourceBundle res = ResourceBundle.getBundle("geoviewer.georef.ui.strings");

    ViewerConfigManager(Map<String, Object> configData) {
        this.configData = configData;
    }

    /**
     * Settings from the bundled defaults only.
     */
    public static ViewerConfigManager loadDefaults() {
        return new ViewerConfigManager(loadDefaultMap());
    }

    /**
     * Bundled defaults overlaid with the YAML file at {@code configPath}. A missing or
     * unreadable file is logged and the defaults are used unchanged.
     */
    public static ViewerConfigManager load(Path configPath) {
        Map<String, Object> merged = loadDefaultMap();
        Map<String, Object> user = loadConfig(configPath);
        deepMerge(merged, user);
        logger.info("Loaded viewer configuration from {} ({} top-level sections)", configPath, merged.size());
        ViewerConfigManager manager = new ViewerConfigManager(merged);
        if (!manager.validateRequiredKeys(REQUIRED_KEYS).isEmpty()) {
            logger.warn("Configuration {} overrides required keys with nothing; built-in defaults apply", configPath);
        }
        return manager;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> loadDefaultMap() {
        ClassLoader loader = ViewerConfigManager.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                logger.error("Default configuration resource not found: {}", DEFAULTS_RESOURCE);
                return new LinkedHashMap<>();
            }
            Object loaded = new Yaml().load(in);
            if (loaded instanceof Map) {
                return new LinkedHashMap<>((Map<String, Object>) loaded);
            }
            logger.error("YAML root is not a map: {}", DEFAULTS_RESOURCE);
        } catch (IOException e) {
            logger.error("Error reading default configuration {}", DEFAULTS_RESOURCE, e);
        }
        return new LinkedHashMap<>();
    }

    /**
     * Loads a YAML file into a Map.
     *
     * @return Map of YAML data, or empty map on error.
     */
    @SuppressWarnings("unchecked")
    private static Map<String, Object> loadConfig(Path path) {
        if (!Files.isRegularFile(path)) {
            logger.error("YAML file not found: {}", path);
            return new LinkedHashMap<>();
        }
        try (InputStream in = Files.newInputStream(path)) {
            Object loaded = new Yaml().load(in);
            if (loaded instanceof Map) {
                return new LinkedHashMap<>((Map<String, Object>) loaded);
            } else if (loaded != null) {
                logger.error("YAML root is not a map: {}", path);
            }
        } catch (Exception e) {
            logger.error("Error parsing YAML: {}", path, e);
        }
        return new LinkedHashMap<>();
    }

    @SuppressWarnings("unchecked")
    private static void deepMerge(Map<String, Object> target, Map<String, Object> overlay) {
        for (Map.Entry<String, Object> entry : overlay.entrySet()) {
            Object existing = target.get(entry.getKey());
            if (existing instanceof Map && entry.getValue() instanceof Map) {
                Map<String, Object> copy = new LinkedHashMap<>((Map<String, Object>) existing);
                deepMerge(copy, (Map<String, Object>) entry.getValue());
                target.put(entry.getKey(), copy);
            } else {
                target.put(entry.getKey(), entry.getValue());
            }
        }
    }


    /**
     * Retrieve a nested value from the configuration.
     *
     * @param keys Sequence of keys (e.g., "crs", "expected_envelope", "x_min").
     * @return The value at the end of the key path, or null if not found.
     */
    public Object getConfigItem(String... keys) {
        Object current = configData;
        for (int i = 0; i < keys.length; i++) {
            String key = keys[i];
            if (current instanceof Map<?, ?> map && map.containsKey(key)) {
                current = map.get(key);
                continue;
            }
            logger.debug(res.getString("configManager.keyNotFound"), key, i, Arrays.toString(keys));
            return null;
        }
        return current;
    }

    public String getString(String... keys) {
        Object v = getConfigItem(keys);
        return (v instanceof String) ? (String) v : null;
    }

    public Double getDouble(String... keys) {
        Object v = getConfigItem(keys);
        if (v instanceof Number n) return n.doubleValue();
        try {
            return (v != null) ? Double.parseDouble(v.toString()) : null;
        } catch (NumberFormatException e) {
            logger.warn("Expected double at {} but got {}", String.join("/", keys), v);
            return null;
        }
    }

    /**
     * Validates that each of the provided key paths exists.
     *
     * @return Set of missing paths (empty if all are present).
     */
    public Set<String[]> validateRequiredKeys(Set<String[]> requiredPaths) {
        Set<String[]> missing = new LinkedHashSet<>();
        for (String[] path : requiredPaths) {
            if (getConfigItem(path) == null) missing.add(path);
        }
        if (!missing.isEmpty()) {
            logger.error("Missing required configuration keys: {}",
                    missing.stream().map(p -> String.join("/", p)).collect(Collectors.toList()));
        }
        return missing;
    }

    private double positiveOr(double fallback, String... keys) {
        Double v = getDouble(keys);
        if (v == null || !Double.isFinite(v) || v <= 0) {
            if (v != null) {
                logger.warn(res.getString("configManager.invalidValue"), String.join("/", keys), v, fallback);
            }
            return fallback;
        }
        return v;
    }

    // ==================== Typed settings ====================

    public double getBaseRangeX() {
        return positiveOr(DEFAULT_BASE_RANGE, "viewport", "base_range_x");
    }

    public double getBaseRangeY() {
        return positiveOr(DEFAULT_BASE_RANGE, "viewport", "base_range_y");
    }

    public double getMinRange() {
        return positiveOr(DEFAULT_MIN_RANGE, "viewport", "min_range");
    }

    public double getMarginFraction() {
        Double v = getDouble("viewport", "margin_fraction");
        return (v != null && Double.isFinite(v) && v >= 0) ? v : DEFAULT_MARGIN_FRACTION;
    }

    public double getDefaultZoomFactor() {
        return positiveOr(1.0, "zoom", "default_factor");
    }

    public double getMinZoomFactor() {
        return positiveOr(DEFAULT_MIN_ZOOM_FACTOR, "zoom", "min_factor");
    }

    public double getSliderDivisor() {
        return positiveOr(DEFAULT_SLIDER_DIVISOR, "zoom", "slider_divisor");
    }

    /**
     * CRS assigned to rasters that carry a world file but no CRS of their own.
     */
    public String getDefaultCrs() {
        String crs = CrsIds.normalize(getString("crs", "default"));
        return crs != null ? crs : DEFAULT_CRS;
    }

    /**
     * Advisory envelope for world file origins, or null when not configured.
     */
    public BoundingBox getExpectedEnvelope() {
        Double xMin = getDouble("crs", "expected_envelope", "x_min");
        Double xMax = getDouble("crs", "expected_envelope", "x_max");
        Double yMin = getDouble("crs", "expected_envelope", "y_min");
        Double yMax = getDouble("crs", "expected_envelope", "y_max");
        if (xMin == null || xMax == null || yMin == null || yMax == null) {
            return null;
        }
        return new BoundingBox(xMin, yMin, xMax, yMax);
    }

    public String getIdFieldName() {
        String name = getString("workflow", "id_field_name");
        return (name == null || name.isBlank()) ? DEFAULT_ID_FIELD : name;
    }
}
