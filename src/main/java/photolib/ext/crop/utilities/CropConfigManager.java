package photolib.ext.crop.utilities;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Loads crop editor settings from YAML.
 *
 * <p>The bundled {@code crop_config.yml} supplies the defaults; a user file, when given,
 * overrides individual keys. All keys live under the {@code crop:} root:</p>
 * <pre>
 * crop:
 *   undo_limit: 50
 *   handle_size_px: 4
 *   rotate_margin_px: 40
 *   flip_threshold: 0.92
 *   default_focal_length_mm: 28
 *   scroll_zoom_step: 0.03
 *   bisection_iterations: 16
 *   start_epsilon: 1.0e-4
 * </pre>
 *
 * <p>Missing or unparsable values fall back to {@link CropSettings#DEFAULTS}; unknown keys are
 * logged and ignored.</p>
 *
 * @since 0.1.0
 */
public class CropConfigManager {
    private static final Logger logger = LoggerFactory.getLogger(CropConfigManager.class);

    static final String DEFAULT_RESOURCE = "/crop_config.yml";
    static final String ROOT = "crop";

    private static final Set<String> KNOWN_KEYS = Set.of(
            "undo_limit", "handle_size_px", "rotate_margin_px", "flip_threshold",
            "default_focal_length_mm", "scroll_zoom_step", "bisection_iterations", "start_epsilon");

    private final Map<String, Object> configData;

    private CropConfigManager(Map<String, Object> configData) {
        this.configData = configData;
    }

    /**
     * Bundled defaults only.
     */
    public static CropConfigManager fromDefaults() {
        return new CropConfigManager(loadResource(DEFAULT_RESOURCE));
    }

    /**
     * Bundled defaults overridden by the file at {@code path}.
     *
     * @param path filesystem path to a YAML file; a missing file is logged and ignored
     */
    public static CropConfigManager fromFile(String path) {
        Map<String, Object> merged = loadResource(DEFAULT_RESOURCE);
        merge(merged, loadFile(path));
        return new CropConfigManager(merged);
    }

    /**
     * Bundled defaults overridden by already-parsed YAML data.
     */
    public static CropConfigManager fromMap(Map<String, Object> overrides) {
        Map<String, Object> merged = loadResource(DEFAULT_RESOURCE);
        merge(merged, overrides);
        return new CropConfigManager(merged);
    }

    public Map<String, Object> getAllConfig() {
        return Collections.unmodifiableMap(configData);
    }

    /**
     * Retrieve a nested value, or {@code null} if any key along the path is missing.
     */
    public Object getConfigItem(String... keys) {
        Object current = configData;
        for (String key : keys) {
            if (current instanceof Map<?, ?> map && map.containsKey(key)) {
                current = map.get(key);
            } else {
                return null;
            }
        }
        return current;
    }

    public Integer getInteger(String... keys) {
        Object v = getConfigItem(keys);
        if (v instanceof Number n) return n.intValue();
        try {
            return (v != null) ? Integer.parseInt(v.toString()) : null;
        } catch (NumberFormatException e) {
            logger.warn("Expected int at {} but got {}", String.join("/", keys), v);
            return null;
        }
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
     * Typed settings with every missing value taken from {@link CropSettings#DEFAULTS}.
     *
     * @throws IllegalArgumentException if a configured value is out of range
     */
    public CropSettings toSettings() {
        warnUnknownKeys();
        CropSettings d = CropSettings.DEFAULTS;
        return new CropSettings(
                intOr("undo_limit", d.undoLimit()),
                doubleOr("handle_size_px", d.handleSizePx()),
                doubleOr("rotate_margin_px", d.rotateMarginPx()),
                doubleOr("flip_threshold", d.flipThreshold()),
                doubleOr("default_focal_length_mm", d.defaultFocalLengthMm()),
                doubleOr("scroll_zoom_step", d.scrollZoomStep()),
                intOr("bisection_iterations", d.bisectionIterations()),
                doubleOr("start_epsilon", d.startEpsilon()));
    }

    private int intOr(String key, int fallback) {
        Integer v = getInteger(ROOT, key);
        return v != null ? v : fallback;
    }

    private double doubleOr(String key, double fallback) {
        Double v = getDouble(ROOT, key);
        return v != null ? v : fallback;
    }

    private void warnUnknownKeys() {
        if (configData.get(ROOT) instanceof Map<?, ?> section) {
            for (Object key : section.keySet()) {
                if (!KNOWN_KEYS.contains(String.valueOf(key))) {
                    logger.warn("Unknown crop setting '{}' ignored", key);
                }
            }
        }
    }

    // ==================== LOADING ====================

    @SuppressWarnings("unchecked")
    private static Map<String, Object> loadResource(String resource) {
        Yaml yaml = new Yaml();
        try (InputStream in = CropConfigManager.class.getResourceAsStream(resource)) {
            if (in == null) {
                logger.warn("Bundled config {} not found, using built-in defaults", resource);
                return new LinkedHashMap<>();
            }
            Object loaded = yaml.load(in);
            if (loaded instanceof Map) {
                return deepCopy((Map<String, Object>) loaded);
            }
            logger.error("YAML root is not a map: {}", resource);
        } catch (Exception e) {
            logger.error("Error parsing bundled YAML: {}", resource, e);
        }
        return new LinkedHashMap<>();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> loadFile(String path) {
        Yaml yaml = new Yaml();
        try (InputStream in = new FileInputStream(path)) {
            Object loaded = yaml.load(in);
            if (loaded instanceof Map) {
                logger.info("Loaded crop settings from {}", path);
                return (Map<String, Object>) loaded;
            }
            logger.error("YAML root is not a map: {}", path);
        } catch (FileNotFoundException e) {
            logger.warn("Crop config file not found: {}", path);
        } catch (Exception e) {
            logger.error("Error parsing YAML: {}", path, e);
        }
        return new LinkedHashMap<>();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> deepCopy(Map<String, Object> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((k, v) -> copy.put(k, v instanceof Map ? deepCopy((Map<String, Object>) v) : v));
        return copy;
    }

    @SuppressWarnings("unchecked")
    private static void merge(Map<String, Object> target, Map<String, Object> overrides) {
        if (overrides == null) {
            return;
        }
        overrides.forEach((k, v) -> {
            if (v instanceof Map && target.get(k) instanceof Map) {
                merge((Map<String, Object>) target.get(k), (Map<String, Object>) v);
            } else {
                target.put(k, v instanceof Map ? deepCopy((Map<String, Object>) v) : v);
            }
        });
    }
}
