package photolib.ext.crop.utilities;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Unit tests for YAML-backed crop settings.
 */
class CropConfigManagerTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Bundled config matches the built-in defaults")
    void testBundledDefaults() {
        CropConfigManager config = CropConfigManager.fromDefaults();
        assertEquals(CropSettings.DEFAULTS, config.toSettings());
        assertEquals(50, config.getInteger("crop", "undo_limit"));
        assertEquals(0.92, config.getDouble("crop", "flip_threshold"));
    }

    @Test
    @DisplayName("A user file overrides individual keys")
    void testFileOverrides() throws IOException {
        Path file = tempDir.resolve("crop.yml");
        Files.writeString(file, "crop:\n  undo_limit: 10\n  flip_threshold: 0.8\n");

        CropSettings settings = CropConfigManager.fromFile(file.toString()).toSettings();
        assertEquals(10, settings.undoLimit());
        assertEquals(0.8, settings.flipThreshold());
        assertEquals(CropSettings.DEFAULTS.rotateMarginPx(), settings.rotateMarginPx());
        assertEquals(CropSettings.DEFAULTS.startEpsilon(), settings.startEpsilon());
    }

    @Test
    @DisplayName("A missing user file leaves the defaults in place")
    void testMissingFile() {
        CropSettings settings = CropConfigManager.fromFile(tempDir.resolve("absent.yml").toString()).toSettings();
        assertEquals(CropSettings.DEFAULTS, settings);
    }

    @Test
    @DisplayName("Unparsable values fall back to the default")
    void testBadValueFallsBack() {
        CropConfigManager config = CropConfigManager.fromMap(Map.of("crop", Map.of("handle_size_px", "large")));
        assertNull(config.getDouble("crop", "handle_size_px"));
        assertEquals(CropSettings.DEFAULTS.handleSizePx(), config.toSettings().handleSizePx());
    }

    @Test
    @DisplayName("Out-of-range values are rejected")
    void testOutOfRange() {
        CropConfigManager config = CropConfigManager.fromMap(Map.of("crop", Map.of("flip_threshold", 2.0)));
        assertThrows(IllegalArgumentException.class, config::toSettings);
    }

    @Test
    @DisplayName("Nested lookups return null for missing paths")
    void testGetConfigItem() {
        CropConfigManager config = CropConfigManager.fromDefaults();
        assertNull(config.getConfigItem("crop", "missing"));
        assertNull(config.getConfigItem("other", "undo_limit"));
        assertTrue(config.getAllConfig().containsKey("crop"));
    }
}
