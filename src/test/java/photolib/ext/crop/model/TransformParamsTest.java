package photolib.ext.crop.model;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/**
 * Unit tests for parameter clamping and the crop rectangle helpers.
 */
class TransformParamsTest {

    // ==================== Clamping ====================

    @Test
    @DisplayName("Values are clamped to their ranges on construction")
    void testClamping() {
        TransformParams p = new TransformParams(2.0, 0, 90, -90, 3, -5);
        assertEquals(Math.PI / 4, p.fineAngle(), 1e-15);
        assertEquals(45, p.perspV());
        assertEquals(-45, p.perspH());
        assertEquals(1, p.shear());
        assertEquals(0, p.focalLength35mm());
    }

    @ParameterizedTest
    @CsvSource({"0, 0", "1, 1", "4, 0", "5, 1", "-1, 3", "-6, 2"})
    @DisplayName("Quarter turns are normalized to 0-3")
    void testQuarterTurns(int given, int expected) {
        assertEquals(expected, TransformParams.IDENTITY.withRotate90(given).rotate90());
    }

    @Test
    @DisplayName("NaN inputs become zero")
    void testNaN() {
        TransformParams p = new TransformParams(Double.NaN, 0, Double.NaN, 0, Double.NaN, Double.NaN);
        assertEquals(TransformParams.IDENTITY, p);
    }

    @Test
    @DisplayName("Total rotation combines quarter turns and fine angle")
    void testTotalRotation() {
        TransformParams p = new TransformParams(0.1, 3, 0, 0, 0, 0);
        assertEquals(3 * Math.PI / 2 + 0.1, p.totalRotation(), 1e-12);
        assertTrue(p.hasFineRotation());
        assertFalse(p.hasPerspective());
        assertTrue(p.withShear(0.2).hasPerspective());
    }

    @Test
    @DisplayName("Unknown focal length falls back to the default")
    void testEffectiveFocalLength() {
        assertEquals(28, TransformParams.IDENTITY.effectiveFocalLength(28));
        assertEquals(50, TransformParams.IDENTITY.withFocalLength(50).effectiveFocalLength(28));
    }

    // ==================== CropRect ====================

    @Test
    @DisplayName("CropRect helpers keep the center where expected")
    void testCropRectHelpers() {
        CropRect r = new CropRect(0.1, 0.2, 0.4, 0.2);
        assertEquals(0.3, r.centerX(), 1e-12);
        assertEquals(0.3, r.centerY(), 1e-12);
        CropRect scaled = r.scaleAboutCenter(0.5);
        assertEquals(0.3, scaled.centerX(), 1e-12);
        assertEquals(0.2, scaled.w(), 1e-12);
        CropRect centered = r.centered();
        assertEquals(0.5, centered.centerX(), 1e-12);
        assertEquals(0.5, centered.centerY(), 1e-12);
        assertTrue(r.contains(0.3, 0.3));
        assertFalse(r.contains(0.6, 0.3));
    }

    @Test
    @DisplayName("Aspect presets expose orientation and lock flags")
    void testAspectFlags() {
        assertFalse(CropAspect.FREE.isLocked());
        assertTrue(CropAspect.A1_1.isLocked());
        assertFalse(CropAspect.A1_1.isOrientable());
        assertTrue(CropAspect.A16_9.isOrientable());
        assertEquals(1.5, CropAspect.ORIGINAL.longShortRatio(2000, 3000), 1e-12);
        assertEquals("4:3", CropAspect.A4_3.toString());
    }
}
