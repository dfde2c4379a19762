package photolib.ext.crop.utilities;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import photolib.ext.crop.model.CropRect;
import photolib.ext.crop.model.TransformParams;

import java.awt.geom.Point2D;

/**
 * Unit tests for the non-interactive bounds correction.
 */
class BoundsCorrectorTest {

    private static final int SRC_W = 3000;
    private static final int SRC_H = 2000;

    private final BoundsCorrector corrector = new BoundsCorrector();

    private static CropGeometry geometry(TransformParams params) {
        return new CropGeometry(SRC_W, SRC_H, params, 28);
    }

    // ==================== Axis-aligned ====================

    @Test
    @DisplayName("Valid axis-aligned rect is returned unchanged")
    void testValidUnchanged() {
        CropRect rect = new CropRect(0.1, 0.2, 0.5, 0.5);
        assertSame(rect, corrector.correct(geometry(TransformParams.IDENTITY), rect));
    }

    @Test
    @DisplayName("Axis-aligned rect outside the box is clamped back")
    void testAxisAlignedClamp() {
        CropRect corrected = corrector.correct(geometry(TransformParams.IDENTITY), new CropRect(0.8, 0.8, 0.5, 0.5));
        assertEquals(0.5, corrected.x(), 1e-12);
        assertEquals(0.5, corrected.y(), 1e-12);
        assertEquals(0.5, corrected.w(), 1e-12);
    }

    @Test
    @DisplayName("Oversized axis-aligned rect is shrunk uniformly, then clamped")
    void testAxisAlignedShrink() {
        CropRect corrected = corrector.correct(geometry(TransformParams.IDENTITY), new CropRect(-0.1, 0.0, 1.2, 0.6));
        assertEquals(1.0, corrected.w(), 1e-12);
        assertEquals(0.5, corrected.h(), 1e-12);
        assertEquals(0.0, corrected.x(), 1e-12);
        assertEquals(0.05, corrected.y(), 1e-12);
    }

    @Test
    @DisplayName("Minimum size is enforced")
    void testMinimumSize() {
        CropRect corrected = corrector.correct(geometry(TransformParams.IDENTITY), new CropRect(0.4, 0.4, 0.001, 0.001));
        assertTrue(corrected.w() >= CropRect.MIN_SIZE);
        assertTrue(corrected.h() >= CropRect.MIN_SIZE);
    }

    @ParameterizedTest
    @CsvSource({
            "3000, 2000, 0, -0.1, 0.49, 1.2, 0.02",
            "3000, 2000, 0, 0.49, -0.1, 0.02, 1.2",
            "1000, 1000, 0.7853981633974483, 0.0, 0.49, 1.0, 0.02",
            "3000, 2000, 0.3, 0.49, -0.1, 0.02, 1.2",
            "3000, 2000, -0.5, -0.2, 0.49, 1.4, 0.02"
    })
    @DisplayName("Shrinking a thin oversized crop never goes below the minimum size")
    void testThinShrinkKeepsMinimum(int srcW, int srcH, double fine, double x, double y, double w, double h) {
        CropGeometry geometry = new CropGeometry(srcW, srcH, TransformParams.IDENTITY.withFineAngle(fine), 28);
        CropRect corrected = corrector.correct(geometry, new CropRect(x, y, w, h));

        assertTrue(corrected.w() >= CropRect.MIN_SIZE, corrected.toString());
        assertTrue(corrected.h() >= CropRect.MIN_SIZE, corrected.toString());
        assertTrue(geometry.containsRect(corrected), corrected.toString());
        assertSame(corrected, corrector.correct(geometry, corrected));
    }

    // ==================== Rotation only ====================

    @Test
    @DisplayName("Scenario C: full-frame crop at 22.5 degrees shrinks inside the source image")
    void testScenarioC() {
        CropGeometry geometry = geometry(TransformParams.IDENTITY.withFineAngle(Math.PI / 8));
        CropRect corrected = corrector.correct(geometry, CropRect.FULL);

        assertTrue(corrected.w() < 1.0);
        assertTrue(corrected.h() < 1.0);
        assertEquals(1.0, corrected.aspect(), 1e-9);
        for (double[] c : corrected.corners()) {
            Point2D.Double p = geometry.normalizedToImagePixel(c[0], c[1]);
            assertTrue(Math.abs(p.x) <= SRC_W / 2.0 + 1e-6, "x=" + p.x);
            assertTrue(Math.abs(p.y) <= SRC_H / 2.0 + 1e-6, "y=" + p.y);
        }
        assertTrue(geometry.containsRect(corrected));
    }

    @Test
    @DisplayName("Rotated crop that fits but is off-center is moved, not shrunk")
    void testRotatedReposition() {
        CropGeometry geometry = geometry(TransformParams.IDENTITY.withFineAngle(0.2));
        CropRect rect = new CropRect(0.0, 0.0, 0.2, 0.2);
        CropRect corrected = corrector.correct(geometry, rect);
        assertEquals(0.2, corrected.w(), 1e-12);
        assertEquals(0.2, corrected.h(), 1e-12);
        assertTrue(geometry.containsRect(corrected));
    }

    // ==================== Perspective ====================

    @ParameterizedTest
    @CsvSource({
            "0, 25, 0, 0",
            "0, -30, 20, 0",
            "0.2, 15, 0, 0.4",
            "0, 0, 0, -0.8"
    })
    @DisplayName("Warped full-frame crop ends up inside the image")
    void testPerspectiveContainment(double fine, double perspV, double perspH, double shear) {
        CropGeometry geometry = geometry(new TransformParams(fine, 0, perspV, perspH, shear, 0));
        CropRect corrected = corrector.correct(geometry, CropRect.FULL);
        assertTrue(geometry.containsRect(corrected), corrected.toString());
        assertTrue(corrected.w() >= CropRect.MIN_SIZE && corrected.h() >= CropRect.MIN_SIZE);
    }

    // ==================== Idempotence ====================

    @ParameterizedTest
    @CsvSource({
            "0, 0, 0, 0, 0",
            "0.3, 0, 0, 0, 0",
            "-0.6, 1, 0, 0, 0",
            "0, 0, 20, 0, 0",
            "0, 0, -15, 10, 0.3",
            "0.2, 3, 10, -10, 0"
    })
    @DisplayName("Correcting twice is a fixed point")
    void testIdempotent(double fine, int rot90, double perspV, double perspH, double shear) {
        CropGeometry geometry = geometry(new TransformParams(fine, rot90, perspV, perspH, shear, 0));
        CropRect once = corrector.correct(geometry, new CropRect(-0.2, 0.1, 1.1, 0.8));
        CropRect twice = corrector.correct(geometry, once);
        assertSame(once, twice);
    }
}
