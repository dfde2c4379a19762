package photolib.ext.crop.utilities;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import photolib.ext.crop.model.TransformParams;

import java.awt.geom.Point2D;

/**
 * Unit tests for the perspective / shear warp.
 */
class WarpTest {

    private static final double TOLERANCE = 1e-9;
    private static final double[] GRID = {0.0, 0.1, 0.25, 0.5, 0.75, 0.9, 1.0};

    // ==================== Identity ====================

    @Test
    @DisplayName("Zero perspective and shear is the identity in both directions")
    void testIdentity() {
        Warp warp = new Warp(TransformParams.IDENTITY.withFineAngle(0.3), 3000, 2000, 28);
        assertTrue(warp.isIdentity());
        Point2D.Double f = warp.forwardWarp(0.3, 0.7);
        Point2D.Double i = warp.inverseWarp(0.3, 0.7);
        assertEquals(0.3, f.x, 0.0);
        assertEquals(0.7, f.y, 0.0);
        assertEquals(0.3, i.x, 0.0);
        assertEquals(0.7, i.y, 0.0);
    }

    @Test
    @DisplayName("Image center is a fixed point of the warp")
    void testCenterFixed() {
        Warp warp = new Warp(TransformParams.IDENTITY.withPerspective(20, -10), 3000, 2000, 28);
        Point2D.Double c = warp.forwardWarp(0.5, 0.5);
        assertEquals(0.5, c.x, TOLERANCE);
        assertEquals(0.5, c.y, TOLERANCE);
    }

    // ==================== Round trip ====================

    @ParameterizedTest
    @CsvSource({
            "20, 0, 0",
            "0, -30, 0",
            "45, 45, 0",
            "-45, 45, 1",
            "10, -20, -0.5",
            "0, 0, 1",
            "-45, -45, -1"
    })
    @DisplayName("Inverse warp undoes the forward warp across the tilt and shear range")
    void testRoundTrip(double perspV, double perspH, double shear) {
        Warp warp = new Warp(new TransformParams(0, 0, perspV, perspH, shear, 0), 4000, 3000, 28);
        for (double u : GRID) {
            for (double v : GRID) {
                Point2D.Double w = warp.forwardWarp(u, v);
                Point2D.Double back = warp.inverseWarp(w.x, w.y);
                assertEquals(u, back.x, TOLERANCE, "u at " + u + "," + v);
                assertEquals(v, back.y, TOLERANCE, "v at " + u + "," + v);

                Point2D.Double again = warp.forwardWarp(back.x, back.y);
                assertEquals(w.x, again.x, TOLERANCE);
                assertEquals(w.y, again.y, TOLERANCE);
            }
        }
    }

    // ==================== Limits ====================

    @Test
    @DisplayName("Projective coefficients are scaled to keep the denominator bounded")
    void testDenominatorBound() {
        Warp warp = new Warp(new TransformParams(0, 0, 45, 45, 1, 10), 3000, 2000, 28);
        double worst = Math.abs(warp.getGx()) * 2.0 + Math.abs(warp.getGy());
        assertTrue(worst <= 1.0 - Warp.MIN_DENOMINATOR + 1e-12, "worst=" + worst);
    }

    @Test
    @DisplayName("Points beyond the horizon have no pre-image")
    void testBeyondHorizon() {
        Warp warp = new Warp(TransformParams.IDENTITY.withPerspective(0, 30), 3000, 2000, 28);
        Point2D.Double p = warp.inverseWarp(1000, 0.5);
        assertTrue(Double.isNaN(p.x));
        assertTrue(Double.isNaN(p.y));
    }

    @Test
    @DisplayName("Longer focal length gives a weaker warp for the same tilt")
    void testFocalLengthSensitivity() {
        Warp wide = new Warp(new TransformParams(0, 0, 15, 0, 0, 24), 3000, 2000, 28);
        Warp tele = new Warp(new TransformParams(0, 0, 15, 0, 0, 100), 3000, 2000, 28);
        assertTrue(Math.abs(wide.getGy()) > Math.abs(tele.getGy()));
    }

    @Test
    @DisplayName("Non-positive image dimensions are rejected")
    void testInvalidDimensions() {
        assertThrows(IllegalArgumentException.class,
                () -> new Warp(TransformParams.IDENTITY, 0, 100, 28));
        assertThrows(IllegalArgumentException.class,
                () -> new Warp(TransformParams.IDENTITY, 100, -1, 28));
    }
}
