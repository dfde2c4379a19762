package photolib.ext.crop.utilities;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.DisplayName;

import photolib.ext.crop.model.CropRect;
import photolib.ext.crop.model.TransformParams;

import java.awt.geom.Point2D;

/**
 * Unit tests for the coordinate chain and the export helpers.
 */
class CropGeometryTest {

    // ==================== Mappings ====================

    @Test
    @DisplayName("Source and BB-normalized coordinates map both ways under rotation and perspective")
    void testMappingRoundTrip() {
        CropGeometry geometry = new CropGeometry(4000, 3000, new TransformParams(0.3, 1, 12, -8, 0.2, 0), 28);
        double[][] points = {{0.1, 0.2}, {0.5, 0.5}, {0.9, 0.7}, {0, 1}};
        for (double[] uv : points) {
            Point2D.Double n = geometry.sourceToNormalized(uv[0], uv[1]);
            Point2D.Double back = geometry.normalizedToSource(n.x, n.y);
            assertEquals(uv[0], back.x, 1e-9);
            assertEquals(uv[1], back.y, 1e-9);
        }
    }

    @Test
    @DisplayName("Image pixel mapping inverts the rotation")
    void testImagePixelRoundTrip() {
        CropGeometry geometry = new CropGeometry(3000, 2000, TransformParams.IDENTITY.withFineAngle(-0.4), 28);
        Point2D.Double px = geometry.normalizedToImagePixel(0.3, 0.6);
        Point2D.Double n = geometry.imagePixelToNormalized(px.x, px.y);
        assertEquals(0.3, n.x, 1e-12);
        assertEquals(0.6, n.y, 1e-12);
    }

    // ==================== Rescale ====================

    @Test
    @DisplayName("Rescaling across a BB change keeps the pixel footprint and center offset")
    void testRescaleKeepsFootprint() {
        CropGeometry from = new CropGeometry(3000, 2000, TransformParams.IDENTITY, 28);
        CropGeometry to = new CropGeometry(3000, 2000, TransformParams.IDENTITY.withFineAngle(0.3), 28);
        CropRect rect = new CropRect(0.2, 0.3, 0.4, 0.2);
        CropRect rescaled = to.rescaleCropFrom(from, rect);

        assertEquals(rect.w() * 3000, rescaled.w() * to.getBoundingBox().getWidth(), 1e-9);
        assertEquals(rect.h() * 2000, rescaled.h() * to.getBoundingBox().getHeight(), 1e-9);
        double offsetBefore = (rect.centerX() - 0.5) * 3000;
        double offsetAfter = (rescaled.centerX() - 0.5) * to.getBoundingBox().getWidth();
        assertEquals(offsetBefore, offsetAfter, 1e-9);
    }

    // ==================== Export ====================

    @Test
    @DisplayName("Output size is the crop in bounding-box pixels")
    void testOutputSize() {
        CropGeometry geometry = new CropGeometry(3000, 2000, TransformParams.IDENTITY, 28);
        assertArrayEquals(new int[]{3000, 2000}, geometry.outputSize(CropRect.FULL));
        assertArrayEquals(new int[]{1500, 500}, geometry.outputSize(new CropRect(0, 0, 0.5, 0.25)));
        assertArrayEquals(new int[]{1, 1}, geometry.outputSize(new CropRect(0, 0, 1e-6, 1e-6)));
    }

    @Test
    @DisplayName("Crop quad of the full frame is the source image corners")
    void testCropQuad() {
        CropGeometry geometry = new CropGeometry(3000, 2000, TransformParams.IDENTITY, 28);
        assertArrayEquals(new double[]{0, 0, 1, 0, 1, 1, 0, 1}, geometry.cropQuad(CropRect.FULL), 1e-12);
    }

    @Test
    @DisplayName("Containment rejects a rect that pokes out of a rotated image")
    void testContainsRect() {
        CropGeometry geometry = new CropGeometry(3000, 2000, TransformParams.IDENTITY.withFineAngle(0.3), 28);
        assertFalse(geometry.containsRect(CropRect.FULL));
        assertTrue(geometry.containsRect(new CropRect(0.45, 0.45, 0.1, 0.1)));
    }
}
