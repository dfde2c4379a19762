package photolib.ext.crop.utilities;

import photolib.ext.crop.model.CropRect;
import photolib.ext.crop.model.TransformParams;

import java.awt.geom.Point2D;

/**
 * CropGeometry - coordinate transformations for one source image under one set of
 * transform parameters.
 *
 * <p>Coordinate Systems:
 * <ul>
 *   <li><b>Source UV:</b> normalized source image coordinates (0-1)</li>
 *   <li><b>Warped UV:</b> source UV after shear and perspective, see {@link Warp}</li>
 *   <li><b>Rotated pixels:</b> warped image in pixels, centered on the image center, rotated by
 *       {@link TransformParams#totalRotation()}</li>
 *   <li><b>BB-normalized:</b> rotated pixels normalized to the {@link BoundingBox} (0-1)</li>
 * </ul>
 *
 * <p>Transform Chain:
 * <pre>
 * Source UV ←→ Warped UV ←→ Rotated pixels ←→ BB-normalized
 * </pre>
 *
 * <p>Instances are immutable and cheap; a new one is built whenever the parameters change.
 *
 * @since 0.1.0
 */
public final class CropGeometry {

    /** Tolerance, in source UV, of the corner containment test. */
    public static final double CONTAINMENT_EPSILON = 1e-6;

    private final int srcW;
    private final int srcH;
    private final TransformParams params;
    private final Warp warp;
    private final BoundingBox bb;
    private final double cosR;
    private final double sinR;

    public CropGeometry(int srcW, int srcH, TransformParams params, double defaultFocalMm) {
        this.srcW = srcW;
        this.srcH = srcH;
        this.params = params;
        this.warp = new Warp(params, srcW, srcH, defaultFocalMm);
        this.bb = BoundingBox.computeBB(warp, params, srcW, srcH);
        double[] cs = BoundingBox.rotationCosSin(params);
        this.cosR = cs[0];
        this.sinR = cs[1];
    }

    public int getSourceWidth() { return srcW; }

    public int getSourceHeight() { return srcH; }

    public TransformParams getParams() { return params; }

    public Warp getWarp() { return warp; }

    public BoundingBox getBoundingBox() { return bb; }

    /** Cosine of the total rotation. */
    public double cos() { return cosR; }

    /** Sine of the total rotation. */
    public double sin() { return sinR; }

    /**
     * Bounding-box width over height; converts pixel aspect ratios to normalized ones.
     */
    public double bbAspect() {
        return bb.getWidth() / bb.getHeight();
    }

    // ==================== POINT MAPPINGS ====================

    /**
     * Source UV → BB-normalized.
     */
    public Point2D.Double sourceToNormalized(double u, double v) {
        Point2D.Double w = warp.forwardWarp(u, v);
        double px = (w.x - 0.5) * srcW;
        double py = (w.y - 0.5) * srcH;
        return bb.toNormalized(px * cosR - py * sinR, px * sinR + py * cosR);
    }

    /**
     * BB-normalized → source UV. NaN coordinates mean the point has no pre-image.
     */
    public Point2D.Double normalizedToSource(double bx, double by) {
        Point2D.Double p = bb.toPixel(bx, by);
        // inverse rotation
        double ix = p.x * cosR + p.y * sinR;
        double iy = -p.x * sinR + p.y * cosR;
        return warp.inverseWarp(ix / srcW + 0.5, iy / srcH + 0.5);
    }

    /**
     * BB-normalized → unrotated image pixels (centered on the image center).
     * Ignores the warp; used by the rotation-only paths.
     */
    public Point2D.Double normalizedToImagePixel(double bx, double by) {
        Point2D.Double p = bb.toPixel(bx, by);
        return new Point2D.Double(p.x * cosR + p.y * sinR, -p.x * sinR + p.y * cosR);
    }

    /**
     * Unrotated image pixels (centered) → BB-normalized. Inverse of {@link #normalizedToImagePixel}.
     */
    public Point2D.Double imagePixelToNormalized(double ix, double iy) {
        return bb.toNormalized(ix * cosR - iy * sinR, ix * sinR + iy * cosR);
    }

    // ==================== CONTAINMENT ====================

    /**
     * Whether a BB-normalized point maps inside the source image.
     */
    public boolean containsPoint(double bx, double by) {
        Point2D.Double uv = normalizedToSource(bx, by);
        return uv.x >= -CONTAINMENT_EPSILON && uv.x <= 1.0 + CONTAINMENT_EPSILON
                && uv.y >= -CONTAINMENT_EPSILON && uv.y <= 1.0 + CONTAINMENT_EPSILON;
    }

    /**
     * Whether all four corners of the rectangle map inside the source image.
     * The warped image is convex, so this is equivalent to full containment.
     */
    public boolean containsRect(CropRect rect) {
        for (double[] c : rect.corners()) {
            if (!containsPoint(c[0], c[1])) {
                return false;
            }
        }
        return true;
    }

    // ==================== RESCALING ACROSS A BB CHANGE ====================

    /**
     * Re-expresses a BB-normalized point of {@code from} in this geometry's BB so that it
     * keeps its rotated-pixel position.
     */
    public Point2D.Double rescalePointFrom(CropGeometry from, double bx, double by) {
        Point2D.Double p = from.bb.toPixel(bx, by);
        return bb.toNormalized(p.x, p.y);
    }

    /**
     * rescaleCropForBBChange: keeps the crop's physical (pixel) footprint and its offset from
     * the image center when the bounding box changes size. For centered boxes this is a
     * per-axis scale of {@code oldBB / newBB} applied to both the size and the offset of
     * the rect's center from the BB center.
     *
     * @param from geometry the rectangle was expressed in
     * @param rect rectangle in {@code from}'s BB-normalized space
     * @return the rectangle in this geometry's BB-normalized space
     */
    public CropRect rescaleCropFrom(CropGeometry from, CropRect rect) {
        double sx = from.bb.getWidth() / bb.getWidth();
        double sy = from.bb.getHeight() / bb.getHeight();
        Point2D.Double c = rescalePointFrom(from, rect.centerX(), rect.centerY());
        double w = rect.w() * sx;
        double h = rect.h() * sy;
        return new CropRect(c.x - w / 2.0, c.y - h / 2.0, w, h);
    }

    // ==================== EXPORT HELPERS ====================

    /**
     * Output pixel size of the crop.
     *
     * @return {@code [width, height]}, each at least 1
     */
    public int[] outputSize(CropRect rect) {
        return new int[]{
                Math.max(1, (int) Math.round(rect.w() * bb.getWidth())),
                Math.max(1, (int) Math.round(rect.h() * bb.getHeight()))
        };
    }

    /**
     * Source UV of the four crop corners for an export pipeline.
     *
     * @return {@code {u0,v0, u1,v1, u2,v2, u3,v3}} for top-left, top-right, bottom-right, bottom-left
     */
    public double[] cropQuad(CropRect rect) {
        double[] quad = new double[8];
        double[][] corners = rect.corners();
        for (int i = 0; i < 4; i++) {
            Point2D.Double uv = normalizedToSource(corners[i][0], corners[i][1]);
            quad[2 * i] = uv.x;
            quad[2 * i + 1] = uv.y;
        }
        return quad;
    }
}
