package photolib.ext.crop.utilities;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import photolib.ext.crop.model.CropRect;

import java.awt.geom.Point2D;

/**
 * Brings a crop rectangle back inside the image after a discrete parameter change
 * (aspect selection, slider rotation, 90° step, perspective slider).
 *
 * <p>Three paths, chosen by the transform:</p>
 * <ol>
 *   <li><b>No fine rotation, no perspective:</b> the image fills the BB; clamp the position
 *       to {@code [0,1]}, shrinking uniformly first if the rect is larger than the BB.</li>
 *   <li><b>Fine rotation only:</b> closed-form inscribed-rectangle budget in image pixels.
 *       The crop's half extents are rotated into image space; the per-axis budget is
 *       {@code imageHalfExtent − rotatedCropHalfExtent}. A negative budget shrinks the crop
 *       uniformly until it is zero, then the crop center is clamped to the budget box and
 *       rotated back.</li>
 *   <li><b>Perspective or shear:</b> two bisection phases using the warp-based corner
 *       containment test. Phase 1 searches the interpolation factor towards the BB-centered
 *       position; phase 2 searches a uniform shrink about the rect's own center, re-running
 *       phase 1 for each trial size.</li>
 * </ol>
 *
 * <p>A rect that is already valid is returned unchanged, which makes the corrector a
 * fixed point. If the bisection budget runs out the last best candidate is accepted.</p>
 *
 * @since 0.1.0
 */
public class BoundsCorrector {
    private static final Logger logger = LoggerFactory.getLogger(BoundsCorrector.class);

    public static final int DEFAULT_ITERATIONS = 16;

    /** Relative slack, in image pixels, below which the rotated path leaves a rect alone. */
    private static final double PIXEL_SLACK = 1e-9;

    private final int iterations;

    public BoundsCorrector() {
        this(DEFAULT_ITERATIONS);
    }

    /**
     * @param iterations bisection iterations per phase
     */
    public BoundsCorrector(int iterations) {
        this.iterations = Math.max(1, iterations);
    }

    /**
     * Corrects {@code rect} so that all four corners lie inside the image.
     *
     * @param geometry current geometry
     * @param rect     rectangle to correct
     * @return the corrected rectangle, or {@code rect} itself when it is already valid
     */
    public CropRect correct(CropGeometry geometry, CropRect rect) {
        CropRect sized = enforceMinimumSize(rect);
        var params = geometry.getParams();
        if (!params.hasFineRotation() && !params.hasPerspective()) {
            return clampAxisAligned(sized);
        }
        if (!params.hasPerspective()) {
            return correctRotated(geometry, sized);
        }
        return correctWarped(geometry, sized);
    }

    static CropRect enforceMinimumSize(CropRect rect) {
        if (rect.w() >= CropRect.MIN_SIZE && rect.h() >= CropRect.MIN_SIZE) {
            return rect;
        }
        return rect.resizeAboutCenter(Math.max(rect.w(), CropRect.MIN_SIZE), Math.max(rect.h(), CropRect.MIN_SIZE));
    }

    // ==================== AXIS-ALIGNED ====================

    private CropRect clampAxisAligned(CropRect rect) {
        CropRect r = rect;
        if (r.w() > 1.0 || r.h() > 1.0) {
            double s = Math.min(1.0 / r.w(), 1.0 / r.h());
            r = r.resizeAboutCenter(
                    Math.max(CropRect.MIN_SIZE, Math.min(1.0, r.w() * s)),
                    Math.max(CropRect.MIN_SIZE, Math.min(1.0, r.h() * s)));
        }
        double x = clamp(r.x(), 0.0, 1.0 - r.w());
        double y = clamp(r.y(), 0.0, 1.0 - r.h());
        if (x == r.x() && y == r.y() && r == rect) {
            return rect;
        }
        logger.debug("Axis-aligned clamp: {} -> ({}, {})", rect, x, y);
        return r.withPosition(x, y);
    }

    // ==================== ROTATION ONLY ====================

    private CropRect correctRotated(CropGeometry geometry, CropRect rect) {
        BoundingBox bb = geometry.getBoundingBox();
        double imageHalfW = geometry.getSourceWidth() / 2.0;
        double imageHalfH = geometry.getSourceHeight() / 2.0;
        double cosA = Math.abs(geometry.cos());
        double sinA = Math.abs(geometry.sin());

        double w = rect.w();
        double h = rect.h();
        double halfW = w * bb.getWidth() / 2.0;
        double halfH = h * bb.getHeight() / 2.0;
        double extentX = cosA * halfW + sinA * halfH;
        double extentY = sinA * halfW + cosA * halfH;

        double slack = PIXEL_SLACK * Math.max(imageHalfW, imageHalfH);
        if (extentX > imageHalfW + slack || extentY > imageHalfH + slack) {
            double s = Math.min(imageHalfW / extentX, imageHalfH / extentY);
            w *= s;
            h *= s;
            // a side at the floor stays there and the other side alone is fitted
            if (h < CropRect.MIN_SIZE) {
                h = CropRect.MIN_SIZE;
                double fixedHalf = h * bb.getHeight() / 2.0;
                double maxHalf = maxHalfExtent(imageHalfW - sinA * fixedHalf, cosA,
                        imageHalfH - cosA * fixedHalf, sinA);
                w = Math.max(CropRect.MIN_SIZE, Math.min(w, 2.0 * maxHalf / bb.getWidth()));
            } else if (w < CropRect.MIN_SIZE) {
                w = CropRect.MIN_SIZE;
                double fixedHalf = w * bb.getWidth() / 2.0;
                double maxHalf = maxHalfExtent(imageHalfW - cosA * fixedHalf, sinA,
                        imageHalfH - sinA * fixedHalf, cosA);
                h = Math.max(CropRect.MIN_SIZE, Math.min(h, 2.0 * maxHalf / bb.getHeight()));
            }
            halfW = w * bb.getWidth() / 2.0;
            halfH = h * bb.getHeight() / 2.0;
            extentX = cosA * halfW + sinA * halfH;
            extentY = sinA * halfW + cosA * halfH;
            logger.debug("Rotated crop shrunk to {} x {} to fit", w, h);
        }
        boolean changed = w != rect.w() || h != rect.h();
        // a negative budget means even the minimum crop does not fit; it is centered
        double budgetX = Math.max(0.0, imageHalfW - extentX);
        double budgetY = Math.max(0.0, imageHalfH - extentY);

        Point2D.Double center = geometry.normalizedToImagePixel(rect.centerX(), rect.centerY());
        double cx = clamp(center.x, -budgetX, budgetX);
        double cy = clamp(center.y, -budgetY, budgetY);
        if (!changed && Math.abs(cx - center.x) <= slack && Math.abs(cy - center.y) <= slack) {
            return rect;
        }

        Point2D.Double back = geometry.imagePixelToNormalized(cx, cy);
        return new CropRect(back.x - w / 2.0, back.y - h / 2.0, w, h);
    }

    // ==================== PERSPECTIVE (BISECTION) ====================

    private CropRect correctWarped(CropGeometry geometry, CropRect rect) {
        if (geometry.containsRect(rect)) {
            return rect;
        }

        // Phase 1: reposition only
        CropRect placed = reposition(geometry, rect);
        if (placed != null) {
            logger.debug("Warped crop repositioned: {} -> {}", rect, placed);
            return placed;
        }

        // Phase 2: shrink about the rect's own center
        double lo = Math.max(CropRect.MIN_SIZE / rect.w(), CropRect.MIN_SIZE / rect.h());
        double hi = 1.0;
        CropRect best = reposition(geometry, rect.scaleAboutCenter(lo));
        if (best == null) {
            CropRect fallback = rect.scaleAboutCenter(lo).centered();
            logger.warn("Crop cannot be fitted inside the warped image, using {}", fallback);
            return fallback;
        }
        for (int i = 0; i < iterations; i++) {
            double mid = (lo + hi) / 2.0;
            CropRect trial = reposition(geometry, rect.scaleAboutCenter(mid));
            if (trial != null) {
                lo = mid;
                best = trial;
            } else {
                hi = mid;
            }
        }
        logger.debug("Warped crop shrunk by {}: {} -> {}", lo, rect, best);
        return best;
    }

    /**
     * Binary-searches the smallest move towards the BB-centered position that makes the
     * rect valid.
     *
     * @return the repositioned rect, or {@code null} when even the centered position is invalid
     */
    private CropRect reposition(CropGeometry geometry, CropRect rect) {
        if (geometry.containsRect(rect)) {
            return rect;
        }
        CropRect target = rect.centered();
        if (!geometry.containsRect(target)) {
            return null;
        }
        double lo = 0.0;
        double hi = 1.0;
        for (int i = 0; i < iterations; i++) {
            double mid = (lo + hi) / 2.0;
            if (geometry.containsRect(rect.lerp(target, mid))) {
                hi = mid;
            } else {
                lo = mid;
            }
        }
        return rect.lerp(target, hi);
    }

    /**
     * Largest half extent {@code e} with {@code coefA * e <= limitA} and {@code coefB * e <= limitB}.
     */
    private static double maxHalfExtent(double limitA, double coefA, double limitB, double coefB) {
        double max = Double.POSITIVE_INFINITY;
        if (coefA > 0) {
            max = Math.min(max, limitA / coefA);
        }
        if (coefB > 0) {
            max = Math.min(max, limitB / coefB);
        }
        return Math.max(0.0, max);
    }

    private static double clamp(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }
}
