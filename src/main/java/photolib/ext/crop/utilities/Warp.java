package photolib.ext.crop.utilities;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import photolib.ext.crop.model.TransformParams;

import java.awt.geom.Point2D;

/**
 * Warp - perspective tilt and shear mapping of source-image coordinates.
 *
 * <p>Coordinate systems:
 * <ul>
 *   <li><b>Source UV:</b> normalized source image coordinates, {@code (0,0)} top-left, {@code (1,1)} bottom-right</li>
 *   <li><b>Warped UV:</b> the same frame after shear and perspective; may leave {@code [0,1]}</li>
 * </ul>
 *
 * <p>Model, in centered coordinates {@code x = 2u - 1}, {@code y = 2v - 1}:
 * <pre>
 *   shear:       xs = x + shear * y,  ys = y
 *   perspective: x' = xs / d,  y' = ys / d,  d = 1 + gx * xs + gy * ys
 * </pre>
 * This is a 3×3 homography restricted to tilt and shear, so the inverse is closed-form:
 * <pre>
 *   d = 1 / (1 - gx * x' - gy * y'),  xs = x' * d,  ys = y' * d,  x = xs - shear * ys
 * </pre>
 *
 * <p>The projective coefficients come from the tilt angles and the focal length:
 * {@code g = tan(tilt) * halfSensorExtent / focal}, with a 36×24 mm sensor whose long side
 * follows the long side of the image. They are scaled down together when needed so that
 * {@code d} stays at least {@value #MIN_DENOMINATOR} everywhere on the sheared image.
 *
 * @since 0.1.0
 */
public final class Warp {
    private static final Logger logger = LoggerFactory.getLogger(Warp.class);

    public static final double SENSOR_LONG_MM = 36.0;
    public static final double SENSOR_SHORT_MM = 24.0;
    static final double MIN_DENOMINATOR = 0.2;

    private final double gx;
    private final double gy;
    private final double shear;
    private final boolean identity;

    /**
     * @param params            current transform parameters
     * @param srcW              source width in pixels
     * @param srcH              source height in pixels
     * @param defaultFocalMm    focal length to use when {@code params} carries none
     */
    public Warp(TransformParams params, int srcW, int srcH, double defaultFocalMm) {
        if (srcW <= 0 || srcH <= 0) {
            throw new IllegalArgumentException("Image dimensions must be positive: " + srcW + "x" + srcH);
        }
        double focal = params.effectiveFocalLength(defaultFocalMm);
        boolean landscape = srcW >= srcH;
        double halfSensorX = (landscape ? SENSOR_LONG_MM : SENSOR_SHORT_MM) / 2.0;
        double halfSensorY = (landscape ? SENSOR_SHORT_MM : SENSOR_LONG_MM) / 2.0;

        double rawGx = Math.tan(Math.toRadians(params.perspH())) * halfSensorX / focal;
        double rawGy = Math.tan(Math.toRadians(params.perspV())) * halfSensorY / focal;
        this.shear = params.shear();

        // |xs| reaches 1 + |shear| on the sheared image, |ys| reaches 1
        double worst = Math.abs(rawGx) * (1.0 + Math.abs(shear)) + Math.abs(rawGy);
        double limit = 1.0 - MIN_DENOMINATOR;
        if (worst > limit) {
            double k = limit / worst;
            rawGx *= k;
            rawGy *= k;
            logger.debug("Projective coefficients scaled by {} to keep the image in front of the horizon", k);
        }
        this.gx = rawGx;
        this.gy = rawGy;
        this.identity = gx == 0.0 && gy == 0.0 && shear == 0.0;
    }

    public boolean isIdentity() {
        return identity;
    }

    double getGx() {
        return gx;
    }

    double getGy() {
        return gy;
    }

    /**
     * Maps a source UV coordinate into the warped frame.
     *
     * @param u source U (0-1 inside the image)
     * @param v source V (0-1 inside the image)
     * @return warped UV
     */
    public Point2D.Double forwardWarp(double u, double v) {
        if (identity) {
            return new Point2D.Double(u, v);
        }
        double x = 2.0 * u - 1.0;
        double y = 2.0 * v - 1.0;
        double xs = x + shear * y;
        double ys = y;
        double d = 1.0 + gx * xs + gy * ys;
        return new Point2D.Double((xs / d + 1.0) / 2.0, (ys / d + 1.0) / 2.0);
    }

    /**
     * Maps a warped UV coordinate back to source UV.
     *
     * <p>Points beyond the projective horizon have no source pre-image; for those both
     * coordinates are {@link Double#NaN}, which every containment test treats as outside.
     *
     * @param wu warped U
     * @param wv warped V
     * @return source UV
     */
    public Point2D.Double inverseWarp(double wu, double wv) {
        if (identity) {
            return new Point2D.Double(wu, wv);
        }
        double xp = 2.0 * wu - 1.0;
        double yp = 2.0 * wv - 1.0;
        double denom = 1.0 - gx * xp - gy * yp;
        if (denom <= 1e-12) {
            return new Point2D.Double(Double.NaN, Double.NaN);
        }
        double d = 1.0 / denom;
        double xs = xp * d;
        double ys = yp * d;
        double x = xs - shear * ys;
        return new Point2D.Double((x + 1.0) / 2.0, (ys + 1.0) / 2.0);
    }
}
