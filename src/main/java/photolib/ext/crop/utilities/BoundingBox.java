package photolib.ext.crop.utilities;

import photolib.ext.crop.model.TransformParams;

import java.awt.geom.Point2D;

/**
 * Axis-aligned extent, in the screen-horizontal frame, of the rotated and warped image.
 *
 * <p>Coordinates are rotated pixels with the origin at the center of the source image.
 * The box is defined by two corner points; as with any box here the corners may be given
 * in either order and the getters normalize them.</p>
 *
 * <h3>Bounding-box-normalized coordinates</h3>
 * <p>Crop rectangles and the view anchor live in BB-normalized space, where {@code (0,0)}
 * is {@code (getMinX(), getMinY())} and {@code (1,1)} is {@code (getMaxX(), getMaxY())}.
 * {@link #toPixel(double, double)} and {@link #toNormalized(double, double)} convert
 * between the two.</p>
 *
 * <h3>Computation</h3>
 * <ul>
 *   <li><strong>Rotation only:</strong> closed form,
 *       {@code bbW = |cos θ|·srcW + |sin θ|·srcH}, {@code bbH = |sin θ|·srcW + |cos θ|·srcH},
 *       centered on the origin</li>
 *   <li><strong>Perspective / shear:</strong> the eight boundary samples (corners and edge
 *       midpoints) are warped, rotated, and their min / max taken. Perspective can shift the
 *       silhouette off-center, which is why the box keeps both corners rather than a size.</li>
 * </ul>
 *
 * @since 0.1.0
 */
public class BoundingBox {

    /** Source-UV boundary samples: corners and edge midpoints, clockwise from top-left. */
    static final double[][] BOUNDARY_SAMPLES = {
            {0.0, 0.0}, {0.5, 0.0}, {1.0, 0.0}, {1.0, 0.5},
            {1.0, 1.0}, {0.5, 1.0}, {0.0, 1.0}, {0.0, 0.5}
    };

    private final double x1;
    private final double y1;
    private final double x2;
    private final double y2;

    /**
     * Creates a new bounding box from two corner points, in rotated pixels.
     *
     * @param x1 X-coordinate of first corner
     * @param y1 Y-coordinate of first corner
     * @param x2 X-coordinate of second corner
     * @param y2 Y-coordinate of second corner
     */
    public BoundingBox(double x1, double y1, double x2, double y2) {
        this.x1 = x1;
        this.y1 = y1;
        this.x2 = x2;
        this.y2 = y2;
    }

    /**
     * Computes the bounding box of the source image under the given warp and rotation.
     *
     * @param warp   perspective / shear warp built from {@code params}
     * @param params rotation parameters, see {@link TransformParams#totalRotation()}
     * @param srcW   source width in pixels
     * @param srcH   source height in pixels
     * @return the bounding box in rotated pixels
     */
    public static BoundingBox computeBB(Warp warp, TransformParams params, int srcW, int srcH) {
        double[] cs = rotationCosSin(params);
        if (warp.isIdentity()) {
            double cosA = Math.abs(cs[0]);
            double sinA = Math.abs(cs[1]);
            double bbW = srcW * cosA + srcH * sinA;
            double bbH = srcW * sinA + srcH * cosA;
            return new BoundingBox(-bbW / 2.0, -bbH / 2.0, bbW / 2.0, bbH / 2.0);
        }

        double cosR = cs[0];
        double sinR = cs[1];
        double minX = Double.POSITIVE_INFINITY, maxX = Double.NEGATIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY, maxY = Double.NEGATIVE_INFINITY;
        for (double[] s : BOUNDARY_SAMPLES) {
            Point2D.Double w = warp.forwardWarp(s[0], s[1]);
            double px = (w.x - 0.5) * srcW;
            double py = (w.y - 0.5) * srcH;
            double rx = px * cosR - py * sinR;
            double ry = px * sinR + py * cosR;
            minX = Math.min(minX, rx);
            maxX = Math.max(maxX, rx);
            minY = Math.min(minY, ry);
            maxY = Math.max(maxY, ry);
        }
        return new BoundingBox(minX, minY, maxX, maxY);
    }

    /**
     * Cosine and sine of the total rotation. Quarter turns are applied exactly so that a
     * 90° step swaps the box dimensions without rounding error.
     *
     * @return {@code [cos, sin]}
     */
    static double[] rotationCosSin(TransformParams params) {
        double c = Math.cos(params.fineAngle());
        double s = Math.sin(params.fineAngle());
        return switch (params.rotate90()) {
            case 1 -> new double[]{-s, c};
            case 2 -> new double[]{-c, -s};
            case 3 -> new double[]{s, -c};
            default -> new double[]{c, s};
        };
    }

    public double getMinX() { return Math.min(x1, x2); }

    public double getMaxX() { return Math.max(x1, x2); }

    public double getMinY() { return Math.min(y1, y2); }

    public double getMaxY() { return Math.max(y1, y2); }

    /** Bounding box width in pixels ({@code bbW}). */
    public double getWidth() { return Math.abs(x2 - x1); }

    /** Bounding box height in pixels ({@code bbH}). */
    public double getHeight() { return Math.abs(y2 - y1); }

    /**
     * Converts a BB-normalized point to rotated pixel coordinates.
     */
    public Point2D.Double toPixel(double bx, double by) {
        return new Point2D.Double(getMinX() + bx * getWidth(), getMinY() + by * getHeight());
    }

    /**
     * Converts rotated pixel coordinates to a BB-normalized point.
     */
    public Point2D.Double toNormalized(double px, double py) {
        return new Point2D.Double((px - getMinX()) / getWidth(), (py - getMinY()) / getHeight());
    }

    @Override
    public String toString() {
        return String.format("BoundingBox[%.1f x %.1f, min=(%.1f, %.1f)]",
                getWidth(), getHeight(), getMinX(), getMinY());
    }
}
