package photolib.ext.crop.utilities;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import photolib.ext.crop.model.CropRect;

/**
 * Closed-form drag limit against the {@link BoundaryPolygon}.
 *
 * <p>For a proposed motion from {@code start} to {@code desired}, every corner moves
 * linearly with the interpolation factor {@code t}, so its signed distance to each edge is
 * linear too: {@code d(t) = d0 + t (d1 - d0)}. A corner that is inside at {@code t = 0}
 * (within {@code startEpsilon}) and outside at {@code t = 1} (zero tolerance) crosses at
 * {@code t = d0 / (d0 - d1)}. The smallest crossing over 4 corners × 8 edges is the limit.</p>
 *
 * <p>The start tolerance lets a rect resting on the boundary leave it again; the zero end
 * tolerance stops repeated small steps from creeping through it.</p>
 *
 * <p>Callers slide along the blocking edge with {@link #slideDelta(DragLimit, double, double)}.</p>
 */
public final class ConstraintSolver {
    private static final Logger logger = LoggerFactory.getLogger(ConstraintSolver.class);

    public static final double DEFAULT_START_EPSILON = 1e-4;

    private final double startEpsilon;

    public ConstraintSolver() {
        this(DEFAULT_START_EPSILON);
    }

    public ConstraintSolver(double startEpsilon) {
        this.startEpsilon = startEpsilon;
    }

    /**
     * Result of a drag-limit query.
     *
     * @param t       largest safe interpolation factor in {@code [0,1]}
     * @param normalX inward normal X of the limiting edge, 0 when unconstrained
     * @param normalY inward normal Y of the limiting edge, 0 when unconstrained
     */
    public record DragLimit(double t, double normalX, double normalY) {

        public static final DragLimit UNCONSTRAINED = new DragLimit(1.0, 0.0, 0.0);

        public boolean isBlocked() {
            return t < 1.0;
        }
    }

    /**
     * Computes how much of the motion from {@code start} to {@code desired} is safe.
     *
     * @param polygon boundary of the warped image
     * @param start   current (valid) rectangle
     * @param desired proposed rectangle
     * @return the drag limit; {@link DragLimit#UNCONSTRAINED} when nothing is violated
     */
    public DragLimit computeDragLimit(BoundaryPolygon polygon, CropRect start, CropRect desired) {
        double[][] c0 = start.corners();
        double[][] c1 = desired.corners();

        double tMin = 1.0;
        int limitingEdge = -1;
        for (int e = 0; e < polygon.edgeCount(); e++) {
            if (polygon.isDegenerate(e)) {
                continue;
            }
            for (int k = 0; k < 4; k++) {
                double d0 = polygon.signedDistance(e, c0[k][0], c0[k][1]);
                double d1 = polygon.signedDistance(e, c1[k][0], c1[k][1]);
                if (d0 >= -startEpsilon && d1 < 0.0) {
                    double denom = d0 - d1;
                    if (denom <= 0.0) {
                        // resting slightly outside and not moving further out
                        continue;
                    }
                    double t = Math.max(0.0, Math.min(1.0, d0 / denom));
                    if (t < tMin) {
                        tMin = t;
                        limitingEdge = e;
                    }
                }
            }
        }

        if (limitingEdge < 0) {
            return DragLimit.UNCONSTRAINED;
        }
        logger.debug("Drag limited to t={} by edge {}", tMin, limitingEdge);
        return new DragLimit(tMin, polygon.normalX(limitingEdge), polygon.normalY(limitingEdge));
    }

    /**
     * Applies the drag limit to the motion and returns the resulting rectangle.
     */
    public CropRect clamp(BoundaryPolygon polygon, CropRect start, CropRect desired) {
        DragLimit limit = computeDragLimit(polygon, start, desired);
        return limit.isBlocked() ? start.lerp(desired, limit.t()) : desired;
    }

    /**
     * Projects the unapplied part of a motion onto the tangent of the blocking edge.
     *
     * @param limit     result of the first pass
     * @param remainingX unapplied X motion
     * @param remainingY unapplied Y motion
     * @return {@code [dx, dy]} along the wall; zero when the first pass was not blocked
     */
    public static double[] slideDelta(DragLimit limit, double remainingX, double remainingY) {
        if (!limit.isBlocked()) {
            return new double[]{0.0, 0.0};
        }
        double tx = -limit.normalY();
        double ty = limit.normalX();
        double along = remainingX * tx + remainingY * ty;
        return new double[]{along * tx, along * ty};
    }
}
