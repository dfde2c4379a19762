package photolib.ext.crop.utilities;

import java.awt.geom.Point2D;

/**
 * Eight-vertex approximation of the warped image boundary in BB-normalized space.
 *
 * <p>Vertices are the four source corners and the four edge midpoints, warped and rotated.
 * Each edge carries its inward unit normal, oriented towards the vertex centroid, so the
 * signed distance of a point is positive inside and negative outside.</p>
 *
 * <p>Edges shorter than {@link #DEGENERATE_EDGE} are flagged and ignored by
 * {@link ConstraintSolver}.</p>
 */
public final class BoundaryPolygon {

    static final double DEGENERATE_EDGE = 1e-9;

    private final double[] vx = new double[8];
    private final double[] vy = new double[8];
    private final double[] nx = new double[8];
    private final double[] ny = new double[8];
    private final boolean[] degenerate = new boolean[8];
    private final double centroidX;
    private final double centroidY;

    /**
     * Builds the polygon for the given geometry.
     */
    public BoundaryPolygon(CropGeometry geometry) {
        double sx = 0, sy = 0;
        for (int i = 0; i < 8; i++) {
            double[] s = BoundingBox.BOUNDARY_SAMPLES[i];
            Point2D.Double p = geometry.sourceToNormalized(s[0], s[1]);
            vx[i] = p.x;
            vy[i] = p.y;
            sx += p.x;
            sy += p.y;
        }
        centroidX = sx / 8.0;
        centroidY = sy / 8.0;

        for (int i = 0; i < 8; i++) {
            int j = (i + 1) % 8;
            double ex = vx[j] - vx[i];
            double ey = vy[j] - vy[i];
            double len = Math.hypot(ex, ey);
            if (len < DEGENERATE_EDGE) {
                degenerate[i] = true;
                continue;
            }
            double ux = -ey / len;
            double uy = ex / len;
            if (ux * (centroidX - vx[i]) + uy * (centroidY - vy[i]) < 0) {
                ux = -ux;
                uy = -uy;
            }
            nx[i] = ux;
            ny[i] = uy;
        }
    }

    public int edgeCount() {
        return 8;
    }

    public boolean isDegenerate(int edge) {
        return degenerate[edge];
    }

    public double vertexX(int i) { return vx[i]; }

    public double vertexY(int i) { return vy[i]; }

    public double normalX(int edge) { return nx[edge]; }

    public double normalY(int edge) { return ny[edge]; }

    public double centroidX() { return centroidX; }

    public double centroidY() { return centroidY; }

    /**
     * Signed distance of a point to the line of an edge; positive on the inner side.
     */
    public double signedDistance(int edge, double px, double py) {
        return nx[edge] * (px - vx[edge]) + ny[edge] * (py - vy[edge]);
    }

    /**
     * Whether the point lies inside every edge's half-plane within {@code epsilon}.
     */
    public boolean contains(double px, double py, double epsilon) {
        for (int e = 0; e < 8; e++) {
            if (!degenerate[e] && signedDistance(e, px, py) < -epsilon) {
                return false;
            }
        }
        return true;
    }
}
