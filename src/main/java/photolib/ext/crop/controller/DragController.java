package photolib.ext.crop.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import photolib.ext.crop.model.CropGeometryState;
import photolib.ext.crop.model.CropRect;
import photolib.ext.crop.model.DragMode;
import photolib.ext.crop.model.DragSession;
import photolib.ext.crop.model.TransformParams;
import photolib.ext.crop.utilities.BoundaryPolygon;
import photolib.ext.crop.utilities.BoundingBox;
import photolib.ext.crop.utilities.BoundsCorrector;
import photolib.ext.crop.utilities.ConstraintSolver;
import photolib.ext.crop.utilities.CropGeometry;
import photolib.ext.crop.utilities.CropSettings;
import photolib.ext.crop.utilities.Warp;

import java.awt.geom.Point2D;

/**
 * DragController - pointer state machine of the crop editor.
 *
 * <p>Screen model: the host supplies the screen position of the view center and a zoom
 * (screen pixels per bounding-box pixel). A BB-normalized point {@code b} is drawn at
 * <pre>
 *   screen = viewCenter + (b - anchor) * bbSize * zoom
 * </pre>
 * where {@code anchor} is the view anchor held by {@link CropGeometryState}.</p>
 *
 * <p>Drag modes, chosen by {@link #hitTest(double, double, boolean)} on pointer-down:
 * <ul>
 *   <li><b>Move:</b> translation clamped by the drag-limit solver, then slid along the
 *       blocking edge; the view anchor follows so the crop stays put on screen.</li>
 *   <li><b>Perspective move</b> (modifier): pointer motion becomes vertical / horizontal tilt.</li>
 *   <li><b>Rotate:</b> pointer angle around the crop center becomes the fine angle.</li>
 *   <li><b>Resize:</b> corners and edges, free or aspect-locked, with orientation auto-flip
 *       and uniform scaling from the center when the modifier is held on a corner.</li>
 * </ul>
 *
 * <p>Rotate and perspective drags change the bounding box. They re-derive every frame from the
 * drag-start snapshot: crop and anchor are re-expressed in the new box so their screen
 * position is unchanged, and the crop is then brought back inside the image.</p>
 *
 * @since 0.1.0
 */
public class DragController {
    private static final Logger logger = LoggerFactory.getLogger(DragController.class);

    static final double MIN_SCROLL_FACTOR = 0.8;
    static final double MAX_SCROLL_FACTOR = 1.2;

    /** Relative ratio error below which the aspect post-check leaves a rect alone. */
    private static final double ASPECT_SLACK = 1e-9;

    private final CropGeometryState state;
    private final CropSettings settings;
    private final ConstraintSolver solver;
    private final BoundsCorrector corrector;

    private double viewCenterX;
    private double viewCenterY;
    private double zoom = 1.0;

    private DragSession session;

    public DragController(CropGeometryState state) {
        this.state = state;
        this.settings = state.getSettings();
        this.solver = new ConstraintSolver(settings.startEpsilon());
        this.corrector = new BoundsCorrector(settings.bisectionIterations());
    }

    // ==================== VIEWPORT ====================

    /**
     * @param centerX screen X of the view center
     * @param centerY screen Y of the view center
     * @param zoom    screen pixels per bounding-box pixel
     */
    public void setViewport(double centerX, double centerY, double zoom) {
        if (!(zoom > 0) || Double.isInfinite(zoom)) {
            throw new IllegalArgumentException("Zoom must be positive: " + zoom);
        }
        this.viewCenterX = centerX;
        this.viewCenterY = centerY;
        this.zoom = zoom;
    }

    public double getZoom() {
        return zoom;
    }

    /**
     * BB-normalized → screen, for the current geometry and anchor.
     */
    public Point2D.Double toScreen(double bx, double by) {
        return toScreen(state.getGeometry(), state.getAnchorX(), state.getAnchorY(), bx, by);
    }

    /**
     * Screen → BB-normalized, for the current geometry and anchor.
     */
    public Point2D.Double toNormalized(double sx, double sy) {
        BoundingBox bb = state.getGeometry().getBoundingBox();
        return new Point2D.Double(
                state.getAnchorX() + (sx - viewCenterX) / (bb.getWidth() * zoom),
                state.getAnchorY() + (sy - viewCenterY) / (bb.getHeight() * zoom));
    }

    private Point2D.Double toScreen(CropGeometry geometry, double anchorX, double anchorY, double bx, double by) {
        BoundingBox bb = geometry.getBoundingBox();
        return new Point2D.Double(
                viewCenterX + (bx - anchorX) * bb.getWidth() * zoom,
                viewCenterY + (by - anchorY) * bb.getHeight() * zoom);
    }

    // ==================== HIT TEST ====================

    /**
     * Picks the drag mode for a press at the given screen position.
     * Priority: corner handles, edge handles, crop interior, rotate band around the image.
     *
     * @param modifier whether the modifier key is held
     * @return the mode, {@link DragMode#NONE} when the press hits nothing
     */
    public DragMode hitTest(double sx, double sy, boolean modifier) {
        CropRect r = state.getRect();
        Point2D.Double tl = toScreen(r.x(), r.y());
        Point2D.Double br = toScreen(r.right(), r.bottom());
        double slop = settings.handleSlopPx();

        boolean nearLeft = Math.abs(sx - tl.x) <= slop;
        boolean nearRight = Math.abs(sx - br.x) <= slop;
        boolean nearTop = Math.abs(sy - tl.y) <= slop;
        boolean nearBottom = Math.abs(sy - br.y) <= slop;

        if (nearTop && nearLeft) return DragMode.RESIZE_TOP_LEFT;
        if (nearTop && nearRight) return DragMode.RESIZE_TOP_RIGHT;
        if (nearBottom && nearLeft) return DragMode.RESIZE_BOTTOM_LEFT;
        if (nearBottom && nearRight) return DragMode.RESIZE_BOTTOM_RIGHT;

        boolean withinX = sx >= tl.x && sx <= br.x;
        boolean withinY = sy >= tl.y && sy <= br.y;
        if (nearTop && withinX) return DragMode.RESIZE_TOP;
        if (nearBottom && withinX) return DragMode.RESIZE_BOTTOM;
        if (nearLeft && withinY) return DragMode.RESIZE_LEFT;
        if (nearRight && withinY) return DragMode.RESIZE_RIGHT;

        if (withinX && withinY) {
            return modifier ? DragMode.PERSPECTIVE_MOVE : DragMode.MOVE;
        }

        Point2D.Double bbTl = toScreen(0, 0);
        Point2D.Double bbBr = toScreen(1, 1);
        double margin = settings.rotateMarginPx();
        if (sx >= bbTl.x - margin && sx <= bbBr.x + margin
                && sy >= bbTl.y - margin && sy <= bbBr.y + margin) {
            return DragMode.ROTATE;
        }
        return DragMode.NONE;
    }

    // ==================== POINTER EVENTS ====================

    /**
     * Starts a drag. Pushes an undo entry and snapshots the state before anything changes.
     *
     * @return the mode of the new drag, {@link DragMode#NONE} when nothing was hit
     */
    public DragMode pointerDown(double sx, double sy, boolean modifier) {
        DragMode mode = hitTest(sx, sy, modifier);
        if (mode == DragMode.NONE) {
            return mode;
        }
        state.pushUndo();
        session = new DragSession(mode, state.snapshot(), state.getGeometry(), sx, sy,
                state.getAnchorX(), state.getAnchorY(), state.isLandscape(), pointerAngle(sx, sy));
        logger.debug("Drag started: {} at ({}, {})", mode, sx, sy);
        return mode;
    }

    /**
     * Applies the pointer position to the active drag.
     *
     * @return {@code false} when no drag is active
     */
    public boolean pointerDrag(double sx, double sy, boolean modifier) {
        if (session == null) {
            return false;
        }
        double dx = sx - session.pointerX();
        double dy = sy - session.pointerY();
        switch (session.mode()) {
            case MOVE -> dragMove(dx, dy);
            case PERSPECTIVE_MOVE -> dragPerspective(dx, dy);
            case ROTATE -> dragRotate(sx, sy);
            default -> dragResize(dx, dy, modifier);
        }
        return true;
    }

    /**
     * Ends the drag. Every frame already satisfied the boundary, so nothing is recomputed.
     */
    public void pointerUp() {
        if (session != null) {
            logger.debug("Drag ended: {} -> {}", session.mode(), state.getRect());
            session = null;
        }
    }

    public DragMode getDragMode() {
        return session == null ? DragMode.NONE : session.mode();
    }

    public boolean isDragging() {
        return session != null;
    }

    /**
     * Scroll-wheel zoom of the crop about its center. Only applies when the pointer is over the crop.
     *
     * @param scrollY scroll notches, positive shrinks the crop
     * @return whether the crop changed
     */
    public boolean scroll(double sx, double sy, double scrollY) {
        if (session != null) {
            return false;
        }
        CropRect rect = state.getRect();
        Point2D.Double p = toNormalized(sx, sy);
        if (!rect.contains(p.x, p.y)) {
            return false;
        }
        double factor = clamp(1.0 - scrollY * settings.scrollZoomStep(), MIN_SCROLL_FACTOR, MAX_SCROLL_FACTOR);
        CropRect desired = rect.scaleAboutCenter(factor);
        if (desired.w() < CropRect.MIN_SIZE || desired.h() < CropRect.MIN_SIZE) {
            double floor = Math.max(CropRect.MIN_SIZE / rect.w(), CropRect.MIN_SIZE / rect.h());
            if (floor >= 1.0) {
                return false;
            }
            desired = rect.scaleAboutCenter(floor);
        }
        CropRect result = solver.clamp(new BoundaryPolygon(state.getGeometry()), rect, desired);
        if (result.equals(rect)) {
            return false;
        }
        state.pushUndo();
        state.setRect(result);
        logger.debug("Scroll zoom by {}: {}", factor, result);
        return true;
    }

    // ==================== MOVE ====================

    private void dragMove(double dxScreen, double dyScreen) {
        BoundingBox bb = session.startGeometry().getBoundingBox();
        CropRect start = session.startRect();
        CropRect desired = start.translate(dxScreen / (bb.getWidth() * zoom), dyScreen / (bb.getHeight() * zoom));

        BoundaryPolygon polygon = new BoundaryPolygon(state.getGeometry());
        CropRect moved = clampAndSlide(polygon, state.getRect(), desired);
        state.setRect(moved);
        state.setAnchor(session.anchorX() + moved.x() - start.x(), session.anchorY() + moved.y() - start.y());
    }

    private CropRect clampAndSlide(BoundaryPolygon polygon, CropRect from, CropRect desired) {
        ConstraintSolver.DragLimit limit = solver.computeDragLimit(polygon, from, desired);
        if (!limit.isBlocked()) {
            return desired;
        }
        CropRect clamped = from.lerp(desired, limit.t());
        double[] slide = ConstraintSolver.slideDelta(limit, desired.x() - clamped.x(), desired.y() - clamped.y());
        if (slide[0] == 0.0 && slide[1] == 0.0) {
            return clamped;
        }
        return solver.clamp(polygon, clamped, clamped.translate(slide[0], slide[1]));
    }

    // ==================== PERSPECTIVE MOVE ====================

    private void dragPerspective(double dxScreen, double dyScreen) {
        BoundingBox bb = session.startGeometry().getBoundingBox();
        TransformParams p0 = session.startParams();
        double focal = p0.effectiveFocalLength(settings.defaultFocalLengthMm());
        boolean landscapeImage = state.getSourceWidth() >= state.getSourceHeight();
        double sensorX = landscapeImage ? Warp.SENSOR_LONG_MM : Warp.SENSOR_SHORT_MM;
        double sensorY = landscapeImage ? Warp.SENSOR_SHORT_MM : Warp.SENSOR_LONG_MM;

        double nx = dxScreen / (bb.getWidth() * zoom);
        double ny = dyScreen / (bb.getHeight() * zoom);
        double deltaH = Math.toDegrees(Math.atan(nx * sensorX / focal));
        double deltaV = Math.toDegrees(Math.atan(ny * sensorY / focal));

        applyFromStart(p0.withPerspective(p0.perspV() + deltaV, p0.perspH() + deltaH));
    }

    // ==================== ROTATE ====================

    private void dragRotate(double sx, double sy) {
        CropRect start = session.startRect();
        Point2D.Double c = toScreen(session.startGeometry(), session.anchorX(), session.anchorY(),
                start.centerX(), start.centerY());
        double current = Math.atan2(sy - c.y, sx - c.x);
        double delta = Math.IEEEremainder(current - session.pointerAngle(), 2.0 * Math.PI);
        double fine = clamp(session.startParams().fineAngle() + delta,
                -TransformParams.MAX_FINE_ANGLE, TransformParams.MAX_FINE_ANGLE);
        applyFromStart(session.startParams().withFineAngle(fine));
    }

    private double pointerAngle(double sx, double sy) {
        CropRect r = state.getRect();
        Point2D.Double c = toScreen(r.centerX(), r.centerY());
        return Math.atan2(sy - c.y, sx - c.x);
    }

    /**
     * Re-expresses the drag-start crop and anchor under new parameters, then corrects the crop.
     */
    private void applyFromStart(TransformParams params) {
        CropGeometry from = session.startGeometry();
        if (params.equals(session.startParams())) {
            state.applyTransform(from, session.startRect(), session.anchorX(), session.anchorY());
            return;
        }
        CropGeometry to = state.geometryFor(params);
        CropRect rect = corrector.correct(to, to.rescaleCropFrom(from, session.startRect()));
        Point2D.Double anchor = to.rescalePointFrom(from, session.anchorX(), session.anchorY());
        state.applyTransform(to, rect, anchor.x, anchor.y);
    }

    // ==================== RESIZE ====================

    private void dragResize(double dxScreen, double dyScreen, boolean modifier) {
        BoundingBox bb = state.getGeometry().getBoundingBox();
        double dx = dxScreen / (bb.getWidth() * zoom);
        double dy = dyScreen / (bb.getHeight() * zoom);
        DragMode mode = session.mode();
        CropRect start = session.startRect();
        boolean locked = state.getAspect().isLocked();
        boolean uniform = mode.isCorner() && modifier;
        boolean landscapeBefore = state.isLandscape();

        CropRect candidate;
        if (uniform) {
            candidate = uniformScale(start, dx, dy, locked);
        } else if (mode.isCorner() && locked) {
            candidate = lockedCorner(start, dx, dy, bb);
        } else if (locked) {
            candidate = lockedEdge(start, dx, dy);
        } else {
            candidate = moveEdges(start, dx, dy);
        }

        BoundaryPolygon polygon = new BoundaryPolygon(state.getGeometry());
        CropRect current = state.getRect();
        CropRect result;
        if (mode.isCorner() && !uniform && !locked) {
            result = clampAndSlideCorner(polygon, current, candidate);
        } else {
            result = solver.clamp(polygon, current, candidate);
        }
        if (locked) {
            CropRect restored = restoreAspect(result, uniform);
            if (restored == null) {
                // previous frame kept the ratio; drop this one, including any flip it made
                logger.debug("Locked ratio cannot be restored above minimum size, keeping {}", current);
                state.setLandscape(landscapeBefore);
                return;
            }
            result = restored;
        }
        state.setRect(result);
    }

    /**
     * Moves the edges touched by the current mode by {@code (dx, dy)}; the others stay.
     */
    private CropRect moveEdges(CropRect r, double dx, double dy) {
        DragMode mode = session.mode();
        double left = r.x();
        double right = r.right();
        double top = r.y();
        double bottom = r.bottom();
        if (mode.movesLeft()) left = Math.min(left + dx, right - CropRect.MIN_SIZE);
        if (mode.movesRight()) right = Math.max(right + dx, left + CropRect.MIN_SIZE);
        if (mode.movesTop()) top = Math.min(top + dy, bottom - CropRect.MIN_SIZE);
        if (mode.movesBottom()) bottom = Math.max(bottom + dy, top + CropRect.MIN_SIZE);
        return new CropRect(left, top, right - left, bottom - top);
    }

    private CropRect clampAndSlideCorner(BoundaryPolygon polygon, CropRect from, CropRect desired) {
        ConstraintSolver.DragLimit limit = solver.computeDragLimit(polygon, from, desired);
        if (!limit.isBlocked()) {
            return desired;
        }
        DragMode mode = session.mode();
        CropRect clamped = from.lerp(desired, limit.t());
        double remX = mode.movesLeft() ? desired.x() - clamped.x() : desired.right() - clamped.right();
        double remY = mode.movesTop() ? desired.y() - clamped.y() : desired.bottom() - clamped.bottom();
        double[] slide = ConstraintSolver.slideDelta(limit, remX, remY);
        if (slide[0] == 0.0 && slide[1] == 0.0) {
            return clamped;
        }
        return solver.clamp(polygon, clamped, moveEdges(clamped, slide[0], slide[1]));
    }

    /**
     * Aspect-locked corner: projects the anchor-to-pointer vector onto the locked ratio in
     * pixel space, flipping orientation first when the pointer crosses the hysteresis band.
     */
    private CropRect lockedCorner(CropRect start, double dx, double dy, BoundingBox bb) {
        DragMode mode = session.mode();
        double anchorX = mode.movesLeft() ? start.right() : start.x();
        double anchorY = mode.movesTop() ? start.bottom() : start.y();
        double cornerX = (mode.movesLeft() ? start.x() : start.right()) + dx;
        double cornerY = (mode.movesTop() ? start.y() : start.bottom()) + dy;
        double signX = mode.movesLeft() ? -1.0 : 1.0;
        double signY = mode.movesTop() ? -1.0 : 1.0;
        double distX = Math.max(0.0, (cornerX - anchorX) * signX) * bb.getWidth();
        double distY = Math.max(0.0, (cornerY - anchorY) * signY) * bb.getHeight();

        if (state.getAspect().isOrientable() && distX > 0 && distY > 0) {
            double threshold = settings.flipThreshold();
            if (state.isLandscape() && distX / distY < threshold) {
                state.setLandscape(false);
                logger.debug("Orientation flipped to portrait ({} / {})", distX, distY);
            } else if (!state.isLandscape() && distY / distX < threshold) {
                state.setLandscape(true);
                logger.debug("Orientation flipped to landscape ({} / {})", distX, distY);
            }
        }

        double ratio = state.targetAspectNormalized();
        double pixelRatio = ratio * state.getGeometry().bbAspect();
        double k = (distX * pixelRatio + distY) / (pixelRatio * pixelRatio + 1.0);
        double w = k * pixelRatio / bb.getWidth();
        double h = k / bb.getHeight();
        if (w < CropRect.MIN_SIZE || h < CropRect.MIN_SIZE) {
            double[] min = minimumAt(ratio);
            w = min[0];
            h = min[1];
        }
        double x = mode.movesLeft() ? anchorX - w : anchorX;
        double y = mode.movesTop() ? anchorY - h : anchorY;
        return new CropRect(x, y, w, h);
    }

    /**
     * Aspect-locked edge: the dragged edge follows the pointer and the other dimension is
     * derived from the ratio, centered on the unchanged axis. When the derived side does not
     * fit the bounding box it is truncated and the dragged side re-derived from it.
     */
    private CropRect lockedEdge(CropRect start, double dx, double dy) {
        DragMode mode = session.mode();
        double ratio = state.targetAspectNormalized();
        if (mode == DragMode.RESIZE_LEFT || mode == DragMode.RESIZE_RIGHT) {
            double w = mode.movesRight() ? start.w() + dx : start.w() - dx;
            double h = w / ratio;
            if (w < CropRect.MIN_SIZE || h < CropRect.MIN_SIZE) {
                double[] min = minimumAt(ratio);
                w = min[0];
                h = min[1];
            }
            double cy = start.centerY();
            double budget = 2.0 * Math.min(cy, 1.0 - cy);
            if (h > budget && budget >= CropRect.MIN_SIZE) {
                h = budget;
                w = h * ratio;
            }
            double x = mode.movesRight() ? start.x() : start.right() - w;
            return new CropRect(x, cy - h / 2.0, w, h);
        }
        double h = mode.movesBottom() ? start.h() + dy : start.h() - dy;
        double w = h * ratio;
        if (w < CropRect.MIN_SIZE || h < CropRect.MIN_SIZE) {
            double[] min = minimumAt(ratio);
            w = min[0];
            h = min[1];
        }
        double cx = start.centerX();
        double budget = 2.0 * Math.min(cx, 1.0 - cx);
        if (w > budget && budget >= CropRect.MIN_SIZE) {
            w = budget;
            h = w / ratio;
        }
        double y = mode.movesBottom() ? start.y() : start.bottom() - h;
        return new CropRect(cx - w / 2.0, y, w, h);
    }

    /**
     * Corner with modifier: uniform scale about the start rect's center.
     */
    private CropRect uniformScale(CropRect start, double dx, double dy, boolean locked) {
        DragMode mode = session.mode();
        double cx = start.centerX();
        double cy = start.centerY();
        double halfW = start.w() / 2.0;
        double halfH = start.h() / 2.0;
        double cornerX = (mode.movesLeft() ? start.x() : start.right()) + dx;
        double cornerY = (mode.movesTop() ? start.y() : start.bottom()) + dy;
        double s = Math.max(Math.abs(cornerX - cx) / halfW, Math.abs(cornerY - cy) / halfH);

        double w = 2.0 * halfW * s;
        double h = 2.0 * halfH * s;
        double ratio = locked ? state.targetAspectNormalized() : w / h;
        if (locked) {
            h = w / ratio;
        }
        if (!(w >= CropRect.MIN_SIZE && h >= CropRect.MIN_SIZE)) {
            double[] min = minimumAt(locked ? ratio : start.aspect());
            w = min[0];
            h = min[1];
        }
        return new CropRect(cx - w / 2.0, cy - h / 2.0, w, h);
    }

    /**
     * Shrinks the dimension that breaks the locked ratio, keeping the drag's anchor in place.
     * Shrinking never leaves the image, so no further clamping is needed.
     *
     * @return the restored rect, or {@code null} when the ratio only fits below the minimum size
     */
    private CropRect restoreAspect(CropRect r, boolean aboutCenter) {
        double ratio = state.targetAspectNormalized();
        double current = r.aspect();
        if (Math.abs(current - ratio) <= ratio * ASPECT_SLACK) {
            return r;
        }
        double w = r.w();
        double h = r.h();
        if (current > ratio) {
            w = h * ratio;
        } else {
            h = w / ratio;
        }
        if (w < CropRect.MIN_SIZE || h < CropRect.MIN_SIZE) {
            return null;
        }
        DragMode mode = session.mode();
        double x;
        double y;
        if (aboutCenter) {
            x = r.centerX() - w / 2.0;
            y = r.centerY() - h / 2.0;
        } else {
            if (mode.movesLeft()) {
                x = r.right() - w;
            } else if (mode.movesRight()) {
                x = r.x();
            } else {
                x = r.centerX() - w / 2.0;
            }
            if (mode.movesTop()) {
                y = r.bottom() - h;
            } else if (mode.movesBottom()) {
                y = r.y();
            } else {
                y = r.centerY() - h / 2.0;
            }
        }
        logger.debug("Aspect restored after clamp: {} -> ({}, {})", r, w, h);
        return new CropRect(x, y, w, h);
    }

    /**
     * Smallest size at the given normalized ratio with both sides at least {@link CropRect#MIN_SIZE}.
     */
    private static double[] minimumAt(double ratio) {
        if (ratio >= 1.0) {
            return new double[]{CropRect.MIN_SIZE * ratio, CropRect.MIN_SIZE};
        }
        return new double[]{CropRect.MIN_SIZE, CropRect.MIN_SIZE / ratio};
    }

    private static double clamp(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }
}
