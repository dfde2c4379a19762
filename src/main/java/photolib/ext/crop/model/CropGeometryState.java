package photolib.ext.crop.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import photolib.ext.crop.utilities.CropGeometry;
import photolib.ext.crop.utilities.CropSettings;

import java.awt.geom.Point2D;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Mutable state of one crop session: the crop rectangle, the transform parameters, the
 * derived geometry, the view anchor, the aspect preset and the undo stack.
 *
 * <p>Every setter publishes the matching {@link CropEvent} on the session's {@link EventBus}.
 * The geometry ({@link CropGeometry}, and with it the bounding box) is rebuilt only when
 * the transform parameters change.</p>
 *
 * <p>Single-threaded: all calls are expected on the thread that delivers input events.</p>
 *
 * @since 0.1.0
 */
public class CropGeometryState {
    private static final Logger logger = LoggerFactory.getLogger(CropGeometryState.class);

    private final int srcW;
    private final int srcH;
    private final CropSettings settings;
    private final EventBus eventBus;
    private final Deque<UndoEntry> undoStack = new ArrayDeque<>();

    private CropRect rect;
    private TransformParams params;
    private CropGeometry geometry;
    private double anchorX = 0.5;
    private double anchorY = 0.5;
    private CropAspect aspect = CropAspect.FREE;
    private boolean landscape;

    /**
     * @param srcW     source width in pixels
     * @param srcH     source height in pixels
     * @param rect     initial crop rectangle
     * @param params   initial transform parameters
     * @param settings tunables
     * @param eventBus channel for change notifications
     */
    public CropGeometryState(int srcW, int srcH, CropRect rect, TransformParams params,
                             CropSettings settings, EventBus eventBus) {
        if (srcW <= 0 || srcH <= 0) {
            throw new IllegalArgumentException("Image dimensions must be positive: " + srcW + "x" + srcH);
        }
        this.srcW = srcW;
        this.srcH = srcH;
        this.settings = Objects.requireNonNull(settings, "settings");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus");
        this.rect = Objects.requireNonNull(rect, "rect");
        this.params = Objects.requireNonNull(params, "params");
        this.geometry = geometryFor(params);
        this.landscape = srcW >= srcH;
    }

    // ==================== QUERIES ====================

    public int getSourceWidth() { return srcW; }

    public int getSourceHeight() { return srcH; }

    public CropSettings getSettings() { return settings; }

    public EventBus getEventBus() { return eventBus; }

    public CropRect getRect() { return rect; }

    public TransformParams getParams() { return params; }

    public CropGeometry getGeometry() { return geometry; }

    public CropAspect getAspect() { return aspect; }

    public boolean isLandscape() { return landscape; }

    public double getAnchorX() { return anchorX; }

    public double getAnchorY() { return anchorY; }

    public Point2D.Double getAnchor() {
        return new Point2D.Double(anchorX, anchorY);
    }

    /**
     * Builds the geometry this session would have under other parameters, without applying them.
     */
    public CropGeometry geometryFor(TransformParams candidate) {
        return new CropGeometry(srcW, srcH, candidate, settings.defaultFocalLengthMm());
    }

    /**
     * Locked aspect ratio as width over height in BB-normalized units.
     *
     * @return the ratio, or NaN when the aspect is {@link CropAspect#FREE}
     */
    public double targetAspectNormalized() {
        if (!aspect.isLocked()) {
            return Double.NaN;
        }
        double pixelRatio = aspect.longShortRatio(srcW, srcH);
        if (!landscape) {
            pixelRatio = 1.0 / pixelRatio;
        }
        return pixelRatio / geometry.bbAspect();
    }

    // ==================== MUTATIONS ====================

    public void setRect(CropRect newRect) {
        Objects.requireNonNull(newRect, "rect");
        if (newRect.equals(rect)) {
            return;
        }
        rect = newRect;
        publish(CropEvent.Type.CROP_CHANGED);
    }

    /**
     * Applies new transform parameters together with the rect and anchor re-expressed in the
     * new bounding box.
     *
     * @param newGeometry geometry built by {@link #geometryFor(TransformParams)}
     * @param newRect     rectangle in {@code newGeometry}'s BB-normalized space
     * @param newAnchorX  view anchor X in {@code newGeometry}'s BB-normalized space
     * @param newAnchorY  view anchor Y in {@code newGeometry}'s BB-normalized space
     */
    public void applyTransform(CropGeometry newGeometry, CropRect newRect, double newAnchorX, double newAnchorY) {
        boolean paramsChanged = !newGeometry.getParams().equals(params);
        boolean rectChanged = !newRect.equals(rect);
        boolean anchorChanged = newAnchorX != anchorX || newAnchorY != anchorY;
        params = newGeometry.getParams();
        geometry = newGeometry;
        rect = newRect;
        anchorX = newAnchorX;
        anchorY = newAnchorY;
        if (paramsChanged) {
            publish(CropEvent.Type.TRANSFORM_CHANGED);
        }
        if (rectChanged) {
            publish(CropEvent.Type.CROP_CHANGED);
        }
        if (anchorChanged) {
            publish(CropEvent.Type.VIEW_CHANGED);
        }
    }

    public void setAnchor(double x, double y) {
        if (x == anchorX && y == anchorY) {
            return;
        }
        anchorX = x;
        anchorY = y;
        publish(CropEvent.Type.VIEW_CHANGED);
    }

    public void setAspect(CropAspect newAspect) {
        Objects.requireNonNull(newAspect, "aspect");
        if (newAspect == aspect) {
            return;
        }
        aspect = newAspect;
        publish(CropEvent.Type.ASPECT_CHANGED);
    }

    public void setLandscape(boolean value) {
        if (value == landscape) {
            return;
        }
        landscape = value;
        publish(CropEvent.Type.ORIENTATION_CHANGED);
    }

    // ==================== SNAPSHOTS & UNDO ====================

    public UndoEntry snapshot() {
        return new UndoEntry(rect, params);
    }

    /**
     * Restores a snapshot. The view anchor keeps its pixel position across the bounding box change.
     */
    public void restore(UndoEntry entry) {
        CropGeometry target = entry.params().equals(params) ? geometry : geometryFor(entry.params());
        Point2D.Double anchor = target.rescalePointFrom(geometry, anchorX, anchorY);
        applyTransform(target, entry.rect(), anchor.x, anchor.y);
    }

    /**
     * Pushes the current state. The oldest entry is discarded beyond the configured limit.
     */
    public void pushUndo() {
        undoStack.push(snapshot());
        while (undoStack.size() > settings.undoLimit()) {
            undoStack.removeLast();
        }
    }

    /**
     * Restores the most recent snapshot.
     *
     * @return {@code false} if the stack was empty
     */
    public boolean undo() {
        UndoEntry entry = undoStack.poll();
        if (entry == null) {
            logger.debug("Undo requested with an empty stack");
            return false;
        }
        restore(entry);
        return true;
    }

    public boolean canUndo() {
        return !undoStack.isEmpty();
    }

    public int getUndoDepth() {
        return undoStack.size();
    }

    public void clearUndo() {
        undoStack.clear();
    }

    private void publish(CropEvent.Type type) {
        eventBus.publish(new CropEvent(type, snapshot()));
    }
}
