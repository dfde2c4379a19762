package photolib.ext.crop.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import photolib.ext.crop.model.CropAspect;
import photolib.ext.crop.model.CropGeometryState;
import photolib.ext.crop.model.CropRect;
import photolib.ext.crop.model.EventBus;
import photolib.ext.crop.model.TransformParams;
import photolib.ext.crop.model.UndoEntry;
import photolib.ext.crop.service.PhotoRecord;
import photolib.ext.crop.service.PhotoRecordStore;
import photolib.ext.crop.service.RecordStoreException;
import photolib.ext.crop.utilities.BoundsCorrector;
import photolib.ext.crop.utilities.CropGeometry;
import photolib.ext.crop.utilities.CropSettings;

import java.awt.geom.Point2D;
import java.util.Objects;

/**
 * CropController - crop mode lifecycle and the discrete (non-drag) operations of the editor.
 *
 * <p>Workflow:
 * <ol>
 *   <li>{@link #enterCrop(String, int, int)} seeds a {@link CropGeometryState} from the photo
 *       record, or full-frame defaults, and snapshots it</li>
 *   <li>The panel calls the setters below; the view forwards pointer events to
 *       {@link #getDragController()}</li>
 *   <li>{@link #commit()} writes the result to the record store, {@link #cancel()} writes the
 *       entry snapshot back instead</li>
 * </ol>
 *
 * <p>Button-style operations (aspect, orientation, 90° steps, reset, centerize) push an undo
 * entry themselves. Slider-style setters ({@link #setFineAngle}, {@link #setPerspective},
 * {@link #setShear}, {@link #setFocalLength}) do not, because a slider fires many times per
 * gesture; the host calls {@link #pushUndo()} once when the slider is grabbed.</p>
 *
 * <p>Every operation other than {@code enterCrop} throws {@link IllegalStateException}
 * outside crop mode.</p>
 *
 * @since 0.1.0
 */
public class CropController {
    private static final Logger logger = LoggerFactory.getLogger(CropController.class);

    /** Tolerance of {@link #hasChanges()}. */
    static final double CHANGE_TOLERANCE = 1e-9;

    private final PhotoRecordStore store;
    private final CropSettings settings;
    private final EventBus eventBus;
    private final BoundsCorrector corrector;

    private String photoId;
    private CropGeometryState state;
    private DragController dragController;
    private UndoEntry entrySnapshot;

    public CropController(PhotoRecordStore store, CropSettings settings, EventBus eventBus) {
        this.store = Objects.requireNonNull(store, "store");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus");
        this.corrector = new BoundsCorrector(settings.bisectionIterations());
    }

    // ==================== LIFECYCLE ====================

    /**
     * Enters crop mode for a photo.
     *
     * @param photoId record key
     * @param srcW    source width in pixels
     * @param srcH    source height in pixels
     * @throws RecordStoreException if the record cannot be read
     */
    public void enterCrop(String photoId, int srcW, int srcH) throws RecordStoreException {
        if (photoId == null || photoId.isBlank()) {
            throw new IllegalArgumentException("Photo id must not be empty");
        }
        PhotoRecord record = store.getRecord(photoId).orElseGet(() -> {
            logger.warn("No record for photo {}, starting from full frame", photoId);
            return PhotoRecord.defaults(0);
        });

        TransformParams params = record.toTransformParams();
        CropRect rect = record.toCropRect();
        if (!isUsable(rect)) {
            logger.warn("Stored crop {} for photo {} is unusable, using full frame", rect, photoId);
            rect = CropRect.FULL;
        }

        CropGeometryState seeded = new CropGeometryState(srcW, srcH, rect, params, settings, eventBus);
        CropRect corrected = corrector.correct(seeded.getGeometry(), rect);
        seeded.setRect(corrected);
        seeded.setLandscape(corrected.w() * seeded.getGeometry().getBoundingBox().getWidth()
                >= corrected.h() * seeded.getGeometry().getBoundingBox().getHeight());

        this.photoId = photoId;
        this.state = seeded;
        this.dragController = new DragController(seeded);
        this.entrySnapshot = seeded.snapshot();
        logger.info("Entered crop mode for {} ({}x{}): {}, {}", photoId, srcW, srcH, corrected, params);
    }

    /**
     * Writes the current crop and transform to the record store and leaves crop mode.
     */
    public void commit() throws RecordStoreException {
        requireActive();
        UndoEntry result = state.snapshot();
        write(result);
        logger.info("Committed crop for {}: {}", photoId, result.rect());
        exit();
    }

    /**
     * Restores the entry snapshot, writes it back to the record store and leaves crop mode.
     */
    public void cancel() throws RecordStoreException {
        requireActive();
        state.restore(entrySnapshot);
        write(entrySnapshot);
        logger.info("Cancelled crop for {}", photoId);
        exit();
    }

    public boolean isActive() {
        return state != null;
    }

    /**
     * Whether the crop or transform differs from the state at entry.
     */
    public boolean hasChanges() {
        requireActive();
        UndoEntry now = state.snapshot();
        TransformParams a = now.params();
        TransformParams b = entrySnapshot.params();
        return !now.rect().approximatelyEquals(entrySnapshot.rect(), CHANGE_TOLERANCE)
                || a.rotate90() != b.rotate90()
                || Math.abs(a.fineAngle() - b.fineAngle()) > CHANGE_TOLERANCE
                || Math.abs(a.perspV() - b.perspV()) > CHANGE_TOLERANCE
                || Math.abs(a.perspH() - b.perspH()) > CHANGE_TOLERANCE
                || Math.abs(a.shear() - b.shear()) > CHANGE_TOLERANCE
                || Math.abs(a.focalLength35mm() - b.focalLength35mm()) > CHANGE_TOLERANCE;
    }

    // ==================== UNDO ====================

    public void pushUndo() {
        requireActive();
        state.pushUndo();
    }

    /**
     * @return {@code false} if there was nothing to undo
     */
    public boolean undo() {
        requireActive();
        return state.undo();
    }

    public boolean canUndo() {
        requireActive();
        return state.canUndo();
    }

    // ==================== ASPECT & ORIENTATION ====================

    /**
     * Selects an aspect preset and, unless it is {@link CropAspect#FREE}, fits the crop to it
     * around the current crop center.
     */
    public void selectAspect(CropAspect aspect) {
        requireActive();
        state.pushUndo();
        state.setAspect(aspect);
        if (aspect.isLocked()) {
            applyAspect();
        }
        logger.info("Aspect set to {}: {}", aspect, state.getRect());
    }

    /**
     * Sets the landscape / portrait flag and re-applies an orientable aspect.
     */
    public void setOrientation(boolean landscape) {
        requireActive();
        if (landscape == state.isLandscape()) {
            return;
        }
        state.pushUndo();
        state.setLandscape(landscape);
        if (state.getAspect().isOrientable()) {
            applyAspect();
        }
        logger.info("Orientation set to {}", landscape ? "landscape" : "portrait");
    }

    /**
     * Largest rect at the locked ratio inside the bounding box, no larger than the current
     * crop's larger side, centered on the current crop center and corrected.
     */
    private void applyAspect() {
        double ratio = state.targetAspectNormalized();
        CropRect current = state.getRect();
        double w = ratio >= 1.0 ? 1.0 : ratio;
        double h = ratio >= 1.0 ? 1.0 / ratio : 1.0;
        double larger = Math.max(w, h);
        double currentLarger = Math.max(current.w(), current.h());
        if (larger > currentLarger) {
            double s = currentLarger / larger;
            w *= s;
            h *= s;
        }
        CropRect fitted = current.resizeAboutCenter(w, h);
        state.setRect(corrector.correct(state.getGeometry(), fitted));
    }

    // ==================== TRANSFORM SETTERS ====================

    /**
     * @param radians fine angle, clamped to ±π/4
     */
    public void setFineAngle(double radians) {
        requireActive();
        applyParams(state.getParams().withFineAngle(radians));
    }

    /**
     * @param vertical   vertical tilt in degrees, clamped to ±45
     * @param horizontal horizontal tilt in degrees, clamped to ±45
     */
    public void setPerspective(double vertical, double horizontal) {
        requireActive();
        applyParams(state.getParams().withPerspective(vertical, horizontal));
    }

    public void setShear(double shear) {
        requireActive();
        applyParams(state.getParams().withShear(shear));
    }

    /**
     * @param mm 35mm-equivalent focal length; 0 falls back to the configured default
     */
    public void setFocalLength(double mm) {
        requireActive();
        applyParams(state.getParams().withFocalLength(mm));
    }

    /**
     * Rebuilds the geometry, keeps the crop's pixel footprint and the anchor's pixel position,
     * then corrects the crop.
     */
    private void applyParams(TransformParams params) {
        if (params.equals(state.getParams())) {
            return;
        }
        CropGeometry from = state.getGeometry();
        CropGeometry to = state.geometryFor(params);
        CropRect rect = corrector.correct(to, to.rescaleCropFrom(from, state.getRect()));
        Point2D.Double anchor = to.rescalePointFrom(from, state.getAnchorX(), state.getAnchorY());
        state.applyTransform(to, rect, anchor.x, anchor.y);
    }

    /**
     * Rotates the image a quarter turn. The crop and the view anchor turn exactly with it,
     * so the crop keeps its content and swaps its width and height.
     *
     * @param clockwise direction on screen
     */
    public void rotate90(boolean clockwise) {
        requireActive();
        state.pushUndo();
        TransformParams p = state.getParams();
        CropGeometry to = state.geometryFor(p.withRotate90(p.rotate90() + (clockwise ? 1 : 3)));

        CropRect r = state.getRect();
        CropRect turned;
        double ax;
        double ay;
        if (clockwise) {
            // (x, y) -> (1 - y, x)
            turned = new CropRect(1.0 - r.bottom(), r.x(), r.h(), r.w());
            ax = 1.0 - state.getAnchorY();
            ay = state.getAnchorX();
        } else {
            // (x, y) -> (y, 1 - x)
            turned = new CropRect(r.y(), 1.0 - r.right(), r.h(), r.w());
            ax = state.getAnchorY();
            ay = 1.0 - state.getAnchorX();
        }
        state.applyTransform(to, corrector.correct(to, turned), ax, ay);
        state.setLandscape(!state.isLandscape());
        logger.info("Rotated {} to {} quarter turns", clockwise ? "clockwise" : "counter-clockwise",
                to.getParams().rotate90());
    }

    /**
     * Full-frame crop, zero transform (the focal length is kept), orientation from the image
     * shape, view recentered. A locked aspect is re-applied.
     */
    public void reset() {
        requireActive();
        state.pushUndo();
        TransformParams params = TransformParams.IDENTITY.withFocalLength(state.getParams().focalLength35mm());
        state.applyTransform(state.geometryFor(params), CropRect.FULL, 0.5, 0.5);
        state.setLandscape(state.getSourceWidth() >= state.getSourceHeight());
        if (state.getAspect().isLocked()) {
            applyAspect();
        }
        logger.info("Crop reset for {}", photoId);
    }

    /**
     * Moves the crop to the bounding-box center and recenters the view on it.
     */
    public void centerize() {
        requireActive();
        state.pushUndo();
        state.setRect(corrector.correct(state.getGeometry(), state.getRect().centered()));
        state.setAnchor(0.5, 0.5);
    }

    // ==================== QUERIES ====================

    public CropGeometryState getState() {
        requireActive();
        return state;
    }

    public DragController getDragController() {
        requireActive();
        return dragController;
    }

    public EventBus getEventBus() {
        return eventBus;
    }

    public String getPhotoId() {
        return photoId;
    }

    /**
     * @return {@code [width, height]} of the cropped output in pixels
     */
    public int[] outputSize() {
        requireActive();
        return state.getGeometry().outputSize(state.getRect());
    }

    /**
     * @return source UV of the crop corners, top-left, top-right, bottom-right, bottom-left
     */
    public double[] cropQuad() {
        requireActive();
        return state.getGeometry().cropQuad(state.getRect());
    }

    // ==================== HELPERS ====================

    private void write(UndoEntry entry) throws RecordStoreException {
        CropRect r = entry.rect();
        TransformParams p = entry.params();
        store.setUserCrop(photoId, r.x(), r.y(), r.w(), r.h());
        store.setUserRotation(photoId, p.fineAngle(), p.rotate90());
        store.setUserPerspective(photoId, p.perspV(), p.perspH(), p.shear(), p.focalLength35mm());
    }

    private void exit() {
        if (dragController != null) {
            dragController.pointerUp();
        }
        state.clearUndo();
        state = null;
        dragController = null;
        entrySnapshot = null;
    }

    private void requireActive() {
        if (state == null) {
            throw new IllegalStateException("Not in crop mode");
        }
    }

    private static boolean isUsable(CropRect r) {
        return Double.isFinite(r.x()) && Double.isFinite(r.y())
                && r.w() >= CropRect.MIN_SIZE && r.h() >= CropRect.MIN_SIZE
                && Double.isFinite(r.w()) && Double.isFinite(r.h());
    }
}
