package photolib.ext.crop.utilities;

/**
 * Tunables of the crop editor, loaded by {@link CropConfigManager}.
 *
 * @param undoLimit            maximum number of undo entries kept
 * @param handleSizePx         half size of a corner handle on screen; the hit slop is 1.5× this
 * @param rotateMarginPx       margin around the bounding box, on screen, where a press starts a rotate drag
 * @param flipThreshold        distance ratio below which an aspect-locked corner drag flips orientation
 * @param defaultFocalLengthMm focal length used when the photo carries none
 * @param scrollZoomStep       crop scale change per scroll notch
 * @param bisectionIterations  iterations per bounds-correction phase
 * @param startEpsilon         drag-limit tolerance for corners resting on the boundary
 */
public record CropSettings(int undoLimit,
                           double handleSizePx,
                           double rotateMarginPx,
                           double flipThreshold,
                           double defaultFocalLengthMm,
                           double scrollZoomStep,
                           int bisectionIterations,
                           double startEpsilon) {

    public static final CropSettings DEFAULTS = new CropSettings(
            50, 4.0, 40.0, 0.92, 28.0, 0.03, 16, 1e-4);

    public CropSettings {
        if (undoLimit < 1) {
            throw new IllegalArgumentException("undo_limit must be at least 1: " + undoLimit);
        }
        if (!(flipThreshold > 0.0 && flipThreshold <= 1.0)) {
            throw new IllegalArgumentException("flip_threshold must be in (0, 1]: " + flipThreshold);
        }
        if (!(defaultFocalLengthMm > 0.0)) {
            throw new IllegalArgumentException("default_focal_length_mm must be positive: " + defaultFocalLengthMm);
        }
        if (bisectionIterations < 1) {
            throw new IllegalArgumentException("bisection_iterations must be at least 1: " + bisectionIterations);
        }
    }

    /** Hit slop around a handle, in screen pixels. */
    public double handleSlopPx() {
        return handleSizePx * 1.5;
    }
}
