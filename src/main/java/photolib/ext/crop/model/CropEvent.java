package photolib.ext.crop.model;

/**
 * Change notification published on the {@link EventBus}.
 *
 * <p>Events carry an immutable snapshot instead of a reference to the live state, so
 * subscribers (preview thumbnail, output-size label, panel controls) never hold pointers
 * into the geometry core.</p>
 *
 * @param type     what changed
 * @param snapshot crop rectangle and transform parameters after the change
 */
public record CropEvent(Type type, UndoEntry snapshot) {

    public enum Type {
        /** Crop rectangle moved or resized. */
        CROP_CHANGED,
        /** Rotation, perspective, shear or focal length changed; the bounding box was rebuilt. */
        TRANSFORM_CHANGED,
        /** A different aspect preset was selected. */
        ASPECT_CHANGED,
        /** Landscape / portrait flag flipped, by the toggle or by auto-flip during a drag. */
        ORIENTATION_CHANGED,
        /** View anchor moved. */
        VIEW_CHANGED
    }
}
