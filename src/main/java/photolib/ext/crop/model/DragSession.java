package photolib.ext.crop.model;

import photolib.ext.crop.utilities.CropGeometry;

/**
 * Transient state of one drag, from pointer-down to pointer-up.
 *
 * <p>Rotate and perspective drags re-derive every frame from this snapshot, so moving the
 * pointer back to where it started restores the starting state exactly.</p>
 *
 * @param mode          interaction mode chosen by the hit test
 * @param start         crop rectangle and parameters at pointer-down
 * @param startGeometry geometry (and bounding box) at pointer-down
 * @param pointerX      screen X at pointer-down
 * @param pointerY      screen Y at pointer-down
 * @param anchorX       view anchor X at pointer-down
 * @param anchorY       view anchor Y at pointer-down
 * @param landscape     orientation flag at pointer-down
 * @param pointerAngle  angle of the pointer around the crop center at pointer-down, used by rotate
 */
public record DragSession(DragMode mode,
                          UndoEntry start,
                          CropGeometry startGeometry,
                          double pointerX,
                          double pointerY,
                          double anchorX,
                          double anchorY,
                          boolean landscape,
                          double pointerAngle) {

    public CropRect startRect() {
        return start.rect();
    }

    public TransformParams startParams() {
        return start.params();
    }
}
