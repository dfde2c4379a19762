package photolib.ext.crop.model;

import java.util.Objects;

/**
 * Immutable snapshot of the crop rectangle and transform parameters.
 *
 * @param rect   crop rectangle at the time of the snapshot
 * @param params transform parameters at the time of the snapshot
 */
public record UndoEntry(CropRect rect, TransformParams params) {

    public UndoEntry {
        Objects.requireNonNull(rect, "rect");
        Objects.requireNonNull(params, "params");
    }
}
