package photolib.ext.crop.model;

/**
 * Interaction states of the drag controller.
 */
public enum DragMode {
    NONE,
    MOVE,
    /** Move with the modifier held: pointer motion tilts the image instead. */
    PERSPECTIVE_MOVE,
    ROTATE,
    RESIZE_TOP_LEFT,
    RESIZE_TOP_RIGHT,
    RESIZE_BOTTOM_LEFT,
    RESIZE_BOTTOM_RIGHT,
    RESIZE_TOP,
    RESIZE_BOTTOM,
    RESIZE_LEFT,
    RESIZE_RIGHT;

    public boolean isCorner() {
        return this == RESIZE_TOP_LEFT || this == RESIZE_TOP_RIGHT
                || this == RESIZE_BOTTOM_LEFT || this == RESIZE_BOTTOM_RIGHT;
    }

    public boolean movesLeft() {
        return this == RESIZE_TOP_LEFT || this == RESIZE_BOTTOM_LEFT || this == RESIZE_LEFT;
    }

    public boolean movesRight() {
        return this == RESIZE_TOP_RIGHT || this == RESIZE_BOTTOM_RIGHT || this == RESIZE_RIGHT;
    }

    public boolean movesTop() {
        return this == RESIZE_TOP_LEFT || this == RESIZE_TOP_RIGHT || this == RESIZE_TOP;
    }

    public boolean movesBottom() {
        return this == RESIZE_BOTTOM_LEFT || this == RESIZE_BOTTOM_RIGHT || this == RESIZE_BOTTOM;
    }
}
