package photolib.ext.crop.model;

/**
 * Crop rectangle in bounding-box-normalized coordinates.
 *
 * <p>The origin is the top-left corner of the bounding box (BB) of the rotated and
 * warped image, and {@code (1, 1)} is its bottom-right corner. The rectangle is
 * always screen-horizontal; the image rotates beneath it.</p>
 *
 * <p>Instances are immutable. Candidate rectangles produced during a drag may
 * temporarily violate the containment invariant; committed rectangles never do.</p>
 *
 * @param x left edge
 * @param y top edge
 * @param w width, at least {@link #MIN_SIZE} once committed
 * @param h height, at least {@link #MIN_SIZE} once committed
 * @since 0.1.0
 */
public record CropRect(double x, double y, double w, double h) {

    /** Smallest width or height a committed crop may have. */
    public static final double MIN_SIZE = 0.02;

    /** Full-frame crop. */
    public static final CropRect FULL = new CropRect(0, 0, 1, 1);

    public double right() {
        return x + w;
    }

    public double bottom() {
        return y + h;
    }

    public double centerX() {
        return x + w / 2.0;
    }

    public double centerY() {
        return y + h / 2.0;
    }

    /** Width over height in normalized units. */
    public double aspect() {
        return w / h;
    }

    /**
     * Corner points in the order top-left, top-right, bottom-right, bottom-left.
     *
     * @return array of four {@code [x, y]} pairs
     */
    public double[][] corners() {
        return new double[][]{
                {x, y},
                {x + w, y},
                {x + w, y + h},
                {x, y + h}
        };
    }

    /**
     * Linear interpolation of all four components towards {@code target}.
     */
    public CropRect lerp(CropRect target, double t) {
        return new CropRect(
                x + (target.x - x) * t,
                y + (target.y - y) * t,
                w + (target.w - w) * t,
                h + (target.h - h) * t);
    }

    public CropRect translate(double dx, double dy) {
        return new CropRect(x + dx, y + dy, w, h);
    }

    public CropRect withPosition(double newX, double newY) {
        return new CropRect(newX, newY, w, h);
    }

    /**
     * Creates a rectangle of the given size sharing this rectangle's center.
     */
    public CropRect resizeAboutCenter(double newW, double newH) {
        return new CropRect(centerX() - newW / 2.0, centerY() - newH / 2.0, newW, newH);
    }

    public CropRect scaleAboutCenter(double factor) {
        return resizeAboutCenter(w * factor, h * factor);
    }

    /**
     * Same size, centered in the bounding box.
     */
    public CropRect centered() {
        return new CropRect(0.5 - w / 2.0, 0.5 - h / 2.0, w, h);
    }

    public boolean contains(double px, double py) {
        return px >= x && px <= x + w && py >= y && py <= y + h;
    }

    /**
     * Component-wise comparison with a tolerance.
     */
    public boolean approximatelyEquals(CropRect other, double tolerance) {
        return other != null
                && Math.abs(x - other.x) <= tolerance
                && Math.abs(y - other.y) <= tolerance
                && Math.abs(w - other.w) <= tolerance
                && Math.abs(h - other.h) <= tolerance;
    }

    @Override
    public String toString() {
        return String.format("CropRect[x=%.4f, y=%.4f, w=%.4f, h=%.4f]", x, y, w, h);
    }
}
