package photolib.ext.crop.model;

/**
 * Immutable rotation / perspective / shear parameters of the crop editor.
 *
 * <p>All values are clamped on construction:</p>
 * <ul>
 *   <li>{@code fineAngle}: radians, ±π/4</li>
 *   <li>{@code rotate90}: number of clockwise quarter turns, normalized to 0-3</li>
 *   <li>{@code perspV}, {@code perspH}: tilt in degrees, ±45</li>
 *   <li>{@code shear}: ±1</li>
 *   <li>{@code focalLength35mm}: 35mm-equivalent focal length, 0 when unknown</li>
 * </ul>
 *
 * @since 0.1.0
 */
public record TransformParams(double fineAngle,
                              int rotate90,
                              double perspV,
                              double perspH,
                              double shear,
                              double focalLength35mm) {

    public static final double MAX_FINE_ANGLE = Math.PI / 4.0;
    public static final double MAX_TILT_DEGREES = 45.0;
    public static final double MAX_SHEAR = 1.0;
    public static final double DEFAULT_FOCAL_LENGTH_MM = 28.0;

    public static final TransformParams IDENTITY = new TransformParams(0, 0, 0, 0, 0, 0);

    public TransformParams {
        fineAngle = clamp(finiteOrZero(fineAngle), -MAX_FINE_ANGLE, MAX_FINE_ANGLE);
        rotate90 = Math.floorMod(rotate90, 4);
        perspV = clamp(finiteOrZero(perspV), -MAX_TILT_DEGREES, MAX_TILT_DEGREES);
        perspH = clamp(finiteOrZero(perspH), -MAX_TILT_DEGREES, MAX_TILT_DEGREES);
        shear = clamp(finiteOrZero(shear), -MAX_SHEAR, MAX_SHEAR);
        focalLength35mm = Math.max(0.0, finiteOrZero(focalLength35mm));
    }

    /** {@code rotate90 * π/2 + fineAngle}. */
    public double totalRotation() {
        return rotate90 * (Math.PI / 2.0) + fineAngle;
    }

    public boolean hasFineRotation() {
        return fineAngle != 0.0;
    }

    public boolean hasPerspective() {
        return perspV != 0.0 || perspH != 0.0 || shear != 0.0;
    }

    /**
     * Focal length used for perspective math; falls back to {@code defaultMm} when unknown.
     */
    public double effectiveFocalLength(double defaultMm) {
        return focalLength35mm > 0 ? focalLength35mm : defaultMm;
    }

    public TransformParams withFineAngle(double angle) {
        return new TransformParams(angle, rotate90, perspV, perspH, shear, focalLength35mm);
    }

    public TransformParams withRotate90(int steps) {
        return new TransformParams(fineAngle, steps, perspV, perspH, shear, focalLength35mm);
    }

    public TransformParams withPerspective(double vertical, double horizontal) {
        return new TransformParams(fineAngle, rotate90, vertical, horizontal, shear, focalLength35mm);
    }

    public TransformParams withShear(double value) {
        return new TransformParams(fineAngle, rotate90, perspV, perspH, value, focalLength35mm);
    }

    public TransformParams withFocalLength(double mm) {
        return new TransformParams(fineAngle, rotate90, perspV, perspH, shear, mm);
    }

    private static double clamp(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }

    private static double finiteOrZero(double v) {
        return Double.isFinite(v) ? v : 0.0;
    }
}
