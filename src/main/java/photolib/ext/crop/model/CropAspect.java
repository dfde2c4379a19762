package photolib.ext.crop.model;

/**
 * Aspect ratio presets offered by the crop panel.
 *
 * <p>Ratios are expressed as long side over short side; the landscape / portrait
 * orientation flag decides which way round they are applied.</p>
 */
public enum CropAspect {
    ORIGINAL("Original", Double.NaN),
    A16_9("16:9", 16.0 / 9.0),
    A4_3("4:3", 4.0 / 3.0),
    A3_2("3:2", 3.0 / 2.0),
    A1_1("1:1", 1.0),
    A5_4("5:4", 5.0 / 4.0),
    FREE("Free", Double.NaN);

    private final String label;
    private final double ratio;

    CropAspect(String label, double ratio) {
        this.label = label;
        this.ratio = ratio;
    }

    public String getLabel() {
        return label;
    }

    public boolean isLocked() {
        return this != FREE;
    }

    /**
     * Whether the landscape / portrait toggle changes anything for this preset.
     */
    public boolean isOrientable() {
        return this != FREE && this != A1_1;
    }

    /**
     * Long-over-short pixel ratio of this preset.
     *
     * @param srcW source image width in pixels, used by {@link #ORIGINAL}
     * @param srcH source image height in pixels, used by {@link #ORIGINAL}
     * @return ratio ≥ 1, or NaN for {@link #FREE}
     */
    public double longShortRatio(double srcW, double srcH) {
        if (this == ORIGINAL) {
            return Math.max(srcW, srcH) / Math.max(1.0, Math.min(srcW, srcH));
        }
        return ratio;
    }

    @Override
    public String toString() {
        return label;
    }
}
