package photolib.ext.crop.service;

import photolib.ext.crop.model.CropRect;
import photolib.ext.crop.model.TransformParams;

/**
 * Persisted crop and transform values of one photo.
 *
 * <p>The crop is stored in bounding-box-normalized coordinates, the fine angle in radians and
 * the perspective tilts in degrees, exactly as {@link CropRect} and {@link TransformParams}
 * hold them. {@code focalLength35mm} is 0 when the camera did not record it.</p>
 */
public class PhotoRecord {
    private final double cropX;
    private final double cropY;
    private final double cropW;
    private final double cropH;
    private final double angle;
    private final int rot90;
    private final double perspV;
    private final double perspH;
    private final double shear;
    private final double focalLength35mm;

    public PhotoRecord(double cropX, double cropY, double cropW, double cropH,
                       double angle, int rot90,
                       double perspV, double perspH, double shear,
                       double focalLength35mm) {
        this.cropX = cropX;
        this.cropY = cropY;
        this.cropW = cropW;
        this.cropH = cropH;
        this.angle = angle;
        this.rot90 = rot90;
        this.perspV = perspV;
        this.perspH = perspH;
        this.shear = shear;
        this.focalLength35mm = focalLength35mm;
    }

    /**
     * Full-frame, untransformed record with the given EXIF focal length.
     */
    public static PhotoRecord defaults(double focalLength35mm) {
        return new PhotoRecord(0, 0, 1, 1, 0, 0, 0, 0, 0, focalLength35mm);
    }

    // Getters
    public double getCropX() { return cropX; }
    public double getCropY() { return cropY; }
    public double getCropW() { return cropW; }
    public double getCropH() { return cropH; }
    public double getAngle() { return angle; }
    public int getRot90() { return rot90; }
    public double getPerspV() { return perspV; }
    public double getPerspH() { return perspH; }
    public double getShear() { return shear; }
    public double getFocalLength35mm() { return focalLength35mm; }

    public CropRect toCropRect() {
        return new CropRect(cropX, cropY, cropW, cropH);
    }

    public TransformParams toTransformParams() {
        return new TransformParams(angle, rot90, perspV, perspH, shear, focalLength35mm);
    }

    public PhotoRecord withCrop(double x, double y, double w, double h) {
        return new PhotoRecord(x, y, w, h, angle, rot90, perspV, perspH, shear, focalLength35mm);
    }

    public PhotoRecord withRotation(double newAngle, int newRot90) {
        return new PhotoRecord(cropX, cropY, cropW, cropH, newAngle, newRot90, perspV, perspH, shear, focalLength35mm);
    }

    public PhotoRecord withPerspective(double v, double h, double newShear, double focal) {
        return new PhotoRecord(cropX, cropY, cropW, cropH, angle, rot90, v, h, newShear, focal);
    }

    @Override
    public String toString() {
        return String.format("PhotoRecord[crop=(%.4f, %.4f, %.4f, %.4f), angle=%.4f, rot90=%d, persp=(%.2f, %.2f), shear=%.3f, focal=%.1f]",
                cropX, cropY, cropW, cropH, angle, rot90, perspV, perspH, shear, focalLength35mm);
    }
}
