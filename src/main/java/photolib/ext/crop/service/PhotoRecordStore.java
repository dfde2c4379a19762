package photolib.ext.crop.service;

import java.util.Optional;

/**
 * Photo record accessor used by the crop editor on entry and on commit.
 */
public interface PhotoRecordStore {

    /**
     * @param photoId record key
     * @return the stored record, or empty if the photo has none yet
     */
    Optional<PhotoRecord> getRecord(String photoId) throws RecordStoreException;

    void setUserCrop(String photoId, double x, double y, double w, double h) throws RecordStoreException;

    /**
     * @param angle fine angle in radians
     * @param rot90 clockwise quarter turns, 0-3
     */
    void setUserRotation(String photoId, double angle, int rot90) throws RecordStoreException;

    /**
     * @param perspV          vertical tilt in degrees
     * @param perspH          horizontal tilt in degrees
     * @param shear           shear factor
     * @param focalLength35mm 35mm-equivalent focal length, 0 when unknown
     */
    void setUserPerspective(String photoId, double perspV, double perspH, double shear,
                            double focalLength35mm) throws RecordStoreException;
}
