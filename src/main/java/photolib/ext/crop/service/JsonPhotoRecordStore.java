package photolib.ext.crop.service;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * {@link PhotoRecordStore} persisted as a single pretty-printed JSON file keyed by photo id.
 *
 * <p>The file is read once on construction and rewritten after every setter call.</p>
 *
 * @since 0.1.0
 */
public class JsonPhotoRecordStore implements PhotoRecordStore {
    private static final Logger logger = LoggerFactory.getLogger(JsonPhotoRecordStore.class);

    private final Path recordsPath;
    private final Map<String, PhotoRecord> records;
    private final Gson gson;

    /**
     * Opens the store, loading existing records.
     *
     * @param recordsPath JSON file; created on first write if it does not exist
     * @throws RecordStoreException if the file exists but cannot be read or parsed
     */
    public JsonPhotoRecordStore(Path recordsPath) throws RecordStoreException {
        this.recordsPath = recordsPath;
        this.gson = new GsonBuilder()
                .setPrettyPrinting()
                .serializeSpecialFloatingPointValues()
                .create();
        this.records = loadRecords();
        logger.info("Loaded {} photo records from {}", records.size(), recordsPath);
    }

    @Override
    public Optional<PhotoRecord> getRecord(String photoId) {
        requireId(photoId);
        return Optional.ofNullable(records.get(photoId));
    }

    @Override
    public void setUserCrop(String photoId, double x, double y, double w, double h) throws RecordStoreException {
        update(photoId, r -> r.withCrop(x, y, w, h));
    }

    @Override
    public void setUserRotation(String photoId, double angle, int rot90) throws RecordStoreException {
        update(photoId, r -> r.withRotation(angle, rot90));
    }

    @Override
    public void setUserPerspective(String photoId, double perspV, double perspH, double shear,
                                   double focalLength35mm) throws RecordStoreException {
        update(photoId, r -> r.withPerspective(perspV, perspH, shear, focalLength35mm));
    }

    /**
     * Inserts or replaces a whole record, e.g. when a photo is imported with its EXIF data.
     */
    public void putRecord(String photoId, PhotoRecord record) throws RecordStoreException {
        requireId(photoId);
        records.put(photoId, record);
        saveRecords();
    }

    public int size() {
        return records.size();
    }

    private void update(String photoId, UnaryOperator<PhotoRecord> change) throws RecordStoreException {
        requireId(photoId);
        PhotoRecord current = records.get(photoId);
        if (current == null) {
            logger.warn("No record for photo {}, creating one", photoId);
            current = PhotoRecord.defaults(0);
        }
        records.put(photoId, change.apply(current));
        saveRecords();
    }

    private Map<String, PhotoRecord> loadRecords() throws RecordStoreException {
        if (!Files.exists(recordsPath)) {
            logger.info("No photo records file found at {}", recordsPath);
            return new LinkedHashMap<>();
        }
        try {
            String json = Files.readString(recordsPath);
            var type = new TypeToken<LinkedHashMap<String, PhotoRecord>>(){}.getType();
            Map<String, PhotoRecord> loaded = gson.fromJson(json, type);
            return loaded != null ? loaded : new LinkedHashMap<>();
        } catch (IOException | JsonParseException e) {
            throw new RecordStoreException("Failed to load photo records from " + recordsPath, e);
        }
    }

    private void saveRecords() throws RecordStoreException {
        try {
            Path parent = recordsPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(recordsPath, gson.toJson(records));
            logger.debug("Saved {} photo records to {}", records.size(), recordsPath);
        } catch (IOException e) {
            throw new RecordStoreException("Failed to save photo records to " + recordsPath, e);
        }
    }

    private static void requireId(String photoId) {
        if (photoId == null || photoId.isBlank()) {
            throw new IllegalArgumentException("Photo id must not be empty");
        }
    }
}
