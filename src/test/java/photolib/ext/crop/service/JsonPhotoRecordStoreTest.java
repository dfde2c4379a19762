package photolib.ext.crop.service;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Unit tests for the JSON-file photo record store.
 */
class JsonPhotoRecordStoreTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("A missing file opens as an empty store")
    void testMissingFile() throws RecordStoreException {
        JsonPhotoRecordStore store = new JsonPhotoRecordStore(tempDir.resolve("records.json"));
        assertEquals(0, store.size());
        assertTrue(store.getRecord("IMG_1").isEmpty());
    }

    @Test
    @DisplayName("Values written by the setters survive reopening the store")
    void testPersistAndReload() throws RecordStoreException {
        Path file = tempDir.resolve("nested").resolve("records.json");
        JsonPhotoRecordStore store = new JsonPhotoRecordStore(file);
        store.setUserCrop("IMG_1", 0.1, 0.2, 0.3, 0.4);
        store.setUserRotation("IMG_1", 0.125, 3);
        store.setUserPerspective("IMG_1", 12.5, -4.0, 0.2, 35.0);
        assertTrue(Files.exists(file));

        PhotoRecord r = new JsonPhotoRecordStore(file).getRecord("IMG_1").orElseThrow();
        assertEquals(0.1, r.getCropX());
        assertEquals(0.2, r.getCropY());
        assertEquals(0.3, r.getCropW());
        assertEquals(0.4, r.getCropH());
        assertEquals(0.125, r.getAngle());
        assertEquals(3, r.getRot90());
        assertEquals(12.5, r.getPerspV());
        assertEquals(-4.0, r.getPerspH());
        assertEquals(0.2, r.getShear());
        assertEquals(35.0, r.getFocalLength35mm());
    }

    @Test
    @DisplayName("Setters only touch their own fields")
    void testPartialUpdate() throws RecordStoreException {
        JsonPhotoRecordStore store = new JsonPhotoRecordStore(tempDir.resolve("records.json"));
        store.putRecord("IMG_2", new PhotoRecord(0.25, 0.25, 0.5, 0.5, 0, 0, 0, 0, 0, 50));
        store.setUserRotation("IMG_2", -0.2, 1);

        PhotoRecord r = store.getRecord("IMG_2").orElseThrow();
        assertEquals(0.25, r.getCropX());
        assertEquals(0.5, r.getCropW());
        assertEquals(-0.2, r.getAngle());
        assertEquals(1, r.getRot90());
        assertEquals(50.0, r.getFocalLength35mm());
    }

    @Test
    @DisplayName("Writing an unknown photo creates a full-frame record first")
    void testCreatesRecord() throws RecordStoreException {
        JsonPhotoRecordStore store = new JsonPhotoRecordStore(tempDir.resolve("records.json"));
        store.setUserRotation("IMG_3", 0.1, 0);

        PhotoRecord r = store.getRecord("IMG_3").orElseThrow();
        assertEquals(1.0, r.getCropW());
        assertEquals(1.0, r.getCropH());
        assertEquals(1, store.size());
    }

    @Test
    @DisplayName("A file that is not a record map is reported as a store error")
    void testCorruptFile() throws IOException {
        Path file = tempDir.resolve("records.json");
        Files.writeString(file, "[1, 2, 3]");
        RecordStoreException e = assertThrows(RecordStoreException.class, () -> new JsonPhotoRecordStore(file));
        assertNotNull(e.getCause());
    }

    @Test
    @DisplayName("Blank photo ids are rejected")
    void testBlankId() throws RecordStoreException {
        JsonPhotoRecordStore store = new JsonPhotoRecordStore(tempDir.resolve("records.json"));
        assertThrows(IllegalArgumentException.class, () -> store.getRecord(" "));
        assertThrows(IllegalArgumentException.class, () -> store.setUserCrop(null, 0, 0, 1, 1));
    }
}
