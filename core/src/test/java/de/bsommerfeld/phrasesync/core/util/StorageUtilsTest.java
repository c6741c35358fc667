package de.bsommerfeld.phrasesync.core.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class StorageUtilsTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void clearOverride() {
        System.clearProperty(StorageUtils.HOME_OVERRIDE);
    }

    @Test
    void getAppDataDir_shouldContainAppName() {
        Path dir = StorageUtils.getAppDataDir("test-app");
        assertTrue(dir.toString().contains("test-app"));
        assertTrue(dir.isAbsolute());
    }

    @Test
    void getAppDataDir_shouldHonorHomeOverride() {
        System.setProperty(StorageUtils.HOME_OVERRIDE, tempDir.toString());

        assertEquals(tempDir.toAbsolutePath(), StorageUtils.getAppDataDir());
        assertEquals(tempDir.toAbsolutePath().resolve("logs"), StorageUtils.getLogsDir());
    }

    @Test
    void resolveInAppData_shouldKeepAbsolutePaths() {
        System.setProperty(StorageUtils.HOME_OVERRIDE, tempDir.toString());
        Path absolute = tempDir.resolve("elsewhere/phrases.db").toAbsolutePath();

        assertEquals(absolute, StorageUtils.resolveInAppData(absolute.toString()));
        assertEquals(tempDir.toAbsolutePath().resolve("phrases.db"), StorageUtils.resolveInAppData("phrases.db"));
    }
}
