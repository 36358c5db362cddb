package de.bsommerfeld.folio.core.util;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class StorageUtilsTest {

    @Test
    void getAppDataDir_shouldContainAppName() {
        Path dir = StorageUtils.getAppDataDir("test-app");
        assertTrue(dir.toString().contains("test-app"));
    }

    @Test
    void getAppDataDir_shouldBeAbsolute() {
        Path dir = StorageUtils.getAppDataDir("test-app");
        assertTrue(dir.isAbsolute());
    }

    @Test
    void getConfigFile_shouldLiveInAppDataDir() {
        Path appDir = StorageUtils.getAppDataDir("test-app");
        Path config = StorageUtils.getConfigFile("test-app");

        assertEquals(appDir.resolve("config.json"), config);
    }

    @Test
    void getAppDataDir_differentNames_shouldProduceDifferentPaths() {
        assertNotEquals(StorageUtils.getAppDataDir("app-one"), StorageUtils.getAppDataDir("app-two"));
    }
}
