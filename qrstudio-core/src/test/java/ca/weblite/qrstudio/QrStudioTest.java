package ca.weblite.qrstudio;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class QrStudioTest {

    @Test
    void testVersionComesFromBuild() {
        String version = QrStudio.getVersion();

        assertNotEquals(QrStudio.UNKNOWN_VERSION, version);
        assertFalse(version.contains("${"), version);
        assertTrue(version.matches("\\d+\\.\\d+\\.\\d+.*"), version);
    }

    @Test
    void testVersionIsStable() {
        assertSame(QrStudio.getVersion(), QrStudio.getVersion());
    }
}
