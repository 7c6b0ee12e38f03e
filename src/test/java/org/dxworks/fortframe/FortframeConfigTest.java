package org.dxworks.fortframe;

import org.dxworks.fortframe.model.Permission;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class FortframeConfigTest {

    @Test
    void defaultsMatchTheDocumentedValues() {
        FortframeConfig config = FortframeConfig.defaults();

        assertEquals("!", config.getDocmark());
        assertEquals(">", config.getPredocmark());
        assertEquals("*", config.getDocmarkAlt());
        assertEquals("|", config.getPredocmarkAlt());
        assertEquals(EnumSet.of(Permission.PUBLIC, Permission.PROTECTED), config.getDisplay());
        assertFalse(config.isHideUndoc());
        assertFalse(config.isProcInternals());
        assertFalse(config.isStrict());
        assertTrue(config.getWorkers() >= 1);
    }

    @Test
    void missingFileGivesDefaults() {
        FortframeConfig config = FortframeConfig.load(Paths.get("src/test/resources/config/absent.yml"));

        assertEquals("!", config.getDocmark());
    }

    @Test
    void loadsYamlSettings() {
        FortframeConfig config = FortframeConfig.load(Paths.get("src/test/resources/config/fortframe-config.yml"));

        assertEquals("<", config.getDocmark());
        assertEquals("", config.getDocmarkAlt());
        assertEquals(EnumSet.of(Permission.PUBLIC, Permission.PRIVATE), config.getDisplay());
        assertTrue(config.isHideUndoc());
        assertTrue(config.isProcInternals());
        assertTrue(config.isWarn());
        assertEquals(2, config.getWorkers());
        assertEquals(List.of(Paths.get("src/test/resources/samples/fortran/include")), config.getIncludeDirs());
        assertEquals(Map.of("netcdf", "https://docs.unidata.ucar.edu/netcdf-fortran/current/"),
                config.getExtraModules());
    }

    @Test
    void collidingDocMarksAreRejected() {
        ConfigurationException error = assertThrows(ConfigurationException.class,
                () -> FortframeConfig.builder().docmark(">").build());

        assertTrue(error.getMessage().contains("docmark ('>') and predocmark ('>') are the same"));
    }

    @Test
    void collidingDocMarksInYamlAreRejected() {
        assertThrows(ConfigurationException.class,
                () -> FortframeConfig.load(Paths.get("src/test/resources/config/colliding-config.yml")));
    }

    @Test
    void emptyAlternateMarksMayCoincide() {
        FortframeConfig config = FortframeConfig.builder().docmarkAlt("").predocmarkAlt("").build();

        assertEquals("", config.getDocmarkAlt());
        assertEquals("", config.getPredocmarkAlt());
    }

    @Test
    void unreadableYamlFallsBackToDefaults() {
        FortframeConfig config = FortframeConfig.load(Paths.get("src/test/resources/config/unknown-key-config.yml"));

        assertEquals("!", config.getDocmark());
        assertEquals(EnumSet.of(Permission.PUBLIC, Permission.PROTECTED), config.getDisplay());
    }

    @Test
    void toBuilderKeepsEverySetting() {
        FortframeConfig config = FortframeConfig.builder().hideUndoc(true).workers(3).build();
        FortframeConfig copy = config.toBuilder().strict(true).build();

        assertTrue(copy.isHideUndoc());
        assertTrue(copy.isStrict());
        assertEquals(3, copy.getWorkers());
    }

    @Test
    void workersMustBePositive() {
        assertThrows(ConfigurationException.class, () -> FortframeConfig.builder().workers(0).build());
    }
}
