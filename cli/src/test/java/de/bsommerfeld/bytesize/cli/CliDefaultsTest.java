package de.bsommerfeld.bytesize.cli;

import de.bsommerfeld.bytesize.ByteSizeConfig;
import de.bsommerfeld.bytesize.unit.UnitSystem;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CliDefaultsTest {

    private String originalSystem;
    private String originalDecimals;

    @BeforeEach
    void rememberProperties() {
        originalSystem = System.getProperty(CliDefaults.SYSTEM_PROPERTY);
        originalDecimals = System.getProperty(CliDefaults.DECIMALS_PROPERTY);
    }

    @AfterEach
    void restoreProperties() {
        restore(CliDefaults.SYSTEM_PROPERTY, originalSystem);
        restore(CliDefaults.DECIMALS_PROPERTY, originalDecimals);
    }

    private static void restore(String key, String value) {
        if (value != null)
            System.setProperty(key, value);
        else
            System.clearProperty(key);
    }

    @Test
    void system_shouldNeverBeNull() {
        System.clearProperty(CliDefaults.SYSTEM_PROPERTY);
        // Falls through to BYTESIZE_SYSTEM, which may or may not be set
        assertNotNull(CliDefaults.system());
    }

    @Test
    void system_shouldResolveFromSystemProperty() {
        System.setProperty(CliDefaults.SYSTEM_PROPERTY, "SI");
        assertEquals(UnitSystem.SI, CliDefaults.system());
    }

    @Test
    void system_shouldBeCaseInsensitive() {
        System.setProperty(CliDefaults.SYSTEM_PROPERTY, "jedec");
        assertEquals(UnitSystem.JEDEC, CliDefaults.system());
    }

    @Test
    void system_shouldDefaultToIecForInvalidValue() {
        System.setProperty(CliDefaults.SYSTEM_PROPERTY, "INVALID_GARBAGE");
        assertEquals(UnitSystem.IEC, CliDefaults.system());
    }

    @Test
    void decimals_shouldResolveFromSystemProperty() {
        System.setProperty(CliDefaults.DECIMALS_PROPERTY, "4");
        assertEquals(4, CliDefaults.decimals());
    }

    @Test
    void decimals_shouldDefaultToTwoForInvalidValues() {
        System.setProperty(CliDefaults.DECIMALS_PROPERTY, "many");
        assertEquals(2, CliDefaults.decimals());

        System.setProperty(CliDefaults.DECIMALS_PROPERTY, "-3");
        assertEquals(2, CliDefaults.decimals());
    }

    @Test
    void config_shouldCarryResolvedDefaults() {
        System.setProperty(CliDefaults.SYSTEM_PROPERTY, "si");
        System.setProperty(CliDefaults.DECIMALS_PROPERTY, "1");

        ByteSizeConfig config = CliDefaults.config();

        assertEquals(UnitSystem.SI, config.format().getSystem());
        assertEquals(1, config.format().getDecimals());
    }
}
