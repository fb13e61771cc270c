package com.trading.fincalc.config;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import static org.junit.Assert.*;

public class KernelSettingsLoaderTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    @Test
    public void testDefaultResource() {
        KernelSettings settings = KernelSettingsLoader.load();
        assertEquals(28, settings.getPrecision());
        assertEquals(RoundingMode.HALF_EVEN, settings.getRoundingMode());
        assertEquals(DomainPolicy.SENTINEL, settings.getDomainPolicy());
        assertEquals(0, new BigDecimal("1e-10").compareTo(settings.getSingularPivotThreshold()));
        assertEquals(0, new BigDecimal("1e-7").compareTo(settings.getInverseCdfClamp()));
        assertEquals(40, settings.getExpTaylorTerms());
    }

    @Test
    public void testOverridesKeepDefaultsAndIgnoreUnknownFields() {
        KernelSettings settings = KernelSettingsLoader.loadResource("fincalc-kernel-strict.json");
        assertEquals(34, settings.getPrecision());
        assertEquals(DomainPolicy.FAIL, settings.getDomainPolicy());
        assertEquals(0, new BigDecimal("0.000000000001").compareTo(settings.getSingularPivotThreshold()));
        // Untouched fields keep their defaults
        assertEquals(20, settings.getSqrtIterations());
        assertEquals(34, settings.mathContext().getPrecision());
    }

    @Test
    public void testMissingResourceUsesDefaults() {
        KernelSettings settings = KernelSettingsLoader.loadResource("no-such-settings.json");
        assertEquals(new KernelSettings(), settings);
    }

    @Test
    public void testInvalidResourceIsRejected() {
        try {
            KernelSettingsLoader.loadResource("fincalc-kernel-invalid.json");
            fail("Should throw IllegalStateException");
        } catch (IllegalStateException e) {
            assertTrue(e.getMessage().contains("fincalc-kernel-invalid.json"));
            assertTrue(e.getCause() instanceof IllegalArgumentException);
        }
    }

    @Test
    public void testParse() {
        KernelSettings settings = KernelSettingsLoader.parse("{\"lnIterations\": 60, \"warnIntervalMillis\": 0}");
        assertEquals(60, settings.getLnIterations());
        assertEquals(0, settings.getWarnIntervalMillis());

        try {
            KernelSettingsLoader.parse("{\"inverseCdfClamp\": 0.6}");
            fail("Should reject a clamp of 0.6");
        } catch (IllegalStateException e) {
            assertTrue(e.getMessage().contains("inverseCdfClamp"));
        }

        try {
            KernelSettingsLoader.parse("{not json");
            fail("Should reject malformed JSON");
        } catch (IllegalStateException e) {
            assertTrue(e.getMessage().startsWith("Invalid kernel settings"));
        }
    }

    @Test
    public void testLoadFromFile() throws Exception {
        File file = tmp.newFile("kernel.json");
        Files.write(file.toPath(), "{\"cosTaylorTerms\": 24}".getBytes(StandardCharsets.UTF_8));
        KernelSettings settings = KernelSettingsLoader.load(file.toPath());
        assertEquals(24, settings.getCosTaylorTerms());

        try {
            KernelSettingsLoader.load(new File(tmp.getRoot(), "absent.json").toPath());
            fail("Should throw IllegalStateException for a missing file");
        } catch (IllegalStateException e) {
            assertTrue(e.getMessage().contains("absent.json"));
        }
    }
}
