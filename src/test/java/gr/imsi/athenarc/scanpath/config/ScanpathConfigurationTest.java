package gr.imsi.athenarc.scanpath.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.util.Properties;

import org.junit.jupiter.api.Test;

public class ScanpathConfigurationTest {

    @Test
    public void testBundledPropertiesUseStandardTable() throws IOException {
        ScanpathConfiguration configuration = ScanpathConfiguration.load();
        assertTrue(configuration.usesStandardTable());
        assertNull(configuration.getOutFolder());
        assertEquals(',', configuration.getCsvDelimiter());
    }

    @Test
    public void testFromProperties() {
        Properties properties = new Properties();
        properties.setProperty(ScanpathConfiguration.TABLE_PROPERTY, " tables/custom.properties ");
        properties.setProperty(ScanpathConfiguration.OUT_PROPERTY, "reports");
        properties.setProperty(ScanpathConfiguration.DELIMITER_PROPERTY, ";");

        ScanpathConfiguration configuration = ScanpathConfiguration.fromProperties(properties);
        assertEquals("tables/custom.properties", configuration.getTableLocation());
        assertEquals("reports", configuration.getOutFolder());
        assertEquals(';', configuration.getCsvDelimiter());
    }

    @Test
    public void testBuilderOverrides() {
        ScanpathConfiguration configuration = new ScanpathConfiguration.Builder()
            .tableLocation("a.properties")
            .build()
            .toBuilder()
            .tableLocation("  ")
            .outFolder("out")
            .build();
        assertTrue(configuration.usesStandardTable());
        assertEquals("out", configuration.getOutFolder());
    }

    @Test
    public void testDelimiterMustBeOneCharacter() {
        Properties properties = new Properties();
        properties.setProperty(ScanpathConfiguration.DELIMITER_PROPERTY, ";;");
        assertThrows(IllegalArgumentException.class, () -> ScanpathConfiguration.fromProperties(properties));
    }
}
