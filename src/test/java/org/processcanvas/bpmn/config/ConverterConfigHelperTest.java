package org.processcanvas.bpmn.config;

import org.junit.jupiter.api.Test;
import org.processcanvas.bpmn.config.models.ConverterConfig;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConverterConfigHelperTest {
    private static final String CUSTOM_CONFIG = "src/test/resources/config/custom_config.json";
    private static final String INVALID_CONFIG = "src/test/resources/config/invalid_config.json";

    @Test
    void shouldLoadShippedDefaults() {
        ConverterConfig config = ConverterConfigHelper.loadDefaults();

        assertEquals(100, config.layout.baseX);
        assertEquals(150, config.layout.spacing);
        assertEquals(200, config.layout.y);
        assertEquals(150, config.lanes.defaultHeight);
        assertEquals(8, config.lanes.palette.size());
        assertEquals("processcanvas-bpmn", config.export.exporter);
        assertEquals("pc", config.export.extensionPrefix);
    }

    @Test
    void shouldMergeConfigFileOverDefaults() throws IOException {
        ConverterConfig config = ConverterConfigHelper.loadConfigFile(CUSTOM_CONFIG);

        assertEquals(40, config.layout.baseX);
        assertEquals(200, config.layout.spacing);
        assertEquals(200, config.layout.y);
        assertEquals(120, config.lanes.defaultHeight);
        assertEquals(List.of("#111111", "#222222"), config.lanes.palette);
        assertEquals(4, config.pools.palette.size());
        assertEquals("Order Desk", config.export.exporter);
        assertEquals("generator", config.export.metaKey);
        assertEquals("processcanvas-bpmn 0.1.0", config.export.metaValue);
    }

    @Test
    void shouldRejectConfigFileAgainstSchema() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ConverterConfigHelper.loadConfigFile(INVALID_CONFIG));
        assertTrue(e.getMessage().contains(INVALID_CONFIG));
    }

    @Test
    void shouldAcceptValidConfigFile() throws IOException {
        assertTrue(ConverterConfigHelper.validateConfigFile(CUSTOM_CONFIG).isEmpty());
    }

    @Test
    void shouldCyclePalettes() {
        ConverterConfig config = ConverterConfigHelper.loadDefaults();

        assertEquals("#3B82F6", ConverterConfigHelper.laneColor(config, 0));
        assertEquals("#10B981", ConverterConfigHelper.laneColor(config, 1));
        assertEquals("#3B82F6", ConverterConfigHelper.laneColor(config, 8));
        assertEquals("#1F2937", ConverterConfigHelper.poolColor(config, 4));
    }

    @Test
    void shouldGiveNoColorForEmptyPalette() {
        ConverterConfig config = ConverterConfigHelper.loadDefaults();
        config.lanes.palette = List.of();

        assertNull(ConverterConfigHelper.laneColor(config, 3));
    }
}
