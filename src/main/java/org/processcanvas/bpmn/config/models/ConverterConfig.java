package org.processcanvas.bpmn.config.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Root of the converter configuration.
 * Defaults live in {@code converter-defaults.json}; a user file only needs the values it overrides.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ConverterConfig {
    /**
     * Placement of nodes the imported document has no layout for.
     */
    public LayoutConfig layout;

    /**
     * Lane height and colours.
     */
    public LaneConfig lanes;

    /**
     * Pool colours.
     */
    public PoolConfig pools;

    /**
     * Values written to exported documents.
     */
    public ExportConfig export;
}
