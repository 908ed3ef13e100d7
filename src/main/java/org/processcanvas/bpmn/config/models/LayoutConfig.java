package org.processcanvas.bpmn.config.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Fallback placement: the n-th node without layout goes to {@code (baseX + n * spacing, y)}.
 * <p>
 * Example from converter-defaults.json:
 * {"baseX": 100, "spacing": 150, "y": 200}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class LayoutConfig {
    public double baseX;
    public double spacing;
    public double y;
}
