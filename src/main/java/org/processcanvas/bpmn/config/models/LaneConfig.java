package org.processcanvas.bpmn.config.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonMerge;
import com.fasterxml.jackson.annotation.OptBoolean;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class LaneConfig {
    /**
     * Height of a lane that has no diagram shape.
     */
    public double defaultHeight;

    /**
     * Colours handed out to lanes in discovery order, cycling.
     * Example: ["#3B82F6", "#10B981"]
     */
    @JsonMerge(OptBoolean.FALSE)
    public List<String> palette;
}
