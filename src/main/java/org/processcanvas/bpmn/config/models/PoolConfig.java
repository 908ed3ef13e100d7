package org.processcanvas.bpmn.config.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonMerge;
import com.fasterxml.jackson.annotation.OptBoolean;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class PoolConfig {
    @JsonMerge(OptBoolean.FALSE)
    public List<String> palette;
}
