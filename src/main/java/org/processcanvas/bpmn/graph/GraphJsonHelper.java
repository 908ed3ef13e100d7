package org.processcanvas.bpmn.graph;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.processcanvas.bpmn.graph.models.Graph;

import java.io.File;
import java.io.IOException;

/**
 * Reads and writes the graph as the JSON payload exchanged with the canvas.
 */
public class GraphJsonHelper {

    private static final ObjectMapper mapper = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_EMPTY)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    public static String toJson(Graph graph) throws IOException {
        return mapper.writeValueAsString(graph);
    }

    public static Graph fromJson(String json) throws IOException {
        return mapper.readValue(json, Graph.class);
    }

    public static Graph loadGraphFile(String graphFilePath) throws IOException {
        return mapper.readValue(new File(graphFilePath), Graph.class);
    }
}
