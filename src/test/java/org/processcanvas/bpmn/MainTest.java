package org.processcanvas.bpmn;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {
    private static final String SCENARIO_A_BPMN = "src/test/resources/bpmn/scenario_a_linear.bpmn";
    private static final String SCENARIO_B_BPMN = "src/test/resources/bpmn/scenario_b_lanes.bpmn";
    private static final String MALFORMED_BPMN = "src/test/resources/bpmn/malformed.bpmn";
    private static final String ORDER_GRAPH = "src/test/resources/graph/order_process.json";
    private static final String DANGLING_GRAPH = "src/test/resources/graph/dangling_graph.json";
    private static final String INVALID_CONFIG = "src/test/resources/config/invalid_config.json";

    @TempDir
    Path tempDir;

    private CommandLine cmd;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        cmd = Main.newCommandLine();
        out = new StringWriter();
        err = new StringWriter();
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
    }

    @Test
    void shouldPrintImportedGraph() {
        int exitCode = cmd.execute("import", SCENARIO_B_BPMN);

        assertEquals(0, exitCode);
        assertTrue(out.toString().contains("\"pool-with-lanes\""));
        assertTrue(out.toString().contains("Task_Quote"));
    }

    @Test
    void shouldWriteExportedBpmnToFile() throws IOException {
        Path target = tempDir.resolve("order.bpmn");

        int exitCode = cmd.execute("export", ORDER_GRAPH, "--name", "Order handling", "--output", target.toString());

        assertEquals(0, exitCode);
        String xml = Files.readString(target);
        assertTrue(xml.contains("bpmn:definitions"));
        assertTrue(xml.contains("Order handling"));
    }

    @Test
    void shouldFailExportOfInconsistentGraph() {
        int exitCode = cmd.execute("export", DANGLING_GRAPH);

        assertEquals(1, exitCode);
        assertTrue(err.toString().contains("c1"));
    }

    @Test
    void shouldReportValidDocument() {
        int exitCode = cmd.execute("validate", SCENARIO_A_BPMN);

        assertEquals(0, exitCode);
        assertTrue(out.toString().contains("Schema: valid"));
    }

    @Test
    void shouldRejectMalformedDocument() {
        int exitCode = cmd.execute("validate", MALFORMED_BPMN);

        assertEquals(1, exitCode);
        assertTrue(out.toString().contains("Schema: INVALID"));
        assertTrue(out.toString().contains("Import: FAILED"));
    }

    @Test
    void shouldReturnTwoForMissingFile() {
        int exitCode = cmd.execute("import", tempDir.resolve("missing.bpmn").toString());

        assertEquals(2, exitCode);
        assertTrue(err.toString().contains("File not found"));
    }

    @Test
    void shouldFailOnInvalidConfig() {
        int exitCode = cmd.execute("import", "--config", INVALID_CONFIG, SCENARIO_A_BPMN);

        assertEquals(1, exitCode);
    }

    @Test
    void shouldRequireSubcommand() {
        assertEquals(2, cmd.execute());
    }
}
