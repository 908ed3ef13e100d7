package org.processcanvas.bpmn.cli;

import org.processcanvas.bpmn.Main;
import org.processcanvas.bpmn.converter.BpmnConverter;
import org.processcanvas.bpmn.graph.GraphJsonHelper;
import org.processcanvas.bpmn.graph.models.Graph;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(
        name = "export",
        mixinStandardHelpOptions = true,
        description = "Export a graph JSON file as BPMN 2.0 XML"
)
public class ExportCommand implements Callable<Integer> {

    @ParentCommand
    private Main parent;

    @Spec
    private CommandSpec spec;

    @Parameters(paramLabel = "<graph.json>", description = "Graph JSON file")
    private Path input;

    @Option(names = {"--name", "-n"}, description = "Display name of the process", paramLabel = "<name>",
            defaultValue = "Process")
    private String processName;

    @Option(names = {"--output", "-o"}, description = "Write the BPMN here instead of stdout", paramLabel = "<file>")
    private Path output;

    @Override
    public Integer call() throws IOException {
        if (!Files.isRegularFile(input)) {
            spec.commandLine().getErr().printf("[ERROR] File not found: %s%n", input);
            return 2;
        }

        Graph graph = GraphJsonHelper.loadGraphFile(input.toString());
        String xml;
        try {
            xml = new BpmnConverter(parent.loadConfig()).exportBpmn(graph, processName);
        } catch (IllegalStateException e) {
            spec.commandLine().getErr().printf("[ERROR] Graph %s is inconsistent: %s%n", input, e.getMessage());
            return 1;
        }

        if (output == null) {
            spec.commandLine().getOut().print(xml);
            spec.commandLine().getOut().flush();
        } else {
            Files.writeString(output, xml, StandardCharsets.UTF_8);
            spec.commandLine().getErr().printf("[INFO] Wrote BPMN to %s%n", output);
        }
        return 0;
    }
}
