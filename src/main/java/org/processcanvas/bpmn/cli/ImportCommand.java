package org.processcanvas.bpmn.cli;

import org.processcanvas.bpmn.Main;
import org.processcanvas.bpmn.converter.BpmnConverter;
import org.processcanvas.bpmn.converter.BpmnImportException;
import org.processcanvas.bpmn.converter.models.Diagnostic;
import org.processcanvas.bpmn.converter.models.ImportResult;
import org.processcanvas.bpmn.graph.GraphJsonHelper;
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
        name = "import",
        mixinStandardHelpOptions = true,
        description = "Import a BPMN 2.0 file and print the graph as JSON"
)
public class ImportCommand implements Callable<Integer> {

    @ParentCommand
    private Main parent;

    @Spec
    private CommandSpec spec;

    @Parameters(paramLabel = "<file>", description = "BPMN 2.0 XML file")
    private Path input;

    @Option(names = {"--output", "-o"}, description = "Write the graph JSON here instead of stdout", paramLabel = "<file>")
    private Path output;

    @Override
    public Integer call() throws IOException {
        if (!Files.isRegularFile(input)) {
            spec.commandLine().getErr().printf("[ERROR] File not found: %s%n", input);
            return 2;
        }

        ImportResult result;
        try {
            BpmnConverter converter = new BpmnConverter(parent.loadConfig());
            result = converter.importBpmn(Files.readString(input, StandardCharsets.UTF_8));
        } catch (BpmnImportException e) {
            String element = e.getElementId() == null ? "" : " (element " + e.getElementId() + ")";
            spec.commandLine().getErr().printf("[ERROR] Cannot import %s: %s%s%n", input, e.getMessage(), element);
            return 1;
        }

        for (Diagnostic diagnostic : result.diagnostics()) {
            spec.commandLine().getErr().printf("[%s] %s: %s%n",
                    diagnostic.severity(), diagnostic.code(), diagnostic.message());
        }

        String json = GraphJsonHelper.toJson(result.graph());
        if (output == null) {
            spec.commandLine().getOut().println(json);
        } else {
            Files.writeString(output, json, StandardCharsets.UTF_8);
            spec.commandLine().getErr().printf("[INFO] Wrote %d nodes and %d connections to %s%n",
                    result.graph().nodes().size(), result.graph().connections().size(), output);
        }
        return 0;
    }
}
