package org.processcanvas.bpmn.cli;

import org.processcanvas.bpmn.Main;
import org.processcanvas.bpmn.converter.BpmnConverter;
import org.processcanvas.bpmn.converter.BpmnImportException;
import org.processcanvas.bpmn.converter.BpmnValidator;
import org.processcanvas.bpmn.converter.models.ImportResult;
import org.processcanvas.bpmn.validation.ProcessValidator;
import org.processcanvas.bpmn.validation.models.IssueType;
import org.processcanvas.bpmn.validation.models.ValidationIssue;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
        name = "validate",
        mixinStandardHelpOptions = true,
        description = "Check a BPMN 2.0 file against the BPMN schema and common modelling rules"
)
public class ValidateCommand implements Callable<Integer> {

    @ParentCommand
    private Main parent;

    @Spec
    private CommandSpec spec;

    @Parameters(paramLabel = "<file>", description = "BPMN 2.0 XML file")
    private Path input;

    /**
     * @return 0 when the file is schema-valid and has no error-level issue, 1 otherwise
     */
    @Override
    public Integer call() throws IOException {
        PrintWriter out = spec.commandLine().getOut();
        if (!Files.isRegularFile(input)) {
            spec.commandLine().getErr().printf("[ERROR] File not found: %s%n", input);
            return 2;
        }

        boolean schemaValid = BpmnValidator.isValid(input.toFile());
        out.printf("Schema: %s%n", schemaValid ? "valid" : "INVALID");

        ImportResult result;
        try {
            result = new BpmnConverter(parent.loadConfig())
                    .importBpmn(Files.readString(input, StandardCharsets.UTF_8));
        } catch (BpmnImportException e) {
            out.printf("Import: FAILED %s%n", e.getMessage());
            return 1;
        }

        List<ValidationIssue> issues = ProcessValidator.validate(result.graph());
        out.printf("Import: %d nodes, %d connections, %d diagnostics%n",
                result.graph().nodes().size(), result.graph().connections().size(), result.diagnostics().size());
        for (ValidationIssue issue : issues) {
            out.printf("  [%s] %s: %s%s%n", issue.type().code(), issue.category().code(), issue.message(),
                    issue.nodeId() == null ? "" : " (" + issue.nodeId() + ")");
        }
        out.flush();

        boolean hasErrors = issues.stream().anyMatch(issue -> issue.type() == IssueType.ERROR);
        return schemaValid && !hasErrors ? 0 : 1;
    }
}
