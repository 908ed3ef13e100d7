package org.processcanvas.bpmn;

import org.processcanvas.bpmn.cli.ExportCommand;
import org.processcanvas.bpmn.cli.ImportCommand;
import org.processcanvas.bpmn.cli.ValidateCommand;
import org.processcanvas.bpmn.config.ConverterConfigHelper;
import org.processcanvas.bpmn.config.models.ConverterConfig;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;

@Command(
        name = "processcanvas-bpmn",
        mixinStandardHelpOptions = true,
        version = "processcanvas-bpmn 0.1.0",
        description = "Converts between process canvas graphs (JSON) and BPMN 2.0 XML",
        subcommands = {ImportCommand.class, ExportCommand.class, ValidateCommand.class}
)
public class Main implements Runnable {

    @Option(names = {"--config", "-c"}, description = "Converter configuration file (JSON), overrides the defaults",
            paramLabel = "<file>", scope = CommandLine.ScopeType.INHERIT)
    private String configPath;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        int exitCode = newCommandLine().execute(args);
        System.exit(exitCode);
    }

    public static CommandLine newCommandLine() {
        return new CommandLine(new Main());
    }

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing sub-command: import, export or validate");
    }

    /**
     * @return the configuration named by {@code --config}, or the shipped defaults
     */
    public ConverterConfig loadConfig() throws IOException {
        if (configPath == null) {
            return ConverterConfigHelper.loadDefaults();
        }
        return ConverterConfigHelper.loadConfigFile(configPath);
    }
}
