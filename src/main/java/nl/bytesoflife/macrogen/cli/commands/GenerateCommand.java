package nl.bytesoflife.macrogen.cli.commands;

import nl.bytesoflife.macrogen.block.LayoutOverflowException;
import nl.bytesoflife.macrogen.block.MissingConnectionException;
import nl.bytesoflife.macrogen.cli.MacrogenCli;
import nl.bytesoflife.macrogen.gds.GdsWriter;
import nl.bytesoflife.macrogen.geometry.Cell;
import nl.bytesoflife.macrogen.macro.MacroDriver;
import nl.bytesoflife.macrogen.primitive.InvalidParameterException;
import nl.bytesoflife.macrogen.tech.RuleSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Builds one macro and writes it as a GDSII file.
 */
@Command(
    name = "generate",
    description = "Generate one macro layout"
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    @Parameters(index = "0", description = "Macro name, see 'list'")
    private String macroName;

    @Option(
        names = {"-o", "--output"},
        description = "Output file (default: <macro>.gds in the working directory)"
    )
    private Path output;

    @ParentCommand
    private MacrogenCli parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter err = spec.commandLine().getErr();
        Optional<MacroDriver> driver = parent.getRegistry().find(macroName);
        if (driver.isEmpty()) {
            err.println("Unknown macro '" + macroName + "'. Available: " + parent.getRegistry().names());
            return MacrogenCli.EXIT_USAGE;
        }
        Path target = output != null ? output : Path.of(macroName + ".gds");
        try {
            RuleSet rules = parent.getRuleSet();
            Cell cell = driver.get().build(rules);
            new GdsWriter(rules.getGridNm()).write(cell, target);
            spec.commandLine().getOut().println("Wrote " + cell.getName() + " to " + target);
            return MacrogenCli.EXIT_OK;
        } catch (InvalidParameterException | MissingConnectionException | LayoutOverflowException e) {
            log.error("Generating {} failed: {}", macroName, e.getMessage());
            err.println("Error: " + e.getMessage());
            return MacrogenCli.EXIT_FAILURE;
        } catch (IOException e) {
            log.error("Writing {} failed", target, e);
            err.println("Error: " + e.getMessage());
            return MacrogenCli.EXIT_FAILURE;
        }
    }
}
