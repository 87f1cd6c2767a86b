package nl.bytesoflife.macrogen.cli.commands;

import nl.bytesoflife.macrogen.cli.MacrogenCli;
import nl.bytesoflife.macrogen.drc.DrcReport;
import nl.bytesoflife.macrogen.drc.DrcRunner;
import nl.bytesoflife.macrogen.gds.GdsReader;
import nl.bytesoflife.macrogen.geometry.Cell;
import nl.bytesoflife.macrogen.tech.RuleSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Checks a GDSII file against the rule set and prints the per-rule report.
 */
@Command(
    name = "drc",
    description = "Run the design-rule checker on a layout file"
)
public class DrcCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(DrcCommand.class);

    @Parameters(index = "0", description = "GDSII file")
    private Path file;

    @Parameters(index = "1", arity = "0..1", description = "Cell to check (default: the top cell)")
    private String cellName;

    @ParentCommand
    private MacrogenCli parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            RuleSet rules = parent.getRuleSet();
            Cell cell = new GdsReader(rules).read(file, cellName);
            DrcReport report = DrcRunner.standard().run(rules, cell);
            out.print(report);
            out.flush();
            return report.isClean() ? MacrogenCli.EXIT_OK : MacrogenCli.EXIT_VIOLATIONS;
        } catch (IOException e) {
            log.error("Cannot check {}: {}", file, e.getMessage());
            err.println("Error: " + e.getMessage());
            return MacrogenCli.EXIT_FAILURE;
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return MacrogenCli.EXIT_FAILURE;
        }
    }
}
