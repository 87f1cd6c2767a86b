package nl.bytesoflife.macrogen.cli.commands;

import nl.bytesoflife.macrogen.block.LayoutOverflowException;
import nl.bytesoflife.macrogen.block.MissingConnectionException;
import nl.bytesoflife.macrogen.cli.MacrogenCli;
import nl.bytesoflife.macrogen.drc.DrcReport;
import nl.bytesoflife.macrogen.drc.DrcRunner;
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
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Builds every registered macro into one directory, optionally checking each.
 */
@Command(
    name = "generate-all",
    description = "Generate every macro layout"
)
public class GenerateAllCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateAllCommand.class);

    @Option(
        names = {"-d", "--directory"},
        description = "Output directory (default: ${DEFAULT-VALUE})",
        defaultValue = "macros/gds"
    )
    private Path directory;

    @Option(
        names = {"--check"},
        description = "Run the design-rule checker on each macro"
    )
    private boolean check;

    @ParentCommand
    private MacrogenCli parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        RuleSet rules;
        try {
            rules = parent.getRuleSet();
        } catch (IOException e) {
            err.println("Error: cannot read rule deck: " + e.getMessage());
            return MacrogenCli.EXIT_FAILURE;
        }

        GdsWriter writer = new GdsWriter(rules.getGridNm());
        DrcRunner runner = DrcRunner.standard();
        int failed = 0;
        int dirty = 0;
        for (MacroDriver driver : parent.getRegistry().all()) {
            Path target = directory.resolve(driver.getName() + ".gds");
            try {
                Cell cell = driver.build(rules);
                writer.write(cell, target);
                out.println("  -> " + target);
                if (check) {
                    DrcReport report = runner.run(rules, cell);
                    out.println("     " + (report.isClean() ? "DRC clean" : report.getTotalViolations() + " violations"));
                    if (!report.isClean()) {
                        out.print(report);
                        dirty++;
                    }
                }
            } catch (InvalidParameterException | MissingConnectionException | LayoutOverflowException e) {
                log.error("Generating {} failed: {}", driver.getName(), e.getMessage());
                err.println("Error in " + driver.getName() + ": " + e.getMessage());
                failed++;
            } catch (IOException e) {
                log.error("Writing {} failed", target, e);
                err.println("Error writing " + target + ": " + e.getMessage());
                failed++;
            }
        }
        log.info("Generated {} of {} macros into {}", parent.getRegistry().all().size() - failed,
                parent.getRegistry().all().size(), directory);
        if (failed > 0) {
            return MacrogenCli.EXIT_FAILURE;
        }
        return dirty > 0 ? MacrogenCli.EXIT_VIOLATIONS : MacrogenCli.EXIT_OK;
    }
}
