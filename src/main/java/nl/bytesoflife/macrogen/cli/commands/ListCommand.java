package nl.bytesoflife.macrogen.cli.commands;

import nl.bytesoflife.macrogen.cli.MacrogenCli;
import nl.bytesoflife.macrogen.macro.MacroDriver;
import nl.bytesoflife.macrogen.tech.RuleSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.Locale;
import java.util.concurrent.Callable;

@Command(
    name = "list",
    description = "List the available macros"
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @ParentCommand
    private MacrogenCli parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        RuleSet rules;
        try {
            rules = parent.getRuleSet();
        } catch (IOException e) {
            log.error("Loading the rule deck failed", e);
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            return MacrogenCli.EXIT_FAILURE;
        }
        double umPerUnit = rules.getGridNm() / 1000.0;
        PrintWriter out = spec.commandLine().getOut();
        for (MacroDriver driver : parent.getRegistry().all()) {
            out.println(String.format(Locale.US, "%-14s %6.1f x %6.1f um  %s", driver.getName(),
                    driver.getWidth() * umPerUnit, driver.getHeight() * umPerUnit, driver.getDescription()));
        }
        out.flush();
        return MacrogenCli.EXIT_OK;
    }
}
