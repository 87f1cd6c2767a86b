package nl.bytesoflife.macrogen.cli;

import nl.bytesoflife.macrogen.cli.commands.DrcCommand;
import nl.bytesoflife.macrogen.cli.commands.GenerateAllCommand;
import nl.bytesoflife.macrogen.cli.commands.GenerateCommand;
import nl.bytesoflife.macrogen.cli.commands.ListCommand;
import nl.bytesoflife.macrogen.macro.MacroRegistry;
import nl.bytesoflife.macrogen.tech.BuiltinTechnologies;
import nl.bytesoflife.macrogen.tech.RuleSet;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(
    name = "macrogen",
    mixinStandardHelpOptions = true,
    version = "macrogen 1.0",
    description = "Parametric analog macro generator and design-rule checker for IHP SG13G2",
    subcommands = {
        GenerateCommand.class,
        GenerateAllCommand.class,
        DrcCommand.class,
        ListCommand.class,
        CommandLine.HelpCommand.class
    },
    footer = {
        "",
        "Exit status: 0 success or DRC clean, 1 DRC violations, 2 usage error,",
        "3 generation or I/O failure."
    }
)
public class MacrogenCli implements Callable<Integer> {

    public static final int EXIT_OK = 0;
    public static final int EXIT_VIOLATIONS = 1;
    public static final int EXIT_USAGE = 2;
    public static final int EXIT_FAILURE = 3;

    @Option(
        names = {"-r", "--rules"},
        description = "Rule deck to use instead of the bundled SG13G2 deck"
    )
    private Path rulesFile;

    private final MacroRegistry registry;

    public MacrogenCli() {
        this(MacroRegistry.standard());
    }

    public MacrogenCli(MacroRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return EXIT_OK;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = createCommandLine();
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Creates a fully configured CommandLine instance.
     * <p>
     * Use this method in tests to get the same configuration as the CLI entry point.
     */
    public static CommandLine createCommandLine() {
        return createCommandLine(MacroRegistry.standard());
    }

    public static CommandLine createCommandLine(MacroRegistry registry) {
        final CommandLine commandLine = new CommandLine(new MacrogenCli(registry));
        commandLine.setCommandName("macrogen");
        commandLine.setExitCodeExceptionMapper(t ->
                t instanceof CommandLine.ParameterException ? EXIT_USAGE : EXIT_FAILURE);
        return commandLine;
    }

    public MacroRegistry getRegistry() {
        return registry;
    }

    /** The bundled SG13G2 rule set, or the deck given with {@code --rules}. */
    public RuleSet getRuleSet() throws IOException {
        return rulesFile == null ? BuiltinTechnologies.sg13g2() : BuiltinTechnologies.load(rulesFile);
    }
}
