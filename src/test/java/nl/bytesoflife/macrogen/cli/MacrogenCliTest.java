package nl.bytesoflife.macrogen.cli;

import nl.bytesoflife.macrogen.gds.GdsWriter;
import nl.bytesoflife.macrogen.geometry.Cell;
import nl.bytesoflife.macrogen.tech.BuiltinTechnologies;
import nl.bytesoflife.macrogen.tech.Layers;
import nl.bytesoflife.macrogen.tech.RuleSet;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class MacrogenCliTest {

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        CommandLine commandLine = MacrogenCli.createCommandLine();
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        return commandLine.execute(args);
    }

    @Test
    void listShowsEveryMacro() {
        assertEquals(MacrogenCli.EXIT_OK, run("list"));
        assertTrue(out.toString().contains("r2r_dac_8bit"));
        assertTrue(out.toString().contains("sar_adc_8bit"));
    }

    @Test
    void listScalesOutlinesWithTheDeckGrid(@TempDir Path dir) throws IOException {
        Path deck = dir.resolve("coarse.rules");
        Files.writeString(deck, "(technology coarse)\n(grid 5nm)\n");

        assertEquals(MacrogenCli.EXIT_OK, run("--rules", deck.toString(), "list"));
        assertTrue(out.toString().contains(" 225.0 x  300.0 um"), out::toString);
    }

    @Test
    void unknownMacroIsAUsageError() {
        assertEquals(MacrogenCli.EXIT_USAGE, run("generate", "pll"));
        assertTrue(err.toString().contains("pll"));
    }

    @Test
    void unknownOptionIsAUsageError() {
        assertEquals(MacrogenCli.EXIT_USAGE, run("generate", "--bogus"));
    }

    @Test
    void generatedMacroPassesDrc(@TempDir Path dir) throws IOException {
        Path gds = dir.resolve("r2r.gds");

        assertEquals(MacrogenCli.EXIT_OK, run("generate", "r2r_dac_8bit", "-o", gds.toString()));
        assertTrue(Files.size(gds) > 0);

        assertEquals(MacrogenCli.EXIT_OK, run("drc", gds.toString()));
        assertTrue(out.toString().contains("DRC CLEAN"));
    }

    @Test
    void violationsGiveExitCodeOne(@TempDir Path dir) throws IOException {
        RuleSet rules = BuiltinTechnologies.sg13g2();
        Cell cell = new Cell("narrow");
        cell.add(rules.layer(Layers.METAL1), 0, 0, 2000, 100);
        Path gds = dir.resolve("narrow.gds");
        new GdsWriter(rules.getGridNm()).write(cell, gds);

        assertEquals(MacrogenCli.EXIT_VIOLATIONS, run("drc", gds.toString()));
        assertTrue(out.toString().contains("M1.a"));
    }

    @Test
    void missingFileIsAFailure(@TempDir Path dir) {
        assertEquals(MacrogenCli.EXIT_FAILURE, run("drc", dir.resolve("absent.gds").toString()));
    }

    @Test
    void generateAllWritesEveryMacro(@TempDir Path dir) {
        assertEquals(MacrogenCli.EXIT_OK, run("generate-all", "-d", dir.toString()));
        assertTrue(Files.exists(dir.resolve("bias_dac_2ch.gds")));
        assertTrue(Files.exists(dir.resolve("sc_svf_2nd.gds")));
    }

    @Test
    void customRuleDeckIsUsed(@TempDir Path dir) throws IOException {
        Path deck = dir.resolve("strict.rules");
        Files.writeString(deck, String.join("\n",
                "(technology strict)",
                "(grid 1nm)",
                "(layer Metal1 8 0)",
                "(rule M1.a (description \"Min Metal1 width\") (width Metal1) (min 0.5um))"));
        Path gds = dir.resolve("wire.gds");
        RuleSet rules = BuiltinTechnologies.sg13g2();
        Cell cell = new Cell("wire");
        cell.add(rules.layer(Layers.METAL1), 0, 0, 2000, 300);
        new GdsWriter(rules.getGridNm()).write(cell, gds);

        assertEquals(MacrogenCli.EXIT_OK, run("drc", gds.toString()));
        assertEquals(MacrogenCli.EXIT_VIOLATIONS, run("--rules", deck.toString(), "drc", gds.toString()));
    }
}
