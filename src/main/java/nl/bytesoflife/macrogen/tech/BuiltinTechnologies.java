package nl.bytesoflife.macrogen.tech;

import nl.bytesoflife.macrogen.tech.parser.RuleDeckParser;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Provides the technology rule decks bundled as classpath resources.
 */
public class BuiltinTechnologies {

    private static final String SG13G2_RESOURCE = "/tech/sg13g2.rules";

    private static volatile RuleSet cachedSg13g2;

    private BuiltinTechnologies() {
    }

    public static RuleSet sg13g2() {
        if (cachedSg13g2 == null) {
            synchronized (BuiltinTechnologies.class) {
                if (cachedSg13g2 == null) {
                    cachedSg13g2 = loadResource(SG13G2_RESOURCE);
                }
            }
        }
        return cachedSg13g2;
    }

    /** Parses a rule deck from the file system, bypassing the cache. */
    public static RuleSet load(Path deck) throws IOException {
        return new RuleDeckParser().parse(Files.readString(deck, StandardCharsets.UTF_8));
    }

    private static RuleSet loadResource(String resource) {
        try (InputStream is = BuiltinTechnologies.class.getResourceAsStream(resource)) {
            if (is == null) throw new IllegalStateException("Resource not found: " + resource);
            String content = new String(is.readAllBytes(), StandardCharsets.UTF_8);
            return new RuleDeckParser().parse(content);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load rule deck " + resource, e);
        }
    }
}
