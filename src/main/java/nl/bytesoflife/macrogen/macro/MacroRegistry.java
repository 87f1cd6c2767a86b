package nl.bytesoflife.macrogen.macro;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The macro drivers known by name, in generation order.
 */
public class MacroRegistry {

    private final Map<String, MacroDriver> drivers = new LinkedHashMap<>();

    public static MacroRegistry standard() {
        MacroRegistry registry = new MacroRegistry();
        registry.register(new R2rDacDriver());
        registry.register(new BiasDacDriver());
        registry.register(new SvfDriver());
        registry.register(new ScSvfDriver());
        registry.register(new SarAdcDriver());
        return registry;
    }

    public void register(MacroDriver driver) {
        if (drivers.putIfAbsent(driver.getName(), driver) != null) {
            throw new IllegalArgumentException("Duplicate macro name: " + driver.getName());
        }
    }

    public Optional<MacroDriver> find(String name) {
        return Optional.ofNullable(drivers.get(name));
    }

    /** @throws IllegalArgumentException if no driver has that name */
    public MacroDriver get(String name) {
        return find(name).orElseThrow(() -> new IllegalArgumentException(
                "Unknown macro '" + name + "', expected one of " + drivers.keySet()));
    }

    public List<MacroDriver> all() {
        return List.copyOf(drivers.values());
    }

    public List<String> names() {
        return List.copyOf(drivers.keySet());
    }
}
