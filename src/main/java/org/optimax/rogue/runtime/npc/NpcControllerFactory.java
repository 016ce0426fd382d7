package org.optimax.rogue.runtime.npc;

import org.optimax.rogue.runtime.spi.INpcController;
import org.optimax.rogue.runtime.spi.IRandomProvider;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Creates NPC controllers by their configured name.
 */
public final class NpcControllerFactory {

    private static final Map<String, Function<IRandomProvider, INpcController>> registry = new HashMap<>();

    static {
        register("stationary", random -> new StationaryNpcController());
        register("wandering", WanderingNpcController::new);
    }

    private NpcControllerFactory() {
    }

    /**
     * Registers a controller under a name. Names are case-insensitive.
     */
    public static void register(String name, Function<IRandomProvider, INpcController> creator) {
        registry.put(name.toLowerCase(Locale.ROOT), creator);
    }

    /**
     * @param name   the controller name, e.g. {@code "stationary"}
     * @param random the stream the controller may draw from
     * @return the controller
     * @throws IllegalArgumentException if the name is unknown
     */
    public static INpcController create(String name, IRandomProvider random) {
        Objects.requireNonNull(name, "NPC controller name cannot be null.");
        Function<IRandomProvider, INpcController> creator = registry.get(name.toLowerCase(Locale.ROOT));
        if (creator == null) {
            throw new IllegalArgumentException("Unknown NPC controller: " + name);
        }
        return creator.apply(random);
    }
}
