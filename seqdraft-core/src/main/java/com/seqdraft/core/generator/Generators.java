package com.seqdraft.core.generator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Looks up {@link DiagramGenerator} implementations registered through {@link ServiceLoader}.
 */
public final class Generators {

    private static final Logger log = LoggerFactory.getLogger(Generators.class);

    private Generators() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Loads all registered generators.
     *
     * @return generators in service-file order
     */
    public static List<DiagramGenerator> all() {
        List<DiagramGenerator> generators = new ArrayList<>();
        ServiceLoader.load(DiagramGenerator.class).forEach(generators::add);
        log.debug("Discovered {} generators", generators.size());
        return generators;
    }

    /**
     * Finds a generator by id.
     *
     * @param id generator id, e.g. {@code mermaid}
     * @return matching generator, empty when none is registered
     */
    public static Optional<DiagramGenerator> find(String id) {
        return all().stream().filter(g -> g.getId().equals(id)).findFirst();
    }
}
