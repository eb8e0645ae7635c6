package com.maogame.engine;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URLClassLoader;
import java.nio.file.Path;

/**
 * A rule module together with the class loader that defined it. The loader stays open for
 * as long as the module may be called.
 *
 * @param module the rule
 * @param source the jar the rule came from, or null for a rule built in code
 * @param classLoader the loader of the jar, or null for a rule built in code
 */
public record LoadedRule(RuleModule module, Path source, URLClassLoader classLoader) implements AutoCloseable {

    public static LoadedRule inMemory(RuleModule module) {
        return new LoadedRule(module, null, null);
    }

    public String name() {
        return module.getName();
    }

    @Override
    public void close() {
        if (classLoader == null) {
            return;
        }
        try {
            classLoader.close();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot close class loader of " + source, e);
        }
    }

    @Override
    public String toString() {
        return "LoadedRule[name=" + name() + (source != null ? ", source=" + source : "") + "]";
    }
}
