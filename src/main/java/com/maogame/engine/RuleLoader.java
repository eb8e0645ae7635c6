package com.maogame.engine;

import com.maogame.errors.InvalidConfigException;
import com.maogame.errors.RuleLoadingException;

import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * Loads rule modules from the jars of a directory.
 * <p>
 * Each jar gets its own class loader and must declare at least one {@link RuleModule} service.
 * Problems are collected over the whole directory and reported in one
 * {@link RuleLoadingException}.
 */
public final class RuleLoader {

    private static final Logger logger = Logger.getLogger(RuleLoader.class.getName());

    private RuleLoader() {
    }

    /**
     * @param directory the directory to scan, not recursively
     * @return the loaded rules, ordered by jar file name
     * @throws InvalidConfigException if the directory cannot be listed
     * @throws RuleLoadingException if any jar fails to provide a valid rule
     */
    public static List<LoadedRule> loadDirectory(Path directory) {
        if (!Files.isDirectory(directory)) {
            throw new InvalidConfigException("Rules directory is not a directory: " + directory);
        }
        List<Path> jars;
        try (Stream<Path> files = Files.list(directory)) {
            jars = files.filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().endsWith(".jar"))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new InvalidConfigException("Cannot list rules directory " + directory, e);
        }

        List<LoadedRule> loaded = new ArrayList<>();
        List<String> failures = new ArrayList<>();
        for (Path jar : jars) {
            loadJar(jar, loaded, failures);
        }
        failures.addAll(checkVersions(loaded.stream().map(LoadedRule::module).toList()));

        if (!failures.isEmpty()) {
            loaded.forEach(LoadedRule::close);
            throw new RuleLoadingException(failures);
        }
        logger.info("Loaded " + loaded.size() + " rules from " + directory);
        return loaded;
    }

    /**
     * @param modules the modules to check
     * @return one message per module whose version differs from {@link GameCore#VERSION}
     */
    public static List<String> checkVersions(List<RuleModule> modules) {
        List<String> failures = new ArrayList<>();
        for (RuleModule module : modules) {
            String version = module.getVersion();
            if (!GameCore.VERSION.equals(version)) {
                failures.add(module.getClass().getName() + ": version " + version
                        + " does not match engine version " + GameCore.VERSION);
            }
        }
        return failures;
    }

    private static void loadJar(Path jar, List<LoadedRule> loaded, List<String> failures) {
        URLClassLoader classLoader;
        try {
            URL url = jar.toUri().toURL();
            classLoader = new URLClassLoader(new URL[] {url}, RuleModule.class.getClassLoader());
        } catch (MalformedURLException e) {
            failures.add(jar + ": " + e.getMessage());
            return;
        }

        List<RuleModule> modules = new ArrayList<>();
        try {
            for (ServiceLoader.Provider<RuleModule> provider : ServiceLoader.load(RuleModule.class, classLoader)
                    .stream().toList()) {
                // the parent loader would also expose rules found on the application class path
                if (provider.type().getClassLoader() == classLoader) {
                    modules.add(provider.get());
                }
            }
        } catch (ServiceConfigurationError e) {
            failures.add(jar + ": " + e.getMessage());
        }

        if (modules.isEmpty()) {
            failures.add(jar + ": no " + RuleModule.class.getName() + " service declared");
            closeLoader(jar, classLoader, failures);
            return;
        }
        for (RuleModule module : modules) {
            loaded.add(new LoadedRule(module, jar, classLoader));
        }
    }

    private static void closeLoader(Path jar, URLClassLoader classLoader, List<String> failures) {
        try {
            classLoader.close();
        } catch (IOException e) {
            failures.add(jar + ": cannot close class loader: " + e.getMessage());
        }
    }
}
