package org.ipusage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public final class ConfigPaths {
    private static final String CONFIG_NAME = "neutron.conf";
    private final List<Path> searchPaths;

    public ConfigPaths(List<Path> searchPaths) {
        this.searchPaths = List.copyOf(searchPaths);
    }

    public static ConfigPaths defaults() {
        final var home = Path.of(System.getProperty("user.home"));
        return new ConfigPaths(List.of(
                home.resolve(".neutron").resolve(CONFIG_NAME),
                home.resolve(CONFIG_NAME),
                Path.of("/etc/neutron").resolve(CONFIG_NAME),
                Path.of("/etc").resolve(CONFIG_NAME)
        ));
    }

    public List<Path> searchPaths() {
        return searchPaths;
    }

    /**
     * Files to read, in override order. Explicit files must exist; without any, the first
     * existing search path is used. An empty result means no configuration was found.
     */
    public List<Path> resolve(List<Path> explicitFiles, Path configDir) {
        final var files = new ArrayList<Path>();
        if (explicitFiles.isEmpty()) {
            searchPaths.stream().filter(Files::isRegularFile).findFirst().ifPresent(files::add);
        } else {
            for (final var file : explicitFiles) {
                if (!Files.isRegularFile(file)) {
                    throw new ConfigurationException("Config file not found: " + file);
                }
                files.add(file);
            }
        }
        if (configDir != null) files.addAll(listConfigDir(configDir));
        return List.copyOf(files);
    }

    private List<Path> listConfigDir(Path configDir) {
        if (!Files.isDirectory(configDir)) {
            throw new ConfigurationException("Config directory not found: " + configDir);
        }
        try (var stream = Files.list(configDir)) {
            return stream.filter(p -> p.getFileName().toString().endsWith(".conf"))
                    .filter(Files::isRegularFile)
                    .sorted()
                    .toList();
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to list config directory " + configDir, ex);
        }
    }
}
