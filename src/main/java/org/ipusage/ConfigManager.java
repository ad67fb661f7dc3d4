package org.ipusage;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public final class ConfigManager {
    private static final String DATABASE = "database";
    private static final String QUARK = "quark";
    private final List<Path> configFiles;

    public ConfigManager(List<Path> configFiles) {
        this.configFiles = List.copyOf(configFiles);
    }

    public Config load() {
        final var values = new HashMap<String, String>();
        for (final var file : configFiles) {
            try {
                values.putAll(parse(Files.readAllLines(file, StandardCharsets.UTF_8)));
            } catch (IOException ex) {
                throw new IllegalStateException("Failed to read config from " + file, ex);
            }
        }
        final var defaults = Config.defaultConfig();
        final var connection = blankToNull(values.get(key(DATABASE, "connection")));
        if (connection == null) {
            throw new ConfigurationException("No [database] connection configured in " + configFiles);
        }
        final var reuseSeconds = parseLong(values.get(key(QUARK, "ipam_reuse_after")),
                defaults.reuseAfter().toSeconds());
        return new Config(connection,
                blankToNull(values.get(key(DATABASE, "user"))),
                values.get(key(DATABASE, "password")),
                Duration.ofSeconds(reuseSeconds),
                values.getOrDefault(key(QUARK, "public_network_id"), defaults.publicNetworkId()),
                values.getOrDefault(key(QUARK, "ip_usage_tenant"), defaults.usageTenant()));
    }

    static Map<String, String> parse(Iterable<String> lines) {
        final var map = new HashMap<String, String>();
        var section = "default";
        for (final var line : lines) {
            if (line == null) continue;
            final var trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#") || trimmed.startsWith(";")) continue;
            if (trimmed.startsWith("[") && trimmed.endsWith("]")) {
                section = trimmed.substring(1, trimmed.length() - 1).trim().toLowerCase(Locale.ROOT);
                continue;
            }
            final var parts = trimmed.split("=", 2);
            if (parts.length == 2) map.put(key(section, parts[0].trim()), parts[1].trim());
        }
        return map;
    }

    private static String key(String section, String name) {
        return section + "." + name;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private static long parseLong(String value, long fallback) {
        if (value == null || value.isBlank()) return fallback;
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }
}
