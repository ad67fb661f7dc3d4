package org.ipusage;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

public record CliOptions(List<Path> configFiles, Path configDir, boolean debug, boolean verbose) {
    private static final Set<String> FLAGS = Set.of("debug", "verbose");

    public CliOptions {
        configFiles = List.copyOf(configFiles);
    }

    public static CliOptions parse(String[] args) {
        final var configFiles = new ArrayList<Path>();
        final var parsed = parseArgs(args, configFiles);
        final var configDir = parsed.containsKey("config-dir") ? Path.of(parsed.get("config-dir")) : null;
        return new CliOptions(configFiles, configDir, flag(parsed, "debug"), flag(parsed, "verbose"));
    }

    private static boolean flag(Map<String, String> parsed, String name) {
        final var value = parsed.get(name);
        return value != null && Boolean.parseBoolean(value.trim());
    }

    private static Map<String, String> parseArgs(String[] args, List<Path> configFiles) {
        final var values = new HashMap<String, String>();
        for (var i = 0; i < args.length; i++) {
            final var arg = args[i];
            if (!arg.startsWith("--")) continue;
            final var token = arg.substring(2);
            final var parts = token.split("=", 2);
            final var key = parts[0];
            String value;
            if (parts.length == 2) {
                value = parts[1];
            } else if (FLAGS.contains(key)) {
                value = "true";
            } else if (i + 1 < args.length && !args[i + 1].startsWith("--")) {
                value = args[++i];
            } else {
                continue;
            }
            if ("config-file".equals(key)) {
                if (!value.isBlank()) configFiles.add(Path.of(value.trim()));
            } else {
                values.put(key, value);
            }
        }
        return values;
    }
}
