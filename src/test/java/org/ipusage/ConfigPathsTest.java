package org.ipusage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigPathsTest {
    @TempDir
    Path tempDir;

    @Test
    void usesFirstExistingSearchPath() throws Exception {
        final var missing = tempDir.resolve("missing.conf");
        final var second = Files.writeString(tempDir.resolve("second.conf"), "");
        final var third = Files.writeString(tempDir.resolve("third.conf"), "");

        final var files = new ConfigPaths(List.of(missing, second, third)).resolve(List.of(), null);

        assertThat(files).containsExactly(second);
    }

    @Test
    void explicitFilesReplaceSearchPaths() throws Exception {
        final var searched = Files.writeString(tempDir.resolve("searched.conf"), "");
        final var explicit = Files.writeString(tempDir.resolve("explicit.conf"), "");

        final var files = new ConfigPaths(List.of(searched)).resolve(List.of(explicit), null);

        assertThat(files).containsExactly(explicit);
    }

    @Test
    void appendsSortedConfigDirEntries() throws Exception {
        final var dir = Files.createDirectory(tempDir.resolve("conf.d"));
        final var b = Files.writeString(dir.resolve("20-quark.conf"), "");
        final var a = Files.writeString(dir.resolve("10-db.conf"), "");
        Files.writeString(dir.resolve("README"), "");
        final var main = Files.writeString(tempDir.resolve("neutron.conf"), "");

        final var files = new ConfigPaths(List.of()).resolve(List.of(main), dir);

        assertThat(files).containsExactly(main, a, b);
    }

    @Test
    void returnsNothingWhenNoSearchPathExists() {
        final var paths = new ConfigPaths(List.of(tempDir.resolve("a.conf"), tempDir.resolve("b.conf")));

        assertThat(paths.resolve(List.of(), null)).isEmpty();
    }

    @Test
    void missingExplicitFileIsAnError() {
        final var paths = new ConfigPaths(List.of());

        assertThatThrownBy(() -> paths.resolve(List.of(tempDir.resolve("nope.conf")), null))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("nope.conf");
    }
}
