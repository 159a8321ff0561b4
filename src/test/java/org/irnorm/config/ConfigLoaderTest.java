package org.irnorm.config;

import com.typesafe.config.Config;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void testLoad_FileOverridesReferenceConf() throws IOException {
        Path file = tempDir.resolve("irnorm.conf");
        Files.writeString(file, "normalizer.reserved-word-suffix = \"_kw\"\n", StandardCharsets.UTF_8);

        Config config = ConfigLoader.load(file.toFile());

        assertThat(config.getString("normalizer.reserved-word-suffix")).isEqualTo("_kw");
        assertThat(config.getBoolean("normalizer.fail-on-unbound-reference")).isFalse();
    }

    @Test
    void testLoad_MissingFileFallsBackToDefaults() {
        Config config = ConfigLoader.load(new File(tempDir.toFile(), "absent.conf"));

        assertThat(config.getString("normalizer.reserved-word-suffix")).isEqualTo("_");
        assertThat(config.getStringList("normalizer.passes")).hasSize(18);
    }
}
