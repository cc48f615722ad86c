package im.arun.nexusoutline.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("ConfigLoader Tests")
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("should load the bundled defaults from the classpath")
    void shouldLoadClasspathDefaults() {
        OutlineConfig config = new ConfigLoader().load(null);

        assertThat(config.getIndentWidth()).isEqualTo(2);
        assertThat(config.isUnwrapOuterFence()).isTrue();
        assertThat(config.isGroupVariants()).isTrue();
        assertThat(config.isIncludeAuxiliaryBlocks()).isFalse();
    }

    @Test
    @DisplayName("should prefer an explicit config file and ignore unknown keys")
    void shouldLoadExplicitFile() throws IOException {
        Path file = tempDir.resolve("custom.yaml");
        Files.writeString(file, "indentWidth: 4\ngroupVariants: false\nsomethingElse: 1\n", StandardCharsets.UTF_8);

        OutlineConfig config = new ConfigLoader(file.toString()).load(null);

        assertThat(config.getIndentWidth()).isEqualTo(4);
        assertThat(config.isGroupVariants()).isFalse();
        assertThat(config.isPrettyPrint()).isTrue();
    }

    @Test
    @DisplayName("should fall back to the classpath when the config file is missing")
    void shouldFallBack_whenFileMissing() {
        OutlineConfig config = new ConfigLoader(tempDir.resolve("missing.yaml").toString()).load(null);

        assertThat(config.getIndentWidth()).isEqualTo(2);
    }

    @Test
    @DisplayName("should apply snake_case and camelCase overrides")
    void shouldApplyOverrides() {
        Map<String, Object> overrides = new HashMap<>();
        overrides.put("indent_width", "3");
        overrides.put("includeAuxiliaryBlocks", "yes");
        overrides.put("pretty_print", false);

        OutlineConfig config = new ConfigLoader().load(overrides);

        assertThat(config.getIndentWidth()).isEqualTo(3);
        assertThat(config.isIncludeAuxiliaryBlocks()).isTrue();
        assertThat(config.isPrettyPrint()).isFalse();
    }

    @Test
    @DisplayName("should ignore an indent width below one")
    void shouldIgnoreInvalidIndentWidth() {
        Map<String, Object> overrides = new HashMap<>();
        overrides.put("indentWidth", 0);
        overrides.put("unknown", "x");

        OutlineConfig config = new ConfigLoader().load(overrides);

        assertThat(config.getIndentWidth()).isEqualTo(2);
    }

    @Test
    @DisplayName("should hand out independent copies of the defaults")
    void shouldReturnIndependentCopies() {
        ConfigLoader loader = new ConfigLoader();
        OutlineConfig first = loader.load(null);
        first.setIndentWidth(8);

        assertThat(loader.load(null).getIndentWidth()).isEqualTo(2);
    }
}
