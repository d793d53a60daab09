package com.helios.turnengine.infra.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EngineConfigTest {

    @AfterEach
    void clearOverrides() {
        System.clearProperty(EngineConfig.ENV_MAX_TOMBSTONES);
        System.clearProperty(EngineConfig.ENV_FALLBACK_MESSAGE);
        System.clearProperty(EngineConfig.ENV_RANDOM_SEED);
        System.clearProperty(EngineConfig.ENV_DEV_COMMANDS);
        System.clearProperty(EngineConfig.ENV_SAVE_DIR);
        System.clearProperty(EngineConfig.ENV_AUTOSAVE_TURNS);
    }

    @Test
    @DisplayName("Defaults keep developer commands off")
    void shouldUseDefaults() {
        EngineConfig config = EngineConfig.builder().build();

        assertThat(config.getMaxTombstones()).isEqualTo(EngineConfig.DEFAULT_MAX_TOMBSTONES);
        assertThat(config.getFallbackMessage()).isEqualTo("Nothing happens.");
        assertThat(config.getRandomSeed()).isZero();
        assertThat(config.isDevCommandsEnabled()).isFalse();
        assertThat(config.getSaveDirectory()).isEqualTo(Path.of("saves"));
        assertThat(config.getAutosaveTurns()).isEqualTo(5);
    }

    @Test
    void testingConfigEnablesDeveloperCommands() {
        assertThat(EngineConfig.forTesting().isDevCommandsEnabled()).isTrue();
        assertThat(EngineConfig.forTesting().getAutosaveTurns()).isZero();
    }

    @Test
    @DisplayName("System properties override defaults")
    void shouldApplyOverrides() {
        System.setProperty(EngineConfig.ENV_MAX_TOMBSTONES, "25");
        System.setProperty(EngineConfig.ENV_FALLBACK_MESSAGE, "You can't do that.");
        System.setProperty(EngineConfig.ENV_RANDOM_SEED, "7");
        System.setProperty(EngineConfig.ENV_DEV_COMMANDS, "true");
        System.setProperty(EngineConfig.ENV_SAVE_DIR, "/tmp/slots");
        System.setProperty(EngineConfig.ENV_AUTOSAVE_TURNS, "10");

        EngineConfig config = EngineConfig.loadDefault();

        assertThat(config.getMaxTombstones()).isEqualTo(25);
        assertThat(config.getFallbackMessage()).isEqualTo("You can't do that.");
        assertThat(config.getRandomSeed()).isEqualTo(7L);
        assertThat(config.isDevCommandsEnabled()).isTrue();
        assertThat(config.getSaveDirectory()).isEqualTo(Path.of("/tmp/slots"));
        assertThat(config.getAutosaveTurns()).isEqualTo(10);
    }

    @Test
    @DisplayName("Unparseable numbers are ignored")
    void shouldIgnoreBadNumbers() {
        System.setProperty(EngineConfig.ENV_MAX_TOMBSTONES, "lots");
        System.setProperty(EngineConfig.ENV_RANDOM_SEED, "0x2a");

        EngineConfig config = EngineConfig.loadDefault();

        assertThat(config.getMaxTombstones()).isEqualTo(EngineConfig.DEFAULT_MAX_TOMBSTONES);
        assertThat(config.getRandomSeed()).isZero();
    }

    @Test
    void shouldRejectInvalidValues() {
        assertThatThrownBy(() -> EngineConfig.builder().maxTombstones(-1).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxTombstones");
        assertThatThrownBy(() -> EngineConfig.builder().fallbackMessage("  ").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("fallbackMessage");
        assertThatThrownBy(() -> EngineConfig.builder().saveDirectory(null).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> EngineConfig.builder().autosaveTurns(-5).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("autosaveTurns");
    }

    @Test
    void toBuilderCopiesEverySetting() {
        EngineConfig original = EngineConfig.builder()
                .maxTombstones(3)
                .fallbackMessage("Hm.")
                .randomSeed(99)
                .devCommandsEnabled(true)
                .saveDirectory(Path.of("elsewhere"))
                .autosaveTurns(2)
                .build();

        assertThat(original.toBuilder().build()).hasToString(original.toString());
    }
}
