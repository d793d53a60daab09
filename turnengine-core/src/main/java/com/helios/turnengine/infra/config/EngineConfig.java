package com.helios.turnengine.infra.config;

import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * Runtime settings for a turn engine session.
 *
 * <p><b>Environment Variable Override:</b>
 * Every property can be overridden via environment variables (or system
 * properties of the same name) using the pattern {@code TURN_ENGINE_<PROPERTY>}:
 * <pre>
 * TURN_ENGINE_MAX_TOMBSTONES=500
 * TURN_ENGINE_FALLBACK_MESSAGE=Nothing happens.
 * TURN_ENGINE_RANDOM_SEED=42
 * TURN_ENGINE_DEV_COMMANDS=true
 * TURN_ENGINE_SAVE_DIR=/var/games/saves
 * TURN_ENGINE_AUTOSAVE_TURNS=5
 * </pre>
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * EngineConfig config = EngineConfig.loadDefault();
 *
 * EngineConfig custom = EngineConfig.builder()
 *     .maxTombstones(100)
 *     .devCommandsEnabled(true)
 *     .build();
 * }</pre>
 */
public final class EngineConfig {

    private static final Logger logger = Logger.getLogger(EngineConfig.class.getName());

    // ========================================================================
    // ENVIRONMENT VARIABLE KEYS
    // ========================================================================

    static final String ENV_MAX_TOMBSTONES = "TURN_ENGINE_MAX_TOMBSTONES";
    static final String ENV_FALLBACK_MESSAGE = "TURN_ENGINE_FALLBACK_MESSAGE";
    static final String ENV_RANDOM_SEED = "TURN_ENGINE_RANDOM_SEED";
    static final String ENV_DEV_COMMANDS = "TURN_ENGINE_DEV_COMMANDS";
    static final String ENV_SAVE_DIR = "TURN_ENGINE_SAVE_DIR";
    static final String ENV_AUTOSAVE_TURNS = "TURN_ENGINE_AUTOSAVE_TURNS";

    public static final int DEFAULT_MAX_TOMBSTONES = 10_000;
    public static final String DEFAULT_FALLBACK_MESSAGE = "Nothing happens.";
    public static final int DEFAULT_AUTOSAVE_TURNS = 5;

    // ========================================================================
    // CONFIGURATION FIELDS
    // ========================================================================

    /** Tombstones kept before compaction; 0 keeps every tombstone. */
    private final int maxTombstones;
    private final String fallbackMessage;
    /** Mixed into the world seed; 0 uses the world seed unchanged. */
    private final long randomSeed;
    private final boolean devCommandsEnabled;
    private final Path saveDirectory;
    /** Autosave every N advanced turns; 0 disables autosave. */
    private final int autosaveTurns;

    private EngineConfig(Builder builder) {
        this.maxTombstones = builder.maxTombstones;
        this.fallbackMessage = builder.fallbackMessage;
        this.randomSeed = builder.randomSeed;
        this.devCommandsEnabled = builder.devCommandsEnabled;
        this.saveDirectory = builder.saveDirectory;
        this.autosaveTurns = builder.autosaveTurns;
        validate();
    }

    // ========================================================================
    // FACTORY METHODS
    // ========================================================================

    /**
     * Defaults with environment overrides applied.
     */
    public static EngineConfig loadDefault() {
        return builder().applyEnvironmentOverrides().build();
    }

    /**
     * Defaults without environment overrides, with developer commands on and
     * autosave off.
     */
    public static EngineConfig forTesting() {
        return builder().devCommandsEnabled(true).autosaveTurns(0).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .maxTombstones(maxTombstones)
                .fallbackMessage(fallbackMessage)
                .randomSeed(randomSeed)
                .devCommandsEnabled(devCommandsEnabled)
                .saveDirectory(saveDirectory)
                .autosaveTurns(autosaveTurns);
    }

    private void validate() {
        if (maxTombstones < 0) {
            throw new IllegalArgumentException("maxTombstones must be >= 0, got " + maxTombstones);
        }
        if (fallbackMessage == null || fallbackMessage.isBlank()) {
            throw new IllegalArgumentException("fallbackMessage must not be blank");
        }
        if (saveDirectory == null) {
            throw new IllegalArgumentException("saveDirectory must not be null");
        }
        if (autosaveTurns < 0) {
            throw new IllegalArgumentException("autosaveTurns must be >= 0, got " + autosaveTurns);
        }
    }

    // ========================================================================
    // GETTERS
    // ========================================================================

    public int getMaxTombstones() {
        return maxTombstones;
    }

    public String getFallbackMessage() {
        return fallbackMessage;
    }

    public long getRandomSeed() {
        return randomSeed;
    }

    public boolean isDevCommandsEnabled() {
        return devCommandsEnabled;
    }

    public Path getSaveDirectory() {
        return saveDirectory;
    }

    public int getAutosaveTurns() {
        return autosaveTurns;
    }

    @Override
    public String toString() {
        return "EngineConfig{maxTombstones=" + maxTombstones
                + ", fallbackMessage='" + fallbackMessage + '\''
                + ", randomSeed=" + randomSeed
                + ", devCommandsEnabled=" + devCommandsEnabled
                + ", saveDirectory=" + saveDirectory
                + ", autosaveTurns=" + autosaveTurns + '}';
    }

    // ========================================================================
    // BUILDER
    // ========================================================================

    public static final class Builder {
        private int maxTombstones = DEFAULT_MAX_TOMBSTONES;
        private String fallbackMessage = DEFAULT_FALLBACK_MESSAGE;
        private long randomSeed = 0L;
        private boolean devCommandsEnabled = false;
        private Path saveDirectory = Path.of("saves");
        private int autosaveTurns = DEFAULT_AUTOSAVE_TURNS;

        private Builder() {
        }

        public Builder maxTombstones(int maxTombstones) {
            this.maxTombstones = maxTombstones;
            return this;
        }

        public Builder fallbackMessage(String fallbackMessage) {
            this.fallbackMessage = fallbackMessage;
            return this;
        }

        public Builder randomSeed(long randomSeed) {
            this.randomSeed = randomSeed;
            return this;
        }

        public Builder devCommandsEnabled(boolean devCommandsEnabled) {
            this.devCommandsEnabled = devCommandsEnabled;
            return this;
        }

        public Builder saveDirectory(Path saveDirectory) {
            this.saveDirectory = saveDirectory;
            return this;
        }

        public Builder autosaveTurns(int autosaveTurns) {
            this.autosaveTurns = autosaveTurns;
            return this;
        }

        /**
         * Applies {@code TURN_ENGINE_*} values found in the environment or in
         * system properties. Unparseable numbers are logged and ignored.
         */
        public Builder applyEnvironmentOverrides() {
            String value = getEnvOrProperty(ENV_MAX_TOMBSTONES);
            if (value != null) {
                try {
                    maxTombstones = Integer.parseInt(value.trim());
                } catch (NumberFormatException e) {
                    logger.warning("Invalid " + ENV_MAX_TOMBSTONES + ": '" + value + "', using " + maxTombstones);
                }
            }
            value = getEnvOrProperty(ENV_FALLBACK_MESSAGE);
            if (value != null && !value.isBlank()) {
                fallbackMessage = value;
            }
            value = getEnvOrProperty(ENV_RANDOM_SEED);
            if (value != null) {
                try {
                    randomSeed = Long.parseLong(value.trim());
                } catch (NumberFormatException e) {
                    logger.warning("Invalid " + ENV_RANDOM_SEED + ": '" + value + "', using " + randomSeed);
                }
            }
            value = getEnvOrProperty(ENV_DEV_COMMANDS);
            if (value != null) {
                devCommandsEnabled = Boolean.parseBoolean(value.trim());
            }
            value = getEnvOrProperty(ENV_SAVE_DIR);
            if (value != null && !value.isBlank()) {
                saveDirectory = Path.of(value.trim());
            }
            value = getEnvOrProperty(ENV_AUTOSAVE_TURNS);
            if (value != null) {
                try {
                    autosaveTurns = Integer.parseInt(value.trim());
                } catch (NumberFormatException e) {
                    logger.warning("Invalid " + ENV_AUTOSAVE_TURNS + ": '" + value + "', using " + autosaveTurns);
                }
            }
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(this);
        }
    }

    /**
     * Get value from environment variable, falling back to system property.
     */
    private static String getEnvOrProperty(String key) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            value = System.getProperty(key);
        }
        return value;
    }
}
