package net.shaderprobe.shader.config;

import net.shaderprobe.shader.codegen.NormalizeMode;
import net.shaderprobe.shader.parser.StatementJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Naming conventions of the host shader environment and generator limits,
 * persisted in Java Properties format.
 */
public class ShaderDebugConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(ShaderDebugConfig.class);

    public static final String RESOURCE_NAME = "/shaderprobe.properties";

    public static final String KEY_ENTRY_FUNCTION = "entry.function";
    public static final String KEY_COLOR_OUTPUT = "output.color";
    public static final String KEY_COORD_INPUT = "input.coord";
    public static final String KEY_RESOLUTION_UNIFORM = "uniform.resolution";
    public static final String KEY_DEFAULT_SAMPLER = "sampler.default";
    public static final String KEY_STATEMENT_SCAN_LIMIT = "statement.scan.limit";
    public static final String KEY_NORMALIZE_MODE = "visualization.normalize";

    private static final String DEFAULTS_ENTRY = "mainImage";
    private static final String DEFAULTS_COLOR = "fragColor";
    private static final String DEFAULTS_COORD = "fragCoord";
    private static final String DEFAULTS_RESOLUTION = "iResolution";
    private static final String DEFAULTS_SAMPLER = "iChannel0";

    private static final ShaderDebugConfig DEFAULTS = builder().build();

    private final String entryFunction;
    private final String colorOutput;
    private final String coordInput;
    private final String resolutionUniform;
    private final String defaultSampler;
    private final int statementScanLimit;
    private final NormalizeMode normalizeMode;

    private ShaderDebugConfig(Builder builder) {
        this.entryFunction = builder.entryFunction;
        this.colorOutput = builder.colorOutput;
        this.coordInput = builder.coordInput;
        this.resolutionUniform = builder.resolutionUniform;
        this.defaultSampler = builder.defaultSampler;
        this.statementScanLimit = builder.statementScanLimit;
        this.normalizeMode = builder.normalizeMode;
    }

    /**
     * Shadertoy conventions: mainImage, fragColor, fragCoord, iResolution, iChannel0.
     */
    public static ShaderDebugConfig defaults() {
        return DEFAULTS;
    }

    /**
     * Loads the configuration bundled on the classpath.
     * Returns defaults if the resource is missing or fails to load.
     */
    public static ShaderDebugConfig load() {
        try (InputStream input = ShaderDebugConfig.class.getResourceAsStream(RESOURCE_NAME)) {
            if (input == null) {
                LOGGER.debug("No {} on classpath, using defaults", RESOURCE_NAME);
                return DEFAULTS;
            }
            Properties properties = new Properties();
            properties.load(input);
            return fromProperties(properties);

        } catch (IOException e) {
            LOGGER.error("Failed to load configuration resource: {}", RESOURCE_NAME, e);
            return DEFAULTS;
        }
    }

    /**
     * Loads configuration from a properties file.
     * Returns defaults if the file doesn't exist or fails to load.
     */
    public static ShaderDebugConfig load(Path configFile) {
        if (!Files.exists(configFile)) {
            LOGGER.debug("No configuration file at {}, using defaults", configFile);
            return DEFAULTS;
        }

        Properties properties = new Properties();
        try (InputStream input = Files.newInputStream(configFile)) {
            properties.load(input);
            LOGGER.info("Loaded {} configuration entries from: {}", properties.size(), configFile);
            return fromProperties(properties);

        } catch (IOException e) {
            LOGGER.error("Failed to load configuration from: {}", configFile, e);
            return DEFAULTS;
        }
    }

    /**
     * Builds a configuration from properties. Missing keys keep their defaults.
     */
    public static ShaderDebugConfig fromProperties(Properties properties) {
        Builder builder = builder()
            .entryFunction(properties.getProperty(KEY_ENTRY_FUNCTION, DEFAULTS_ENTRY))
            .colorOutput(properties.getProperty(KEY_COLOR_OUTPUT, DEFAULTS_COLOR))
            .coordInput(properties.getProperty(KEY_COORD_INPUT, DEFAULTS_COORD))
            .resolutionUniform(properties.getProperty(KEY_RESOLUTION_UNIFORM, DEFAULTS_RESOLUTION))
            .defaultSampler(properties.getProperty(KEY_DEFAULT_SAMPLER, DEFAULTS_SAMPLER));

        String scanLimit = properties.getProperty(KEY_STATEMENT_SCAN_LIMIT);
        if (scanLimit != null) {
            try {
                builder.statementScanLimit(Integer.parseInt(scanLimit.trim()));
            } catch (IllegalArgumentException e) {
                LOGGER.warn("Invalid {} '{}', using {}", KEY_STATEMENT_SCAN_LIMIT, scanLimit,
                    StatementJoiner.DEFAULT_SCAN_LIMIT);
            }
        }

        String normalize = properties.getProperty(KEY_NORMALIZE_MODE);
        if (normalize != null) {
            try {
                builder.normalizeMode(NormalizeMode.fromString(normalize));
            } catch (IllegalArgumentException e) {
                LOGGER.warn("Invalid {} '{}', using off", KEY_NORMALIZE_MODE, normalize);
            }
        }

        return builder.build();
    }

    /**
     * Saves this configuration to a properties file, creating parent directories.
     */
    public void save(Path configFile) {
        Properties properties = toProperties();

        try {
            Path parent = configFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }

            try (OutputStream output = Files.newOutputStream(configFile)) {
                properties.store(output, "ShaderProbe configuration");
                LOGGER.info("Saved {} configuration entries to: {}", properties.size(), configFile);
            }

        } catch (IOException e) {
            LOGGER.error("Failed to save configuration to: {}", configFile, e);
        }
    }

    public Properties toProperties() {
        Properties properties = new Properties();
        properties.setProperty(KEY_ENTRY_FUNCTION, entryFunction);
        properties.setProperty(KEY_COLOR_OUTPUT, colorOutput);
        properties.setProperty(KEY_COORD_INPUT, coordInput);
        properties.setProperty(KEY_RESOLUTION_UNIFORM, resolutionUniform);
        properties.setProperty(KEY_DEFAULT_SAMPLER, defaultSampler);
        properties.setProperty(KEY_STATEMENT_SCAN_LIMIT, Integer.toString(statementScanLimit));
        properties.setProperty(KEY_NORMALIZE_MODE, normalizeMode.getName());
        return properties;
    }

    /**
     * Name of the entry function, mainImage for Shadertoy.
     */
    public String getEntryFunction() {
        return entryFunction;
    }

    public String getColorOutput() {
        return colorOutput;
    }

    public String getCoordInput() {
        return coordInput;
    }

    public String getResolutionUniform() {
        return resolutionUniform;
    }

    public String getDefaultSampler() {
        return defaultSampler;
    }

    /**
     * How many lines the statement joiner looks backward and forward.
     */
    public int getStatementScanLimit() {
        return statementScanLimit;
    }

    /**
     * Normalization used when a request doesn't specify one.
     */
    public NormalizeMode getNormalizeMode() {
        return normalizeMode;
    }

    /**
     * Header of the synthesized entry function.
     */
    public String entryHeader() {
        return String.format("void %s(out vec4 %s, in vec2 %s) {", entryFunction, colorOutput, coordInput);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return String.format("ShaderDebugConfig{entry=%s, output=%s, coord=%s, resolution=%s, sampler=%s, scanLimit=%d, normalize=%s}",
            entryFunction, colorOutput, coordInput, resolutionUniform, defaultSampler, statementScanLimit,
            normalizeMode.getName());
    }

    /**
     * Builder for configurations assembled in code.
     */
    public static class Builder {
        private String entryFunction = DEFAULTS_ENTRY;
        private String colorOutput = DEFAULTS_COLOR;
        private String coordInput = DEFAULTS_COORD;
        private String resolutionUniform = DEFAULTS_RESOLUTION;
        private String defaultSampler = DEFAULTS_SAMPLER;
        private int statementScanLimit = StatementJoiner.DEFAULT_SCAN_LIMIT;
        private NormalizeMode normalizeMode = NormalizeMode.OFF;

        public Builder entryFunction(String entryFunction) {
            this.entryFunction = requireIdentifier(entryFunction, KEY_ENTRY_FUNCTION);
            return this;
        }

        public Builder colorOutput(String colorOutput) {
            this.colorOutput = requireIdentifier(colorOutput, KEY_COLOR_OUTPUT);
            return this;
        }

        public Builder coordInput(String coordInput) {
            this.coordInput = requireIdentifier(coordInput, KEY_COORD_INPUT);
            return this;
        }

        public Builder resolutionUniform(String resolutionUniform) {
            this.resolutionUniform = requireIdentifier(resolutionUniform, KEY_RESOLUTION_UNIFORM);
            return this;
        }

        public Builder defaultSampler(String defaultSampler) {
            this.defaultSampler = requireIdentifier(defaultSampler, KEY_DEFAULT_SAMPLER);
            return this;
        }

        public Builder statementScanLimit(int statementScanLimit) {
            if (statementScanLimit < 0) {
                throw new IllegalArgumentException("Statement scan limit cannot be negative: " + statementScanLimit);
            }
            this.statementScanLimit = statementScanLimit;
            return this;
        }

        public Builder normalizeMode(NormalizeMode normalizeMode) {
            this.normalizeMode = normalizeMode != null ? normalizeMode : NormalizeMode.OFF;
            return this;
        }

        public ShaderDebugConfig build() {
            return new ShaderDebugConfig(this);
        }

        private static String requireIdentifier(String value, String key) {
            if (value == null || !value.trim().matches("[A-Za-z_]\\w*")) {
                throw new IllegalArgumentException("Invalid identifier for " + key + ": " + value);
            }
            return value.trim();
        }
    }
}
