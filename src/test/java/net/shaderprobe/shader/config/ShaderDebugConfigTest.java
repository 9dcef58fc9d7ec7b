package net.shaderprobe.shader.config;

import net.shaderprobe.shader.codegen.NormalizeMode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class ShaderDebugConfigTest {

    @Test
    public void testDefaults() {
        ShaderDebugConfig config = ShaderDebugConfig.defaults();

        assertEquals("mainImage", config.getEntryFunction());
        assertEquals("fragColor", config.getColorOutput());
        assertEquals("fragCoord", config.getCoordInput());
        assertEquals("iResolution", config.getResolutionUniform());
        assertEquals("iChannel0", config.getDefaultSampler());
        assertEquals(10, config.getStatementScanLimit());
        assertEquals(NormalizeMode.OFF, config.getNormalizeMode());
        assertEquals("void mainImage(out vec4 fragColor, in vec2 fragCoord) {", config.entryHeader());
    }

    @Test
    public void testBundledResourceMatchesDefaults() {
        ShaderDebugConfig config = ShaderDebugConfig.load();

        assertEquals(ShaderDebugConfig.defaults().toProperties(), config.toProperties());
    }

    @Test
    public void testPropertiesOverrideNames() {
        Properties properties = new Properties();
        properties.setProperty(ShaderDebugConfig.KEY_ENTRY_FUNCTION, "main");
        properties.setProperty(ShaderDebugConfig.KEY_COLOR_OUTPUT, "outColor");
        properties.setProperty(ShaderDebugConfig.KEY_NORMALIZE_MODE, "Soft");

        ShaderDebugConfig config = ShaderDebugConfig.fromProperties(properties);

        assertEquals("main", config.getEntryFunction());
        assertEquals("outColor", config.getColorOutput());
        assertEquals("fragCoord", config.getCoordInput());
        assertEquals(NormalizeMode.SOFT, config.getNormalizeMode());
        assertEquals("void main(out vec4 outColor, in vec2 fragCoord) {", config.entryHeader());
    }

    @Test
    public void testInvalidValuesFallBack() {
        Properties properties = new Properties();
        properties.setProperty(ShaderDebugConfig.KEY_STATEMENT_SCAN_LIMIT, "many");
        properties.setProperty(ShaderDebugConfig.KEY_NORMALIZE_MODE, "loud");

        ShaderDebugConfig config = ShaderDebugConfig.fromProperties(properties);

        assertEquals(10, config.getStatementScanLimit());
        assertEquals(NormalizeMode.OFF, config.getNormalizeMode());
    }

    @Test
    public void testBuilderRejectsNonIdentifiers() {
        assertThrows(IllegalArgumentException.class, () -> ShaderDebugConfig.builder().entryFunction("main image"));
        assertThrows(IllegalArgumentException.class, () -> ShaderDebugConfig.builder().colorOutput(null));
        assertThrows(IllegalArgumentException.class, () -> ShaderDebugConfig.builder().statementScanLimit(-2));
    }

    @Test
    public void testSaveAndLoad(@TempDir Path directory) {
        Path file = directory.resolve("nested").resolve("shaderprobe.properties");
        ShaderDebugConfig config = ShaderDebugConfig.builder()
            .entryFunction("main")
            .statementScanLimit(4)
            .normalizeMode(NormalizeMode.ABS)
            .build();

        config.save(file);
        ShaderDebugConfig loaded = ShaderDebugConfig.load(file);

        assertEquals("main", loaded.getEntryFunction());
        assertEquals(4, loaded.getStatementScanLimit());
        assertEquals(NormalizeMode.ABS, loaded.getNormalizeMode());
    }

    @Test
    public void testMissingFileGivesDefaults() {
        assertSame(ShaderDebugConfig.defaults(), ShaderDebugConfig.load(Path.of("does-not-exist.properties")));
    }

    @Test
    public void testNormalizeModeNames() {
        assertEquals(NormalizeMode.ABS, NormalizeMode.fromString(" ABS "));
        assertEquals(NormalizeMode.OFF, NormalizeMode.fromString(""));
        assertEquals("soft", NormalizeMode.SOFT.getName());
        assertThrows(IllegalArgumentException.class, () -> NormalizeMode.fromString("clamp"));
    }
}
