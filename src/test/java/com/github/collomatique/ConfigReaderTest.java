package com.github.collomatique;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Properties;

import org.junit.jupiter.api.Test;

import com.github.collomatique.ilp.repr.ReprKind;

public class ConfigReaderTest {

    static class RecordingTarget implements ConfigReader.ConfigTarget {
        final List<String> calls = new ArrayList<>();

        @Override
        public void setLookupPath(List<String> lookupPath) {
            calls.add("lookupPath " + lookupPath);
        }

        @Override
        public void setReprKind(ReprKind reprKind) {
            calls.add("repr " + reprKind);
        }

        @Override
        public void setSearchLimits(long maxSteps, Optional<Duration> timeLimit) {
            calls.add("limits " + maxSteps + " " + timeLimit.map(Duration::toSeconds).orElse(-1L));
        }

        @Override
        public void setThreads(int threads) {
            calls.add("threads " + threads);
        }
    }

    @Test
    public void testDefaults() {
        var config = ConfigReader.readConfig(new Properties());
        assertEquals(List.of(), config.lookupPath());
        assertEquals(ReprKind.DENSE, config.reprKind());
        assertEquals("null", config.initializer());
        assertEquals(Long.MAX_VALUE, config.maxSteps());
        assertEquals(Optional.empty(), config.timeLimit());
        assertEquals(1, config.threads());
        assertEquals(0, config.annealingIterations());
    }

    @Test
    public void testReadsProperties() throws IOException {
        var text = """
                # comment
                lookupPath = a, b ,,c
                repr = Sparse
                initializer = random
                randomProbability = 0.25
                maxSteps = 1000
                timeLimitSeconds = 30
                threads = 4
                annealingIterations = 50
                seed = 7
                """;
        var config = ConfigReader.readConfig(new ByteArrayInputStream(text.getBytes(StandardCharsets.ISO_8859_1)));
        assertEquals(List.of("a", "b", "c"), config.lookupPath());
        assertEquals(ReprKind.SPARSE, config.reprKind());
        assertEquals("random", config.initializer());
        assertEquals(0.25, config.randomProbability());
        assertEquals(1000, config.maxSteps());
        assertEquals(Optional.of(Duration.ofSeconds(30)), config.timeLimit());
        assertEquals(4, config.threads());
        assertEquals(50, config.annealingIterations());
        assertEquals(7, config.seed());
    }

    @Test
    public void testApplyConfigOnlyReachesOverriddenSetters() {
        var properties = new Properties();
        properties.setProperty("lookupPath", "scripts");
        properties.setProperty("maxSteps", "10");
        var target = new RecordingTarget();
        ConfigReader.readConfig(properties).applyConfig(target);
        assertEquals(List.of("lookupPath [scripts]", "repr DENSE", "limits 10 -1", "threads 1"), target.calls);
    }

    @Test
    public void testBundledConfig() {
        var config = ConfigReader.readConfig();
        assertEquals(ReprKind.DENSE, config.reprKind());
        assertEquals(1, config.threads());
    }

    @Test
    public void testInvalidValues() {
        var properties = new Properties();
        properties.setProperty("repr", "bitset");
        assertThrows(IllegalArgumentException.class, () -> ConfigReader.readConfig(properties));
        properties.setProperty("repr", "dense");
        properties.setProperty("threads", "many");
        assertThrows(NumberFormatException.class, () -> ConfigReader.readConfig(properties));
    }
}
