package com.github.collomatique;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Properties;

import com.github.collomatique.ilp.repr.ReprKind;

import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads {@code collomatique.cfg} from the working directory, falling back to the copy on the
 * classpath.
 */
@Slf4j
public class ConfigReader {

    public static final String CONFIG_FILE = "collomatique.cfg";

    public static Config readConfig() {
        var file = Path.of(CONFIG_FILE);
        try {
            if (Files.isRegularFile(file)) {
                log.debug("reading configuration from {}", file.toAbsolutePath());
                try (var in = Files.newInputStream(file)) {
                    return readConfig(in);
                }
            }
            try (var in = ConfigReader.class.getResourceAsStream("/" + CONFIG_FILE)) {
                if (in == null) {
                    log.debug("no {} found, using defaults", CONFIG_FILE);
                    return readConfig(new Properties());
                }
                return readConfig(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    static Config readConfig(InputStream in) throws IOException {
        Properties properties = new Properties();
        properties.load(in);
        return readConfig(properties);
    }

    static Config readConfig(Properties properties) {
        var config = new Config();
        Arrays.stream(properties.getProperty("lookupPath", "").split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .forEach(config.lookupPath::add);
        config.reprKind = ReprKind.parse(properties.getProperty("repr", "dense"));
        config.initializer = properties.getProperty("initializer", "null").trim();
        config.randomProbability = Double.parseDouble(properties.getProperty("randomProbability", "0.5"));
        config.maxSteps = Long.parseLong(properties.getProperty("maxSteps", String.valueOf(Long.MAX_VALUE)));
        config.timeLimit = Optional.ofNullable(properties.getProperty("timeLimitSeconds"))
                .map(s -> Duration.ofSeconds(Long.parseLong(s.trim())));
        config.threads = Integer.parseInt(properties.getProperty("threads", "1"));
        config.annealingIterations = Integer.parseInt(properties.getProperty("annealingIterations", "0"));
        config.seed = Long.parseLong(properties.getProperty("seed", "0"));
        return config;
    }

    @Getter
    @Accessors(fluent = true)
    @ToString
    public static class Config {
        private final List<String> lookupPath = new ArrayList<>();
        private ReprKind reprKind;
        private String initializer;
        private double randomProbability;
        private long maxSteps;
        private Optional<Duration> timeLimit;
        private int threads;
        private int annealingIterations;
        private long seed;

        public void applyConfig(ConfigTarget ct) {
            ct.setLookupPath(lookupPath);
            ct.setReprKind(reprKind);
            ct.setInitializer(initializer, randomProbability);
            ct.setSearchLimits(maxSteps, timeLimit);
            ct.setThreads(threads);
            ct.setAnnealingIterations(annealingIterations);
            ct.setSeed(seed);
        }
    }

    /** Receives the settings it cares about. */
    public interface ConfigTarget {
        default void setLookupPath(List<String> lookupPath) {}

        default void setReprKind(ReprKind reprKind) {}

        default void setInitializer(String initializer, double randomProbability) {}

        default void setSearchLimits(long maxSteps, Optional<Duration> timeLimit) {}

        default void setThreads(int threads) {}

        default void setAnnealingIterations(int annealingIterations) {}

        default void setSeed(long seed) {}
    }
}
