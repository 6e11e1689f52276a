package com.barlang.runner;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.barlang.core.model.BacktestConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Runner configuration, read from YAML.
 *
 * <p>Lookup order: an explicit file, then ~/.barlang/runner.yaml, then
 * barlang-runner.yaml on the classpath, then built-in defaults.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class RunnerConfig {

    private static final Logger log = LoggerFactory.getLogger(RunnerConfig.class);

    static final Path USER_CONFIG_PATH = Path.of(
        System.getProperty("user.home"), ".barlang", "runner.yaml"
    );
    static final String CLASSPATH_CONFIG = "/barlang-runner.yaml";

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private BacktestConfig backtest = BacktestConfig.defaults();
    private String dataFile;
    private String dateColumn = "date";
    private int sampleBars = 250;
    private long sampleSeed = 42;

    public RunnerConfig() {
    }

    // ==================== Properties ====================

    public BacktestConfig getBacktest() {
        return backtest;
    }

    public void setBacktest(BacktestConfig backtest) {
        this.backtest = backtest != null ? backtest : BacktestConfig.defaults();
    }

    public String getDataFile() {
        return dataFile;
    }

    public void setDataFile(String dataFile) {
        this.dataFile = dataFile;
    }

    public String getDateColumn() {
        return dateColumn;
    }

    public void setDateColumn(String dateColumn) {
        this.dateColumn = dateColumn != null && !dateColumn.isBlank() ? dateColumn : "date";
    }

    public int getSampleBars() {
        return sampleBars;
    }

    public void setSampleBars(int sampleBars) {
        this.sampleBars = sampleBars;
    }

    public long getSampleSeed() {
        return sampleSeed;
    }

    public void setSampleSeed(long sampleSeed) {
        this.sampleSeed = sampleSeed;
    }

    // ==================== Loading ====================

    /**
     * Load configuration. An explicit path must exist and parse; the implicit
     * locations fall through to defaults when absent.
     */
    public static RunnerConfig load(Path explicitPath) throws IOException {
        if (explicitPath != null) {
            log.info("Loading runner config from {}", explicitPath);
            return YAML.readValue(explicitPath.toFile(), RunnerConfig.class);
        }

        if (Files.exists(USER_CONFIG_PATH)) {
            log.info("Loading runner config from {}", USER_CONFIG_PATH);
            return YAML.readValue(USER_CONFIG_PATH.toFile(), RunnerConfig.class);
        }

        try (InputStream is = RunnerConfig.class.getResourceAsStream(CLASSPATH_CONFIG)) {
            if (is != null) {
                log.debug("Loading runner config from classpath {}", CLASSPATH_CONFIG);
                return YAML.readValue(is, RunnerConfig.class);
            }
        }

        log.debug("No runner config found, using defaults");
        return new RunnerConfig();
    }

    /**
     * Parse configuration from YAML text.
     */
    public static RunnerConfig parse(String yaml) throws IOException {
        return YAML.readValue(yaml, RunnerConfig.class);
    }
}
