package com.chessvision;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Tunables for the detection pipeline and the engine client.
 * Loaded from JSON with Gson; keys missing from the file keep the defaults below.
 */
public class DetectorConfig {

    private static final Logger log = LoggerFactory.getLogger(DetectorConfig.class);

    public static final String DEFAULT_RESOURCE = "/chessvision.json";

    private int cameraIndex = 0;
    private int canonicalSize = 512;
    private int blurKernel = 3;
    private double brightnessOffset = 0;

    // Binarization thresholds for the baseline attempt and the two sweep directions
    private double baselineThreshold = 20;
    private double lowGainThreshold = 40;
    private double highGainThreshold = 70;
    private double gainStep = 0.1;

    private double noiseFloor = 20.0;
    private long sweepTimeoutMillis = 10_000;

    private int engineDepth = 10;
    private String engineUrl = "https://stockfish.online/api/s/v2.php";
    private String sessionDir = "session";

    public static DetectorConfig defaults() {
        return new DetectorConfig();
    }

    /**
     * Reads {@value #DEFAULT_RESOURCE} from the classpath, falling back to defaults when absent.
     */
    public static DetectorConfig load() {
        try (InputStream is = DetectorConfig.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (is == null) {
                log.info("No {} on classpath, using defaults", DEFAULT_RESOURCE);
                return defaults();
            }
            return parse(new InputStreamReader(is, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new IllegalStateException("Could not read " + DEFAULT_RESOURCE, e);
        }
    }

    public static DetectorConfig load(Path file) {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            log.info("Loading detector config from {}", file);
            return parse(reader);
        } catch (IOException e) {
            throw new IllegalStateException("Could not read config file " + file, e);
        }
    }

    static DetectorConfig parse(Reader reader) {
        DetectorConfig config;
        try {
            config = new Gson().fromJson(reader, DetectorConfig.class);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Malformed detector config: " + e.getMessage(), e);
        }
        if (config == null) {
            config = defaults();
        }
        config.validate();
        return config;
    }

    void validate() {
        require(cameraIndex >= 0, "cameraIndex");
        require(canonicalSize >= 64 && canonicalSize % 8 == 0, "canonicalSize");
        require(blurKernel > 0 && blurKernel % 2 == 1, "blurKernel");
        require(baselineThreshold >= 0 && baselineThreshold < 255, "baselineThreshold");
        require(lowGainThreshold >= 0 && lowGainThreshold < 255, "lowGainThreshold");
        require(highGainThreshold >= 0 && highGainThreshold < 255, "highGainThreshold");
        // Finer steps would collapse once gains are rounded to one decimal
        require(gainStep >= 0.1 && gainStep <= 1.0, "gainStep");
        require(noiseFloor >= 0, "noiseFloor");
        require(sweepTimeoutMillis > 0, "sweepTimeoutMillis");
        require(engineDepth >= 1 && engineDepth <= 15, "engineDepth");
        require(engineUrl != null && !engineUrl.isBlank(), "engineUrl");
        require(sessionDir != null && !sessionDir.isBlank(), "sessionDir");
    }

    private static void require(boolean condition, String key) {
        if (!condition) {
            throw new IllegalArgumentException("Invalid value for config key '" + key + "'");
        }
    }

    public int getCameraIndex() { return cameraIndex; }
    public int getCanonicalSize() { return canonicalSize; }
    public int getBlurKernel() { return blurKernel; }
    public double getBrightnessOffset() { return brightnessOffset; }
    public double getBaselineThreshold() { return baselineThreshold; }
    public double getLowGainThreshold() { return lowGainThreshold; }
    public double getHighGainThreshold() { return highGainThreshold; }
    public double getGainStep() { return gainStep; }
    public double getNoiseFloor() { return noiseFloor; }
    public long getSweepTimeoutMillis() { return sweepTimeoutMillis; }
    public int getEngineDepth() { return engineDepth; }
    public String getEngineUrl() { return engineUrl; }
    public String getSessionDir() { return sessionDir; }

    public DetectorConfig withSweepTimeoutMillis(long millis) {
        DetectorConfig copy = copy();
        copy.sweepTimeoutMillis = millis;
        copy.validate();
        return copy;
    }

    public DetectorConfig withNoiseFloor(double floor) {
        DetectorConfig copy = copy();
        copy.noiseFloor = floor;
        copy.validate();
        return copy;
    }

    private DetectorConfig copy() {
        Gson gson = new Gson();
        return gson.fromJson(gson.toJson(this), DetectorConfig.class);
    }
}
