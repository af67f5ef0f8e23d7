package com.chessvision;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import nu.pattern.OpenCV;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Size;
import org.opencv.imgcodecs.Imgcodecs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Saves calibration and the reference board to a directory so a session can be resumed.
 * Calibration goes to {@code calibration.json}, the reference to {@code reference.png}.
 */
public class SessionStore {

    private static final Logger log = LoggerFactory.getLogger(SessionStore.class);

    static final String CALIBRATION_FILE = "calibration.json";
    static final String REFERENCE_FILE = "reference.png";

    static {
        OpenCV.loadLocally();
    }

    private final Path directory;
    private final Gson gson = new GsonBuilder().setPrettyPrinting().create();

    public SessionStore(Path directory) {
        this.directory = directory;
    }

    public Path getDirectory() {
        return directory;
    }

    public void saveCalibration(CalibrationTransform transform) {
        JsonObject json = new JsonObject();
        Size source = transform.getSourceSize();
        json.addProperty("frameWidth", source.width);
        json.addProperty("frameHeight", source.height);
        json.addProperty("canonicalSize", transform.getCanonicalSize());
        JsonArray corners = new JsonArray();
        for (Point p : transform.getCorners()) {
            JsonArray xy = new JsonArray();
            xy.add(p.x);
            xy.add(p.y);
            corners.add(xy);
        }
        json.add("corners", corners);

        try {
            Files.createDirectories(directory);
            Files.writeString(directory.resolve(CALIBRATION_FILE), gson.toJson(json), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not save calibration to " + directory, e);
        }
        log.info("Calibration saved to {}", directory.resolve(CALIBRATION_FILE));
    }

    /**
     * Reads a saved calibration and rebuilds its transform with {@code calibrator},
     * which re-validates the corners.
     */
    public Optional<CalibrationTransform> loadCalibration(Calibrator calibrator) {
        Path file = directory.resolve(CALIBRATION_FILE);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        JsonObject json;
        try {
            json = gson.fromJson(Files.readString(file, StandardCharsets.UTF_8), JsonObject.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read " + file, e);
        } catch (JsonParseException e) {
            throw new CalibrationException("saved calibration " + file + " is malformed: " + e.getMessage());
        }
        if (json == null || !json.has("corners") || !json.has("frameWidth") || !json.has("frameHeight")) {
            throw new CalibrationException("saved calibration " + file + " is incomplete");
        }

        List<Point> corners = new ArrayList<>();
        for (var element : json.getAsJsonArray("corners")) {
            JsonArray xy = element.getAsJsonArray();
            corners.add(new Point(xy.get(0).getAsDouble(), xy.get(1).getAsDouble()));
        }
        Size frameSize = new Size(json.get("frameWidth").getAsDouble(), json.get("frameHeight").getAsDouble());
        return Optional.of(calibrator.calibrate(corners, frameSize));
    }

    public void saveReference(BoardFrame frame) {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not create " + directory, e);
        }
        Path file = directory.resolve(REFERENCE_FILE);
        if (!Imgcodecs.imwrite(file.toString(), frame.image())) {
            throw new UncheckedIOException(new IOException("Could not write " + file));
        }
        log.info("Reference board saved to {}", file);
    }

    public Optional<BoardFrame> loadReference() {
        Path file = directory.resolve(REFERENCE_FILE);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        Mat image = Imgcodecs.imread(file.toString(), Imgcodecs.IMREAD_UNCHANGED);
        if (image.empty()) {
            throw new UncheckedIOException(new IOException("Could not decode " + file));
        }
        Instant modified;
        try {
            modified = Files.getLastModifiedTime(file).toInstant();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not stat " + file, e);
        }
        return Optional.of(new BoardFrame(image, modified));
    }
}
