package com.chessvision;

import javafx.application.Application;
import javafx.application.Platform;
import javafx.geometry.Insets;
import javafx.scene.Scene;
import javafx.scene.control.Alert;
import javafx.scene.control.Button;
import javafx.scene.control.Label;
import javafx.scene.control.RadioButton;
import javafx.scene.control.Slider;
import javafx.scene.control.TextArea;
import javafx.scene.control.ToggleGroup;
import javafx.scene.layout.BorderPane;
import javafx.scene.layout.HBox;
import javafx.scene.layout.VBox;
import javafx.stage.Stage;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Size;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Desktop front end: live camera, click-to-calibrate, player turns confirmed with a button
 * and engine replies drawn as arrows on the rectified board.
 */
public class ChessVisionApp extends Application {

    private static final Logger log = LoggerFactory.getLogger(ChessVisionApp.class);

    private DetectorConfig config;
    private OpenCvCamera camera;
    private ChessGameTracker tracker;
    private MoveDetectionLoop loop;
    private BestMoveProvider engine;
    private SessionStore sessionStore;
    private final Rectifier previewRectifier = new Rectifier();

    private CameraViewer cameraViewer;
    private ChessBoard chessBoardUI;
    private TextArea logArea;
    private Label statusLabel;
    private Button btnStartGame;
    private Button btnConfirm;
    private Slider depthSlider;
    private RadioButton playWhite;

    private final List<Point> clickedCorners = new CopyOnWriteArrayList<>();
    private boolean calibrating = false;
    private volatile LegalMove lastDetected;
    private volatile LegalMove pendingEngineMove;

    @Override
    public void init() {
        List<String> args = getParameters().getRaw();
        config = args.isEmpty() ? DetectorConfig.load() : DetectorConfig.load(Path.of(args.get(0)));
        camera = new OpenCvCamera(config.getCameraIndex());
        tracker = new ChessGameTracker();
        loop = MoveDetectionLoop.create(config, camera, tracker, BoardOrientation.WHITE_AT_BOTTOM);
        engine = new StockfishClient(config);
        sessionStore = new SessionStore(Path.of(config.getSessionDir()));
    }

    @Override
    public void start(Stage stage) {
        chessBoardUI = new ChessBoard();
        chessBoardUI.updateBoard(tracker.getBoardArray());

        cameraViewer = new CameraViewer();
        cameraViewer.setOnFrameClicked(this::onFrameClicked);
        showRawView();
        cameraViewer.startPreview(camera);

        logArea = new TextArea();
        logArea.setEditable(false);
        logArea.setPrefHeight(150);
        logArea.setText(">>> Click 'Calibrate', then the board corners TL, TR, BL, BR.\n");

        statusLabel = new Label("Status: IDLE");
        statusLabel.setStyle("-fx-text-fill: white; -fx-font-weight: bold; -fx-font-size: 14px;");

        Button btnCalibrate = new Button("CALIBRATE");
        btnCalibrate.setOnAction(e -> beginCalibration());

        Button btnResume = new Button("RESUME SESSION");
        btnResume.setOnAction(e -> resumeSession());

        btnStartGame = new Button("START GAME");
        btnStartGame.setStyle("-fx-background-color: #4CAF50; -fx-text-fill: white; -fx-font-weight: bold;");
        btnStartGame.setDisable(true);
        btnStartGame.setOnAction(e -> startGame());

        btnConfirm = new Button("CONFIRM MOVE");
        btnConfirm.setStyle("-fx-background-color: #2196F3; -fx-text-fill: white; -fx-font-weight: bold;");
        btnConfirm.setDisable(true);
        btnConfirm.setOnAction(e -> confirmMove());

        Button btnStop = new Button("STOP / RESET");
        btnStop.setStyle("-fx-background-color: #f44336; -fx-text-fill: white;");
        btnStop.setOnAction(e -> stopGame());

        ToggleGroup colorGroup = new ToggleGroup();
        playWhite = new RadioButton("White");
        playWhite.setToggleGroup(colorGroup);
        playWhite.setSelected(true);
        playWhite.setStyle("-fx-text-fill: white;");
        RadioButton playBlack = new RadioButton("Black");
        playBlack.setToggleGroup(colorGroup);
        playBlack.setStyle("-fx-text-fill: white;");

        depthSlider = new Slider(1, 15, config.getEngineDepth());
        depthSlider.setMajorTickUnit(1);
        depthSlider.setSnapToTicks(true);
        depthSlider.setShowTickLabels(true);
        Label depthLabel = new Label("Engine depth");
        depthLabel.setStyle("-fx-text-fill: white;");

        HBox controlBox = new HBox(15, btnCalibrate, btnResume, playWhite, playBlack,
                depthLabel, depthSlider, btnStartGame, btnConfirm, btnStop, statusLabel);
        controlBox.setPadding(new Insets(10));
        controlBox.setStyle("-fx-background-color: #333; -fx-alignment: center-left;");

        VBox rightPane = new VBox(10, new Label("Camera Feed"), cameraViewer, logArea);
        rightPane.setPadding(new Insets(10));

        BorderPane root = new BorderPane();
        root.setCenter(chessBoardUI.getBoardUI());
        root.setRight(rightPane);
        root.setBottom(controlBox);

        loop.addListener(new DetectionListener() {
            @Override
            public void onStateChanged(DetectionState state) {
                Platform.runLater(() -> {
                    statusLabel.setText("Status: " + state);
                    // orientation is fixed while a sweep runs
                    btnStartGame.setDisable(state == DetectionState.DETECTING || loop.getTransform().isEmpty());
                });
            }

            @Override
            public void onReferenceUpdated(BoardFrame reference) {
                try {
                    sessionStore.saveReference(reference);
                } catch (RuntimeException e) {
                    log.warn("Could not save reference: {}", e.getMessage());
                }
            }
        });

        Scene scene = new Scene(root, 1400, 800);
        stage.setScene(scene);
        stage.setTitle("Chess Vision");
        stage.setOnCloseRequest(e -> {
            cameraViewer.stopPreview();
            loop.close();
            camera.release();
            Platform.exit();
        });
        stage.show();
    }

    // ---------------------------------------------------------------- calibration

    private void beginCalibration() {
        if (loop.getState() == DetectionState.DETECTING) return;
        clickedCorners.clear();
        calibrating = true;
        btnStartGame.setDisable(true);
        btnConfirm.setDisable(true);
        showRawView();
        log("Calibrating: click TL, TR, BL, BR corners of the board.");
    }

    private void onFrameClicked(Point point, Size frameSize) {
        if (!calibrating) return;
        clickedCorners.add(point);
        log(String.format("Corner %d: (%.0f, %.0f)", clickedCorners.size(), point.x, point.y));
        if (clickedCorners.size() < 4) return;

        calibrating = false;
        List<Point> corners = new ArrayList<>(clickedCorners);
        loop.calibrate(corners, frameSize).whenComplete((transform, error) -> Platform.runLater(() -> {
            if (error != null) {
                clickedCorners.clear();
                showError("Calibration", rootMessage(error));
                showRawView();
                return;
            }
            saveCalibration(transform);
            showBoardView();
            btnStartGame.setDisable(false);
            log("Board calibrated. Set up the pieces and click 'Start Game'.");
        }));
    }

    private void saveCalibration(CalibrationTransform transform) {
        try {
            sessionStore.saveCalibration(transform);
        } catch (RuntimeException e) {
            log.warn("Could not save calibration: {}", e.getMessage());
        }
    }

    private void resumeSession() {
        if (loop.getState() == DetectionState.DETECTING) return;
        Optional<CalibrationTransform> stored;
        Optional<BoardFrame> reference;
        try {
            stored = sessionStore.loadCalibration(new Calibrator(config));
            reference = sessionStore.loadReference();
        } catch (RuntimeException e) {
            showError("Resume", e.getMessage());
            return;
        }
        if (stored.isEmpty()) {
            showError("Resume", "No saved calibration in " + sessionStore.getDirectory());
            return;
        }
        if (reference.isEmpty()) {
            loop.install(stored.get()).whenComplete((t, error) -> Platform.runLater(() -> {
                if (error != null) {
                    showError("Resume", rootMessage(error));
                    return;
                }
                showBoardView();
                btnStartGame.setDisable(false);
                log("Calibration restored. Click 'Start Game'.");
            }));
            return;
        }
        if (!applyOrientation()) return;
        newGame();
        loop.resume(stored.get(), reference.get()).whenComplete((r, error) -> Platform.runLater(() -> {
            if (error != null) {
                showError("Resume", rootMessage(error));
                return;
            }
            showBoardView();
            btnStartGame.setDisable(false);
            log("Session resumed with saved reference. Game state starts from the initial position.");
            if (isPlayersTurn()) {
                log("Your move. Play it on the board, then click 'Confirm Move'.");
                btnConfirm.setDisable(false);
            } else {
                requestEngineMove();
            }
        }));
    }

    // ---------------------------------------------------------------- game

    private void startGame() {
        if (!applyOrientation()) return;
        newGame();

        loop.arm().whenComplete((reference, error) -> Platform.runLater(() -> {
            if (error != null) {
                showError("Start Game", rootMessage(error));
                return;
            }
            log("Reference captured. Game started.");
            if (isPlayersTurn()) {
                log("Your move. Play it on the board, then click 'Confirm Move'.");
                btnConfirm.setDisable(false);
            } else {
                requestEngineMove();
            }
        }));
    }

    private void confirmMove() {
        btnConfirm.setDisable(true);
        if (pendingEngineMove != null) {
            confirmEngineMove();
            return;
        }
        log("Detecting move...");
        loop.requestDetection().whenComplete((outcome, error) -> Platform.runLater(() -> {
            if (error != null) {
                log("Detection error: " + rootMessage(error));
                btnConfirm.setDisable(false);
                return;
            }
            if (!outcome.isDetected()) {
                DetectionFailure failure = outcome.getFailure().orElseThrow();
                log("!!! " + failure.getReason() + ": " + failure.getMessage());
                if (failure.getReason() != FailureReason.CANCELLED) {
                    showWarning("Move not detected",
                            "Fix the board to a legal position and click 'Confirm Move' again.");
                    btnConfirm.setDisable(false);
                }
                return;
            }
            DetectedMove detected = outcome.getMove().orElseThrow();
            tracker.apply(detected.getMove());
            lastDetected = detected.getMove();
            chessBoardUI.updateBoard(tracker.getBoardArray());
            log(">>> MOVE PLAYED: " + detected.getUci() + " (" + detected.getSetting()
                    + ", attempt " + detected.getAttempts() + ")");
            if (!checkGameOver()) {
                requestEngineMove();
            }
        }));
    }

    private void requestEngineMove() {
        int depth = (int) Math.round(depthSlider.getValue());
        log("Engine thinking (depth " + depth + ")...");
        engine.bestMove(tracker.fen(), depth).whenComplete((suggestion, error) -> Platform.runLater(() -> {
            if (error != null) {
                showError("Engine", rootMessage(error));
                btnConfirm.setDisable(true);
                return;
            }
            BoardCoordinate from = BoardCoordinate.parse(suggestion.getBestMove().substring(0, 2));
            BoardCoordinate to = BoardCoordinate.parse(suggestion.getBestMove().substring(2, 4));
            pendingEngineMove = tracker.tryMove(from, to).orElse(null);
            if (pendingEngineMove == null) {
                showError("Engine", "Engine suggested an illegal move: " + suggestion.getBestMove());
                return;
            }
            log(">>> ENGINE: " + suggestion.getBestMove() + " (eval " + suggestion.getEvaluation()
                    + "). Make it on the board, then click 'Confirm Move'.");
            btnConfirm.setDisable(false);
        }));
    }

    private void confirmEngineMove() {
        LegalMove move = pendingEngineMove;
        tracker.applyUci(move.getUci());
        pendingEngineMove = null;
        lastDetected = null;
        chessBoardUI.updateBoard(tracker.getBoardArray());
        log(">>> ENGINE MOVE PLAYED: " + move.getUci());

        loop.refreshReference().whenComplete((reference, error) -> Platform.runLater(() -> {
            if (error != null) {
                showError("Reference", rootMessage(error));
                return;
            }
            if (!checkGameOver()) {
                log("Your move. Play it on the board, then click 'Confirm Move'.");
                btnConfirm.setDisable(false);
            }
        }));
    }

    private boolean applyOrientation() {
        BoardOrientation orientation = selectedOrientation();
        try {
            loop.setOrientation(orientation);
        } catch (IllegalStateException e) {
            showWarning("Busy", "Wait for the current detection to finish.");
            return false;
        }
        chessBoardUI.setOrientation(orientation);
        return true;
    }

    private void newGame() {
        tracker.reset();
        lastDetected = null;
        pendingEngineMove = null;
        chessBoardUI.updateBoard(tracker.getBoardArray());
    }

    private boolean checkGameOver() {
        GameStatus status = tracker.status();
        if (status == GameStatus.CHECK) {
            log("Check!");
        }
        if (!status.isOver()) {
            return false;
        }
        showInfo("Game Over", "Game finished: " + status);
        btnConfirm.setDisable(true);
        return true;
    }

    private void stopGame() {
        loop.stop().whenComplete((v, error) -> Platform.runLater(() -> {
            pendingEngineMove = null;
            lastDetected = null;
            calibrating = false;
            clickedCorners.clear();
            btnStartGame.setDisable(true);
            btnConfirm.setDisable(true);
            showRawView();
            log("Session stopped. Calibrate again to start a new game.");
        }));
    }

    private boolean isPlayersTurn() {
        return tracker.isWhiteToMove() == playWhite.isSelected();
    }

    private BoardOrientation selectedOrientation() {
        return playWhite.isSelected() ? BoardOrientation.WHITE_AT_BOTTOM : BoardOrientation.BLACK_AT_BOTTOM;
    }

    // ---------------------------------------------------------------- views

    private void showRawView() {
        cameraViewer.setRenderer(frame -> {
            Mat shown = frame.clone();
            OverlayRenderer.drawCorners(shown, new ArrayList<>(clickedCorners));
            return shown;
        }, true);
    }

    private void showBoardView() {
        cameraViewer.setRenderer(frame -> {
            Optional<CalibrationTransform> transform = loop.getTransform();
            if (transform.isEmpty() || !transform.get().getSourceSize().equals(frame.size())) {
                return frame.clone();
            }
            BoardFrame board = previewRectifier.rectify(frame, transform.get());
            Mat shown = board.copyImage();
            board.release();
            SquareTable table = loop.getSquareTable();
            OverlayRenderer.drawGrid(shown, OverlayRenderer.GRID_COLOR, 1);
            LegalMove detected = lastDetected;
            if (detected != null) {
                OverlayRenderer.drawMoveArrow(shown, detected, table, OverlayRenderer.DETECTED_MOVE_COLOR);
            }
            LegalMove engineMove = pendingEngineMove;
            if (engineMove != null) {
                OverlayRenderer.drawMoveArrow(shown, engineMove, table, OverlayRenderer.ENGINE_MOVE_COLOR);
            }
            return shown;
        }, false);
    }

    // ---------------------------------------------------------------- helpers

    private static String rootMessage(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        return cause.getMessage();
    }

    private void showError(String title, String content) {
        log.error("{}: {}", title, content);
        log("ERROR " + title + ": " + content);
        Alert alert = new Alert(Alert.AlertType.ERROR);
        alert.setTitle(title);
        alert.setContentText(content);
        alert.showAndWait();
    }

    private void showWarning(String title, String content) {
        Alert alert = new Alert(Alert.AlertType.WARNING);
        alert.setTitle(title);
        alert.setContentText(content);
        alert.showAndWait();
    }

    private void showInfo(String title, String content) {
        Alert alert = new Alert(Alert.AlertType.INFORMATION);
        alert.setTitle(title);
        alert.setContentText(content);
        alert.showAndWait();
    }

    private void log(String msg) {
        log.info(msg);
        logArea.appendText(msg + "\n");
        logArea.setScrollTop(Double.MAX_VALUE);
    }

    public static void main(String[] args) {
        launch(args);
    }
}
