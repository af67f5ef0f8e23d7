package com.chessvision;

import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Size;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * One move-detection session: calibration, the reference frame, and on-demand
 * detection passes.
 * <p>
 * Every request runs on a single background thread, so requests never overlap.
 * A detection request made while another is in flight is rejected.
 * Nothing here is timer driven; each pass is triggered by {@link #requestDetection()}.
 */
public class MoveDetectionLoop implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MoveDetectionLoop.class);

    private final FrameSource camera;
    private final Calibrator calibrator;
    private final Rectifier rectifier;
    private final ContrastAdapter contrastAdapter;
    private final MoveCandidateResolver resolver;
    private final LegalMoveOracle oracle;

    private final ReferenceStore referenceStore = new ReferenceStore();
    private final List<DetectionListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicReference<DetectionState> state = new AtomicReference<>(DetectionState.IDLE);
    // Bumped by stop(); a running pass compares against the value it started with
    private final AtomicLong generation = new AtomicLong();
    private final ExecutorService executor;

    private volatile CalibrationTransform transform;

    public MoveDetectionLoop(FrameSource camera, Calibrator calibrator, Rectifier rectifier,
                             ContrastAdapter contrastAdapter, MoveCandidateResolver resolver,
                             LegalMoveOracle oracle) {
        this.camera = camera;
        this.calibrator = calibrator;
        this.rectifier = rectifier;
        this.contrastAdapter = contrastAdapter;
        this.resolver = resolver;
        this.oracle = oracle;
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "move-detection");
            t.setDaemon(true);
            return t;
        });
    }

    public static MoveDetectionLoop create(DetectorConfig config, FrameSource camera,
                                           LegalMoveOracle oracle, BoardOrientation orientation) {
        DiffEngine diffEngine = new DiffEngine(config);
        MoveCandidateResolver resolver = new MoveCandidateResolver(new SquareTable(orientation), config);
        ContrastAdapter adapter = new ContrastAdapter(diffEngine, resolver, config);
        return new MoveDetectionLoop(camera, new Calibrator(config), new Rectifier(), adapter, resolver, oracle);
    }

    public void addListener(DetectionListener listener) {
        listeners.add(listener);
    }

    public DetectionState getState() {
        return state.get();
    }

    public Optional<CalibrationTransform> getTransform() {
        return Optional.ofNullable(transform);
    }

    /** The last confirmed board image, for display. */
    public Optional<BoardFrame> currentReference() {
        return referenceStore.current();
    }

    public SquareTable getSquareTable() {
        return resolver.getSquareTable();
    }

    /**
     * Changes which side sits at the bottom of the rectified image.
     */
    public void setOrientation(BoardOrientation orientation) {
        if (state.get() == DetectionState.DETECTING) {
            throw new IllegalStateException("Cannot change orientation while detecting");
        }
        resolver.setSquareTable(new SquareTable(orientation));
        log.info("Board orientation set to {}", orientation);
    }

    // ---------------------------------------------------------------- requests

    /**
     * Installs a new calibration from four corners (TL, TR, BL, BR) picked on a frame of
     * {@code frameSize}. Drops the current reference.
     */
    public CompletableFuture<CalibrationTransform> calibrate(List<Point> corners, Size frameSize) {
        if (state.get() == DetectionState.DETECTING) {
            return CompletableFuture.failedFuture(new IllegalStateException("Cannot calibrate while detecting"));
        }
        return submit(() -> {
            CalibrationTransform installed = calibrator.calibrate(corners, frameSize);
            referenceStore.clear();
            transform = installed;
            setState(DetectionState.CALIBRATED);
            notifyListeners(l -> l.onCalibrationComplete(installed));
            return installed;
        });
    }

    /**
     * Calibrates from a stored transform, e.g. one loaded by {@link SessionStore}.
     */
    public CompletableFuture<CalibrationTransform> install(CalibrationTransform stored) {
        return calibrate(stored.getCorners(), stored.getSourceSize());
    }

    /**
     * Resumes a saved session: installs the calibration and the saved reference and arms
     * without capturing. The reference must match the calibration's canonical size.
     */
    public CompletableFuture<BoardFrame> resume(CalibrationTransform stored, BoardFrame savedReference) {
        if (state.get() == DetectionState.DETECTING) {
            return CompletableFuture.failedFuture(new IllegalStateException("Cannot resume while detecting"));
        }
        return submit(() -> {
            if (savedReference.size() != stored.getCanonicalSize()) {
                throw new IllegalArgumentException("Saved reference is " + savedReference.size()
                        + " px, calibration expects " + stored.getCanonicalSize());
            }
            CalibrationTransform installed = calibrator.calibrate(stored.getCorners(), stored.getSourceSize());
            transform = installed;
            notifyListeners(l -> l.onCalibrationComplete(installed));
            camera.open();
            referenceStore.replace(savedReference);
            setState(DetectionState.ARMED);
            notifyListeners(l -> l.onReferenceUpdated(savedReference));
            log.info("Session resumed from saved calibration and reference");
            return savedReference;
        });
    }

    /**
     * Captures the starting position as the reference frame.
     */
    public CompletableFuture<BoardFrame> arm() {
        return submit(() -> {
            DetectionState current = state.get();
            if (current != DetectionState.CALIBRATED && current != DetectionState.ARMED) {
                throw new IllegalStateException("Cannot arm in state " + current);
            }
            camera.open();
            return captureReference();
        });
    }

    /**
     * Re-captures the reference after a move was made on the board outside detection,
     * such as the engine's reply.
     */
    public CompletableFuture<BoardFrame> refreshReference() {
        return submit(() -> {
            if (state.get() != DetectionState.ARMED) {
                throw new IllegalStateException("Cannot refresh reference in state " + state.get());
            }
            return captureReference();
        });
    }

    /**
     * Looks for the move made since the reference was captured.
     * The returned future fails with {@link IllegalStateException} when the session is
     * not armed or another detection is running.
     */
    public CompletableFuture<DetectionOutcome> requestDetection() {
        if (!state.compareAndSet(DetectionState.ARMED, DetectionState.DETECTING)) {
            log.warn("Detection request rejected in state {}", state.get());
            return CompletableFuture.failedFuture(
                    new IllegalStateException("Detection rejected in state " + state.get()));
        }
        long startedGeneration = generation.get();
        CompletableFuture<DetectionOutcome> result = submit(() -> runDetection(startedGeneration));
        if (result.isCompletedExceptionally()) {
            state.compareAndSet(DetectionState.DETECTING, DetectionState.ARMED);
        }
        return result;
    }

    /**
     * Ends the session: cancels a running contrast search, releases the camera and
     * forgets calibration and reference.
     */
    public CompletableFuture<Void> stop() {
        generation.incrementAndGet();
        CompletableFuture<Void> done = submit(() -> {
            shutdownSession();
            return null;
        });
        if (done.isCompletedExceptionally()) {
            // Executor already gone, nothing else can touch the session
            shutdownSession();
            return CompletableFuture.completedFuture(null);
        }
        return done;
    }

    @Override
    public void close() {
        stop();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Detection thread did not finish in time, interrupting");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // ---------------------------------------------------------------- background work

    private BoardFrame captureReference() {
        CalibrationTransform t = requireTransform();
        Mat raw = camera.read();
        BoardFrame frame;
        try {
            frame = rectifier.rectify(raw, t);
        } finally {
            raw.release();
        }
        referenceStore.replace(frame);
        setState(DetectionState.ARMED);
        log.info("Reference board captured at {}", frame.getCapturedAt());
        notifyListeners(l -> l.onReferenceUpdated(frame));
        return frame;
    }

    private DetectionOutcome runDetection(long startedGeneration) {
        // A stop or recalibration queued ahead of this pass has already moved the session on
        if (state.get() != DetectionState.DETECTING || isCancelled(startedGeneration)) {
            throw new IllegalStateException("Session changed before detection started");
        }
        BoardFrame reference = referenceStore.current().orElse(null);
        CalibrationTransform t = transform;
        if (reference == null || t == null) {
            setState(DetectionState.ARMED);
            throw new IllegalStateException("Armed session has no reference or calibration");
        }
        notifyListeners(l -> l.onStateChanged(DetectionState.DETECTING));
        try {
            BoardFrame candidate;
            try {
                Mat raw = camera.read();
                try {
                    candidate = rectifier.rectify(raw, t);
                } finally {
                    raw.release();
                }
            } catch (CameraIOException e) {
                return fail(new DetectionFailure(FailureReason.CAMERA_IO_ERROR, e.getMessage()), startedGeneration);
            } catch (RectificationException e) {
                return fail(new DetectionFailure(FailureReason.RECTIFICATION_ERROR, e.getMessage()), startedGeneration);
            }

            ContrastSearchResult result = contrastAdapter.search(candidate, reference, oracle,
                    () -> isCancelled(startedGeneration));

            if (result.isCancelled()) {
                candidate.release();
                DetectionFailure failure = new DetectionFailure(FailureReason.CANCELLED,
                        "Detection stopped", result.getTried());
                notifyListeners(l -> l.onDetectionFailed(failure));
                return DetectionOutcome.failed(failure);
            }

            if (result.getMove().isPresent()) {
                DetectedMove detected = new DetectedMove(result.getMove().get(),
                        result.getWinningSetting().orElseThrow(), result.getAttempts());
                setState(DetectionState.CONFIRMED);
                referenceStore.replace(candidate);
                log.info("Move detected: {}", detected);
                notifyListeners(l -> l.onReferenceUpdated(candidate));
                notifyListeners(l -> l.onMoveDetected(detected));
                setState(DetectionState.ARMED);
                return DetectionOutcome.detected(detected);
            }

            candidate.release();
            String message = result.isTimedOut()
                    ? "No legal move found before the contrast search timed out"
                    : "No legal move found at any contrast setting";
            return fail(new DetectionFailure(FailureReason.NO_LEGAL_MOVE, message, result.getTried()), startedGeneration);
        } catch (RuntimeException e) {
            log.error("Detection pass failed", e);
            if (!isCancelled(startedGeneration)) {
                setState(DetectionState.ARMED);
            }
            throw e;
        }
    }

    private DetectionOutcome fail(DetectionFailure failure, long startedGeneration) {
        log.warn("Detection failed: {}", failure);
        setState(DetectionState.FAILED);
        notifyListeners(l -> l.onDetectionFailed(failure));
        if (!isCancelled(startedGeneration)) {
            setState(DetectionState.ARMED);
        }
        return DetectionOutcome.failed(failure);
    }

    private void shutdownSession() {
        camera.release();
        referenceStore.clear();
        transform = null;
        setState(DetectionState.IDLE);
        log.info("Detection session stopped");
    }

    private boolean isCancelled(long startedGeneration) {
        return generation.get() != startedGeneration || Thread.currentThread().isInterrupted();
    }

    private CalibrationTransform requireTransform() {
        CalibrationTransform t = transform;
        if (t == null) {
            throw new IllegalStateException("Session is not calibrated");
        }
        return t;
    }

    private void setState(DetectionState next) {
        DetectionState previous = state.getAndSet(next);
        if (previous != next) {
            log.debug("State {} -> {}", previous, next);
            notifyListeners(l -> l.onStateChanged(next));
        }
    }

    private void notifyListeners(Consumer<DetectionListener> event) {
        for (DetectionListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                log.error("Detection listener threw", e);
            }
        }
    }

    private <T> CompletableFuture<T> submit(Callable<T> task) {
        CompletableFuture<T> future = new CompletableFuture<>();
        try {
            executor.execute(() -> {
                try {
                    future.complete(task.call());
                } catch (Exception e) {
                    future.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            future.completeExceptionally(new IllegalStateException("Detection session is closed", e));
        }
        return future;
    }
}
