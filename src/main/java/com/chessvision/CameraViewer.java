package com.chessvision;

import javafx.application.Platform;
import javafx.scene.image.Image;
import javafx.scene.image.ImageView;
import javafx.scene.input.MouseButton;
import javafx.scene.layout.StackPane;
import nu.pattern.OpenCV;
import org.opencv.core.Mat;
import org.opencv.core.MatOfByte;
import org.opencv.core.Point;
import org.opencv.core.Size;
import org.opencv.imgcodecs.Imgcodecs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.util.function.BiConsumer;
import java.util.function.UnaryOperator;

/**
 * Live camera pane. A background thread reads frames, passes them through a
 * renderer (raw view with corners, or rectified board with overlays) and shows the result.
 */
public class CameraViewer extends StackPane {

    private static final Logger log = LoggerFactory.getLogger(CameraViewer.class);
    private static final long FRAME_INTERVAL_MS = 1000 / 30;

    static {
        OpenCV.loadLocally();
    }

    private final ImageView imageView = new ImageView();
    private volatile boolean running = false;
    private volatile UnaryOperator<Mat> renderer = UnaryOperator.identity();
    private volatile Size rawFrameSize;
    private volatile boolean showingRawFrame = true;
    private Thread thread;

    public CameraViewer() {
        imageView.setFitWidth(640);
        imageView.setPreserveRatio(true);
        this.getChildren().add(imageView);
    }

    /**
     * Replaces the frame renderer. {@code rawView} tells click handling whether the
     * rendered image has raw-frame geometry.
     */
    public void setRenderer(UnaryOperator<Mat> renderer, boolean rawView) {
        this.renderer = renderer;
        this.showingRawFrame = rawView;
    }

    /**
     * Reports clicks in raw-frame pixel coordinates, together with the raw frame size.
     * Clicks are ignored while the rectified view is shown.
     */
    public void setOnFrameClicked(BiConsumer<Point, Size> handler) {
        imageView.setOnMouseClicked(e -> {
            Size size = rawFrameSize;
            if (e.getButton() != MouseButton.PRIMARY || size == null || !showingRawFrame) return;

            double drawW = imageView.getBoundsInLocal().getWidth();
            double drawH = imageView.getBoundsInLocal().getHeight();
            if (drawW == 0 || drawH == 0) return;

            // Screen click -> image pixel
            double imgX = e.getX() * (size.width / drawW);
            double imgY = e.getY() * (size.height / drawH);
            imgX = Math.max(0, Math.min(size.width - 1, imgX));
            imgY = Math.max(0, Math.min(size.height - 1, imgY));
            handler.accept(new Point(imgX, imgY), size);
        });
    }

    public void startPreview(FrameSource camera) {
        if (running) return;
        running = true;
        thread = new Thread(() -> {
            while (running) {
                try {
                    // The preview owns the device: a stopped session releases it, the preview reopens it
                    if (!camera.isOpened()) {
                        camera.open();
                    }
                    Mat frame = camera.read();
                    rawFrameSize = frame.size();
                    Mat shown = renderer.apply(frame);
                    Image image = mat2Image(shown);
                    if (shown != frame) shown.release();
                    frame.release();
                    Platform.runLater(() -> imageView.setImage(image));
                    Thread.sleep(FRAME_INTERVAL_MS);
                } catch (CameraIOException e) {
                    log.warn("Preview: {}", e.getMessage());
                    if (!pause(1000)) break;
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                } catch (RuntimeException e) {
                    log.error("Preview renderer failed", e);
                    if (!pause(500)) break;
                }
            }
        }, "camera-preview");
        thread.setDaemon(true);
        thread.start();
    }

    public void stopPreview() {
        running = false;
        if (thread != null) {
            thread.interrupt();
            thread = null;
        }
    }

    private static boolean pause(long millis) {
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    static Image mat2Image(Mat frame) {
        MatOfByte buffer = new MatOfByte();
        Imgcodecs.imencode(".png", frame, buffer);
        Image image = new Image(new ByteArrayInputStream(buffer.toArray()));
        buffer.release();
        return image;
    }
}
