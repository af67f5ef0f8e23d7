package com.chessvision;

import nu.pattern.OpenCV;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.Rect;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

import java.util.ArrayList;
import java.util.List;

/**
 * Compares a candidate board image with the reference, one score per square.
 * Stateless: the same inputs always give the same scores.
 */
public class DiffEngine {

    static {
        OpenCV.loadLocally();
    }

    private final int blurKernel;
    private final double brightnessOffset;

    public DiffEngine(int blurKernel, double brightnessOffset) {
        if (blurKernel <= 0 || blurKernel % 2 == 0) {
            throw new IllegalArgumentException("Blur kernel must be odd and positive: " + blurKernel);
        }
        this.blurKernel = blurKernel;
        this.brightnessOffset = brightnessOffset;
    }

    public DiffEngine(DetectorConfig config) {
        this(config.getBlurKernel(), config.getBrightnessOffset());
    }

    /**
     * @return all 64 squares ordered by {@link SquareDifference#BY_MAGNITUDE}
     */
    public List<SquareDifference> compare(BoardFrame candidate, BoardFrame reference, ContrastSetting setting) {
        Mat cand = candidate.image();
        Mat ref = reference.image();
        if (cand.cols() != ref.cols() || cand.rows() != ref.rows()) {
            throw new IllegalArgumentException("Frames differ in size: " + cand.size() + " vs " + ref.size());
        }

        Mat grayCandidate = prepare(cand, setting);
        Mat grayReference = prepare(ref, setting);

        Mat diff = new Mat();
        Core.absdiff(grayReference, grayCandidate, diff);
        Imgproc.threshold(diff, diff, setting.getThreshold(), 255, Imgproc.THRESH_BINARY);

        int tileWidth = diff.cols() / 8;
        int tileHeight = diff.rows() / 8;
        List<SquareDifference> scores = new ArrayList<>(64);
        for (int index = 1; index <= 64; index++) {
            int col = (index - 1) % 8;
            int row = (index - 1) / 8;
            Mat tile = new Mat(diff, new Rect(col * tileWidth, row * tileHeight, tileWidth, tileHeight));
            scores.add(new SquareDifference(index, Core.mean(tile).val[0]));
            tile.release();
        }

        grayCandidate.release();
        grayReference.release();
        diff.release();

        scores.sort(SquareDifference.BY_MAGNITUDE);
        return scores;
    }

    // Smoothing precedes the gain
    private Mat prepare(Mat image, ContrastSetting setting) {
        Mat gray = new Mat();
        if (image.channels() == 1) {
            image.copyTo(gray);
        } else if (image.channels() == 4) {
            Imgproc.cvtColor(image, gray, Imgproc.COLOR_BGRA2GRAY);
        } else {
            Imgproc.cvtColor(image, gray, Imgproc.COLOR_BGR2GRAY);
        }
        Imgproc.GaussianBlur(gray, gray, new Size(blurKernel, blurKernel), 0);
        Core.convertScaleAbs(gray, gray, setting.getGain(), brightnessOffset);
        return gray;
    }
}
