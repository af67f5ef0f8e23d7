package com.chessvision;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DiffEngineTest {

    private final DiffEngine engine = new DiffEngine(3, 0);
    private final ContrastSetting baseline = ContrastSetting.baseline(20);

    @Test
    void changedSquaresRankFirst() {
        BoardFrame reference = BoardImages.frame(BoardImages.boardWithPieces(10));
        BoardFrame candidate = BoardImages.frame(BoardImages.boardWithPieces(50));

        List<SquareDifference> scores = engine.compare(candidate, reference, baseline);

        assertEquals(64, scores.size());
        Set<Integer> topTwo = Set.of(scores.get(0).getSquareIndex(), scores.get(1).getSquareIndex());
        assertEquals(Set.of(10, 50), topTwo);
        assertTrue(scores.get(1).getMagnitude() > 20);
        assertEquals(0.0, scores.get(2).getMagnitude(), 1e-9);
    }

    @Test
    void everySquareScoredOnce() {
        BoardFrame reference = BoardImages.frame(BoardImages.boardWithPieces(1));
        BoardFrame candidate = BoardImages.frame(BoardImages.boardWithPieces(64));

        Set<Integer> indices = new HashSet<>();
        for (SquareDifference d : engine.compare(candidate, reference, baseline)) {
            indices.add(d.getSquareIndex());
        }
        assertEquals(64, indices.size());
    }

    @Test
    void identicalFramesScoreZero() {
        BoardFrame reference = BoardImages.frame(BoardImages.boardWithPieces(5, 33));
        BoardFrame candidate = BoardImages.frame(BoardImages.boardWithPieces(5, 33));

        for (SquareDifference d : engine.compare(candidate, reference, baseline)) {
            assertEquals(0.0, d.getMagnitude(), 1e-9, "square " + d.getSquareIndex());
        }
    }

    @Test
    void lowGainSuppressesFaintChanges() {
        BoardFrame reference = BoardImages.frame(BoardImages.boardWithPieces(10));
        BoardFrame candidate = BoardImages.frame(BoardImages.boardWithPieces(50));

        // 100 vs 200 scaled by 0.1 differs by 10, under the threshold
        List<SquareDifference> scores = engine.compare(candidate, reference, new ContrastSetting(0.1, 40));

        assertEquals(0.0, scores.get(0).getMagnitude(), 1e-9);
    }

    @Test
    void sameInputsGiveSameScores() {
        BoardFrame reference = BoardImages.frame(BoardImages.boardWithPieces(10, 11));
        BoardFrame candidate = BoardImages.frame(BoardImages.boardWithPieces(11, 27));

        assertEquals(engine.compare(candidate, reference, baseline).toString(),
                engine.compare(candidate, reference, baseline).toString());
    }

    @Test
    void rejectsFramesOfDifferentSize() {
        BoardFrame reference = BoardImages.frame(BoardImages.emptyBoard(512, 512));
        BoardFrame candidate = BoardImages.frame(BoardImages.emptyBoard(256, 256));

        assertThrows(IllegalArgumentException.class, () -> engine.compare(candidate, reference, baseline));
    }

    @Test
    void rejectsEvenBlurKernel() {
        assertThrows(IllegalArgumentException.class, () -> new DiffEngine(4, 0));
    }
}
