package com.chessvision;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class MoveCandidateResolverTest {

    private final MoveCandidateResolver resolver =
            new MoveCandidateResolver(new SquareTable(BoardOrientation.WHITE_AT_BOTTOM), 20.0);

    // Tile 53 is e2 and tile 37 is e4 with white at the bottom
    private static List<SquareDifference> scores(int first, double firstMagnitude, int second, double secondMagnitude) {
        List<SquareDifference> all = new ArrayList<>();
        for (int i = 1; i <= 64; i++) {
            double magnitude = i == first ? firstMagnitude : i == second ? secondMagnitude : 1.0;
            all.add(new SquareDifference(i, magnitude));
        }
        return all;
    }

    @Test
    void resolvesWhenOriginChangedLess() {
        StubOracle oracle = new StubOracle("e2e4");

        Optional<ResolvedMove> move = resolver.resolve(scores(37, 90, 53, 60), oracle);

        assertTrue(move.isPresent());
        assertEquals("e2e4", move.get().getMove().getUci());
        assertEquals(53, move.get().getCandidate().getOrigin().getSquareIndex());
        assertEquals(List.of("e2e4"), oracle.asked);
    }

    @Test
    void triesReverseOrderingWhenFirstIsIllegal() {
        StubOracle oracle = new StubOracle("e2e4");

        Optional<ResolvedMove> move = resolver.resolve(scores(53, 90, 37, 60), oracle);

        assertTrue(move.isPresent());
        assertEquals("e2e4", move.get().getMove().getUci());
        assertEquals(List.of("e4e2", "e2e4"), oracle.asked);
    }

    @Test
    void emptyWhenNeitherOrderingIsLegal() {
        StubOracle oracle = new StubOracle();

        assertTrue(resolver.resolve(scores(53, 90, 37, 60), oracle).isEmpty());
        assertEquals(2, oracle.asked.size());
    }

    @Test
    void equalMagnitudesBreakTiesByLowerIndex() {
        StubOracle oracle = new StubOracle();

        resolver.resolve(scores(53, 70, 37, 70), oracle);

        // top is 37 (lower index), so 53 is tried as origin first
        assertEquals(List.of("e2e4", "e4e2"), oracle.asked);
    }

    @Test
    void changesBelowNoiseFloorAreIgnored() {
        StubOracle oracle = new StubOracle("e2e4");

        assertTrue(resolver.resolve(scores(37, 15, 53, 12), oracle).isEmpty());
        assertTrue(oracle.asked.isEmpty());
    }

    @Test
    void orientationChangeRemapsSquares() {
        MoveCandidateResolver flipped =
                new MoveCandidateResolver(new SquareTable(BoardOrientation.WHITE_AT_BOTTOM), 20.0);
        flipped.setSquareTable(new SquareTable(BoardOrientation.BLACK_AT_BOTTOM));
        StubOracle oracle = new StubOracle("d7d5");

        // With black at the bottom, d7 is tile 53 and d5 is tile 37
        Optional<ResolvedMove> move = flipped.resolve(scores(37, 90, 53, 60), oracle);

        assertEquals("d7d5", move.orElseThrow().getMove().getUci());
    }
}
