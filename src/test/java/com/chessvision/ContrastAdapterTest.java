package com.chessvision;

import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ContrastAdapterTest {

    private final DetectorConfig config = DetectorConfig.defaults();
    private final DiffEngine diffEngine = new DiffEngine(config);
    private final MoveCandidateResolver resolver =
            new MoveCandidateResolver(new SquareTable(BoardOrientation.WHITE_AT_BOTTOM), config);

    // e2 (tile 53) moved to e4 (tile 37)
    private final BoardFrame reference = BoardImages.frame(BoardImages.boardWithPieces(53));
    private final BoardFrame candidate = BoardImages.frame(BoardImages.boardWithPieces(37));

    @Test
    void scheduleStartsAtBaselineThenSweepsDownThenUp() {
        List<ContrastSetting> schedule = ContrastAdapter.buildSchedule(config);

        assertEquals(20, schedule.size());
        assertEquals(new ContrastSetting(1.0, 20), schedule.get(0));
        assertEquals(new ContrastSetting(0.9, 40), schedule.get(1));
        assertEquals(new ContrastSetting(0.1, 40), schedule.get(9));
        assertEquals(new ContrastSetting(1.1, 70), schedule.get(10));
        assertEquals(new ContrastSetting(2.0, 70), schedule.get(19));
    }

    @Test
    void gainsAreRoundedToOneDecimal() {
        DetectorConfig quarterSteps = DetectorConfig.parse(new StringReader("{\"gainStep\": 0.25}"));

        List<Double> gains = ContrastAdapter.buildSchedule(quarterSteps).stream()
                .map(ContrastSetting::getGain)
                .collect(Collectors.toList());

        assertEquals(List.of(1.0, 0.8, 0.5, 0.3, 1.3, 1.5, 1.8, 2.0), gains);
    }

    @Test
    void firstLegalMoveWins() {
        ContrastAdapter adapter = new ContrastAdapter(diffEngine, resolver, config);

        ContrastSearchResult result = adapter.search(candidate, reference, new StubOracle("e2e4"), () -> false);

        assertEquals("e2e4", result.getMove().orElseThrow().getMove().getUci());
        assertEquals(1, result.getAttempts());
        assertEquals(ContrastSetting.baseline(20), result.getWinningSetting().orElseThrow());
    }

    @Test
    void exhaustsScheduleWhenNothingIsLegal() {
        ContrastAdapter adapter = new ContrastAdapter(diffEngine, resolver, config.withSweepTimeoutMillis(60_000));

        ContrastSearchResult result = adapter.search(candidate, reference, new StubOracle(), () -> false);

        assertTrue(result.getMove().isEmpty());
        assertTrue(result.getWinningSetting().isEmpty());
        assertEquals(adapter.getIterationCap(), result.getAttempts());
        assertFalse(result.isTimedOut());
        assertFalse(result.isCancelled());
        for (ContrastSetting tried : result.getTried()) {
            assertTrue(tried.getGain() >= ContrastSetting.MIN_GAIN && tried.getGain() <= ContrastSetting.MAX_GAIN);
        }
    }

    @Test
    void laterSettingCanWin() {
        ContrastAdapter adapter = new ContrastAdapter(diffEngine, resolver, config);
        AtomicInteger questions = new AtomicInteger();
        LegalMoveOracle oracle = new StubOracle() {
            @Override
            public synchronized Optional<LegalMove> tryMove(BoardCoordinate origin, BoardCoordinate destination) {
                // two questions per attempt; accept on the third attempt
                if (questions.incrementAndGet() < 5) {
                    return Optional.empty();
                }
                return Optional.of(new LegalMove(origin, destination, origin.toString() + destination, "fen"));
            }
        };

        ContrastSearchResult result = adapter.search(candidate, reference, oracle, () -> false);

        assertEquals(3, result.getAttempts());
        assertEquals(new ContrastSetting(0.8, 40), result.getWinningSetting().orElseThrow());
    }

    @Test
    void stopsWhenCancelled() {
        ContrastAdapter adapter = new ContrastAdapter(diffEngine, resolver, config);
        AtomicInteger checks = new AtomicInteger();

        ContrastSearchResult result = adapter.search(candidate, reference, new StubOracle(),
                () -> checks.incrementAndGet() > 3);

        assertTrue(result.isCancelled());
        assertEquals(3, result.getAttempts());
        assertTrue(result.getMove().isEmpty());
    }

    @Test
    void stopsWhenTimeBudgetIsSpent() {
        AtomicLong nanos = new AtomicLong();
        ContrastAdapter adapter = new ContrastAdapter(diffEngine, resolver, ContrastAdapter.buildSchedule(config),
                1_500, () -> nanos.getAndAdd(1_000_000_000L));

        ContrastSearchResult result = adapter.search(candidate, reference, new StubOracle(), () -> false);

        assertTrue(result.isTimedOut());
        assertEquals(2, result.getAttempts());
    }

    @Test
    void rejectsEmptySchedule() {
        assertThrows(IllegalArgumentException.class,
                () -> new ContrastAdapter(diffEngine, resolver, List.of(), 1000, System::nanoTime));
    }
}
