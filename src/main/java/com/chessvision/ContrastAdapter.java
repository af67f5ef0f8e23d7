package com.chessvision;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.BooleanSupplier;
import java.util.function.LongSupplier;

/**
 * Retries move resolution under different contrast gains.
 * <p>
 * The attempt schedule is fixed at construction: the baseline gain first, then
 * gains below the baseline going down to {@link ContrastSetting#MIN_GAIN}, then
 * gains above it going up to {@link ContrastSetting#MAX_GAIN}. The first legal
 * move wins.
 */
public class ContrastAdapter {

    private static final Logger log = LoggerFactory.getLogger(ContrastAdapter.class);

    private final DiffEngine diffEngine;
    private final MoveCandidateResolver resolver;
    private final List<ContrastSetting> schedule;
    private final long timeoutMillis;
    private final LongSupplier nanoClock;

    public ContrastAdapter(DiffEngine diffEngine, MoveCandidateResolver resolver, DetectorConfig config) {
        this(diffEngine, resolver, buildSchedule(config), config.getSweepTimeoutMillis(), System::nanoTime);
    }

    ContrastAdapter(DiffEngine diffEngine, MoveCandidateResolver resolver, List<ContrastSetting> schedule,
                    long timeoutMillis, LongSupplier nanoClock) {
        if (schedule.isEmpty()) {
            throw new IllegalArgumentException("Contrast schedule is empty");
        }
        this.diffEngine = diffEngine;
        this.resolver = resolver;
        this.schedule = Collections.unmodifiableList(new ArrayList<>(schedule));
        this.timeoutMillis = timeoutMillis;
        this.nanoClock = nanoClock;
    }

    /**
     * Baseline, then downward from baseline-step to the minimum, then upward from
     * baseline+step to the maximum. Gains are rounded to one decimal.
     */
    static List<ContrastSetting> buildSchedule(DetectorConfig config) {
        List<ContrastSetting> settings = new ArrayList<>();
        settings.add(ContrastSetting.baseline(config.getBaselineThreshold()));

        double step = config.getGainStep();
        int stepsDown = (int) Math.floor((ContrastSetting.BASELINE_GAIN - ContrastSetting.MIN_GAIN) / step + 1e-9);
        for (int i = 1; i <= stepsDown; i++) {
            settings.add(new ContrastSetting(round(ContrastSetting.BASELINE_GAIN - i * step), config.getLowGainThreshold()));
        }
        int stepsUp = (int) Math.floor((ContrastSetting.MAX_GAIN - ContrastSetting.BASELINE_GAIN) / step + 1e-9);
        for (int i = 1; i <= stepsUp; i++) {
            settings.add(new ContrastSetting(round(ContrastSetting.BASELINE_GAIN + i * step), config.getHighGainThreshold()));
        }
        return settings;
    }

    private static double round(double gain) {
        double rounded = Math.round(gain * 10.0) / 10.0;
        return Math.max(ContrastSetting.MIN_GAIN, Math.min(ContrastSetting.MAX_GAIN, rounded));
    }

    public List<ContrastSetting> getSchedule() {
        return schedule;
    }

    /** Upper bound on resolver invocations per search. */
    public int getIterationCap() {
        return schedule.size();
    }

    /**
     * Walks the schedule until a legal move is found, the schedule ends, the
     * time budget runs out, or {@code cancelled} reports true. Both signals are
     * checked before every attempt.
     */
    public ContrastSearchResult search(BoardFrame candidate, BoardFrame reference,
                                       LegalMoveOracle oracle, BooleanSupplier cancelled) {
        long started = nanoClock.getAsLong();
        long budgetNanos = timeoutMillis * 1_000_000L;
        List<ContrastSetting> tried = new ArrayList<>();

        for (ContrastSetting setting : schedule) {
            if (cancelled.getAsBoolean()) {
                log.info("Contrast search cancelled after {} attempts", tried.size());
                return new ContrastSearchResult(null, null, tried, true, false);
            }
            if (!tried.isEmpty() && nanoClock.getAsLong() - started > budgetNanos) {
                log.warn("Contrast search timed out after {} attempts ({} ms)", tried.size(), timeoutMillis);
                return new ContrastSearchResult(null, null, tried, false, true);
            }

            tried.add(setting);
            List<SquareDifference> differences = diffEngine.compare(candidate, reference, setting);
            log.debug("Attempt {} at {}: top squares {}", tried.size(), setting, differences.subList(0, 2));

            Optional<ResolvedMove> resolved = resolver.resolve(differences, oracle);
            if (resolved.isPresent()) {
                if (tried.size() > 1) {
                    log.info("Move {} found after contrast adjustment at {}", resolved.get(), setting);
                }
                return new ContrastSearchResult(resolved.get(), setting, tried, false, false);
            }
        }

        log.info("No legal move after {} contrast settings", tried.size());
        return new ContrastSearchResult(null, null, tried, false, false);
    }
}
