package com.chessvision;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Picks the two most changed squares and asks the oracle whether either
 * direction between them is a legal move.
 * <p>
 * Only the top two squares are ever considered. Lighting artifacts that light
 * up more than two squares can therefore hide a real move; the contrast sweep
 * is the only recovery.
 */
public class MoveCandidateResolver {

    private static final Logger log = LoggerFactory.getLogger(MoveCandidateResolver.class);

    private volatile SquareTable squareTable;
    private final double noiseFloor;

    public MoveCandidateResolver(SquareTable squareTable, double noiseFloor) {
        this.squareTable = squareTable;
        this.noiseFloor = noiseFloor;
    }

    public MoveCandidateResolver(SquareTable squareTable, DetectorConfig config) {
        this(squareTable, config.getNoiseFloor());
    }

    /**
     * @param differences all 64 squares of one comparison, in any order
     * @return the legal move, or empty when no ordering of the top two squares is legal
     */
    public Optional<ResolvedMove> resolve(List<SquareDifference> differences, LegalMoveOracle oracle) {
        if (differences.size() < 2) {
            throw new IllegalArgumentException("Need at least two squares, got " + differences.size());
        }
        List<SquareDifference> ranked = new ArrayList<>(differences);
        ranked.sort(SquareDifference.BY_MAGNITUDE);
        SquareDifference top = ranked.get(0);
        SquareDifference second = ranked.get(1);

        if (top.getMagnitude() < noiseFloor) {
            log.debug("Strongest change {} is below noise floor {}", top, noiseFloor);
            return Optional.empty();
        }

        SquareTable table = squareTable;
        // Change gives no direction; try the weaker square as origin first
        MoveCandidate first = new MoveCandidate(second, top);
        for (MoveCandidate candidate : List.of(first, first.reversed())) {
            BoardCoordinate origin = table.coordinate(candidate.getOrigin().getSquareIndex());
            BoardCoordinate destination = table.coordinate(candidate.getDestination().getSquareIndex());
            Optional<LegalMove> legal = oracle.tryMove(origin, destination);
            if (legal.isPresent()) {
                return Optional.of(new ResolvedMove(candidate, legal.get()));
            }
            log.debug("Oracle rejected {}{} from {}", origin, destination, candidate);
        }
        return Optional.empty();
    }

    public SquareTable getSquareTable() {
        return squareTable;
    }

    public void setSquareTable(SquareTable squareTable) {
        if (squareTable == null) {
            throw new IllegalArgumentException("squareTable is required");
        }
        this.squareTable = squareTable;
    }
}
