package com.chessvision;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Rules state of the game on the physical board: piece placement, side to move,
 * castling rights, en passant target and move clocks.
 * Acts as the {@link LegalMoveOracle} for move detection.
 */
public class ChessGameTracker implements LegalMoveOracle {

    private static final Logger log = LoggerFactory.getLogger(ChessGameTracker.class);

    public static final String START_FEN = "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1";

    // Piece constants
    public static final int EMPTY = 0;
    public static final int W_PAWN = 1, W_KNIGHT = 2, W_BISHOP = 3;
    public static final int W_ROOK = 4, W_QUEEN = 5, W_KING = 6;
    public static final int B_PAWN = -1, B_KNIGHT = -2, B_BISHOP = -3;
    public static final int B_ROOK = -4, B_QUEEN = -5, B_KING = -6;

    // board[rank][file], rank 0 = rank 1
    private final int[][] board = new int[8][8];
    private boolean whiteToMove;
    private boolean castleWhiteKingside, castleWhiteQueenside;
    private boolean castleBlackKingside, castleBlackQueenside;
    private int[] enPassantTarget;
    private int halfmoveClock;
    private int fullmoveNumber;
    private final List<String> moveHistory = new ArrayList<>();
    // Occurrences per position (placement, side, castling, en passant)
    private final Map<String, Integer> positionCounts = new HashMap<>();

    public ChessGameTracker() {
        loadFen(START_FEN);
    }

    public static ChessGameTracker fromFen(String fen) {
        ChessGameTracker tracker = new ChessGameTracker();
        tracker.loadFen(fen);
        return tracker;
    }

    private ChessGameTracker(ChessGameTracker other) {
        for (int r = 0; r < 8; r++) System.arraycopy(other.board[r], 0, board[r], 0, 8);
        whiteToMove = other.whiteToMove;
        castleWhiteKingside = other.castleWhiteKingside;
        castleWhiteQueenside = other.castleWhiteQueenside;
        castleBlackKingside = other.castleBlackKingside;
        castleBlackQueenside = other.castleBlackQueenside;
        enPassantTarget = other.enPassantTarget == null ? null : other.enPassantTarget.clone();
        halfmoveClock = other.halfmoveClock;
        fullmoveNumber = other.fullmoveNumber;
        moveHistory.addAll(other.moveHistory);
        positionCounts.putAll(other.positionCounts);
    }

    public synchronized void reset() {
        loadFen(START_FEN);
        log.info("Game reset to start position");
    }

    // ---------------------------------------------------------------- oracle

    @Override
    public synchronized Optional<LegalMove> tryMove(BoardCoordinate origin, BoardCoordinate destination) {
        int[] from = {origin.getRank(), origin.getFile()};
        int[] to = {destination.getRank(), destination.getFile()};
        if (!isLegal(from, to)) {
            return Optional.empty();
        }
        ChessGameTracker after = new ChessGameTracker(this);
        String uci = after.executeMove(from, to);
        return Optional.of(new LegalMove(origin, destination, uci, after.getFEN()));
    }

    @Override
    public synchronized void apply(LegalMove move) {
        int[] from = {move.getOrigin().getRank(), move.getOrigin().getFile()};
        int[] to = {move.getDestination().getRank(), move.getDestination().getFile()};
        if (!isLegal(from, to)) {
            throw new IllegalArgumentException("Move " + move.getUci() + " is not legal in " + getFEN());
        }
        String uci = executeMove(from, to);
        log.info("Move played: {} -> {}", uci, getFEN());
        if (log.isDebugEnabled()) {
            log.debug("Board after {}:{}", uci, boardToString());
        }
    }

    /**
     * Plays a move given in UCI notation, as produced by an engine.
     * Promotions always become a queen.
     */
    public synchronized LegalMove applyUci(String uci) {
        if (uci == null || uci.length() < 4) {
            throw new IllegalArgumentException("Not a UCI move: " + uci);
        }
        BoardCoordinate origin = BoardCoordinate.parse(uci.substring(0, 2));
        BoardCoordinate destination = BoardCoordinate.parse(uci.substring(2, 4));
        LegalMove move = tryMove(origin, destination)
                .orElseThrow(() -> new IllegalArgumentException("Move " + uci + " is not legal in " + getFEN()));
        apply(move);
        return move;
    }

    @Override
    public synchronized String fen() {
        return getFEN();
    }

    // ---------------------------------------------------------------- status

    public synchronized GameStatus status() {
        boolean inCheck = isKingInCheck(whiteToMove);
        boolean canMove = hasAnyLegalMove();
        if (!canMove) {
            return inCheck ? GameStatus.CHECKMATE : GameStatus.STALEMATE;
        }
        if (halfmoveClock >= 100) return GameStatus.FIFTY_MOVE_DRAW;
        if (positionCounts.getOrDefault(positionKey(), 0) >= 3) return GameStatus.THREEFOLD_REPETITION;
        if (isInsufficientMaterial()) return GameStatus.INSUFFICIENT_MATERIAL;
        return inCheck ? GameStatus.CHECK : GameStatus.ONGOING;
    }

    public synchronized boolean isWhiteToMove() {
        return whiteToMove;
    }

    public synchronized List<String> getMoveHistory() {
        return Collections.unmodifiableList(new ArrayList<>(moveHistory));
    }

    /** Copy of the board, indexed [rank][file]. */
    public synchronized int[][] getBoardArray() {
        int[][] copy = new int[8][8];
        for (int r = 0; r < 8; r++) System.arraycopy(board[r], 0, copy[r], 0, 8);
        return copy;
    }

    public synchronized int pieceAt(BoardCoordinate square) {
        return board[square.getRank()][square.getFile()];
    }

    // ---------------------------------------------------------------- legality

    private boolean isLegal(int[] from, int[] to) {
        if (Arrays.equals(from, to)) return false;
        int piece = board[from[0]][from[1]];
        if (piece == EMPTY || !isCorrectColor(piece)) return false;

        boolean pseudoLegal;
        if (isCastlingAttempt(piece, from, to)) {
            pseudoLegal = canCastle(from, to);
        } else if (isEnPassantAttempt(piece, from, to)) {
            pseudoLegal = true;
        } else {
            pseudoLegal = canPieceMoveGeometry(piece, from, to, board[to[0]][to[1]]);
        }
        if (!pseudoLegal) return false;

        // Simulate and reject anything that leaves the mover's king attacked
        ChessGameTracker after = new ChessGameTracker(this);
        after.executeMove(from, to);
        return !after.isKingInCheck(whiteToMove);
    }

    private boolean hasAnyLegalMove() {
        for (int r = 0; r < 8; r++) {
            for (int c = 0; c < 8; c++) {
                int p = board[r][c];
                if (p == EMPTY || !isCorrectColor(p)) continue;
                for (int tr = 0; tr < 8; tr++) {
                    for (int tc = 0; tc < 8; tc++) {
                        if (isLegal(new int[]{r, c}, new int[]{tr, tc})) return true;
                    }
                }
            }
        }
        return false;
    }

    private boolean isCastlingAttempt(int piece, int[] from, int[] to) {
        int homeRank = piece > 0 ? 0 : 7;
        return Math.abs(piece) == W_KING && from[0] == homeRank && from[1] == 4
                && to[0] == homeRank && Math.abs(to[1] - from[1]) == 2;
    }

    private boolean canCastle(int[] from, int[] to) {
        int rank = from[0];
        boolean kingside = to[1] == 6;
        boolean right = whiteToMove
                ? (kingside ? castleWhiteKingside : castleWhiteQueenside)
                : (kingside ? castleBlackKingside : castleBlackQueenside);
        if (!right) return false;

        int rook = whiteToMove ? W_ROOK : B_ROOK;
        if (board[rank][kingside ? 7 : 0] != rook) return false;
        int[] between = kingside ? new int[]{5, 6} : new int[]{1, 2, 3};
        for (int file : between) {
            if (board[rank][file] != EMPTY) return false;
        }

        // King may not castle out of, through, or into check
        boolean byWhite = !whiteToMove;
        int step = kingside ? 1 : -1;
        for (int file = 4; file != to[1] + step; file += step) {
            if (isSquareAttacked(rank, file, byWhite)) return false;
        }
        return true;
    }

    private boolean isEnPassantAttempt(int piece, int[] from, int[] to) {
        if (Math.abs(piece) != W_PAWN || enPassantTarget == null) return false;
        int dir = piece > 0 ? 1 : -1;
        return to[0] == enPassantTarget[0] && to[1] == enPassantTarget[1]
                && to[0] - from[0] == dir && Math.abs(to[1] - from[1]) == 1;
    }

    /**
     * Checks if the King of the given color is currently under attack.
     */
    private boolean isKingInCheck(boolean whiteKing) {
        int kingVal = whiteKing ? W_KING : B_KING;
        for (int r = 0; r < 8; r++) {
            for (int c = 0; c < 8; c++) {
                if (board[r][c] == kingVal) {
                    return isSquareAttacked(r, c, !whiteKing);
                }
            }
        }
        return false;
    }

    private boolean isSquareAttacked(int rank, int file, boolean byWhite) {
        int[] target = {rank, file};
        for (int r = 0; r < 8; r++) {
            for (int c = 0; c < 8; c++) {
                int p = board[r][c];
                if (p != EMPTY && (p > 0) == byWhite && canPieceAttack(p, new int[]{r, c}, target)) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Attack geometry only; ignores whose turn it is.
     */
    private boolean canPieceAttack(int piece, int[] from, int[] to) {
        int rankDiff = to[0] - from[0];
        int fileDiff = to[1] - from[1];
        boolean isWhite = piece > 0;

        if (Math.abs(piece) == W_PAWN) {
            int dir = isWhite ? 1 : -1;
            return rankDiff == dir && Math.abs(fileDiff) == 1;
        }
        // Dummy enemy target so the capture rule applies
        return canPieceMoveGeometry(piece, from, to, isWhite ? B_PAWN : W_PAWN);
    }

    private boolean canPieceMoveGeometry(int piece, int[] from, int[] to, int targetPiece) {
        int fromRank = from[0], fromFile = from[1];
        int rankDiff = to[0] - fromRank;
        int fileDiff = to[1] - fromFile;
        boolean isWhite = piece > 0;

        if (rankDiff == 0 && fileDiff == 0) return false;
        // Cannot land on own piece
        if (targetPiece != EMPTY && (targetPiece > 0) == isWhite) return false;

        switch (Math.abs(piece)) {
            case 1: // Pawn
                int dir = isWhite ? 1 : -1;
                if (fileDiff == 0 && rankDiff == dir && targetPiece == EMPTY) return true;
                if (fileDiff == 0 && fromRank == (isWhite ? 1 : 6) && rankDiff == 2 * dir
                        && targetPiece == EMPTY && board[fromRank + dir][fromFile] == EMPTY) return true;
                return Math.abs(fileDiff) == 1 && rankDiff == dir && targetPiece != EMPTY;
            case 2: // Knight
                return (Math.abs(rankDiff) == 2 && Math.abs(fileDiff) == 1) || (Math.abs(rankDiff) == 1 && Math.abs(fileDiff) == 2);
            case 3: // Bishop
                return Math.abs(rankDiff) == Math.abs(fileDiff) && isPathClear(from, to);
            case 4: // Rook
                return (rankDiff == 0 || fileDiff == 0) && isPathClear(from, to);
            case 5: // Queen
                return (rankDiff == 0 || fileDiff == 0 || Math.abs(rankDiff) == Math.abs(fileDiff)) && isPathClear(from, to);
            case 6: // King
                return Math.abs(rankDiff) <= 1 && Math.abs(fileDiff) <= 1;
            default:
                return false;
        }
    }

    private boolean isPathClear(int[] from, int[] to) {
        int rStep = Integer.compare(to[0] - from[0], 0);
        int cStep = Integer.compare(to[1] - from[1], 0);
        int r = from[0] + rStep, c = from[1] + cStep;
        while (r != to[0] || c != to[1]) {
            if (board[r][c] != EMPTY) return false;
            r += rStep;
            c += cStep;
        }
        return true;
    }

    private boolean isInsufficientMaterial() {
        int minors = 0;
        for (int r = 0; r < 8; r++) {
            for (int c = 0; c < 8; c++) {
                int abs = Math.abs(board[r][c]);
                if (abs == W_PAWN || abs == W_ROOK || abs == W_QUEEN) return false;
                if (abs == W_KNIGHT || abs == W_BISHOP) minors++;
            }
        }
        return minors <= 1;
    }

    private boolean isCorrectColor(int p) {
        return whiteToMove ? p > 0 : p < 0;
    }

    // ---------------------------------------------------------------- execution

    /**
     * Moves pieces without legality checks and returns the UCI string.
     */
    private String executeMove(int[] from, int[] to) {
        int piece = board[from[0]][from[1]];
        int captured = board[to[0]][to[1]];
        String promotion = "";

        if (isCastlingAttempt(piece, from, to)) {
            int rank = from[0];
            boolean kingside = to[1] == 6;
            int rook = board[rank][kingside ? 7 : 0];
            board[rank][kingside ? 7 : 0] = EMPTY;
            board[rank][kingside ? 5 : 3] = rook;
        } else if (isEnPassantAttempt(piece, from, to)) {
            board[from[0]][to[1]] = EMPTY;
            captured = piece > 0 ? B_PAWN : W_PAWN;
        }

        // Auto-promote to Queen
        int placed = piece;
        if (Math.abs(piece) == W_PAWN && (to[0] == 0 || to[0] == 7)) {
            promotion = "q";
            placed = piece > 0 ? W_QUEEN : B_QUEEN;
        }

        board[to[0]][to[1]] = placed;
        board[from[0]][from[1]] = EMPTY;

        if (Math.abs(piece) == W_PAWN && Math.abs(to[0] - from[0]) == 2) {
            enPassantTarget = new int[]{(from[0] + to[0]) / 2, from[1]};
        } else {
            enPassantTarget = null;
        }

        updateCastlingRights(piece, from, to);

        halfmoveClock = (Math.abs(piece) == W_PAWN || captured != EMPTY) ? 0 : halfmoveClock + 1;
        if (!whiteToMove) fullmoveNumber++;
        whiteToMove = !whiteToMove;

        String uci = coordsToSquare(from) + coordsToSquare(to) + promotion;
        moveHistory.add(uci);
        recordPosition();
        return uci;
    }

    private void recordPosition() {
        positionCounts.merge(positionKey(), 1, Integer::sum);
    }

    private String positionKey() {
        String[] fields = getFEN().split(" ");
        return fields[0] + ' ' + fields[1] + ' ' + fields[2] + ' ' + fields[3];
    }

    private void updateCastlingRights(int piece, int[] from, int[] to) {
        if (piece == W_KING) { castleWhiteKingside = false; castleWhiteQueenside = false; }
        if (piece == B_KING) { castleBlackKingside = false; castleBlackQueenside = false; }
        // A rook leaving or being captured on its home square
        for (int[] sq : new int[][]{from, to}) {
            if (sq[0] == 0 && sq[1] == 0) castleWhiteQueenside = false;
            if (sq[0] == 0 && sq[1] == 7) castleWhiteKingside = false;
            if (sq[0] == 7 && sq[1] == 0) castleBlackQueenside = false;
            if (sq[0] == 7 && sq[1] == 7) castleBlackKingside = false;
        }
    }

    // ---------------------------------------------------------------- FEN

    private void loadFen(String fen) {
        String[] parts = fen.trim().split("\\s+");
        if (parts.length < 4) {
            throw new IllegalArgumentException("Not a FEN: " + fen);
        }
        for (int[] row : board) Arrays.fill(row, EMPTY);

        String[] ranks = parts[0].split("/");
        if (ranks.length != 8) {
            throw new IllegalArgumentException("FEN needs 8 ranks: " + fen);
        }
        for (int i = 0; i < 8; i++) {
            int rank = 7 - i;
            int file = 0;
            for (char ch : ranks[i].toCharArray()) {
                if (Character.isDigit(ch)) {
                    file += ch - '0';
                } else {
                    if (file > 7) throw new IllegalArgumentException("FEN rank overflow: " + ranks[i]);
                    board[rank][file++] = fenToPiece(ch);
                }
            }
            if (file != 8) throw new IllegalArgumentException("FEN rank has " + file + " files: " + ranks[i]);
        }

        whiteToMove = parts[1].equals("w");
        castleWhiteKingside = parts[2].contains("K");
        castleWhiteQueenside = parts[2].contains("Q");
        castleBlackKingside = parts[2].contains("k");
        castleBlackQueenside = parts[2].contains("q");
        enPassantTarget = parts[3].equals("-") ? null : squareToCoords(parts[3]);
        halfmoveClock = parts.length > 4 ? Integer.parseInt(parts[4]) : 0;
        fullmoveNumber = parts.length > 5 ? Integer.parseInt(parts[5]) : 1;
        moveHistory.clear();
        positionCounts.clear();
        recordPosition();
    }

    public synchronized String getFEN() {
        StringBuilder fen = new StringBuilder();
        for (int rank = 7; rank >= 0; rank--) {
            int emptyCount = 0;
            for (int file = 0; file < 8; file++) {
                int piece = board[rank][file];
                if (piece == EMPTY) {
                    emptyCount++;
                } else {
                    if (emptyCount > 0) { fen.append(emptyCount); emptyCount = 0; }
                    fen.append(pieceToFEN(piece));
                }
            }
            if (emptyCount > 0) fen.append(emptyCount);
            if (rank > 0) fen.append('/');
        }
        fen.append(whiteToMove ? " w " : " b ");
        String castling = getCastlingRights();
        fen.append(castling.isEmpty() ? "-" : castling).append(' ');
        fen.append(enPassantTarget == null ? "-" : coordsToSquare(enPassantTarget)).append(' ');
        fen.append(halfmoveClock).append(' ').append(fullmoveNumber);
        return fen.toString();
    }

    private String getCastlingRights() {
        StringBuilder rights = new StringBuilder();
        if (castleWhiteKingside) rights.append('K');
        if (castleWhiteQueenside) rights.append('Q');
        if (castleBlackKingside) rights.append('k');
        if (castleBlackQueenside) rights.append('q');
        return rights.toString();
    }

    private static char pieceToFEN(int piece) {
        char c = switch (Math.abs(piece)) {
            case 1 -> 'p'; case 2 -> 'n'; case 3 -> 'b';
            case 4 -> 'r'; case 5 -> 'q'; case 6 -> 'k';
            default -> ' ';
        };
        return piece > 0 ? Character.toUpperCase(c) : c;
    }

    private static int fenToPiece(char ch) {
        int abs = switch (Character.toLowerCase(ch)) {
            case 'p' -> W_PAWN; case 'n' -> W_KNIGHT; case 'b' -> W_BISHOP;
            case 'r' -> W_ROOK; case 'q' -> W_QUEEN; case 'k' -> W_KING;
            default -> throw new IllegalArgumentException("Unknown FEN piece: " + ch);
        };
        return Character.isUpperCase(ch) ? abs : -abs;
    }

    private static int[] squareToCoords(String square) {
        BoardCoordinate c = BoardCoordinate.parse(square);
        return new int[]{c.getRank(), c.getFile()};
    }

    private static String coordsToSquare(int[] coords) {
        return new BoardCoordinate(coords[1], coords[0]).toString();
    }

    public synchronized String boardToString() {
        StringBuilder sb = new StringBuilder("\n  a b c d e f g h\n");
        for (int rank = 7; rank >= 0; rank--) {
            sb.append(rank + 1).append('|');
            for (int file = 0; file < 8; file++) {
                sb.append(pieceToChar(board[rank][file])).append(' ');
            }
            sb.append('|').append(rank + 1).append('\n');
        }
        return sb.append("  a b c d e f g h").toString();
    }

    private static char pieceToChar(int piece) {
        if (piece == EMPTY) return '.';
        char c = Character.toUpperCase(pieceToFEN(piece));
        return piece > 0 ? c : Character.toLowerCase(c);
    }
}
