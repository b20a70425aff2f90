package ai.cubes.cube.moves;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The 18 outer-layer turns in Singmaster notation.
 *
 * <p>This is the single canonical representation of a move. Text tokens ({@code "R"},
 * {@code "R'"}, {@code "R2"}) map to exactly one constant through {@link #token()} and
 * {@link #tryParse(String)}, so there is only one lookup path from input to move table.
 */
public enum Move {
    U(Face.U, Turn.CLOCKWISE),
    U_PRIME(Face.U, Turn.COUNTER_CLOCKWISE),
    U2(Face.U, Turn.DOUBLE),
    D(Face.D, Turn.CLOCKWISE),
    D_PRIME(Face.D, Turn.COUNTER_CLOCKWISE),
    D2(Face.D, Turn.DOUBLE),
    R(Face.R, Turn.CLOCKWISE),
    R_PRIME(Face.R, Turn.COUNTER_CLOCKWISE),
    R2(Face.R, Turn.DOUBLE),
    L(Face.L, Turn.CLOCKWISE),
    L_PRIME(Face.L, Turn.COUNTER_CLOCKWISE),
    L2(Face.L, Turn.DOUBLE),
    F(Face.F, Turn.CLOCKWISE),
    F_PRIME(Face.F, Turn.COUNTER_CLOCKWISE),
    F2(Face.F, Turn.DOUBLE),
    B(Face.B, Turn.CLOCKWISE),
    B_PRIME(Face.B, Turn.COUNTER_CLOCKWISE),
    B2(Face.B, Turn.DOUBLE);

    private static final Map<String, Move> BY_TOKEN = indexByToken();
    private static final Map<Face, Map<Turn, Move>> BY_FACE = indexByFace();
    private static final List<Move> ALL = List.of(values());

    private final Face face;
    private final Turn turn;

    Move(Face face, Turn turn) {
        this.face = face;
        this.turn = turn;
    }

    public Face face() {
        return face;
    }

    public Turn turn() {
        return turn;
    }

    /**
     * Returns the Singmaster token for this move, e.g. {@code R}, {@code R'} or {@code R2}.
     */
    public String token() {
        return face.letter() + turn.suffix();
    }

    /**
     * Whether this is one of the six hand-authored clockwise quarter turns.
     */
    public boolean isBaseTurn() {
        return turn == Turn.CLOCKWISE;
    }

    /**
     * Returns the move that undoes this one on the same face.
     */
    public Move inverse() {
        return of(face, turn.inverse());
    }

    /**
     * Returns the move turning {@code face} by {@code turn}.
     */
    public static Move of(Face face, Turn turn) {
        Objects.requireNonNull(face, "face");
        Objects.requireNonNull(turn, "turn");
        return BY_FACE.get(face).get(turn);
    }

    /**
     * Returns all 18 moves in declaration order as an immutable list.
     */
    public static List<Move> all() {
        return ALL;
    }

    /**
     * Resolves an exact Singmaster token.
     *
     * @param token the token, matched case-sensitively with no surrounding whitespace
     * @return the move, or {@code null} if the token is not one of the 18 names
     */
    public static Move tryParse(String token) {
        if (token == null) {
            return null;
        }
        return BY_TOKEN.get(token);
    }

    @Override
    public String toString() {
        return token();
    }

    private static Map<String, Move> indexByToken() {
        Map<String, Move> index = new HashMap<>();
        for (Move move : values()) {
            index.put(move.token(), move);
        }
        return Collections.unmodifiableMap(index);
    }

    private static Map<Face, Map<Turn, Move>> indexByFace() {
        Map<Face, Map<Turn, Move>> index = new EnumMap<>(Face.class);
        for (Move move : values()) {
            index.computeIfAbsent(move.face, f -> new EnumMap<>(Turn.class)).put(move.turn, move);
        }
        return index;
    }
}
