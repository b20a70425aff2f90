package ai.cubes.cube;

import ai.cubes.cube.moves.Face;
import ai.cubes.cube.moves.Move;
import ai.cubes.cube.moves.MoveApplicator;
import ai.cubes.cube.moves.MoveDefinition;
import ai.cubes.cube.moves.MoveTable;
import ai.cubes.cube.moves.Turn;
import ai.cubes.cube.notation.NotationParser;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Piece-level (cubie) model of a 3×3×3 cube.
 * <p>
 * The whole state is one array of 8 corner slots and one array of 12 edge slots. Each slot
 * records which piece sits there and how it is twisted or flipped relative to solved. A new
 * cube is solved: slot {@code i} holds piece {@code i} with orientation 0.
 * <p>
 * <strong>Moves:</strong> every move replaces both arrays with freshly computed ones (see
 * {@link MoveApplicator}), so permutations and orientation ranges are preserved by
 * construction. Text input is accepted in Singmaster notation; an unknown token raises
 * {@link ai.cubes.cube.moves.InvalidMoveException} before anything is applied for that token.
 * <p>
 * <strong>Threading:</strong> instances are not thread-safe. Use one cube per thread or guard it
 * externally. The {@link MoveTable} a cube reads from is immutable and can be shared.
 */
public class CubeState {
    private static final Logger log = LoggerFactory.getLogger(CubeState.class);
    private static final long[] STATE_ZOBRIST = initStateZobrist();
    private static final int CORNER_KEYS = Corner.COUNT * Corner.COUNT * CornerSlot.ORIENTATIONS;

    private final MoveTable moveTable;
    private final Scrambler scrambler;

    private CornerSlot[] corners;
    private EdgeSlot[] edges;

    /**
     * Creates a solved cube using the shared move table and an unseeded scrambler.
     */
    public CubeState() {
        this(MoveTable.standard(), new Scrambler());
    }

    /**
     * Creates a solved cube.
     *
     * @param moveTable the move definitions to apply; must not be null
     * @param scrambler the source of random moves for {@link #scramble(int)}; must not be null
     */
    public CubeState(MoveTable moveTable, Scrambler scrambler) {
        this.moveTable = Objects.requireNonNull(moveTable, "moveTable");
        this.scrambler = Objects.requireNonNull(scrambler, "scrambler");
        reset();
    }

    /**
     * Restores the solved state.
     */
    public final void reset() {
        corners = CornerSlot.solvedArray();
        edges = EdgeSlot.solvedArray();
    }

    /**
     * Whether every slot holds its own piece with orientation 0.
     */
    public boolean isSolved() {
        for (int i = 0; i < corners.length; i++) {
            if (corners[i].pieceIndex() != i || corners[i].orientation() != 0) {
                return false;
            }
        }
        for (int i = 0; i < edges.length; i++) {
            if (edges[i].pieceIndex() != i || edges[i].orientation() != 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * Applies one move given as a Singmaster token.
     *
     * @throws ai.cubes.cube.moves.InvalidMoveException if the token is not one of the 18 names;
     *         the cube is left unchanged
     */
    public void applyMove(String token) {
        applyDefinition(moveTable.lookup(token));
    }

    /**
     * Applies one move. Never fails.
     */
    public void applyMove(Move move) {
        applyDefinition(moveTable.lookup(move));
    }

    /**
     * Applies each move in order.
     */
    public void applyMoves(List<Move> moves) {
        for (Move move : moves) {
            applyMove(move);
        }
    }

    /**
     * Applies a whitespace-separated sequence of tokens, strictly left to right.
     * <p>
     * This is not transactional: if a token is invalid, the moves before it stay applied and
     * the exception propagates. Take a {@link #copy()} first to be able to roll back.
     *
     * @throws ai.cubes.cube.moves.InvalidMoveException at the first unrecognised token
     */
    public void applyMoves(String sequence) {
        for (String token : NotationParser.tokenize(sequence)) {
            applyMove(token);
        }
    }

    /**
     * Turns a face given by number.
     *
     * @param face face index: U=0, D=1, R=2, L=3, F=4, B=5
     * @param direction {@code 1} clockwise, {@code -1} counter-clockwise, {@code 2} or
     *        {@code -2} half turn
     * @throws ai.cubes.cube.moves.InvalidMoveException if either argument is out of range; the
     *         cube is left unchanged
     */
    public void rotate(int face, int direction) {
        Move move = Move.of(Face.fromIndex(face), Turn.fromDirection(direction));
        if (log.isDebugEnabled()) {
            log.debug("rotate({}, {}) -> {}", face, direction, move);
        }
        applyMove(move);
    }

    /**
     * Applies {@link Scrambler#DEFAULT_LENGTH} random moves.
     *
     * @return the applied moves as tokens joined by single spaces
     */
    public String scramble() {
        return scramble(Scrambler.DEFAULT_LENGTH);
    }

    /**
     * Applies {@code length} random moves.
     *
     * @param length number of moves; zero or negative leaves the cube unchanged
     * @return the applied moves as tokens joined by single spaces (empty if none)
     */
    public String scramble(int length) {
        return NotationParser.format(scrambler.scramble(this, length));
    }

    /**
     * Returns an independent cube with the same slots, move table and scrambler.
     */
    public CubeState copy() {
        CubeState clone = new CubeState(moveTable, scrambler);
        clone.corners = corners.clone();
        clone.edges = edges.clone();
        return clone;
    }

    /**
     * Returns a snapshot of the 8 corner slots.
     */
    public CornerSlot[] getCorners() {
        return corners.clone();
    }

    /**
     * Returns a snapshot of the 12 edge slots.
     */
    public EdgeSlot[] getEdges() {
        return edges.clone();
    }

    public CornerSlot getCorner(Corner slot) {
        return corners[slot.ordinal()];
    }

    public EdgeSlot getEdge(Edge slot) {
        return edges[slot.ordinal()];
    }

    /**
     * Returns a 64-bit Zobrist key of the slot contents.
     * <p>
     * Equal states always have equal keys; different states collide only by chance. Intended for
     * visited-state sets and transposition tables.
     */
    public long getStateKey() {
        long h = 0L;
        for (int i = 0; i < corners.length; i++) {
            CornerSlot slot = corners[i];
            h ^= STATE_ZOBRIST[(i * Corner.COUNT + slot.pieceIndex()) * CornerSlot.ORIENTATIONS + slot.orientation()];
        }
        for (int i = 0; i < edges.length; i++) {
            EdgeSlot slot = edges[i];
            h ^= STATE_ZOBRIST[CORNER_KEYS + (i * Edge.COUNT + slot.pieceIndex()) * EdgeSlot.ORIENTATIONS + slot.orientation()];
        }
        return h;
    }

    private void applyDefinition(MoveDefinition definition) {
        // Both arrays are computed from the old state before either is replaced.
        CornerSlot[] nextCorners = MoveApplicator.applyCorners(corners, definition);
        EdgeSlot[] nextEdges = MoveApplicator.applyEdges(edges, definition);
        corners = nextCorners;
        edges = nextEdges;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CubeState)) {
            return false;
        }
        CubeState other = (CubeState) o;
        return Arrays.equals(corners, other.corners) && Arrays.equals(edges, other.edges);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(corners) + Arrays.hashCode(edges);
    }

    /**
     * Diagnostic dump of every slot as {@code (piece,orientation)}, corners then edges.
     * <p>
     * Example for a solved cube:
     * {@code corners=[(0,0) (1,0) ... (7,0)] edges=[(0,0) ... (11,0)]}
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("corners=[");
        for (int i = 0; i < corners.length; i++) {
            if (i > 0) {
                sb.append(' ');
            }
            sb.append(corners[i]);
        }
        sb.append("] edges=[");
        for (int i = 0; i < edges.length; i++) {
            if (i > 0) {
                sb.append(' ');
            }
            sb.append(edges[i]);
        }
        return sb.append(']').toString();
    }

    /**
     * Fills the Zobrist table with xorshift values from a fixed seed, so keys are stable
     * across runs. One entry per (slot, piece, orientation) for corners, then for edges.
     */
    private static long[] initStateZobrist() {
        int size = Corner.COUNT * Corner.COUNT * CornerSlot.ORIENTATIONS
                + Edge.COUNT * Edge.COUNT * EdgeSlot.ORIENTATIONS;
        long[] table = new long[size];
        long seed = 0x9E3779B97F4A7C15L;
        for (int i = 0; i < size; i++) {
            seed ^= (seed << 7);
            seed ^= (seed >>> 9);
            seed ^= (seed << 8);
            table[i] = seed;
        }
        return table;
    }
}
