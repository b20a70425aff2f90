package ai.cubes.cube.moves;

import static ai.cubes.cube.Corner.DBL;
import static ai.cubes.cube.Corner.DFR;
import static ai.cubes.cube.Corner.DLF;
import static ai.cubes.cube.Corner.DRB;
import static ai.cubes.cube.Corner.UBR;
import static ai.cubes.cube.Corner.UFL;
import static ai.cubes.cube.Corner.ULB;
import static ai.cubes.cube.Corner.URF;
import static ai.cubes.cube.Edge.BL;
import static ai.cubes.cube.Edge.BR;
import static ai.cubes.cube.Edge.DB;
import static ai.cubes.cube.Edge.DF;
import static ai.cubes.cube.Edge.DL;
import static ai.cubes.cube.Edge.DR;
import static ai.cubes.cube.Edge.FL;
import static ai.cubes.cube.Edge.FR;
import static ai.cubes.cube.Edge.UB;
import static ai.cubes.cube.Edge.UF;
import static ai.cubes.cube.Edge.UL;
import static ai.cubes.cube.Edge.UR;

import ai.cubes.cube.Corner;
import ai.cubes.cube.Edge;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable registry mapping each of the 18 {@link Move}s to its {@link MoveDefinition}.
 *
 * <p>Only the six clockwise quarter turns are written out below. Each one lists, per
 * destination slot, the slot its piece comes from and the orientation change picked up on
 * the way. The half and counter-clockwise turns are derived from them with
 * {@link MoveComposer#derive(MoveDefinition, int)}, so the six base tables stay the single
 * source of truth.
 *
 * <p>A table never changes after construction and may be shared freely between threads.
 * {@link #standard()} returns a process-wide instance built on first use; callers that want
 * to own their table (a Spring context, a test) can call {@link #build()} instead.
 */
public final class MoveTable {
    private static final Logger log = LoggerFactory.getLogger(MoveTable.class);

    private final Map<Move, MoveDefinition> definitions;

    private MoveTable(Map<Move, MoveDefinition> definitions) {
        this.definitions = Collections.unmodifiableMap(definitions);
    }

    /**
     * Returns the shared table.
     * <p>
     * The table is built exactly once, on the first call, by JVM class initialisation of a
     * holder class. Concurrent first callers all observe the same fully populated instance,
     * and later calls return it without further work.
     */
    public static MoveTable standard() {
        return Holder.INSTANCE;
    }

    /**
     * Builds a new, independent table from the base quarter turns.
     */
    public static MoveTable build() {
        Map<Move, MoveDefinition> definitions = new EnumMap<>(Move.class);
        for (Face face : Face.values()) {
            MoveDefinition base = baseTurn(face);
            for (Turn turn : Turn.values()) {
                MoveDefinition definition = turn == Turn.CLOCKWISE
                        ? base
                        : MoveComposer.derive(base, turn.quarterTurns());
                definitions.put(Move.of(face, turn), definition);
            }
        }
        if (log.isDebugEnabled()) {
            log.debug("Built move table with {} definitions", definitions.size());
        }
        return new MoveTable(definitions);
    }

    /**
     * Returns the definition of {@code move}. Never fails for a non-null move.
     */
    public MoveDefinition lookup(Move move) {
        Objects.requireNonNull(move, "move");
        return definitions.get(move);
    }

    /**
     * Returns the definition named by an exact Singmaster token.
     *
     * @throws InvalidMoveException if the token is not one of the 18 canonical names
     */
    public MoveDefinition lookup(String token) {
        Move move = Move.tryParse(token);
        if (move == null) {
            throw InvalidMoveException.forToken(token);
        }
        return definitions.get(move);
    }

    /**
     * Number of definitions held; always 18.
     */
    public int size() {
        return definitions.size();
    }

    /**
     * Read-only view of every entry, in {@link Move} declaration order.
     */
    public Map<Move, MoveDefinition> asMap() {
        return definitions;
    }

    /**
     * Returns the hand-authored clockwise quarter turn of {@code face}.
     */
    static MoveDefinition baseTurn(Face face) {
        return switch (face) {
            case U -> new MoveDefinition(
                    corners(UBR, URF, UFL, ULB, DFR, DLF, DBL, DRB),
                    new int[]{0, 0, 0, 0, 0, 0, 0, 0},
                    edges(UB, UR, UF, UL, DR, DF, DL, DB, FR, FL, BL, BR),
                    new int[]{0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0});
            case D -> new MoveDefinition(
                    corners(URF, UFL, ULB, UBR, DLF, DBL, DRB, DFR),
                    new int[]{0, 0, 0, 0, 0, 0, 0, 0},
                    edges(UR, UF, UL, UB, DF, DL, DB, DR, FR, FL, BL, BR),
                    new int[]{0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0});
            case R -> new MoveDefinition(
                    corners(DFR, UFL, ULB, URF, DRB, DLF, DBL, UBR),
                    new int[]{2, 0, 0, 1, 1, 0, 0, 2},
                    edges(FR, UF, UL, UB, BR, DF, DL, DB, DR, FL, BL, UR),
                    new int[]{0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0});
            case L -> new MoveDefinition(
                    corners(URF, ULB, DBL, UBR, DFR, UFL, DLF, DRB),
                    new int[]{0, 1, 2, 0, 0, 2, 1, 0},
                    edges(UR, UF, BL, UB, DR, DF, FL, DB, FR, UL, DL, BR),
                    new int[]{0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0});
            case F -> new MoveDefinition(
                    corners(UFL, DLF, ULB, UBR, URF, DFR, DBL, DRB),
                    new int[]{1, 2, 0, 0, 2, 1, 0, 0},
                    edges(UR, FL, UL, UB, DR, FR, DL, DB, UF, DF, BL, BR),
                    new int[]{0, 1, 0, 0, 0, 1, 0, 0, 1, 1, 0, 0});
            case B -> new MoveDefinition(
                    corners(URF, UFL, UBR, DRB, DFR, DLF, ULB, DBL),
                    new int[]{0, 0, 1, 2, 0, 0, 2, 1},
                    edges(UR, UF, UL, BR, DR, DF, DL, BL, FR, FL, UB, DB),
                    new int[]{0, 0, 0, 1, 0, 0, 0, 1, 0, 0, 1, 1});
        };
    }

    private static int[] corners(Corner... sources) {
        int[] table = new int[sources.length];
        for (int i = 0; i < sources.length; i++) {
            table[i] = sources[i].ordinal();
        }
        return table;
    }

    private static int[] edges(Edge... sources) {
        int[] table = new int[sources.length];
        for (int i = 0; i < sources.length; i++) {
            table[i] = sources[i].ordinal();
        }
        return table;
    }

    private static final class Holder {
        private static final MoveTable INSTANCE = build();
    }
}
