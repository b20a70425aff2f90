package ai.cubes.cube.moves;

import ai.cubes.cube.Corner;
import ai.cubes.cube.CornerSlot;
import ai.cubes.cube.Edge;
import ai.cubes.cube.EdgeSlot;
import java.util.List;
import java.util.Objects;

/**
 * Builds move definitions by simulating moves on a solved reference cube.
 *
 * <p>Starting from solved, slot {@code i} initially holds piece {@code i} with orientation 0.
 * After applying any sequence of definitions, the piece found in slot {@code i} is exactly the
 * composed permutation's source for {@code i}, and its accumulated orientation is the composed
 * delta. Reading the simulated cube back therefore yields the composed definition directly,
 * with no composition algebra written by hand.
 */
public final class MoveComposer {
    private MoveComposer() {
    }

    /**
     * Returns the definition equivalent to applying {@code base} {@code repetitions} times.
     * <p>
     * Two repetitions of a quarter turn give the half turn; three give the counter-clockwise
     * quarter turn, since a face turn has order four.
     *
     * @param base the definition to repeat
     * @param repetitions how many times to apply it; must be at least 1
     * @return the derived definition
     * @throws IllegalArgumentException if {@code repetitions} is less than 1
     */
    public static MoveDefinition derive(MoveDefinition base, int repetitions) {
        Objects.requireNonNull(base, "base");
        if (repetitions < 1) {
            throw new IllegalArgumentException("repetitions must be at least 1, got " + repetitions);
        }
        CornerSlot[] corners = CornerSlot.solvedArray();
        EdgeSlot[] edges = EdgeSlot.solvedArray();
        for (int i = 0; i < repetitions; i++) {
            corners = MoveApplicator.applyCorners(corners, base);
            edges = MoveApplicator.applyEdges(edges, base);
        }
        return readOff(corners, edges);
    }

    /**
     * Returns the single definition equivalent to applying {@code first} then {@code second}.
     */
    public static MoveDefinition compose(MoveDefinition first, MoveDefinition second) {
        return composeAll(List.of(first, second));
    }

    /**
     * Returns the single definition equivalent to applying every definition in order.
     * An empty list yields the identity.
     */
    public static MoveDefinition composeAll(List<MoveDefinition> definitions) {
        Objects.requireNonNull(definitions, "definitions");
        CornerSlot[] corners = CornerSlot.solvedArray();
        EdgeSlot[] edges = EdgeSlot.solvedArray();
        for (MoveDefinition definition : definitions) {
            Objects.requireNonNull(definition, "definition");
            corners = MoveApplicator.applyCorners(corners, definition);
            edges = MoveApplicator.applyEdges(edges, definition);
        }
        return readOff(corners, edges);
    }

    private static MoveDefinition readOff(CornerSlot[] corners, EdgeSlot[] edges) {
        int[] cp = new int[Corner.COUNT];
        int[] co = new int[Corner.COUNT];
        for (int i = 0; i < Corner.COUNT; i++) {
            cp[i] = corners[i].pieceIndex();
            co[i] = corners[i].orientation();
        }
        int[] ep = new int[Edge.COUNT];
        int[] eo = new int[Edge.COUNT];
        for (int i = 0; i < Edge.COUNT; i++) {
            ep[i] = edges[i].pieceIndex();
            eo[i] = edges[i].orientation();
        }
        return new MoveDefinition(cp, co, ep, eo);
    }
}
