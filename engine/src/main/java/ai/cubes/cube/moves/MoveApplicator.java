package ai.cubes.cube.moves;

import ai.cubes.cube.Corner;
import ai.cubes.cube.CornerSlot;
import ai.cubes.cube.Edge;
import ai.cubes.cube.EdgeSlot;

/**
 * Applies a {@link MoveDefinition} to slot arrays.
 * <p>
 * Application is a pull: new slot {@code i} takes the piece found in the source slot the
 * definition names for {@code i}, with the definition's delta added to its orientation
 * modulo 3 (corners) or 2 (edges). The input arrays are only read; results are written to
 * fresh arrays so that no slot is read after it has been overwritten.
 */
public final class MoveApplicator {
    private MoveApplicator() {
    }

    /**
     * Returns the corner slots after applying {@code definition} to {@code corners}.
     */
    public static CornerSlot[] applyCorners(CornerSlot[] corners, MoveDefinition definition) {
        CornerSlot[] next = new CornerSlot[Corner.COUNT];
        for (int i = 0; i < Corner.COUNT; i++) {
            CornerSlot source = corners[definition.cornerSource(i)];
            int orientation = (source.orientation() + definition.cornerDelta(i)) % CornerSlot.ORIENTATIONS;
            next[i] = new CornerSlot(source.pieceIndex(), orientation);
        }
        return next;
    }

    /**
     * Returns the edge slots after applying {@code definition} to {@code edges}.
     */
    public static EdgeSlot[] applyEdges(EdgeSlot[] edges, MoveDefinition definition) {
        EdgeSlot[] next = new EdgeSlot[Edge.COUNT];
        for (int i = 0; i < Edge.COUNT; i++) {
            EdgeSlot source = edges[definition.edgeSource(i)];
            int orientation = (source.orientation() + definition.edgeDelta(i)) % EdgeSlot.ORIENTATIONS;
            next[i] = new EdgeSlot(source.pieceIndex(), orientation);
        }
        return next;
    }
}
