package ai.cubes.unit.helpers;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.cubes.cube.Corner;
import ai.cubes.cube.CornerSlot;
import ai.cubes.cube.CubeState;
import ai.cubes.cube.Edge;
import ai.cubes.cube.EdgeSlot;
import ai.cubes.cube.Scrambler;
import ai.cubes.cube.moves.MoveTable;

/**
 * Shared assertions and factories for cube tests.
 */
public final class CubeTestHelper {
    private CubeTestHelper() {
    }

    /**
     * Solved cube using the shared table and a scrambler seeded with {@code seed}.
     */
    public static CubeState seededCube(long seed) {
        return new CubeState(MoveTable.standard(), Scrambler.seeded(seed));
    }

    /**
     * Asserts that corner and edge piece indices are permutations and every orientation is in range.
     */
    public static void assertWellFormed(CubeState cube) {
        CornerSlot[] corners = cube.getCorners();
        assertEquals(Corner.COUNT, corners.length);
        boolean[] seenCorners = new boolean[Corner.COUNT];
        for (CornerSlot slot : corners) {
            assertTrue(!seenCorners[slot.pieceIndex()], "corner piece repeated: " + cube);
            seenCorners[slot.pieceIndex()] = true;
            assertTrue(slot.orientation() >= 0 && slot.orientation() <= 2, "corner twist out of range: " + cube);
        }

        EdgeSlot[] edges = cube.getEdges();
        assertEquals(Edge.COUNT, edges.length);
        boolean[] seenEdges = new boolean[Edge.COUNT];
        for (EdgeSlot slot : edges) {
            assertTrue(!seenEdges[slot.pieceIndex()], "edge piece repeated: " + cube);
            seenEdges[slot.pieceIndex()] = true;
            assertTrue(slot.orientation() >= 0 && slot.orientation() <= 1, "edge flip out of range: " + cube);
        }
    }

    /**
     * Sum of corner twists modulo 3 and of edge flips modulo 2; both are 0 for every reachable state.
     */
    public static int[] orientationParity(CubeState cube) {
        int twist = 0;
        for (CornerSlot slot : cube.getCorners()) {
            twist += slot.orientation();
        }
        int flip = 0;
        for (EdgeSlot slot : cube.getEdges()) {
            flip += slot.orientation();
        }
        return new int[]{twist % 3, flip % 2};
    }
}
