package ai.cubes.cube.moves;

import ai.cubes.cube.Corner;
import ai.cubes.cube.CornerSlot;
import ai.cubes.cube.Edge;
import ai.cubes.cube.EdgeSlot;
import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable permutation and orientation-delta tables describing one move.
 * <p>
 * Entries are indexed by destination slot. {@code cornerSource(i)} names the slot whose
 * piece ends up in slot {@code i}, and {@code cornerDelta(i)} is the twist added to it on
 * the way. Edges work the same with flip instead of twist.
 * <p>
 * The constructor copies and validates its arrays, so an instance is always well-formed:
 * both permutations are bijections and every delta is within its modulus.
 */
public final class MoveDefinition {
    private final int[] cornerPermutation;
    private final int[] cornerOrientationDelta;
    private final int[] edgePermutation;
    private final int[] edgeOrientationDelta;

    /**
     * @param cornerPermutation source slot for each of the 8 corner slots
     * @param cornerOrientationDelta twist added per corner slot, each in {@code 0..2}
     * @param edgePermutation source slot for each of the 12 edge slots
     * @param edgeOrientationDelta flip added per edge slot, each in {@code 0..1}
     * @throws IllegalArgumentException if any table has the wrong length, is not a
     *         permutation, or holds an out-of-range delta
     */
    public MoveDefinition(
            int[] cornerPermutation,
            int[] cornerOrientationDelta,
            int[] edgePermutation,
            int[] edgeOrientationDelta) {
        this.cornerPermutation = checkPermutation("corner", cornerPermutation, Corner.COUNT);
        this.cornerOrientationDelta = checkDelta("corner", cornerOrientationDelta, Corner.COUNT, CornerSlot.ORIENTATIONS);
        this.edgePermutation = checkPermutation("edge", edgePermutation, Edge.COUNT);
        this.edgeOrientationDelta = checkDelta("edge", edgeOrientationDelta, Edge.COUNT, EdgeSlot.ORIENTATIONS);
    }

    public int cornerSource(int slot) {
        return cornerPermutation[slot];
    }

    public int cornerDelta(int slot) {
        return cornerOrientationDelta[slot];
    }

    public int edgeSource(int slot) {
        return edgePermutation[slot];
    }

    public int edgeDelta(int slot) {
        return edgeOrientationDelta[slot];
    }

    public int[] getCornerPermutation() {
        return cornerPermutation.clone();
    }

    public int[] getCornerOrientationDelta() {
        return cornerOrientationDelta.clone();
    }

    public int[] getEdgePermutation() {
        return edgePermutation.clone();
    }

    public int[] getEdgeOrientationDelta() {
        return edgeOrientationDelta.clone();
    }

    /**
     * Whether applying this definition leaves every slot untouched.
     */
    public boolean isIdentity() {
        for (int i = 0; i < Corner.COUNT; i++) {
            if (cornerPermutation[i] != i || cornerOrientationDelta[i] != 0) {
                return false;
            }
        }
        for (int i = 0; i < Edge.COUNT; i++) {
            if (edgePermutation[i] != i || edgeOrientationDelta[i] != 0) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MoveDefinition)) {
            return false;
        }
        MoveDefinition other = (MoveDefinition) o;
        return Arrays.equals(cornerPermutation, other.cornerPermutation)
                && Arrays.equals(cornerOrientationDelta, other.cornerOrientationDelta)
                && Arrays.equals(edgePermutation, other.edgePermutation)
                && Arrays.equals(edgeOrientationDelta, other.edgeOrientationDelta);
    }

    @Override
    public int hashCode() {
        int h = Arrays.hashCode(cornerPermutation);
        h = 31 * h + Arrays.hashCode(cornerOrientationDelta);
        h = 31 * h + Arrays.hashCode(edgePermutation);
        return 31 * h + Arrays.hashCode(edgeOrientationDelta);
    }

    @Override
    public String toString() {
        return "MoveDefinition(cp=" + Arrays.toString(cornerPermutation)
                + ", co=" + Arrays.toString(cornerOrientationDelta)
                + ", ep=" + Arrays.toString(edgePermutation)
                + ", eo=" + Arrays.toString(edgeOrientationDelta) + ")";
    }

    private static int[] checkPermutation(String kind, int[] table, int size) {
        Objects.requireNonNull(table, kind + " permutation");
        if (table.length != size) {
            throw new IllegalArgumentException(
                    kind + " permutation must have " + size + " entries, got " + table.length);
        }
        boolean[] seen = new boolean[size];
        for (int source : table) {
            if (source < 0 || source >= size || seen[source]) {
                throw new IllegalArgumentException(
                        kind + " permutation is not a permutation of 0.." + (size - 1) + ": " + Arrays.toString(table));
            }
            seen[source] = true;
        }
        return table.clone();
    }

    private static int[] checkDelta(String kind, int[] table, int size, int modulus) {
        Objects.requireNonNull(table, kind + " orientation delta");
        if (table.length != size) {
            throw new IllegalArgumentException(
                    kind + " orientation delta must have " + size + " entries, got " + table.length);
        }
        for (int delta : table) {
            if (delta < 0 || delta >= modulus) {
                throw new IllegalArgumentException(
                        kind + " orientation delta out of range 0.." + (modulus - 1) + ": " + Arrays.toString(table));
            }
        }
        return table.clone();
    }
}
