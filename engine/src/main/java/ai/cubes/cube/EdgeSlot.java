package ai.cubes.cube;

/**
 * Contents of one of the twelve edge slots.
 *
 * @param pieceIndex which edge piece (0..11) occupies the slot
 * @param orientation flip of that piece relative to solved alignment (0..1)
 */
public record EdgeSlot(int pieceIndex, int orientation) {
    /** Number of flip states an edge piece can be in. */
    public static final int ORIENTATIONS = 2;

    public EdgeSlot {
        if (pieceIndex < 0 || pieceIndex >= Edge.COUNT) {
            throw new IllegalArgumentException("Invalid edge piece " + pieceIndex);
        }
        if (orientation < 0 || orientation >= ORIENTATIONS) {
            throw new IllegalArgumentException("Invalid edge orientation " + orientation);
        }
    }

    /**
     * Returns a fresh array of Edge.COUNT slots where slot i holds piece i with orientation 0.
     */
    public static EdgeSlot[] solvedArray() {
        EdgeSlot[] slots = new EdgeSlot[Edge.COUNT];
        for (int i = 0; i < slots.length; i++) {
            slots[i] = new EdgeSlot(i, 0);
        }
        return slots;
    }

    @Override
    public String toString() {
        return "(" + pieceIndex + "," + orientation + ")";
    }
}
