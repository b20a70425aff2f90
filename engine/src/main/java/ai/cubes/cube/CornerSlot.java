package ai.cubes.cube;

/**
 * Contents of one of the eight corner slots.
 *
 * @param pieceIndex which corner piece (0..7) occupies the slot
 * @param orientation twist of that piece relative to solved alignment (0..2)
 */
public record CornerSlot(int pieceIndex, int orientation) {
    /** Number of twist states a corner piece can be in. */
    public static final int ORIENTATIONS = 3;

    public CornerSlot {
        if (pieceIndex < 0 || pieceIndex >= Corner.COUNT) {
            throw new IllegalArgumentException("Invalid corner piece " + pieceIndex);
        }
        if (orientation < 0 || orientation >= ORIENTATIONS) {
            throw new IllegalArgumentException("Invalid corner orientation " + orientation);
        }
    }

    /**
     * Returns a fresh array of Corner.COUNT slots where slot i holds piece i with orientation 0.
     */
    public static CornerSlot[] solvedArray() {
        CornerSlot[] slots = new CornerSlot[Corner.COUNT];
        for (int i = 0; i < slots.length; i++) {
            slots[i] = new CornerSlot(i, 0);
        }
        return slots;
    }

    @Override
    public String toString() {
        return "(" + pieceIndex + "," + orientation + ")";
    }
}
