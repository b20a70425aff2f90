package ai.cubes.cube;

/**
 * The eight corner slots in the cube's fixed reference frame.
 * <p>
 * Each name lists the faces the slot touches, starting with its U or D face and continuing
 * clockwise. The ordinal is the slot index used by {@link CubeState} and every move table,
 * and the same index identifies the piece that belongs there when the cube is solved.
 */
public enum Corner {
    URF, UFL, ULB, UBR, DFR, DLF, DBL, DRB;

    /** Number of corner slots. */
    public static final int COUNT = 8;
}
