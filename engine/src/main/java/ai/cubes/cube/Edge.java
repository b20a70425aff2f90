package ai.cubes.cube;

/**
 * The twelve edge slots in the cube's fixed reference frame.
 * <p>
 * The ordinal is the slot index used by {@link CubeState} and every move table.
 * The first named face is the reference side for edge flip.
 */
public enum Edge {
    UR, UF, UL, UB, DR, DF, DL, DB, FR, FL, BL, BR;

    /** Number of edge slots. */
    public static final int COUNT = 12;
}
