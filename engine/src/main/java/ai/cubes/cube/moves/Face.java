package ai.cubes.cube.moves;

/**
 * The six outer layers that can be turned.
 * <p>
 * The declaration order fixes the numeric face index accepted by
 * {@link ai.cubes.cube.CubeState#rotate(int, int)}: U=0, D=1, R=2, L=3, F=4, B=5.
 */
public enum Face {
    /** Up. */
    U,
    /** Down. */
    D,
    /** Right. */
    R,
    /** Left. */
    L,
    /** Front. */
    F,
    /** Back. */
    B;

    /**
     * Returns the face with the given numeric index.
     *
     * @param index face index in {@code 0..5}
     * @return the matching face
     * @throws InvalidMoveException if the index is out of range
     */
    public static Face fromIndex(int index) {
        Face[] faces = values();
        if (index < 0 || index >= faces.length) {
            throw new InvalidMoveException("Face index out of range: " + index);
        }
        return faces[index];
    }

    /**
     * Returns the Singmaster letter of this face.
     */
    public String letter() {
        return name();
    }
}
