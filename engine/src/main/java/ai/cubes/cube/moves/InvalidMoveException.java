package ai.cubes.cube.moves;

/**
 * Thrown when a move token or numeric face/direction pair does not name one of the
 * 18 outer-layer turns.
 */
public class InvalidMoveException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    public InvalidMoveException(String message) {
        super(message);
    }

    /**
     * Builds the exception reported for an unrecognised token.
     *
     * @param token the offending text (may be null)
     * @return the exception to throw
     */
    public static InvalidMoveException forToken(String token) {
        return new InvalidMoveException("Unrecognised move: '" + token + "'");
    }
}
