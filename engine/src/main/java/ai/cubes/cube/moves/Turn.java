package ai.cubes.cube.moves;

/**
 * Amount by which a face is turned, with its Singmaster suffix.
 * <p>
 * Each turn is expressed as a number of clockwise quarter turns, which is how the
 * double and counter-clockwise tables are derived from the base quarter turn.
 */
public enum Turn {
    /** 90 degrees clockwise, no suffix. */
    CLOCKWISE("", 1),
    /** 90 degrees counter-clockwise, suffix {@code '}. */
    COUNTER_CLOCKWISE("'", 3),
    /** 180 degrees, suffix {@code 2}. */
    DOUBLE("2", 2);

    /** Quarter-turn order of a face turn. */
    public static final int QUARTER_TURNS_PER_REVOLUTION = 4;

    private final String suffix;
    private final int quarterTurns;

    Turn(String suffix, int quarterTurns) {
        this.suffix = suffix;
        this.quarterTurns = quarterTurns;
    }

    public String suffix() {
        return suffix;
    }

    /**
     * Returns how many clockwise quarter turns this turn is equivalent to (1, 2 or 3).
     */
    public int quarterTurns() {
        return quarterTurns;
    }

    /**
     * Returns the turn that cancels this one.
     */
    public Turn inverse() {
        return switch (this) {
            case CLOCKWISE -> COUNTER_CLOCKWISE;
            case COUNTER_CLOCKWISE -> CLOCKWISE;
            case DOUBLE -> DOUBLE;
        };
    }

    /**
     * Maps a numeric direction to a turn: {@code 1} clockwise, {@code -1} counter-clockwise,
     * {@code 2} or {@code -2} half turn.
     *
     * @throws InvalidMoveException for any other value
     */
    public static Turn fromDirection(int direction) {
        return switch (direction) {
            case 1 -> CLOCKWISE;
            case -1 -> COUNTER_CLOCKWISE;
            case 2, -2 -> DOUBLE;
            default -> throw new InvalidMoveException("Unsupported turn direction: " + direction);
        };
    }
}
