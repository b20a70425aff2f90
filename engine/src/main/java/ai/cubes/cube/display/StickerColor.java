package ai.cubes.cube.display;

/**
 * Sticker colours of a standard cube, one per face in solved position.
 * <p>
 * Each colour carries the face letter it belongs to when solved and an ANSI escape code for
 * terminal display. Declaration order follows facelet order: U, R, F, D, L, B.
 */
public enum StickerColor {
    /** Up face. */
    WHITE('U', 'W', "\u001B[97m"),
    /** Right face. */
    RED('R', 'R', "\u001B[31m"),
    /** Front face. */
    GREEN('F', 'G', "\u001B[32m"),
    /** Down face. */
    YELLOW('D', 'Y', "\u001B[93m"),
    /** Left face. */
    ORANGE('L', 'O', "\u001B[38;5;208m"),
    /** Back face. */
    BLUE('B', 'B', "\u001B[34m");

    /** ANSI escape code to reset text formatting in terminals. */
    private static final String ANSI_RESET = "\u001B[0m";

    private final char faceLetter;
    private final char initial;
    private final String ansi;

    StickerColor(char faceLetter, char initial, String ansi) {
        this.faceLetter = faceLetter;
        this.initial = initial;
        this.ansi = ansi;
    }

    /**
     * Returns the letter of the face this colour sits on when solved (e.g. {@code U} for white).
     */
    public char getFaceLetter() {
        return faceLetter;
    }

    /**
     * Returns the first letter of the colour name (e.g. {@code W} for white).
     */
    public char getInitial() {
        return initial;
    }

    /**
     * Returns the colour initial wrapped in this colour's ANSI codes.
     */
    public String toColoredString() {
        return ansi + initial + ANSI_RESET;
    }
}
