package ai.cubes.cube.display;

import ai.cubes.cube.CubeState;
import java.util.Objects;

/**
 * Renders a cube as an unfolded net for console display.
 * <p>
 * U sits above F, the middle band reads L F R B, and D sits below F:
 * <pre>
 *       W W W
 *       W W W
 *       W W W
 * O O O G G G R R R B B B
 * O O O G G G R R R B B B
 * O O O G G G R R R B B B
 *       Y Y Y
 *       Y Y Y
 *       Y Y Y
 * </pre>
 * Stickers are shown by colour initial, optionally wrapped in ANSI colour codes.
 */
public class CubeFormatter {
    private static final int U = 0;
    private static final int R = 1;
    private static final int F = 2;
    private static final int D = 3;
    private static final int L = 4;
    private static final int B = 5;
    private static final int[] MIDDLE_BAND = {L, F, R, B};
    private static final String INDENT = "      ";

    private final CubeState state;
    private final boolean colour;

    /**
     * @param state the cube to render; must not be null
     * @param colour whether to emit ANSI colour codes
     */
    public CubeFormatter(CubeState state, boolean colour) {
        this.state = Objects.requireNonNull(state, "state");
        this.colour = colour;
    }

    public String format() {
        StickerColor[] facelets = FaceletProjector.project(state);
        StringBuilder sb = new StringBuilder();
        appendFace(sb, facelets, U);
        for (int row = 0; row < 3; row++) {
            for (int i = 0; i < MIDDLE_BAND.length; i++) {
                if (i > 0) {
                    sb.append(' ');
                }
                appendRow(sb, facelets, MIDDLE_BAND[i], row);
            }
            sb.append('\n');
        }
        appendFace(sb, facelets, D);
        return sb.toString();
    }

    private void appendFace(StringBuilder sb, StickerColor[] facelets, int face) {
        for (int row = 0; row < 3; row++) {
            sb.append(INDENT);
            appendRow(sb, facelets, face, row);
            sb.append('\n');
        }
    }

    private void appendRow(StringBuilder sb, StickerColor[] facelets, int face, int row) {
        for (int col = 0; col < 3; col++) {
            if (col > 0) {
                sb.append(' ');
            }
            StickerColor sticker = facelets[9 * face + 3 * row + col];
            if (colour) {
                sb.append(sticker.toColoredString());
            } else {
                sb.append(sticker.getInitial());
            }
        }
    }
}
