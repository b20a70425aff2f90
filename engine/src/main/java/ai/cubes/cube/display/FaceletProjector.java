package ai.cubes.cube.display;

import static ai.cubes.cube.display.StickerColor.BLUE;
import static ai.cubes.cube.display.StickerColor.GREEN;
import static ai.cubes.cube.display.StickerColor.ORANGE;
import static ai.cubes.cube.display.StickerColor.RED;
import static ai.cubes.cube.display.StickerColor.WHITE;
import static ai.cubes.cube.display.StickerColor.YELLOW;

import ai.cubes.cube.Corner;
import ai.cubes.cube.CornerSlot;
import ai.cubes.cube.CubeState;
import ai.cubes.cube.Edge;
import ai.cubes.cube.EdgeSlot;
import java.util.Objects;

/**
 * Derives the 54 visible sticker colours from a piece-level {@link CubeState}.
 *
 * <p><b>Facelet layout:</b> six faces in the order U, R, F, D, L, B, nine stickers each, read
 * row by row as the face is seen from outside the cube with U above F (for U: B edge on top;
 * for D: F edge on top; for L, F, R, B: U edge on top). Index {@code 9 * face + 4} is a centre
 * and never moves.
 *
 * <p><b>Projection:</b> for a corner slot holding piece {@code p} with twist {@code t}, the
 * sticker at the slot's facelet {@code (n + t) mod 3} shows colour {@code n} of piece {@code p}.
 * Edges work the same with flip modulo 2. Facelet and colour lists start at the U or D sticker
 * for corners and follow the slot names for edges, matching the orientation convention of the
 * move tables.
 */
public final class FaceletProjector {
    /** Number of stickers on the cube. */
    public static final int FACELET_COUNT = 54;

    private static final int[][] CORNER_FACELETS = {
            {8, 9, 20},   // URF
            {6, 18, 38},  // UFL
            {0, 36, 47},  // ULB
            {2, 45, 11},  // UBR
            {29, 26, 15}, // DFR
            {27, 44, 24}, // DLF
            {33, 53, 42}, // DBL
            {35, 17, 51}  // DRB
    };

    private static final StickerColor[][] CORNER_COLORS = {
            {WHITE, RED, GREEN},
            {WHITE, GREEN, ORANGE},
            {WHITE, ORANGE, BLUE},
            {WHITE, BLUE, RED},
            {YELLOW, GREEN, RED},
            {YELLOW, ORANGE, GREEN},
            {YELLOW, BLUE, ORANGE},
            {YELLOW, RED, BLUE}
    };

    private static final int[][] EDGE_FACELETS = {
            {5, 10},  // UR
            {7, 19},  // UF
            {3, 37},  // UL
            {1, 46},  // UB
            {32, 16}, // DR
            {28, 25}, // DF
            {30, 43}, // DL
            {34, 52}, // DB
            {23, 12}, // FR
            {21, 41}, // FL
            {50, 39}, // BL
            {48, 14}  // BR
    };

    private static final StickerColor[][] EDGE_COLORS = {
            {WHITE, RED},
            {WHITE, GREEN},
            {WHITE, ORANGE},
            {WHITE, BLUE},
            {YELLOW, RED},
            {YELLOW, GREEN},
            {YELLOW, ORANGE},
            {YELLOW, BLUE},
            {GREEN, RED},
            {GREEN, ORANGE},
            {BLUE, ORANGE},
            {BLUE, RED}
    };

    private FaceletProjector() {
    }

    /**
     * Returns the colour of every sticker, indexed as described in the class documentation.
     */
    public static StickerColor[] project(CubeState state) {
        Objects.requireNonNull(state, "state");
        StickerColor[] facelets = new StickerColor[FACELET_COUNT];
        StickerColor[] faces = StickerColor.values();
        for (int face = 0; face < faces.length; face++) {
            facelets[9 * face + 4] = faces[face];
        }

        CornerSlot[] corners = state.getCorners();
        for (int i = 0; i < Corner.COUNT; i++) {
            int piece = corners[i].pieceIndex();
            int twist = corners[i].orientation();
            for (int n = 0; n < CornerSlot.ORIENTATIONS; n++) {
                facelets[CORNER_FACELETS[i][(n + twist) % CornerSlot.ORIENTATIONS]] = CORNER_COLORS[piece][n];
            }
        }

        EdgeSlot[] edges = state.getEdges();
        for (int i = 0; i < Edge.COUNT; i++) {
            int piece = edges[i].pieceIndex();
            int flip = edges[i].orientation();
            for (int n = 0; n < EdgeSlot.ORIENTATIONS; n++) {
                facelets[EDGE_FACELETS[i][(n + flip) % EdgeSlot.ORIENTATIONS]] = EDGE_COLORS[piece][n];
            }
        }
        return facelets;
    }

    /**
     * Returns the 54-character face string, each sticker written as the letter of the face
     * whose colour it shows. A solved cube gives
     * {@code UUUUUUUUURRRRRRRRRFFFFFFFFFDDDDDDDDDLLLLLLLLLBBBBBBBBB}.
     */
    public static String toFaceletString(CubeState state) {
        StringBuilder sb = new StringBuilder(FACELET_COUNT);
        for (StickerColor color : project(state)) {
            sb.append(color.getFaceLetter());
        }
        return sb.toString();
    }
}
