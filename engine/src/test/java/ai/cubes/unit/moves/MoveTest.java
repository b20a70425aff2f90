package ai.cubes.unit.moves;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;

import ai.cubes.cube.moves.Face;
import ai.cubes.cube.moves.Move;
import ai.cubes.cube.moves.Turn;
import java.util.HashSet;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Move")
class MoveTest {

    @Nested
    @DisplayName("Tokens")
    class TokenTests {

        @Test
        void tokensAreUniqueAndRoundTrip() {
            Set<String> tokens = new HashSet<>();
            for (Move move : Move.all()) {
                tokens.add(move.token());
                assertSame(move, Move.tryParse(move.token()));
            }
            assertEquals(18, tokens.size());
        }

        @Test
        void tokenShapes() {
            assertEquals("R", Move.R.token());
            assertEquals("R'", Move.R_PRIME.token());
            assertEquals("R2", Move.R2.token());
            assertEquals("B'", Move.B_PRIME.toString());
        }

        @Test
        void unknownTokensParseToNull() {
            assertNull(Move.tryParse(null));
            assertNull(Move.tryParse("r"));
            assertNull(Move.tryParse("R'2"));
            assertNull(Move.tryParse("U_PRIME"));
        }
    }

    @Nested
    @DisplayName("Structure")
    class StructureTests {

        @Test
        void ofFindsEveryCombination() {
            for (Face face : Face.values()) {
                for (Turn turn : Turn.values()) {
                    Move move = Move.of(face, turn);
                    assertSame(face, move.face());
                    assertSame(turn, move.turn());
                }
            }
        }

        @Test
        void inversePairs() {
            assertSame(Move.U_PRIME, Move.U.inverse());
            assertSame(Move.U, Move.U_PRIME.inverse());
            assertSame(Move.D2, Move.D2.inverse());
            for (Move move : Move.all()) {
                assertSame(move, move.inverse().inverse());
            }
        }

        @Test
        void faceIndicesFollowDeclarationOrder() {
            assertSame(Face.U, Face.fromIndex(0));
            assertSame(Face.D, Face.fromIndex(1));
            assertSame(Face.R, Face.fromIndex(2));
            assertSame(Face.L, Face.fromIndex(3));
            assertSame(Face.F, Face.fromIndex(4));
            assertSame(Face.B, Face.fromIndex(5));
        }

        @Test
        void turnQuarterCounts() {
            assertEquals(1, Turn.CLOCKWISE.quarterTurns());
            assertEquals(2, Turn.DOUBLE.quarterTurns());
            assertEquals(3, Turn.COUNTER_CLOCKWISE.quarterTurns());
        }
    }
}
