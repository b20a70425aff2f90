package ai.cubes.unit.moves;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.cubes.cube.CubeState;
import ai.cubes.cube.Scrambler;
import ai.cubes.cube.moves.Move;
import ai.cubes.cube.moves.MoveComposer;
import ai.cubes.cube.moves.MoveDefinition;
import ai.cubes.cube.moves.MoveTable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("MoveComposer")
class MoveComposerTest {
    private final MoveTable table = MoveTable.standard();

    @Test
    void deriveOnceReturnsEquivalentDefinition() {
        MoveDefinition r = table.lookup(Move.R);
        assertEquals(r, MoveComposer.derive(r, 1));
    }

    @Test
    void deriveFourTimesIsIdentity() {
        for (Move move : Move.all()) {
            assertTrue(MoveComposer.derive(table.lookup(move), 4).isIdentity(), move.token());
        }
    }

    @Test
    void deriveTwiceOfHalfTurnIsIdentity() {
        assertTrue(MoveComposer.derive(table.lookup(Move.L2), 2).isIdentity());
        assertFalse(MoveComposer.derive(table.lookup(Move.L), 2).isIdentity());
    }

    @Test
    void deriveRejectsNonPositiveRepetitions() {
        assertThrows(IllegalArgumentException.class, () -> MoveComposer.derive(table.lookup(Move.U), 0));
    }

    @Test
    void emptyCompositionIsIdentity() {
        assertTrue(MoveComposer.composeAll(Collections.emptyList()).isIdentity());
    }

    @Test
    void composedSequenceMatchesStepwiseApplication() {
        Scrambler scrambler = Scrambler.seeded(99L);
        CubeState stepwise = new CubeState(table, scrambler);
        List<Move> moves = scrambler.scramble(stepwise, 40);

        List<MoveDefinition> definitions = new ArrayList<>();
        for (Move move : moves) {
            definitions.add(table.lookup(move));
        }
        MoveDefinition combined = MoveComposer.composeAll(definitions);

        // Reading a solved cube back after the moves gives the combined tables.
        for (int i = 0; i < 8; i++) {
            assertEquals(combined.cornerSource(i), stepwise.getCorners()[i].pieceIndex());
            assertEquals(combined.cornerDelta(i), stepwise.getCorners()[i].orientation());
        }
        for (int i = 0; i < 12; i++) {
            assertEquals(combined.edgeSource(i), stepwise.getEdges()[i].pieceIndex());
            assertEquals(combined.edgeDelta(i), stepwise.getEdges()[i].orientation());
        }
    }
}
