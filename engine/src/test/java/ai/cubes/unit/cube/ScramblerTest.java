package ai.cubes.unit.cube;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.cubes.cube.CubeState;
import ai.cubes.cube.Scrambler;
import ai.cubes.cube.moves.Move;
import ai.cubes.cube.notation.NotationParser;
import ai.cubes.unit.helpers.CubeTestHelper;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ScramblerTest {

    @Test
    void defaultLengthIsTwentyFive() {
        CubeState cube = CubeTestHelper.seededCube(1L);
        String sequence = cube.scramble();
        assertEquals(25, NotationParser.tokenize(sequence).size());
    }

    @Test
    void sameSeedGivesSameSequenceAndState() {
        CubeState first = CubeTestHelper.seededCube(42L);
        CubeState second = CubeTestHelper.seededCube(42L);
        String a = first.scramble(30);
        String b = second.scramble(30);
        assertEquals(a, b);
        assertEquals(first, second);
    }

    @Test
    void differentSeedsDiffer() {
        assertNotEquals(CubeTestHelper.seededCube(1L).scramble(30), CubeTestHelper.seededCube(2L).scramble(30));
    }

    @Test
    void returnedSequenceIsWhatWasApplied() {
        CubeState scrambled = CubeTestHelper.seededCube(5L);
        String sequence = scrambled.scramble(20);
        assertTrue(sequence.matches("([UDRLFB]['2]?)( [UDRLFB]['2]?){19}"), sequence);

        CubeState replayed = new CubeState();
        replayed.applyMoves(sequence);
        assertEquals(replayed, scrambled);
    }

    @Test
    void nonPositiveLengthIsNoOp() {
        CubeState cube = CubeTestHelper.seededCube(5L);
        assertEquals("", cube.scramble(0));
        assertEquals("", cube.scramble(-4));
        assertTrue(cube.isSolved());
    }

    @Test
    void drawsFromAllEighteenMoves() {
        Scrambler scrambler = Scrambler.seeded(123L);
        List<Move> moves = scrambler.scramble(new CubeState(), 2000);
        Set<Move> seen = EnumSet.noneOf(Move.class);
        seen.addAll(moves);
        assertEquals(18, seen.size());
    }
}
