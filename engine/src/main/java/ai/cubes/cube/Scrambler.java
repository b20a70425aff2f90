package ai.cubes.cube;

import ai.cubes.cube.moves.Move;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies uniformly random outer-layer turns to a cube.
 * <p>
 * Moves are drawn with replacement from all 18 turns. Nothing prevents consecutive draws from
 * cancelling or merging (for example {@code R} then {@code R'}). With a seeded {@link Random}
 * the drawn sequence is reproducible.
 */
public class Scrambler {
    private static final Logger log = LoggerFactory.getLogger(Scrambler.class);

    /** Scramble length used when the caller does not choose one. */
    public static final int DEFAULT_LENGTH = 25;

    private final Random random;

    /**
     * Creates a scrambler with a non-deterministic seed.
     */
    public Scrambler() {
        this(new Random());
    }

    public Scrambler(Random random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * Creates a scrambler whose sequences are fully determined by {@code seed}.
     */
    public static Scrambler seeded(long seed) {
        return new Scrambler(new Random(seed));
    }

    /**
     * Draws {@code length} moves and applies them to {@code state} in order.
     *
     * @param state the cube to scramble; mutated in place
     * @param length number of moves; zero or negative leaves the cube unchanged
     * @return the moves applied, in order
     */
    public List<Move> scramble(CubeState state, int length) {
        Objects.requireNonNull(state, "state");
        if (length <= 0) {
            return Collections.emptyList();
        }
        List<Move> all = Move.all();
        List<Move> applied = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            Move move = all.get(random.nextInt(all.size()));
            state.applyMove(move);
            applied.add(move);
        }
        if (log.isDebugEnabled()) {
            log.debug("Scrambled with {} moves: {}", length, applied);
        }
        return applied;
    }
}
