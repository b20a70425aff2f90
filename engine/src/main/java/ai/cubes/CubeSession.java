package ai.cubes;

import ai.cubes.config.ScrambleProperties;
import ai.cubes.config.SessionProperties;
import ai.cubes.cube.CubeState;
import ai.cubes.cube.Scrambler;
import ai.cubes.cube.display.CubeFormatter;
import ai.cubes.cube.moves.InvalidMoveException;
import ai.cubes.cube.moves.Move;
import ai.cubes.cube.moves.MoveTable;
import ai.cubes.cube.notation.NotationParser;
import ai.cubes.player.Player;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Interactive session: shows the cube, asks the {@link Player} for a command and applies it.
 *
 * <p>Recognised commands (case-insensitive keywords, case-sensitive move tokens):
 * <ul>
 *     <li>{@code quit} ends the session.</li>
 *     <li>{@code reset} restores the solved cube and clears the undo history.</li>
 *     <li>{@code scramble [N]} applies N random moves (default {@code scramble.length}).</li>
 *     <li>{@code undo} reverts the moves of the last command that changed the cube.</li>
 *     <li>Anything else is read as a move sequence such as {@code R U R' U'}.</li>
 * </ul>
 * A sequence containing an invalid token keeps the moves before it, as
 * {@link CubeState#applyMoves(String)} does; those moves still form one undo step.
 */
@Component
@Profile("console")
public class CubeSession implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(CubeSession.class);

    private final Player player;
    private final MoveTable moveTable;
    private final Scrambler scrambler;
    private final ScrambleProperties scrambleProperties;
    private final SessionProperties sessionProperties;

    public CubeSession(
            Player player,
            MoveTable moveTable,
            Scrambler scrambler,
            ScrambleProperties scrambleProperties,
            SessionProperties sessionProperties) {
        this.player = Objects.requireNonNull(player, "player");
        this.moveTable = Objects.requireNonNull(moveTable, "moveTable");
        this.scrambler = Objects.requireNonNull(scrambler, "scrambler");
        this.scrambleProperties = Objects.requireNonNull(scrambleProperties, "scrambleProperties");
        this.sessionProperties = Objects.requireNonNull(sessionProperties, "sessionProperties");
    }

    @Override
    public void run(String... args) {
        // CLI entrypoint ignores the result; tests call play() directly.
        play();
    }

    /**
     * Runs the command loop on a fresh solved cube until the player quits, input ends, or
     * {@code session.max-commands} is reached.
     *
     * @return summary of the session
     */
    public SessionResult play() {
        CubeState cube = new CubeState(moveTable, scrambler);
        Deque<List<Move>> history = new ArrayDeque<>();
        String feedback = "";
        int commands = 0;
        int movesApplied = 0;

        while (commands < sessionProperties.getMaxCommands()) {
            printCube(cube, commands);
            String input = player.nextCommand(cube, feedback);
            if (input == null) {
                if (log.isDebugEnabled()) {
                    log.debug("Input closed. Exiting session for player {}", player.getClass().getSimpleName());
                }
                break;
            }
            input = input.strip();
            if (input.isEmpty()) {
                feedback = "";
                continue;
            }
            commands++;

            String keyword = input.split("\\s+")[0].toLowerCase();
            if (keyword.equals("quit")) {
                break;
            }
            feedback = "";
            switch (keyword) {
                case "reset" -> {
                    cube.reset();
                    history.clear();
                }
                case "undo" -> {
                    if (history.isEmpty()) {
                        feedback = "Nothing to undo.";
                    } else {
                        List<Move> inverse = NotationParser.invert(history.pop());
                        cube.applyMoves(inverse);
                        movesApplied += inverse.size();
                    }
                }
                case "scramble" -> {
                    try {
                        List<Move> scramble = scrambler.scramble(cube, scrambleLength(input));
                        if (!scramble.isEmpty()) {
                            history.push(scramble);
                            movesApplied += scramble.size();
                        }
                        feedback = "Scramble: " + NotationParser.format(scramble);
                    } catch (NumberFormatException e) {
                        feedback = "Usage: scramble [N] (e.g., scramble 20)";
                    }
                }
                default -> {
                    List<Move> applied = new ArrayList<>();
                    try {
                        for (String token : NotationParser.tokenize(input)) {
                            Move move = NotationParser.parseToken(token);
                            cube.applyMove(move);
                            applied.add(move);
                        }
                    } catch (InvalidMoveException e) {
                        feedback = e.getMessage() + " (" + applied.size() + " earlier move(s) applied)";
                        if (log.isDebugEnabled()) {
                            log.debug("Invalid move in '{}': {}", input, e.getMessage());
                        }
                    }
                    if (!applied.isEmpty()) {
                        history.push(applied);
                        movesApplied += applied.size();
                    }
                }
            }
            if (cube.isSolved() && movesApplied > 0 && feedback.isEmpty() && !keyword.equals("reset")) {
                feedback = "Solved!";
            }
        }

        printCube(cube, commands);
        return new SessionResult(commands, movesApplied, cube.isSolved());
    }

    private int scrambleLength(String input) {
        String[] parts = input.split("\\s+");
        if (parts.length > 2) {
            throw new NumberFormatException("Too many arguments: " + input);
        }
        return parts.length == 2 ? Integer.parseInt(parts[1]) : scrambleProperties.getLength();
    }

    private void printCube(CubeState cube, int commands) {
        if (log.isInfoEnabled()) {
            String net = new CubeFormatter(cube, sessionProperties.isColour()).format();
            log.info("\nCOMMAND {}{}\n{}", commands + 1, cube.isSolved() ? " (solved)" : "", net);
        }
    }

    /**
     * Lightweight summary of a single session run.
     */
    public static final class SessionResult {
        private final int commands;
        private final int movesApplied;
        private final boolean solved;

        public SessionResult(int commands, int movesApplied, boolean solved) {
            this.commands = commands;
            this.movesApplied = movesApplied;
            this.solved = solved;
        }

        /**
         * Number of non-blank commands read, including the final {@code quit}.
         */
        public int getCommands() {
            return commands;
        }

        /**
         * Moves applied to the cube over the session, counting scrambles and undo inversions.
         */
        public int getMovesApplied() {
            return movesApplied;
        }

        public boolean isSolved() {
            return solved;
        }
    }
}
