package ai.cubes.cube.notation;

import ai.cubes.cube.moves.InvalidMoveException;
import ai.cubes.cube.moves.Move;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Converts Singmaster notation to and from {@link Move}s.
 * <p>
 * A token is a face letter ({@code U D R L F B}) optionally followed by {@code '} or
 * {@code 2}, matched exactly: no lower case, no whitespace inside a token, no other suffix.
 * A sequence is any number of tokens separated by runs of whitespace.
 */
public final class NotationParser {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private NotationParser() {
    }

    /**
     * Resolves a single token.
     *
     * @throws InvalidMoveException if the token is not one of the 18 canonical names
     */
    public static Move parseToken(String token) {
        Move move = Move.tryParse(token);
        if (move == null) {
            throw InvalidMoveException.forToken(token);
        }
        return move;
    }

    /**
     * Splits a sequence into its raw tokens, dropping empty runs. The tokens are not validated.
     */
    public static List<String> tokenize(String sequence) {
        if (sequence == null) {
            return Collections.emptyList();
        }
        String trimmed = sequence.strip();
        if (trimmed.isEmpty()) {
            return Collections.emptyList();
        }
        return List.of(WHITESPACE.split(trimmed));
    }

    /**
     * Parses a whole sequence up front.
     *
     * @throws InvalidMoveException at the first token that is not a canonical move
     */
    public static List<Move> parseSequence(String sequence) {
        List<String> tokens = tokenize(sequence);
        List<Move> moves = new ArrayList<>(tokens.size());
        for (String token : tokens) {
            moves.add(parseToken(token));
        }
        return moves;
    }

    /**
     * Returns the sequence that undoes {@code moves}: reversed, each move inverted.
     */
    public static List<Move> invert(List<Move> moves) {
        List<Move> inverse = new ArrayList<>(moves.size());
        for (int i = moves.size() - 1; i >= 0; i--) {
            inverse.add(moves.get(i).inverse());
        }
        return inverse;
    }

    /**
     * Formats moves as their tokens joined by single spaces.
     */
    public static String format(List<Move> moves) {
        return moves.stream().map(Move::token).collect(Collectors.joining(" "));
    }
}
