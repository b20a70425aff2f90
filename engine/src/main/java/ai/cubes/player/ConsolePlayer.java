package ai.cubes.player;

import ai.cubes.cube.CubeState;
import java.util.Scanner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Human player that reads commands from stdin (CLI).
 */
@Component
@Profile("console")
public class ConsolePlayer implements Player {
    private static final String PROMPT = "Enter command (moves e.g. R U R' U' | scramble [N] | undo | reset | quit): ";

    private final Scanner scanner = new Scanner(System.in);

    @Override
    public String nextCommand(CubeState cube, String feedback) {
        if (!feedback.isBlank()) {
            System.out.println(feedback);
        }
        System.out.print(PROMPT);
        if (!scanner.hasNextLine()) {
            return null;
        }
        return scanner.nextLine();
    }
}
