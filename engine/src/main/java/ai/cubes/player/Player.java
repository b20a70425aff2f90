package ai.cubes.player;

import ai.cubes.cube.CubeState;

/**
 * Represents a player capable of providing the next command for the cube session.
 */
public interface Player {

    /**
     * Provide the next command for the session loop (e.g., {@code "R U R' U'"},
     * {@code "scramble 20"}, {@code "undo"}, {@code "quit"}).
     *
     * @param cube     current cube state.
     * @param feedback error feedback about the previous command, or an empty string.
     * @return raw command string, or null to signal the session should exit.
     */
    String nextCommand(CubeState cube, String feedback);
}
