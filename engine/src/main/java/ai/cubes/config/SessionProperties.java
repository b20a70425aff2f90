package ai.cubes.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for the interactive console session.
 *
 * <p>{@code session.colour} toggles ANSI colours in the printed cube net.
 * {@code session.max-commands} caps how many commands one session handles before it stops.
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "session")
public class SessionProperties {
  private boolean colour = true;
  private int maxCommands = 10_000;

  public boolean isColour() {
    return colour;
  }

  public void setColour(boolean colour) {
    this.colour = colour;
  }

  /**
   * Returns the maximum number of commands handled per session.
   * @return the command cap
   */
  public int getMaxCommands() {
    return maxCommands;
  }

  public void setMaxCommands(int maxCommands) {
    this.maxCommands = maxCommands;
  }
}
