package ai.cubes.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for scrambling.
 *
 * <p>{@code scramble.length} is the number of random moves a bare {@code scramble} command
 * applies. {@code scramble.seed}, when set, makes every scramble sequence of the run
 * reproducible; leave it unset for a non-deterministic seed.
 *
 * Usage:
 * {@code java -jar engine.jar --scramble.length=30 --scramble.seed=42}
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "scramble")
public class ScrambleProperties {
  private int length = 25;
  private Long seed;

  /**
   * Returns the default scramble length.
   * @return number of moves per scramble
   */
  public int getLength() {
    return length;
  }

  /**
   * Sets the default scramble length.
   * @param length number of moves per scramble; zero or less scrambles nothing
   */
  public void setLength(int length) {
    this.length = length;
  }

  /**
   * Returns the fixed random seed, if any.
   * @return the seed, or null for a non-deterministic seed
   */
  public Long getSeed() {
    return seed;
  }

  public void setSeed(Long seed) {
    this.seed = seed;
  }
}
