package ai.cubes.config;

import ai.cubes.cube.Scrambler;
import ai.cubes.cube.moves.MoveTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the shared, immutable move table and the scrambler into the application context.
 */
@Configuration
public class CubeConfiguration {
    private static final Logger log = LoggerFactory.getLogger(CubeConfiguration.class);

    @Bean
    public MoveTable moveTable() {
        // Built eagerly at context start-up; the table is small and pure.
        return MoveTable.standard();
    }

    @Bean
    public Scrambler scrambler(ScrambleProperties properties) {
        if (properties.getSeed() != null) {
            if (log.isInfoEnabled()) {
                log.info("Using fixed scramble seed {}", properties.getSeed());
            }
            return Scrambler.seeded(properties.getSeed());
        }
        return new Scrambler();
    }
}
