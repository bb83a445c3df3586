package ai.gamedata.translator.config;

import java.util.Optional;

/**
 * Source of environment values; tests substitute a map-backed lambda.
 */
@FunctionalInterface
public interface EnvironmentReader {

    Optional<String> get(String key);
}
