package ai.gamedata.translator.config;

import java.util.Optional;

/**
 * Reads process environment variables, treating blank values as absent.
 */
public class SystemEnvironmentReader implements EnvironmentReader {

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(System.getenv(key)).filter(value -> !value.isBlank());
    }
}
