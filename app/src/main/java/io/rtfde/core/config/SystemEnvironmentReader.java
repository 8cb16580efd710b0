package io.rtfde.core.config;

import java.util.Optional;

/**
 * Reads diagnostic settings from the process environment.
 */
public class SystemEnvironmentReader implements EnvironmentReader {

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(System.getenv(key));
    }
}
