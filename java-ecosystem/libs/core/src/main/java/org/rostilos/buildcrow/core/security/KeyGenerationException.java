package org.rostilos.buildcrow.core.security;

/**
 * Thrown when a repository key pair cannot be generated.
 * The failure is usually transient (entropy or provider availability), callers may retry.
 */
public class KeyGenerationException extends RuntimeException {

    public KeyGenerationException(String message) {
        super(message);
    }

    public KeyGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
