package com.maogame.errors;

/**
 * Base class of the hard errors raised by the engine.
 * <p>
 * Gameplay violations are never thrown: they are returned to the caller and penalized.
 * A {@code GameException} signals a malformed request or an unrecoverable state.
 */
public class GameException extends RuntimeException {

    public GameException(String message) {
        super(message);
    }

    public GameException(String message, Throwable cause) {
        super(message, cause);
    }
}
