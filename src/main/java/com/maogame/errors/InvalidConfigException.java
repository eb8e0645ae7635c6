package com.maogame.errors;

/**
 * Configuration file or table that cannot be used.
 */
public class InvalidConfigException extends GameException {

    public InvalidConfigException(String message) {
        super(message);
    }

    public InvalidConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
