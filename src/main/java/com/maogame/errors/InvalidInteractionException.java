package com.maogame.errors;

/**
 * Interaction whose steps do not have the shape its handler expects.
 */
public class InvalidInteractionException extends GameException {

    public InvalidInteractionException(String message) {
        super(message);
    }
}
