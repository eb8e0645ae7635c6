package com.maogame.errors;

public class NoStackAvailableException extends GameException {

    public NoStackAvailableException(String message) {
        super(message);
    }
}
