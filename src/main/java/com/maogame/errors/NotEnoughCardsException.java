package com.maogame.errors;

public class NotEnoughCardsException extends GameException {

    public NotEnoughCardsException(int missing) {
        super("Not enough cards left to draw, " + missing + " missing");
    }
}
