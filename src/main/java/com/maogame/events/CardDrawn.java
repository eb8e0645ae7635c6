package com.maogame.events;

import java.util.OptionalInt;

/**
 * A player drew a card.
 *
 * @param event the card movement
 */
public record CardDrawn(CardEvent event) implements Occurrence {

    @Override
    public boolean isRecordable() {
        return true;
    }

    @Override
    public boolean changesTurn() {
        return true;
    }

    @Override
    public OptionalInt playerIndex() {
        return OptionalInt.of(event.playerIndex());
    }

    @Override
    public String toString() {
        return "CardDrawn[" + event + "]";
    }
}
