package com.maogame.events;

import java.util.OptionalInt;

/**
 * A player discarded a card.
 *
 * @param event the card movement
 */
public record CardDiscarded(CardEvent event) implements Occurrence {

    @Override
    public boolean isRecordable() {
        return true;
    }

    @Override
    public OptionalInt playerIndex() {
        return OptionalInt.of(event.playerIndex());
    }

    @Override
    public String toString() {
        return "CardDiscarded[" + event + "]";
    }
}
