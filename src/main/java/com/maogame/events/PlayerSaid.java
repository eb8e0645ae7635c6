package com.maogame.events;

import java.util.OptionalInt;

/**
 * A player said something out loud.
 *
 * @param player the speaking player
 * @param message what was said
 */
public record PlayerSaid(int player, String message) implements Occurrence {

    @Override
    public boolean isRecordable() {
        return true;
    }

    @Override
    public OptionalInt playerIndex() {
        return OptionalInt.of(player);
    }

    @Override
    public String toString() {
        return "PlayerSaid[player=" + player + ", message=" + message + "]";
    }
}
