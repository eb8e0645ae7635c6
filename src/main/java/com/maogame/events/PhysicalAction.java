package com.maogame.events;

import java.util.OptionalInt;

/**
 * A player performed a named physical gesture, such as knocking on the table.
 *
 * @param player the acting player
 * @param name the gesture
 */
public record PhysicalAction(int player, String name) implements Occurrence {

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
        return "PhysicalAction[player=" + player + ", name=" + name + "]";
    }
}
