package com.maogame.events;

import java.util.OptionalInt;

/**
 * A player is about to receive the default penalty.
 *
 * @param player the penalized player
 */
public record PlayerPenalty(int player) implements Occurrence {

    @Override
    public OptionalInt playerIndex() {
        return OptionalInt.of(player);
    }

    @Override
    public String toString() {
        return "PlayerPenalty[player=" + player + "]";
    }
}
