package com.maogame.events;

import java.util.List;
import java.util.OptionalInt;

/**
 * A player's turn was closed.
 *
 * @param player the player whose turn ended
 * @param events the recorded occurrences that made up the turn, oldest first
 */
public record EndPlayerTurn(int player, List<Occurrence> events) implements Occurrence {

    public EndPlayerTurn {
        events = List.copyOf(events);
    }

    @Override
    public OptionalInt playerIndex() {
        return OptionalInt.of(player);
    }

    @Override
    public String toString() {
        return "EndPlayerTurn[player=" + player + ", events=" + events + "]";
    }
}
