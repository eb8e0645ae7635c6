package com.maogame.events;

import java.util.OptionalInt;

/**
 * Something that happened in the game and is offered to every active rule module.
 * <p>
 * Recordable occurrences are kept in the turn log until the turn they belong to is closed.
 * Turn-changing occurrences are the ones that end the acting player's turn.
 */
public sealed interface Occurrence permits
        CardPlayed,
        CardDrawn,
        CardDiscarded,
        PlayerSaid,
        PhysicalAction,
        StackRanOut,
        EndPlayerTurn,
        PlayerPenalty,
        GameStart,
        VerifyRules {

    default boolean isRecordable() {
        return false;
    }

    default boolean changesTurn() {
        return false;
    }

    /**
     * @return the player the occurrence is about, if any
     */
    default OptionalInt playerIndex() {
        return OptionalInt.empty();
    }
}
