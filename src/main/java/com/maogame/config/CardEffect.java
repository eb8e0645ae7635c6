package com.maogame.config;

import com.maogame.turn.TurnChange;

import java.util.List;

/**
 * Effect attached to a card by the card-effect table.
 */
public sealed interface CardEffect permits CardEffect.TurnEffect, CardEffect.SayEffect, CardEffect.PhysicalEffect {

    /**
     * Playing the card changes the turn order this way instead of the default advance.
     *
     * @param change the turn change
     */
    record TurnEffect(TurnChange change) implements CardEffect {
    }

    /**
     * The player must say one of the accepted phrases during the turn the card is played.
     *
     * @param accepted the phrases, any one of them satisfies the requirement
     */
    record SayEffect(List<String> accepted) implements CardEffect {

        public SayEffect {
            if (accepted.isEmpty()) {
                throw new IllegalArgumentException("A say effect needs at least one phrase");
            }
            accepted = List.copyOf(accepted);
        }

        /**
         * @param message what the player said
         * @param caseSensitive whether the comparison keeps case
         * @return true if the message contains one of the accepted phrases
         */
        public boolean isSatisfiedBy(String message, boolean caseSensitive) {
            String haystack = caseSensitive ? message : message.toLowerCase();
            for (String phrase : accepted) {
                if (haystack.contains(caseSensitive ? phrase : phrase.toLowerCase())) {
                    return true;
                }
            }
            return false;
        }
    }

    /**
     * The player must perform the named gesture during the turn the card is played.
     *
     * @param name the gesture
     */
    record PhysicalEffect(String name) implements CardEffect {
    }
}
