package com.maogame.engine;

import com.maogame.domain.Card;

/**
 * Outcome of the basic rules for playing a card: it is the player's turn, and the card shares
 * its value or its colour with the top card of the stack.
 */
public sealed interface PlayCheck permits PlayCheck.CanPlay, PlayCheck.WrongTurn, PlayCheck.CannotPlaceThisCard {

    String message();

    record CanPlay() implements PlayCheck {
        @Override
        public String message() {
            return "The card can be played";
        }
    }

    /**
     * @param player the player who tried to play
     * @param current the player whose turn it is
     */
    record WrongTurn(int player, int current) implements PlayCheck {
        @Override
        public String message() {
            return "It is not your turn";
        }
    }

    /**
     * @param card the card the player tried to play
     * @param top the card on top of the targeted stack
     */
    record CannotPlaceThisCard(Card card, Card top) implements PlayCheck {
        @Override
        public String message() {
            return "You cannot place " + card + " on " + top;
        }
    }
}
