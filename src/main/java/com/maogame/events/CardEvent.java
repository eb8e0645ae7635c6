package com.maogame.events;

import com.maogame.domain.Card;

/**
 * A card moving between a hand and a stack.
 *
 * @param card the card
 * @param cardIndex the position of the card in the hand, or in the stack it came from
 * @param playerIndex the player moving the card
 * @param stackIndex the stack involved, or null when a new stack is requested
 */
public record CardEvent(Card card, int cardIndex, int playerIndex, Integer stackIndex) {

    @Override
    public String toString() {
        return "CardEvent[card=" + card + ", cardIndex=" + cardIndex + ", playerIndex=" + playerIndex
                + ", stackIndex=" + stackIndex + "]";
    }
}
