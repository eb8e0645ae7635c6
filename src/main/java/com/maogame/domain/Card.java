package com.maogame.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * A playing card.
 *
 * @param value the face value
 * @param type the suit or special kind
 */
public record Card(CardValue value, CardType type) {

    public static Card of(int value, Suit suit) {
        return new Card(CardValue.of(value), new CardType.Common(suit));
    }

    public CardColor color() {
        return type.color();
    }

    /**
     * Builds the 52 common cards, values 1 to 13 in every suit, shuffled.
     *
     * @param random the source of randomness for the shuffle
     * @return a new mutable deck
     */
    public static List<Card> shuffledDeck(Random random) {
        List<Card> deck = new ArrayList<>(52);
        for (Suit suit : Suit.values()) {
            for (int value = 1; value <= 13; value++) {
                deck.add(of(value, suit));
            }
        }
        Collections.shuffle(deck, random);
        return deck;
    }

    @Override
    public String toString() {
        return value + " of " + type.key();
    }
}
