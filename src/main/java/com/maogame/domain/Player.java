package com.maogame.domain;

import com.maogame.errors.InvalidIndexException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A seat at the table: a display name and a hand of cards.
 */
public class Player {

    private final String name;
    private final List<Card> hand = new ArrayList<>();

    public Player(String name) {
        this.name = name;
    }

    public String name() {
        return name;
    }

    public List<Card> hand() {
        return Collections.unmodifiableList(hand);
    }

    public Card card(int index) {
        checkIndex(index);
        return hand.get(index);
    }

    public void addCard(Card card) {
        hand.add(card);
    }

    public void addCards(List<Card> cards) {
        hand.addAll(cards);
    }

    public Card removeCard(int index) {
        checkIndex(index);
        return hand.remove(index);
    }

    public void clearHand() {
        hand.clear();
    }

    public boolean hasEmptyHand() {
        return hand.isEmpty();
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= hand.size()) {
            throw new InvalidIndexException(InvalidIndexException.Target.CARD, index, hand.size());
        }
    }

    @Override
    public String toString() {
        return "Player[name=" + name + ", cards=" + hand.size() + "]";
    }
}
