package com.maogame.domain;

import com.maogame.errors.InvalidIndexException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A pile of cards on the table. The last card of the list is the top of the pile.
 * A stack may carry several {@link StackType} tags at once.
 */
public class Stack {

    private final List<Card> cards;
    private final boolean visible;
    private final EnumSet<StackType> types;

    public Stack(List<Card> cards, boolean visible, Set<StackType> types) {
        this.cards = new ArrayList<>(cards);
        this.visible = visible;
        this.types = types.isEmpty() ? EnumSet.noneOf(StackType.class) : EnumSet.copyOf(types);
    }

    public static Stack drawable(List<Card> cards) {
        return new Stack(cards, false, EnumSet.of(StackType.DRAWABLE));
    }

    public static Stack playable(List<Card> cards) {
        return new Stack(cards, true, EnumSet.of(StackType.PLAYABLE));
    }

    public static Stack discardable(List<Card> cards) {
        return new Stack(cards, true, EnumSet.of(StackType.DISCARDABLE));
    }

    public List<Card> cards() {
        return Collections.unmodifiableList(cards);
    }

    public int size() {
        return cards.size();
    }

    public boolean isEmpty() {
        return cards.isEmpty();
    }

    public boolean isVisible() {
        return visible;
    }

    public boolean hasType(StackType type) {
        return types.contains(type);
    }

    public Set<StackType> types() {
        return Collections.unmodifiableSet(types);
    }

    public Optional<Card> top() {
        return cards.isEmpty() ? Optional.empty() : Optional.of(cards.get(cards.size() - 1));
    }

    public void push(Card card) {
        cards.add(card);
    }

    public Optional<Card> pop() {
        return cards.isEmpty() ? Optional.empty() : Optional.of(cards.remove(cards.size() - 1));
    }

    public Card removeCard(int index) {
        if (index < 0 || index >= cards.size()) {
            throw new InvalidIndexException(InvalidIndexException.Target.CARD, index, cards.size());
        }
        return cards.remove(index);
    }

    /**
     * Removes every card but the top one.
     *
     * @return the removed cards, bottom first
     */
    public List<Card> takeAllButTop() {
        if (cards.size() <= 1) {
            return new ArrayList<>();
        }
        List<Card> under = cards.subList(0, cards.size() - 1);
        List<Card> taken = new ArrayList<>(under);
        under.clear();
        return taken;
    }

    /**
     * Removes every card.
     *
     * @return the removed cards, bottom first
     */
    public List<Card> takeAll() {
        List<Card> taken = new ArrayList<>(cards);
        cards.clear();
        return taken;
    }

    public void addAll(List<Card> newCards) {
        cards.addAll(newCards);
    }

    @Override
    public String toString() {
        return "Stack[types=" + types + ", size=" + cards.size() + ", top=" + top().map(Card::toString).orElse("-") + "]";
    }
}
