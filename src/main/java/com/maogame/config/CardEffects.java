package com.maogame.config;

import com.maogame.domain.Card;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Table of effects triggered by playing a card.
 * <p>
 * A lookup returns the union of the effects declared for the card's value, for its type,
 * and for the exact value and type, in that order.
 */
public class CardEffects {

    private final Map<CardSelector, List<CardEffect>> effects = new LinkedHashMap<>();

    public CardEffects() {
    }

    public CardEffects(Map<CardSelector, List<CardEffect>> initial) {
        initial.forEach(this::add);
    }

    public void add(CardSelector selector, List<CardEffect> newEffects) {
        effects.computeIfAbsent(selector, key -> new ArrayList<>()).addAll(newEffects);
    }

    public void add(CardSelector selector, CardEffect effect) {
        add(selector, List.of(effect));
    }

    /**
     * Adds every entry of another table to this one.
     */
    public void merge(CardEffects other) {
        other.effects.forEach(this::add);
    }

    /**
     * Removes the entries of another table from this one, one occurrence per effect.
     */
    public void remove(CardEffects other) {
        other.effects.forEach((selector, removed) -> {
            List<CardEffect> current = effects.get(selector);
            if (current == null) {
                return;
            }
            for (CardEffect effect : removed) {
                current.remove(effect);
            }
            if (current.isEmpty()) {
                effects.remove(selector);
            }
        });
    }

    public List<CardEffect> lookup(Card card) {
        List<CardEffect> found = new ArrayList<>();
        for (CardSelector selector : CardSelector.selectorsFor(card)) {
            found.addAll(effects.getOrDefault(selector, List.of()));
        }
        return found;
    }

    /**
     * Names of every physical action a card of this table may require, in declaration order.
     */
    public List<String> physicalActions() {
        Set<String> names = new LinkedHashSet<>();
        for (List<CardEffect> declared : effects.values()) {
            for (CardEffect effect : declared) {
                if (effect instanceof CardEffect.PhysicalEffect physical) {
                    names.add(physical.name());
                }
            }
        }
        return new ArrayList<>(names);
    }

    public Map<CardSelector, List<CardEffect>> entries() {
        return Collections.unmodifiableMap(effects);
    }

    public boolean isEmpty() {
        return effects.isEmpty();
    }

    @Override
    public String toString() {
        return "CardEffects" + effects;
    }
}
