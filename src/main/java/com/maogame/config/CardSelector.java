package com.maogame.config;

import com.maogame.domain.Card;

/**
 * Key of the card-effect table. A selector matches on value only, on type only, or on both.
 *
 * @param value the value key, or null
 * @param type the type key, or null
 */
public record CardSelector(String value, String type) {

    public CardSelector {
        if (value == null && type == null) {
            throw new IllegalArgumentException("A card selector needs a value, a type, or both");
        }
    }

    public static CardSelector byValue(String value) {
        return new CardSelector(value, null);
    }

    public static CardSelector byType(String type) {
        return new CardSelector(null, type);
    }

    public static CardSelector byValueAndType(String value, String type) {
        return new CardSelector(value, type);
    }

    @Override
    public String toString() {
        if (value == null) {
            return type;
        }
        return type == null ? value : value + "_" + type;
    }

    static CardSelector[] selectorsFor(Card card) {
        String value = card.value().key();
        String type = card.type().key();
        return new CardSelector[] {byValue(value), byType(type), byValueAndType(value, type)};
    }
}
