package com.maogame.domain;

public enum Suit {
    SPADE(CardColor.BLACK),
    DIAMOND(CardColor.RED),
    CLUB(CardColor.BLACK),
    HEART(CardColor.RED);

    private final CardColor color;

    Suit(CardColor color) {
        this.color = color;
    }

    public CardColor color() {
        return color;
    }

    public String key() {
        return name().toLowerCase();
    }
}
