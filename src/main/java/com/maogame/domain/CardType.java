package com.maogame.domain;

/**
 * Kind of a card: a common suited card, a rule card or a joker.
 */
public sealed interface CardType permits CardType.Common, CardType.RuleCard, CardType.Joker {

    CardColor color();

    /**
     * @return the key used by the card-effect table
     */
    String key();

    record Common(Suit suit) implements CardType {
        @Override
        public CardColor color() {
            return suit.color();
        }

        @Override
        public String key() {
            return suit.key();
        }
    }

    record RuleCard() implements CardType {
        @Override
        public CardColor color() {
            return CardColor.UNDEFINED;
        }

        @Override
        public String key() {
            return "rule";
        }
    }

    /**
     * @param description free text printed on the joker
     * @param color the colour the joker counts as
     */
    record Joker(String description, CardColor color) implements CardType {
        @Override
        public String key() {
            return "joker";
        }
    }
}
