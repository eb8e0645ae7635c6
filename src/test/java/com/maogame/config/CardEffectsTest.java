package com.maogame.config;

import com.maogame.domain.Card;
import com.maogame.domain.CardColor;
import com.maogame.domain.CardType;
import com.maogame.domain.CardValue;
import com.maogame.domain.Suit;
import com.maogame.turn.TurnChange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Card Effects Tests")
class CardEffectsTest {

    private final CardEffect say = new CardEffect.SayEffect(List.of("seven"));
    private final CardEffect knock = new CardEffect.PhysicalEffect("knock");
    private final CardEffect skip = new CardEffect.TurnEffect(TurnChange.parse("up_up_2"));

    private CardEffects effects;

    @BeforeEach
    void setUp() {
        effects = new CardEffects();
        effects.add(CardSelector.byValue("7"), say);
        effects.add(CardSelector.byType("heart"), knock);
        effects.add(CardSelector.byValueAndType("7", "heart"), skip);
    }

    @Nested
    @DisplayName("Lookup")
    class Lookup {

        @Test
        @DisplayName("Should union value, type and exact selectors")
        void unionsSelectors() {
            assertEquals(List.of(say, knock, skip), effects.lookup(Card.of(7, Suit.HEART)));
        }

        @Test
        @DisplayName("Should match the value alone")
        void valueOnly() {
            assertEquals(List.of(say), effects.lookup(Card.of(7, Suit.SPADE)));
        }

        @Test
        @DisplayName("Should match the type alone")
        void typeOnly() {
            assertEquals(List.of(knock), effects.lookup(Card.of(2, Suit.HEART)));
        }

        @Test
        @DisplayName("Should find nothing for an unlisted card")
        void nothing() {
            assertTrue(effects.lookup(new Card(CardValue.PLUS_INFINITY, new CardType.Joker("wild", CardColor.RED))).isEmpty());
        }
    }

    @Nested
    @DisplayName("Merging")
    class Merging {

        @Test
        @DisplayName("Should add merged effects up and take them back on removal")
        void mergeAndRemove() {
            CardEffects rule = new CardEffects();
            CardEffect bow = new CardEffect.PhysicalEffect("bow");
            rule.add(CardSelector.byValue("7"), bow);

            effects.merge(rule);
            assertEquals(List.of(say, bow), effects.lookup(Card.of(7, Suit.CLUB)));

            effects.remove(rule);
            assertEquals(List.of(say), effects.lookup(Card.of(7, Suit.CLUB)));
        }

        @Test
        @DisplayName("Should drop a selector left without effects")
        void removalDropsEmptySelector() {
            CardEffects rule = new CardEffects();
            rule.add(CardSelector.byType("heart"), knock);

            effects.remove(rule);

            assertFalse(effects.entries().containsKey(CardSelector.byType("heart")));
        }
    }

    @Nested
    @DisplayName("Physical actions")
    class PhysicalActions {

        @Test
        @DisplayName("Should list each declared physical action once")
        void listsPhysicalActions() {
            effects.add(CardSelector.byValue("12"), new CardEffect.PhysicalEffect("bow"));
            effects.add(CardSelector.byValue("1"), knock);

            assertEquals(List.of("knock", "bow"), effects.physicalActions());
        }

        @Test
        @DisplayName("Should forget a physical action removed with its rule")
        void removedPhysicalAction() {
            CardEffects rule = new CardEffects();
            rule.add(CardSelector.byType("heart"), knock);

            effects.remove(rule);

            assertTrue(effects.physicalActions().isEmpty());
        }
    }

    @Nested
    @DisplayName("Say requirements")
    class SayRequirements {

        @Test
        @DisplayName("Should accept any accepted phrase contained in the message")
        void substringOfAnyPhrase() {
            CardEffect.SayEffect effect = new CardEffect.SayEffect(List.of("hello", "good day"));

            assertTrue(effect.isSatisfiedBy("well, good day to you", true));
            assertFalse(effect.isSatisfiedBy("goodbye", true));
        }

        @Test
        @DisplayName("Should compare case only when configured")
        void caseSensitivity() {
            CardEffect.SayEffect effect = new CardEffect.SayEffect(List.of("Hello"));

            assertFalse(effect.isSatisfiedBy("hello there", true));
            assertTrue(effect.isSatisfiedBy("hello there", false));
        }
    }
}
