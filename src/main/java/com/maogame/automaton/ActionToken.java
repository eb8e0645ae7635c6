package com.maogame.automaton;

/**
 * Typed input token a player submits while building an interaction.
 * <p>
 * The declaration order is the tie-break order used when sorting automaton children.
 */
public enum ActionToken {
    SELECT_CARD,
    SELECT_PLAYER,
    SELECT_PLAYABLE_STACK,
    SELECT_DRAWABLE_STACK,
    SELECT_DISCARDABLE_STACK,
    SELECT_RULE,
    DO_ACTION
}
