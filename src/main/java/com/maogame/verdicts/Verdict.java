package com.maogame.verdicts;

/**
 * A rule module's answer to an occurrence.
 * <p>
 * {@link Disallow} and {@link ForgetSomething} are violations and get the player penalized.
 * The three turn hooks are deferred and run around the turn change.
 */
public sealed interface Verdict permits
        Ignored,
        Disallow,
        ForgetSomething,
        OverrideBasicRule,
        ExecuteBeforeTurnChange,
        ExecuteAfterTurnChange {

    Verdict IGNORED = new Ignored();

    /**
     * @return true for the verdicts that run around the turn change
     */
    default boolean isDeferred() {
        return this instanceof OverrideBasicRule
                || this instanceof ExecuteBeforeTurnChange
                || this instanceof ExecuteAfterTurnChange;
    }
}
