package com.maogame.verdicts;

/**
 * A rule broken by a player. Every violation is penalized exactly once.
 */
public sealed interface Violation permits Disallow, ForgetSomething {

    /**
     * @return the name of the rule that was broken
     */
    String rule();

    /**
     * @return a message for the player
     */
    String reason();

    /**
     * @return the penalty to apply instead of the default one, or null
     */
    PenaltyHook penalty();
}
