package com.maogame.verdicts;

/**
 * The rule takes over the turn change: the default advance is skipped and the hook is
 * expected to move the turn itself.
 *
 * @param hook runs before the (skipped) default turn change
 */
public record OverrideBasicRule(TurnHook hook) implements Verdict {

    @Override
    public String toString() {
        return "OverrideBasicRule";
    }
}
