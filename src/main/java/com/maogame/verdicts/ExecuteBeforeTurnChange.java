package com.maogame.verdicts;

/**
 * @param hook runs before the turn changes
 */
public record ExecuteBeforeTurnChange(TurnHook hook) implements Verdict {

    @Override
    public String toString() {
        return "ExecuteBeforeTurnChange";
    }
}
