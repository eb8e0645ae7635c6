package com.maogame.verdicts;

/**
 * @param hook runs after the turn changed
 */
public record ExecuteAfterTurnChange(TurnHook hook) implements Verdict {

    @Override
    public String toString() {
        return "ExecuteAfterTurnChange";
    }
}
