package com.maogame.verdicts;

import com.maogame.engine.GameCore;

/**
 * Code a rule module asks the engine to run around a turn change.
 */
@FunctionalInterface
public interface TurnHook {

    /**
     * @param core the game core
     * @param playerIndex the player whose action triggered the occurrence
     */
    void apply(GameCore core, int playerIndex);
}
