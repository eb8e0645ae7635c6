package com.maogame.verdicts;

import com.maogame.engine.GameCore;

/**
 * Custom punishment replacing the default "draw one card" penalty.
 */
@FunctionalInterface
public interface PenaltyHook {

    void apply(GameCore core, int playerIndex);
}
