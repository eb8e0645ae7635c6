package com.maogame.automaton;

import com.maogame.engine.GameCore;
import com.maogame.verdicts.Violation;

import java.util.List;

/**
 * Action bound to an automaton leaf, executed once an interaction sequence resolves to it.
 */
@FunctionalInterface
public interface InteractionHandler {

    /**
     * Executes the action.
     *
     * @param playerIndex the player who performed the interaction
     * @param core the game core to act on
     * @param steps the full resolved step sequence, root first
     * @return the violations the action produced, may be empty
     */
    List<Violation> handle(int playerIndex, GameCore core, List<InteractionStep> steps);
}
