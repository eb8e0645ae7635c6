package com.maogame.verdicts;

import com.maogame.engine.GameCore;
import com.maogame.events.Occurrence;

import java.util.List;

/**
 * Second look a rule module takes at an occurrence once every first-pass verdict is known.
 * It lets a rule react to what the other rules decided.
 */
@FunctionalInterface
public interface CrossRuleCallback {

    /**
     * @param core the game core
     * @param occurrence the occurrence being resolved
     * @param deferred the turn-hook verdicts collected so far, read-only
     * @return an additional verdict; a turn-hook verdict is appended to the deferred ones,
     *         anything else is dropped
     */
    Verdict reconsider(GameCore core, Occurrence occurrence, List<Verdict> deferred);
}
