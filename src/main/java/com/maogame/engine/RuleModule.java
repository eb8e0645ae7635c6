package com.maogame.engine;

import com.maogame.events.Occurrence;
import com.maogame.verdicts.RuleVerdict;

/**
 * A pluggable game rule.
 * <p>
 * Active rule modules are offered every occurrence, in activation order, together with the
 * game core. They answer with a verdict and may act on the core directly while doing so.
 * State that must survive between calls goes in the core's rule data store under the
 * module's name.
 * <p>
 * Modules shipped as jars declare their implementation in
 * {@code META-INF/services/com.maogame.engine.RuleModule}.
 */
public interface RuleModule {

    /**
     * Reacts to an occurrence.
     *
     * @param occurrence the occurrence
     * @param core the game core
     * @return the verdict of this rule, never null
     */
    RuleVerdict onEvent(Occurrence occurrence, GameCore core);

    /**
     * @return the engine version this module was built against, compared to {@link GameCore#VERSION}
     */
    String getVersion();

    /**
     * @return the description of this rule and what it adds to the game
     */
    RuleData ruleData();

    /**
     * Undoes changes this rule made to the game when it is deactivated. The engine already
     * removes the automaton paths and card effects declared in {@link #ruleData()}.
     *
     * @param core the game core
     */
    default void removeCardEffects(GameCore core) {
    }

    default String getName() {
        return ruleData().name();
    }
}
