package com.maogame.engine;

import com.maogame.automaton.ActionToken;
import com.maogame.automaton.AutomatonNode;
import com.maogame.automaton.InteractionHandler;
import com.maogame.automaton.InteractionStep;
import com.maogame.errors.InvalidInteractionException;

import java.util.List;

/**
 * Interaction paths every game starts with: playing, discarding and drawing a card, and
 * performing a gesture.
 */
final class BasicActions {

    static final InteractionHandler PLAY = (player, core, steps) -> {
        expectTokens(steps, ActionToken.SELECT_CARD, ActionToken.SELECT_PLAYABLE_STACK);
        return core.playCard(player, steps.get(0).expectIndex(), optionalIndex(steps.get(1)));
    };

    static final InteractionHandler DISCARD = (player, core, steps) -> {
        expectTokens(steps, ActionToken.SELECT_CARD, ActionToken.SELECT_DISCARDABLE_STACK);
        return core.discardCard(player, steps.get(0).expectIndex(), optionalIndex(steps.get(1)));
    };

    static final InteractionHandler DRAW = (player, core, steps) -> {
        expectTokens(steps, ActionToken.SELECT_DRAWABLE_STACK);
        return core.drawCard(player, optionalIndex(steps.get(0)));
    };

    static final InteractionHandler GESTURE = (player, core, steps) -> {
        expectTokens(steps, ActionToken.SELECT_PLAYER, ActionToken.DO_ACTION);
        return core.performGesture(player, steps.get(1).expectText());
    };

    private BasicActions() {
    }

    static List<List<AutomatonNode>> paths() {
        return List.of(
                List.of(AutomatonNode.branch(ActionToken.SELECT_CARD),
                        AutomatonNode.leaf(ActionToken.SELECT_PLAYABLE_STACK, PLAY)),
                List.of(AutomatonNode.branch(ActionToken.SELECT_CARD),
                        AutomatonNode.leaf(ActionToken.SELECT_DISCARDABLE_STACK, DISCARD)),
                List.of(AutomatonNode.leaf(ActionToken.SELECT_DRAWABLE_STACK, DRAW)),
                List.of(AutomatonNode.branch(ActionToken.SELECT_PLAYER),
                        AutomatonNode.leaf(ActionToken.DO_ACTION, GESTURE)));
    }

    private static void expectTokens(List<InteractionStep> steps, ActionToken... expected) {
        List<ActionToken> received = steps.stream().map(InteractionStep::token).toList();
        if (!received.equals(List.of(expected))) {
            throw new InvalidInteractionException("Expected " + List.of(expected) + " but received " + received);
        }
    }

    private static Integer optionalIndex(InteractionStep step) {
        return step.hasPayload() ? step.expectIndex() : null;
    }
}
