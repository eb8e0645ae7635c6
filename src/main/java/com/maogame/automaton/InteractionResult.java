package com.maogame.automaton;

import java.util.List;

/**
 * Outcome of feeding one step to the {@link Automaton}.
 */
public sealed interface InteractionResult permits
        InteractionResult.NoInteractionFound,
        InteractionResult.AdvancedNextState,
        InteractionResult.Leaf,
        InteractionResult.Candidates {

    /** No child of the current node accepts the step. The cursor did not move. */
    record NoInteractionFound() implements InteractionResult {
    }

    /** The step matched a single branch; the cursor moved into it. */
    record AdvancedNextState() implements InteractionResult {
    }

    /**
     * The step resolved a leaf. The cursor is back at the root.
     *
     * @param steps the full step sequence, root first, ending with the incoming step
     * @param handler the handler bound to the leaf
     */
    record Leaf(List<InteractionStep> steps, InteractionHandler handler) implements InteractionResult {
        public Leaf {
            steps = List.copyOf(steps);
        }
    }

    /**
     * Several children accept the step. Leaves come first, branches last.
     *
     * @param nodes the candidates, in the order an index refers to
     */
    record Candidates(List<AutomatonNode> nodes) implements InteractionResult {
        public Candidates {
            nodes = List.copyOf(nodes);
        }
    }
}
