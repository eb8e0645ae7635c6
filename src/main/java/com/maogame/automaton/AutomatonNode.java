package com.maogame.automaton;

import java.util.Objects;

/**
 * Template of a node in the interaction automaton.
 * <p>
 * A node with a handler is a leaf, otherwise it is a branch. Leaves are identified by their
 * token and owning rule; branches by their token only.
 *
 * @param step the step template, its payload is ignored for matching
 * @param rule the name of the rule owning this node, or null for built-in nodes
 * @param handler the bound handler, or null for a branch
 */
public record AutomatonNode(InteractionStep step, String rule, InteractionHandler handler) {

    public AutomatonNode {
        Objects.requireNonNull(step, "step");
    }

    public static AutomatonNode branch(ActionToken token) {
        return new AutomatonNode(InteractionStep.of(token), null, null);
    }

    public static AutomatonNode leaf(ActionToken token, InteractionHandler handler) {
        return new AutomatonNode(InteractionStep.of(token), null, handler);
    }

    public static AutomatonNode leaf(ActionToken token, String rule, InteractionHandler handler) {
        return new AutomatonNode(InteractionStep.of(token), rule, handler);
    }

    public ActionToken token() {
        return step.token();
    }

    public boolean isLeaf() {
        return handler != null;
    }

    public AutomatonNode withRule(String newRule) {
        return new AutomatonNode(step, newRule, handler);
    }

    AutomatonNode withStep(InteractionStep newStep) {
        return new AutomatonNode(newStep, rule, handler);
    }

    /**
     * Whether this node occupies the same slot as another under one parent.
     */
    boolean sameSlotAs(AutomatonNode other) {
        if (token() != other.token() || isLeaf() != other.isLeaf()) {
            return false;
        }
        return !isLeaf() || Objects.equals(rule, other.rule);
    }

    @Override
    public String toString() {
        return (isLeaf() ? "Leaf[" : "Branch[") + step + (rule != null ? ", rule=" + rule : "") + "]";
    }
}
