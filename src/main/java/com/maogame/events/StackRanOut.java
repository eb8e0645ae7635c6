package com.maogame.events;

/**
 * A drawable stack has no card left.
 *
 * @param stackIndex the exhausted stack
 */
public record StackRanOut(int stackIndex) implements Occurrence {

    @Override
    public String toString() {
        return "StackRanOut[stackIndex=" + stackIndex + "]";
    }
}
