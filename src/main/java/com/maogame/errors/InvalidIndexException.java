package com.maogame.errors;

/**
 * Index outside the bounds of the collection it addresses.
 */
public class InvalidIndexException extends GameException {

    /**
     * What the rejected index was meant to address.
     */
    public enum Target {
        PLAYER, CARD, STACK, RULE
    }

    private final Target target;
    private final int index;

    public InvalidIndexException(Target target, int index, int size) {
        super("Invalid " + target.name().toLowerCase() + " index " + index + " (size " + size + ")");
        this.target = target;
        this.index = index;
    }

    public Target target() {
        return target;
    }

    public int index() {
        return index;
    }
}
