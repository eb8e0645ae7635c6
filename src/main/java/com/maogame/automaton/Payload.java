package com.maogame.automaton;

import com.maogame.errors.InvalidInteractionException;

/**
 * Value attached to an interaction step: either a numeric index or a free-form text.
 */
public sealed interface Payload permits Payload.Index, Payload.Text {

    /**
     * Returns the index carried by this payload.
     *
     * @return the index
     * @throws InvalidInteractionException if this payload is not an index
     */
    default int expectIndex() {
        if (this instanceof Index index) {
            return index.value();
        }
        throw new InvalidInteractionException("Expected an index payload but got " + this);
    }

    /**
     * Returns the text carried by this payload.
     *
     * @return the text
     * @throws InvalidInteractionException if this payload is not a text
     */
    default String expectText() {
        if (this instanceof Text text) {
            return text.value();
        }
        throw new InvalidInteractionException("Expected a text payload but got " + this);
    }

    record Index(int value) implements Payload {
        @Override
        public String toString() {
            return "Index[" + value + "]";
        }
    }

    record Text(String value) implements Payload {
        @Override
        public String toString() {
            return "Text[" + value + "]";
        }
    }
}
