package com.maogame.events;

/**
 * Probe sent to each rule module when the engine starts, to check it answers at all.
 */
public record VerifyRules() implements Occurrence {

    @Override
    public String toString() {
        return "VerifyRules";
    }
}
