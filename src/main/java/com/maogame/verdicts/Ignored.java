package com.maogame.verdicts;

/**
 * The rule module has nothing to say about the occurrence.
 */
public record Ignored() implements Verdict {

    @Override
    public String toString() {
        return "Ignored";
    }
}
