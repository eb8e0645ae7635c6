package com.maogame.verdicts;

/**
 * The occurrence is not allowed.
 *
 * @param rule the rule refusing the occurrence
 * @param reason the message shown to the player
 * @param penalty the penalty to apply instead of the default one, may be null
 */
public record Disallow(String rule, String reason, PenaltyHook penalty) implements Verdict, Violation {

    /** Rule name used for violations of the built-in rules. */
    public static final String BASIC_RULES = "Basic Rules";

    public Disallow(String rule, String reason) {
        this(rule, reason, null);
    }

    @Override
    public String toString() {
        return "Disallow[rule=" + rule + ", reason=" + reason + "]";
    }
}
