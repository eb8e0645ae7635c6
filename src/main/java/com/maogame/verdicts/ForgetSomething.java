package com.maogame.verdicts;

/**
 * The player forgot to say or do something the rules required.
 *
 * @param kind what was forgotten
 * @param rule the rule that required it
 * @param playerName the display name of the forgetful player
 * @param penalty the penalty to apply instead of the default one, may be null
 */
public record ForgetSomething(Kind kind, String rule, String playerName, PenaltyHook penalty)
        implements Verdict, Violation {

    public enum Kind {
        SAY("You forget to say something"),
        DO("You forget to do something");

        private final String message;

        Kind(String message) {
            this.message = message;
        }

        public String message() {
            return message;
        }
    }

    public ForgetSomething(Kind kind, String rule, String playerName) {
        this(kind, rule, playerName, null);
    }

    @Override
    public String reason() {
        return kind.message();
    }

    @Override
    public String toString() {
        return "ForgetSomething[kind=" + kind + ", rule=" + rule + ", player=" + playerName + "]";
    }
}
