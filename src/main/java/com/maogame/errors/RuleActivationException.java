package com.maogame.errors;

/**
 * Activation of an active rule, or deactivation of an inactive one.
 */
public class RuleActivationException extends GameException {

    public RuleActivationException(String message) {
        super(message);
    }
}
