package com.maogame.errors;

import java.util.List;

/**
 * One or more rule modules could not be loaded or validated.
 * All failures found in a single pass are reported together.
 */
public class RuleLoadingException extends GameException {

    private final List<String> failures;

    public RuleLoadingException(List<String> failures) {
        super("Invalid rule modules:\n  " + String.join("\n  ", failures));
        this.failures = List.copyOf(failures);
    }

    public List<String> failures() {
        return failures;
    }
}
