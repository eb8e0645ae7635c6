package com.maogame.verdicts;

import java.util.List;

/**
 * What one rule module returned for an occurrence: its verdict and an optional
 * cross-rule callback.
 *
 * @param verdict the first-pass verdict
 * @param crossRuleCallback the second-pass callback, or null
 */
public record RuleVerdict(Verdict verdict, CrossRuleCallback crossRuleCallback) {

    private static final RuleVerdict IGNORED = new RuleVerdict(Verdict.IGNORED, null);

    public static RuleVerdict ignored() {
        return IGNORED;
    }

    public static RuleVerdict of(Verdict verdict) {
        return new RuleVerdict(verdict, null);
    }

    public boolean isIgnored() {
        return verdict instanceof Ignored;
    }

    public static boolean allIgnored(List<RuleVerdict> verdicts) {
        return verdicts.stream().allMatch(RuleVerdict::isIgnored);
    }

    public static boolean anyViolation(List<RuleVerdict> verdicts) {
        return verdicts.stream().anyMatch(v -> v.verdict() instanceof Violation);
    }

    @Override
    public String toString() {
        return crossRuleCallback == null ? verdict.toString() : verdict + " (+cross-rule)";
    }
}
