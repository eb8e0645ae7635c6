package com.maogame.engine;

import com.maogame.config.CardEffect;
import com.maogame.events.CardPlayed;
import com.maogame.events.EndPlayerTurn;
import com.maogame.events.Occurrence;
import com.maogame.events.PhysicalAction;
import com.maogame.events.PlayerPenalty;
import com.maogame.events.PlayerSaid;
import com.maogame.verdicts.Disallow;
import com.maogame.verdicts.ExecuteAfterTurnChange;
import com.maogame.verdicts.ExecuteBeforeTurnChange;
import com.maogame.verdicts.ForgetSomething;
import com.maogame.verdicts.OverrideBasicRule;
import com.maogame.verdicts.PenaltyHook;
import com.maogame.verdicts.RuleVerdict;
import com.maogame.verdicts.Verdict;
import com.maogame.verdicts.Violation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * Dispatches occurrences to the active rule modules and resolves their verdicts.
 * <p>
 * Recordable occurrences are appended to the turn log, which is drained each time a player's
 * turn is closed.
 */
public class EventPipeline {

    private static final Logger logger = Logger.getLogger(EventPipeline.class.getName());

    private final GameCore core;
    private final List<Occurrence> turnLog = new ArrayList<>();

    EventPipeline(GameCore core) {
        this.core = core;
    }

    /**
     * Offers an occurrence to every active rule module, in activation order.
     *
     * @param occurrence the occurrence
     * @return one verdict per active module
     */
    public List<RuleVerdict> onEvent(Occurrence occurrence) {
        logger.info("Processing occurrence: " + occurrence);
        if (occurrence.isRecordable()) {
            turnLog.add(occurrence);
        }

        List<RuleVerdict> verdicts = new ArrayList<>();
        for (LoadedRule rule : List.copyOf(core.activatedRules())) {
            RuleVerdict verdict = rule.module().onEvent(occurrence, core);
            if (verdict == null) {
                throw new IllegalStateException("Rule " + rule.name() + " returned no verdict for " + occurrence);
            }
            if (!verdict.isIgnored()) {
                logger.info("Verdict from " + rule.name() + ": " + verdict);
            }
            verdicts.add(verdict);
        }
        return verdicts;
    }

    /**
     * Resolves the verdicts collected for an occurrence.
     * <p>
     * When every rule ignored the occurrence the basic rules apply. Otherwise violations are
     * penalized, cross-rule callbacks get their second look, and the turn hooks run around the
     * turn change, which is skipped if any rule overrides it.
     *
     * @param playerIndex the player who caused the occurrence
     * @param occurrence the occurrence
     * @param verdicts the verdicts returned by {@link #onEvent(Occurrence)}
     * @return the violations committed by the player
     */
    public List<Violation> propagateAndExecute(int playerIndex, Occurrence occurrence, List<RuleVerdict> verdicts) {
        if (RuleVerdict.allIgnored(verdicts)) {
            return core.applyBasicRules(playerIndex, occurrence);
        }

        List<Violation> violations = new ArrayList<>();
        List<Verdict> deferred = new ArrayList<>();
        for (RuleVerdict ruleVerdict : verdicts) {
            Verdict verdict = ruleVerdict.verdict();
            if (verdict instanceof Violation violation) {
                violations.add(violation);
            } else if (verdict.isDeferred()) {
                deferred.add(verdict);
            }
        }
        for (Violation violation : violations) {
            applyPenalty(playerIndex, violation);
        }

        for (RuleVerdict ruleVerdict : verdicts) {
            if (ruleVerdict.crossRuleCallback() == null) {
                continue;
            }
            Verdict extra = ruleVerdict.crossRuleCallback()
                    .reconsider(core, occurrence, Collections.unmodifiableList(new ArrayList<>(deferred)));
            if (extra != null && extra.isDeferred()) {
                deferred.add(extra);
            }
        }

        boolean wrongInteraction = !violations.isEmpty();
        List<Violation> result = new ArrayList<>(violations);
        if (core.isTurnBoundary(playerIndex, occurrence)) {
            result.addAll(onTurnEnds(wrongInteraction ? occurrence : null));
        } else if (wrongInteraction) {
            forget(occurrence);
        }

        boolean overridden = false;
        for (Verdict verdict : deferred) {
            if (verdict instanceof OverrideBasicRule override) {
                overridden = true;
                override.hook().apply(core, playerIndex);
            } else if (verdict instanceof ExecuteBeforeTurnChange before) {
                before.hook().apply(core, playerIndex);
            }
        }
        if (!overridden) {
            core.advanceTurn(playerIndex, occurrence, wrongInteraction);
        }
        for (Verdict verdict : deferred) {
            if (verdict instanceof ExecuteAfterTurnChange after) {
                after.hook().apply(core, playerIndex);
            }
        }
        return result;
    }

    /**
     * Closes the current player's turn.
     * <p>
     * The occurrence that broke a rule, if any, is dropped from the log first. The log is then
     * cut after its most recent turn-changing entry; entries of other players in the cut part
     * are discarded, the rest is sent as an {@link EndPlayerTurn}. Finally the say and gesture
     * requirements of the cards played during the turn are checked.
     *
     * @param wrongOccurrence the violating occurrence that ends the turn, or {@code null}
     * @return the violations found while closing the turn, already penalized
     */
    public List<Violation> onTurnEnds(Occurrence wrongOccurrence) {
        if (wrongOccurrence != null) {
            forget(wrongOccurrence);
        }
        int closing = core.currentPlayer();

        int end = turnLog.size() - 1;
        for (int i = turnLog.size() - 1; i >= 0; i--) {
            if (turnLog.get(i).changesTurn()) {
                end = i;
                break;
            }
        }
        List<Occurrence> slice = turnLog.subList(0, end + 1);
        List<Occurrence> closedTurn = new ArrayList<>();
        for (Occurrence occurrence : slice) {
            if (occurrence.playerIndex().isEmpty() || occurrence.playerIndex().getAsInt() == closing) {
                closedTurn.add(occurrence);
            }
        }
        slice.clear();

        if (closedTurn.isEmpty()) {
            logger.info("Turn of player " + closing + " ended with nothing recorded");
            return new ArrayList<>();
        }

        EndPlayerTurn endPlayerTurn = new EndPlayerTurn(closing, closedTurn);
        List<Violation> violations = new ArrayList<>(
                propagateAndExecute(closing, endPlayerTurn, onEvent(endPlayerTurn)));

        List<Violation> forgotten = checkCardRequirements(closing, closedTurn);
        for (Violation violation : forgotten) {
            applyPenalty(closing, violation);
        }
        violations.addAll(forgotten);
        return violations;
    }

    /**
     * Closes the current player's turn after a legal action.
     */
    public List<Violation> onTurnEnds() {
        return onTurnEnds(null);
    }

    private List<Violation> checkCardRequirements(int closing, List<Occurrence> closedTurn) {
        String playerName = core.player(closing).name();
        List<Violation> forgotten = new ArrayList<>();
        for (Occurrence occurrence : closedTurn) {
            if (!(occurrence instanceof CardPlayed played)) {
                continue;
            }
            int player = played.event().playerIndex();
            for (CardEffect effect : core.cardEffects().lookup(played.event().card())) {
                if (effect instanceof CardEffect.SayEffect say && !hasSaid(closedTurn, player, say)) {
                    forgotten.add(new ForgetSomething(ForgetSomething.Kind.SAY, Disallow.BASIC_RULES, playerName));
                } else if (effect instanceof CardEffect.PhysicalEffect gesture && !hasDone(closedTurn, player, gesture)) {
                    forgotten.add(new ForgetSomething(ForgetSomething.Kind.DO, Disallow.BASIC_RULES, playerName));
                }
            }
        }
        return forgotten;
    }

    private boolean hasSaid(List<Occurrence> closedTurn, int player, CardEffect.SayEffect say) {
        for (Occurrence occurrence : closedTurn) {
            if (occurrence instanceof PlayerSaid said && said.player() == player
                    && say.isSatisfiedBy(said.message(), core.isCaseSensitiveSay())) {
                return true;
            }
        }
        return false;
    }

    private static boolean hasDone(List<Occurrence> closedTurn, int player, CardEffect.PhysicalEffect gesture) {
        for (Occurrence occurrence : closedTurn) {
            if (occurrence instanceof PhysicalAction action && action.player() == player
                    && action.name().equals(gesture.name())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Punishes a violation with its own penalty, or with the default one.
     */
    public void applyPenalty(int playerIndex, Violation violation) {
        logger.info("Penalty for player " + playerIndex + ": " + violation);
        PenaltyHook hook = violation.penalty();
        if (hook != null) {
            hook.apply(core, playerIndex);
        } else {
            applyDefaultPenalty(playerIndex);
        }
    }

    /**
     * Offers a {@link PlayerPenalty} to the rules; if none of them reacts the player draws
     * one card.
     */
    public void applyDefaultPenalty(int playerIndex) {
        PlayerPenalty penalty = new PlayerPenalty(playerIndex);
        if (RuleVerdict.allIgnored(onEvent(penalty))) {
            core.applyBasicRules(playerIndex, penalty);
        }
    }

    /**
     * Drops a recorded occurrence that turned out to be a violation.
     */
    void forget(Occurrence occurrence) {
        for (int i = turnLog.size() - 1; i >= 0; i--) {
            if (turnLog.get(i) == occurrence) {
                turnLog.remove(i);
                return;
            }
        }
    }

    public List<Occurrence> turnLog() {
        return Collections.unmodifiableList(turnLog);
    }

    void clearLog() {
        turnLog.clear();
    }
}
