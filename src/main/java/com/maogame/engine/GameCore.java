package com.maogame.engine;

import com.maogame.automaton.Automaton;
import com.maogame.automaton.AutomatonNode;
import com.maogame.automaton.InteractionResult;
import com.maogame.automaton.InteractionStep;
import com.maogame.config.CardEffect;
import com.maogame.config.CardEffects;
import com.maogame.config.CardEffectsLoader;
import com.maogame.config.GameConfig;
import com.maogame.domain.Card;
import com.maogame.domain.Player;
import com.maogame.domain.Stack;
import com.maogame.domain.StackType;
import com.maogame.errors.InvalidIndexException;
import com.maogame.errors.InvalidInteractionException;
import com.maogame.errors.NoStackAvailableException;
import com.maogame.errors.NotEnoughCardsException;
import com.maogame.errors.RuleActivationException;
import com.maogame.errors.RuleLoadingException;
import com.maogame.events.CardDiscarded;
import com.maogame.events.CardDrawn;
import com.maogame.events.CardEvent;
import com.maogame.events.CardPlayed;
import com.maogame.events.GameStart;
import com.maogame.events.Occurrence;
import com.maogame.events.PhysicalAction;
import com.maogame.events.PlayerPenalty;
import com.maogame.events.PlayerSaid;
import com.maogame.events.StackRanOut;
import com.maogame.events.VerifyRules;
import com.maogame.turn.TurnChange;
import com.maogame.turn.TurnTracker;
import com.maogame.verdicts.Disallow;
import com.maogame.verdicts.RuleVerdict;
import com.maogame.verdicts.Violation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.logging.Logger;

/**
 * State of a game and the entry points to act on it.
 * <p>
 * The core owns the table (stacks and players), the available and active rule modules, the
 * interaction automaton, the card-effect table and the turn order. Rule modules receive the
 * core with every occurrence and may change any of it.
 */
public class GameCore implements AutoCloseable {

    /** Engine version rule modules must be built against. */
    public static final String VERSION = "1.0";

    private static final Logger logger = Logger.getLogger(GameCore.class.getName());

    private final List<LoadedRule> availableRules;
    private final List<LoadedRule> activatedRules = new ArrayList<>();
    private final CardEffects cardEffects = new CardEffects();
    private final Automaton automaton = new Automaton();
    private final TurnTracker turn = new TurnTracker();
    private final EventPipeline pipeline = new EventPipeline(this);
    private final Map<String, Map<String, Object>> ruleStores = new HashMap<>();
    private final List<Player> players = new ArrayList<>();
    private final List<Stack> stacks = new ArrayList<>();
    private final Random random;

    private boolean caseSensitiveSay = true;
    private boolean canPlayOnNewStack;
    private int dealer;

    /**
     * @param availableRules the rules that can be activated during the game
     * @param baseEffects card effects that apply whatever rules are active
     * @param random source of randomness for shuffling
     * @throws RuleLoadingException if a rule has the wrong version or fails the start-up probe
     */
    public GameCore(List<LoadedRule> availableRules, CardEffects baseEffects, Random random) {
        this.availableRules = new ArrayList<>(availableRules);
        this.random = random;
        cardEffects.merge(baseEffects);
        automaton.extend(BasicActions.paths());
        verifyRules();
    }

    public GameCore(List<RuleModule> rules) {
        this(rules.stream().map(LoadedRule::inMemory).toList(), new CardEffects(), new Random());
    }

    /**
     * Builds a game from a settings file: loads the rule jars and the card-effect table, and
     * seats the configured players.
     */
    public static GameCore fromConfig(GameConfig config, Random random) {
        config.verify();
        List<LoadedRule> rules = config.rulesDirectory() == null
                ? List.of()
                : RuleLoader.loadDirectory(config.rulesDirectory());
        CardEffects effects = config.cardEffects() == null
                ? new CardEffects()
                : CardEffectsLoader.load(config.cardEffects());
        GameCore core = new GameCore(rules, effects, random);
        core.setCaseSensitiveSay(config.caseSensitiveSay());
        core.setCanPlayOnNewStack(config.canPlayOnNewStack());
        core.setPlayers(config.players());
        return core;
    }

    private void verifyRules() {
        List<String> failures = new ArrayList<>(
                RuleLoader.checkVersions(availableRules.stream().map(LoadedRule::module).toList()));
        for (LoadedRule rule : availableRules) {
            try {
                if (rule.module().onEvent(new VerifyRules(), this) == null) {
                    failures.add(rule.name() + ": returned no verdict");
                }
            } catch (RuntimeException e) {
                failures.add(rule.name() + ": " + e);
            }
        }
        if (!failures.isEmpty()) {
            throw new RuleLoadingException(failures);
        }
    }

    // ---------------------------------------------------------------- players and stacks

    /**
     * Seats new players with empty hands. The first seat plays first.
     */
    public void setPlayers(List<String> names) {
        players.clear();
        for (String name : names) {
            players.add(new Player(name));
        }
        turn.reset(0);
    }

    public List<Player> players() {
        return Collections.unmodifiableList(players);
    }

    public Player player(int index) {
        checkPlayer(index);
        return players.get(index);
    }

    public void setStacks(List<Stack> newStacks) {
        stacks.clear();
        stacks.addAll(newStacks);
    }

    public void addStack(Stack stack) {
        stacks.add(stack);
    }

    public List<Stack> stacks() {
        return Collections.unmodifiableList(stacks);
    }

    public Stack stack(int index) {
        checkStack(index);
        return stacks.get(index);
    }

    /**
     * @return the player holding no card, if any
     */
    public Optional<Player> winner() {
        return players.stream().filter(Player::hasEmptyHand).findFirst();
    }

    /**
     * Starts a new round: fresh shuffled deck, one face-up card, an empty discard pile, and
     * {@code handSize} cards for each player. The player after the dealer plays first.
     */
    public void initNewGame(int handSize) {
        for (Player player : players) {
            player.clearHand();
        }
        pipeline.clearLog();
        automaton.reset();

        List<Card> deck = Card.shuffledDeck(random);
        Stack drawable = Stack.drawable(deck);
        Stack playable = Stack.playable(List.of());
        drawable.pop().ifPresent(playable::push);
        setStacks(List.of(drawable, playable, Stack.discardable(List.of())));

        for (Player player : players) {
            player.addCards(drawCards(handSize));
        }
        turn.reset(players.isEmpty() ? 0 : (dealer + 1) % players.size());
        logger.info("New game with " + players.size() + " players, " + handSize + " cards each");
        pipeline.propagateAndExecute(turn.current(), new GameStart(), pipeline.onEvent(new GameStart()));
    }

    public void setDealer(int dealer) {
        checkPlayer(dealer);
        this.dealer = dealer;
    }

    public int dealer() {
        return dealer;
    }

    // ---------------------------------------------------------------- turn

    public int currentPlayer() {
        return turn.current();
    }

    public TurnTracker turn() {
        return turn;
    }

    public void updateTurn(TurnChange change) {
        turn.update(change, players.size());
        logger.info("Turn change " + change + ", now player " + turn.current());
    }

    boolean isTurnBoundary(int playerIndex, Occurrence occurrence) {
        return occurrence.changesTurn() && playerIndex == turn.current();
    }

    /**
     * Moves the turn after a turn-changing occurrence of the current player. A card played
     * without penalty applies its configured turn changes, anything else moves one seat.
     */
    void advanceTurn(int playerIndex, Occurrence occurrence, boolean tookPenalty) {
        if (!isTurnBoundary(playerIndex, occurrence)) {
            return;
        }
        turn.setPrevious(playerIndex);
        List<TurnChange> changes = new ArrayList<>();
        if (occurrence instanceof CardPlayed played && !tookPenalty) {
            for (CardEffect effect : cardEffects.lookup(played.event().card())) {
                if (effect instanceof CardEffect.TurnEffect turnEffect) {
                    changes.add(turnEffect.change());
                }
            }
        }
        if (changes.isEmpty()) {
            changes.add(TurnChange.DEFAULT);
        }
        for (TurnChange change : changes) {
            updateTurn(change);
        }
    }

    // ---------------------------------------------------------------- interactions

    public Automaton automaton() {
        return automaton;
    }

    public InteractionResult onAction(InteractionStep step) {
        return automaton.onAction(step);
    }

    public InteractionResult onActionIndexed(InteractionStep step, int index) {
        return automaton.onActionIndexed(step, index);
    }

    public Optional<AutomatonNode> cancelLastAction() {
        return automaton.cancelLast();
    }

    /**
     * Runs the handler of a resolved interaction.
     *
     * @param playerIndex the player who performed the interaction
     * @param leaf the resolved interaction
     * @return the violations the action produced
     */
    public List<Violation> execute(int playerIndex, InteractionResult.Leaf leaf) {
        checkPlayer(playerIndex);
        return leaf.handler().handle(playerIndex, this, leaf.steps());
    }

    /**
     * Plays a card from a hand onto a playable stack.
     *
     * @param playerIndex the player
     * @param cardIndex the card in the player's hand
     * @param stackIndex the playable stack, or null to open a new one
     * @return the violations, already penalized
     */
    public List<Violation> playCard(int playerIndex, int cardIndex, Integer stackIndex) {
        Card card = player(playerIndex).card(cardIndex);
        if (stackIndex == null) {
            if (!canPlayOnNewStack) {
                throw new InvalidInteractionException("A playable stack must be selected");
            }
        } else {
            requireStackType(stackIndex, StackType.PLAYABLE);
        }
        CardPlayed played = new CardPlayed(new CardEvent(card, cardIndex, playerIndex, stackIndex));
        List<RuleVerdict> verdicts = pipeline.onEvent(played);
        if (!RuleVerdict.allIgnored(verdicts) && !RuleVerdict.anyViolation(verdicts)) {
            moveToStack(played.event(), StackType.PLAYABLE);
        }
        return pipeline.propagateAndExecute(playerIndex, played, verdicts);
    }

    /**
     * Discards a card from a hand. The basic rules forbid it; a rule module must allow it.
     */
    public List<Violation> discardCard(int playerIndex, int cardIndex, Integer stackIndex) {
        Card card = player(playerIndex).card(cardIndex);
        int target = stackIndex != null ? stackIndex : firstStackOfType(StackType.DISCARDABLE);
        requireStackType(target, StackType.DISCARDABLE);
        CardDiscarded discarded = new CardDiscarded(new CardEvent(card, cardIndex, playerIndex, target));
        List<RuleVerdict> verdicts = pipeline.onEvent(discarded);
        if (!RuleVerdict.allIgnored(verdicts) && !RuleVerdict.anyViolation(verdicts)) {
            moveToStack(discarded.event(), StackType.DISCARDABLE);
        }
        return pipeline.propagateAndExecute(playerIndex, discarded, verdicts);
    }

    /**
     * Draws the top card of a drawable stack.
     *
     * @param playerIndex the player
     * @param stackIndex the drawable stack, or null for the first one holding cards
     * @return the violations, already penalized
     */
    public List<Violation> drawCard(int playerIndex, Integer stackIndex) {
        checkPlayer(playerIndex);
        int index = drawableStackWithCards(stackIndex);
        Stack stack = stacks.get(index);
        Card card = stack.pop().orElseThrow(() -> new NotEnoughCardsException(1));

        CardDrawn drawn = new CardDrawn(new CardEvent(card, stack.size(), playerIndex, index));
        List<RuleVerdict> verdicts = pipeline.onEvent(drawn);
        if (!RuleVerdict.allIgnored(verdicts)) {
            if (RuleVerdict.anyViolation(verdicts)) {
                stack.push(card);
            } else {
                players.get(playerIndex).addCard(card);
            }
        }
        return pipeline.propagateAndExecute(playerIndex, drawn, verdicts);
    }

    public List<Violation> say(int playerIndex, String message) {
        checkPlayer(playerIndex);
        PlayerSaid said = new PlayerSaid(playerIndex, message);
        return pipeline.propagateAndExecute(playerIndex, said, pipeline.onEvent(said));
    }

    public List<Violation> performGesture(int playerIndex, String name) {
        checkPlayer(playerIndex);
        PhysicalAction action = new PhysicalAction(playerIndex, name);
        return pipeline.propagateAndExecute(playerIndex, action, pipeline.onEvent(action));
    }

    /**
     * Checks the basic rules for playing a card.
     *
     * @param playerIndex the player
     * @param card the card to play
     * @param stackIndex the targeted stack, or null for a new stack
     * @return the outcome of the check
     */
    public PlayCheck checkPlay(int playerIndex, Card card, Integer stackIndex) {
        if (playerIndex != turn.current()) {
            return new PlayCheck.WrongTurn(playerIndex, turn.current());
        }
        if (stackIndex != null) {
            Optional<Card> top = stack(stackIndex).top();
            if (top.isPresent()
                    && !card.value().equals(top.get().value())
                    && card.color() != top.get().color()) {
                return new PlayCheck.CannotPlaceThisCard(card, top.get());
            }
        }
        return new PlayCheck.CanPlay();
    }

    /**
     * What happens to an occurrence every active rule ignored.
     */
    List<Violation> applyBasicRules(int playerIndex, Occurrence occurrence) {
        if (occurrence instanceof CardPlayed played) {
            return playWithBasicRules(playerIndex, played);
        }
        if (occurrence instanceof CardDrawn drawn) {
            players.get(playerIndex).addCard(drawn.event().card());
            List<Violation> violations = new ArrayList<>();
            if (isTurnBoundary(playerIndex, drawn)) {
                violations.addAll(pipeline.onTurnEnds());
            }
            advanceTurn(playerIndex, drawn, false);
            return violations;
        }
        if (occurrence instanceof CardDiscarded discarded) {
            Disallow refused = new Disallow(Disallow.BASIC_RULES, "You cannot discard a card");
            pipeline.applyPenalty(playerIndex, refused);
            pipeline.forget(discarded);
            return new ArrayList<>(List.of(refused));
        }
        if (occurrence instanceof PlayerPenalty penalty) {
            players.get(penalty.player()).addCards(drawCards(1));
            return new ArrayList<>();
        }
        if (occurrence instanceof StackRanOut ranOut) {
            collapseIntoDrawable(ranOut.stackIndex());
        }
        return new ArrayList<>();
    }

    private List<Violation> playWithBasicRules(int playerIndex, CardPlayed played) {
        CardEvent event = played.event();
        PlayCheck check = checkPlay(playerIndex, event.card(), event.stackIndex());
        List<Violation> violations = new ArrayList<>();
        boolean boundary = isTurnBoundary(playerIndex, played);
        if (check instanceof PlayCheck.CanPlay) {
            moveToStack(event, StackType.PLAYABLE);
            if (boundary) {
                violations.addAll(pipeline.onTurnEnds());
            }
            advanceTurn(playerIndex, played, false);
            return violations;
        }

        logger.info("Player " + playerIndex + " broke the basic rules: " + check.message());
        Disallow refused = new Disallow(Disallow.BASIC_RULES, check.message());
        violations.add(refused);
        pipeline.applyPenalty(playerIndex, refused);
        if (boundary) {
            violations.addAll(pipeline.onTurnEnds(played));
        } else {
            pipeline.forget(played);
        }
        advanceTurn(playerIndex, played, true);
        return violations;
    }

    private void moveToStack(CardEvent event, StackType type) {
        Card card = players.get(event.playerIndex()).removeCard(event.cardIndex());
        if (event.stackIndex() == null) {
            stacks.add(new Stack(List.of(card), true, EnumSet.of(type)));
        } else {
            stacks.get(event.stackIndex()).push(card);
        }
    }

    // ---------------------------------------------------------------- drawing and refilling

    /**
     * Takes cards from the drawable stacks, in stack order. When every drawable stack is empty
     * the table is refilled once.
     *
     * @param count the number of cards
     * @return the drawn cards
     * @throws NoStackAvailableException if the table has no drawable stack
     * @throws NotEnoughCardsException if the cards run out even after refilling
     */
    public List<Card> drawCards(int count) {
        List<Integer> drawable = stackIndexesOfType(StackType.DRAWABLE);
        if (drawable.isEmpty()) {
            throw new NoStackAvailableException("No drawable stack on the table");
        }
        List<Card> drawn = new ArrayList<>();
        boolean refilled = false;
        while (drawn.size() < count) {
            boolean allEmpty = drawable.stream().allMatch(i -> stacks.get(i).isEmpty());
            if (allEmpty) {
                if (refilled) {
                    throw new NotEnoughCardsException(count - drawn.size());
                }
                refillDrawableStack(drawable.get(0), true);
                refilled = true;
                continue;
            }
            for (int index : drawable) {
                Stack stack = stacks.get(index);
                while (drawn.size() < count && !stack.isEmpty()) {
                    stack.pop().ifPresent(drawn::add);
                }
            }
        }
        return drawn;
    }

    /**
     * Refills a drawable stack from the other stacks: every playable stack keeps its top card
     * and discard piles are emptied.
     *
     * @param stackIndex the stack to refill, or null for the first drawable stack
     * @param consultRules whether the rules may handle the refill themselves first
     */
    public void refillDrawableStack(Integer stackIndex, boolean consultRules) {
        int index = stackIndex != null ? stackIndex : firstStackOfType(StackType.DRAWABLE);
        requireStackType(index, StackType.DRAWABLE);
        StackRanOut ranOut = new StackRanOut(index);
        if (consultRules && !RuleVerdict.allIgnored(pipeline.onEvent(ranOut))) {
            logger.info("Refill of stack " + index + " handled by the rules");
            return;
        }
        applyBasicRules(turn.current(), ranOut);
    }

    private void collapseIntoDrawable(int index) {
        Stack target = stacks.get(index);
        List<Card> collected = new ArrayList<>();
        for (Stack stack : stacks) {
            if (stack == target) {
                continue;
            }
            if (stack.hasType(StackType.PLAYABLE)) {
                collected.addAll(stack.takeAllButTop());
            } else if (stack.hasType(StackType.DISCARDABLE)) {
                collected.addAll(stack.takeAll());
            }
        }
        Collections.shuffle(collected, random);
        target.addAll(collected);
        logger.info("Refilled stack " + index + " with " + collected.size() + " cards");
    }

    private int drawableStackWithCards(Integer stackIndex) {
        if (stackIndex != null) {
            requireStackType(stackIndex, StackType.DRAWABLE);
            if (stacks.get(stackIndex).isEmpty()) {
                refillDrawableStack(stackIndex, true);
            }
            if (stacks.get(stackIndex).isEmpty()) {
                throw new NotEnoughCardsException(1);
            }
            return stackIndex;
        }
        List<Integer> drawable = stackIndexesOfType(StackType.DRAWABLE);
        if (drawable.isEmpty()) {
            throw new NoStackAvailableException("No drawable stack on the table");
        }
        for (int index : drawable) {
            if (!stacks.get(index).isEmpty()) {
                return index;
            }
        }
        int first = drawable.get(0);
        refillDrawableStack(first, true);
        if (stacks.get(first).isEmpty()) {
            throw new NotEnoughCardsException(1);
        }
        return first;
    }

    private List<Integer> stackIndexesOfType(StackType type) {
        List<Integer> indexes = new ArrayList<>();
        for (int i = 0; i < stacks.size(); i++) {
            if (stacks.get(i).hasType(type)) {
                indexes.add(i);
            }
        }
        return indexes;
    }

    private int firstStackOfType(StackType type) {
        List<Integer> indexes = stackIndexesOfType(type);
        if (indexes.isEmpty()) {
            throw new NoStackAvailableException("No " + type.name().toLowerCase() + " stack on the table");
        }
        return indexes.get(0);
    }

    private void requireStackType(int index, StackType type) {
        checkStack(index);
        if (!stacks.get(index).hasType(type)) {
            throw new InvalidInteractionException("Stack " + index + " is not " + type.name().toLowerCase());
        }
    }

    private void checkStack(int index) {
        if (index < 0 || index >= stacks.size()) {
            throw new InvalidIndexException(InvalidIndexException.Target.STACK, index, stacks.size());
        }
    }

    private void checkPlayer(int index) {
        if (index < 0 || index >= players.size()) {
            throw new InvalidIndexException(InvalidIndexException.Target.PLAYER, index, players.size());
        }
    }

    // ---------------------------------------------------------------- rules

    public List<LoadedRule> availableRules() {
        return Collections.unmodifiableList(availableRules);
    }

    public List<LoadedRule> activatedRules() {
        return Collections.unmodifiableList(activatedRules);
    }

    public boolean isActivated(int ruleIndex) {
        checkRule(ruleIndex);
        return activatedRules.contains(availableRules.get(ruleIndex));
    }

    /**
     * Activates an available rule: it starts receiving occurrences, and its interaction paths
     * and card effects join the game.
     *
     * @throws InvalidIndexException if no rule has this index
     * @throws RuleActivationException if the rule is already active
     */
    public void activateRuleByIndex(int ruleIndex) {
        checkRule(ruleIndex);
        LoadedRule rule = availableRules.get(ruleIndex);
        if (activatedRules.contains(rule)) {
            throw new RuleActivationException("Rule " + rule.name() + " is already activated");
        }
        RuleData data = rule.module().ruleData();
        automaton.extend(data.taggedPaths());
        cardEffects.merge(data.cardEffects());
        activatedRules.add(rule);
        logger.info("Activated rule " + rule.name());
    }

    /**
     * Deactivates a rule and removes what it added to the game.
     *
     * @throws InvalidIndexException if no rule has this index
     * @throws RuleActivationException if the rule is not active
     */
    public void deactivateRuleByIndex(int ruleIndex) {
        checkRule(ruleIndex);
        LoadedRule rule = availableRules.get(ruleIndex);
        if (!activatedRules.contains(rule)) {
            throw new RuleActivationException("Rule " + rule.name() + " is not activated");
        }
        RuleData data = rule.module().ruleData();
        automaton.removePaths(data.taggedPaths());
        cardEffects.remove(data.cardEffects());
        activatedRules.remove(rule);
        rule.module().removeCardEffects(this);
        logger.info("Deactivated rule " + rule.name());
    }

    private void checkRule(int ruleIndex) {
        if (ruleIndex < 0 || ruleIndex >= availableRules.size()) {
            throw new InvalidIndexException(InvalidIndexException.Target.RULE, ruleIndex, availableRules.size());
        }
    }

    /**
     * Private storage of a rule, kept for the whole game.
     *
     * @param ruleName the owning rule
     * @return the mutable store of that rule
     */
    public Map<String, Object> ruleStore(String ruleName) {
        return ruleStores.computeIfAbsent(ruleName, name -> new HashMap<>());
    }

    // ---------------------------------------------------------------- misc

    public EventPipeline pipeline() {
        return pipeline;
    }

    public List<Occurrence> turnLog() {
        return pipeline.turnLog();
    }

    public CardEffects cardEffects() {
        return cardEffects;
    }

    /**
     * Physical actions a player can perform through the gesture path: every action the active
     * card effects ask for.
     */
    public List<String> possibleActions() {
        return cardEffects.physicalActions();
    }

    public boolean isCaseSensitiveSay() {
        return caseSensitiveSay;
    }

    public void setCaseSensitiveSay(boolean caseSensitiveSay) {
        this.caseSensitiveSay = caseSensitiveSay;
    }

    public boolean canPlayOnNewStack() {
        return canPlayOnNewStack;
    }

    public void setCanPlayOnNewStack(boolean canPlayOnNewStack) {
        this.canPlayOnNewStack = canPlayOnNewStack;
    }

    @Override
    public void close() {
        for (LoadedRule rule : availableRules) {
            rule.close();
        }
    }
}
