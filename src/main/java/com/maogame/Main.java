package com.maogame;

import com.maogame.automaton.ActionToken;
import com.maogame.automaton.InteractionResult;
import com.maogame.automaton.InteractionStep;
import com.maogame.config.CardEffects;
import com.maogame.config.CardEffectsLoader;
import com.maogame.config.GameConfig;
import com.maogame.domain.Card;
import com.maogame.domain.Player;
import com.maogame.domain.StackType;
import com.maogame.engine.GameCore;
import com.maogame.engine.PlayCheck;
import com.maogame.verdicts.Violation;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Random;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Entry point playing a short automatic game and logging what happens.
 * <p>
 * With a settings file as first argument the game is built from it; otherwise three players
 * play with the card effects bundled in the jar.
 */
public class Main {

    static {
        try (InputStream is = Main.class.getResourceAsStream("/logging.properties")) {
            if (is != null) {
                LogManager.getLogManager().readConfiguration(is);
            }
        } catch (IOException e) {
            Logger.getLogger(Main.class.getName()).log(Level.WARNING, "Cannot read logging.properties, using defaults", e);
        }
    }

    private static final Logger logger = Logger.getLogger(Main.class.getName());

    private static final int MAX_MOVES = 30;

    public static void main(String[] args) {
        Random random = new Random(42);
        GameCore core;
        int handSize;
        if (args.length > 0) {
            GameConfig config = GameConfig.load(Path.of(args[0]));
            core = GameCore.fromConfig(config, random);
            handSize = config.handSize();
        } else {
            core = new GameCore(List.of(), bundledCardEffects(), random);
            core.setPlayers(List.of("alice", "bob", "carol"));
            handSize = 5;
        }
        try (core) {
            runDemo(core, handSize);
        }
    }

    static CardEffects bundledCardEffects() {
        try (InputStream in = Main.class.getResourceAsStream("/card-effects.toml")) {
            if (in == null) {
                return new CardEffects();
            }
            return CardEffectsLoader.read(in);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read bundled card effects", e);
        }
    }

    /**
     * Deals and lets every player in turn play the first card the basic rules accept, or draw.
     *
     * @return the number of moves played
     */
    public static int runDemo(GameCore core, int handSize) {
        logger.info("=== Mao Demo ===");
        core.initNewGame(handSize);

        int moves = 0;
        while (moves < MAX_MOVES && core.winner().isEmpty()) {
            int player = core.currentPlayer();
            List<Violation> violations = playOrDraw(core, player);
            for (Violation violation : violations) {
                logger.info(core.player(player).name() + " was penalized: " + violation.reason());
            }
            moves++;
        }

        core.winner().ifPresentOrElse(
                winner -> logger.info("Winner: " + winner.name()),
                () -> logger.info("No winner after " + MAX_MOVES + " moves"));
        for (Player player : core.players()) {
            logger.info(player.name() + " holds " + player.hand().size() + " cards");
        }
        return moves;
    }

    private static List<Violation> playOrDraw(GameCore core, int player) {
        int playable = firstStack(core, StackType.PLAYABLE);
        List<Card> hand = core.player(player).hand();
        for (int i = 0; i < hand.size(); i++) {
            if (core.checkPlay(player, hand.get(i), playable) instanceof PlayCheck.CanPlay) {
                core.onAction(InteractionStep.of(ActionToken.SELECT_CARD, i));
                return resolve(core, player, InteractionStep.of(ActionToken.SELECT_PLAYABLE_STACK, playable));
            }
        }
        return resolve(core, player, InteractionStep.of(ActionToken.SELECT_DRAWABLE_STACK));
    }

    private static List<Violation> resolve(GameCore core, int player, InteractionStep step) {
        InteractionResult result = core.onAction(step);
        if (result instanceof InteractionResult.Leaf leaf) {
            return core.execute(player, leaf);
        }
        core.automaton().reset();
        logger.info("Interaction " + step + " did not resolve: " + result);
        return List.of();
    }

    private static int firstStack(GameCore core, StackType type) {
        for (int i = 0; i < core.stacks().size(); i++) {
            if (core.stacks().get(i).hasType(type)) {
                return i;
            }
        }
        throw new IllegalStateException("No " + type + " stack on the table");
    }
}
