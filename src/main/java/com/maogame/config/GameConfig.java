package com.maogame.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.maogame.errors.InvalidConfigException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Settings of a game, read from a TOML file.
 * <pre>
 * rules_directory = "rules"
 * card_effects = "card-effects.toml"
 * hand_size = 7
 * case_sensitive_say = false
 * can_play_on_new_stack = false
 * players = ["alice", "bob", "carol"]
 * </pre>
 * Relative paths are resolved against the directory of the settings file.
 *
 * @param rulesDirectory directory scanned for rule module jars, may be null
 * @param cardEffects card-effect table file, may be null
 * @param handSize cards dealt to each player
 * @param caseSensitiveSay whether say requirements compare case
 * @param canPlayOnNewStack whether a card may open a new playable stack
 * @param players display names of the players, in seating order
 */
public record GameConfig(
        @JsonProperty("rules_directory") Path rulesDirectory,
        @JsonProperty("card_effects") Path cardEffects,
        @JsonProperty("hand_size") Integer handSize,
        @JsonProperty("case_sensitive_say") Boolean caseSensitiveSay,
        @JsonProperty("can_play_on_new_stack") Boolean canPlayOnNewStack,
        @JsonProperty("players") List<String> players) {

    public static final int DEFAULT_HAND_SIZE = 7;

    public GameConfig {
        handSize = handSize == null ? DEFAULT_HAND_SIZE : handSize;
        caseSensitiveSay = caseSensitiveSay == null ? Boolean.TRUE : caseSensitiveSay;
        canPlayOnNewStack = canPlayOnNewStack == null ? Boolean.FALSE : canPlayOnNewStack;
        players = players == null ? List.of() : List.copyOf(players);
        if (handSize < 0) {
            throw new InvalidConfigException("hand_size must not be negative: " + handSize);
        }
    }

    public static GameConfig defaults() {
        return new GameConfig(null, null, null, null, null, null);
    }

    public static GameConfig load(Path file) {
        GameConfig raw;
        try (InputStream in = Files.newInputStream(file)) {
            raw = CardEffectsLoader.MAPPER.readValue(in, GameConfig.class);
        } catch (IOException e) {
            throw new InvalidConfigException("Cannot read game configuration " + file + ": " + e.getMessage(), e);
        }
        Path base = file.toAbsolutePath().getParent();
        return new GameConfig(
                resolve(base, raw.rulesDirectory()),
                resolve(base, raw.cardEffects()),
                raw.handSize(),
                raw.caseSensitiveSay(),
                raw.canPlayOnNewStack(),
                raw.players());
    }

    /**
     * Checks the referenced files exist.
     *
     * @throws InvalidConfigException if the rules directory or the card-effect file is missing
     */
    public void verify() {
        if (rulesDirectory != null && !Files.isDirectory(rulesDirectory)) {
            throw new InvalidConfigException("Rules directory is not a directory: " + rulesDirectory);
        }
        if (cardEffects != null && !Files.isRegularFile(cardEffects)) {
            throw new InvalidConfigException("Card effects file not found: " + cardEffects);
        }
    }

    private static Path resolve(Path base, Path path) {
        if (path == null || path.isAbsolute() || base == null) {
            return path;
        }
        return base.resolve(path).normalize();
    }
}
