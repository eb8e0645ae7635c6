package com.maogame.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import com.maogame.domain.CardValue;
import com.maogame.errors.InvalidConfigException;
import com.maogame.turn.TurnChange;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Reads a card-effect table written in TOML.
 * <pre>
 * [[card_effects]]
 * value = 7
 * effects = [{ turn = "up_up_2" }]
 *
 * [[card_effects]]
 * type = "heart"
 * effects = [{ say_any = ["nice heart", "lovely heart"] }, { physical = "knock" }]
 * </pre>
 */
public final class CardEffectsLoader {

    private static final Logger logger = Logger.getLogger(CardEffectsLoader.class.getName());

    static final ObjectMapper MAPPER = TomlMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    record EffectEntry(
            @JsonProperty("turn") String turn,
            @JsonProperty("say") String say,
            @JsonProperty("say_any") List<String> sayAny,
            @JsonProperty("physical") String physical) {
    }

    record SelectorEntry(
            @JsonProperty("value") String value,
            @JsonProperty("type") String type,
            @JsonProperty("effects") List<EffectEntry> effects) {
    }

    record EffectsFile(@JsonProperty("card_effects") List<SelectorEntry> cardEffects) {
    }

    private CardEffectsLoader() {
    }

    public static CardEffects load(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            CardEffects effects = read(in);
            logger.info("Loaded card effects from " + file + ": " + effects.entries().size() + " selectors");
            return effects;
        } catch (IOException e) {
            throw new InvalidConfigException("Cannot read card effects from " + file, e);
        }
    }

    /**
     * @param in the TOML document
     * @return the parsed table
     * @throws InvalidConfigException if the document is not a valid effect table
     */
    public static CardEffects read(InputStream in) {
        EffectsFile file;
        try {
            file = MAPPER.readValue(in, EffectsFile.class);
        } catch (IOException e) {
            throw new InvalidConfigException("Malformed card effects table: " + e.getMessage(), e);
        }
        CardEffects effects = new CardEffects();
        if (file == null || file.cardEffects() == null) {
            return effects;
        }
        for (SelectorEntry entry : file.cardEffects()) {
            CardSelector selector = toSelector(entry);
            List<CardEffect> parsed = new ArrayList<>();
            if (entry.effects() != null) {
                for (EffectEntry effect : entry.effects()) {
                    parsed.add(toEffect(selector, effect));
                }
            }
            effects.add(selector, parsed);
        }
        return effects;
    }

    private static CardSelector toSelector(SelectorEntry entry) {
        if (entry.value() == null && entry.type() == null) {
            throw new InvalidConfigException("Card effect entry needs a value, a type, or both");
        }
        String value = null;
        if (entry.value() != null) {
            try {
                value = CardValue.parse(entry.value()).key();
            } catch (IllegalArgumentException e) {
                throw new InvalidConfigException(e.getMessage(), e);
            }
        }
        String type = entry.type() == null ? null : entry.type().trim().toLowerCase();
        return new CardSelector(value, type);
    }

    private static CardEffect toEffect(CardSelector selector, EffectEntry entry) {
        int declared = (entry.turn() != null ? 1 : 0)
                + (entry.say() != null ? 1 : 0)
                + (entry.sayAny() != null ? 1 : 0)
                + (entry.physical() != null ? 1 : 0);
        if (declared != 1) {
            throw new InvalidConfigException("Effect of " + selector
                    + " must declare exactly one of turn, say, say_any, physical");
        }
        if (entry.turn() != null) {
            try {
                return new CardEffect.TurnEffect(TurnChange.parse(entry.turn()));
            } catch (IllegalArgumentException e) {
                throw new InvalidConfigException(e.getMessage(), e);
            }
        }
        if (entry.say() != null) {
            return new CardEffect.SayEffect(List.of(entry.say()));
        }
        if (entry.sayAny() != null) {
            if (entry.sayAny().isEmpty()) {
                throw new InvalidConfigException("say_any of " + selector + " is empty");
            }
            return new CardEffect.SayEffect(entry.sayAny());
        }
        return new CardEffect.PhysicalEffect(entry.physical());
    }
}
