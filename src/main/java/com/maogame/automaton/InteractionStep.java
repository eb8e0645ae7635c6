package com.maogame.automaton;

import com.maogame.errors.InvalidInteractionException;

/**
 * One step of a player interaction: a token and an optional payload.
 * Only the token takes part in automaton matching.
 *
 * @param token the action token
 * @param payload the attached value, or null when the step carries none
 */
public record InteractionStep(ActionToken token, Payload payload) {

    public InteractionStep {
        if (token == null) {
            throw new IllegalArgumentException("token must not be null");
        }
    }

    public static InteractionStep of(ActionToken token) {
        return new InteractionStep(token, null);
    }

    public static InteractionStep of(ActionToken token, int index) {
        return new InteractionStep(token, new Payload.Index(index));
    }

    public static InteractionStep of(ActionToken token, String text) {
        return new InteractionStep(token, new Payload.Text(text));
    }

    public boolean hasPayload() {
        return payload != null;
    }

    /**
     * @return the index payload of this step
     * @throws InvalidInteractionException if the step carries no index
     */
    public int expectIndex() {
        return requirePayload().expectIndex();
    }

    /**
     * @return the text payload of this step
     * @throws InvalidInteractionException if the step carries no text
     */
    public String expectText() {
        return requirePayload().expectText();
    }

    /**
     * Returns a copy of this step carrying the given payload.
     *
     * @param newPayload the payload, may be null
     * @return the new step
     */
    public InteractionStep withPayload(Payload newPayload) {
        return new InteractionStep(token, newPayload);
    }

    private Payload requirePayload() {
        if (payload == null) {
            throw new InvalidInteractionException("Step " + token + " carries no payload");
        }
        return payload;
    }

    @Override
    public String toString() {
        return payload == null ? token.name() : token + "(" + payload + ")";
    }
}
