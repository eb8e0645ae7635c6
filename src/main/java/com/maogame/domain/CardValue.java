package com.maogame.domain;

/**
 * Face value of a card. Besides plain numbers, two sentinel values sit below and above
 * every number.
 *
 * @param number the numeric value
 */
public record CardValue(int number) {

    public static final CardValue MINUS_INFINITY = new CardValue(Integer.MIN_VALUE);
    public static final CardValue PLUS_INFINITY = new CardValue(Integer.MAX_VALUE);

    private static final String MINUS_INFINITY_KEY = "minus_infinity";
    private static final String PLUS_INFINITY_KEY = "plus_infinity";

    public static CardValue of(int number) {
        return new CardValue(number);
    }

    /**
     * Parses the key form produced by {@link #key()}.
     *
     * @param key a number or one of the infinity keys
     * @return the value
     * @throws IllegalArgumentException if the key is not recognised
     */
    public static CardValue parse(String key) {
        String trimmed = key.trim().toLowerCase();
        if (MINUS_INFINITY_KEY.equals(trimmed)) {
            return MINUS_INFINITY;
        }
        if (PLUS_INFINITY_KEY.equals(trimmed)) {
            return PLUS_INFINITY;
        }
        try {
            return new CardValue(Integer.parseInt(trimmed));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Unknown card value: " + key, e);
        }
    }

    /**
     * @return the key used by the card-effect table
     */
    public String key() {
        if (this.equals(MINUS_INFINITY)) {
            return MINUS_INFINITY_KEY;
        }
        if (this.equals(PLUS_INFINITY)) {
            return PLUS_INFINITY_KEY;
        }
        return Integer.toString(number);
    }

    @Override
    public String toString() {
        return key();
    }
}
