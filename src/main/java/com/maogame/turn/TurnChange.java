package com.maogame.turn;

/**
 * A change of the turn order. {@link Rotate} reverses the direction before applying its
 * updater; {@link Update} keeps it.
 * <p>
 * The textual form is {@code <up|ro>_<set|up>_<n>}, for example {@code up_up_2} to skip a
 * player or {@code ro_up_1} to reverse and move one seat.
 */
public sealed interface TurnChange permits TurnChange.Update, TurnChange.Rotate {

    /** The change applied when no rule or card asks for anything else. */
    TurnChange DEFAULT = new Update(new TurnUpdater.Step(1));

    TurnUpdater updater();

    record Update(TurnUpdater updater) implements TurnChange {
        @Override
        public String toString() {
            return "up_" + updater;
        }
    }

    record Rotate(TurnUpdater updater) implements TurnChange {
        @Override
        public String toString() {
            return "ro_" + updater;
        }
    }

    /**
     * Parses the textual form.
     *
     * @param text the text to parse
     * @return the turn change
     * @throws IllegalArgumentException if the text is malformed
     */
    static TurnChange parse(String text) {
        String[] parts = text.trim().toLowerCase().split("_");
        if (parts.length != 3) {
            throw new IllegalArgumentException("Turn change must look like <up|ro>_<set|up>_<n>: " + text);
        }
        int amount;
        try {
            amount = Integer.parseInt(parts[2]);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid turn change amount in " + text, e);
        }
        TurnUpdater updater = switch (parts[1]) {
            case "set" -> new TurnUpdater.Set(amount);
            case "up" -> new TurnUpdater.Step(amount);
            default -> throw new IllegalArgumentException("Unknown turn updater '" + parts[1] + "' in " + text);
        };
        return switch (parts[0]) {
            case "up" -> new Update(updater);
            case "ro" -> new Rotate(updater);
            default -> throw new IllegalArgumentException("Unknown turn change '" + parts[0] + "' in " + text);
        };
    }
}
