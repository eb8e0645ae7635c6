package com.maogame.turn;

import com.maogame.errors.InvalidIndexException;

/**
 * Current player, previous player and play direction.
 */
public class TurnTracker {

    private int current;
    private int previous;
    private int direction = 1;

    public int current() {
        return current;
    }

    public int previous() {
        return previous;
    }

    /**
     * @return {@code 1} for clockwise play, {@code -1} after an odd number of rotations
     */
    public int direction() {
        return direction;
    }

    public void setPrevious(int previous) {
        this.previous = previous;
    }

    /**
     * Puts the tracker back to the given seat, playing clockwise.
     *
     * @param start the seat that plays first
     */
    public void reset(int start) {
        current = start;
        previous = start;
        direction = 1;
    }

    /**
     * Applies a turn change.
     *
     * @param change the change to apply
     * @param playerCount the number of seats at the table
     * @throws InvalidIndexException if a set targets a seat outside the table
     */
    public void update(TurnChange change, int playerCount) {
        if (playerCount <= 0) {
            throw new InvalidIndexException(InvalidIndexException.Target.PLAYER, current, playerCount);
        }
        TurnUpdater updater = change.updater();
        if (updater instanceof TurnUpdater.Set set && (set.index() < 0 || set.index() >= playerCount)) {
            throw new InvalidIndexException(InvalidIndexException.Target.PLAYER, set.index(), playerCount);
        }
        if (change instanceof TurnChange.Rotate) {
            direction = -direction;
        }
        if (updater instanceof TurnUpdater.Set set) {
            current = set.index();
        } else if (updater instanceof TurnUpdater.Step step) {
            int offset = Math.floorMod(step.count(), playerCount);
            current = Math.floorMod(current + direction * offset, playerCount);
        }
    }

    @Override
    public String toString() {
        return "TurnTracker[current=" + current + ", previous=" + previous + ", direction=" + direction + "]";
    }
}
