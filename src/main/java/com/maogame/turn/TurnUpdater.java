package com.maogame.turn;

/**
 * How the current player index moves: to a fixed seat, or by a number of seats in the
 * current direction.
 */
public sealed interface TurnUpdater permits TurnUpdater.Set, TurnUpdater.Step {

    /**
     * @param index the seat that becomes current
     */
    record Set(int index) implements TurnUpdater {
        @Override
        public String toString() {
            return "set_" + index;
        }
    }

    /**
     * @param count the number of seats to move, negative values move backwards
     */
    record Step(int count) implements TurnUpdater {
        @Override
        public String toString() {
            return "up_" + count;
        }
    }
}
