package com.maogame.turn;

import com.maogame.errors.InvalidIndexException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Turn Tracker Tests")
class TurnTrackerTest {

    private static final int PLAYERS = 4;

    private TurnTracker tracker;

    @BeforeEach
    void setUp() {
        tracker = new TurnTracker();
        tracker.reset(1);
    }

    @Nested
    @DisplayName("Updates")
    class Updates {

        @Test
        @DisplayName("Should leave everything unchanged on a step of zero")
        void stepZeroIsIdentity() {
            tracker.update(new TurnChange.Update(new TurnUpdater.Step(0)), PLAYERS);

            assertEquals(1, tracker.current());
            assertEquals(1, tracker.direction());
        }

        @Test
        @DisplayName("Should wrap a step around the table")
        void stepWraps() {
            tracker.update(new TurnChange.Update(new TurnUpdater.Step(5)), PLAYERS);

            assertEquals(2, tracker.current());
        }

        @Test
        @DisplayName("Should wrap a huge step without overflowing")
        void hugeStep() {
            tracker.reset(2);

            tracker.update(TurnChange.parse("up_up_" + Integer.MAX_VALUE), 3);

            assertEquals(0, tracker.current());
        }

        @Test
        @DisplayName("Should move backwards on a negative step")
        void negativeStep() {
            tracker.update(new TurnChange.Update(new TurnUpdater.Step(-2)), PLAYERS);

            assertEquals(3, tracker.current());
        }

        @Test
        @DisplayName("Should jump to the seat on set")
        void set() {
            tracker.update(new TurnChange.Update(new TurnUpdater.Set(3)), PLAYERS);

            assertEquals(3, tracker.current());
            assertEquals(1, tracker.direction());
        }

        @Test
        @DisplayName("Should reject a set outside the table and change nothing")
        void setOutOfRange() {
            assertThrows(InvalidIndexException.class,
                    () -> tracker.update(new TurnChange.Rotate(new TurnUpdater.Set(PLAYERS)), PLAYERS));

            assertEquals(1, tracker.current());
            assertEquals(1, tracker.direction());
        }
    }

    @Nested
    @DisplayName("Rotations")
    class Rotations {

        @Test
        @DisplayName("Should flip the direction exactly once on rotate")
        void rotateFlipsOnce() {
            tracker.update(new TurnChange.Rotate(new TurnUpdater.Step(0)), PLAYERS);
            assertEquals(-1, tracker.direction());
            assertEquals(1, tracker.current());

            tracker.update(new TurnChange.Rotate(new TurnUpdater.Step(0)), PLAYERS);
            assertEquals(1, tracker.direction());
        }

        @Test
        @DisplayName("Should step in the new direction after a rotate")
        void rotateThenStep() {
            tracker.update(new TurnChange.Rotate(new TurnUpdater.Step(1)), PLAYERS);

            assertEquals(0, tracker.current());

            tracker.update(TurnChange.DEFAULT, PLAYERS);
            assertEquals(3, tracker.current());
        }

        @Test
        @DisplayName("Should flip and jump on rotate with set")
        void rotateSet() {
            tracker.update(new TurnChange.Rotate(new TurnUpdater.Set(0)), PLAYERS);

            assertEquals(0, tracker.current());
            assertEquals(-1, tracker.direction());
        }
    }

    @Nested
    @DisplayName("Parsing")
    class Parsing {

        @Test
        @DisplayName("Should parse updates and rotations")
        void parses() {
            assertEquals(new TurnChange.Update(new TurnUpdater.Step(2)), TurnChange.parse("up_up_2"));
            assertEquals(new TurnChange.Rotate(new TurnUpdater.Set(0)), TurnChange.parse("ro_set_0"));
            assertEquals(new TurnChange.Update(new TurnUpdater.Step(-1)), TurnChange.parse("UP_UP_-1"));
        }

        @Test
        @DisplayName("Should print the parsable form")
        void printsParsableForm() {
            TurnChange change = new TurnChange.Rotate(new TurnUpdater.Step(3));

            assertEquals(change, TurnChange.parse(change.toString()));
        }

        @Test
        @DisplayName("Should reject malformed text")
        void rejectsMalformed() {
            assertThrows(IllegalArgumentException.class, () -> TurnChange.parse("up_2"));
            assertThrows(IllegalArgumentException.class, () -> TurnChange.parse("sideways_up_1"));
            assertThrows(IllegalArgumentException.class, () -> TurnChange.parse("up_jump_1"));
            assertThrows(IllegalArgumentException.class, () -> TurnChange.parse("up_up_two"));
        }
    }
}
