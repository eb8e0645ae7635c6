package com.maogame;

import com.maogame.engine.GameCore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Main Demo Tests")
class MainTest {

    @Test
    @DisplayName("Bundled card effects are found on the class path")
    void bundledEffects() {
        assertFalse(Main.bundledCardEffects().isEmpty());
    }

    @Test
    @DisplayName("The demo game runs to completion")
    void demoRuns() {
        try (GameCore core = new GameCore(List.of(), Main.bundledCardEffects(), new Random(3))) {
            core.setPlayers(List.of("alice", "bob"));

            int moves = Main.runDemo(core, 4);

            assertTrue(moves > 0);
            assertEquals(3, core.stacks().size());
        }
    }
}
