package com.franchiseplatform.common.leverage;

import com.franchiseplatform.common.model.Leverage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LeverageInterpreterTest {

    @Test
    @DisplayName("gap beyond the margin names the dominant side")
    void dominantParty() {
        assertEquals(LeverageInterpreter.Party.USER,     LeverageInterpreter.dominantParty(new Leverage(0.8, 0.3)));
        assertEquals(LeverageInterpreter.Party.AGENT,    LeverageInterpreter.dominantParty(new Leverage(0.2, 0.7)));
        assertEquals(LeverageInterpreter.Party.BALANCED, LeverageInterpreter.dominantParty(new Leverage(0.5, 0.4)));
    }

    @Test
    @DisplayName("gap is user minus agent")
    void gap() {
        assertEquals(-0.25, LeverageInterpreter.gap(new Leverage(0.25, 0.5)), 1e-9);
    }

    @Test
    @DisplayName("describe() matches the dominant party")
    void describe() {
        assertTrue(LeverageInterpreter.describe(new Leverage(0.9, 0.1)).startsWith("You hold"));
        assertTrue(LeverageInterpreter.describe(Leverage.balanced()).contains("balanced"));
    }
}
