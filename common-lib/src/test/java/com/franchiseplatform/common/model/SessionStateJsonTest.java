package com.franchiseplatform.common.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * JSON shape of the session-state union as the service layer would publish it.
 */
class SessionStateJsonTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    @DisplayName("phone-dead state carries its tag and cooldown")
    void phoneDead() throws Exception {
        String json = mapper.writeValueAsString(new SessionState.PhoneDead(7));

        assertTrue(json.contains("\"state\":\"PHONE_DEAD\""), json);
        assertTrue(json.contains("\"untilRound\":7"), json);
        assertFalse(json.contains("terminal"), json);
        assertEquals(new SessionState.PhoneDead(7), mapper.readValue(json, SessionState.class));
    }

    @Test
    @DisplayName("lockout round-trips with its reason")
    void lockedOut() throws Exception {
        SessionState state = new SessionState.LockedOut("too many lowball offers (2)");
        SessionState back = mapper.readValue(mapper.writeValueAsString(state), SessionState.class);

        assertEquals(state, back);
        assertTrue(back.isTerminal());
    }

    @Test
    @DisplayName("shadow approach nests the advisor event")
    void shadowPending() throws Exception {
        SessionState state = new SessionState.ShadowPending(
            new ShadowAdvisorEvent("Cousin Ray", "Jordan Reyes", 23_000_000L, 4));
        String json = mapper.writeValueAsString(state);

        assertTrue(json.contains("\"advisorName\":\"Cousin Ray\""), json);
        assertEquals(state, mapper.readValue(json, SessionState.class));
    }
}
