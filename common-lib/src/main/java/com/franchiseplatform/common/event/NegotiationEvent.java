package com.franchiseplatform.common.event;

import com.franchiseplatform.common.model.PressLeak;
import com.franchiseplatform.common.model.ShadowAdvisorEvent;

/**
 * Something the scheduler made happen to a session in the round just played.
 * Returned alongside the new session so callers can surface it.
 */
public sealed interface NegotiationEvent permits
        NegotiationEvent.PressLeakPublished,
        NegotiationEvent.PhoneWentDead,
        NegotiationEvent.ShadowAdvisorApproached,
        NegotiationEvent.NegotiationsLockedOut {

    String playerId();

    int round();

    String eventType();

    // ── event types ──────────────────────────────────────────────────────────

    record PressLeakPublished(String playerId, int round, PressLeak leak) implements NegotiationEvent {
        public String eventType() { return "PRESS_LEAK"; }
    }

    record PhoneWentDead(String playerId, int round, int untilRound) implements NegotiationEvent {
        public String eventType() { return "PHONE_DEAD"; }
    }

    record ShadowAdvisorApproached(String playerId, int round, ShadowAdvisorEvent approach) implements NegotiationEvent {
        public String eventType() { return "SHADOW_ADVISOR"; }
    }

    record NegotiationsLockedOut(String playerId, int round, String reason) implements NegotiationEvent {
        public String eventType() { return "LOCKOUT"; }
    }
}
