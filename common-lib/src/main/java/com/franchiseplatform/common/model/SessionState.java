package com.franchiseplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Phase of a negotiation session. Exactly one applies at a time, so combinations
 * such as "locked out and phone dead" cannot be expressed.
 *
 * <pre>
 * NORMAL ⇄ PHONE_DEAD
 * NORMAL ⇄ SHADOW_PENDING
 * NORMAL | PHONE_DEAD | SHADOW_PENDING → ACCEPTED | LOCKED_OUT   (both absorbing)
 * </pre>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "state")
@JsonSubTypes({
    @JsonSubTypes.Type(value = SessionState.Normal.class,        name = "NORMAL"),
    @JsonSubTypes.Type(value = SessionState.PhoneDead.class,     name = "PHONE_DEAD"),
    @JsonSubTypes.Type(value = SessionState.ShadowPending.class, name = "SHADOW_PENDING"),
    @JsonSubTypes.Type(value = SessionState.LockedOut.class,     name = "LOCKED_OUT"),
    @JsonSubTypes.Type(value = SessionState.Accepted.class,      name = "ACCEPTED")
})
public sealed interface SessionState permits
        SessionState.Normal,
        SessionState.PhoneDead,
        SessionState.ShadowPending,
        SessionState.LockedOut,
        SessionState.Accepted {

    /** No further offers are evaluated once a terminal state is reached. */
    @JsonIgnore
    default boolean isTerminal() {
        return false;
    }

    record Normal() implements SessionState {}

    record PhoneDead(
        @JsonProperty("untilRound") int untilRound
    ) implements SessionState {

        public boolean isActiveAt(int round) {
            return round < untilRound;
        }
    }

    record ShadowPending(
        @JsonProperty("event") ShadowAdvisorEvent event
    ) implements SessionState {}

    record LockedOut(
        @JsonProperty("reason") String reason
    ) implements SessionState {
        @JsonIgnore
        @Override
        public boolean isTerminal() { return true; }
    }

    record Accepted(
        @JsonProperty("offerId") String offerId
    ) implements SessionState {
        @JsonIgnore
        @Override
        public boolean isTerminal() { return true; }
    }

    static SessionState normal() {
        return new Normal();
    }
}
