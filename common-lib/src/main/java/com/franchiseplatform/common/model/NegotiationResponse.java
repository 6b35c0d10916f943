package com.franchiseplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.franchiseplatform.common.contract.ContractOffer;

/**
 * Agent's answer to one offer. Pure output; callers may keep it in a history list.
 *
 * <p>{@code counterOffer} is non-null only for {@link NegotiationOutcome#COUNTERED}.
 */
public record NegotiationResponse(
    @JsonProperty("accepted")     boolean            accepted,
    @JsonProperty("newMood")      AgentMood          newMood,
    @JsonProperty("message")      String             message,
    @JsonProperty("counterOffer") ContractOffer      counterOffer,
    @JsonProperty("outcome")      NegotiationOutcome outcome
) {

    public static NegotiationResponse accepted(AgentMood mood, String message) {
        return new NegotiationResponse(true, mood, message, null, NegotiationOutcome.ACCEPTED);
    }

    public static NegotiationResponse countered(AgentMood mood, String message, ContractOffer counterOffer) {
        return new NegotiationResponse(false, mood, message, counterOffer, NegotiationOutcome.COUNTERED);
    }

    public static NegotiationResponse declined(NegotiationOutcome outcome, AgentMood mood, String message) {
        return new NegotiationResponse(false, mood, message, null, outcome);
    }

    @JsonIgnore
    public boolean isLockout() {
        return outcome == NegotiationOutcome.LOCKED_OUT;
    }
}
