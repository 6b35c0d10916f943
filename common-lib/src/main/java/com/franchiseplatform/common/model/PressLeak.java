package com.franchiseplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A story the agent planted about the user's offer.
 */
public record PressLeak(
    @JsonProperty("round")       int    round,
    @JsonProperty("headline")    String headline,
    @JsonProperty("offerAmount") double offerAmount,
    @JsonProperty("marketValue") long   marketValue
) {}
