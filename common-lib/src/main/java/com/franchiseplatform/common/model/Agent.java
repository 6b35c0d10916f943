package com.franchiseplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A player's representative for one negotiation window. Immutable; regenerated
 * identically for the same player by the profile factory.
 */
public record Agent(
    @JsonProperty("name")               String         name,
    @JsonProperty("archetype")          AgentArchetype archetype,
    @JsonProperty("patience")           double         patience,
    @JsonProperty("maxContractLength")  int            maxContractLength,
    @JsonProperty("moodVolatility")     double         moodVolatility
) {}
