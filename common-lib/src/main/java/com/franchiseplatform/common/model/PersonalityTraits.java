package com.franchiseplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Player personality scores, each 0–100, used to pick an agent archetype.
 */
public record PersonalityTraits(
    @JsonProperty("leadership")    int leadership,
    @JsonProperty("workEthic")     int workEthic,
    @JsonProperty("teamPlayer")    int teamPlayer,
    @JsonProperty("motivation")    int motivation,
    @JsonProperty("loyalty")       int loyalty,
    @JsonProperty("marketability") int marketability,
    @JsonProperty("discipline")    int discipline,
    @JsonProperty("ego")           int ego
) {}
