package com.franchiseplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An off-book advisor approaching the user's front office on the player's behalf.
 * Must be answered before {@code deadlineRound} passes.
 */
public record ShadowAdvisorEvent(
    @JsonProperty("advisorName")   String advisorName,
    @JsonProperty("playerName")    String playerName,
    @JsonProperty("demand")        long   demand,
    @JsonProperty("deadlineRound") int    deadlineRound
) {}
