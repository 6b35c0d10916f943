package com.franchiseplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Caller-supplied snapshot of the offering team. The engine never caches or
 * refreshes it; staleness is the caller's concern.
 */
public record TeamContext(
    @JsonProperty("teamName")        String          teamName,
    @JsonProperty("capSpace")        long            capSpace,
    @JsonProperty("positionDepth")   int             positionDepth,
    @JsonProperty("isContender")     boolean         isContender,
    @JsonProperty("cashReserveTier") CashReserveTier cashReserveTier
) {

    public static TeamContext of(long capSpace, int positionDepth, boolean isContender) {
        return new TeamContext("Your team", capSpace, positionDepth, isContender, CashReserveTier.COMFORTABLE);
    }
}
