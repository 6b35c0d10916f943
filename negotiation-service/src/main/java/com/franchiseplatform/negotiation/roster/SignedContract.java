package com.franchiseplatform.negotiation.roster;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Contract as it lands on the roster after a signing is committed.
 * {@code deadCap} is the charge if the player were released before playing a down.
 */
public record SignedContract(
    @JsonProperty("offerId")         String offerId,
    @JsonProperty("totalValue")      long   totalValue,
    @JsonProperty("years")           int    years,
    @JsonProperty("guaranteedMoney") long   guaranteedMoney,
    @JsonProperty("currentYearCap")  long   currentYearCap,
    @JsonProperty("signingBonus")    long   signingBonus,
    @JsonProperty("incentives")      long   incentives,
    @JsonProperty("deadCap")         long   deadCap
) {}
