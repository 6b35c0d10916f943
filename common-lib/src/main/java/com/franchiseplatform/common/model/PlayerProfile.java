package com.franchiseplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The slice of a roster player the negotiation core needs.
 *
 * <p>{@code personality} and {@code marketValue} are nullable: without traits the
 * agent archetype comes from the player id, without a market value it is derived
 * from overall rating, position and age.
 */
public record PlayerProfile(
    @JsonProperty("id")          String            id,
    @JsonProperty("firstName")   String            firstName,
    @JsonProperty("lastName")    String            lastName,
    @JsonProperty("position")    Position          position,
    @JsonProperty("age")         int               age,
    @JsonProperty("overall")     int               overall,
    @JsonProperty("personality") PersonalityTraits personality,
    @JsonProperty("marketValue") Long              marketValue
) {

    public String fullName() {
        return firstName + " " + lastName;
    }

    public PlayerProfile withMarketValue(long marketValue) {
        return new PlayerProfile(id, firstName, lastName, position, age, overall, personality, marketValue);
    }
}
