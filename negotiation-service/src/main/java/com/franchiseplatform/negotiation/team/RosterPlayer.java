package com.franchiseplatform.negotiation.team;

import com.franchiseplatform.common.model.PersonalityTraits;
import com.franchiseplatform.common.model.PlayerProfile;
import com.franchiseplatform.common.model.Position;
import com.franchiseplatform.negotiation.roster.SignedContract;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * League player record. {@code teamId} is null for free agents; {@code contract} is
 * null until a signing is committed.
 */
@Data
@NoArgsConstructor
public class RosterPlayer {

    private String id;

    private String firstName;

    private String lastName;

    private Position position;

    private int age;

    private int overall;

    private PersonalityTraits personality;

    /** Nullable; estimated from rating when absent. */
    private Long marketValue;

    private String teamId;

    private SignedContract contract;

    public RosterPlayer(String id, String firstName, String lastName, Position position, int age, int overall) {
        this.id        = id;
        this.firstName = firstName;
        this.lastName  = lastName;
        this.position  = position;
        this.age       = age;
        this.overall   = overall;
    }

    public PlayerProfile toProfile() {
        return new PlayerProfile(id, firstName, lastName, position, age, overall, personality, marketValue);
    }
}
