package com.franchiseplatform.negotiation.team;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A franchise as the negotiation side sees it: cap books and cash on hand.
 *
 * capLimit:     league salary cap for the season
 * committedCap: sum of current-season cap hits already on the books
 * cashReserves: cash available for signing bonuses
 */
@Data
@NoArgsConstructor
public class Team {

    private String id;

    private String name;

    private long capLimit;

    private long committedCap;

    private long cashReserves;

    private boolean contender;

    public Team(String id, String name, long capLimit, long committedCap, long cashReserves, boolean contender) {
        this.id           = id;
        this.name         = name;
        this.capLimit     = capLimit;
        this.committedCap = committedCap;
        this.cashReserves = cashReserves;
        this.contender    = contender;
    }

    public long getCapSpace() {
        return capLimit - committedCap;
    }
}
