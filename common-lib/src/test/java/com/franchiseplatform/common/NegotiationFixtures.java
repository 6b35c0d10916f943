package com.franchiseplatform.common;

import com.franchiseplatform.common.contract.ContractOffer;
import com.franchiseplatform.common.model.Agent;
import com.franchiseplatform.common.model.AgentArchetype;
import com.franchiseplatform.common.model.AgentMood;
import com.franchiseplatform.common.model.Leverage;
import com.franchiseplatform.common.model.NegotiationSession;
import com.franchiseplatform.common.model.PersonalityTraits;
import com.franchiseplatform.common.model.PlayerProfile;
import com.franchiseplatform.common.model.Position;
import com.franchiseplatform.common.model.TeamContext;

import java.util.Random;

/**
 * Shared builders for negotiation tests. Agents use their archetype's base values
 * so thresholds in assertions are exact.
 */
public final class NegotiationFixtures {

    public static final long MARKET_VALUE = 20_000_000L;

    private NegotiationFixtures() {}

    public static Agent agent(AgentArchetype archetype) {
        return new Agent("Test Agent", archetype, archetype.basePatience(),
            archetype.baseMaxContractLength(), archetype.baseMoodVolatility());
    }

    /** Round-1 session, age 27 (no career-stage leverage), balanced leverage. */
    public static NegotiationSession session(AgentArchetype archetype, long marketValue, TeamContext team) {
        return NegotiationSession.open("p-1", "Test Player", 27, agent(archetype),
            AgentMood.NEUTRAL, marketValue, Leverage.balanced(), team);
    }

    public static TeamContext roomyTeam() {
        return TeamContext.of(100_000_000L, 4, false);
    }

    /** Flat offer with the given average per year and guaranteed share. */
    public static ContractOffer offer(String id, int years, long averagePerYear, double guaranteedShare) {
        long guaranteed = Math.round(averagePerYear * years * guaranteedShare);
        return ContractOffer.flat(id, years, averagePerYear, 0L, guaranteed);
    }

    // ── players ──────────────────────────────────────────────────────────────

    public static PersonalityTraits sharkTraits() {
        return new PersonalityTraits(50, 60, 40, 60, 45, 80, 50, 80);
    }

    public static PersonalityTraits brandBuilderTraits() {
        return new PersonalityTraits(60, 80, 70, 70, 60, 72, 70, 50);
    }

    public static PersonalityTraits familyFriendTraits() {
        return new PersonalityTraits(60, 70, 80, 60, 85, 40, 75, 30);
    }

    public static PersonalityTraits selfRepresentedTraits() {
        return new PersonalityTraits(85, 80, 60, 90, 40, 50, 80, 40);
    }

    public static PlayerProfile player(String id, int age, PersonalityTraits traits, Long marketValue) {
        return new PlayerProfile(id, "Jordan", "Reyes", Position.CB, age, 85, traits, marketValue);
    }

    /** Always rolls zero, so every probability gate that can fire does. */
    public static Random alwaysFires() {
        return new Random() {
            @Override
            public double nextDouble() {
                return 0.0;
            }
        };
    }
}
