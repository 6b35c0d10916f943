package com.franchiseplatform.common.leverage;

import com.franchiseplatform.common.NegotiationFixtures;
import com.franchiseplatform.common.contract.ContractOffer;
import com.franchiseplatform.common.engine.NegotiationPolicy;
import com.franchiseplatform.common.model.AgentArchetype;
import com.franchiseplatform.common.model.AgentMood;
import com.franchiseplatform.common.model.Leverage;
import com.franchiseplatform.common.model.NegotiationSession;
import com.franchiseplatform.common.model.PressLeak;
import com.franchiseplatform.common.model.TeamContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static com.franchiseplatform.common.NegotiationFixtures.MARKET_VALUE;
import static org.junit.jupiter.api.Assertions.*;

class LeverageModelTest {

    private static final double EPS = 1e-9;

    private final LeverageModel model = new LeverageModel(NegotiationPolicy.defaults());

    private static final TeamContext TIGHT_THIN = TeamContext.of(10_000_000L, 1, false);
    private static final ContractOffer NINE_MILLION = ContractOffer.flat("o", 5, 9_000_000L, 0L, 0L);

    @Nested
    @DisplayName("computeLeverage()")
    class ComputeTests {

        @Test
        @DisplayName("cap squeeze and thin depth push agent leverage up")
        void agentSide() {
            NegotiationSession session = NegotiationFixtures.session(AgentArchetype.SHARK, MARKET_VALUE, TIGHT_THIN);
            Leverage leverage = model.computeLeverage(session, NINE_MILLION, TIGHT_THIN);
            // 0.20 + 0.25×0.5 + 0.25×0.75 + 0.10 temperament
            assertEquals(0.6125, leverage.agentLeverage(), EPS);
            // 0.20 + 0.30 × (1M margin / 20M)
            assertEquals(0.215, leverage.userLeverage(), EPS);
        }

        @Test
        @DisplayName("contender status helps the user, scaled by ring factor")
        void contender() {
            TeamContext contender = TeamContext.of(10_000_000L, 1, true);
            NegotiationSession session = NegotiationFixtures.session(AgentArchetype.FAMILY_FRIEND, MARKET_VALUE, contender);
            Leverage leverage = model.computeLeverage(session, NINE_MILLION, contender);
            assertEquals(0.415, leverage.userLeverage(), EPS);
            assertEquals(0.4625, leverage.agentLeverage(), EPS);
        }

        @Test
        @DisplayName("later rounds add capped fatigue to both sides")
        void fatigue() {
            NegotiationSession session = NegotiationFixtures.session(AgentArchetype.SHARK, MARKET_VALUE, TIGHT_THIN)
                .nextRound().nextRound();
            Leverage leverage = model.computeLeverage(session, NINE_MILLION, TIGHT_THIN);
            assertEquals(0.6725, leverage.agentLeverage(), EPS);
            assertEquals(0.275, leverage.userLeverage(), EPS);
            assertEquals(0.15, model.fatigue(40), EPS);
        }

        @Test
        @DisplayName("press leaks add user leverage up to the cap")
        void pressLeaks() {
            NegotiationSession session = NegotiationFixtures.session(AgentArchetype.SHARK, MARKET_VALUE, TIGHT_THIN);
            for (int i = 0; i < 5; i++) {
                session = session.withPressLeak(new PressLeak(1, "leak " + i, 9_000_000.0, MARKET_VALUE));
            }
            assertEquals(0.415, model.computeLeverage(session, NINE_MILLION, TIGHT_THIN).userLeverage(), EPS);
        }

        @Test
        @DisplayName("every reported shadow approach costs user leverage, round after round")
        void shadowReports() {
            NegotiationSession reported = NegotiationFixtures.session(AgentArchetype.SHARK, MARKET_VALUE, TIGHT_THIN)
                .withShadowReport();
            assertEquals(0.165, model.computeLeverage(reported, NINE_MILLION, TIGHT_THIN).userLeverage(), EPS);

            // stored leverage is ignored; only the report count carries over
            Leverage reset = model.computeLeverage(reported.withLeverage(Leverage.balanced()), NINE_MILLION, TIGHT_THIN);
            assertEquals(0.165, reset.userLeverage(), EPS);
            assertEquals(0.6125, reset.agentLeverage(), EPS);

            NegotiationSession twice = reported.withShadowReport().nextRound();
            // 0.215 − 2 × 0.05 + fatigue 0.03
            assertEquals(0.145, model.computeLeverage(twice, NINE_MILLION, TIGHT_THIN).userLeverage(), EPS);
        }

        @Test
        @DisplayName("each side is clamped to [0, 1]")
        void clamped() {
            TeamContext broke = TeamContext.of(0L, 0, false);
            NegotiationSession session = NegotiationSession.open("p-young", "Young Star", 24,
                NegotiationFixtures.agent(AgentArchetype.SHARK), AgentMood.NEUTRAL, MARKET_VALUE,
                Leverage.balanced(), broke);
            for (int i = 0; i < 9; i++) {
                session = session.nextRound();
            }
            Leverage leverage = model.computeLeverage(session, NINE_MILLION, broke);
            assertEquals(1.0, leverage.agentLeverage(), EPS);
            assertTrue(leverage.userLeverage() >= 0.0 && leverage.userLeverage() <= 1.0);
        }
    }

    @Test
    @DisplayName("opening leverage measures cap margin against market value")
    void openingLeverage() {
        TeamContext roomy = NegotiationFixtures.roomyTeam();
        NegotiationSession session = NegotiationFixtures.session(AgentArchetype.SHARK, MARKET_VALUE, roomy);
        Leverage leverage = model.computeOpeningLeverage(session, roomy);
        assertEquals(0.5, leverage.userLeverage(), EPS);
        assertEquals(0.3, leverage.agentLeverage(), EPS);
    }
}
