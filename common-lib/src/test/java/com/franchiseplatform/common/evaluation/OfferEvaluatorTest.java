package com.franchiseplatform.common.evaluation;

import com.franchiseplatform.common.NegotiationFixtures;
import com.franchiseplatform.common.contract.ContractEconomics;
import com.franchiseplatform.common.contract.ContractOffer;
import com.franchiseplatform.common.engine.NegotiationPolicy;
import com.franchiseplatform.common.model.AgentArchetype;
import com.franchiseplatform.common.model.AgentMood;
import com.franchiseplatform.common.model.Leverage;
import com.franchiseplatform.common.model.NegotiationOutcome;
import com.franchiseplatform.common.model.NegotiationResponse;
import com.franchiseplatform.common.model.NegotiationSession;
import com.franchiseplatform.common.model.SessionState;
import com.franchiseplatform.common.model.TeamContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static com.franchiseplatform.common.NegotiationFixtures.MARKET_VALUE;
import static com.franchiseplatform.common.NegotiationFixtures.offer;
import static org.junit.jupiter.api.Assertions.*;

class OfferEvaluatorTest {

    private static final double EPS = 1e-9;

    private final OfferEvaluator evaluator = new OfferEvaluator(NegotiationPolicy.defaults());
    private final TeamContext team = NegotiationFixtures.roomyTeam();

    private NegotiationSession shark() {
        return NegotiationFixtures.session(AgentArchetype.SHARK, MARKET_VALUE, team);
    }

    // ── the shark scenario ────────────────────────────────────────────────

    @Nested
    @DisplayName("Shark, market value 20M")
    class SharkScenarioTests {

        @Test
        @DisplayName("14M a year (fit 0.70) → rejected as a lowball")
        void lowballRejected() {
            OfferEvaluation result = evaluator.evaluate(shark(), offer("o-1", 5, 14_000_000L, 0.5), team);

            assertEquals(NegotiationOutcome.REJECTED, result.outcome());
            assertFalse(result.response().accepted());
            assertTrue(result.lowballStrike());
            assertEquals(0.70, result.fit(), EPS);
            // volatile agent drops two steps
            assertEquals(AgentMood.ANGRY, result.response().newMood());
        }

        @Test
        @DisplayName("19.5M a year (fit 0.975) with half guaranteed → accepted")
        void nearMarketAccepted() {
            OfferEvaluation result = evaluator.evaluate(shark(), offer("o-2", 5, 19_500_000L, 0.5), team);

            assertEquals(NegotiationOutcome.ACCEPTED, result.outcome());
            assertTrue(result.response().accepted());
            assertEquals(AgentMood.EXCITED, result.response().newMood());
            assertEquals(0.96, result.threshold(), EPS);
            assertNull(result.response().counterOffer());
        }

        @Test
        @DisplayName("same money with nothing guaranteed → still accepted")
        void noGuaranteesAccepted() {
            OfferEvaluation result = evaluator.evaluate(shark(), offer("o-3", 5, 19_500_000L, 0.0), team);

            assertEquals(0.96, result.threshold(), EPS);
            assertEquals(NegotiationOutcome.ACCEPTED, result.outcome());
        }

        @Test
        @DisplayName("19.5M a year is accepted even when every bit of leverage sits with the agent")
        void agentHeavyLeverageStillAccepts() {
            NegotiationSession cornered = shark().withLeverage(new Leverage(0.0, 1.0));
            OfferEvaluation result = evaluator.evaluate(cornered, offer("o-3", 4, 19_500_000L, 0.0), team);

            assertEquals(0.97, result.threshold(), EPS);
            assertEquals(NegotiationOutcome.ACCEPTED, result.outcome());
        }

        @Test
        @DisplayName("near miss → counter at market × threshold with shark-level guarantees")
        void counterOffer() {
            ContractOffer original = offer("o-4", 5, 18_000_000L, 0.5);
            NegotiationResponse response = evaluator.evaluate(shark(), original, team).response();

            assertEquals(NegotiationOutcome.COUNTERED, response.outcome());
            assertEquals(AgentMood.INTERESTED, response.newMood());

            ContractOffer counter = response.counterOffer();
            assertNotNull(counter);
            assertEquals("o-4-counter-1", counter.id());
            assertEquals(5, counter.years());
            assertEquals(19_200_000.0, ContractEconomics.averagePerYear(counter), EPS);
            assertEquals(83_520_000L, counter.guaranteedMoney());
            assertTrue(counter.guaranteedMoney() >= original.guaranteedMoney());
        }
    }

    // ── hard limits ───────────────────────────────────────────────────────

    @Nested
    @DisplayName("hard limits")
    class HardLimitTests {

        @Test
        @DisplayName("year-1 cap hit above cap space → CAP_INFEASIBLE even when fit passes")
        void capInfeasible() {
            TeamContext capped = TeamContext.of(10_000_000L, 4, false);
            NegotiationSession session = NegotiationFixtures.session(AgentArchetype.SHARK, MARKET_VALUE, capped);
            OfferEvaluation result = evaluator.evaluate(session, offer("o-5", 5, 21_000_000L, 0.9), capped);

            assertEquals(NegotiationOutcome.CAP_INFEASIBLE, result.outcome());
            assertFalse(result.response().accepted());
            assertEquals(AgentMood.NEUTRAL, result.response().newMood());
            assertTrue(result.response().message().startsWith("Cap infeasible"));
        }

        @Test
        @DisplayName("brand builder turns down a third year → TERM_TOO_LONG, mood sours one step")
        void termTooLong() {
            NegotiationSession session = NegotiationFixtures.session(AgentArchetype.BRAND_BUILDER, MARKET_VALUE, team);
            OfferEvaluation result = evaluator.evaluate(session, offer("o-6", 3, 25_000_000L, 1.0), team);

            assertEquals(NegotiationOutcome.TERM_TOO_LONG, result.outcome());
            assertEquals(AgentMood.ANGRY, result.response().newMood());
            assertFalse(result.lowballStrike());
            assertTrue(result.isRejection());
        }
    }

    // ── short circuits ────────────────────────────────────────────────────

    @Nested
    @DisplayName("short circuits")
    class ShortCircuitTests {

        @Test
        @DisplayName("locked out → LOCKED_OUT with the recorded reason")
        void lockedOut() {
            NegotiationSession session = shark().withState(new SessionState.LockedOut("too many lowball offers"));
            NegotiationResponse response = evaluator.evaluate(session, offer("o", 5, 30_000_000L, 1.0), team).response();

            assertEquals(NegotiationOutcome.LOCKED_OUT, response.outcome());
            assertTrue(response.isLockout());
            assertTrue(response.message().contains("too many lowball offers"));
            assertEquals(session.agentMood(), response.newMood());
        }

        @Test
        @DisplayName("phone dead this round → PHONE_DEAD")
        void phoneDead() {
            NegotiationSession session = shark().withState(new SessionState.PhoneDead(3));
            OfferEvaluation result = evaluator.evaluate(session, offer("o", 5, 30_000_000L, 1.0), team);

            assertEquals(NegotiationOutcome.PHONE_DEAD, result.outcome());
            assertTrue(result.isShortCircuit());
            assertTrue(Double.isNaN(result.fit()));
        }

        @Test
        @DisplayName("already agreed → ALREADY_AGREED")
        void alreadyAgreed() {
            NegotiationSession session = shark().withState(new SessionState.Accepted("o-2"));
            assertEquals(NegotiationOutcome.ALREADY_AGREED,
                evaluator.evaluate(session, offer("o", 5, 30_000_000L, 1.0), team).outcome());
        }
    }

    // ── thresholds and mood ───────────────────────────────────────────────

    @Nested
    @DisplayName("thresholds and mood")
    class ThresholdTests {

        @Test
        @DisplayName("family friend discounts contenders and values guarantees")
        void familyFriendContender() {
            TeamContext contender = TeamContext.of(100_000_000L, 4, true);
            double threshold = evaluator.acceptanceThreshold(
                NegotiationFixtures.agent(AgentArchetype.FAMILY_FRIEND), AgentMood.NEUTRAL,
                Leverage.balanced(), offer("o", 4, 10_000_000L, 0.5), contender);
            assertEquals(0.89, threshold, EPS);
        }

        @Test
        @DisplayName("an angry agent asks 0.07 more than an excited one")
        void moodOffsets() {
            ContractOffer o = offer("o", 3, 10_000_000L, 0.5);
            double excited = evaluator.acceptanceThreshold(NegotiationFixtures.agent(AgentArchetype.SHARK),
                AgentMood.EXCITED, Leverage.balanced(), o, team);
            double angry = evaluator.acceptanceThreshold(NegotiationFixtures.agent(AgentArchetype.SHARK),
                AgentMood.ANGRY, Leverage.balanced(), o, team);
            assertEquals(0.07, angry - excited, EPS);
        }

        @Test
        @DisplayName("agent-side leverage raises the threshold by at most 0.01")
        void leverageRaisesThreshold() {
            ContractOffer o = offer("o", 3, 10_000_000L, 0.5);
            double agentHeavy = evaluator.acceptanceThreshold(NegotiationFixtures.agent(AgentArchetype.SHARK),
                AgentMood.NEUTRAL, new Leverage(0.0, 1.0), o, team);
            assertEquals(0.97, agentHeavy, EPS);
        }

        @Test
        @DisplayName("user-side leverage lowers the threshold in full")
        void leverageLowersThreshold() {
            ContractOffer o = offer("o", 3, 10_000_000L, 0.5);
            double userHeavy = evaluator.acceptanceThreshold(NegotiationFixtures.agent(AgentArchetype.SHARK),
                AgentMood.NEUTRAL, new Leverage(1.0, 0.0), o, team);
            assertEquals(0.92, userHeavy, EPS);
        }

        @Test
        @DisplayName("family friend gives the contender discount for an open starting spot")
        void familyFriendStartingSpot() {
            ContractOffer o = offer("o", 4, 10_000_000L, 0.5);
            double open = evaluator.acceptanceThreshold(NegotiationFixtures.agent(AgentArchetype.FAMILY_FRIEND),
                AgentMood.NEUTRAL, Leverage.balanced(), o, TeamContext.of(100_000_000L, 1, false));
            double crowded = evaluator.acceptanceThreshold(NegotiationFixtures.agent(AgentArchetype.FAMILY_FRIEND),
                AgentMood.NEUTRAL, Leverage.balanced(), o, TeamContext.of(100_000_000L, 2, false));
            double openContender = evaluator.acceptanceThreshold(NegotiationFixtures.agent(AgentArchetype.FAMILY_FRIEND),
                AgentMood.NEUTRAL, Leverage.balanced(), o, TeamContext.of(100_000_000L, 0, true));

            assertEquals(0.89, open, EPS);
            assertEquals(0.94, crowded, EPS);
            // the discount is not stacked
            assertEquals(0.89, openContender, EPS);
        }

        @Test
        @DisplayName("an open starting spot does not move a brand builder")
        void brandBuilderIgnoresStartingSpot() {
            double threshold = evaluator.acceptanceThreshold(NegotiationFixtures.agent(AgentArchetype.BRAND_BUILDER),
                AgentMood.NEUTRAL, Leverage.balanced(), offer("o", 2, 10_000_000L, 0.5),
                TeamContext.of(100_000_000L, 0, false));
            assertEquals(0.95, threshold, EPS);
        }

        @Test
        @DisplayName("patient agents have a wider near-miss band")
        void nearMissFloor() {
            assertEquals(0.84, evaluator.nearMissFloor(NegotiationFixtures.agent(AgentArchetype.SHARK)), EPS);
            assertEquals(0.75, evaluator.nearMissFloor(NegotiationFixtures.agent(AgentArchetype.FAMILY_FRIEND)), EPS);
        }

        @Test
        @DisplayName("self-represented player never drops below NEUTRAL")
        void selfRepresentedStaysCalm() {
            NegotiationSession session = NegotiationFixtures.session(AgentArchetype.SELF_REPRESENTED, MARKET_VALUE, team);
            OfferEvaluation result = evaluator.evaluate(session, offer("o", 3, 8_000_000L, 0.5), team);

            assertEquals(NegotiationOutcome.REJECTED, result.outcome());
            assertEquals(AgentMood.NEUTRAL, result.response().newMood());
        }

        @Test
        @DisplayName("steady family friend loses one mood step on a lowball")
        void steadyAgentOneStep() {
            NegotiationSession session = NegotiationFixtures.session(AgentArchetype.FAMILY_FRIEND, MARKET_VALUE, team)
                .withMood(AgentMood.INTERESTED);
            OfferEvaluation result = evaluator.evaluate(session, offer("o", 3, 8_000_000L, 0.5), team);
            assertEquals(AgentMood.NEUTRAL, result.response().newMood());
        }
    }
}
