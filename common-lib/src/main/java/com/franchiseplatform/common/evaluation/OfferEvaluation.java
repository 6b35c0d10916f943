package com.franchiseplatform.common.evaluation;

import com.franchiseplatform.common.model.NegotiationOutcome;
import com.franchiseplatform.common.model.NegotiationResponse;

/**
 * Evaluator result: the response handed to the caller plus the figures the engine
 * needs to advance the session. {@code fit}, {@code threshold} and
 * {@code nearMissFloor} are {@code NaN} when the call short-circuited before scoring.
 */
public record OfferEvaluation(
    NegotiationResponse response,
    double fit,
    double threshold,
    double nearMissFloor,
    boolean lowballStrike
) {

    static OfferEvaluation shortCircuit(NegotiationResponse response) {
        return new OfferEvaluation(response, Double.NaN, Double.NaN, Double.NaN, false);
    }

    public NegotiationOutcome outcome() {
        return response.outcome();
    }

    public boolean isShortCircuit() {
        return response.outcome().isShortCircuit();
    }

    /** Whether the agent turned the offer down outright. */
    public boolean isRejection() {
        NegotiationOutcome outcome = response.outcome();
        return outcome == NegotiationOutcome.REJECTED || outcome == NegotiationOutcome.TERM_TOO_LONG;
    }
}
