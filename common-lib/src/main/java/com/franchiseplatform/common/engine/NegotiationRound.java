package com.franchiseplatform.common.engine;

import com.franchiseplatform.common.event.NegotiationEvent;
import com.franchiseplatform.common.model.NegotiationResponse;
import com.franchiseplatform.common.model.NegotiationSession;

import java.util.List;

/**
 * Full result of one offer: the session before and after, the agent's response and
 * any events the scheduler fired. {@code before} and {@code after} are distinct values;
 * neither is modified later.
 */
public record NegotiationRound(
    NegotiationSession before,
    NegotiationSession after,
    NegotiationResponse response,
    List<NegotiationEvent> events
) {

    public NegotiationRound {
        events = events == null ? List.of() : List.copyOf(events);
    }

    /** False when the call was absorbed by a terminal session. */
    public boolean sessionChanged() {
        return !before.equals(after);
    }
}
