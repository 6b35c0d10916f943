package com.franchiseplatform.negotiation;

import com.franchiseplatform.common.engine.NegotiationPolicy;
import com.franchiseplatform.negotiation.service.NegotiationService;
import com.franchiseplatform.negotiation.team.TeamRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class NegotiationServiceApplicationTest {

    @Autowired
    private NegotiationService negotiationService;

    @Autowired
    private TeamRegistry teamRegistry;

    @Autowired
    private NegotiationPolicy negotiationPolicy;

    @Test
    @DisplayName("context wires the service over the in-memory registry with application.yml policy")
    void contextLoads() {
        assertNotNull(negotiationService);
        assertTrue(teamRegistry.findTeam("none").isEmpty());
        assertEquals(NegotiationPolicy.defaults(), negotiationPolicy);
    }
}
