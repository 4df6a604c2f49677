package com.example.realtime.shared.routing;

import com.example.realtime.shared.model.Event;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChannelRouterTest {

    private final ChannelRouter router = new ChannelRouter();

    @Test
    void sectorEventIsDualWrittenToBranchFallback() {
        Event event = Event.builder()
                .type("ORDER_SUBMITTED")
                .tenantId(1L)
                .branchId(5L)
                .sectorId(2L)
                .entity(Map.of("order_id", 42))
                .build();

        assertEquals(Set.of("sector:2:waiters", "branch:5:waiters", "branch:5:admin"), router.resolve(event));
    }

    @Test
    void pendingRoundGoesToWaitersAndAdminOnly() {
        Event event = Event.builder().type("ROUND_PENDING").tenantId(1L).branchId(5L).sectorId(2L).sessionId(8L).build();

        // branch-wide waiter event: no sector channel
        assertEquals(Set.of("branch:5:waiters", "branch:5:admin"), router.resolve(event));
    }

    @Test
    void submittedRoundAddsKitchen() {
        Event event = Event.builder().type("ROUND_SUBMITTED").tenantId(1L).branchId(5L).sessionId(8L).build();

        assertEquals(Set.of("branch:5:waiters", "branch:5:kitchen", "branch:5:admin"), router.resolve(event));
    }

    @Test
    void terminalRoundStagesAlsoReachTheSession() {
        Event event = Event.builder().type("ROUND_SERVED").tenantId(1L).branchId(5L).sessionId(8L).build();

        assertEquals(Set.of("branch:5:waiters", "branch:5:kitchen", "branch:5:admin", "session:8"), router.resolve(event));
    }

    @Test
    void sessionEventWithoutSessionIdSkipsSessionChannel() {
        Event event = Event.builder().type("PAYMENT_APPROVED").tenantId(1L).branchId(5L).build();

        assertEquals(Set.of("branch:5:waiters", "branch:5:admin"), router.resolve(event));
    }

    @Test
    void adminCrudGoesToBranchAndTenantAdmins() {
        Event branchScoped = Event.builder().type("ENTITY_UPDATED").tenantId(3L).branchId(5L).build();
        Event tenantWide = Event.builder().type("CASCADE_DELETE").tenantId(3L).branchId(0L).build();

        assertEquals(Set.of("branch:5:admin", "tenant:3:admin"), router.resolve(branchScoped));
        assertEquals(Set.of("tenant:3:admin"), router.resolve(tenantWide));
    }

    @Test
    void tenantWideEventGoesToTenantAdmin() {
        Event event = Event.builder().type("TABLE_STATUS_CHANGED").tenantId(3L).branchId(0L).sessionId(4L).build();

        assertEquals(Set.of("tenant:3:admin", "session:4"), router.resolve(event));
    }

    @Test
    void recipientUserGetsDirectChannel() {
        Event event = Event.builder()
                .type("SERVICE_CALL_CREATED")
                .tenantId(1L)
                .branchId(5L)
                .entity(Map.of(ChannelRouter.RECIPIENT_USER_KEY, 77))
                .build();

        assertTrue(router.resolve(event).contains("user:77"));
    }

    @Test
    void channelNamesRequirePositiveIds() {
        assertThrows(IllegalArgumentException.class, () -> ChannelNames.branchWaiters(0));
        assertThrows(IllegalArgumentException.class, () -> ChannelNames.session(-1));
        assertEquals("tenant:9:admin", ChannelNames.tenantAdmin(9));
    }

    @Test
    void subscriberPatternsMatchTwoOfThreeChannels() {
        Event event = Event.builder().type("ORDER_SUBMITTED").tenantId(1L).branchId(5L).sectorId(2L).build();
        Set<ChannelPattern> patterns = Set.of(ChannelPattern.of("branch:*:waiters"), ChannelPattern.of("branch:*:admin"));

        long matched = router.resolve(event).stream()
                .filter(channel -> patterns.stream().anyMatch(p -> p.matches(channel)))
                .count();

        assertEquals(2, matched);
    }
}
