package com.example.realtime.shared.routing;

import com.example.realtime.shared.model.Event;
import com.example.realtime.shared.util.Constants.EventTypes;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Maps an event to the channels it must be published on. Stateless and side-effect free.
 */
@Component
public class ChannelRouter {

    public static final String RECIPIENT_USER_KEY = "recipient_user_id";

    public Set<String> resolve(Event event) {
        Set<String> channels = new LinkedHashSet<>();
        String type = event.getType();
        long branchId = event.getBranchId();

        if (EventTypes.ADMIN_ONLY.contains(type)) {
            if (!event.isTenantWide()) {
                channels.add(ChannelNames.branchAdmin(branchId));
            }
            channels.add(ChannelNames.tenantAdmin(event.getTenantId()));
            return Collections.unmodifiableSet(channels);
        }

        if (event.isTenantWide()) {
            channels.add(ChannelNames.tenantAdmin(event.getTenantId()));
        } else {
            addWaiterChannels(event, channels);
            if (EventTypes.KITCHEN.contains(type)) {
                channels.add(ChannelNames.branchKitchen(branchId));
            }
            channels.add(ChannelNames.branchAdmin(branchId));
        }

        if (event.getSessionId() != null && EventTypes.SESSION.contains(type)) {
            channels.add(ChannelNames.session(event.getSessionId()));
        }

        Long recipient = recipientUserId(event);
        if (recipient != null) {
            channels.add(ChannelNames.user(recipient));
        }
        return Collections.unmodifiableSet(channels);
    }

    private void addWaiterChannels(Event event, Set<String> channels) {
        // Sector-targeted events are also written to the branch channel so that stale
        // sector assignments never hide an event from the floor.
        if (event.getSectorId() != null && !EventTypes.BRANCH_WIDE_WAITER.contains(event.getType())) {
            channels.add(ChannelNames.sectorWaiters(event.getSectorId()));
        }
        channels.add(ChannelNames.branchWaiters(event.getBranchId()));
    }

    private Long recipientUserId(Event event) {
        Object value = event.getEntity().get(RECIPIENT_USER_KEY);
        if (value instanceof Number number && number.longValue() > 0) {
            return number.longValue();
        }
        return null;
    }
}
