package com.example.realtime.gateway.session;

import com.example.realtime.shared.routing.ChannelNames;
import com.example.realtime.shared.util.Constants.ClientRole;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Who is on the other end of a connection, and therefore which channels it listens to.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class ClientScope {

    private final long userId;
    private final long tenantId;
    private final ClientRole role;
    @Singular
    private final Set<Long> branchIds;
    @Singular
    private final Set<Long> sectorIds;
    /** Table session of a diner device; absent for staff. */
    private final Long sessionId;

    /**
     * Channels this client receives. Staff also get their personal {@code user:} channel.
     */
    public Set<String> channels() {
        Set<String> channels = new LinkedHashSet<>();
        switch (role) {
            case WAITER:
                branchIds.forEach(branchId -> channels.add(ChannelNames.branchWaiters(branchId)));
                sectorIds.forEach(sectorId -> channels.add(ChannelNames.sectorWaiters(sectorId)));
                channels.add(ChannelNames.user(userId));
                break;
            case KITCHEN:
                branchIds.forEach(branchId -> channels.add(ChannelNames.branchKitchen(branchId)));
                channels.add(ChannelNames.user(userId));
                break;
            case ADMIN:
            case MANAGER:
                branchIds.forEach(branchId -> channels.add(ChannelNames.branchAdmin(branchId)));
                channels.add(ChannelNames.tenantAdmin(tenantId));
                channels.add(ChannelNames.user(userId));
                break;
            case DINER:
                if (sessionId != null) {
                    channels.add(ChannelNames.session(sessionId));
                }
                break;
            default:
                break;
        }
        return channels;
    }
}
