package com.example.realtime.shared.routing;

/**
 * Hierarchical channel names. Every id must be positive.
 */
public final class ChannelNames {

    private ChannelNames() {}

    public static String branchWaiters(long branchId) {
        return "branch:" + requirePositive("branch_id", branchId) + ":waiters";
    }

    public static String branchKitchen(long branchId) {
        return "branch:" + requirePositive("branch_id", branchId) + ":kitchen";
    }

    public static String branchAdmin(long branchId) {
        return "branch:" + requirePositive("branch_id", branchId) + ":admin";
    }

    public static String sectorWaiters(long sectorId) {
        return "sector:" + requirePositive("sector_id", sectorId) + ":waiters";
    }

    public static String session(long sessionId) {
        return "session:" + requirePositive("session_id", sessionId);
    }

    public static String user(long userId) {
        return "user:" + requirePositive("user_id", userId);
    }

    public static String tenantAdmin(long tenantId) {
        return "tenant:" + requirePositive("tenant_id", tenantId) + ":admin";
    }

    private static long requirePositive(String name, long id) {
        if (id <= 0) {
            throw new IllegalArgumentException(name + " must be positive, got " + id);
        }
        return id;
    }
}
