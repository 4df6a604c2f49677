package com.example.realtime.gateway.routing;

public record SectorKey(long userId, long tenantId) {
}
