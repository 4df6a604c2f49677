package com.example.realtime.gateway.config;

import com.example.realtime.gateway.routing.SectorKey;
import com.example.realtime.shared.config.AppProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.AllArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;

@Configuration
@AllArgsConstructor
public class CaffeineConfig {

    private final AppProperties appProperties;

    @Bean
    public Cache<SectorKey, List<Long>> sectorAssignmentCache() {
        return sectorAssignmentCache(appProperties.getSectorCache(), Ticker.systemTicker());
    }

    public static Cache<SectorKey, List<Long>> sectorAssignmentCache(AppProperties.SectorCache settings, Ticker ticker) {
        return Caffeine.newBuilder()
                .maximumSize(settings.getMaxEntries())
                .expireAfterWrite(Duration.ofMillis(settings.getTtlMs()))
                .ticker(ticker)
                .recordStats()
                .build();
    }
}
