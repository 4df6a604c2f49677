package com.example.realtime.shared.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Enables scheduled jobs (outbox polling, stale-claim recovery, heartbeats) outside of tests
 * that activate the {@code no-scheduling} profile.
 */
@Configuration
@EnableScheduling
@Profile("!no-scheduling")
public class SchedulingConditionalConfig {
}
