package com.example.realtime.publisher;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.boot.autoconfigure.data.redis.RedisReactiveAutoConfiguration;
import org.springframework.boot.autoconfigure.data.redis.RedisRepositoriesAutoConfiguration;

/**
 * Publisher side of the event distribution layer. Drains the transactional outbox into the
 * broker and exposes the outbox admin API.
 *
 * Redis auto-configuration is excluded: all connections come from the shared pool manager.
 */
@SpringBootApplication(
        scanBasePackages = "com.example.realtime",
        exclude = {
                RedisAutoConfiguration.class,
                RedisReactiveAutoConfiguration.class,
                RedisRepositoriesAutoConfiguration.class
        })
public class RealtimePublisherApplication {

    public static void main(String[] args) {
        SpringApplication.run(RealtimePublisherApplication.class, args);
    }
}
