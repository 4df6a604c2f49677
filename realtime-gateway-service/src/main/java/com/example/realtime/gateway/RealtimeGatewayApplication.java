package com.example.realtime.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.boot.autoconfigure.data.redis.RedisReactiveAutoConfiguration;
import org.springframework.boot.autoconfigure.data.redis.RedisRepositoriesAutoConfiguration;

/**
 * Gateway side of the event distribution layer. Subscribes to the channel patterns and the
 * critical stream, and fans events out to connected clients over SSE.
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
public class RealtimeGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(RealtimeGatewayApplication.class, args);
    }
}
