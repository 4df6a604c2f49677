package com.example.realtime.shared.outbox;

import com.example.realtime.shared.config.AppProperties;
import com.example.realtime.shared.exception.EventValidationException;
import com.example.realtime.shared.model.Event;
import com.example.realtime.shared.model.OutboxEvent;
import com.example.realtime.shared.util.Constants.AggregateType;
import com.example.realtime.shared.util.EventCodec;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;
import org.springframework.test.context.junit.jupiter.SpringJUnitConfig;
import org.springframework.transaction.IllegalTransactionStateException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.EnableTransactionManagement;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringJUnitConfig(OutboxWriterTest.Config.class)
class OutboxWriterTest {

    @Configuration
    @EnableTransactionManagement
    static class Config {

        @Bean(destroyMethod = "shutdown")
        EmbeddedDatabase dataSource() {
            return new EmbeddedDatabaseBuilder()
                    .setType(EmbeddedDatabaseType.H2)
                    .generateUniqueName(true)
                    .addScript("db/outbox-schema.sql")
                    .build();
        }

        @Bean
        JdbcTemplate jdbcTemplate(EmbeddedDatabase dataSource) {
            return new JdbcTemplate(dataSource);
        }

        @Bean
        PlatformTransactionManager transactionManager(EmbeddedDatabase dataSource) {
            return new DataSourceTransactionManager(dataSource);
        }

        @Bean
        AppProperties appProperties() {
            AppProperties properties = new AppProperties();
            properties.getPublisher().setMaxEventBytes(1024);
            return properties;
        }

        @Bean
        OutboxEventRepository outboxEventRepository(JdbcTemplate jdbcTemplate) {
            return new OutboxEventRepository(jdbcTemplate);
        }

        @Bean
        OutboxWriter outboxWriter(OutboxEventRepository repository, AppProperties appProperties) {
            return new OutboxWriter(repository, new EventCodec(new ObjectMapper()), appProperties);
        }
    }

    @Autowired
    private OutboxWriter outboxWriter;

    @Autowired
    private OutboxEventRepository repository;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private PlatformTransactionManager transactionManager;

    private TransactionTemplate transactionTemplate;

    @BeforeEach
    void setup() {
        jdbcTemplate.update("DELETE FROM outbox_event");
        transactionTemplate = new TransactionTemplate(transactionManager);
    }

    private static Event roundSubmitted() {
        return Event.builder()
                .type("ROUND_SUBMITTED")
                .tenantId(3L)
                .branchId(9L)
                .sessionId(12L)
                .entity(Map.of("round_id", 77))
                .build();
    }

    @Test
    void writesPendingRowInsideTransaction() {
        Long id = transactionTemplate.execute(status -> outboxWriter.writeRoundEvent(roundSubmitted(), 77L));

        OutboxEvent row = repository.findById(id).orElseThrow();
        assertEquals(3L, row.getTenantId());
        assertEquals("ROUND_SUBMITTED", row.getEventType());
        assertEquals("round", row.getAggregateType());
        assertEquals(77L, row.getAggregateId());
        assertTrue(row.getPayload().contains("\"session_id\":12"));
    }

    @Test
    void rowRollsBackWithTheBusinessTransaction() {
        transactionTemplate.executeWithoutResult(status -> {
            outboxWriter.writeBillingEvent(roundSubmitted().toBuilder().type("CHECK_PAID").build(), 5L);
            status.setRollbackOnly();
        });

        assertTrue(repository.findPending(10).isEmpty());
    }

    @Test
    void refusesToWriteWithoutATransaction() {
        assertThrows(IllegalTransactionStateException.class,
                () -> outboxWriter.writeServiceCallEvent(roundSubmitted(), 1L));
    }

    @Test
    void oversizedEventIsRejected() {
        Event huge = roundSubmitted().toBuilder().entity(Map.of("notes", "x".repeat(2000))).build();

        assertThrows(EventValidationException.class,
                () -> transactionTemplate.execute(status -> outboxWriter.write(huge, AggregateType.ROUND, 1L)));
        assertTrue(repository.findPending(10).isEmpty());
    }
}
