package com.openparking.parking.domain.service;

import com.openparking.parking.config.AsyncConfig;
import com.openparking.parking.domain.model.ActionLog;
import com.openparking.parking.domain.model.AuditAction;
import com.openparking.parking.domain.repository.ActionLogRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.ImportAutoConfiguration;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * {@link ActionLogService} with a connection pool of one: a caller that holds the only connection
 * must not wait for its audit insert, and the entry is written once the connection is back.
 */
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Testcontainers(disabledWithoutDocker = true)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@ImportAutoConfiguration(JacksonAutoConfiguration.class)
@Import({ActionLogService.class, AsyncConfig.class})
class ActionLogServiceIntegrationTest {

    private static final Duration CONNECTION_TIMEOUT = Duration.ofSeconds(5);

    @Container
    static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("open_parking")
            .withUsername("postgres")
            .withPassword("postgres");

    @DynamicPropertySource
    static void configureDatasource(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
        registry.add("spring.datasource.hikari.maximum-pool-size", () -> 1);
        registry.add("spring.datasource.hikari.connection-timeout", CONNECTION_TIMEOUT::toMillis);
    }

    @Autowired
    private ActionLogService actionLogService;
    @Autowired
    private ActionLogRepository actionLogRepository;
    @Autowired
    private PlatformTransactionManager transactionManager;

    @AfterEach
    void cleanUp() {
        actionLogRepository.deleteAll();
    }

    @Test
    @DisplayName("record returns immediately while the caller holds the only pooled connection")
    void record_saturatedPool_doesNotBlockCaller() throws InterruptedException {
        TransactionTemplate caller = new TransactionTemplate(transactionManager);

        long elapsedMillis = caller.execute(status -> {
            actionLogRepository.count();
            long started = System.nanoTime();
            actionLogService.record(AuditAction.SLOT_CREATED, 1L, Map.of("slotId", 7L));
            return Duration.ofNanos(System.nanoTime() - started).toMillis();
        });

        assertThat(elapsedMillis).isLessThan(500);
        List<ActionLog> written = awaitEntries(1);
        assertThat(written).singleElement().satisfies(entry -> {
            assertThat(entry.getAction()).isEqualTo("SLOT_CREATED");
            assertThat(entry.getUserId()).isEqualTo(1L);
            assertThat(entry.getDetails()).isEqualTo("{\"slotId\":7}");
        });
    }

    @Test
    @DisplayName("entries recorded inside a transaction that rolls back are still written")
    void record_callerRollsBack_entryKept() throws InterruptedException {
        TransactionTemplate caller = new TransactionTemplate(transactionManager);

        caller.executeWithoutResult(status -> {
            actionLogRepository.count();
            actionLogService.record(AuditAction.USER_LOGIN_FAILED, null);
            status.setRollbackOnly();
        });

        assertThat(awaitEntries(1)).extracting(ActionLog::getAction).containsExactly("USER_LOGIN_FAILED");
    }

    private List<ActionLog> awaitEntries(int expected) throws InterruptedException {
        long deadline = System.nanoTime() + CONNECTION_TIMEOUT.multipliedBy(2).toNanos();
        List<ActionLog> entries = actionLogRepository.findAll();
        while (entries.size() < expected && System.nanoTime() < deadline) {
            Thread.sleep(50);
            entries = actionLogRepository.findAll();
        }
        return entries;
    }
}
