package com.lendingmarket.backend.support;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

import org.junit.jupiter.api.AfterEach;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Shared PostgreSQL container for DB-backed integration tests. Flyway migrates the schema on context start;
 * every test leaves the tables empty for the next one.
 */
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
public abstract class AbstractPostgresIntegrationTest {

    private static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16.4")
            .withDatabaseName("lendingmarket_test")
            .withUsername("lending_user")
            .withPassword("lending_password");

    private static final Object START_LOCK = new Object();

    @DynamicPropertySource
    static void configureDatasource(DynamicPropertyRegistry registry) {
        synchronized (START_LOCK) {
            if (!POSTGRES.isRunning()) {
                POSTGRES.start();
            }
        }
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
    }

    @AfterEach
    void truncateTables() {
        try (Connection connection = DriverManager.getConnection(
                POSTGRES.getJdbcUrl(),
                POSTGRES.getUsername(),
                POSTGRES.getPassword());
             Statement stmt = connection.createStatement()) {
            stmt.execute("""
                    TRUNCATE TABLE audit_log, repayment, ach_detail, email_invitation,
                                   loan_participant, loan, user_capability, user_account
                    """);
        } catch (SQLException ex) {
            throw new IllegalStateException("Failed to truncate tables after test", ex);
        }
    }
}
