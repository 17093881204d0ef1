package com.adlab.backend.support;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

import org.junit.jupiter.api.AfterEach;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;

/**
 * Shared PostgreSQL container for DB-backed integration tests. The schema comes from the regular
 * Flyway migrations; every test leaves the tables as the migrations created them.
 */
public abstract class AbstractPostgresIntegrationTest {

    private static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16.4")
            .withDatabaseName("adlab_test")
            .withUsername("adlab")
            .withPassword("adlab_password");

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
    void resetGovernanceState() {
        try (Connection connection = DriverManager.getConnection(
                POSTGRES.getJdbcUrl(),
                POSTGRES.getUsername(),
                POSTGRES.getPassword());
             Statement stmt = connection.createStatement()) {
            // TRUNCATE bypasses the append-only row trigger on audit_log
            stmt.execute("TRUNCATE audit_log, production_snapshot, ingestion_log, failure_injection, workspace_membership");
            stmt.execute("DELETE FROM kill_switch WHERE scope = 'WORKSPACE'");
            stmt.execute("""
                    UPDATE kill_switch
                       SET is_enabled = FALSE, reason = NULL,
                           activated_by = NULL, activated_at = NULL,
                           deactivated_by = NULL, deactivated_at = NULL
                     WHERE scope = 'GLOBAL'
                    """);
        } catch (SQLException ex) {
            throw new IllegalStateException("Failed to reset governance tables after test", ex);
        }
    }
}
