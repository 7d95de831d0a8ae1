package com.socialhub.backend.support;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

import com.socialhub.backend.modules.auth.application.PasswordResetMailer;

import org.junit.jupiter.api.AfterEach;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;

/**
 * Shared PostgreSQL container for DB-backed integration tests. Flyway runs the real migrations on
 * startup and every table is truncated after each test. The container is started once per JVM and
 * shared by every cached application context, so a missing Docker daemon fails the run.
 */
@SpringBootTest
@ActiveProfiles("test")
public abstract class AbstractPostgresIntegrationTest {

    private static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16.4")
            .withDatabaseName("socialhub_test")
            .withUsername("socialhub")
            .withPassword("socialhub");

    static {
        POSTGRES.start();
    }

    @MockBean
    protected PasswordResetMailer passwordResetMailer;

    @DynamicPropertySource
    static void configureDatasource(DynamicPropertyRegistry registry) {
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
            stmt.execute("TRUNCATE TABLE post, follower, follow_request, reset_token, refresh_token, app_user CASCADE");
        } catch (SQLException ex) {
            throw new IllegalStateException("Failed to truncate tables after test", ex);
        }
    }
}
