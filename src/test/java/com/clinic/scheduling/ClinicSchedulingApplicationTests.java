package com.clinic.scheduling;

import com.clinic.scheduling.integration.AbstractIntegrationTest;
import org.junit.jupiter.api.Test;

class ClinicSchedulingApplicationTests extends AbstractIntegrationTest {

    @Test
    void contextLoads() {
        // Spring context starts against Testcontainers PostgreSQL with all Flyway migrations applied.
    }
}
