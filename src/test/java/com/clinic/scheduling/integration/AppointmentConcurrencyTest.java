package com.clinic.scheduling.integration;

import com.clinic.scheduling.dto.request.CreateAppointmentRequest;
import com.clinic.scheduling.entity.ReservationMode;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

class AppointmentConcurrencyTest extends AbstractIntegrationTest {

    private static final String APPOINTMENTS_URL = "/api/v1/appointments";

    @Test
    void concurrentBookings_ofOneDoctor_onlyOneSucceeds() throws Exception {
        Long roleId = createRole("people", "physician");
        Long doctor = createResource(createSubtype("people", "gp"), "Dr. Grey", ReservationMode.EXCLUSIVE, 1);
        assignRole(doctor, roleId);
        Long consult = createProcedure("CONSULT", 30);
        addRequirement(consult, roleId, 1);
        Instant start = dayAt9(2);

        int threadCount = 10;
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        CountDownLatch startLatch = new CountDownLatch(1);
        List<Future<ResponseEntity<String>>> futures = new ArrayList<>();

        for (int i = 0; i < threadCount; i++) {
            final String contactId = "patient-" + i;
            futures.add(executor.submit(() -> {
                startLatch.await();
                var request = new CreateAppointmentRequest(consult, null, start, contactId, null, null, null);
                return exchange(APPOINTMENTS_URL, HttpMethod.POST, TENANT, request, String.class);
            }));
        }

        // Release all threads simultaneously
        startLatch.countDown();

        List<HttpStatus> statuses = new ArrayList<>();
        for (Future<ResponseEntity<String>> future : futures) {
            statuses.add((HttpStatus) future.get().getStatusCode());
        }

        executor.shutdown();

        long successCount = statuses.stream()
            .filter(s -> s == HttpStatus.CREATED)
            .count();
        long conflictCount = statuses.stream()
            .filter(s -> s == HttpStatus.CONFLICT)
            .count();

        assertThat(successCount).isEqualTo(1);
        assertThat(conflictCount).isEqualTo(threadCount - 1);
        Integer reservations = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM appointment_resources WHERE resource_id = ?", Integer.class, doctor);
        assertThat(reservations).isEqualTo(1);
    }
}
