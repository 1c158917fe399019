package com.clinic.scheduling.integration;

import com.clinic.scheduling.dto.request.CreateAppointmentRequest;
import com.clinic.scheduling.dto.request.GenerateSlotsRequest;
import com.clinic.scheduling.dto.response.AppointmentResponse;
import com.clinic.scheduling.dto.response.SlotResponse;
import com.clinic.scheduling.entity.ReservationMode;
import com.clinic.scheduling.entity.SlotGenerationType;
import com.clinic.scheduling.entity.SlotStatus;
import com.clinic.scheduling.service.model.GeneratedSlot;
import com.clinic.scheduling.service.model.ResourceAssignment;
import com.clinic.scheduling.service.model.SlotValidationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class SlotIntegrationTest extends AbstractIntegrationTest {

    private static final String SLOTS_URL = "/api/v1/slots";

    private Long roleId;
    private Long doctor;
    private Long consult;
    private Instant nine;

    @BeforeEach
    void setUpClinic() {
        roleId = createRole("people", "physician");
        doctor = createResource(createSubtype("people", "gp"), "Dr. Grey", ReservationMode.EXCLUSIVE, 1);
        assignRole(doctor, roleId);
        consult = createProcedure("CONSULT", 30);
        addRequirement(consult, roleId, 1);
        nine = dayAt9(4);
    }

    @Test
    void generate_skipsStartTimesWhereTheDoctorIsBooked() {
        post("/api/v1/appointments", new CreateAppointmentRequest(consult, null, nine.plus(Duration.ofMinutes(30)),
            "patient-1", null, null, null), AppointmentResponse.class);

        ResponseEntity<GeneratedSlot[]> response = post(SLOTS_URL + "/generate",
            new GenerateSlotsRequest(consult, nine, nine.plus(Duration.ofHours(2)), null, 30, null, null),
            GeneratedSlot[].class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody())
            .extracting(GeneratedSlot::startTime)
            .containsExactly(nine, nine.plus(Duration.ofMinutes(60)), nine.plus(Duration.ofMinutes(90)));
        assertThat(response.getBody()[0].assignments())
            .extracting(ResourceAssignment::resourceId)
            .containsExactly(doctor);
        assertThat(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM procedure_slots", Integer.class))
            .isEqualTo(1);
    }

    @Test
    void createSlots_persistsManualSlotsOnce() {
        var request = new GenerateSlotsRequest(consult, nine, nine.plus(Duration.ofHours(1)), null, 30, null, null);

        ResponseEntity<SlotResponse[]> first = post(SLOTS_URL, request, SlotResponse[].class);
        assertThat(first.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        assertThat(first.getBody())
            .extracting(SlotResponse::generationType, SlotResponse::status)
            .containsOnly(tuple(SlotGenerationType.MANUAL, SlotStatus.AVAILABLE));
        assertThat(first.getBody()).hasSize(2);

        ResponseEntity<SlotResponse[]> second = post(SLOTS_URL, request, SlotResponse[].class);
        assertThat(second.getBody()).isEmpty();
    }

    @Test
    void validateSlot_reportsBookedSlotWithAlternatives() {
        SlotResponse slot = post(SLOTS_URL,
            new GenerateSlotsRequest(consult, nine, nine.plus(Duration.ofMinutes(30)), null, 30, null, null),
            SlotResponse[].class).getBody()[0];
        assertThat(post(SLOTS_URL + "/" + slot.id() + "/validate", null, SlotValidationResult.class)
            .getBody().valid()).isTrue();

        post("/api/v1/appointments", new CreateAppointmentRequest(consult, slot.id(), null, "patient-1",
            null, null, null), AppointmentResponse.class);
        ResponseEntity<SlotValidationResult> response =
            post(SLOTS_URL + "/" + slot.id() + "/validate", null, SlotValidationResult.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        SlotValidationResult result = response.getBody();
        assertThat(result.valid()).isFalse();
        assertThat(result.issues()).contains("Slot is BOOKED");
        assertThat(result.alternatives()).isNotEmpty();
    }

    @Test
    void cleanup_deletesOnlyStaleAutoSlots() {
        Instant past = nine.minus(Duration.ofDays(5));
        insertSlot(past, "AUTO");
        insertSlot(past.plus(Duration.ofHours(1)), "MANUAL");
        insertSlot(nine, "AUTO");

        ResponseEntity<Map<String, Integer>> response = exchange(
            SLOTS_URL + "/cleanup?before=" + nine.minus(Duration.ofDays(1)), HttpMethod.POST, TENANT, null,
            new ParameterizedTypeReference<Map<String, Integer>>() {});

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).containsEntry("deleted", 1);
        assertThat(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM procedure_slots", Integer.class))
            .isEqualTo(2);
    }

    private void insertSlot(Instant start, String generationType) {
        jdbcTemplate.update("INSERT INTO procedure_slots (tenant_id, procedure_id, start_time, end_time, "
                + "status, generation_type) VALUES (?, ?, ?, ?, 'AVAILABLE', ?)",
            TENANT, consult, Timestamp.from(start), Timestamp.from(start.plus(Duration.ofMinutes(30))),
            generationType);
    }
}
