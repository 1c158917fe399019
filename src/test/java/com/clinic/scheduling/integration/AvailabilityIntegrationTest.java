package com.clinic.scheduling.integration;

import com.clinic.scheduling.dto.request.AvailabilityRequest;
import com.clinic.scheduling.dto.response.AvailabilityResponse;
import com.clinic.scheduling.dto.response.ErrorResponse;
import com.clinic.scheduling.entity.AvailabilityType;
import com.clinic.scheduling.entity.ReservationMode;
import com.clinic.scheduling.recurrence.RecurrencePattern;
import com.clinic.scheduling.recurrence.RecurrenceRange;
import com.clinic.scheduling.service.model.AvailabilityWindow;
import com.clinic.scheduling.service.model.ResourceAvailabilityCheck;
import org.junit.jupiter.api.Test;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.TemporalAdjusters;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class AvailabilityIntegrationTest extends AbstractIntegrationTest {

    private static final String AVAILABILITY_URL = "/api/v1/availability";
    private static final ParameterizedTypeReference<Map<Long, List<AvailabilityWindow>>> WINDOWS =
        new ParameterizedTypeReference<>() {};

    @Test
    void weeklyShift_expandsIntoConcreteWindows() {
        Long doctor = createResource(createSubtype("people", "physician"), "Dr. House", ReservationMode.EXCLUSIVE, 1);
        Instant monday = LocalDate.now(ZoneOffset.UTC).with(TemporalAdjusters.next(DayOfWeek.MONDAY))
            .atStartOfDay(ZoneOffset.UTC).toInstant();
        var shift = new RecurrencePattern.Weekly(1, Set.of(DayOfWeek.MONDAY, DayOfWeek.WEDNESDAY), null,
            new RecurrenceRange.NoEnd());
        var request = new AvailabilityRequest(doctor, monday.plus(Duration.ofHours(9)),
            monday.plus(Duration.ofHours(12)), AvailabilityType.AVAILABLE, shift, null, null, "Clinic hours", "admin");

        ResponseEntity<AvailabilityResponse> created = post(AVAILABILITY_URL, request, AvailabilityResponse.class);
        assertThat(created.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        assertThat(created.getBody().recurrencePattern()).isEqualTo(shift);

        Instant sunday = monday.plus(Duration.ofDays(7));
        ResponseEntity<Map<Long, List<AvailabilityWindow>>> windows = exchange(
            AVAILABILITY_URL + "/windows?resourceIds=" + doctor + "&from=" + monday + "&to=" + sunday,
            HttpMethod.GET, TENANT, null, WINDOWS);

        assertThat(windows.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(windows.getBody().get(doctor))
            .extracting(AvailabilityWindow::start, AvailabilityWindow::end, AvailabilityWindow::type)
            .containsExactly(
                tuple(monday.plus(Duration.ofHours(9)), monday.plus(Duration.ofHours(12)), AvailabilityType.AVAILABLE),
                tuple(monday.plus(Duration.ofHours(57)), monday.plus(Duration.ofHours(60)), AvailabilityType.AVAILABLE));
    }

    @Test
    void blockedRecord_cutsDefaultAvailability_andCheckReportsIt() {
        Long room = createResource(createSubtype("place", "exam-room"), "Room 1", ReservationMode.EXCLUSIVE, 1);
        Instant nine = dayAt9(3);
        var lunch = new AvailabilityRequest(room, nine.plus(Duration.ofHours(3)), nine.plus(Duration.ofHours(4)),
            AvailabilityType.BLOCKED, null, null, null, "Cleaning", null);
        post(AVAILABILITY_URL, lunch, AvailabilityResponse.class);

        ResponseEntity<Map<Long, List<AvailabilityWindow>>> windows = exchange(
            AVAILABILITY_URL + "/windows?resourceIds=" + room + "&from=" + nine + "&to=" + nine.plus(Duration.ofHours(8)),
            HttpMethod.GET, TENANT, null, WINDOWS);
        assertThat(windows.getBody().get(room))
            .extracting(AvailabilityWindow::type)
            .containsExactly(AvailabilityType.AVAILABLE, AvailabilityType.BLOCKED, AvailabilityType.AVAILABLE);

        ResponseEntity<ResourceAvailabilityCheck> blocked = get(AVAILABILITY_URL + "/check?resourceId=" + room
            + "&start=" + nine.plus(Duration.ofMinutes(190)) + "&end=" + nine.plus(Duration.ofMinutes(220)),
            ResourceAvailabilityCheck.class);
        assertThat(blocked.getBody().available()).isFalse();
        assertThat(blocked.getBody().reason()).isNotBlank();

        ResponseEntity<ResourceAvailabilityCheck> free = get(AVAILABILITY_URL + "/check?resourceId=" + room
            + "&start=" + nine + "&end=" + nine.plus(Duration.ofMinutes(30)), ResourceAvailabilityCheck.class);
        assertThat(free.getBody().available()).isTrue();
        assertThat(free.getBody().mode()).isEqualTo(ReservationMode.EXCLUSIVE);
        assertThat(free.getBody().capacity()).isEqualTo(1);
    }

    @Test
    void deleteRecord_restoresDefaultAvailability() {
        Long room = createResource(createSubtype("place", "exam-room"), "Room 1", ReservationMode.EXCLUSIVE, 1);
        Instant nine = dayAt9(3);
        var closed = new AvailabilityRequest(room, nine, nine.plus(Duration.ofHours(8)),
            AvailabilityType.BLOCKED, null, null, null, "Renovation", null);
        Long recordId = post(AVAILABILITY_URL, closed, AvailabilityResponse.class).getBody().id();
        String checkUrl = AVAILABILITY_URL + "/check?resourceId=" + room + "&start=" + nine.plus(Duration.ofHours(1))
            + "&end=" + nine.plus(Duration.ofHours(2));
        assertThat(get(checkUrl, ResourceAvailabilityCheck.class).getBody().available()).isFalse();

        ResponseEntity<Void> deleted = delete(AVAILABILITY_URL + "/" + recordId, Void.class);

        assertThat(deleted.getStatusCode()).isEqualTo(HttpStatus.NO_CONTENT);
        assertThat(get(checkUrl, ResourceAvailabilityCheck.class).getBody().available()).isTrue();
    }

    @Test
    void createRecord_endingBeforeItStarts_returns400() {
        Long room = createResource(createSubtype("place", "exam-room"), "Room 1", ReservationMode.EXCLUSIVE, 1);
        Instant nine = dayAt9(3);
        var request = new AvailabilityRequest(room, nine, nine.minus(Duration.ofHours(1)),
            AvailabilityType.AVAILABLE, null, null, null, null, null);

        ResponseEntity<ErrorResponse> response = post(AVAILABILITY_URL, request, ErrorResponse.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    }

    @Test
    void records_ofAnotherTenant_areNotFound() {
        Long room = createResource(createSubtype("place", "exam-room"), "Room 1", ReservationMode.EXCLUSIVE, 1);
        Instant nine = dayAt9(3);
        Long recordId = post(AVAILABILITY_URL, new AvailabilityRequest(room, nine, nine.plus(Duration.ofHours(1)),
            AvailabilityType.AVAILABLE, null, null, null, null, null), AvailabilityResponse.class).getBody().id();

        ResponseEntity<ErrorResponse> response = exchange(AVAILABILITY_URL + "/" + recordId, HttpMethod.GET,
            OTHER_TENANT, null, ErrorResponse.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }
}
