package com.clinic.scheduling.unit.service;

import com.clinic.scheduling.config.SchedulingProperties;
import com.clinic.scheduling.dto.request.GenerateSlotsRequest;
import com.clinic.scheduling.dto.request.PreferenceRequest;
import com.clinic.scheduling.entity.Appointment;
import com.clinic.scheduling.entity.AppointmentResource;
import com.clinic.scheduling.entity.AvailabilityType;
import com.clinic.scheduling.entity.PreferenceType;
import com.clinic.scheduling.entity.Procedure;
import com.clinic.scheduling.entity.ProcedureSlot;
import com.clinic.scheduling.entity.ProcedureType;
import com.clinic.scheduling.entity.ReservationMode;
import com.clinic.scheduling.entity.Resource;
import com.clinic.scheduling.entity.ResourceSubtype;
import com.clinic.scheduling.entity.ResourceType;
import com.clinic.scheduling.entity.SlotStatus;
import com.clinic.scheduling.exception.ValidationException;
import com.clinic.scheduling.repository.AppointmentResourceRepository;
import com.clinic.scheduling.repository.ProcedureRepository;
import com.clinic.scheduling.repository.ProcedureSlotRepository;
import com.clinic.scheduling.repository.ResourceRepository;
import com.clinic.scheduling.service.AvailabilityService;
import com.clinic.scheduling.service.CapacityEvaluator;
import com.clinic.scheduling.service.ProcedureService;
import com.clinic.scheduling.service.ResourceCatalogService;
import com.clinic.scheduling.service.ResourceSelector;
import com.clinic.scheduling.service.SlotGenerationService;
import com.clinic.scheduling.service.model.AvailabilityTimeline;
import com.clinic.scheduling.service.model.AvailabilityWindow;
import com.clinic.scheduling.service.model.ExpandedRequirement;
import com.clinic.scheduling.service.model.GeneratedSlot;
import com.clinic.scheduling.service.model.RoleCandidate;
import com.clinic.scheduling.service.model.SlotValidationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SlotGenerationServiceTest {

    private static final String TENANT = "clinic-a";
    private static final Long DOCTOR_ROLE = 10L;

    @Mock
    private ProcedureRepository procedureRepository;

    @Mock
    private ProcedureSlotRepository slotRepository;

    @Mock
    private ResourceRepository resourceRepository;

    @Mock
    private AppointmentResourceRepository appointmentResourceRepository;

    @Mock
    private ProcedureService procedureService;

    @Mock
    private ResourceCatalogService catalogService;

    @Mock
    private AvailabilityService availabilityService;

    private SlotGenerationService slotGenerationService;

    private Procedure consult;
    private Resource doctor;

    @BeforeEach
    void setUp() {
        slotGenerationService = new SlotGenerationService(procedureRepository, slotRepository, resourceRepository,
            appointmentResourceRepository, procedureService, catalogService, availabilityService,
            new ResourceSelector(new CapacityEvaluator()), SchedulingProperties.defaults());

        consult = new Procedure();
        consult.setId(1L);
        consult.setTenantId(TENANT);
        consult.setProcedureType(ProcedureType.ATOMIC);
        consult.setDurationMinutes(30);

        ResourceType people = new ResourceType();
        people.setId(1L);
        people.setCode("people");
        ResourceSubtype physician = new ResourceSubtype();
        physician.setResourceType(people);
        doctor = new Resource();
        doctor.setId(7L);
        doctor.setTenantId(TENANT);
        doctor.setSubtype(physician);
    }

    @Test
    void generateSlots_skipsStartsWhereTheDoctorIsBusy() {
        stubMorningClinic();
        AppointmentResource busy = new AppointmentResource();
        busy.setAppointment(new Appointment());
        busy.getAppointment().setId(50L);
        busy.setResource(doctor);
        busy.setReservedStart(at("09:30"));
        busy.setReservedEnd(at("10:00"));
        busy.setReservationMode(ReservationMode.EXCLUSIVE);
        when(appointmentResourceRepository.findLiveOverlapping(anyCollection(), any(), any()))
            .thenReturn(List.of(busy));

        List<GeneratedSlot> slots = slotGenerationService.generateSlots(TENANT,
            new GenerateSlotsRequest(1L, at("09:00"), at("11:00"), null, 30, null, null));

        assertThat(slots).extracting(GeneratedSlot::startTime)
            .containsExactly(at("09:00"), at("10:00"), at("10:30"));
        assertThat(slots.get(0).endTime()).isEqualTo(at("09:30"));
        assertThat(slots.get(0).assignments()).singleElement()
            .satisfies(a -> assertThat(a.resourceId()).isEqualTo(7L));
    }

    @Test
    void generateSlots_stopsAtMaxSlots() {
        stubMorningClinic();
        when(appointmentResourceRepository.findLiveOverlapping(anyCollection(), any(), any())).thenReturn(List.of());

        List<GeneratedSlot> slots = slotGenerationService.generateSlots(TENANT,
            new GenerateSlotsRequest(1L, at("09:00"), at("11:00"), null, 15, 2, null));

        assertThat(slots).extracting(GeneratedSlot::startTime).containsExactly(at("09:00"), at("09:15"));
    }

    @Test
    void generateSlots_preferenceForOtherResource_addsPenaltyToScore() {
        stubMorningClinic();
        when(appointmentResourceRepository.findLiveOverlapping(anyCollection(), any(), any())).thenReturn(List.of());

        List<GeneratedSlot> slots = slotGenerationService.generateSlots(TENANT,
            new GenerateSlotsRequest(1L, at("09:00"), at("09:30"), null, 30, null,
                List.of(new PreferenceRequest(DOCTOR_ROLE, 99L, PreferenceType.PREFERRED, null))));

        assertThat(slots).singleElement().satisfies(s -> assertThat(s.priorityScore()).isEqualTo(5));
    }

    @Test
    void generateSlots_emptyWindow_throwsValidationException() {
        when(procedureRepository.findByIdAndTenantId(1L, TENANT)).thenReturn(Optional.of(consult));

        assertThatThrownBy(() -> slotGenerationService.generateSlots(TENANT,
                new GenerateSlotsRequest(1L, at("11:00"), at("09:00"), null, null, null, null)))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("end must be after its start");
    }

    @Test
    void validateSlot_bookedPastSlotOfInactiveProcedure_listsEveryIssue() {
        consult.setActive(false);
        ProcedureSlot slot = new ProcedureSlot();
        slot.setId(3L);
        slot.setProcedure(consult);
        slot.setStartTime(Instant.parse("2020-01-06T09:00:00Z"));
        slot.setEndTime(Instant.parse("2020-01-06T09:30:00Z"));
        slot.setStatus(SlotStatus.BOOKED);
        when(slotRepository.findByIdAndTenantId(3L, TENANT)).thenReturn(Optional.of(slot));

        SlotValidationResult result = slotGenerationService.validateSlot(TENANT, 3L);

        assertThat(result.valid()).isFalse();
        assertThat(result.issues()).containsExactly(
            "Slot is BOOKED", "Procedure 1 is deactivated", "Slot started in the past");
        assertThat(result.alternatives()).isEmpty();
    }

    @Test
    void cleanupStaleSlots_withoutCutoff_throwsValidationException() {
        assertThatThrownBy(() -> slotGenerationService.cleanupStaleSlots(TENANT, null))
            .isInstanceOf(ValidationException.class);
        verify(slotRepository, never()).deleteStale(any(), any(), any(), any());
    }

    @Test
    void alignUp_roundsToNextIntervalBoundary() {
        assertThat(align(Instant.parse("2025-01-06T09:07:00Z"), 15)).isEqualTo(Instant.parse("2025-01-06T09:15:00Z"));
        assertThat(align(Instant.parse("2025-01-06T09:15:00Z"), 15)).isEqualTo(Instant.parse("2025-01-06T09:15:00Z"));
        assertThat(align(Instant.parse("2025-01-06T09:15:00.001Z"), 15)).isEqualTo(Instant.parse("2025-01-06T09:30:00Z"));
    }

    private void stubMorningClinic() {
        when(procedureRepository.findByIdAndTenantId(1L, TENANT)).thenReturn(Optional.of(consult));
        when(procedureService.totalDurationMinutes(consult)).thenReturn(30);
        when(procedureService.expandedRequirements(consult)).thenReturn(List.of(
            new ExpandedRequirement(1L, 100L, DOCTOR_ROLE, 1, null, true, 0, 30)));
        when(catalogService.findRoleCandidates(DOCTOR_ROLE, TENANT, true))
            .thenReturn(List.of(new RoleCandidate(doctor, 0)));
        when(availabilityService.buildTimelines(anyCollection(), any(), any())).thenReturn(Map.of(7L,
            new AvailabilityTimeline(7L, List.of(new AvailabilityWindow(7L, at("09:00"), at("11:00"),
                AvailabilityType.AVAILABLE, ReservationMode.EXCLUSIVE, 1)), List.of())));
    }

    private static Instant align(Instant instant, int interval) {
        return ReflectionTestUtils.invokeMethod(SlotGenerationService.class, "alignUp", instant, interval);
    }

    private static Instant at(String time) {
        return Instant.parse("2025-01-06T" + time + ":00Z");
    }
}
