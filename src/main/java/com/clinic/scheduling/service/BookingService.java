package com.clinic.scheduling.service;

import com.clinic.scheduling.dto.request.CreateAppointmentRequest;
import com.clinic.scheduling.dto.request.RescheduleAppointmentRequest;
import com.clinic.scheduling.dto.response.AppointmentResponse;
import com.clinic.scheduling.event.BookingConflictEvent;
import com.clinic.scheduling.exception.BookingConflictException;
import com.clinic.scheduling.exception.ConflictException;
import com.clinic.scheduling.exception.InvalidAppointmentStateException;
import com.clinic.scheduling.exception.StorageException;
import com.clinic.scheduling.service.model.GeneratedSlot;
import com.clinic.scheduling.service.model.PreferenceSpec;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.function.Supplier;

@Service
@RequiredArgsConstructor
public class BookingService {

    private static final Logger log = LoggerFactory.getLogger(BookingService.class);

    private final AppointmentService appointmentService;
    private final SlotGenerationService slotGenerationService;
    private final ApplicationEventPublisher eventPublisher;

    public AppointmentResponse book(String tenantId, CreateAppointmentRequest request) {
        return withAlternatives(tenantId, request.procedureId(), request.slotId(), request.startTime(),
            request.contactId(), SlotGenerationService.toSpecs(request.preferences()),
            () -> appointmentService.create(tenantId, request));
    }

    public AppointmentResponse reschedule(String tenantId, Long appointmentId, RescheduleAppointmentRequest request) {
        AppointmentResponse current = appointmentService.get(tenantId, appointmentId);
        List<PreferenceSpec> preferences = current.preferences().stream()
            .map(p -> new PreferenceSpec(p.roleId(), p.resourceId(), p.preferenceType(), p.priority()))
            .toList();
        return withAlternatives(tenantId, current.procedureId(), request.slotId(), request.startTime(),
            current.contactId(), preferences,
            () -> appointmentService.reschedule(tenantId, appointmentId, request));
    }

    private AppointmentResponse withAlternatives(String tenantId, Long procedureId, Long slotId, Instant requestedStart,
                                                 String contactId, List<PreferenceSpec> preferences,
                                                 Supplier<AppointmentResponse> booking) {
        try {
            return booking.get();
        } catch (InvalidAppointmentStateException ex) {
            throw ex;
        } catch (ConflictException ex) {
            List<GeneratedSlot> alternatives = alternatives(tenantId, procedureId, requestedStart, preferences);
            eventPublisher.publishEvent(new BookingConflictEvent(tenantId, procedureId, slotId, requestedStart,
                contactId, ex.getMessage(), ex.getConflicts(), alternatives.size()));
            throw new BookingConflictException(ex, alternatives);
        } catch (DataIntegrityViolationException | ConcurrencyFailureException ex) {
            throw ex;
        } catch (DataAccessException ex) {
            throw new StorageException("Booking failed on a storage error", ex);
        }
    }

    private List<GeneratedSlot> alternatives(String tenantId, Long procedureId, Instant requestedStart,
                                             List<PreferenceSpec> preferences) {
        Instant now = Instant.now();
        Instant from = requestedStart != null && requestedStart.isAfter(now) ? requestedStart : now;
        try {
            return slotGenerationService.findAlternatives(tenantId, procedureId, from, preferences);
        } catch (RuntimeException ex) {
            log.warn("Could not compute alternatives for procedure {} in tenant {}: {}",
                procedureId, tenantId, ex.getMessage());
            return List.of();
        }
    }
}
