package com.clinic.scheduling.unit.service;

import com.clinic.scheduling.dto.request.CreateAppointmentRequest;
import com.clinic.scheduling.dto.response.AppointmentResponse;
import com.clinic.scheduling.entity.AppointmentStatus;
import com.clinic.scheduling.entity.ReservationMode;
import com.clinic.scheduling.event.BookingConflictEvent;
import com.clinic.scheduling.exception.BookingConflictException;
import com.clinic.scheduling.exception.ConflictException;
import com.clinic.scheduling.exception.InvalidAppointmentStateException;
import com.clinic.scheduling.exception.StorageException;
import com.clinic.scheduling.service.AppointmentService;
import com.clinic.scheduling.service.BookingService;
import com.clinic.scheduling.service.SlotGenerationService;
import com.clinic.scheduling.service.model.GeneratedSlot;
import com.clinic.scheduling.service.model.ResourceConflict;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BookingServiceTest {

    private static final String TENANT = "clinic-a";
    private static final Instant START = Instant.parse("2030-01-07T09:00:00Z");

    @Mock
    private AppointmentService appointmentService;

    @Mock
    private SlotGenerationService slotGenerationService;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    @InjectMocks
    private BookingService bookingService;

    private final CreateAppointmentRequest request =
        new CreateAppointmentRequest(10L, null, START, "contact-1", null, null, null);

    @Test
    void book_success_returnsAppointmentWithoutLookingForAlternatives() {
        AppointmentResponse booked = new AppointmentResponse(1L, TENANT, 2L, 10L, START, START.plusSeconds(1800),
            "contact-1", AppointmentStatus.SCHEDULED, null, null, null, null, null, List.of(), List.of(), null);
        when(appointmentService.create(TENANT, request)).thenReturn(booked);

        assertThat(bookingService.book(TENANT, request)).isSameAs(booked);
        verify(slotGenerationService, never()).findAlternatives(anyString(), anyLong(), any(), anyList());
    }

    @Test
    void book_conflict_attachesAlternativesAndPublishesEvent() {
        ResourceConflict conflict = new ResourceConflict(5L, 77L, START, START.plusSeconds(1800),
            ReservationMode.EXCLUSIVE);
        GeneratedSlot alternative = new GeneratedSlot(START.plusSeconds(1800), START.plusSeconds(3600), List.of(), 0);
        when(appointmentService.create(TENANT, request))
            .thenThrow(new ConflictException("Resource 5 is already reserved", List.of(conflict)));
        when(slotGenerationService.findAlternatives(eq(TENANT), eq(10L), eq(START), anyList()))
            .thenReturn(List.of(alternative));

        assertThatThrownBy(() -> bookingService.book(TENANT, request))
            .isInstanceOf(BookingConflictException.class)
            .satisfies(ex -> {
                BookingConflictException bce = (BookingConflictException) ex;
                assertThat(bce.getConflicts()).containsExactly(conflict);
                assertThat(bce.getAlternatives()).containsExactly(alternative);
            });

        ArgumentCaptor<BookingConflictEvent> event = ArgumentCaptor.forClass(BookingConflictEvent.class);
        verify(eventPublisher).publishEvent(event.capture());
        assertThat(event.getValue().alternativesOffered()).isEqualTo(1);
        assertThat(event.getValue().contactId()).isEqualTo("contact-1");
    }

    @Test
    void book_conflict_alternativeSearchFailure_stillReportsConflict() {
        when(appointmentService.create(TENANT, request)).thenThrow(new ConflictException("Slot 2 is BOOKED"));
        when(slotGenerationService.findAlternatives(eq(TENANT), eq(10L), eq(START), anyList()))
            .thenThrow(new IllegalStateException("boom"));

        assertThatThrownBy(() -> bookingService.book(TENANT, request))
            .isInstanceOf(BookingConflictException.class)
            .satisfies(ex -> assertThat(((BookingConflictException) ex).getAlternatives()).isEmpty());
    }

    @Test
    void book_invalidState_isNotTurnedIntoBookingConflict() {
        when(appointmentService.create(TENANT, request)).thenThrow(
            new InvalidAppointmentStateException(1L, AppointmentStatus.COMPLETED, AppointmentStatus.CANCELLED));

        assertThatThrownBy(() -> bookingService.book(TENANT, request))
            .isExactlyInstanceOf(InvalidAppointmentStateException.class);
        verify(eventPublisher, never()).publishEvent(any(Object.class));
    }

    @Test
    void book_lockTimeout_propagatesUnchanged() {
        when(appointmentService.create(TENANT, request)).thenThrow(new CannotAcquireLockException("lock timeout"));

        assertThatThrownBy(() -> bookingService.book(TENANT, request))
            .isInstanceOf(CannotAcquireLockException.class);
    }

    @Test
    void book_storageFailure_isWrapped() {
        when(appointmentService.create(TENANT, request))
            .thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThatThrownBy(() -> bookingService.book(TENANT, request))
            .isInstanceOf(StorageException.class)
            .hasCauseInstanceOf(DataAccessResourceFailureException.class);
    }
}
