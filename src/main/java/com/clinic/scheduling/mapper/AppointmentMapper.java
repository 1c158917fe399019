package com.clinic.scheduling.mapper;

import com.clinic.scheduling.dto.response.AppointmentResponse;
import com.clinic.scheduling.entity.Appointment;
import com.clinic.scheduling.entity.AppointmentPreference;
import com.clinic.scheduling.entity.AppointmentResource;

public final class AppointmentMapper {

    private AppointmentMapper() {}

    public static AppointmentResponse toResponse(Appointment appointment) {
        return new AppointmentResponse(
            appointment.getId(),
            appointment.getTenantId(),
            appointment.getSlot().getId(),
            appointment.getSlot().getProcedure().getId(),
            appointment.getSlot().getStartTime(),
            appointment.getSlot().getEndTime(),
            appointment.getContactId(),
            appointment.getStatus(),
            appointment.getNotes(),
            appointment.getCancellationReason(),
            appointment.getCancelledAt(),
            appointment.getCompletedAt(),
            appointment.getCreatedBy(),
            appointment.getResources().stream().map(AppointmentMapper::toReservation).toList(),
            appointment.getPreferences().stream().map(AppointmentMapper::toPreference).toList(),
            appointment.getCreatedAt()
        );
    }

    private static AppointmentResponse.Reservation toReservation(AppointmentResource reservation) {
        return new AppointmentResponse.Reservation(
            reservation.getId(),
            reservation.getResource().getId(),
            reservation.getRole().getId(),
            reservation.getReservedStart(),
            reservation.getReservedEnd(),
            reservation.getReservationMode(),
            reservation.getStatus(),
            reservation.getQuantityConsumed()
        );
    }

    private static AppointmentResponse.Preference toPreference(AppointmentPreference preference) {
        return new AppointmentResponse.Preference(
            preference.getRole().getId(),
            preference.getResource().getId(),
            preference.getPreferenceType(),
            preference.getPriority()
        );
    }
}
