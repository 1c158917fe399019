package com.clinic.scheduling.exception;

import com.clinic.scheduling.entity.AppointmentStatus;

public class InvalidAppointmentStateException extends ConflictException {

    public InvalidAppointmentStateException(Long appointmentId, AppointmentStatus current, AppointmentStatus target) {
        super("Appointment " + appointmentId + " cannot move to " + target + " while in status " + current);
    }
}
