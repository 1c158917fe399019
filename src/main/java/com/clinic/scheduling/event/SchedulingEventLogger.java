package com.clinic.scheduling.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Default consumer of scheduling events. Listeners run after the publishing transaction
 * commits, or immediately when an event is published outside a transaction, so rolled
 * back bookings never show up here.
 */
@Component
public class SchedulingEventLogger {

    private static final Logger log = LoggerFactory.getLogger(SchedulingEventLogger.class);

    @TransactionalEventListener(fallbackExecution = true)
    public void onAppointmentCreated(AppointmentCreatedEvent event) {
        log.info("Appointment {} created for tenant {} on slot {} [{} - {}], resources {}",
            event.appointmentId(), event.tenantId(), event.slotId(),
            event.startTime(), event.endTime(), event.resourceIds());
    }

    @TransactionalEventListener(fallbackExecution = true)
    public void onAppointmentCancelled(AppointmentCancelledEvent event) {
        log.info("Appointment {} cancelled for tenant {}, slot {} released (reason: {})",
            event.appointmentId(), event.tenantId(), event.slotId(), event.reason());
    }

    @TransactionalEventListener(fallbackExecution = true)
    public void onAppointmentCompleted(AppointmentCompletedEvent event) {
        log.info("Appointment {} completed for tenant {} at {}",
            event.appointmentId(), event.tenantId(), event.completedAt());
    }

    @TransactionalEventListener(fallbackExecution = true)
    public void onStatusChanged(AppointmentStatusChangedEvent event) {
        log.debug("Appointment {} moved {} -> {}", event.appointmentId(), event.from(), event.to());
    }

    @TransactionalEventListener(fallbackExecution = true)
    public void onLowStock(LowStockEvent event) {
        log.warn("Resource {} ({}) is low on stock for tenant {}: {} on hand, threshold {}",
            event.resourceId(), event.resourceName(), event.tenantId(),
            event.quantityOnHand(), event.quantityThreshold());
    }

    @TransactionalEventListener(fallbackExecution = true)
    public void onInventoryAdjusted(InventoryAdjustedEvent event) {
        log.info("Inventory of resource {} adjusted by {} ({} -> {}) for tenant {}: {}",
            event.resourceId(), event.delta(), event.quantityBefore(), event.quantityAfter(),
            event.tenantId(), event.reason());
    }

    @TransactionalEventListener(fallbackExecution = true)
    public void onRoleAssignmentChanged(RoleAssignmentChangedEvent event) {
        log.info("Role {} {} on resource {} for tenant {} (priority {})",
            event.roleId(), event.change(), event.resourceId(), event.tenantId(), event.priority());
    }

    @TransactionalEventListener(fallbackExecution = true)
    public void onBookingConflict(BookingConflictEvent event) {
        log.warn("Booking conflict for tenant {} on procedure {} at {}: {} ({} conflicts, {} alternatives)",
            event.tenantId(), event.procedureId(), event.requestedStart(), event.message(),
            event.conflicts().size(), event.alternativesOffered());
    }
}
