package com.clinic.scheduling.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * The actual reservation of one resource, in one role, for
 * {@code [reservedStart, reservedEnd)}.
 *
 * <p>A row is <em>live</em> while its appointment is not cancelled or no-show and its
 * own {@link #status} is live (see {@link AppointmentResourceStatus#isLive()}). Only live
 * rows count in the double-booking and capacity checks:
 * <ul>
 *   <li>exclusive resource: live rows never overlap;</li>
 *   <li>shared resource: at every instant the number of overlapping live rows stays
 *       within the effective max-concurrency.</li>
 * </ul>
 * Both are checked inside the booking transaction after the resource row is locked.
 *
 * <p>{@link #quantityConsumed} is set for consumables only.
 */
@Entity
@Table(name = "appointment_resources")
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "id", callSuper = false)
public class AppointmentResource extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "appointment_id", nullable = false)
    private Appointment appointment;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "resource_id", nullable = false)
    private Resource resource;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "role_id", nullable = false)
    private ResourceRole role;

    @Column(name = "reserved_start", nullable = false)
    private Instant reservedStart;

    @Column(name = "reserved_end", nullable = false)
    private Instant reservedEnd;

    @Enumerated(EnumType.STRING)
    @Column(name = "reservation_mode", nullable = false, length = 20)
    private ReservationMode reservationMode;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private AppointmentResourceStatus status = AppointmentResourceStatus.ASSIGNED;

    @Column(name = "quantity_consumed")
    private Integer quantityConsumed;

    @Column(name = "notes", columnDefinition = "TEXT")
    private String notes;
}
