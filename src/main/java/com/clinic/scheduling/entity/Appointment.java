package com.clinic.scheduling.entity;

import jakarta.persistence.CascadeType;
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
import jakarta.persistence.OneToMany;
import jakarta.persistence.OrderBy;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.BatchSize;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A booking of a contact into a {@link ProcedureSlot}.
 *
 * <p>{@link #contactId} identifies a contact owned by the CRM; this engine never reads
 * contact data. Reservation rows ({@link #resources}) and preferences are inserted
 * together with the appointment and are never deleted: a cancelled appointment keeps its
 * rows as history, and the conflict queries exclude them by status.
 *
 * <p>{@link #version} guards concurrent status transitions (e.g. a cancel racing a
 * check-in); the loser gets an optimistic-lock failure mapped to 409.
 */
@Entity
@Table(name = "appointments")
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "id", callSuper = false)
public class Appointment extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false, length = 64)
    private String tenantId;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "procedure_slot_id", nullable = false)
    private ProcedureSlot slot;

    @Column(name = "contact_id", length = 64)
    private String contactId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private AppointmentStatus status = AppointmentStatus.SCHEDULED;

    @Column(name = "notes", columnDefinition = "TEXT")
    private String notes;

    @Column(name = "cancellation_reason", length = 255)
    private String cancellationReason;

    @Column(name = "cancelled_at")
    private Instant cancelledAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "created_by", length = 64)
    private String createdBy;

    @Version
    @Column(name = "version", nullable = false)
    private Integer version;

    @OneToMany(mappedBy = "appointment", fetch = FetchType.LAZY, cascade = CascadeType.ALL)
    @OrderBy("id ASC")
    @BatchSize(size = 20)
    private List<AppointmentResource> resources = new ArrayList<>();

    @OneToMany(mappedBy = "appointment", fetch = FetchType.LAZY, cascade = CascadeType.ALL)
    @OrderBy("priority ASC, id ASC")
    @BatchSize(size = 20)
    private List<AppointmentPreference> preferences = new ArrayList<>();

    public void addResource(AppointmentResource reservation) {
        reservation.setAppointment(this);
        resources.add(reservation);
    }

    public void addPreference(AppointmentPreference preference) {
        preference.setAppointment(this);
        preferences.add(preference);
    }
}
