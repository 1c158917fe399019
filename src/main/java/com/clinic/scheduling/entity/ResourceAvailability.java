package com.clinic.scheduling.entity;

import com.clinic.scheduling.entity.converter.RecurrencePatternConverter;
import com.clinic.scheduling.recurrence.RecurrencePattern;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
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
 * An available or blocked window on a resource.
 *
 * <p>{@link #startTime}/{@link #endTime} describe the first occurrence. When
 * {@link #recurrencePattern} is set the window repeats according to the rule; it is
 * stored as tagged JSON in a {@code TEXT} column. The overrides, when present, replace
 * the resource's default reservation mode and max-concurrency for instants covered by
 * this window.
 */
@Entity
@Table(name = "resource_availability")
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "id", callSuper = false)
public class ResourceAvailability extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "resource_id", nullable = false)
    private Resource resource;

    @Column(name = "start_time", nullable = false)
    private Instant startTime;

    @Column(name = "end_time", nullable = false)
    private Instant endTime;

    @Enumerated(EnumType.STRING)
    @Column(name = "availability_type", nullable = false, length = 20)
    private AvailabilityType availabilityType;

    @Convert(converter = RecurrencePatternConverter.class)
    @Column(name = "recurrence_pattern", columnDefinition = "TEXT")
    private RecurrencePattern recurrencePattern;

    @Enumerated(EnumType.STRING)
    @Column(name = "reservation_mode_override", length = 20)
    private ReservationMode reservationModeOverride;

    @Column(name = "max_concurrent_override")
    private Integer maxConcurrentOverride;

    @Column(name = "reason", length = 255)
    private String reason;

    @Column(name = "created_by", length = 64)
    private String createdBy;
}
