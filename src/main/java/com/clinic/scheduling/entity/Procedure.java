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
import jakarta.persistence.OneToMany;
import jakarta.persistence.OrderBy;
import jakarta.persistence.Table;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.BatchSize;

import java.util.ArrayList;
import java.util.List;

/**
 * A clinical service definition.
 *
 * <p>An {@link ProcedureType#ATOMIC} procedure has its own {@link #durationMinutes} and
 * carries the role requirements. A {@link ProcedureType#COMPOSITE} procedure has no
 * duration of its own; it is the ordered sequence of {@link #children}, each followed by
 * a gap. Both kinds add {@link #bufferBeforeMinutes} and {@link #bufferAfterMinutes}
 * around themselves.
 *
 * <p>{@link #children} and {@link #requirements} are owned collections
 * ({@code orphanRemoval}); {@code @BatchSize} keeps tree walks from issuing one SELECT
 * per node.
 */
@Entity
@Table(name = "procedures")
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "id", callSuper = false)
public class Procedure extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false, length = 64)
    private String tenantId;

    /** Unique per tenant, enforced by {@code uk_procedures_tenant_code}. */
    @Column(name = "code", nullable = false, length = 50)
    private String code;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "procedure_type", nullable = false, length = 20)
    private ProcedureType procedureType;

    @Column(name = "duration_minutes")
    private Integer durationMinutes;

    @Column(name = "buffer_before_minutes", nullable = false)
    private Integer bufferBeforeMinutes = 0;

    @Column(name = "buffer_after_minutes", nullable = false)
    private Integer bufferAfterMinutes = 0;

    @Column(name = "color", length = 20)
    private String color;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @OneToMany(mappedBy = "parent", fetch = FetchType.LAZY, cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("sequenceOrder ASC, id ASC")
    @BatchSize(size = 20)
    private List<ProcedureComposition> children = new ArrayList<>();

    @OneToMany(mappedBy = "procedure", fetch = FetchType.LAZY, cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id ASC")
    @BatchSize(size = 20)
    private List<ProcedureRequirement> requirements = new ArrayList<>();

    public boolean isComposite() {
        return procedureType == ProcedureType.COMPOSITE;
    }
}
