package com.clinic.scheduling.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
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

/**
 * Ties a {@link ResourceRole} to an atomic {@link Procedure}.
 *
 * <p>The role is held for {@code [offsetStartMinutes, offsetEndMinutes)} measured from
 * the start of the procedure's active part (after its buffer-before). A {@code null}
 * {@link #offsetEndMinutes} means "until the procedure ends"; a {@code null}
 * {@link #quantityMax} means "exactly {@link #quantityMin}".
 */
@Entity
@Table(name = "procedure_requirements")
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "id", callSuper = false)
public class ProcedureRequirement extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "procedure_id", nullable = false)
    private Procedure procedure;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "role_id", nullable = false)
    private ResourceRole role;

    @Column(name = "quantity_min", nullable = false)
    private Integer quantityMin = 1;

    @Column(name = "quantity_max")
    private Integer quantityMax;

    @Column(name = "is_required", nullable = false)
    private boolean required = true;

    @Column(name = "offset_start_minutes", nullable = false)
    private Integer offsetStartMinutes = 0;

    @Column(name = "offset_end_minutes")
    private Integer offsetEndMinutes;

    @Column(name = "notes", columnDefinition = "TEXT")
    private String notes;
}
