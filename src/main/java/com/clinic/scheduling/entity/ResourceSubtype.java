package com.clinic.scheduling.entity;

import com.clinic.scheduling.entity.converter.MetadataSchemaConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
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

import java.util.ArrayList;
import java.util.List;

/**
 * Second level of the resource taxonomy ("doctor", "treatment room", "laser").
 *
 * <p>{@link #metadataSchema} declares which metadata keys a resource of this subtype may
 * carry and their value types. Resource metadata is checked against it on every write
 * by {@code MetadataValidator}; the schema itself is stored as a JSON array in a
 * {@code TEXT} column.
 */
@Entity
@Table(name = "resource_subtypes")
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "id", callSuper = false)
public class ResourceSubtype extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "resource_type_id", nullable = false)
    private ResourceType resourceType;

    @Column(name = "code", nullable = false, unique = true, length = 50)
    private String code;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Convert(converter = MetadataSchemaConverter.class)
    @Column(name = "metadata_schema", nullable = false, columnDefinition = "TEXT")
    private List<MetadataField> metadataSchema = new ArrayList<>();

    @Column(name = "is_active", nullable = false)
    private boolean active = true;
}
