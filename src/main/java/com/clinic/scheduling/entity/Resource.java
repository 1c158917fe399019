package com.clinic.scheduling.entity;

import com.clinic.scheduling.entity.converter.MetadataConverter;
import com.clinic.scheduling.exception.InsufficientInventoryException;
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
import jakarta.persistence.Version;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A bookable unit: a person, a room, a piece of equipment or a consumable.
 *
 * <p><strong>Taxonomy</strong>: a resource references exactly one {@link ResourceSubtype};
 * its {@link ResourceType} is always {@code subtype.resourceType}. Storing only the
 * subtype means the pair can never disagree.
 *
 * <p><strong>Hierarchy</strong>: {@link #parentResourceId} is a plain id, not an
 * association. Parents are resolved by lookup in {@code ResourceCatalogService}, which
 * also rejects cycles on write. Loading a resource therefore never drags in a chain of
 * ancestors.
 *
 * <p><strong>Reservation lock</strong>: the booking engine locks resource rows with
 * {@code SELECT ... FOR UPDATE} before reading their reservations. Every reservation
 * insert and every consumable decrement on this resource is therefore serialised.
 * {@link #version} additionally guards catalog edits racing with bookings.
 *
 * <p><strong>Inventory</strong>: only meaningful when {@link #consumable} is set.
 * {@link #quantityOnHand} never goes negative; {@link #consume(int)} throws
 * {@link InsufficientInventoryException} instead.
 */
@Entity
@Table(name = "resources")
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "id", callSuper = false)
public class Resource extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false, length = 64)
    private String tenantId;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "resource_subtype_id", nullable = false)
    private ResourceSubtype subtype;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "default_reservation_mode", nullable = false, length = 20)
    private ReservationMode defaultReservationMode = ReservationMode.EXCLUSIVE;

    @Column(name = "max_concurrent_bookings", nullable = false)
    private Integer maxConcurrentBookings = 1;

    @Column(name = "parent_resource_id")
    private Long parentResourceId;

    @Column(name = "is_consumable", nullable = false)
    private boolean consumable;

    @Column(name = "quantity_on_hand")
    private Integer quantityOnHand;

    @Column(name = "quantity_threshold")
    private Integer quantityThreshold;

    /** Staff identity owned by the external staff directory; never dereferenced here. */
    @Column(name = "staff_user_id", length = 64)
    private String staffUserId;

    @Convert(converter = MetadataConverter.class)
    @Column(name = "metadata", nullable = false, columnDefinition = "TEXT")
    private Map<String, Object> metadata = new LinkedHashMap<>();

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Version
    @Column(name = "version", nullable = false)
    private Integer version;

    public ResourceType getResourceType() {
        return subtype.getResourceType();
    }

    /**
     * Removes {@code quantity} units from stock.
     *
     * @return {@code true} when this decrement crossed the low-stock threshold
     */
    public boolean consume(int quantity) {
        return adjustInventory(-quantity);
    }

    /** Puts units back, e.g. when the appointment that used them is cancelled. */
    public void restock(int quantity) {
        adjustInventory(quantity);
    }

    /**
     * Applies a signed delta to {@link #quantityOnHand}.
     *
     * @return {@code true} when the quantity was above the threshold before and is at or
     *         below it now
     */
    public boolean adjustInventory(int delta) {
        int before = quantityOnHand == null ? 0 : quantityOnHand;
        int after = before + delta;
        if (after < 0) {
            throw new InsufficientInventoryException(id, before, -delta);
        }
        quantityOnHand = after;
        return quantityThreshold != null && before > quantityThreshold && after <= quantityThreshold;
    }

    public boolean isLowStock() {
        return consumable && quantityThreshold != null && quantityOnHand != null
            && quantityOnHand <= quantityThreshold;
    }
}
