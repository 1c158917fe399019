package com.clinic.scheduling.repository;

import com.clinic.scheduling.entity.Resource;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface ResourceRepository extends JpaRepository<Resource, Long>,
        JpaSpecificationExecutor<Resource> {

    Optional<Resource> findByIdAndTenantId(Long id, String tenantId);

    List<Resource> findAllByTenantIdAndIdIn(String tenantId, Collection<Long> ids);

    /**
     * Locks resource rows before their reservations are read. Rows are always locked in
     * id order so two bookings touching the same resources cannot deadlock.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000"))
    @Query("SELECT r FROM Resource r WHERE r.id IN :ids ORDER BY r.id")
    List<Resource> findAllByIdInForUpdate(@Param("ids") Collection<Long> ids);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000"))
    @Query("SELECT r FROM Resource r WHERE r.id = :id AND r.tenantId = :tenantId")
    Optional<Resource> findByIdAndTenantIdForUpdate(@Param("id") Long id, @Param("tenantId") String tenantId);

    @Query("""
        SELECT r FROM Resource r
        WHERE r.tenantId = :tenantId AND r.consumable = true AND r.active = true
          AND r.quantityThreshold IS NOT NULL AND r.quantityOnHand <= r.quantityThreshold
        ORDER BY r.quantityOnHand ASC, r.id ASC
        """)
    List<Resource> findLowStock(@Param("tenantId") String tenantId);

    @Query("SELECT r.parentResourceId FROM Resource r WHERE r.id = :id")
    Optional<Long> findParentIdById(@Param("id") Long id);

    @Query("SELECT r.id FROM Resource r WHERE r.parentResourceId = :parentId")
    List<Long> findIdsByParentResourceId(@Param("parentId") Long parentId);
}
