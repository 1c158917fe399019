package com.clinic.scheduling.repository;

import com.clinic.scheduling.entity.ResourceAvailability;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface ResourceAvailabilityRepository extends JpaRepository<ResourceAvailability, Long> {

    @Query("""
        SELECT a FROM ResourceAvailability a JOIN FETCH a.resource r
        WHERE a.id = :id AND r.tenantId = :tenantId
        """)
    Optional<ResourceAvailability> findByIdAndTenantId(@Param("id") Long id, @Param("tenantId") String tenantId);

    @Query("""
        SELECT a FROM ResourceAvailability a
        WHERE a.resource.id = :resourceId
        ORDER BY a.startTime ASC, a.id ASC
        """)
    List<ResourceAvailability> findAllByResourceId(@Param("resourceId") Long resourceId);

    /** Records whose first occurrence starts before the window end; the rest cannot reach it. */
    @Query("""
        SELECT a FROM ResourceAvailability a
        WHERE a.resource.id IN :resourceIds AND a.startTime < :windowEnd
        ORDER BY a.id ASC
        """)
    List<ResourceAvailability> findStartingBefore(@Param("resourceIds") Collection<Long> resourceIds,
                                                  @Param("windowEnd") Instant windowEnd);
}
