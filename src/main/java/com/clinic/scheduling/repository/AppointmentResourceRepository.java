package com.clinic.scheduling.repository;

import com.clinic.scheduling.entity.AppointmentResource;
import com.clinic.scheduling.entity.AppointmentResourceStatus;
import com.clinic.scheduling.entity.AppointmentStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

public interface AppointmentResourceRepository extends JpaRepository<AppointmentResource, Long> {

    @Query("""
        SELECT ar FROM AppointmentResource ar JOIN ar.appointment a
        WHERE ar.resource.id IN :resourceIds
          AND ar.reservedStart < :windowEnd AND ar.reservedEnd > :windowStart
          AND a.status NOT IN :releasedAppointmentStatuses
          AND ar.status NOT IN :releasedRowStatuses
        ORDER BY ar.reservedStart ASC, ar.id ASC
        """)
    List<AppointmentResource> findOverlapping(@Param("resourceIds") Collection<Long> resourceIds,
                                              @Param("windowStart") Instant windowStart,
                                              @Param("windowEnd") Instant windowEnd,
                                              @Param("releasedAppointmentStatuses") Collection<AppointmentStatus> releasedAppointmentStatuses,
                                              @Param("releasedRowStatuses") Collection<AppointmentResourceStatus> releasedRowStatuses);

    /**
     * Reservations that still hold capacity: neither the appointment nor the row has been
     * released.
     */
    default List<AppointmentResource> findLiveOverlapping(Collection<Long> resourceIds,
                                                          Instant windowStart, Instant windowEnd) {
        if (resourceIds.isEmpty()) {
            return List.of();
        }
        return findOverlapping(resourceIds, windowStart, windowEnd,
            AppointmentStatus.RELEASING, AppointmentResourceStatus.NOT_LIVE);
    }
}
