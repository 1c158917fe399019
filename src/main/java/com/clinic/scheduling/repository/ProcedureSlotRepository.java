package com.clinic.scheduling.repository;

import com.clinic.scheduling.entity.ProcedureSlot;
import com.clinic.scheduling.entity.SlotGenerationType;
import com.clinic.scheduling.entity.SlotStatus;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Optional;

public interface ProcedureSlotRepository extends JpaRepository<ProcedureSlot, Long>,
        JpaSpecificationExecutor<ProcedureSlot> {

    @Query("SELECT s FROM ProcedureSlot s JOIN FETCH s.procedure WHERE s.id = :id AND s.tenantId = :tenantId")
    Optional<ProcedureSlot> findByIdAndTenantId(@Param("id") Long id, @Param("tenantId") String tenantId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000"))
    @Query("SELECT s FROM ProcedureSlot s WHERE s.id = :id AND s.tenantId = :tenantId")
    Optional<ProcedureSlot> findByIdAndTenantIdForUpdate(@Param("id") Long id, @Param("tenantId") String tenantId);

    boolean existsByProcedureIdAndStartTimeAndStatusNot(Long procedureId, Instant startTime, SlotStatus status);

    /** Deletes never-booked auto slots; slots referenced by any appointment are kept as history. */
    @Modifying
    @Query("""
        DELETE FROM ProcedureSlot s
        WHERE s.tenantId = :tenantId AND s.generationType = :generationType
          AND s.status = :status AND s.endTime < :before
          AND NOT EXISTS (SELECT 1 FROM Appointment a WHERE a.slot = s)
        """)
    int deleteStale(@Param("tenantId") String tenantId,
                    @Param("generationType") SlotGenerationType generationType,
                    @Param("status") SlotStatus status,
                    @Param("before") Instant before);
}
