package com.clinic.scheduling.repository;

import com.clinic.scheduling.entity.Appointment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface AppointmentRepository extends JpaRepository<Appointment, Long>,
        JpaSpecificationExecutor<Appointment> {

    @Query("""
        SELECT a FROM Appointment a JOIN FETCH a.slot s JOIN FETCH s.procedure
        WHERE a.id = :id AND a.tenantId = :tenantId
        """)
    Optional<Appointment> findByIdAndTenantId(@Param("id") Long id, @Param("tenantId") String tenantId);
}
