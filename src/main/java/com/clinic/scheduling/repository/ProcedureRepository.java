package com.clinic.scheduling.repository;

import com.clinic.scheduling.entity.Procedure;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface ProcedureRepository extends JpaRepository<Procedure, Long>,
        JpaSpecificationExecutor<Procedure> {

    Optional<Procedure> findByIdAndTenantId(Long id, String tenantId);

    boolean existsByTenantIdAndCode(String tenantId, String code);

    boolean existsByTenantIdAndCodeAndIdNot(String tenantId, String code, Long id);

    @Query("SELECT COUNT(c) > 0 FROM ProcedureComposition c WHERE c.child.id = :childId")
    boolean isUsedAsChild(@Param("childId") Long childId);
}
