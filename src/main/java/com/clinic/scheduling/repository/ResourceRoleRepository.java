package com.clinic.scheduling.repository;

import com.clinic.scheduling.entity.ResourceRole;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface ResourceRoleRepository extends JpaRepository<ResourceRole, Long> {

    boolean existsByCode(String code);

    @Query("SELECT r FROM ResourceRole r JOIN FETCH r.resourceType ORDER BY r.id")
    List<ResourceRole> findAllWithType();

    @Query("SELECT r FROM ResourceRole r JOIN FETCH r.resourceType t WHERE t.code = :typeCode ORDER BY r.id")
    List<ResourceRole> findAllByTypeCode(@Param("typeCode") String typeCode);
}
