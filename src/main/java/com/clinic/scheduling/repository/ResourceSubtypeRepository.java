package com.clinic.scheduling.repository;

import com.clinic.scheduling.entity.ResourceSubtype;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface ResourceSubtypeRepository extends JpaRepository<ResourceSubtype, Long> {

    boolean existsByCode(String code);

    @Query("SELECT s FROM ResourceSubtype s JOIN FETCH s.resourceType ORDER BY s.id")
    List<ResourceSubtype> findAllWithType();

    @Query("SELECT s FROM ResourceSubtype s JOIN FETCH s.resourceType t WHERE t.code = :typeCode ORDER BY s.id")
    List<ResourceSubtype> findAllByTypeCode(@Param("typeCode") String typeCode);
}
