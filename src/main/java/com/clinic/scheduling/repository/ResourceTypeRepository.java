package com.clinic.scheduling.repository;

import com.clinic.scheduling.entity.ResourceType;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface ResourceTypeRepository extends JpaRepository<ResourceType, Long> {

    Optional<ResourceType> findByCode(String code);

    List<ResourceType> findAllByOrderBySortOrderAscIdAsc();
}
