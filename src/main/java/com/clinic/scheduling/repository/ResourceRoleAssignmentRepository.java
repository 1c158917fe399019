package com.clinic.scheduling.repository;

import com.clinic.scheduling.entity.ResourceRoleAssignment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface ResourceRoleAssignmentRepository extends JpaRepository<ResourceRoleAssignment, Long> {

    Optional<ResourceRoleAssignment> findByResourceIdAndRoleId(Long resourceId, Long roleId);

    boolean existsByResourceIdAndRoleId(Long resourceId, Long roleId);

    @Query("""
        SELECT a FROM ResourceRoleAssignment a JOIN FETCH a.role
        WHERE a.resource.id = :resourceId
        ORDER BY a.priority ASC, a.id ASC
        """)
    List<ResourceRoleAssignment> findAllByResourceId(@Param("resourceId") Long resourceId);

    @Query("""
        SELECT a FROM ResourceRoleAssignment a JOIN FETCH a.resource r
        WHERE a.role.id = :roleId
        ORDER BY a.priority ASC, r.id ASC
        """)
    List<ResourceRoleAssignment> findAllByRoleId(@Param("roleId") Long roleId);

    @Query("""
        SELECT a FROM ResourceRoleAssignment a JOIN FETCH a.resource r
        WHERE a.role.id = :roleId AND r.tenantId = :tenantId
        ORDER BY a.priority ASC, r.id ASC
        """)
    List<ResourceRoleAssignment> findAllByRoleIdAndTenantId(@Param("roleId") Long roleId,
                                                             @Param("tenantId") String tenantId);

    /**
     * Active resources of a tenant able to fill any of the roles, as ids only so the
     * booking engine can lock them before any resource entity is loaded.
     */
    @Query("""
        SELECT DISTINCT a.resource.id FROM ResourceRoleAssignment a
        WHERE a.role.id IN :roleIds AND a.resource.tenantId = :tenantId AND a.resource.active = true
        """)
    List<Long> findActiveResourceIdsByRoleIds(@Param("roleIds") Collection<Long> roleIds,
                                              @Param("tenantId") String tenantId);

    @Query("""
        SELECT a FROM ResourceRoleAssignment a JOIN FETCH a.resource r
        WHERE a.role.id IN :roleIds AND r.id IN :resourceIds
        ORDER BY a.priority ASC, r.id ASC
        """)
    List<ResourceRoleAssignment> findAllByRoleIdInAndResourceIdIn(@Param("roleIds") Collection<Long> roleIds,
                                                                   @Param("resourceIds") Collection<Long> resourceIds);
}
