package com.clinic.scheduling.mapper;

import com.clinic.scheduling.dto.response.ResourceResponse;
import com.clinic.scheduling.dto.response.ResourceSubtypeResponse;
import com.clinic.scheduling.dto.response.ResourceTypeResponse;
import com.clinic.scheduling.dto.response.RoleAssignmentResponse;
import com.clinic.scheduling.dto.response.RoleResponse;
import com.clinic.scheduling.entity.Resource;
import com.clinic.scheduling.entity.ResourceRole;
import com.clinic.scheduling.entity.ResourceRoleAssignment;
import com.clinic.scheduling.entity.ResourceSubtype;
import com.clinic.scheduling.entity.ResourceType;

import java.util.List;
import java.util.Map;

public final class ResourceMapper {

    private ResourceMapper() {}

    public static ResourceTypeResponse toResponse(ResourceType type) {
        return new ResourceTypeResponse(
            type.getId(),
            type.getCode(),
            type.getName(),
            type.getDescription(),
            type.getSortOrder(),
            type.isActive()
        );
    }

    public static ResourceSubtypeResponse toResponse(ResourceSubtype subtype) {
        return new ResourceSubtypeResponse(
            subtype.getId(),
            subtype.getResourceType().getId(),
            subtype.getResourceType().getCode(),
            subtype.getCode(),
            subtype.getName(),
            subtype.getDescription(),
            subtype.getMetadataSchema() == null ? List.of() : List.copyOf(subtype.getMetadataSchema()),
            subtype.isActive()
        );
    }

    public static RoleResponse toResponse(ResourceRole role) {
        return new RoleResponse(
            role.getId(),
            role.getCode(),
            role.getName(),
            role.getDescription(),
            role.getResourceType().getId(),
            role.getResourceType().getCode(),
            role.isActive()
        );
    }

    public static ResourceResponse toResponse(Resource resource) {
        return new ResourceResponse(
            resource.getId(),
            resource.getTenantId(),
            resource.getSubtype().getId(),
            resource.getSubtype().getCode(),
            resource.getResourceType().getCode(),
            resource.getName(),
            resource.getDescription(),
            resource.getDefaultReservationMode(),
            resource.getMaxConcurrentBookings(),
            resource.getParentResourceId(),
            resource.isConsumable(),
            resource.getQuantityOnHand(),
            resource.getQuantityThreshold(),
            resource.isLowStock(),
            resource.getStaffUserId(),
            resource.getMetadata() == null ? Map.of() : resource.getMetadata(),
            resource.isActive(),
            resource.getCreatedAt(),
            resource.getUpdatedAt()
        );
    }

    public static RoleAssignmentResponse toResponse(ResourceRoleAssignment assignment) {
        return new RoleAssignmentResponse(
            assignment.getId(),
            assignment.getResource().getId(),
            assignment.getResource().getName(),
            assignment.getRole().getId(),
            assignment.getRole().getCode(),
            assignment.getPriority()
        );
    }
}
