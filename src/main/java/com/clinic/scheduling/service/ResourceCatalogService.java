package com.clinic.scheduling.service;

import com.clinic.scheduling.dto.request.AdjustInventoryRequest;
import com.clinic.scheduling.dto.request.AssignRoleRequest;
import com.clinic.scheduling.dto.request.CreateResourceRequest;
import com.clinic.scheduling.dto.request.CreateResourceSubtypeRequest;
import com.clinic.scheduling.dto.request.CreateRoleRequest;
import com.clinic.scheduling.dto.request.UpdateResourceRequest;
import com.clinic.scheduling.dto.response.ResourceResponse;
import com.clinic.scheduling.dto.response.ResourceSubtypeResponse;
import com.clinic.scheduling.dto.response.ResourceTypeResponse;
import com.clinic.scheduling.dto.response.RoleAssignmentResponse;
import com.clinic.scheduling.dto.response.RoleResponse;
import com.clinic.scheduling.entity.MetadataField;
import com.clinic.scheduling.entity.ReservationMode;
import com.clinic.scheduling.entity.Resource;
import com.clinic.scheduling.entity.ResourceRole;
import com.clinic.scheduling.entity.ResourceRoleAssignment;
import com.clinic.scheduling.entity.ResourceSubtype;
import com.clinic.scheduling.entity.ResourceType;
import com.clinic.scheduling.event.InventoryAdjustedEvent;
import com.clinic.scheduling.event.LowStockEvent;
import com.clinic.scheduling.event.RoleAssignmentChangedEvent;
import com.clinic.scheduling.exception.InactiveResourceException;
import com.clinic.scheduling.exception.NotFoundException;
import com.clinic.scheduling.exception.ValidationException;
import com.clinic.scheduling.mapper.ResourceMapper;
import com.clinic.scheduling.repository.ResourceRepository;
import com.clinic.scheduling.repository.ResourceRoleAssignmentRepository;
import com.clinic.scheduling.repository.ResourceRoleRepository;
import com.clinic.scheduling.repository.ResourceSubtypeRepository;
import com.clinic.scheduling.repository.ResourceTypeRepository;
import com.clinic.scheduling.service.model.RoleCandidate;
import lombok.RequiredArgsConstructor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class ResourceCatalogService {

    private final ResourceTypeRepository resourceTypeRepository;
    private final ResourceSubtypeRepository resourceSubtypeRepository;
    private final ResourceRoleRepository resourceRoleRepository;
    private final ResourceRepository resourceRepository;
    private final ResourceRoleAssignmentRepository assignmentRepository;
    private final MetadataValidator metadataValidator;
    private final ApplicationEventPublisher eventPublisher;

    @Transactional(readOnly = true)
    public List<ResourceTypeResponse> listTypes() {
        return resourceTypeRepository.findAllByOrderBySortOrderAscIdAsc().stream()
            .map(ResourceMapper::toResponse)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<ResourceSubtypeResponse> listSubtypes(String typeCode) {
        List<ResourceSubtype> subtypes = typeCode == null
            ? resourceSubtypeRepository.findAllWithType()
            : resourceSubtypeRepository.findAllByTypeCode(typeCode);
        return subtypes.stream().map(ResourceMapper::toResponse).toList();
    }

    @Transactional
    public ResourceSubtypeResponse createSubtype(CreateResourceSubtypeRequest request) {
        ResourceType type = resourceTypeRepository.findById(request.resourceTypeId())
            .orElseThrow(() -> new NotFoundException("ResourceType", request.resourceTypeId()));
        if (resourceSubtypeRepository.existsByCode(request.code())) {
            throw new ValidationException("Resource subtype code '" + request.code() + "' already exists");
        }
        List<MetadataField> schema =
            request.metadataSchema() == null ? List.of() : request.metadataSchema();
        Set<String> names = new HashSet<>();
        for (MetadataField field : schema) {
            if (field.name() == null || field.name().isBlank() || field.type() == null) {
                throw new ValidationException("Metadata fields need a name and a type");
            }
            if (!names.add(field.name())) {
                throw new ValidationException("Metadata field '" + field.name() + "' is declared twice");
            }
        }

        ResourceSubtype subtype = new ResourceSubtype();
        subtype.setResourceType(type);
        subtype.setCode(request.code());
        subtype.setName(request.name());
        subtype.setDescription(request.description());
        subtype.setMetadataSchema(new ArrayList<>(schema));
        return ResourceMapper.toResponse(resourceSubtypeRepository.save(subtype));
    }

    @Transactional(readOnly = true)
    public List<RoleResponse> listRoles(String typeCode) {
        List<ResourceRole> roles = typeCode == null
            ? resourceRoleRepository.findAllWithType()
            : resourceRoleRepository.findAllByTypeCode(typeCode);
        return roles.stream().map(ResourceMapper::toResponse).toList();
    }

    @Transactional
    public RoleResponse createRole(CreateRoleRequest request) {
        ResourceType type = resourceTypeRepository.findById(request.resourceTypeId())
            .orElseThrow(() -> new NotFoundException("ResourceType", request.resourceTypeId()));
        if (resourceRoleRepository.existsByCode(request.code())) {
            throw new ValidationException("Role code '" + request.code() + "' already exists");
        }
        ResourceRole role = new ResourceRole();
        role.setCode(request.code());
        role.setName(request.name());
        role.setDescription(request.description());
        role.setResourceType(type);
        return ResourceMapper.toResponse(resourceRoleRepository.save(role));
    }

    @Transactional
    public ResourceResponse createResource(String tenantId, CreateResourceRequest request) {
        ResourceSubtype subtype = resourceSubtypeRepository.findById(request.subtypeId())
            .orElseThrow(() -> new NotFoundException("ResourceSubtype", request.subtypeId()));
        if (!subtype.isActive()) {
            throw new InactiveResourceException("ResourceSubtype", subtype.getId());
        }
        boolean consumable = ResourceType.CONSUMABLE.equals(subtype.getResourceType().getCode());
        if (!consumable && (request.quantityOnHand() != null || request.quantityThreshold() != null)) {
            throw new ValidationException("Only consumable resources carry stock quantities");
        }
        metadataValidator.validate(subtype.getMetadataSchema(), request.metadata());

        Resource resource = new Resource();
        resource.setTenantId(tenantId);
        resource.setSubtype(subtype);
        resource.setName(request.name());
        resource.setDescription(request.description());
        resource.setDefaultReservationMode(request.defaultReservationMode() != null
            ? request.defaultReservationMode() : ReservationMode.EXCLUSIVE);
        resource.setMaxConcurrentBookings(request.maxConcurrentBookings() != null
            ? request.maxConcurrentBookings() : 1);
        resource.setConsumable(consumable);
        if (consumable) {
            resource.setQuantityOnHand(request.quantityOnHand() != null ? request.quantityOnHand() : 0);
            resource.setQuantityThreshold(request.quantityThreshold());
        }
        resource.setStaffUserId(request.staffUserId());
        resource.setMetadata(request.metadata() == null ? new LinkedHashMap<>() : new LinkedHashMap<>(request.metadata()));
        if (request.parentResourceId() != null) {
            validateParent(tenantId, null, request.parentResourceId());
            resource.setParentResourceId(request.parentResourceId());
        }
        return ResourceMapper.toResponse(resourceRepository.save(resource));
    }

    @Transactional
    public ResourceResponse updateResource(String tenantId, Long id, UpdateResourceRequest request) {
        Resource resource = findActiveResource(tenantId, id);
        if (!resource.isConsumable() && request.quantityThreshold() != null) {
            throw new ValidationException("Only consumable resources carry stock quantities");
        }
        metadataValidator.validate(resource.getSubtype().getMetadataSchema(), request.metadata());
        if (request.parentResourceId() != null) {
            validateParent(tenantId, id, request.parentResourceId());
        }

        resource.setName(request.name());
        resource.setDescription(request.description());
        resource.setDefaultReservationMode(request.defaultReservationMode());
        resource.setMaxConcurrentBookings(request.maxConcurrentBookings());
        resource.setParentResourceId(request.parentResourceId());
        resource.setQuantityThreshold(request.quantityThreshold());
        resource.setStaffUserId(request.staffUserId());
        resource.setMetadata(request.metadata() == null ? new LinkedHashMap<>() : new LinkedHashMap<>(request.metadata()));
        return ResourceMapper.toResponse(resourceRepository.save(resource));
    }

    @Transactional
    public ResourceResponse deactivateResource(String tenantId, Long id) {
        Resource resource = findResource(tenantId, id);
        resource.setActive(false);
        return ResourceMapper.toResponse(resourceRepository.save(resource));
    }

    @Transactional(readOnly = true)
    public ResourceResponse getResource(String tenantId, Long id) {
        return ResourceMapper.toResponse(findResource(tenantId, id));
    }

    @Transactional(readOnly = true)
    public Page<ResourceResponse> listResources(String tenantId, String typeCode, Boolean active, Pageable pageable) {
        Specification<Resource> spec = (root, query, cb) -> cb.equal(root.get("tenantId"), tenantId);

        if (typeCode != null) {
            spec = spec.and((root, query, cb) ->
                cb.equal(root.get("subtype").get("resourceType").get("code"), typeCode));
        }
        if (active != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("active"), active));
        }

        return resourceRepository.findAll(spec, pageable).map(ResourceMapper::toResponse);
    }

    /**
     * Resources nested below {@code id}: its direct children, or with {@code recursive}
     * every descendant level by level. Each level is ordered by id.
     */
    @Transactional(readOnly = true)
    public List<ResourceResponse> listChildren(String tenantId, Long id, boolean recursive) {
        findResource(tenantId, id);

        List<Long> descendantIds = new ArrayList<>();
        Set<Long> visited = new HashSet<>(Set.of(id));
        List<Long> frontier = List.of(id);
        while (!frontier.isEmpty()) {
            List<Long> next = new ArrayList<>();
            for (Long parentId : frontier) {
                for (Long childId : resourceRepository.findIdsByParentResourceId(parentId)) {
                    if (visited.add(childId)) {
                        next.add(childId);
                    }
                }
            }
            next.sort(null);
            descendantIds.addAll(next);
            frontier = recursive ? next : List.of();
        }
        if (descendantIds.isEmpty()) {
            return List.of();
        }

        Map<Long, Resource> byId = resourceRepository.findAllByTenantIdAndIdIn(tenantId, descendantIds).stream()
            .collect(Collectors.toMap(Resource::getId, Function.identity()));
        return descendantIds.stream()
            .map(byId::get)
            .filter(Objects::nonNull)
            .map(ResourceMapper::toResponse)
            .toList();
    }

    @Transactional
    public RoleAssignmentResponse assignRole(String tenantId, Long resourceId, AssignRoleRequest request) {
        Resource resource = findActiveResource(tenantId, resourceId);
        ResourceRole role = resourceRoleRepository.findById(request.roleId())
            .orElseThrow(() -> new NotFoundException("ResourceRole", request.roleId()));
        if (!role.isActive()) {
            throw new InactiveResourceException("ResourceRole", role.getId());
        }
        if (!role.getResourceType().getId().equals(resource.getResourceType().getId())) {
            throw new ValidationException("Role '" + role.getCode() + "' is for resources of type '"
                + role.getResourceType().getCode() + "', resource " + resourceId + " is of type '"
                + resource.getResourceType().getCode() + "'");
        }
        int priority = request.priority() != null ? request.priority() : 0;

        ResourceRoleAssignment assignment = assignmentRepository
            .findByResourceIdAndRoleId(resourceId, role.getId())
            .orElse(null);
        RoleAssignmentChangedEvent.Change change = RoleAssignmentChangedEvent.Change.UPDATED;
        if (assignment == null) {
            assignment = new ResourceRoleAssignment();
            assignment.setResource(resource);
            assignment.setRole(role);
            change = RoleAssignmentChangedEvent.Change.ASSIGNED;
        }
        assignment.setPriority(priority);
        ResourceRoleAssignment saved = assignmentRepository.save(assignment);

        eventPublisher.publishEvent(new RoleAssignmentChangedEvent(tenantId, resourceId, role.getId(), change, priority));
        return ResourceMapper.toResponse(saved);
    }

    @Transactional
    public void unassignRole(String tenantId, Long resourceId, Long roleId) {
        findResource(tenantId, resourceId);
        ResourceRoleAssignment assignment = assignmentRepository.findByResourceIdAndRoleId(resourceId, roleId)
            .orElseThrow(() -> new NotFoundException("ResourceRoleAssignment", resourceId + "/" + roleId));
        assignmentRepository.delete(assignment);
        eventPublisher.publishEvent(new RoleAssignmentChangedEvent(
            tenantId, resourceId, roleId, RoleAssignmentChangedEvent.Change.UNASSIGNED, null));
    }

    @Transactional(readOnly = true)
    public List<RoleAssignmentResponse> listRoleAssignments(String tenantId, Long resourceId) {
        findResource(tenantId, resourceId);
        return assignmentRepository.findAllByResourceId(resourceId).stream()
            .map(ResourceMapper::toResponse)
            .toList();
    }

    @Transactional
    public ResourceResponse adjustInventory(String tenantId, Long resourceId, AdjustInventoryRequest request) {
        Resource resource = resourceRepository.findByIdAndTenantIdForUpdate(resourceId, tenantId)
            .orElseThrow(() -> new NotFoundException("Resource", resourceId));
        if (!resource.isActive()) {
            throw new InactiveResourceException("Resource", resourceId);
        }
        if (!resource.isConsumable()) {
            throw new ValidationException("Resource " + resourceId + " is not a consumable");
        }

        int before = resource.getQuantityOnHand() == null ? 0 : resource.getQuantityOnHand();
        boolean crossedThreshold = resource.adjustInventory(request.delta());
        Resource saved = resourceRepository.save(resource);

        eventPublisher.publishEvent(new InventoryAdjustedEvent(
            tenantId, resourceId, request.delta(), before, saved.getQuantityOnHand(), request.reason()));
        if (crossedThreshold) {
            eventPublisher.publishEvent(lowStockEvent(saved));
        }
        return ResourceMapper.toResponse(saved);
    }

    @Transactional(readOnly = true)
    public List<ResourceResponse> listResourcesForRole(Long roleId, String tenantId, boolean activeOnly) {
        return findRoleCandidates(roleId, tenantId, activeOnly).stream()
            .map(candidate -> ResourceMapper.toResponse(candidate.resource()))
            .toList();
    }

    /**
     * Resources filling a role, ordered by assignment priority then id. {@code tenantId}
     * may be {@code null} to search every tenant.
     */
    @Transactional(readOnly = true)
    public List<RoleCandidate> findRoleCandidates(Long roleId, String tenantId, boolean activeOnly) {
        if (!resourceRoleRepository.existsById(roleId)) {
            throw new NotFoundException("ResourceRole", roleId);
        }
        List<ResourceRoleAssignment> assignments = tenantId == null
            ? assignmentRepository.findAllByRoleId(roleId)
            : assignmentRepository.findAllByRoleIdAndTenantId(roleId, tenantId);
        return assignments.stream()
            .filter(assignment -> !activeOnly || assignment.getResource().isActive())
            .map(assignment -> new RoleCandidate(assignment.getResource(), assignment.getPriority()))
            .toList();
    }

    @Transactional(readOnly = true)
    public List<ResourceResponse> listLowStock(String tenantId) {
        return resourceRepository.findLowStock(tenantId).stream()
            .map(ResourceMapper::toResponse)
            .toList();
    }

    static LowStockEvent lowStockEvent(Resource resource) {
        return new LowStockEvent(resource.getTenantId(), resource.getId(), resource.getName(),
            resource.getQuantityOnHand(), resource.getQuantityThreshold());
    }

    private Resource findResource(String tenantId, Long id) {
        return resourceRepository.findByIdAndTenantId(id, tenantId)
            .orElseThrow(() -> new NotFoundException("Resource", id));
    }

    private Resource findActiveResource(String tenantId, Long id) {
        Resource resource = findResource(tenantId, id);
        if (!resource.isActive()) {
            throw new InactiveResourceException("Resource", id);
        }
        return resource;
    }

    /**
     * A parent must be a place of the same tenant, and walking up from it must never reach
     * the resource itself. Ancestors are resolved one id at a time.
     */
    private void validateParent(String tenantId, Long resourceId, Long parentId) {
        if (parentId.equals(resourceId)) {
            throw new ValidationException("Resource cannot be its own parent");
        }
        Resource parent = resourceRepository.findByIdAndTenantId(parentId, tenantId)
            .orElseThrow(() -> new NotFoundException("Resource", parentId));
        if (!ResourceType.PLACE.equals(parent.getResourceType().getCode())) {
            throw new ValidationException("Parent resource " + parentId + " must be of type 'place'");
        }
        if (resourceId == null) {
            return;
        }
        Set<Long> visited = new HashSet<>();
        Long current = parent.getParentResourceId();
        while (current != null && visited.add(current)) {
            if (current.equals(resourceId)) {
                throw new ValidationException("Parent " + parentId + " would create a cycle in the resource hierarchy");
            }
            current = resourceRepository.findParentIdById(current).orElse(null);
        }
    }
}
