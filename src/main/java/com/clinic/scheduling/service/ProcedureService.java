package com.clinic.scheduling.service;

import com.clinic.scheduling.dto.request.CreateProcedureRequest;
import com.clinic.scheduling.dto.request.ProcedureChildRequest;
import com.clinic.scheduling.dto.request.ReorderChildrenRequest;
import com.clinic.scheduling.dto.request.RequirementRequest;
import com.clinic.scheduling.dto.request.UpdateProcedureRequest;
import com.clinic.scheduling.dto.response.ProcedureResponse;
import com.clinic.scheduling.dto.response.RequirementResponse;
import com.clinic.scheduling.entity.Procedure;
import com.clinic.scheduling.entity.ProcedureComposition;
import com.clinic.scheduling.entity.ProcedureRequirement;
import com.clinic.scheduling.entity.ProcedureType;
import com.clinic.scheduling.entity.ResourceRole;
import com.clinic.scheduling.exception.InactiveResourceException;
import com.clinic.scheduling.exception.NotFoundException;
import com.clinic.scheduling.exception.ValidationException;
import com.clinic.scheduling.mapper.ProcedureMapper;
import com.clinic.scheduling.repository.ProcedureRepository;
import com.clinic.scheduling.repository.ResourceRoleRepository;
import com.clinic.scheduling.service.model.ExpandedRequirement;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class ProcedureService {

    private final ProcedureRepository procedureRepository;
    private final ResourceRoleRepository resourceRoleRepository;

    @Transactional
    public ProcedureResponse create(String tenantId, CreateProcedureRequest request) {
        if (procedureRepository.existsByTenantIdAndCode(tenantId, request.code())) {
            throw new ValidationException("Procedure code '" + request.code() + "' already exists");
        }
        Procedure procedure = new Procedure();
        procedure.setTenantId(tenantId);
        procedure.setCode(request.code());
        procedure.setName(request.name());
        procedure.setDescription(request.description());
        procedure.setProcedureType(request.procedureType());
        procedure.setBufferBeforeMinutes(orZero(request.bufferBeforeMinutes()));
        procedure.setBufferAfterMinutes(orZero(request.bufferAfterMinutes()));
        procedure.setColor(request.color());
        applyDuration(procedure, request.durationMinutes());

        List<ProcedureChildRequest> children = request.children() == null ? List.of() : request.children();
        if (!procedure.isComposite() && !children.isEmpty()) {
            throw new ValidationException("Only composite procedures have children");
        }
        Procedure saved = procedureRepository.save(procedure);
        for (ProcedureChildRequest child : children) {
            attachChild(tenantId, saved, child);
        }
        return toResponse(procedureRepository.save(saved));
    }

    @Transactional
    public ProcedureResponse update(String tenantId, Long id, UpdateProcedureRequest request) {
        Procedure procedure = findActive(tenantId, id);
        if (request.procedureType() != null && request.procedureType() != procedure.getProcedureType()) {
            throw new ValidationException("Procedure type cannot change from "
                + procedure.getProcedureType() + " to " + request.procedureType());
        }
        if (procedureRepository.existsByTenantIdAndCodeAndIdNot(tenantId, request.code(), id)) {
            throw new ValidationException("Procedure code '" + request.code() + "' already exists");
        }
        procedure.setCode(request.code());
        procedure.setName(request.name());
        procedure.setDescription(request.description());
        procedure.setBufferBeforeMinutes(orZero(request.bufferBeforeMinutes()));
        procedure.setBufferAfterMinutes(orZero(request.bufferAfterMinutes()));
        procedure.setColor(request.color());
        applyDuration(procedure, request.durationMinutes());
        for (ProcedureRequirement requirement : procedure.getRequirements()) {
            validateOffsets(procedure, requirement.getOffsetStartMinutes(), requirement.getOffsetEndMinutes());
        }
        return toResponse(procedureRepository.save(procedure));
    }

    @Transactional
    public ProcedureResponse deactivate(String tenantId, Long id) {
        Procedure procedure = find(tenantId, id);
        procedure.setActive(false);
        return toResponse(procedureRepository.save(procedure));
    }

    @Transactional(readOnly = true)
    public ProcedureResponse get(String tenantId, Long id) {
        return toResponse(find(tenantId, id));
    }

    @Transactional(readOnly = true)
    public Page<ProcedureResponse> list(String tenantId, ProcedureType type, Boolean active, Pageable pageable) {
        Specification<Procedure> spec = (root, query, cb) -> cb.equal(root.get("tenantId"), tenantId);

        if (type != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("procedureType"), type));
        }
        if (active != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("active"), active));
        }

        return procedureRepository.findAll(spec, pageable).map(this::toResponse);
    }

    @Transactional
    public ProcedureResponse addChild(String tenantId, Long parentId, ProcedureChildRequest request) {
        Procedure parent = findActive(tenantId, parentId);
        attachChild(tenantId, parent, request);
        return toResponse(procedureRepository.save(parent));
    }

    @Transactional
    public ProcedureResponse removeChild(String tenantId, Long parentId, Long compositionId) {
        Procedure parent = findActive(tenantId, parentId);
        ProcedureComposition composition = parent.getChildren().stream()
            .filter(c -> c.getId().equals(compositionId))
            .findFirst()
            .orElseThrow(() -> new NotFoundException("ProcedureComposition", compositionId));
        parent.getChildren().remove(composition);
        renumber(parent.getChildren());
        return toResponse(procedureRepository.save(parent));
    }

    @Transactional
    public ProcedureResponse reorderChildren(String tenantId, Long parentId, ReorderChildrenRequest request) {
        Procedure parent = findActive(tenantId, parentId);
        Map<Long, ProcedureComposition> byId = parent.getChildren().stream()
            .collect(Collectors.toMap(ProcedureComposition::getId, Function.identity()));
        Set<Long> requested = new LinkedHashSet<>(request.compositionIds());
        if (requested.size() != request.compositionIds().size() || !requested.equals(byId.keySet())) {
            throw new ValidationException("Reorder must list every child of procedure " + parentId + " exactly once");
        }
        List<ProcedureComposition> reordered = request.compositionIds().stream().map(byId::get).toList();
        renumber(reordered);
        parent.getChildren().sort((a, b) -> Integer.compare(a.getSequenceOrder(), b.getSequenceOrder()));
        return toResponse(procedureRepository.save(parent));
    }

    @Transactional
    public RequirementResponse addRequirement(String tenantId, Long procedureId, RequirementRequest request) {
        Procedure procedure = findActive(tenantId, procedureId);
        if (procedure.isComposite()) {
            throw new ValidationException("Requirements can only be attached to atomic procedures");
        }
        ProcedureRequirement requirement = new ProcedureRequirement();
        requirement.setProcedure(procedure);
        applyRequirement(procedure, requirement, request);
        procedure.getRequirements().add(requirement);
        procedureRepository.saveAndFlush(procedure);
        return ProcedureMapper.toResponse(requirement);
    }

    @Transactional
    public RequirementResponse updateRequirement(String tenantId, Long procedureId, Long requirementId,
                                                 RequirementRequest request) {
        Procedure procedure = findActive(tenantId, procedureId);
        ProcedureRequirement requirement = findRequirement(procedure, requirementId);
        applyRequirement(procedure, requirement, request);
        procedureRepository.save(procedure);
        return ProcedureMapper.toResponse(requirement);
    }

    @Transactional
    public void removeRequirement(String tenantId, Long procedureId, Long requirementId) {
        Procedure procedure = findActive(tenantId, procedureId);
        procedure.getRequirements().remove(findRequirement(procedure, requirementId));
        procedureRepository.save(procedure);
    }

    @Transactional(readOnly = true)
    public List<ExpandedRequirement> getExpandedRequirements(String tenantId, Long id) {
        return expandedRequirements(find(tenantId, id));
    }

    public int totalDurationMinutes(Procedure procedure) {
        return totalDuration(procedure, new HashSet<>());
    }

    /**
     * Flattens the procedure tree into requirements with offsets from the slot start.
     * Children are laid out in sequence order, each after the previous child's total
     * duration and gap.
     */
    public List<ExpandedRequirement> expandedRequirements(Procedure procedure) {
        List<ExpandedRequirement> result = new ArrayList<>();
        expand(procedure, 0, result, new HashSet<>());
        return result;
    }

    private int totalDuration(Procedure procedure, Set<Long> path) {
        enter(procedure, path);
        int total = orZero(procedure.getBufferBeforeMinutes()) + orZero(procedure.getBufferAfterMinutes());
        if (procedure.isComposite()) {
            for (ProcedureComposition composition : procedure.getChildren()) {
                total += totalDuration(composition.getChild(), path) + orZero(composition.getGapAfterMinutes());
            }
        } else {
            total += orZero(procedure.getDurationMinutes());
        }
        path.remove(procedure.getId());
        return total;
    }

    private void expand(Procedure procedure, int base, List<ExpandedRequirement> out, Set<Long> path) {
        enter(procedure, path);
        int activeStart = base + orZero(procedure.getBufferBeforeMinutes());
        if (procedure.isComposite()) {
            int cursor = activeStart;
            for (ProcedureComposition composition : procedure.getChildren()) {
                Procedure child = composition.getChild();
                expand(child, cursor, out, path);
                cursor += totalDuration(child, path) + orZero(composition.getGapAfterMinutes());
            }
        } else {
            int duration = orZero(procedure.getDurationMinutes());
            for (ProcedureRequirement requirement : procedure.getRequirements()) {
                int start = activeStart + orZero(requirement.getOffsetStartMinutes());
                int end = activeStart + (requirement.getOffsetEndMinutes() != null
                    ? requirement.getOffsetEndMinutes() : duration);
                out.add(new ExpandedRequirement(
                    procedure.getId(),
                    requirement.getId(),
                    requirement.getRole().getId(),
                    requirement.getQuantityMin(),
                    requirement.getQuantityMax(),
                    requirement.isRequired(),
                    start,
                    end));
            }
        }
        path.remove(procedure.getId());
    }

    private static void enter(Procedure procedure, Set<Long> path) {
        if (procedure.getId() != null && !path.add(procedure.getId())) {
            throw new ValidationException("Procedure " + procedure.getId() + " is part of a circular composition");
        }
    }

    private void attachChild(String tenantId, Procedure parent, ProcedureChildRequest request) {
        if (!parent.isComposite()) {
            throw new ValidationException("Only composite procedures have children");
        }
        Procedure child = procedureRepository.findByIdAndTenantId(request.childProcedureId(), tenantId)
            .orElseThrow(() -> new NotFoundException("Procedure", request.childProcedureId()));
        if (!child.isActive()) {
            throw new InactiveResourceException("Procedure", child.getId());
        }
        if (child.getId().equals(parent.getId()) || reaches(child, parent.getId(), new HashSet<>())) {
            throw new ValidationException("Adding procedure " + child.getId() + " to " + parent.getId()
                + " would create a circular composition");
        }

        ProcedureComposition composition = new ProcedureComposition();
        composition.setParent(parent);
        composition.setChild(child);
        composition.setGapAfterMinutes(orZero(request.gapAfterMinutes()));

        List<ProcedureComposition> children = parent.getChildren();
        int position = request.sequenceOrder() == null
            ? children.size()
            : Math.min(request.sequenceOrder(), children.size());
        children.add(position, composition);
        renumber(children);
    }

    private boolean reaches(Procedure from, Long targetId, Set<Long> visited) {
        if (from.getId().equals(targetId)) {
            return true;
        }
        if (!visited.add(from.getId())) {
            return false;
        }
        for (ProcedureComposition composition : from.getChildren()) {
            if (reaches(composition.getChild(), targetId, visited)) {
                return true;
            }
        }
        return false;
    }

    private static void renumber(List<ProcedureComposition> children) {
        for (int i = 0; i < children.size(); i++) {
            children.get(i).setSequenceOrder(i);
        }
    }

    private void applyRequirement(Procedure procedure, ProcedureRequirement requirement, RequirementRequest request) {
        ResourceRole role = resourceRoleRepository.findById(request.roleId())
            .orElseThrow(() -> new NotFoundException("ResourceRole", request.roleId()));
        if (!role.isActive()) {
            throw new InactiveResourceException("ResourceRole", role.getId());
        }
        int quantityMin = request.quantityMin() != null ? request.quantityMin() : 1;
        if (request.quantityMax() != null && quantityMin > request.quantityMax()) {
            throw new ValidationException("Quantity min " + quantityMin
                + " must not exceed quantity max " + request.quantityMax());
        }
        int offsetStart = orZero(request.offsetStartMinutes());
        validateOffsets(procedure, offsetStart, request.offsetEndMinutes());

        requirement.setRole(role);
        requirement.setQuantityMin(quantityMin);
        requirement.setQuantityMax(request.quantityMax());
        requirement.setRequired(request.required() == null || request.required());
        requirement.setOffsetStartMinutes(offsetStart);
        requirement.setOffsetEndMinutes(request.offsetEndMinutes());
        requirement.setNotes(request.notes());
    }

    private static void validateOffsets(Procedure procedure, Integer offsetStart, Integer offsetEnd) {
        int start = orZero(offsetStart);
        int duration = orZero(procedure.getDurationMinutes());
        if (start < 0 || (offsetEnd != null && offsetEnd < 0)) {
            throw new ValidationException("Requirement offsets must not be negative");
        }
        if (offsetEnd != null && start >= offsetEnd) {
            throw new ValidationException("Offset start " + start + " must be before offset end " + offsetEnd);
        }
        if (offsetEnd != null && offsetEnd > duration) {
            throw new ValidationException("Offset end " + offsetEnd + " exceeds the procedure duration of "
                + duration + " minutes");
        }
        if (start >= duration) {
            throw new ValidationException("Offset start " + start + " must be within the procedure duration of "
                + duration + " minutes");
        }
    }

    private static void applyDuration(Procedure procedure, Integer durationMinutes) {
        if (procedure.isComposite()) {
            if (durationMinutes != null) {
                throw new ValidationException("Composite procedures derive their duration from their children");
            }
            procedure.setDurationMinutes(null);
            return;
        }
        if (durationMinutes == null || durationMinutes <= 0) {
            throw new ValidationException("Atomic procedures require a positive duration");
        }
        procedure.setDurationMinutes(durationMinutes);
    }

    private ProcedureRequirement findRequirement(Procedure procedure, Long requirementId) {
        return procedure.getRequirements().stream()
            .filter(r -> r.getId().equals(requirementId))
            .findFirst()
            .orElseThrow(() -> new NotFoundException("ProcedureRequirement", requirementId));
    }

    private Procedure find(String tenantId, Long id) {
        return procedureRepository.findByIdAndTenantId(id, tenantId)
            .orElseThrow(() -> new NotFoundException("Procedure", id));
    }

    private Procedure findActive(String tenantId, Long id) {
        Procedure procedure = find(tenantId, id);
        if (!procedure.isActive()) {
            throw new InactiveResourceException("Procedure", id);
        }
        return procedure;
    }

    private ProcedureResponse toResponse(Procedure procedure) {
        return ProcedureMapper.toResponse(procedure, totalDurationMinutes(procedure));
    }

    private static int orZero(Integer value) {
        return value == null ? 0 : value;
    }
}
