package com.clinic.scheduling.service;

import com.clinic.scheduling.dto.request.CreateAppointmentRequest;
import com.clinic.scheduling.dto.request.ReassignResourceRequest;
import com.clinic.scheduling.dto.request.RescheduleAppointmentRequest;
import com.clinic.scheduling.dto.response.AppointmentResponse;
import com.clinic.scheduling.entity.Appointment;
import com.clinic.scheduling.entity.AppointmentPreference;
import com.clinic.scheduling.entity.AppointmentResource;
import com.clinic.scheduling.entity.AppointmentResourceStatus;
import com.clinic.scheduling.entity.AppointmentStatus;
import com.clinic.scheduling.entity.Procedure;
import com.clinic.scheduling.entity.ProcedureSlot;
import com.clinic.scheduling.entity.Resource;
import com.clinic.scheduling.entity.ResourceRoleAssignment;
import com.clinic.scheduling.entity.SlotGenerationType;
import com.clinic.scheduling.entity.SlotStatus;
import com.clinic.scheduling.event.AppointmentCancelledEvent;
import com.clinic.scheduling.event.AppointmentCompletedEvent;
import com.clinic.scheduling.event.AppointmentCreatedEvent;
import com.clinic.scheduling.event.AppointmentStatusChangedEvent;
import com.clinic.scheduling.event.InventoryAdjustedEvent;
import com.clinic.scheduling.exception.ConflictException;
import com.clinic.scheduling.exception.InactiveResourceException;
import com.clinic.scheduling.exception.InsufficientInventoryException;
import com.clinic.scheduling.exception.InvalidAppointmentStateException;
import com.clinic.scheduling.exception.NotFoundException;
import com.clinic.scheduling.exception.ValidationException;
import com.clinic.scheduling.mapper.AppointmentMapper;
import com.clinic.scheduling.repository.AppointmentRepository;
import com.clinic.scheduling.repository.AppointmentResourceRepository;
import com.clinic.scheduling.repository.ProcedureRepository;
import com.clinic.scheduling.repository.ProcedureSlotRepository;
import com.clinic.scheduling.repository.ResourceRepository;
import com.clinic.scheduling.repository.ResourceRoleAssignmentRepository;
import com.clinic.scheduling.repository.ResourceRoleRepository;
import com.clinic.scheduling.service.model.AvailabilityTimeline;
import com.clinic.scheduling.service.model.BookedInterval;
import com.clinic.scheduling.service.model.CoverageReport;
import com.clinic.scheduling.service.model.ExpandedRequirement;
import com.clinic.scheduling.service.model.PreferenceSpec;
import com.clinic.scheduling.service.model.ResourceAssignment;
import com.clinic.scheduling.service.model.ResourceAvailabilityCheck;
import com.clinic.scheduling.service.model.RoleCandidate;
import com.clinic.scheduling.service.model.SelectionContext;
import com.clinic.scheduling.service.model.SelectionResult;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Booking runs in one transaction: the slot row (when booking an existing slot) and
 * then every candidate resource row are locked with {@code SELECT ... FOR UPDATE}, in id
 * order, before any reservation is read. Resource ids are fetched as scalars first so no
 * resource entity is loaded ahead of its lock. Conflict and capacity checks therefore
 * always see the reservations committed by concurrent bookings.
 */
@Service
@RequiredArgsConstructor
public class AppointmentService {

    private static final Logger log = LoggerFactory.getLogger(AppointmentService.class);

    static final String RESCHEDULE_REASON = "Rescheduled";

    private final AppointmentRepository appointmentRepository;
    private final AppointmentResourceRepository appointmentResourceRepository;
    private final ProcedureRepository procedureRepository;
    private final ProcedureSlotRepository slotRepository;
    private final ResourceRepository resourceRepository;
    private final ResourceRoleRepository resourceRoleRepository;
    private final ResourceRoleAssignmentRepository assignmentRepository;
    private final ProcedureService procedureService;
    private final ResourceCatalogService catalogService;
    private final AvailabilityService availabilityService;
    private final CapacityEvaluator capacityEvaluator;
    private final ResourceSelector resourceSelector;
    private final ApplicationEventPublisher eventPublisher;

    @Transactional
    public AppointmentResponse create(String tenantId, CreateAppointmentRequest request) {
        Appointment appointment = book(tenantId, request.procedureId(), request.slotId(), request.startTime(),
            request.contactId(), SlotGenerationService.toSpecs(request.preferences()),
            request.notes(), request.createdBy());
        return AppointmentMapper.toResponse(appointment);
    }

    @Transactional
    public AppointmentResponse confirm(String tenantId, Long id) {
        return AppointmentMapper.toResponse(transition(tenantId, id, AppointmentStatus.CONFIRMED));
    }

    @Transactional
    public AppointmentResponse checkIn(String tenantId, Long id) {
        return AppointmentMapper.toResponse(transition(tenantId, id, AppointmentStatus.CHECKED_IN));
    }

    @Transactional
    public AppointmentResponse start(String tenantId, Long id) {
        return AppointmentMapper.toResponse(transition(tenantId, id, AppointmentStatus.IN_PROGRESS));
    }

    @Transactional
    public AppointmentResponse complete(String tenantId, Long id) {
        Appointment appointment = transition(tenantId, id, AppointmentStatus.COMPLETED);
        Instant now = Instant.now();
        appointment.setCompletedAt(now);
        appointment.getSlot().setCompletedAt(now);
        eventPublisher.publishEvent(new AppointmentCompletedEvent(tenantId, appointment.getId(),
            appointment.getSlot().getId(), appointment.getContactId(), now));
        return AppointmentMapper.toResponse(appointmentRepository.save(appointment));
    }

    @Transactional
    public AppointmentResponse cancel(String tenantId, Long id, String reason) {
        return AppointmentMapper.toResponse(cancelInternal(tenantId, id, reason));
    }

    @Transactional
    public AppointmentResponse noShow(String tenantId, Long id) {
        return AppointmentMapper.toResponse(transition(tenantId, id, AppointmentStatus.NO_SHOW));
    }

    @Transactional
    public AppointmentResponse reschedule(String tenantId, Long id, RescheduleAppointmentRequest request) {
        requireOneTarget(request.slotId(), request.startTime());
        Appointment original = find(tenantId, id);
        List<PreferenceSpec> preferences = original.getPreferences().stream()
            .map(p -> new PreferenceSpec(p.getRole().getId(), p.getResource().getId(),
                p.getPreferenceType(), p.getPriority()))
            .toList();
        Long procedureId = original.getSlot().getProcedure().getId();

        cancelInternal(tenantId, id, RESCHEDULE_REASON);
        appointmentRepository.flush();

        Appointment rebooked = book(tenantId, procedureId, request.slotId(), request.startTime(),
            original.getContactId(), preferences, original.getNotes(), original.getCreatedBy());
        log.info("Appointment {} rescheduled as {}", id, rebooked.getId());
        return AppointmentMapper.toResponse(rebooked);
    }

    @Transactional
    public AppointmentResponse reassignResource(String tenantId, Long id, ReassignResourceRequest request) {
        Appointment appointment = find(tenantId, id);
        if (appointment.getStatus().isTerminal()) {
            throw new ConflictException("Appointment " + id + " is " + appointment.getStatus()
                + " and its resources cannot change");
        }
        AppointmentResource oldRow = appointment.getResources().stream()
            .filter(row -> row.getStatus().isLive() && row.getResource().getId().equals(request.oldResourceId()))
            .findFirst()
            .orElseThrow(() -> new ValidationException("Resource " + request.oldResourceId()
                + " holds no live reservation on appointment " + id));
        Long roleId = oldRow.getRole().getId();

        Map<Long, Resource> locked = lockResources(List.of(request.oldResourceId(), request.newResourceId()));
        Resource newResource = locked.get(request.newResourceId());
        if (newResource == null || !tenantId.equals(newResource.getTenantId())) {
            throw new NotFoundException("Resource", request.newResourceId());
        }
        if (!newResource.isActive()) {
            throw new InactiveResourceException("Resource", newResource.getId());
        }
        if (!assignmentRepository.existsByResourceIdAndRoleId(newResource.getId(), roleId)) {
            throw new ValidationException("Resource " + newResource.getId() + " does not hold role " + roleId);
        }

        Instant start = oldRow.getReservedStart();
        Instant end = oldRow.getReservedEnd();
        AvailabilityTimeline timeline = availabilityService.buildTimelines(List.of(newResource), start, end)
            .get(newResource.getId());
        List<BookedInterval> bookings = appointmentResourceRepository
            .findLiveOverlapping(List.of(newResource.getId()), start, end).stream()
            .map(BookedInterval::of)
            .toList();
        ResourceAvailabilityCheck check = capacityEvaluator.evaluate(timeline, start, end, bookings);
        if (!check.available()) {
            throw new ConflictException("Resource " + newResource.getId() + " cannot take over: " + check.reason(),
                check.conflicts());
        }

        Integer quantity = oldRow.getQuantityConsumed();
        if (quantity != null) {
            Resource oldResource = locked.get(request.oldResourceId());
            if (!newResource.isConsumable()) {
                throw new ValidationException("Resource " + newResource.getId() + " is not a consumable");
            }
            consume(newResource, quantity, "Reassigned to appointment " + id);
            restock(oldResource, quantity, "Released from appointment " + id);
        }

        oldRow.setStatus(AppointmentResourceStatus.RELEASED);
        AppointmentResource newRow = new AppointmentResource();
        newRow.setResource(newResource);
        newRow.setRole(oldRow.getRole());
        newRow.setReservedStart(start);
        newRow.setReservedEnd(end);
        newRow.setReservationMode(check.mode());
        newRow.setQuantityConsumed(quantity);
        appointment.addResource(newRow);

        log.info("Appointment {} role {} reassigned from resource {} to {}",
            id, roleId, request.oldResourceId(), newResource.getId());
        return AppointmentMapper.toResponse(appointmentRepository.save(appointment));
    }

    @Transactional(readOnly = true)
    public CoverageReport checkCoverage(String tenantId, Long resourceId, Instant from, Instant to) {
        if (from == null || to == null || !to.isAfter(from)) {
            throw new ValidationException("Window end must be after its start");
        }
        resourceRepository.findByIdAndTenantId(resourceId, tenantId)
            .orElseThrow(() -> new NotFoundException("Resource", resourceId));

        List<CoverageReport.AffectedAppointment> affected = new ArrayList<>();
        for (AppointmentResource row : appointmentResourceRepository.findLiveOverlapping(List.of(resourceId), from, to)) {
            Long roleId = row.getRole().getId();
            List<Long> alternatives = catalogService.findRoleCandidates(roleId, tenantId, true).stream()
                .map(RoleCandidate::resourceId)
                .filter(candidateId -> !candidateId.equals(resourceId))
                .filter(candidateId -> availabilityService.checkResource(tenantId, candidateId,
                    row.getReservedStart(), row.getReservedEnd()).available())
                .toList();
            affected.add(new CoverageReport.AffectedAppointment(row.getAppointment().getId(), roleId,
                row.getReservedStart(), row.getReservedEnd(), alternatives));
        }
        return new CoverageReport(resourceId, from, to, affected);
    }

    @Transactional(readOnly = true)
    public AppointmentResponse get(String tenantId, Long id) {
        return AppointmentMapper.toResponse(find(tenantId, id));
    }

    @Transactional(readOnly = true)
    public Page<AppointmentResponse> list(String tenantId, AppointmentStatus status, String contactId,
                                          Instant from, Instant to, Pageable pageable) {
        Specification<Appointment> spec = Specification.where(
            (root, query, cb) -> cb.equal(root.get("tenantId"), tenantId));

        if (status != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("status"), status));
        }
        if (contactId != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("contactId"), contactId));
        }
        if (from != null) {
            spec = spec.and((root, query, cb) -> cb.greaterThanOrEqualTo(root.get("slot").get("startTime"), from));
        }
        if (to != null) {
            spec = spec.and((root, query, cb) -> cb.lessThan(root.get("slot").get("startTime"), to));
        }
        return appointmentRepository.findAll(spec, pageable).map(AppointmentMapper::toResponse);
    }

    private Appointment book(String tenantId, Long procedureId, Long slotId, Instant startTime, String contactId,
                             List<PreferenceSpec> preferences, String notes, String createdBy) {
        requireOneTarget(slotId, startTime);
        Procedure procedure = procedureRepository.findByIdAndTenantId(procedureId, tenantId)
            .orElseThrow(() -> new NotFoundException("Procedure", procedureId));
        if (!procedure.isActive()) {
            throw new InactiveResourceException("Procedure", procedureId);
        }
        int total = procedureService.totalDurationMinutes(procedure);
        if (total <= 0) {
            throw new ValidationException("Procedure " + procedureId + " has no duration");
        }
        List<ExpandedRequirement> requirements = procedureService.expandedRequirements(procedure);

        ProcedureSlot slot;
        if (slotId != null) {
            slot = slotRepository.findByIdAndTenantIdForUpdate(slotId, tenantId)
                .orElseThrow(() -> new NotFoundException("ProcedureSlot", slotId));
            if (!slot.getProcedure().getId().equals(procedureId)) {
                throw new ValidationException("Slot " + slotId + " belongs to procedure " + slot.getProcedure().getId());
            }
            if (slot.getStatus() != SlotStatus.AVAILABLE) {
                throw new ConflictException("Slot " + slotId + " is " + slot.getStatus());
            }
        } else {
            slot = new ProcedureSlot();
            slot.setTenantId(tenantId);
            slot.setProcedure(procedure);
            slot.setStartTime(startTime);
            slot.setEndTime(startTime.plus(Duration.ofMinutes(total)));
            slot.setGenerationType(SlotGenerationType.AUTO);
        }
        Instant start = slot.getStartTime();
        Instant end = slot.getEndTime();

        Set<Long> roleIds = requirements.stream()
            .map(ExpandedRequirement::roleId)
            .collect(Collectors.toCollection(LinkedHashSet::new));
        List<Long> resourceIds = roleIds.isEmpty()
            ? List.of()
            : assignmentRepository.findActiveResourceIdsByRoleIds(roleIds, tenantId);
        Map<Long, Resource> locked = lockResources(resourceIds);

        List<AppointmentPreference> preferenceRows = preferenceRows(tenantId, preferences);
        SelectionContext context = lockedContext(roleIds, locked, preferences, start, end);
        SelectionResult selection = resourceSelector.select(start, requirements, context);
        if (!selection.successful()) {
            SelectionResult.StockShortfall shortfall = selection.failure().shortfall();
            if (shortfall != null) {
                throw new InsufficientInventoryException(shortfall.resourceId(), shortfall.onHand(), shortfall.requested());
            }
            throw new ConflictException(selection.failure().message(), selection.failure().conflicts());
        }

        slot.setStatus(SlotStatus.BOOKED);
        slot = slotRepository.save(slot);

        Appointment appointment = new Appointment();
        appointment.setTenantId(tenantId);
        appointment.setSlot(slot);
        appointment.setContactId(contactId);
        appointment.setStatus(AppointmentStatus.SCHEDULED);
        appointment.setNotes(notes);
        appointment.setCreatedBy(createdBy);

        for (ResourceAssignment assignment : selection.assignments()) {
            Resource resource = locked.get(assignment.resourceId());
            AppointmentResource row = new AppointmentResource();
            row.setResource(resource);
            row.setRole(resourceRoleRepository.getReferenceById(assignment.roleId()));
            row.setReservedStart(assignment.reservedStart());
            row.setReservedEnd(assignment.reservedEnd());
            row.setReservationMode(assignment.mode());
            row.setQuantityConsumed(assignment.quantity());
            appointment.addResource(row);
        }
        preferenceRows.forEach(appointment::addPreference);
        Appointment saved = appointmentRepository.saveAndFlush(appointment);

        for (ResourceAssignment assignment : selection.assignments()) {
            if (assignment.quantity() != null) {
                consume(locked.get(assignment.resourceId()), assignment.quantity(),
                    "Consumed by appointment " + saved.getId());
            }
        }

        List<Long> bookedResourceIds = selection.assignments().stream()
            .map(ResourceAssignment::resourceId)
            .distinct()
            .toList();
        eventPublisher.publishEvent(new AppointmentCreatedEvent(tenantId, saved.getId(), slot.getId(),
            procedureId, contactId, start, end, bookedResourceIds));
        log.info("Booked appointment {} in slot {} with resources {}", saved.getId(), slot.getId(), bookedResourceIds);
        return saved;
    }

    private SelectionContext lockedContext(Set<Long> roleIds, Map<Long, Resource> locked,
                                           List<PreferenceSpec> preferences, Instant start, Instant end) {
        Map<Long, List<RoleCandidate>> candidatesByRole = new LinkedHashMap<>();
        roleIds.forEach(roleId -> candidatesByRole.put(roleId, new ArrayList<>()));
        if (!locked.isEmpty()) {
            for (ResourceRoleAssignment assignment
                    : assignmentRepository.findAllByRoleIdInAndResourceIdIn(roleIds, locked.keySet())) {
                Resource resource = locked.get(assignment.getResource().getId());
                if (resource.isActive()) {
                    candidatesByRole.get(assignment.getRole().getId())
                        .add(new RoleCandidate(resource, assignment.getPriority()));
                }
            }
        }
        Map<Long, List<BookedInterval>> bookings = appointmentResourceRepository
            .findLiveOverlapping(locked.keySet(), start, end).stream()
            .map(BookedInterval::of)
            .collect(Collectors.groupingBy(BookedInterval::resourceId));
        return new SelectionContext(candidatesByRole,
            availabilityService.buildTimelines(locked.values(), start, end), bookings, preferences);
    }

    /** Locks the given resource rows in id order; the result is keyed by id in that order. */
    private Map<Long, Resource> lockResources(List<Long> ids) {
        if (ids.isEmpty()) {
            return Map.of();
        }
        return resourceRepository.findAllByIdInForUpdate(new TreeSet<>(ids)).stream()
            .collect(Collectors.toMap(Resource::getId, Function.identity(), (a, b) -> a, LinkedHashMap::new));
    }

    private List<AppointmentPreference> preferenceRows(String tenantId, List<PreferenceSpec> preferences) {
        List<AppointmentPreference> rows = new ArrayList<>();
        for (PreferenceSpec spec : preferences) {
            Resource resource = resourceRepository.findByIdAndTenantId(spec.resourceId(), tenantId)
                .orElseThrow(() -> new NotFoundException("Resource", spec.resourceId()));
            if (!resourceRoleRepository.existsById(spec.roleId())) {
                throw new NotFoundException("ResourceRole", spec.roleId());
            }
            AppointmentPreference row = new AppointmentPreference();
            row.setRole(resourceRoleRepository.getReferenceById(spec.roleId()));
            row.setResource(resource);
            row.setPreferenceType(spec.type());
            row.setPriority(spec.priority());
            rows.add(row);
        }
        return rows;
    }

    private Appointment cancelInternal(String tenantId, Long id, String reason) {
        Appointment appointment = transition(tenantId, id, AppointmentStatus.CANCELLED);
        Instant now = Instant.now();
        appointment.setCancelledAt(now);
        appointment.setCancellationReason(reason);
        appointment.getSlot().setStatus(SlotStatus.AVAILABLE);

        List<AppointmentResource> consumed = appointment.getResources().stream()
            .filter(row -> row.getStatus().isLive() && row.getQuantityConsumed() != null)
            .toList();
        if (!consumed.isEmpty()) {
            Map<Long, Resource> locked = lockResources(consumed.stream().map(row -> row.getResource().getId()).toList());
            for (AppointmentResource row : consumed) {
                restock(locked.get(row.getResource().getId()), row.getQuantityConsumed(),
                    "Appointment " + id + " cancelled");
            }
        }

        eventPublisher.publishEvent(new AppointmentCancelledEvent(tenantId, id, appointment.getSlot().getId(),
            appointment.getContactId(), reason, now));
        return appointmentRepository.save(appointment);
    }

    private Appointment transition(String tenantId, Long id, AppointmentStatus target) {
        Appointment appointment = find(tenantId, id);
        AppointmentStatus current = appointment.getStatus();
        if (!current.canTransitionTo(target)) {
            throw new InvalidAppointmentStateException(id, current, target);
        }
        appointment.setStatus(target);
        eventPublisher.publishEvent(new AppointmentStatusChangedEvent(tenantId, id, current, target));
        return appointment;
    }

    private void consume(Resource resource, int quantity, String reason) {
        int before = resource.getQuantityOnHand() == null ? 0 : resource.getQuantityOnHand();
        boolean crossed = resource.consume(quantity);
        eventPublisher.publishEvent(new InventoryAdjustedEvent(resource.getTenantId(), resource.getId(),
            -quantity, before, resource.getQuantityOnHand(), reason));
        if (crossed) {
            eventPublisher.publishEvent(ResourceCatalogService.lowStockEvent(resource));
        }
    }

    private void restock(Resource resource, int quantity, String reason) {
        int before = resource.getQuantityOnHand() == null ? 0 : resource.getQuantityOnHand();
        resource.restock(quantity);
        eventPublisher.publishEvent(new InventoryAdjustedEvent(resource.getTenantId(), resource.getId(),
            quantity, before, resource.getQuantityOnHand(), reason));
    }

    private Appointment find(String tenantId, Long id) {
        return appointmentRepository.findByIdAndTenantId(id, tenantId)
            .orElseThrow(() -> new NotFoundException("Appointment", id));
    }

    private static void requireOneTarget(Long slotId, Instant startTime) {
        if ((slotId == null) == (startTime == null)) {
            throw new ValidationException("Exactly one of slotId and startTime must be given");
        }
    }
}
