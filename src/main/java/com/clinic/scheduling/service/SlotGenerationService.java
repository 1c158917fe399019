package com.clinic.scheduling.service;

import com.clinic.scheduling.config.SchedulingProperties;
import com.clinic.scheduling.dto.request.GenerateSlotsRequest;
import com.clinic.scheduling.dto.request.PreferenceRequest;
import com.clinic.scheduling.dto.response.SlotResponse;
import com.clinic.scheduling.entity.Procedure;
import com.clinic.scheduling.entity.ProcedureSlot;
import com.clinic.scheduling.entity.Resource;
import com.clinic.scheduling.entity.ResourceType;
import com.clinic.scheduling.entity.SlotGenerationType;
import com.clinic.scheduling.entity.SlotStatus;
import com.clinic.scheduling.exception.InactiveResourceException;
import com.clinic.scheduling.exception.NotFoundException;
import com.clinic.scheduling.exception.ValidationException;
import com.clinic.scheduling.mapper.SlotMapper;
import com.clinic.scheduling.repository.AppointmentResourceRepository;
import com.clinic.scheduling.repository.ProcedureRepository;
import com.clinic.scheduling.repository.ProcedureSlotRepository;
import com.clinic.scheduling.repository.ResourceRepository;
import com.clinic.scheduling.service.model.BookedInterval;
import com.clinic.scheduling.service.model.ExpandedRequirement;
import com.clinic.scheduling.service.model.GeneratedSlot;
import com.clinic.scheduling.service.model.PreferenceSpec;
import com.clinic.scheduling.service.model.RoleCandidate;
import com.clinic.scheduling.service.model.SelectionContext;
import com.clinic.scheduling.service.model.SelectionResult;
import com.clinic.scheduling.service.model.SlotValidationResult;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class SlotGenerationService {

    private static final Logger log = LoggerFactory.getLogger(SlotGenerationService.class);

    private final ProcedureRepository procedureRepository;
    private final ProcedureSlotRepository slotRepository;
    private final ResourceRepository resourceRepository;
    private final AppointmentResourceRepository appointmentResourceRepository;
    private final ProcedureService procedureService;
    private final ResourceCatalogService catalogService;
    private final AvailabilityService availabilityService;
    private final ResourceSelector resourceSelector;
    private final SchedulingProperties properties;

    @Transactional(readOnly = true)
    public List<GeneratedSlot> generateSlots(String tenantId, GenerateSlotsRequest request) {
        Procedure procedure = findActiveProcedure(tenantId, request.procedureId());
        int interval = request.intervalMinutes() != null ? request.intervalMinutes() : properties.slotIntervalMinutes();
        int maxSlots = request.maxSlots() != null ? request.maxSlots() : properties.maxSlots();
        return generate(tenantId, procedure, request.from(), request.to(), request.locationResourceId(),
            interval, maxSlots, toSpecs(request.preferences()));
    }

    @Transactional
    public List<SlotResponse> createSlots(String tenantId, GenerateSlotsRequest request) {
        Procedure procedure = findActiveProcedure(tenantId, request.procedureId());
        List<GeneratedSlot> candidates = generateSlots(tenantId, request);

        List<SlotResponse> created = new ArrayList<>();
        for (GeneratedSlot candidate : candidates) {
            if (slotRepository.existsByProcedureIdAndStartTimeAndStatusNot(
                    procedure.getId(), candidate.startTime(), SlotStatus.CANCELLED)) {
                continue;
            }
            ProcedureSlot slot = new ProcedureSlot();
            slot.setTenantId(tenantId);
            slot.setProcedure(procedure);
            slot.setStartTime(candidate.startTime());
            slot.setEndTime(candidate.endTime());
            slot.setStatus(SlotStatus.AVAILABLE);
            slot.setGenerationType(SlotGenerationType.MANUAL);
            created.add(SlotMapper.toResponse(slotRepository.save(slot)));
        }
        log.info("Created {} of {} candidate slots for procedure {} in tenant {}",
            created.size(), candidates.size(), procedure.getId(), tenantId);
        return created;
    }

    @Transactional(readOnly = true)
    public SlotResponse getSlot(String tenantId, Long id) {
        return SlotMapper.toResponse(findSlot(tenantId, id));
    }

    @Transactional(readOnly = true)
    public Page<SlotResponse> listSlots(String tenantId, Long procedureId, SlotStatus status,
                                        Instant from, Instant to, Pageable pageable) {
        Specification<ProcedureSlot> spec = Specification.where(
            (root, query, cb) -> cb.equal(root.get("tenantId"), tenantId));

        if (procedureId != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("procedure").get("id"), procedureId));
        }
        if (status != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("status"), status));
        }
        if (from != null) {
            spec = spec.and((root, query, cb) -> cb.greaterThanOrEqualTo(root.get("startTime"), from));
        }
        if (to != null) {
            spec = spec.and((root, query, cb) -> cb.lessThan(root.get("startTime"), to));
        }
        return slotRepository.findAll(spec, pageable).map(SlotMapper::toResponse);
    }

    @Transactional(readOnly = true)
    public SlotValidationResult validateSlot(String tenantId, Long slotId) {
        ProcedureSlot slot = findSlot(tenantId, slotId);
        Procedure procedure = slot.getProcedure();
        Instant now = Instant.now();
        List<String> issues = new ArrayList<>();

        if (slot.getStatus() != SlotStatus.AVAILABLE) {
            issues.add("Slot is " + slot.getStatus());
        }
        if (!procedure.isActive()) {
            issues.add("Procedure " + procedure.getId() + " is deactivated");
        }
        if (slot.getStartTime().isBefore(now)) {
            issues.add("Slot started in the past");
        }
        if (procedure.isActive()) {
            int total = procedureService.totalDurationMinutes(procedure);
            Instant end = slot.getStartTime().plus(Duration.ofMinutes(total));
            if (!end.equals(slot.getEndTime())) {
                issues.add("Slot length no longer matches the procedure duration of " + total + " minutes");
            }
            List<ExpandedRequirement> requirements = procedureService.expandedRequirements(procedure);
            SelectionContext context = loadContext(tenantId, requirements, List.of(), null,
                slot.getStartTime(), end);
            SelectionResult selection = resourceSelector.select(slot.getStartTime(), requirements, context);
            if (!selection.successful()) {
                issues.add(selection.failure().message());
            }
        }

        if (issues.isEmpty()) {
            return new SlotValidationResult(slotId, true, List.of(), List.of());
        }
        List<GeneratedSlot> alternatives = List.of();
        if (procedure.isActive()) {
            Instant from = alignUp(slot.getStartTime().isAfter(now) ? slot.getStartTime() : now,
                properties.slotIntervalMinutes());
            alternatives = generate(tenantId, procedure, from,
                from.plus(properties.validationHorizonDays(), ChronoUnit.DAYS), null,
                properties.slotIntervalMinutes(), properties.alternativesCount(), List.of());
        }
        return new SlotValidationResult(slotId, false, issues, alternatives);
    }

    @Transactional
    public int cleanupStaleSlots(String tenantId, Instant before) {
        if (before == null) {
            throw new ValidationException("Cleanup cut-off is required");
        }
        int deleted = slotRepository.deleteStale(tenantId, SlotGenerationType.AUTO, SlotStatus.AVAILABLE, before);
        log.info("Deleted {} stale auto slots ending before {} in tenant {}", deleted, before, tenantId);
        return deleted;
    }

    @Transactional(readOnly = true)
    public List<GeneratedSlot> findAlternatives(String tenantId, Long procedureId, Instant from,
                                                List<PreferenceSpec> preferences) {
        Procedure procedure = findActiveProcedure(tenantId, procedureId);
        Instant start = alignUp(from, properties.slotIntervalMinutes());
        return generate(tenantId, procedure, start, start.plus(properties.alternativesDays(), ChronoUnit.DAYS),
            null, properties.slotIntervalMinutes(), properties.alternativesCount(), preferences);
    }

    static List<PreferenceSpec> toSpecs(List<PreferenceRequest> preferences) {
        if (preferences == null) {
            return List.of();
        }
        return preferences.stream()
            .map(p -> new PreferenceSpec(p.roleId(), p.resourceId(), p.preferenceType(),
                p.priority() == null ? 0 : p.priority()))
            .toList();
    }

    private List<GeneratedSlot> generate(String tenantId, Procedure procedure, Instant from, Instant to,
                                         Long locationResourceId, int intervalMinutes, int maxSlots,
                                         List<PreferenceSpec> preferences) {
        if (from == null || to == null || !to.isAfter(from)) {
            throw new ValidationException("Generation window end must be after its start");
        }
        int total = procedureService.totalDurationMinutes(procedure);
        if (total <= 0) {
            throw new ValidationException("Procedure " + procedure.getId() + " has no duration");
        }
        List<ExpandedRequirement> requirements = procedureService.expandedRequirements(procedure);
        SelectionContext context = loadContext(tenantId, requirements, preferences, locationResourceId, from, to);

        Duration length = Duration.ofMinutes(total);
        Duration step = Duration.ofMinutes(intervalMinutes);
        List<GeneratedSlot> slots = new ArrayList<>();
        for (Instant start = from; !start.plus(length).isAfter(to) && slots.size() < maxSlots; start = start.plus(step)) {
            SelectionResult selection = resourceSelector.select(start, requirements, context);
            if (selection.successful()) {
                slots.add(new GeneratedSlot(start, start.plus(length), selection.assignments(), selection.score()));
            }
        }
        log.debug("Generated {} candidate slots for procedure {} between {} and {}",
            slots.size(), procedure.getId(), from, to);
        return slots;
    }

    private SelectionContext loadContext(String tenantId, List<ExpandedRequirement> requirements,
                                         List<PreferenceSpec> preferences, Long locationResourceId,
                                         Instant from, Instant to) {
        Set<Long> allowedPlaces = locationResourceId == null ? null : placesWithin(tenantId, locationResourceId);

        Map<Long, List<RoleCandidate>> candidatesByRole = new LinkedHashMap<>();
        Map<Long, Resource> resources = new LinkedHashMap<>();
        for (Long roleId : requirements.stream().map(ExpandedRequirement::roleId).collect(Collectors.toCollection(LinkedHashSet::new))) {
            List<RoleCandidate> candidates = catalogService.findRoleCandidates(roleId, tenantId, true).stream()
                .filter(c -> allowedPlaces == null
                    || !ResourceType.PLACE.equals(c.resource().getResourceType().getCode())
                    || allowedPlaces.contains(c.resourceId()))
                .toList();
            candidatesByRole.put(roleId, candidates);
            candidates.forEach(c -> resources.put(c.resourceId(), c.resource()));
        }

        Map<Long, List<BookedInterval>> bookings = appointmentResourceRepository
            .findLiveOverlapping(resources.keySet(), from, to).stream()
            .map(BookedInterval::of)
            .collect(Collectors.groupingBy(BookedInterval::resourceId));

        return new SelectionContext(candidatesByRole,
            availabilityService.buildTimelines(resources.values(), from, to), bookings, preferences);
    }

    /** The location itself plus every place nested below it. */
    private Set<Long> placesWithin(String tenantId, Long locationResourceId) {
        Resource location = resourceRepository.findByIdAndTenantId(locationResourceId, tenantId)
            .orElseThrow(() -> new NotFoundException("Resource", locationResourceId));
        if (!ResourceType.PLACE.equals(location.getResourceType().getCode())) {
            throw new ValidationException("Location " + locationResourceId + " must be of type 'place'");
        }
        Set<Long> ids = new LinkedHashSet<>();
        Collection<Long> frontier = List.of(locationResourceId);
        while (!frontier.isEmpty()) {
            List<Long> next = new ArrayList<>();
            for (Long id : frontier) {
                if (ids.add(id)) {
                    next.addAll(resourceRepository.findIdsByParentResourceId(id));
                }
            }
            frontier = next;
        }
        return ids;
    }

    private Procedure findActiveProcedure(String tenantId, Long procedureId) {
        Procedure procedure = procedureRepository.findByIdAndTenantId(procedureId, tenantId)
            .orElseThrow(() -> new NotFoundException("Procedure", procedureId));
        if (!procedure.isActive()) {
            throw new InactiveResourceException("Procedure", procedureId);
        }
        return procedure;
    }

    private ProcedureSlot findSlot(String tenantId, Long id) {
        return slotRepository.findByIdAndTenantId(id, tenantId)
            .orElseThrow(() -> new NotFoundException("ProcedureSlot", id));
    }

    static Instant alignUp(Instant instant, int intervalMinutes) {
        long step = intervalMinutes * 60L;
        long seconds = instant.getEpochSecond();
        long aligned = Math.floorDiv(seconds, step) * step;
        if (aligned < seconds || instant.getNano() > 0) {
            aligned += step;
        }
        return Instant.ofEpochSecond(aligned);
    }
}
