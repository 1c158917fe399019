package com.clinic.scheduling.service;

import com.clinic.scheduling.dto.request.AvailabilityRequest;
import com.clinic.scheduling.dto.response.AvailabilityResponse;
import com.clinic.scheduling.entity.AvailabilityType;
import com.clinic.scheduling.entity.Resource;
import com.clinic.scheduling.entity.ResourceAvailability;
import com.clinic.scheduling.exception.InactiveResourceException;
import com.clinic.scheduling.exception.NotFoundException;
import com.clinic.scheduling.exception.ValidationException;
import com.clinic.scheduling.mapper.AvailabilityMapper;
import com.clinic.scheduling.recurrence.Occurrence;
import com.clinic.scheduling.recurrence.RecurrenceExpander;
import com.clinic.scheduling.repository.AppointmentResourceRepository;
import com.clinic.scheduling.repository.ResourceAvailabilityRepository;
import com.clinic.scheduling.repository.ResourceRepository;
import com.clinic.scheduling.service.model.AvailabilityTimeline;
import com.clinic.scheduling.service.model.AvailabilityWindow;
import com.clinic.scheduling.service.model.BookedInterval;
import com.clinic.scheduling.service.model.ResourceAvailabilityCheck;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class AvailabilityService {

    private final ResourceAvailabilityRepository availabilityRepository;
    private final ResourceRepository resourceRepository;
    private final AppointmentResourceRepository appointmentResourceRepository;
    private final RecurrenceExpander recurrenceExpander;
    private final CapacityEvaluator capacityEvaluator;

    @Transactional
    public AvailabilityResponse create(String tenantId, AvailabilityRequest request) {
        Resource resource = resourceRepository.findByIdAndTenantId(request.resourceId(), tenantId)
            .orElseThrow(() -> new NotFoundException("Resource", request.resourceId()));
        if (!resource.isActive()) {
            throw new InactiveResourceException("Resource", resource.getId());
        }
        validate(request);

        ResourceAvailability availability = new ResourceAvailability();
        availability.setResource(resource);
        apply(availability, request);
        return AvailabilityMapper.toResponse(availabilityRepository.save(availability));
    }

    @Transactional
    public AvailabilityResponse update(String tenantId, Long id, AvailabilityRequest request) {
        ResourceAvailability availability = find(tenantId, id);
        if (!availability.getResource().getId().equals(request.resourceId())) {
            throw new ValidationException("Availability " + id + " belongs to resource "
                + availability.getResource().getId() + " and cannot be moved");
        }
        validate(request);
        apply(availability, request);
        return AvailabilityMapper.toResponse(availabilityRepository.save(availability));
    }

    @Transactional
    public void delete(String tenantId, Long id) {
        availabilityRepository.delete(find(tenantId, id));
    }

    @Transactional(readOnly = true)
    public AvailabilityResponse get(String tenantId, Long id) {
        return AvailabilityMapper.toResponse(find(tenantId, id));
    }

    @Transactional(readOnly = true)
    public List<AvailabilityResponse> listForResource(String tenantId, Long resourceId) {
        resourceRepository.findByIdAndTenantId(resourceId, tenantId)
            .orElseThrow(() -> new NotFoundException("Resource", resourceId));
        return availabilityRepository.findAllByResourceId(resourceId).stream()
            .map(AvailabilityMapper::toResponse)
            .toList();
    }

    @Transactional(readOnly = true)
    public Map<Long, List<AvailabilityWindow>> expand(String tenantId, Collection<Long> resourceIds,
                                                      Instant from, Instant to) {
        requireWindow(from, to);
        List<Resource> resources = resourceRepository.findAllByTenantIdAndIdIn(tenantId, resourceIds);
        if (resources.size() != resourceIds.stream().distinct().count()) {
            Collection<Long> found = resources.stream().map(Resource::getId).toList();
            Long missing = resourceIds.stream().filter(id -> !found.contains(id)).findFirst().orElse(null);
            throw new NotFoundException("Resource", missing);
        }
        Map<Long, List<AvailabilityWindow>> result = new LinkedHashMap<>();
        buildTimelines(resources, from, to).forEach((id, timeline) -> result.put(id, timeline.windows()));
        return result;
    }

    @Transactional(readOnly = true)
    public ResourceAvailabilityCheck checkResource(String tenantId, Long resourceId, Instant start, Instant end) {
        requireWindow(start, end);
        Resource resource = resourceRepository.findByIdAndTenantId(resourceId, tenantId)
            .orElseThrow(() -> new NotFoundException("Resource", resourceId));
        if (!resource.isActive()) {
            return ResourceAvailabilityCheck.unavailable(resourceId, "Resource " + resourceId + " is deactivated");
        }
        AvailabilityTimeline timeline = buildTimelines(List.of(resource), start, end).get(resourceId);
        List<BookedInterval> bookings = appointmentResourceRepository
            .findLiveOverlapping(List.of(resourceId), start, end).stream()
            .map(BookedInterval::of)
            .toList();
        return capacityEvaluator.evaluate(timeline, start, end, bookings);
    }

    /**
     * Builds a timeline per resource over {@code [from, to)}. Callers that hold row locks
     * on the resources pass the locked entities so no stale copy is read.
     */
    public Map<Long, AvailabilityTimeline> buildTimelines(Collection<Resource> resources, Instant from, Instant to) {
        Map<Long, AvailabilityTimeline> timelines = new LinkedHashMap<>();
        if (resources.isEmpty()) {
            return timelines;
        }
        List<Long> ids = resources.stream().map(Resource::getId).toList();
        Map<Long, List<ResourceAvailability>> recordsByResource = availabilityRepository.findStartingBefore(ids, to)
            .stream()
            .collect(Collectors.groupingBy(record -> record.getResource().getId()));

        for (Resource resource : resources) {
            List<ResourceAvailability> records = recordsByResource.getOrDefault(resource.getId(), List.of());
            timelines.put(resource.getId(), timeline(resource, records, from, to));
        }
        return timelines;
    }

    AvailabilityTimeline timeline(Resource resource, List<ResourceAvailability> records, Instant from, Instant to) {
        List<AvailabilityWindow> available = new ArrayList<>();
        List<AvailabilityWindow> blocked = new ArrayList<>();
        boolean scheduled = false;

        for (ResourceAvailability record : records) {
            if (!recurrenceExpander.mayReach(record.getStartTime(), record.getEndTime(),
                    record.getRecurrencePattern(), from, to)) {
                continue;
            }
            boolean isAvailable = record.getAvailabilityType() == AvailabilityType.AVAILABLE;
            scheduled |= isAvailable;
            List<Occurrence> occurrences = recurrenceExpander.expand(record.getStartTime(), record.getEndTime(),
                record.getRecurrencePattern(), from, to);
            for (Occurrence occurrence : occurrences) {
                AvailabilityWindow window = new AvailabilityWindow(
                    resource.getId(),
                    occurrence.start(),
                    occurrence.end(),
                    record.getAvailabilityType(),
                    record.getReservationModeOverride() != null
                        ? record.getReservationModeOverride() : resource.getDefaultReservationMode(),
                    record.getMaxConcurrentOverride() != null
                        ? record.getMaxConcurrentOverride() : resource.getMaxConcurrentBookings());
                (isAvailable ? available : blocked).add(window);
            }
        }

        // no available record reaches the window, so the resource defaults apply
        if (!scheduled) {
            available.add(new AvailabilityWindow(resource.getId(), from, to, AvailabilityType.AVAILABLE,
                resource.getDefaultReservationMode(), resource.getMaxConcurrentBookings()));
        }
        // blocked time always wins
        return new AvailabilityTimeline(resource.getId(), subtract(available, blocked), blocked);
    }

    static List<AvailabilityWindow> subtract(List<AvailabilityWindow> available, List<AvailabilityWindow> blocked) {
        List<AvailabilityWindow> sortedBlocks = blocked.stream()
            .sorted(Comparator.comparing(AvailabilityWindow::start))
            .toList();
        List<AvailabilityWindow> result = new ArrayList<>();
        for (AvailabilityWindow window : available) {
            Instant cursor = window.start();
            for (AvailabilityWindow block : sortedBlocks) {
                if (!block.overlaps(cursor, window.end())) {
                    continue;
                }
                if (block.start().isAfter(cursor)) {
                    result.add(piece(window, cursor, block.start()));
                }
                if (block.end().isAfter(cursor)) {
                    cursor = block.end();
                }
                if (!cursor.isBefore(window.end())) {
                    break;
                }
            }
            if (cursor.isBefore(window.end())) {
                result.add(piece(window, cursor, window.end()));
            }
        }
        return result;
    }

    private static AvailabilityWindow piece(AvailabilityWindow window, Instant start, Instant end) {
        return new AvailabilityWindow(window.resourceId(), start, end, window.type(), window.mode(), window.maxConcurrent());
    }

    private void validate(AvailabilityRequest request) {
        if (!request.endTime().isAfter(request.startTime())) {
            throw new ValidationException("Availability end time must be after its start time");
        }
        if (request.recurrencePattern() != null) {
            request.recurrencePattern().validate(request.startTime().atZone(recurrenceExpander.zone()).toLocalDate());
        }
    }

    private static void apply(ResourceAvailability availability, AvailabilityRequest request) {
        availability.setStartTime(request.startTime());
        availability.setEndTime(request.endTime());
        availability.setAvailabilityType(request.availabilityType());
        availability.setRecurrencePattern(request.recurrencePattern());
        availability.setReservationModeOverride(request.reservationModeOverride());
        availability.setMaxConcurrentOverride(request.maxConcurrentOverride());
        availability.setReason(request.reason());
        availability.setCreatedBy(request.createdBy());
    }

    private ResourceAvailability find(String tenantId, Long id) {
        return availabilityRepository.findByIdAndTenantId(id, tenantId)
            .orElseThrow(() -> new NotFoundException("ResourceAvailability", id));
    }

    private static void requireWindow(Instant from, Instant to) {
        if (from == null || to == null || !to.isAfter(from)) {
            throw new ValidationException("Window end must be after its start");
        }
    }
}
