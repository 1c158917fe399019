package com.clinic.scheduling.service;

import com.clinic.scheduling.entity.PreferenceType;
import com.clinic.scheduling.entity.Resource;
import com.clinic.scheduling.service.model.AvailabilityTimeline;
import com.clinic.scheduling.service.model.BookedInterval;
import com.clinic.scheduling.service.model.ExpandedRequirement;
import com.clinic.scheduling.service.model.PreferenceSpec;
import com.clinic.scheduling.service.model.ResourceAssignment;
import com.clinic.scheduling.service.model.ResourceAvailabilityCheck;
import com.clinic.scheduling.service.model.ResourceConflict;
import com.clinic.scheduling.service.model.RoleCandidate;
import com.clinic.scheduling.service.model.SelectionContext;
import com.clinic.scheduling.service.model.SelectionResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Required requirements are filled before optional ones. For each requirement,
 * resources named by a {@code REQUIRED} preference are taken as they are and fail the
 * whole selection if they cannot take the booking. Remaining places are filled from the
 * role's candidates ranked by: {@code PREFERRED} preference, fewer overlapping
 * reservations, catalog priority, id.
 *
 * <p>A consumable requirement is supplied entirely by one resource holding at least
 * {@code quantityMin} units; any other requirement takes {@code quantityMin} distinct
 * resources. Picks made for earlier requirements count against capacity for later ones,
 * so one resource can serve two requirements only when their windows allow it.
 */
@Component
@RequiredArgsConstructor
public class ResourceSelector {

    static final int NOT_PREFERRED_PENALTY = 5;
    static final int UNFILLED_OPTIONAL_PENALTY = 10;

    private final CapacityEvaluator capacityEvaluator;

    public SelectionResult select(Instant slotStart, List<ExpandedRequirement> requirements, SelectionContext context) {
        List<ExpandedRequirement> ordered = requirements.stream()
            .sorted(Comparator.comparing((ExpandedRequirement r) -> !r.required()))
            .toList();

        List<ResourceAssignment> picks = new ArrayList<>();
        Map<Long, List<BookedInterval>> tentative = new HashMap<>();
        Map<Long, Integer> stockLeft = new HashMap<>();
        int score = 0;

        for (ExpandedRequirement requirement : ordered) {
            Instant start = slotStart.plus(Duration.ofMinutes(requirement.startOffsetMinutes()));
            Instant end = slotStart.plus(Duration.ofMinutes(requirement.endOffsetMinutes()));
            RequirementPick pick = pickFor(requirement, start, end, context, tentative, stockLeft);

            if (pick.failure() != null) {
                if (requirement.required() || pick.requiredPreferenceFailed()) {
                    return pick.failure();
                }
                score += UNFILLED_OPTIONAL_PENALTY;
                continue;
            }
            for (Chosen chosen : pick.chosen()) {
                Resource resource = chosen.candidate().resource();
                Integer quantity = resource.isConsumable() ? requirement.quantityMin() : null;
                picks.add(new ResourceAssignment(requirement.roleId(), resource.getId(), start, end,
                    chosen.check().mode(), quantity));
                tentative.computeIfAbsent(resource.getId(), id -> new ArrayList<>())
                    .add(new BookedInterval(resource.getId(), null, start, end, chosen.check().mode()));
                if (quantity != null) {
                    stockLeft.merge(resource.getId(), -quantity, Integer::sum);
                }
                score += chosen.score();
            }
        }
        return SelectionResult.success(picks, score);
    }

    private RequirementPick pickFor(ExpandedRequirement requirement, Instant start, Instant end,
                                    SelectionContext context, Map<Long, List<BookedInterval>> tentative,
                                    Map<Long, Integer> stockLeft) {
        List<RoleCandidate> candidates = context.candidatesByRole().getOrDefault(requirement.roleId(), List.of());
        List<PreferenceSpec> rolePreferences = context.preferences().stream()
            .filter(p -> p.roleId().equals(requirement.roleId()))
            .sorted(Comparator.comparingInt(PreferenceSpec::priority))
            .toList();
        boolean consumableRole = candidates.stream().anyMatch(c -> c.resource().isConsumable());
        int needed = consumableRole ? 1 : Math.max(requirement.quantityMin(), 1);

        List<Chosen> chosen = new ArrayList<>();
        Set<Long> taken = new HashSet<>();

        for (PreferenceSpec preference : rolePreferences) {
            if (preference.type() != PreferenceType.REQUIRED || chosen.size() >= needed) {
                continue;
            }
            RoleCandidate candidate = candidates.stream()
                .filter(c -> c.resourceId().equals(preference.resourceId()))
                .findFirst()
                .orElse(null);
            if (candidate == null) {
                return RequirementPick.requiredPreferenceFailed(SelectionResult.failed(
                    "Required resource " + preference.resourceId() + " cannot fill role " + requirement.roleId(),
                    List.of()));
            }
            Evaluation evaluation = evaluate(candidate, requirement, start, end, context, tentative, stockLeft);
            if (evaluation.shortfall() != null) {
                return RequirementPick.requiredPreferenceFailed(evaluation.shortfall());
            }
            if (!evaluation.check().available()) {
                return RequirementPick.requiredPreferenceFailed(SelectionResult.failed(
                    "Required resource " + preference.resourceId() + " is unavailable: " + evaluation.check().reason(),
                    evaluation.check().conflicts()));
            }
            chosen.add(new Chosen(candidate, evaluation.check(), evaluation.overlapping() + candidate.catalogPriority()));
            taken.add(candidate.resourceId());
        }

        if (chosen.size() < needed) {
            List<Long> preferred = rolePreferences.stream()
                .filter(p -> p.type() == PreferenceType.PREFERRED)
                .map(PreferenceSpec::resourceId)
                .toList();
            List<Ranked> ranked = new ArrayList<>();
            List<ResourceConflict> conflicts = new ArrayList<>();
            SelectionResult shortfall = null;

            for (RoleCandidate candidate : candidates) {
                if (taken.contains(candidate.resourceId())) {
                    continue;
                }
                Evaluation evaluation = evaluate(candidate, requirement, start, end, context, tentative, stockLeft);
                if (evaluation.shortfall() != null) {
                    shortfall = shortfall == null ? evaluation.shortfall() : shortfall;
                } else if (evaluation.check().available()) {
                    int preferenceRank = preferred.indexOf(candidate.resourceId());
                    ranked.add(new Ranked(candidate, evaluation,
                        preferenceRank < 0 ? Integer.MAX_VALUE : preferenceRank));
                } else {
                    conflicts.addAll(evaluation.check().conflicts());
                }
            }

            ranked.sort(Comparator.comparingInt(Ranked::preferenceRank)
                .thenComparingInt(r -> r.evaluation().overlapping())
                .thenComparingInt(r -> r.candidate().catalogPriority())
                .thenComparing(r -> r.candidate().resourceId()));

            for (Ranked r : ranked) {
                if (chosen.size() >= needed) {
                    break;
                }
                int penalty = !preferred.isEmpty() && r.preferenceRank() == Integer.MAX_VALUE ? NOT_PREFERRED_PENALTY : 0;
                chosen.add(new Chosen(r.candidate(), r.evaluation().check(),
                    r.evaluation().overlapping() + r.candidate().catalogPriority() + penalty));
            }

            if (chosen.size() < needed) {
                if (shortfall != null && conflicts.isEmpty()) {
                    return RequirementPick.failed(shortfall);
                }
                return RequirementPick.failed(SelectionResult.failed(
                    "No available resource for role " + requirement.roleId() + " between " + start + " and " + end
                        + " (" + chosen.size() + " of " + needed + " found)",
                    conflicts));
            }
        }
        return RequirementPick.of(chosen);
    }

    private Evaluation evaluate(RoleCandidate candidate, ExpandedRequirement requirement, Instant start, Instant end,
                                SelectionContext context, Map<Long, List<BookedInterval>> tentative,
                                Map<Long, Integer> stockLeft) {
        Resource resource = candidate.resource();
        AvailabilityTimeline timeline = context.timelines().get(resource.getId());
        if (timeline == null || !resource.isActive()) {
            return new Evaluation(ResourceAvailabilityCheck.unavailable(resource.getId(),
                "Resource " + resource.getId() + " is not schedulable"), 0, null);
        }
        List<BookedInterval> bookings = new ArrayList<>(context.bookings().getOrDefault(resource.getId(), List.of()));
        bookings.addAll(tentative.getOrDefault(resource.getId(), List.of()));

        ResourceAvailabilityCheck check = capacityEvaluator.evaluate(timeline, start, end, bookings);
        int overlapping = (int) bookings.stream().filter(b -> b.overlaps(start, end)).count();

        if (check.available() && resource.isConsumable()) {
            int onHand = resource.getQuantityOnHand() == null ? 0 : resource.getQuantityOnHand();
            int left = onHand + stockLeft.getOrDefault(resource.getId(), 0);
            if (left < requirement.quantityMin()) {
                return new Evaluation(check, overlapping, SelectionResult.outOfStock(
                    "Resource " + resource.getId() + " has " + left + " units, " + requirement.quantityMin() + " needed",
                    new SelectionResult.StockShortfall(resource.getId(), left, requirement.quantityMin())));
            }
        }
        return new Evaluation(check, overlapping, null);
    }

    private record Evaluation(ResourceAvailabilityCheck check, int overlapping, SelectionResult shortfall) {}

    private record Chosen(RoleCandidate candidate, ResourceAvailabilityCheck check, int score) {}

    private record Ranked(RoleCandidate candidate, Evaluation evaluation, int preferenceRank) {}

    private record RequirementPick(List<Chosen> chosen, SelectionResult failure, boolean requiredPreferenceFailed) {

        static RequirementPick of(List<Chosen> chosen) {
            return new RequirementPick(chosen, null, false);
        }

        static RequirementPick failed(SelectionResult failure) {
            return new RequirementPick(List.of(), failure, false);
        }

        static RequirementPick requiredPreferenceFailed(SelectionResult failure) {
            return new RequirementPick(List.of(), failure, true);
        }
    }
}
