package com.clinic.scheduling.controller;

import com.clinic.scheduling.dto.request.GenerateSlotsRequest;
import com.clinic.scheduling.dto.response.PagedResponse;
import com.clinic.scheduling.dto.response.SlotResponse;
import com.clinic.scheduling.entity.SlotStatus;
import com.clinic.scheduling.service.SlotGenerationService;
import com.clinic.scheduling.service.model.GeneratedSlot;
import com.clinic.scheduling.service.model.SlotValidationResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Pageable;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/slots")
@RequiredArgsConstructor
@Tag(name = "Slots", description = "Candidate slot generation and persisted slots")
public class SlotController {

    private final SlotGenerationService slotGenerationService;

    @PostMapping("/generate")
    @Operation(summary = "Generate candidate slots", description = "Computes bookable start times for a procedure "
        + "with a ranked resource combination each. Nothing is persisted or held.")
    @ApiResponse(responseCode = "200", description = "Candidates generated")
    @ApiResponse(responseCode = "400", description = "Validation error")
    @ApiResponse(responseCode = "404", description = "Procedure or location not found")
    @ApiResponse(responseCode = "409", description = "Procedure deactivated")
    public ResponseEntity<List<GeneratedSlot>> generate(@RequestHeader("X-Tenant-Id") String tenantId,
                                                        @Valid @RequestBody GenerateSlotsRequest request) {
        return ResponseEntity.ok(slotGenerationService.generateSlots(tenantId, request));
    }

    @PostMapping
    @Operation(summary = "Create slots", description = "Generates candidates and persists them as MANUAL slots. "
        + "Start times that already have a non-cancelled slot are skipped.")
    @ApiResponse(responseCode = "201", description = "Slots created")
    @ApiResponse(responseCode = "400", description = "Validation error")
    @ApiResponse(responseCode = "404", description = "Procedure not found")
    public ResponseEntity<List<SlotResponse>> create(@RequestHeader("X-Tenant-Id") String tenantId,
                                                     @Valid @RequestBody GenerateSlotsRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(slotGenerationService.createSlots(tenantId, request));
    }

    @GetMapping
    @Operation(summary = "List slots", description = "Returns a paginated list of persisted slots.")
    public ResponseEntity<PagedResponse<SlotResponse>> findAll(
            @RequestHeader("X-Tenant-Id") String tenantId,
            @Parameter(description = "Filter by procedure ID") @RequestParam(required = false) Long procedureId,
            @Parameter(description = "Filter by status") @RequestParam(required = false) SlotStatus status,
            @Parameter(description = "Slots starting at or after") @RequestParam(required = false) Instant from,
            @Parameter(description = "Slots starting before") @RequestParam(required = false) Instant to,
            Pageable pageable) {
        return ResponseEntity.ok(PagedResponse.from(
            slotGenerationService.listSlots(tenantId, procedureId, status, from, to, pageable)));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get slot by ID")
    @ApiResponse(responseCode = "200", description = "Slot found")
    @ApiResponse(responseCode = "404", description = "Slot not found")
    public ResponseEntity<SlotResponse> findById(@RequestHeader("X-Tenant-Id") String tenantId,
                                                 @PathVariable Long id) {
        return ResponseEntity.ok(slotGenerationService.getSlot(tenantId, id));
    }

    @PostMapping("/{id}/validate")
    @Operation(summary = "Validate a slot", description = "Checks that the slot could still be booked; "
        + "otherwise lists the issues and alternative slots.")
    @ApiResponse(responseCode = "200", description = "Validation performed")
    @ApiResponse(responseCode = "404", description = "Slot not found")
    public ResponseEntity<SlotValidationResult> validate(@RequestHeader("X-Tenant-Id") String tenantId,
                                                         @PathVariable Long id) {
        return ResponseEntity.ok(slotGenerationService.validateSlot(tenantId, id));
    }

    @PostMapping("/cleanup")
    @Operation(summary = "Delete stale auto slots", description = "Deletes AUTO slots still AVAILABLE that ended "
        + "before the given instant and were never referenced by an appointment.")
    @ApiResponse(responseCode = "200", description = "Cleanup performed")
    public ResponseEntity<Map<String, Integer>> cleanup(
            @RequestHeader("X-Tenant-Id") String tenantId,
            @Parameter(description = "Cut-off instant") @RequestParam Instant before) {
        return ResponseEntity.ok(Map.of("deleted", slotGenerationService.cleanupStaleSlots(tenantId, before)));
    }
}
