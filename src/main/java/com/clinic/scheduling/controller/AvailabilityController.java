package com.clinic.scheduling.controller;

import com.clinic.scheduling.dto.request.AvailabilityRequest;
import com.clinic.scheduling.dto.response.AvailabilityResponse;
import com.clinic.scheduling.service.AvailabilityService;
import com.clinic.scheduling.service.model.AvailabilityWindow;
import com.clinic.scheduling.service.model.ResourceAvailabilityCheck;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/availability")
@RequiredArgsConstructor
@Tag(name = "Availability", description = "Resource availability windows, recurrence and capacity checks")
public class AvailabilityController {

    private final AvailabilityService availabilityService;

    @PostMapping
    @Operation(summary = "Create an availability window", description = "Adds an available or blocked window, "
        + "optionally recurring, with optional reservation mode and capacity overrides.")
    @ApiResponse(responseCode = "201", description = "Window created")
    @ApiResponse(responseCode = "400", description = "Validation error or invalid recurrence")
    @ApiResponse(responseCode = "404", description = "Resource not found")
    @ApiResponse(responseCode = "409", description = "Resource deactivated")
    public ResponseEntity<AvailabilityResponse> create(@RequestHeader("X-Tenant-Id") String tenantId,
                                                       @Valid @RequestBody AvailabilityRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(availabilityService.create(tenantId, request));
    }

    @GetMapping
    @Operation(summary = "List availability windows of a resource")
    @ApiResponse(responseCode = "404", description = "Resource not found")
    public ResponseEntity<List<AvailabilityResponse>> listForResource(
            @RequestHeader("X-Tenant-Id") String tenantId,
            @Parameter(description = "Resource ID") @RequestParam Long resourceId) {
        return ResponseEntity.ok(availabilityService.listForResource(tenantId, resourceId));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get availability window by ID")
    @ApiResponse(responseCode = "200", description = "Window found")
    @ApiResponse(responseCode = "404", description = "Window not found")
    public ResponseEntity<AvailabilityResponse> findById(@RequestHeader("X-Tenant-Id") String tenantId,
                                                         @PathVariable Long id) {
        return ResponseEntity.ok(availabilityService.get(tenantId, id));
    }

    @PutMapping("/{id}")
    @Operation(summary = "Update an availability window", description = "The owning resource cannot change.")
    @ApiResponse(responseCode = "200", description = "Window updated")
    @ApiResponse(responseCode = "400", description = "Validation error or invalid recurrence")
    @ApiResponse(responseCode = "404", description = "Window not found")
    public ResponseEntity<AvailabilityResponse> update(@RequestHeader("X-Tenant-Id") String tenantId,
                                                       @PathVariable Long id,
                                                       @Valid @RequestBody AvailabilityRequest request) {
        return ResponseEntity.ok(availabilityService.update(tenantId, id, request));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete an availability window")
    @ApiResponse(responseCode = "204", description = "Window deleted")
    @ApiResponse(responseCode = "404", description = "Window not found")
    public ResponseEntity<Void> delete(@RequestHeader("X-Tenant-Id") String tenantId, @PathVariable Long id) {
        availabilityService.delete(tenantId, id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/windows")
    @Operation(summary = "Expand availability", description = "Concrete available and blocked windows per "
        + "resource between from and to, with recurrences expanded and blocked time cut out.")
    @ApiResponse(responseCode = "200", description = "Windows expanded")
    @ApiResponse(responseCode = "400", description = "Invalid window")
    @ApiResponse(responseCode = "404", description = "Resource not found")
    public ResponseEntity<Map<Long, List<AvailabilityWindow>>> expand(
            @RequestHeader("X-Tenant-Id") String tenantId,
            @Parameter(description = "Resource IDs") @RequestParam List<Long> resourceIds,
            @Parameter(description = "Window start (ISO-8601 instant)") @RequestParam Instant from,
            @Parameter(description = "Window end (ISO-8601 instant)") @RequestParam Instant to) {
        return ResponseEntity.ok(availabilityService.expand(tenantId, resourceIds, from, to));
    }

    @GetMapping("/check")
    @Operation(summary = "Check a resource for a window", description = "Reports whether the resource can take "
        + "one more reservation for the window, with its mode, capacity and conflicting reservations.")
    @ApiResponse(responseCode = "200", description = "Check performed")
    @ApiResponse(responseCode = "400", description = "Invalid window")
    @ApiResponse(responseCode = "404", description = "Resource not found")
    public ResponseEntity<ResourceAvailabilityCheck> check(
            @RequestHeader("X-Tenant-Id") String tenantId,
            @Parameter(description = "Resource ID") @RequestParam Long resourceId,
            @Parameter(description = "Window start (ISO-8601 instant)") @RequestParam Instant start,
            @Parameter(description = "Window end (ISO-8601 instant)") @RequestParam Instant end) {
        return ResponseEntity.ok(availabilityService.checkResource(tenantId, resourceId, start, end));
    }
}
