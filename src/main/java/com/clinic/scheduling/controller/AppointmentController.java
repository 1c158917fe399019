package com.clinic.scheduling.controller;

import com.clinic.scheduling.dto.request.CancelAppointmentRequest;
import com.clinic.scheduling.dto.request.CreateAppointmentRequest;
import com.clinic.scheduling.dto.request.ReassignResourceRequest;
import com.clinic.scheduling.dto.request.RescheduleAppointmentRequest;
import com.clinic.scheduling.dto.response.AppointmentResponse;
import com.clinic.scheduling.dto.response.PagedResponse;
import com.clinic.scheduling.entity.AppointmentStatus;
import com.clinic.scheduling.service.AppointmentService;
import com.clinic.scheduling.service.BookingService;
import com.clinic.scheduling.service.model.CoverageReport;
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
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;

@RestController
@RequestMapping("/api/v1/appointments")
@RequiredArgsConstructor
@Tag(name = "Appointments", description = "Conflict-safe booking and appointment lifecycle")
public class AppointmentController {

    private final BookingService bookingService;
    private final AppointmentService appointmentService;

    @PostMapping
    @Operation(summary = "Book an appointment", description = "Books an existing slot (slotId) or a new window "
        + "(startTime). Resources are locked, re-checked and reserved in one transaction. "
        + "On conflict the response lists alternative slots.")
    @ApiResponse(responseCode = "201", description = "Appointment booked")
    @ApiResponse(responseCode = "400", description = "Validation error")
    @ApiResponse(responseCode = "404", description = "Procedure, slot or resource not found")
    @ApiResponse(responseCode = "409", description = "Resources unavailable, slot taken or stock insufficient")
    public ResponseEntity<AppointmentResponse> create(@RequestHeader("X-Tenant-Id") String tenantId,
                                                      @Valid @RequestBody CreateAppointmentRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(bookingService.book(tenantId, request));
    }

    @GetMapping
    @Operation(summary = "List appointments", description = "Returns a paginated list of appointments with optional filters.")
    public ResponseEntity<PagedResponse<AppointmentResponse>> findAll(
            @RequestHeader("X-Tenant-Id") String tenantId,
            @Parameter(description = "Filter by status") @RequestParam(required = false) AppointmentStatus status,
            @Parameter(description = "Filter by contact ID") @RequestParam(required = false) String contactId,
            @Parameter(description = "Starting at or after") @RequestParam(required = false) Instant from,
            @Parameter(description = "Starting before") @RequestParam(required = false) Instant to,
            Pageable pageable) {
        return ResponseEntity.ok(PagedResponse.from(
            appointmentService.list(tenantId, status, contactId, from, to, pageable)));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get appointment by ID")
    @ApiResponse(responseCode = "200", description = "Appointment found")
    @ApiResponse(responseCode = "404", description = "Appointment not found")
    public ResponseEntity<AppointmentResponse> findById(@RequestHeader("X-Tenant-Id") String tenantId,
                                                        @PathVariable Long id) {
        return ResponseEntity.ok(appointmentService.get(tenantId, id));
    }

    @PatchMapping("/{id}/confirm")
    @Operation(summary = "Confirm an appointment")
    @ApiResponse(responseCode = "200", description = "Appointment confirmed")
    @ApiResponse(responseCode = "404", description = "Appointment not found")
    @ApiResponse(responseCode = "409", description = "Transition not allowed")
    public ResponseEntity<AppointmentResponse> confirm(@RequestHeader("X-Tenant-Id") String tenantId,
                                                       @PathVariable Long id) {
        return ResponseEntity.ok(appointmentService.confirm(tenantId, id));
    }

    @PatchMapping("/{id}/check-in")
    @Operation(summary = "Check in an appointment")
    @ApiResponse(responseCode = "200", description = "Appointment checked in")
    @ApiResponse(responseCode = "409", description = "Transition not allowed")
    public ResponseEntity<AppointmentResponse> checkIn(@RequestHeader("X-Tenant-Id") String tenantId,
                                                       @PathVariable Long id) {
        return ResponseEntity.ok(appointmentService.checkIn(tenantId, id));
    }

    @PatchMapping("/{id}/start")
    @Operation(summary = "Start an appointment")
    @ApiResponse(responseCode = "200", description = "Appointment in progress")
    @ApiResponse(responseCode = "409", description = "Transition not allowed")
    public ResponseEntity<AppointmentResponse> start(@RequestHeader("X-Tenant-Id") String tenantId,
                                                     @PathVariable Long id) {
        return ResponseEntity.ok(appointmentService.start(tenantId, id));
    }

    @PatchMapping("/{id}/complete")
    @Operation(summary = "Complete an appointment")
    @ApiResponse(responseCode = "200", description = "Appointment completed")
    @ApiResponse(responseCode = "409", description = "Transition not allowed")
    public ResponseEntity<AppointmentResponse> complete(@RequestHeader("X-Tenant-Id") String tenantId,
                                                        @PathVariable Long id) {
        return ResponseEntity.ok(appointmentService.complete(tenantId, id));
    }

    @PatchMapping("/{id}/cancel")
    @Operation(summary = "Cancel an appointment", description = "Frees the slot and restores consumed stock. "
        + "Reservation records are retained for history.")
    @ApiResponse(responseCode = "200", description = "Appointment cancelled")
    @ApiResponse(responseCode = "404", description = "Appointment not found")
    @ApiResponse(responseCode = "409", description = "Appointment already in a terminal state")
    public ResponseEntity<AppointmentResponse> cancel(@RequestHeader("X-Tenant-Id") String tenantId,
                                                      @PathVariable Long id,
                                                      @Valid @RequestBody(required = false) CancelAppointmentRequest request) {
        String reason = request == null ? null : request.reason();
        return ResponseEntity.ok(appointmentService.cancel(tenantId, id, reason));
    }

    @PatchMapping("/{id}/no-show")
    @Operation(summary = "Mark an appointment as no-show", description = "Consumed stock is not restored.")
    @ApiResponse(responseCode = "200", description = "Appointment marked as no-show")
    @ApiResponse(responseCode = "409", description = "Transition not allowed")
    public ResponseEntity<AppointmentResponse> noShow(@RequestHeader("X-Tenant-Id") String tenantId,
                                                      @PathVariable Long id) {
        return ResponseEntity.ok(appointmentService.noShow(tenantId, id));
    }

    @PatchMapping("/{id}/reschedule")
    @Operation(summary = "Reschedule an appointment", description = "Cancels the appointment and books the same "
        + "procedure with the same preferences at the new slot or start time, atomically.")
    @ApiResponse(responseCode = "200", description = "Appointment rescheduled; the body is the new appointment")
    @ApiResponse(responseCode = "400", description = "Neither or both of slotId and startTime given")
    @ApiResponse(responseCode = "409", description = "New time unavailable; alternatives are listed")
    public ResponseEntity<AppointmentResponse> reschedule(@RequestHeader("X-Tenant-Id") String tenantId,
                                                          @PathVariable Long id,
                                                          @Valid @RequestBody RescheduleAppointmentRequest request) {
        return ResponseEntity.ok(bookingService.reschedule(tenantId, id, request));
    }

    @PatchMapping("/{id}/reassign")
    @Operation(summary = "Reassign a resource", description = "Moves one reservation to another resource holding "
        + "the same role. The old reservation is kept as RELEASED.")
    @ApiResponse(responseCode = "200", description = "Resource reassigned")
    @ApiResponse(responseCode = "400", description = "Resource holds no reservation or lacks the role")
    @ApiResponse(responseCode = "409", description = "New resource unavailable")
    public ResponseEntity<AppointmentResponse> reassign(@RequestHeader("X-Tenant-Id") String tenantId,
                                                        @PathVariable Long id,
                                                        @Valid @RequestBody ReassignResourceRequest request) {
        return ResponseEntity.ok(appointmentService.reassignResource(tenantId, id, request));
    }

    @GetMapping("/coverage")
    @Operation(summary = "Check coverage for a resource", description = "Live appointments holding the resource "
        + "in the window, each with the resources that could take over.")
    @ApiResponse(responseCode = "200", description = "Coverage computed")
    @ApiResponse(responseCode = "404", description = "Resource not found")
    public ResponseEntity<CoverageReport> coverage(
            @RequestHeader("X-Tenant-Id") String tenantId,
            @Parameter(description = "Resource ID") @RequestParam Long resourceId,
            @Parameter(description = "Window start") @RequestParam Instant from,
            @Parameter(description = "Window end") @RequestParam Instant to) {
        return ResponseEntity.ok(appointmentService.checkCoverage(tenantId, resourceId, from, to));
    }
}
