package com.clinic.scheduling.controller;

import com.clinic.scheduling.dto.request.CreateProcedureRequest;
import com.clinic.scheduling.dto.request.ProcedureChildRequest;
import com.clinic.scheduling.dto.request.ReorderChildrenRequest;
import com.clinic.scheduling.dto.request.RequirementRequest;
import com.clinic.scheduling.dto.request.UpdateProcedureRequest;
import com.clinic.scheduling.dto.response.PagedResponse;
import com.clinic.scheduling.dto.response.ProcedureResponse;
import com.clinic.scheduling.dto.response.RequirementResponse;
import com.clinic.scheduling.entity.ProcedureType;
import com.clinic.scheduling.service.ProcedureService;
import com.clinic.scheduling.service.model.ExpandedRequirement;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Pageable;
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

import java.util.List;

@RestController
@RequestMapping("/api/v1/procedures")
@RequiredArgsConstructor
@Tag(name = "Procedures", description = "Atomic and composite procedures with their resource requirements")
public class ProcedureController {

    private final ProcedureService procedureService;

    @PostMapping
    @Operation(summary = "Create a procedure", description = "Atomic procedures carry a duration; composite "
        + "procedures take their duration from their ordered children and the gaps between them.")
    @ApiResponse(responseCode = "201", description = "Procedure created")
    @ApiResponse(responseCode = "400", description = "Validation error, duplicate code or circular composition")
    public ResponseEntity<ProcedureResponse> create(@RequestHeader("X-Tenant-Id") String tenantId,
                                                    @Valid @RequestBody CreateProcedureRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(procedureService.create(tenantId, request));
    }

    @GetMapping
    @Operation(summary = "List procedures", description = "Returns a paginated list of the tenant's procedures.")
    public ResponseEntity<PagedResponse<ProcedureResponse>> findAll(
            @RequestHeader("X-Tenant-Id") String tenantId,
            @Parameter(description = "Filter by type (ATOMIC, COMPOSITE)") @RequestParam(required = false) ProcedureType type,
            @Parameter(description = "Filter by active flag") @RequestParam(required = false) Boolean active,
            Pageable pageable) {
        return ResponseEntity.ok(PagedResponse.from(procedureService.list(tenantId, type, active, pageable)));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get procedure by ID")
    @ApiResponse(responseCode = "200", description = "Procedure found")
    @ApiResponse(responseCode = "404", description = "Procedure not found")
    public ResponseEntity<ProcedureResponse> findById(@RequestHeader("X-Tenant-Id") String tenantId,
                                                      @PathVariable Long id) {
        return ResponseEntity.ok(procedureService.get(tenantId, id));
    }

    @PutMapping("/{id}")
    @Operation(summary = "Update a procedure", description = "The procedure type cannot change.")
    @ApiResponse(responseCode = "200", description = "Procedure updated")
    @ApiResponse(responseCode = "400", description = "Validation error")
    @ApiResponse(responseCode = "404", description = "Procedure not found")
    public ResponseEntity<ProcedureResponse> update(@RequestHeader("X-Tenant-Id") String tenantId,
                                                    @PathVariable Long id,
                                                    @Valid @RequestBody UpdateProcedureRequest request) {
        return ResponseEntity.ok(procedureService.update(tenantId, id, request));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Deactivate a procedure", description = "Soft delete; existing slots and appointments are kept.")
    @ApiResponse(responseCode = "200", description = "Procedure deactivated")
    @ApiResponse(responseCode = "404", description = "Procedure not found")
    public ResponseEntity<ProcedureResponse> deactivate(@RequestHeader("X-Tenant-Id") String tenantId,
                                                        @PathVariable Long id) {
        return ResponseEntity.ok(procedureService.deactivate(tenantId, id));
    }

    @PostMapping("/{id}/children")
    @Operation(summary = "Add a child procedure", description = "Appends or inserts a child into a composite "
        + "procedure. Adding a child that already contains the parent is rejected.")
    @ApiResponse(responseCode = "200", description = "Child added")
    @ApiResponse(responseCode = "400", description = "Not a composite or circular composition")
    @ApiResponse(responseCode = "404", description = "Procedure not found")
    public ResponseEntity<ProcedureResponse> addChild(@RequestHeader("X-Tenant-Id") String tenantId,
                                                      @PathVariable Long id,
                                                      @Valid @RequestBody ProcedureChildRequest request) {
        return ResponseEntity.ok(procedureService.addChild(tenantId, id, request));
    }

    @DeleteMapping("/{id}/children/{compositionId}")
    @Operation(summary = "Remove a child procedure")
    @ApiResponse(responseCode = "200", description = "Child removed")
    @ApiResponse(responseCode = "404", description = "Procedure or child not found")
    public ResponseEntity<ProcedureResponse> removeChild(@RequestHeader("X-Tenant-Id") String tenantId,
                                                         @PathVariable Long id,
                                                         @PathVariable Long compositionId) {
        return ResponseEntity.ok(procedureService.removeChild(tenantId, id, compositionId));
    }

    @PutMapping("/{id}/children/order")
    @Operation(summary = "Reorder child procedures", description = "Lists every child composition exactly once in the new order.")
    @ApiResponse(responseCode = "200", description = "Children reordered")
    @ApiResponse(responseCode = "400", description = "Order does not list every child once")
    public ResponseEntity<ProcedureResponse> reorderChildren(@RequestHeader("X-Tenant-Id") String tenantId,
                                                             @PathVariable Long id,
                                                             @Valid @RequestBody ReorderChildrenRequest request) {
        return ResponseEntity.ok(procedureService.reorderChildren(tenantId, id, request));
    }

    @PostMapping("/{id}/requirements")
    @Operation(summary = "Add a resource requirement", description = "Atomic procedures only.")
    @ApiResponse(responseCode = "201", description = "Requirement added")
    @ApiResponse(responseCode = "400", description = "Validation error or composite procedure")
    @ApiResponse(responseCode = "404", description = "Procedure or role not found")
    public ResponseEntity<RequirementResponse> addRequirement(@RequestHeader("X-Tenant-Id") String tenantId,
                                                              @PathVariable Long id,
                                                              @Valid @RequestBody RequirementRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(procedureService.addRequirement(tenantId, id, request));
    }

    @PutMapping("/{id}/requirements/{requirementId}")
    @Operation(summary = "Update a resource requirement")
    @ApiResponse(responseCode = "200", description = "Requirement updated")
    @ApiResponse(responseCode = "404", description = "Procedure or requirement not found")
    public ResponseEntity<RequirementResponse> updateRequirement(@RequestHeader("X-Tenant-Id") String tenantId,
                                                                 @PathVariable Long id,
                                                                 @PathVariable Long requirementId,
                                                                 @Valid @RequestBody RequirementRequest request) {
        return ResponseEntity.ok(procedureService.updateRequirement(tenantId, id, requirementId, request));
    }

    @DeleteMapping("/{id}/requirements/{requirementId}")
    @Operation(summary = "Remove a resource requirement")
    @ApiResponse(responseCode = "204", description = "Requirement removed")
    @ApiResponse(responseCode = "404", description = "Procedure or requirement not found")
    public ResponseEntity<Void> removeRequirement(@RequestHeader("X-Tenant-Id") String tenantId,
                                                  @PathVariable Long id,
                                                  @PathVariable Long requirementId) {
        procedureService.removeRequirement(tenantId, id, requirementId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{id}/expanded-requirements")
    @Operation(summary = "Expand requirements", description = "Every requirement of every atomic procedure in the "
        + "tree, with offsets measured from the start of the whole procedure.")
    @ApiResponse(responseCode = "200", description = "Requirements expanded")
    @ApiResponse(responseCode = "404", description = "Procedure not found")
    public ResponseEntity<List<ExpandedRequirement>> expandedRequirements(@RequestHeader("X-Tenant-Id") String tenantId,
                                                                          @PathVariable Long id) {
        return ResponseEntity.ok(procedureService.getExpandedRequirements(tenantId, id));
    }
}
