package com.clinic.scheduling.controller;

import com.clinic.scheduling.dto.request.AdjustInventoryRequest;
import com.clinic.scheduling.dto.request.AssignRoleRequest;
import com.clinic.scheduling.dto.request.CreateResourceRequest;
import com.clinic.scheduling.dto.request.UpdateResourceRequest;
import com.clinic.scheduling.dto.response.PagedResponse;
import com.clinic.scheduling.dto.response.ResourceResponse;
import com.clinic.scheduling.dto.response.RoleAssignmentResponse;
import com.clinic.scheduling.service.ResourceCatalogService;
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
@RequestMapping("/api/v1/resources")
@RequiredArgsConstructor
@Tag(name = "Resources", description = "Tenant resources, role assignments and consumable stock")
public class ResourceController {

    private final ResourceCatalogService catalogService;

    @PostMapping
    @Operation(summary = "Create a resource", description = "Creates a resource of a subtype. Metadata is "
        + "validated against the subtype schema; stock fields are only accepted for consumables.")
    @ApiResponse(responseCode = "201", description = "Resource created")
    @ApiResponse(responseCode = "400", description = "Validation error")
    @ApiResponse(responseCode = "404", description = "Subtype or parent not found")
    public ResponseEntity<ResourceResponse> create(@RequestHeader("X-Tenant-Id") String tenantId,
                                                   @Valid @RequestBody CreateResourceRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(catalogService.createResource(tenantId, request));
    }

    @GetMapping
    @Operation(summary = "List resources", description = "Returns a paginated list of the tenant's resources.")
    public ResponseEntity<PagedResponse<ResourceResponse>> findAll(
            @RequestHeader("X-Tenant-Id") String tenantId,
            @Parameter(description = "Filter by resource type code") @RequestParam(required = false) String typeCode,
            @Parameter(description = "Filter by active flag") @RequestParam(required = false) Boolean active,
            Pageable pageable) {
        return ResponseEntity.ok(
            PagedResponse.from(catalogService.listResources(tenantId, typeCode, active, pageable)));
    }

    @GetMapping("/low-stock")
    @Operation(summary = "List low-stock consumables", description = "Active consumables at or below their threshold.")
    public ResponseEntity<List<ResourceResponse>> lowStock(@RequestHeader("X-Tenant-Id") String tenantId) {
        return ResponseEntity.ok(catalogService.listLowStock(tenantId));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get resource by ID")
    @ApiResponse(responseCode = "200", description = "Resource found")
    @ApiResponse(responseCode = "404", description = "Resource not found")
    public ResponseEntity<ResourceResponse> findById(@RequestHeader("X-Tenant-Id") String tenantId,
                                                     @PathVariable Long id) {
        return ResponseEntity.ok(catalogService.getResource(tenantId, id));
    }

    @PutMapping("/{id}")
    @Operation(summary = "Update a resource", description = "Replaces the editable fields. Subtype and stock "
        + "level cannot be changed here.")
    @ApiResponse(responseCode = "200", description = "Resource updated")
    @ApiResponse(responseCode = "400", description = "Validation error")
    @ApiResponse(responseCode = "404", description = "Resource not found")
    @ApiResponse(responseCode = "409", description = "Concurrent modification")
    public ResponseEntity<ResourceResponse> update(@RequestHeader("X-Tenant-Id") String tenantId,
                                                   @PathVariable Long id,
                                                   @Valid @RequestBody UpdateResourceRequest request) {
        return ResponseEntity.ok(catalogService.updateResource(tenantId, id, request));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Deactivate a resource", description = "Soft delete: the resource is kept for history "
        + "but no longer offered for new bookings.")
    @ApiResponse(responseCode = "200", description = "Resource deactivated")
    @ApiResponse(responseCode = "404", description = "Resource not found")
    public ResponseEntity<ResourceResponse> deactivate(@RequestHeader("X-Tenant-Id") String tenantId,
                                                       @PathVariable Long id) {
        return ResponseEntity.ok(catalogService.deactivateResource(tenantId, id));
    }

    @GetMapping("/{id}/children")
    @Operation(summary = "List nested resources", description = "Returns the resources whose parent is this one. "
        + "With recursive=true every descendant is returned, level by level.")
    @ApiResponse(responseCode = "404", description = "Resource not found")
    public ResponseEntity<List<ResourceResponse>> listChildren(
            @RequestHeader("X-Tenant-Id") String tenantId,
            @PathVariable Long id,
            @Parameter(description = "Include every descendant") @RequestParam(defaultValue = "false") boolean recursive) {
        return ResponseEntity.ok(catalogService.listChildren(tenantId, id, recursive));
    }

    @GetMapping("/{id}/roles")
    @Operation(summary = "List roles held by a resource")
    @ApiResponse(responseCode = "404", description = "Resource not found")
    public ResponseEntity<List<RoleAssignmentResponse>> listRoles(@RequestHeader("X-Tenant-Id") String tenantId,
                                                                  @PathVariable Long id) {
        return ResponseEntity.ok(catalogService.listRoleAssignments(tenantId, id));
    }

    @PostMapping("/{id}/roles")
    @Operation(summary = "Assign a role", description = "Assigns a role to the resource or updates the priority "
        + "of an existing assignment. The role must belong to the resource's type.")
    @ApiResponse(responseCode = "200", description = "Role assigned")
    @ApiResponse(responseCode = "400", description = "Role does not fit the resource type")
    @ApiResponse(responseCode = "404", description = "Resource or role not found")
    public ResponseEntity<RoleAssignmentResponse> assignRole(@RequestHeader("X-Tenant-Id") String tenantId,
                                                             @PathVariable Long id,
                                                             @Valid @RequestBody AssignRoleRequest request) {
        return ResponseEntity.ok(catalogService.assignRole(tenantId, id, request));
    }

    @DeleteMapping("/{id}/roles/{roleId}")
    @Operation(summary = "Unassign a role")
    @ApiResponse(responseCode = "204", description = "Role unassigned")
    @ApiResponse(responseCode = "404", description = "Resource or assignment not found")
    public ResponseEntity<Void> unassignRole(@RequestHeader("X-Tenant-Id") String tenantId,
                                             @PathVariable Long id,
                                             @PathVariable Long roleId) {
        catalogService.unassignRole(tenantId, id, roleId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/inventory")
    @Operation(summary = "Adjust consumable stock", description = "Applies a signed delta. Stock never goes negative.")
    @ApiResponse(responseCode = "200", description = "Stock adjusted")
    @ApiResponse(responseCode = "400", description = "Resource is not a consumable")
    @ApiResponse(responseCode = "404", description = "Resource not found")
    @ApiResponse(responseCode = "409", description = "Not enough stock or resource deactivated")
    public ResponseEntity<ResourceResponse> adjustInventory(@RequestHeader("X-Tenant-Id") String tenantId,
                                                            @PathVariable Long id,
                                                            @Valid @RequestBody AdjustInventoryRequest request) {
        return ResponseEntity.ok(catalogService.adjustInventory(tenantId, id, request));
    }
}
