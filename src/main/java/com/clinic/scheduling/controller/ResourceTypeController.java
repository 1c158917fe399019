package com.clinic.scheduling.controller;

import com.clinic.scheduling.dto.request.CreateResourceSubtypeRequest;
import com.clinic.scheduling.dto.request.CreateRoleRequest;
import com.clinic.scheduling.dto.response.ResourceResponse;
import com.clinic.scheduling.dto.response.ResourceSubtypeResponse;
import com.clinic.scheduling.dto.response.ResourceTypeResponse;
import com.clinic.scheduling.dto.response.RoleResponse;
import com.clinic.scheduling.service.ResourceCatalogService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
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

import java.util.List;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Tag(name = "Resource Taxonomy", description = "Global resource types, subtypes and roles")
public class ResourceTypeController {

    private final ResourceCatalogService catalogService;

    @GetMapping("/resource-types")
    @Operation(summary = "List resource types", description = "Returns the fixed resource types in display order.")
    public ResponseEntity<List<ResourceTypeResponse>> listTypes() {
        return ResponseEntity.ok(catalogService.listTypes());
    }

    @GetMapping("/resource-subtypes")
    @Operation(summary = "List resource subtypes")
    public ResponseEntity<List<ResourceSubtypeResponse>> listSubtypes(
            @Parameter(description = "Filter by resource type code") @RequestParam(required = false) String typeCode) {
        return ResponseEntity.ok(catalogService.listSubtypes(typeCode));
    }

    @PostMapping("/resource-subtypes")
    @Operation(summary = "Create a resource subtype", description = "Creates a subtype of a resource type, "
        + "optionally with a metadata schema that resources of the subtype are validated against.")
    @ApiResponse(responseCode = "201", description = "Subtype created")
    @ApiResponse(responseCode = "400", description = "Validation error")
    @ApiResponse(responseCode = "404", description = "Resource type not found")
    @ApiResponse(responseCode = "409", description = "Subtype code already exists")
    public ResponseEntity<ResourceSubtypeResponse> createSubtype(@Valid @RequestBody CreateResourceSubtypeRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(catalogService.createSubtype(request));
    }

    @GetMapping("/roles")
    @Operation(summary = "List roles")
    public ResponseEntity<List<RoleResponse>> listRoles(
            @Parameter(description = "Filter by resource type code") @RequestParam(required = false) String typeCode) {
        return ResponseEntity.ok(catalogService.listRoles(typeCode));
    }

    @PostMapping("/roles")
    @Operation(summary = "Create a role", description = "Creates a role that resources of one type can fill.")
    @ApiResponse(responseCode = "201", description = "Role created")
    @ApiResponse(responseCode = "400", description = "Validation error")
    @ApiResponse(responseCode = "404", description = "Resource type not found")
    @ApiResponse(responseCode = "409", description = "Role code already exists")
    public ResponseEntity<RoleResponse> createRole(@Valid @RequestBody CreateRoleRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(catalogService.createRole(request));
    }

    @GetMapping("/roles/{id}/resources")
    @Operation(summary = "List resources filling a role", description = "Ordered by assignment priority, then id.")
    @ApiResponse(responseCode = "200", description = "Resources found")
    @ApiResponse(responseCode = "404", description = "Role not found")
    public ResponseEntity<List<ResourceResponse>> listResourcesForRole(
            @RequestHeader("X-Tenant-Id") String tenantId,
            @PathVariable Long id,
            @Parameter(description = "Only active resources") @RequestParam(defaultValue = "true") boolean activeOnly) {
        return ResponseEntity.ok(catalogService.listResourcesForRole(id, tenantId, activeOnly));
    }
}
