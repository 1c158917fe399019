package com.clinic.scheduling.unit.service;

import com.clinic.scheduling.dto.request.CreateProcedureRequest;
import com.clinic.scheduling.dto.request.ProcedureChildRequest;
import com.clinic.scheduling.dto.request.RequirementRequest;
import com.clinic.scheduling.dto.response.ProcedureResponse;
import com.clinic.scheduling.entity.Procedure;
import com.clinic.scheduling.entity.ProcedureComposition;
import com.clinic.scheduling.entity.ProcedureRequirement;
import com.clinic.scheduling.entity.ProcedureType;
import com.clinic.scheduling.entity.ResourceRole;
import com.clinic.scheduling.exception.InactiveResourceException;
import com.clinic.scheduling.exception.NotFoundException;
import com.clinic.scheduling.exception.ValidationException;
import com.clinic.scheduling.repository.ProcedureRepository;
import com.clinic.scheduling.repository.ResourceRoleRepository;
import com.clinic.scheduling.service.ProcedureService;
import com.clinic.scheduling.service.model.ExpandedRequirement;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProcedureServiceTest {

    private static final String TENANT = "clinic-a";

    @Mock
    private ProcedureRepository procedureRepository;

    @Mock
    private ResourceRoleRepository resourceRoleRepository;

    @InjectMocks
    private ProcedureService procedureService;

    @Test
    void totalDuration_atomic_includesBuffers() {
        Procedure consult = atomic(1L, 30);
        consult.setBufferBeforeMinutes(5);
        consult.setBufferAfterMinutes(10);

        assertThat(procedureService.totalDurationMinutes(consult)).isEqualTo(45);
    }

    @Test
    void totalDuration_composite_sumsChildrenGapsAndBuffers() {
        Procedure composite = ultrasoundVisit();

        assertThat(procedureService.totalDurationMinutes(composite)).isEqualTo(60);
    }

    @Test
    void expandedRequirements_offsetsFollowChildSequence() {
        Procedure composite = ultrasoundVisit();

        List<ExpandedRequirement> expanded = procedureService.expandedRequirements(composite);

        assertThat(expanded).hasSize(2);
        // prep: composite buffer 5, whole prep duration
        assertThat(expanded.get(0).startOffsetMinutes()).isEqualTo(5);
        assertThat(expanded.get(0).endOffsetMinutes()).isEqualTo(20);
        // scan starts after prep (15) and its gap (5); requirement offset 10..20
        assertThat(expanded.get(1).startOffsetMinutes()).isEqualTo(35);
        assertThat(expanded.get(1).endOffsetMinutes()).isEqualTo(45);
        assertThat(expanded.get(1).roleId()).isEqualTo(200L);
    }

    @Test
    void expandedRequirements_offsetsStartAfterOwnBufferBefore() {
        Procedure consult = atomic(1L, 30);
        consult.setBufferBeforeMinutes(10);
        addRequirement(consult, 100L, 0, null);

        List<ExpandedRequirement> expanded = procedureService.expandedRequirements(consult);

        assertThat(expanded).singleElement().satisfies(r -> {
            assertThat(r.startOffsetMinutes()).isEqualTo(10);
            assertThat(r.endOffsetMinutes()).isEqualTo(40);
        });
    }

    @Test
    void totalDuration_circularComposition_throwsValidationException() {
        Procedure a = composite(1L);
        Procedure b = composite(2L);
        addChild(a, b, 0);
        addChild(b, a, 0);

        assertThatThrownBy(() -> procedureService.totalDurationMinutes(a))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("circular");
    }

    @Test
    void create_atomicWithoutDuration_throwsValidationException() {
        when(procedureRepository.existsByTenantIdAndCode(TENANT, "CONSULT")).thenReturn(false);

        assertThatThrownBy(() -> procedureService.create(TENANT, new CreateProcedureRequest(
                "CONSULT", "Consultation", null, ProcedureType.ATOMIC, null, 0, 0, null, null)))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("positive duration");
        verify(procedureRepository, never()).save(any());
    }

    @Test
    void create_compositeWithOwnDuration_throwsValidationException() {
        when(procedureRepository.existsByTenantIdAndCode(TENANT, "VISIT")).thenReturn(false);

        assertThatThrownBy(() -> procedureService.create(TENANT, new CreateProcedureRequest(
                "VISIT", "Visit", null, ProcedureType.COMPOSITE, 30, 0, 0, null, null)))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("derive their duration");
    }

    @Test
    void create_duplicateCode_throwsValidationException() {
        when(procedureRepository.existsByTenantIdAndCode(TENANT, "CONSULT")).thenReturn(true);

        assertThatThrownBy(() -> procedureService.create(TENANT, new CreateProcedureRequest(
                "CONSULT", "Consultation", null, ProcedureType.ATOMIC, 30, 0, 0, null, null)))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("already exists");
    }

    @Test
    void create_atomic_returnsTotalDuration() {
        when(procedureRepository.existsByTenantIdAndCode(TENANT, "CONSULT")).thenReturn(false);
        when(procedureRepository.save(any(Procedure.class))).thenAnswer(inv -> inv.getArgument(0));

        ProcedureResponse response = procedureService.create(TENANT, new CreateProcedureRequest(
            "CONSULT", "Consultation", null, ProcedureType.ATOMIC, 30, 5, 5, "#00aa00", null));

        assertThat(response.totalDurationMinutes()).isEqualTo(40);
        assertThat(response.tenantId()).isEqualTo(TENANT);
        assertThat(response.active()).isTrue();
    }

    @Test
    void addChild_wouldCreateCycle_throwsValidationException() {
        Procedure parent = composite(1L);
        Procedure child = composite(2L);
        addChild(child, parent, 0);
        when(procedureRepository.findByIdAndTenantId(1L, TENANT)).thenReturn(Optional.of(parent));
        when(procedureRepository.findByIdAndTenantId(2L, TENANT)).thenReturn(Optional.of(child));

        assertThatThrownBy(() -> procedureService.addChild(TENANT, 1L, new ProcedureChildRequest(2L, null, 0)))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("circular");
    }

    @Test
    void addChild_inactiveChild_throwsInactiveResourceException() {
        Procedure parent = composite(1L);
        Procedure child = atomic(2L, 15);
        child.setActive(false);
        when(procedureRepository.findByIdAndTenantId(1L, TENANT)).thenReturn(Optional.of(parent));
        when(procedureRepository.findByIdAndTenantId(2L, TENANT)).thenReturn(Optional.of(child));

        assertThatThrownBy(() -> procedureService.addChild(TENANT, 1L, new ProcedureChildRequest(2L, null, 0)))
            .isInstanceOf(InactiveResourceException.class);
    }

    @Test
    void addRequirement_toComposite_throwsValidationException() {
        when(procedureRepository.findByIdAndTenantId(1L, TENANT)).thenReturn(Optional.of(composite(1L)));

        assertThatThrownBy(() -> procedureService.addRequirement(TENANT, 1L,
                new RequirementRequest(100L, 1, null, true, 0, null, null)))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("atomic");
    }

    @Test
    void addRequirement_offsetBeyondDuration_throwsValidationException() {
        when(procedureRepository.findByIdAndTenantId(1L, TENANT)).thenReturn(Optional.of(atomic(1L, 30)));
        when(resourceRoleRepository.findById(100L)).thenReturn(Optional.of(role(100L)));

        assertThatThrownBy(() -> procedureService.addRequirement(TENANT, 1L,
                new RequirementRequest(100L, 1, null, true, 10, 45, null)))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("exceeds the procedure duration");
    }

    @Test
    void addRequirement_minAboveMax_throwsValidationException() {
        when(procedureRepository.findByIdAndTenantId(1L, TENANT)).thenReturn(Optional.of(atomic(1L, 30)));
        when(resourceRoleRepository.findById(100L)).thenReturn(Optional.of(role(100L)));

        assertThatThrownBy(() -> procedureService.addRequirement(TENANT, 1L,
                new RequirementRequest(100L, 3, 2, true, null, null, null)))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("must not exceed");
    }

    @Test
    void get_otherTenant_throwsNotFound() {
        when(procedureRepository.findByIdAndTenantId(1L, "clinic-b")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> procedureService.get("clinic-b", 1L))
            .isInstanceOf(NotFoundException.class);
    }

    /** Composite (buffers 5/5) of prep (15 min, gap 5) then scan (30 min). Total 60. */
    private Procedure ultrasoundVisit() {
        Procedure prep = atomic(11L, 15);
        addRequirement(prep, 100L, 0, null);
        Procedure scan = atomic(12L, 30);
        addRequirement(scan, 200L, 10, 20);

        Procedure visit = composite(10L);
        visit.setBufferBeforeMinutes(5);
        visit.setBufferAfterMinutes(5);
        addChild(visit, prep, 5);
        addChild(visit, scan, 0);
        return visit;
    }

    private static Procedure atomic(Long id, int duration) {
        Procedure procedure = new Procedure();
        procedure.setId(id);
        procedure.setTenantId(TENANT);
        procedure.setCode("P" + id);
        procedure.setName("Procedure " + id);
        procedure.setProcedureType(ProcedureType.ATOMIC);
        procedure.setDurationMinutes(duration);
        return procedure;
    }

    private static Procedure composite(Long id) {
        Procedure procedure = new Procedure();
        procedure.setId(id);
        procedure.setTenantId(TENANT);
        procedure.setCode("C" + id);
        procedure.setName("Composite " + id);
        procedure.setProcedureType(ProcedureType.COMPOSITE);
        return procedure;
    }

    private static void addChild(Procedure parent, Procedure child, int gap) {
        ProcedureComposition composition = new ProcedureComposition();
        composition.setId(parent.getId() * 100 + parent.getChildren().size());
        composition.setParent(parent);
        composition.setChild(child);
        composition.setSequenceOrder(parent.getChildren().size());
        composition.setGapAfterMinutes(gap);
        parent.getChildren().add(composition);
    }

    private static void addRequirement(Procedure procedure, Long roleId, int offsetStart, Integer offsetEnd) {
        ProcedureRequirement requirement = new ProcedureRequirement();
        requirement.setId(procedure.getId() * 10);
        requirement.setProcedure(procedure);
        requirement.setRole(role(roleId));
        requirement.setOffsetStartMinutes(offsetStart);
        requirement.setOffsetEndMinutes(offsetEnd);
        procedure.getRequirements().add(requirement);
    }

    private static ResourceRole role(Long id) {
        ResourceRole role = new ResourceRole();
        role.setId(id);
        role.setCode("ROLE_" + id);
        role.setName("Role " + id);
        return role;
    }
}
