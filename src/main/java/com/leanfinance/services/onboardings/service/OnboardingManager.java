package com.leanfinance.services.onboardings.service;

import com.leanfinance.services.onboardings.client.SlackClient;
import com.leanfinance.services.onboardings.config.OnboardingConfig;
import com.leanfinance.services.onboardings.constants.Department;
import com.leanfinance.services.onboardings.constants.OnboardingStatus;
import com.leanfinance.services.onboardings.dto.deal.EnrichedDeal;
import com.leanfinance.services.onboardings.dto.deal.TechnicianInfo;
import com.leanfinance.services.onboardings.dto.directory.TeamMember;
import com.leanfinance.services.onboardings.entity.OnboardingRecord;
import com.leanfinance.services.onboardings.entity.TechnicianAssignment;
import com.leanfinance.services.onboardings.exception.DepartmentNotAssignedException;
import com.leanfinance.services.onboardings.exception.ServiceNotFoundException;
import com.leanfinance.services.onboardings.pipeline.OnboardingPipeline;
import com.leanfinance.services.onboardings.pipeline.PipelineEngine;
import com.leanfinance.services.onboardings.pipeline.StepContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * ══════════════════════════════════════════════════════════════════
 * Onboarding Manager
 * ══════════════════════════════════════════════════════════════════
 *
 * Decides what happens to one enriched deal:
 *
 *   COMPLETED already          → returned untouched
 *   service/department unknown → FAILED, no pipeline
 *   no technician resolved     → WAITING_TECHNICIAN + Slack DM to the responsible
 *   otherwise                  → pipeline run
 *
 * Technician resolution:
 *   - departments with *_asignado properties (SU, FI, AS, LA): first deal
 *     candidate read from one of those properties, looked up in the
 *     department's directory. Not in the directory → unresolved.
 *   - other departments (LE, DA, DI): the department responsible.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OnboardingManager {

    private final OnboardingStateService stateService;
    private final ServiceMapper serviceMapper;
    private final PipelineEngine pipelineEngine;
    private final OnboardingPipeline pipeline;
    private final SlackClient slackClient;
    private final OnboardingConfig config;

    public OnboardingRecord processDeal(EnrichedDeal deal) {
        Optional<OnboardingRecord> existing = stateService.findByDealId(deal.getDealId());
        if (existing.isPresent() && existing.get().isCompleted()) {
            log.info("Onboarding for dealId={} already COMPLETED, nothing to do", deal.getDealId());
            return existing.get();
        }

        // 1. Department
        Department department;
        try {
            department = serviceMapper.resolveDepartment(deal.getServiceName());
        } catch (ServiceNotFoundException ex) {
            return fail(deal, existing,
                    "Servicio no encontrado en la Sheet: '" + deal.getServiceName() + "'");
        } catch (DepartmentNotAssignedException ex) {
            return fail(deal, existing,
                    "Servicio sin departamento asignado: '" + deal.getServiceName() + "'");
        }

        List<TechnicianAssignment> relevant = relevantTechnicians(deal, department);

        // 2. Technician
        Optional<TeamMember> technician = resolveTechnician(deal, department);
        if (technician.isEmpty()) {
            OnboardingRecord waiting = existing
                    .map(r -> stateService.markWaitingTechnician(r.getId(), department, relevant))
                    .orElseGet(() -> stateService.createRecord(
                            deal, department, relevant, OnboardingStatus.WAITING_TECHNICIAN, null));
            notifyResponsible(deal, department);
            return waiting;
        }

        // 3. Pipeline
        OnboardingRecord record = existing
                .map(r -> stateService.assignResolution(r.getId(), department, relevant))
                .orElseGet(() -> stateService.createRecord(
                        deal, department, relevant, OnboardingStatus.PENDING, null));

        StepContext ctx = StepContext.from(deal, department, technician.get(), config.getHubspotPortalId());
        log.info("Running pipeline for dealId={} (department={}, technician={})",
                deal.getDealId(), department, technician.get().getEmail());
        return pipelineEngine.run(record, ctx, pipeline.steps());
    }

    // ════════════════════════════════════════════════════════════
    // TECHNICIAN RESOLUTION
    // ════════════════════════════════════════════════════════════

    Optional<TeamMember> resolveTechnician(EnrichedDeal deal, Department department) {
        if (!department.hasTechnicianProperties()) {
            return serviceMapper.responsible(department);
        }

        Optional<TechnicianInfo> candidate = deal.getTechnicians().stream()
                .filter(t -> department.getTechnicianProperties().contains(t.propertyName()))
                .findFirst();
        if (candidate.isEmpty()) {
            log.info("Deal {} has no technician assigned for department {}", deal.getDealId(), department);
            return Optional.empty();
        }

        String tecId = candidate.get().hubspotTecId();
        Optional<TeamMember> member = serviceMapper.teamMembers(department).stream()
                .filter(m -> tecId.equals(m.getHubspotTecId()))
                .findFirst();
        if (member.isEmpty()) {
            log.warn("Technician {} ({}) of deal {} is not in the {} directory",
                    tecId, candidate.get().propertyName(), deal.getDealId(), department);
        }
        return member;
    }

    private static List<TechnicianAssignment> relevantTechnicians(EnrichedDeal deal, Department department) {
        return deal.getTechnicians().stream()
                .filter(t -> department.getTechnicianProperties().contains(t.propertyName()))
                .map(t -> new TechnicianAssignment(t.hubspotTecId(), t.propertyName()))
                .toList();
    }

    // ════════════════════════════════════════════════════════════
    // OUTCOMES
    // ════════════════════════════════════════════════════════════

    private OnboardingRecord fail(EnrichedDeal deal, Optional<OnboardingRecord> existing, String error) {
        log.warn("Deal {} cannot be onboarded: {}", deal.getDealId(), error);
        if (existing.isPresent()) {
            return stateService.markFailed(existing.get().getId(), error);
        }
        return stateService.createRecord(deal, null, List.of(), OnboardingStatus.FAILED, error);
    }

    private void notifyResponsible(EnrichedDeal deal, Department department) {
        Optional<TeamMember> responsible = serviceMapper.responsible(department);
        if (responsible.isEmpty() || !responsible.get().hasSlackId()) {
            log.warn("Cannot notify missing technician for deal {}: no responsible with Slack id in {}",
                    deal.getDealId(), department);
            return;
        }

        try {
            slackClient.sendDirectMessage(responsible.get().getSlackId(), waitingMessage(deal, department));
            log.info("Responsible {} notified about deal {} waiting for a technician",
                    responsible.get().getEmail(), deal.getDealId());
        } catch (RuntimeException ex) {
            log.error("Failed to notify responsible about deal {}: {}", deal.getDealId(), ex.getMessage());
        }
    }

    static String waitingMessage(EnrichedDeal deal, Department department) {
        return "⚠️ Nuevo negocio sin técnico asignado:\n"
                + "*" + deal.getDealName() + "*\n"
                + "Empresa: *" + deal.getCompanyName() + "*\n"
                + "Servicio: *" + deal.getServiceName() + "*\n"
                + "Departamento: *" + department.getLabel() + "*\n\n"
                + "Por favor, asigna un técnico en HubSpot.";
    }
}
