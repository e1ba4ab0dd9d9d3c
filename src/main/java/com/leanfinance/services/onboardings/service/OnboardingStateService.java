package com.leanfinance.services.onboardings.service;

import com.leanfinance.services.onboardings.constants.Department;
import com.leanfinance.services.onboardings.constants.OnboardingStatus;
import com.leanfinance.services.onboardings.constants.StepName;
import com.leanfinance.services.onboardings.dto.deal.EnrichedDeal;
import com.leanfinance.services.onboardings.entity.OnboardingRecord;
import com.leanfinance.services.onboardings.entity.StepRecord;
import com.leanfinance.services.onboardings.entity.TechnicianAssignment;
import com.leanfinance.services.onboardings.exception.InvalidRequestException;
import com.leanfinance.services.onboardings.exception.OnboardingNotFoundException;
import com.leanfinance.services.onboardings.repository.OnboardingRecordRepository;
import com.leanfinance.services.onboardings.repository.StepRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

/**
 * Every write to the onboarding tables goes through here, one transaction per
 * call. A crash mid-pipeline leaves everything written so far committed, and
 * the next cycle resumes from it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OnboardingStateService {

    private final OnboardingRecordRepository recordRepository;
    private final StepRecordRepository stepRepository;

    // ════════════════════════════════════════════════════════════
    // CREATE
    // ════════════════════════════════════════════════════════════

    /**
     * Creates the record for a deal. If another writer created it first, the
     * existing record is returned unchanged.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public OnboardingRecord createRecord(EnrichedDeal deal, Department department,
                                         List<TechnicianAssignment> technicians,
                                         OnboardingStatus status, String lastError) {
        Optional<OnboardingRecord> existing = recordRepository.findByDealId(deal.getDealId());
        if (existing.isPresent()) {
            log.info("Onboarding already exists for dealId={} (id={})", deal.getDealId(), existing.get().getId());
            return existing.get();
        }

        OnboardingRecord record = OnboardingRecord.builder()
                .dealId(deal.getDealId())
                .dealName(deal.getDealName())
                .companyName(deal.getCompanyName())
                .serviceName(deal.getServiceName())
                .hubspotOwnerId(deal.getHubspotOwnerId())
                .department(department)
                .status(status)
                .lastError(lastError)
                .build();
        record.replaceTechnicians(technicians);

        try {
            OnboardingRecord saved = recordRepository.saveAndFlush(record);
            log.info("Onboarding {} created for dealId={} → {}", saved.getId(), deal.getDealId(), status);
            return saved;
        } catch (DataIntegrityViolationException ex) {
            log.warn("Race creating onboarding for dealId={}, returning the winner", deal.getDealId());
            return recordRepository.findByDealId(deal.getDealId())
                    .orElseThrow(() -> ex);
        }
    }

    // ════════════════════════════════════════════════════════════
    // RECORD TRANSITIONS
    // ════════════════════════════════════════════════════════════

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public OnboardingRecord markInProgress(Long id) {
        OnboardingRecord record = findOrThrow(id);
        record.markInProgress();
        log.info("Onboarding {} → IN_PROGRESS", id);
        return recordRepository.save(record);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void moveToStep(Long id, StepName step) {
        OnboardingRecord record = findOrThrow(id);
        record.moveToStep(step);
        recordRepository.save(record);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public OnboardingRecord finishPipeline(Long id, boolean anyStepFailed) {
        OnboardingRecord record = findOrThrow(id);
        record.markFinished(anyStepFailed);
        OnboardingRecord saved = recordRepository.save(record);
        log.info("Onboarding {} → {}", id, saved.getStatus());
        return saved;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public OnboardingRecord markFailed(Long id, String error) {
        OnboardingRecord record = findOrThrow(id);
        record.markFailed(error);
        log.info("Onboarding {} → FAILED: {}", id, error);
        return recordRepository.save(record);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public OnboardingRecord markWaitingTechnician(Long id, Department department,
                                                  List<TechnicianAssignment> technicians) {
        OnboardingRecord record = findOrThrow(id);
        record.setDepartment(department);
        record.replaceTechnicians(technicians);
        record.markWaitingTechnician();
        log.info("Onboarding {} → WAITING_TECHNICIAN (department={})", id, department);
        return recordRepository.save(record);
    }

    /** Refreshes department and technicians of a record that is about to run again. */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public OnboardingRecord assignResolution(Long id, Department department,
                                             List<TechnicianAssignment> technicians) {
        OnboardingRecord record = findOrThrow(id);
        record.setDepartment(department);
        record.replaceTechnicians(technicians);
        return recordRepository.save(record);
    }

    /** Puts a FAILED onboarding back to PENDING so the next cycle runs it again. */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public OnboardingRecord resetForRetry(String dealId) {
        OnboardingRecord record = recordRepository.findByDealId(dealId)
                .orElseThrow(() -> OnboardingNotFoundException.withDealId(dealId));
        if (record.getStatus() != OnboardingStatus.FAILED) {
            throw InvalidRequestException.notRetryable(dealId, record.getStatus().name());
        }
        record.resetToPending();
        log.info("Onboarding {} (dealId={}) reset FAILED → PENDING", record.getId(), dealId);
        return recordRepository.save(record);
    }

    // ════════════════════════════════════════════════════════════
    // STEP PERSISTENCE
    // ════════════════════════════════════════════════════════════

    /**
     * Insert-or-update keyed on (onboardingId, stepName). Losing an insert
     * race against the unique constraint falls back to updating the winner.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public StepRecord upsertStep(StepRecord step) {
        Optional<StepRecord> existing =
                stepRepository.findByOnboardingIdAndStepName(step.getOnboardingId(), step.getStepName());
        if (existing.isPresent()) {
            StepRecord row = existing.get();
            row.copyStateFrom(step);
            log.debug("Onboarding {} — step {} → {}", step.getOnboardingId(), step.getStepName(), step.getStatus());
            return stepRepository.save(row);
        }

        try {
            StepRecord saved = stepRepository.saveAndFlush(step);
            log.debug("Onboarding {} — step {} created as {}",
                    step.getOnboardingId(), step.getStepName(), step.getStatus());
            return saved;
        } catch (DataIntegrityViolationException ex) {
            StepRecord row = stepRepository.findByOnboardingIdAndStepName(step.getOnboardingId(), step.getStepName())
                    .orElseThrow(() -> ex);
            row.copyStateFrom(step);
            return stepRepository.save(row);
        }
    }

    // ════════════════════════════════════════════════════════════
    // QUERIES
    // ════════════════════════════════════════════════════════════

    @Transactional(readOnly = true)
    public Optional<OnboardingRecord> findByDealId(String dealId) {
        return recordRepository.findByDealId(dealId);
    }

    @Transactional(readOnly = true)
    public boolean existsByDealId(String dealId) {
        return recordRepository.existsByDealId(dealId);
    }

    /** PENDING, WAITING_TECHNICIAN and IN_PROGRESS records, oldest first. */
    @Transactional(readOnly = true)
    public List<OnboardingRecord> listPending() {
        return recordRepository.findByStatusInOrderByCreatedAtAsc(EnumSet.of(
                OnboardingStatus.PENDING, OnboardingStatus.WAITING_TECHNICIAN, OnboardingStatus.IN_PROGRESS));
    }

    @Transactional(readOnly = true)
    public List<OnboardingRecord> listFailed() {
        return listByStatus(OnboardingStatus.FAILED);
    }

    @Transactional(readOnly = true)
    public List<OnboardingRecord> listByStatus(OnboardingStatus status) {
        return recordRepository.findByStatusOrderByCreatedAtAsc(status);
    }

    @Transactional(readOnly = true)
    public List<StepRecord> findSteps(Long onboardingId) {
        return stepRepository.findByOnboardingIdOrderByIdAsc(onboardingId);
    }

    private OnboardingRecord findOrThrow(Long id) {
        return recordRepository.findById(id)
                .orElseThrow(() -> OnboardingNotFoundException.withId(id));
    }
}
