package com.leanfinance.services.onboardings.repository;

import com.leanfinance.services.onboardings.constants.StepName;
import com.leanfinance.services.onboardings.entity.StepRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface StepRecordRepository extends JpaRepository<StepRecord, Long> {

    Optional<StepRecord> findByOnboardingIdAndStepName(Long onboardingId, StepName stepName);

    List<StepRecord> findByOnboardingIdOrderByIdAsc(Long onboardingId);
}
