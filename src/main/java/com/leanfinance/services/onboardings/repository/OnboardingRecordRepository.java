package com.leanfinance.services.onboardings.repository;

import com.leanfinance.services.onboardings.constants.OnboardingStatus;
import com.leanfinance.services.onboardings.entity.OnboardingRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface OnboardingRecordRepository extends JpaRepository<OnboardingRecord, Long> {

    Optional<OnboardingRecord> findByDealId(String dealId);

    boolean existsByDealId(String dealId);

    List<OnboardingRecord> findByStatusInOrderByCreatedAtAsc(Collection<OnboardingStatus> statuses);

    List<OnboardingRecord> findByStatusOrderByCreatedAtAsc(OnboardingStatus status);
}
