package com.leanfinance.services.onboardings.entity;

import com.leanfinance.services.onboardings.constants.Department;
import com.leanfinance.services.onboardings.constants.OnboardingStatus;
import com.leanfinance.services.onboardings.constants.StepName;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(
        name = "onboardings",
        uniqueConstraints = {
                @UniqueConstraint(name = "uq_onboarding_deal", columnNames = "deal_id")
        },
        indexes = {
                @Index(name = "idx_onboarding_status", columnList = "status")
        }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OnboardingRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "deal_id", nullable = false, length = 50)
    private String dealId;

    @Column(name = "deal_name", nullable = false)
    private String dealName;

    @Column(name = "company_name", nullable = false)
    private String companyName;

    @Column(name = "service_name", nullable = false)
    private String serviceName;

    @Enumerated(EnumType.STRING)
    @Column(name = "department", length = 5)
    private Department department;

    @Column(name = "hubspot_owner_id", length = 50)
    private String hubspotOwnerId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "onboarding_technicians", joinColumns = @JoinColumn(name = "onboarding_id"))
    @OrderColumn(name = "position")
    @Builder.Default
    private List<TechnicianAssignment> technicians = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 30)
    @Builder.Default
    private OnboardingStatus status = OnboardingStatus.PENDING;

    @Enumerated(EnumType.STRING)
    @Column(name = "current_step", length = 50)
    private StepName currentStep;

    /** Why the record could not enter the pipeline (unknown service, no department). */
    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @Column(name = "created_at", nullable = false, updatable = false)
    @CreationTimestamp
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    @UpdateTimestamp
    private LocalDateTime updatedAt;

    // ════════════════════════════════════════════════════════════
    // STATE TRANSITIONS
    // ════════════════════════════════════════════════════════════

    public void markInProgress() {
        this.status = OnboardingStatus.IN_PROGRESS;
        this.lastError = null;
    }

    public void moveToStep(StepName step) {
        this.currentStep = step;
    }

    public void markFinished(boolean anyStepFailed) {
        this.status = anyStepFailed ? OnboardingStatus.FAILED : OnboardingStatus.COMPLETED;
        this.currentStep = null;
    }

    public void markFailed(String error) {
        this.status = OnboardingStatus.FAILED;
        this.lastError = error;
        this.currentStep = null;
    }

    public void markWaitingTechnician() {
        this.status = OnboardingStatus.WAITING_TECHNICIAN;
        this.currentStep = null;
    }

    public void resetToPending() {
        this.status = OnboardingStatus.PENDING;
        this.currentStep = null;
    }

    public void replaceTechnicians(List<TechnicianAssignment> assignments) {
        this.technicians.clear();
        this.technicians.addAll(assignments);
    }

    // ════════════════════════════════════════════════════════════
    // STATE QUERIES
    // ════════════════════════════════════════════════════════════

    public boolean isCompleted() {
        return status == OnboardingStatus.COMPLETED;
    }

    public boolean isPersisted() {
        return id != null;
    }
}
