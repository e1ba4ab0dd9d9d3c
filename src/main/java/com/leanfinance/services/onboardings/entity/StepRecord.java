package com.leanfinance.services.onboardings.entity;

import com.leanfinance.services.onboardings.constants.StepName;
import com.leanfinance.services.onboardings.constants.StepStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Progress of one step of one onboarding. Upserted on (onboarding_id, step_name).
 */
@Entity
@Table(
        name = "onboarding_steps",
        uniqueConstraints = {
                @UniqueConstraint(name = "uq_onboarding_step", columnNames = {"onboarding_id", "step_name"})
        }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StepRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "onboarding_id", nullable = false)
    private Long onboardingId;

    @Enumerated(EnumType.STRING)
    @Column(name = "step_name", nullable = false, length = 50)
    private StepName stepName;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    @Builder.Default
    private StepStatus status = StepStatus.PENDING;

    /** JSON-serialized step payload. */
    @Column(name = "result_data", columnDefinition = "TEXT")
    private String resultData;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "started_at")
    private LocalDateTime startedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    /** Copies the mutable state of {@code source} onto this row, keeping identity. */
    public void copyStateFrom(StepRecord source) {
        this.status = source.getStatus();
        this.resultData = source.getResultData();
        this.errorMessage = source.getErrorMessage();
        this.startedAt = source.getStartedAt();
        this.completedAt = source.getCompletedAt();
    }
}
