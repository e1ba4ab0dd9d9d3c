package com.leanfinance.services.onboardings.pipeline;

import com.leanfinance.services.onboardings.pipeline.steps.CreateDriveFolderStep;
import com.leanfinance.services.onboardings.pipeline.steps.CreateHoldedContactStep;
import com.leanfinance.services.onboardings.pipeline.steps.NotifySlackStep;
import com.leanfinance.services.onboardings.pipeline.steps.SendEmailStep;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * The fixed step sequence of an onboarding:
 * drive folder → Holded contact → Slack DM → email.
 */
@Component
public class OnboardingPipeline {

    private final List<PipelineStep> steps;

    public OnboardingPipeline(CreateDriveFolderStep createDriveFolder,
                              CreateHoldedContactStep createHoldedContact,
                              NotifySlackStep notifySlack,
                              SendEmailStep sendEmail) {
        this.steps = List.of(createDriveFolder, createHoldedContact, notifySlack, sendEmail);
    }

    public List<PipelineStep> steps() {
        return steps;
    }
}
