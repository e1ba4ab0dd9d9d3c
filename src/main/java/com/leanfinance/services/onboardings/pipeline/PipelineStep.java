package com.leanfinance.services.onboardings.pipeline;

import com.leanfinance.services.onboardings.constants.StepName;

/**
 * One provisioning step of an onboarding.
 *
 * {@link #execute} reports expected problems (missing data, no Slack id) as a
 * failed {@link StepResult}. Exceptions are left for faults nobody planned
 * for; the engine records both the same way.
 */
public abstract class PipelineStep {

    public abstract StepName name();

    /**
     * True when an earlier run already did this step's work. Implementations
     * that return true must also fill in the context fields later steps read.
     */
    public boolean checkAlreadyDone(StepContext ctx) {
        return false;
    }

    public abstract StepResult execute(StepContext ctx);

    public final StepResult run(StepContext ctx) {
        if (checkAlreadyDone(ctx)) {
            return skippedResult(ctx);
        }
        return execute(ctx);
    }

    /** Payload stored on the SKIPPED step record. */
    protected StepResult skippedResult(StepContext ctx) {
        return StepResult.skipped();
    }
}
