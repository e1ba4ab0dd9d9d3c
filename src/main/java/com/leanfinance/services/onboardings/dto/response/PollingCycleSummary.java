package com.leanfinance.services.onboardings.dto.response;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.*;

/**
 * Counters of one polling cycle
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Schema(description = "Outcome of one polling cycle")
public class PollingCycleSummary {

    @Schema(description = "New won deals detected")
    private int newDeals;

    @Schema(description = "New deals whose processing threw")
    private int newDealErrors;

    @Schema(description = "Pending records picked up again")
    private int retried;

    @Schema(description = "Pending records skipped because they could not be re-enriched or threw")
    private int retrySkipped;

    @Schema(description = "FAILED records listed in the summary email")
    private int failed;

    @Schema(description = "Whether the failure summary email went out")
    private boolean summaryEmailSent;
}
