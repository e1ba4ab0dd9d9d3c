package com.leanfinance.services.onboardings.pipeline.steps;

import com.leanfinance.services.onboardings.client.SlackClient;
import com.leanfinance.services.onboardings.constants.OnboardingConstants;
import com.leanfinance.services.onboardings.constants.StepName;
import com.leanfinance.services.onboardings.dto.directory.TeamMember;
import com.leanfinance.services.onboardings.pipeline.PipelineStep;
import com.leanfinance.services.onboardings.pipeline.StepContext;
import com.leanfinance.services.onboardings.pipeline.StepResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Slack DM telling the technician about the new client.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class NotifySlackStep extends PipelineStep {

    private final SlackClient slackClient;

    @Override
    public StepName name() {
        return StepName.NOTIFY_SLACK;
    }

    @Override
    public StepResult execute(StepContext ctx) {
        TeamMember technician = ctx.getTechnician();
        if (technician == null || !technician.hasSlackId()) {
            return StepResult.failure("Technician has no Slack id");
        }

        String ts = slackClient.sendDirectMessage(technician.getSlackId(), buildMessage(ctx));
        log.info("Technician notified on Slack: dealId={}, technician={}, ts={}",
                ctx.getDealId(), technician.getShortName(), ts);
        return StepResult.success(Map.of(OnboardingConstants.DATA_SLACK_MESSAGE_TS, ts));
    }

    static String buildMessage(StepContext ctx) {
        return "Hola " + ctx.getTechnician().greetingName() + " 👋\n\n"
                + "Se te ha asignado un nuevo negocio: *" + ctx.getDealName() + "*\n"
                + "Empresa: *" + ctx.getCompanyName() + "*\n"
                + "Servicio: *" + ctx.getServiceName() + "*\n\n"
                + "Revisa tu bandeja de entrada de email para más información.";
    }
}
