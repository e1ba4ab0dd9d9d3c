package com.leanfinance.services.onboardings.pipeline.steps;

import com.leanfinance.services.onboardings.client.GmailClient;
import com.leanfinance.services.onboardings.constants.Department;
import com.leanfinance.services.onboardings.dto.directory.TeamMember;
import com.leanfinance.services.onboardings.pipeline.StepContext;
import com.leanfinance.services.onboardings.pipeline.StepResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SendEmailStepTest {

    private static final TeamMember TECHNICIAN = TeamMember.builder()
            .email("ana@leanfinance.es")
            .shortName("Ana")
            .fullName("Ana García")
            .build();

    @Mock
    private GmailClient gmailClient;

    @InjectMocks
    private SendEmailStep step;

    @Test
    void run_emailsTechnician() {
        when(gmailClient.sendEmail(eq("ana@leanfinance.es"), eq("Nuevo onboarding: ACME SL — ENISA"), anyString()))
                .thenReturn("msg-1");

        StepResult result = step.run(ctx(TECHNICIAN, "12345"));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getData()).containsEntry("gmail_message_id", "msg-1");
    }

    @Test
    void run_withoutTechnician_isDeclaredFailure() {
        StepResult result = step.run(ctx(null, "12345"));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).isEqualTo("No technician assigned");
        verifyNoInteractions(gmailClient);
    }

    @Test
    void buildHtml_linksCreatedArtifactsAndWarnsAboutHolded() {
        StepContext ctx = ctx(TECHNICIAN, "12345");
        ctx.setDriveFolderUrl("https://drive.google.com/drive/folders/F1");
        ctx.setHoldedContactUrl("https://app.holded.com/contacts/H1");

        String html = SendEmailStep.buildHtml(ctx);

        assertThat(html)
                .contains("Hola Ana")
                .contains("https://drive.google.com/drive/folders/F1")
                .contains("https://app.holded.com/contacts/H1")
                .contains("https://app.hubspot.com/contacts/12345/deal/D1")
                .contains("no ha sido supervisada");
    }

    @Test
    void buildHtml_withoutPortalId_omitsHubSpotLink() {
        String html = SendEmailStep.buildHtml(ctx(TECHNICIAN, null));

        assertThat(html).doesNotContain("app.hubspot.com");
    }

    private static StepContext ctx(TeamMember technician, String portalId) {
        return StepContext.builder()
                .dealId("D1")
                .dealName("ACME SL - ENISA")
                .companyName("ACME SL")
                .serviceName("ENISA")
                .department(Department.SU)
                .technician(technician)
                .hubspotPortalId(portalId)
                .build();
    }
}
