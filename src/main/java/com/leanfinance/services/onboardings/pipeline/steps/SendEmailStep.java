package com.leanfinance.services.onboardings.pipeline.steps;

import com.leanfinance.services.onboardings.client.GmailClient;
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

import static org.springframework.web.util.HtmlUtils.htmlEscape;

/**
 * Onboarding email to the technician with links to the Drive folder, the
 * Holded contact and the HubSpot deal. Runs last so the links exist.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SendEmailStep extends PipelineStep {

    private static final String CELL = "padding: 8px; border: 1px solid #ddd;";

    private final GmailClient gmailClient;

    @Override
    public StepName name() {
        return StepName.SEND_EMAIL;
    }

    @Override
    public StepResult execute(StepContext ctx) {
        TeamMember technician = ctx.getTechnician();
        if (technician == null) {
            return StepResult.failure("No technician assigned");
        }
        if (technician.getEmail() == null || technician.getEmail().isBlank()) {
            return StepResult.failure("Technician " + technician.getFullName() + " has no email");
        }

        String subject = "Nuevo onboarding: " + ctx.getCompanyName() + " — " + ctx.getServiceName();
        String messageId = gmailClient.sendEmail(technician.getEmail(), subject, buildHtml(ctx));
        log.info("Onboarding email sent: dealId={}, to={}, messageId={}",
                ctx.getDealId(), technician.getEmail(), messageId);
        return StepResult.success(Map.of(OnboardingConstants.DATA_GMAIL_MESSAGE_ID, messageId));
    }

    static String buildHtml(StepContext ctx) {
        String departmentLabel = ctx.getDepartment() != null ? ctx.getDepartment().getLabel() : "";

        StringBuilder links = new StringBuilder();
        appendLink(links, "Google Drive", ctx.getDriveFolderUrl(), "Carpeta del cliente");
        appendLink(links, "Holded", ctx.getHoldedContactUrl(), "Ficha del contacto");
        appendLink(links, "HubSpot", ctx.hubspotDealUrl(), "Deal en HubSpot");

        return "<div style=\"font-family: Arial, sans-serif; max-width: 600px; margin: 0 auto;\">\n"
                + "<h2>Nuevo onboarding asignado</h2>\n"
                + "<p>Hola " + htmlEscape(ctx.getTechnician().greetingName()) + ",</p>\n"
                + "<p>Se te ha asignado un nuevo negocio. A continuación tienes los detalles:</p>\n"
                + "<table style=\"border-collapse: collapse; width: 100%; margin: 16px 0;\">\n"
                + row("Negocio", ctx.getDealName())
                + row("Empresa", ctx.getCompanyName())
                + row("Servicio", ctx.getServiceName())
                + row("Departamento", departmentLabel)
                + "</table>\n"
                + "<h3>Enlaces</h3>\n"
                + "<ul>\n" + links + "</ul>\n"
                + "<div style=\"background-color: #fff3cd; border: 1px solid #ffc107; border-radius: 4px; "
                + "padding: 12px; margin: 16px 0;\">\n"
                + "<strong>⚠️ Importante:</strong> La ficha del cliente en Holded se ha creado automáticamente "
                + "y <strong>no ha sido supervisada</strong>. Por favor, revisa que los datos sean correctos "
                + "antes de empezar a trabajar.\n"
                + "</div>\n"
                + "<p style=\"color: #666; font-size: 12px; margin-top: 24px;\">"
                + "Este email ha sido enviado automáticamente por el sistema de onboardings de LeanFinance.</p>\n"
                + "</div>\n";
    }

    private static String row(String label, String value) {
        return "<tr><td style=\"" + CELL + " font-weight: bold;\">" + label + "</td>"
                + "<td style=\"" + CELL + "\">" + htmlEscape(value == null ? "" : value) + "</td></tr>\n";
    }

    private static void appendLink(StringBuilder links, String label, String url, String text) {
        if (url == null) return;
        links.append("<li><strong>").append(label).append(":</strong> <a href=\"")
                .append(htmlEscape(url)).append("\">").append(text).append("</a></li>\n");
    }
}
