package com.leanfinance.services.onboardings.pipeline.steps;

import com.leanfinance.services.onboardings.client.HoldedClient;
import com.leanfinance.services.onboardings.client.HubSpotClient;
import com.leanfinance.services.onboardings.dto.deal.CompanyInfo;
import com.leanfinance.services.onboardings.dto.deal.ContactPersonInfo;
import com.leanfinance.services.onboardings.pipeline.StepContext;
import com.leanfinance.services.onboardings.pipeline.StepResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CreateHoldedContactStepTest {

    @Mock
    private HoldedClient holdedClient;
    @Mock
    private HubSpotClient hubSpotClient;

    @InjectMocks
    private CreateHoldedContactStep step;

    private final ContactPersonInfo contact = ContactPersonInfo.builder()
            .firstName("Laura")
            .lastName("Ruiz")
            .email("laura@acme.es")
            .mobilePhone("600000000")
            .jobTitle("CEO")
            .build();

    @Test
    void run_existingHoldedId_skipsWithoutCallingHolded() {
        StepContext ctx = ctx(CompanyInfo.builder().hubspotId("C1").holdedId("H1").build());

        StepResult result = step.run(ctx);

        assertThat(result.isSkipped()).isTrue();
        assertThat(result.getData()).containsEntry("holded_contact_id", "H1");
        assertThat(ctx.getHoldedContactUrl()).isEqualTo("https://app.holded.com/contacts/H1");
        verifyNoInteractions(holdedClient, hubSpotClient);
    }

    @Test
    void run_createsContactAndWritesIdBack() {
        StepContext ctx = ctx(CompanyInfo.builder()
                .hubspotId("C1")
                .name("ACME SL")
                .nif("B12345678")
                .country("Portugal")
                .website("acme.es")
                .build());
        when(holdedClient.createContact(anyMap())).thenReturn("H2");

        StepResult result = step.run(ctx);

        assertThat(result.isSuccess()).isTrue();
        assertThat(ctx.getHoldedContactId()).isEqualTo("H2");
        verify(hubSpotClient).updateCompany("C1", Map.of("tl_holded_id", "H2"));
    }

    @Test
    void run_withoutCompany_isDeclaredFailure() {
        StepResult result = step.run(ctx(null));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).isEqualTo("No company data to create the Holded contact");
        verify(holdedClient, never()).createContact(anyMap());
    }

    @Test
    @SuppressWarnings("unchecked")
    void buildPayload_fallsBackToContactEmailAndMapsCountry() {
        StepContext ctx = ctx(CompanyInfo.builder()
                .hubspotId("C1")
                .name("ACME SL")
                .nif("B12345678")
                .country("Portugal")
                .build());

        Map<String, Object> payload = step.buildPayload(ctx);

        assertThat(payload)
                .containsEntry("name", "ACME SL")
                .containsEntry("type", "client")
                .containsEntry("code", "B12345678")
                .containsEntry("email", "laura@acme.es");
        assertThat((Map<String, Object>) payload.get("billAddress")).containsEntry("countryCode", "PT");
        Map<String, Object> person = ((List<Map<String, Object>>) payload.get("contactPersons")).get(0);
        assertThat(person)
                .containsEntry("name", "Laura Ruiz")
                .containsEntry("phone", "600000000");
    }

    @Test
    void countryCode_defaultsToSpain() {
        assertThat(CreateHoldedContactStep.countryCode(null)).isEqualTo("ES");
        assertThat(CreateHoldedContactStep.countryCode("Narnia")).isEqualTo("ES");
        assertThat(CreateHoldedContactStep.countryCode(" France ")).isEqualTo("FR");
    }

    private StepContext ctx(CompanyInfo company) {
        return StepContext.builder()
                .dealId("D1")
                .companyName("ACME SL")
                .company(company)
                .contact(contact)
                .build();
    }
}
