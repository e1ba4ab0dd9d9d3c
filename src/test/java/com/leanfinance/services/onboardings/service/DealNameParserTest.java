package com.leanfinance.services.onboardings.service;

import com.leanfinance.services.onboardings.exception.DealNameParseException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DealNameParserTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "ACME SL - ENISA            | ACME SL | ENISA",
            "ACME SL -ENISA             | ACME SL | ENISA",
            "ACME SL- ENISA             | ACME SL | ENISA",
            "ACME SL-ENISA              | ACME SL | ENISA",
            "  ACME SL  -  CFO externo  | ACME SL | CFO externo"
    })
    void parse_acceptsEverySeparatorVariant(String dealName, String company, String service) {
        DealNameParser.ParsedDealName parsed = DealNameParser.parse(dealName);

        assertThat(parsed.companyName()).isEqualTo(company);
        assertThat(parsed.serviceName()).isEqualTo(service);
    }

    @Test
    void parse_splitsOnFirstSeparatorOnly() {
        DealNameParser.ParsedDealName parsed = DealNameParser.parse("EMPRESA - ENISA - NEXT");

        assertThat(parsed.companyName()).isEqualTo("EMPRESA");
        assertThat(parsed.serviceName()).isEqualTo("ENISA - NEXT");
    }

    @Test
    void parse_prefersSpacedSeparatorOverBareHyphen() {
        DealNameParser.ParsedDealName parsed = DealNameParser.parse("Coca-Cola - Asesoría fiscal");

        assertThat(parsed.companyName()).isEqualTo("Coca-Cola");
        assertThat(parsed.serviceName()).isEqualTo("Asesoría fiscal");
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"ACME SL", "ACME SL - ", " - ENISA", "-", "   "})
    void parse_rejectsNamesWithoutTwoParts(String dealName) {
        assertThatThrownBy(() -> DealNameParser.parse(dealName))
                .isInstanceOf(DealNameParseException.class);
    }
}
