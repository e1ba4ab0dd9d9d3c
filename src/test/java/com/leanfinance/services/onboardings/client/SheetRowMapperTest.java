package com.leanfinance.services.onboardings.client;

import com.leanfinance.services.onboardings.constants.Department;
import com.leanfinance.services.onboardings.dto.directory.ServiceEntry;
import com.leanfinance.services.onboardings.dto.directory.TeamMember;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SheetRowMapperTest {

    private static final List<String> USERS_HEADER =
            List.of("hubspot_tec_id", "slack_id", "email", "nombre", "corto", "depto", "responsable");
    private static final List<String> SERVICES_HEADER = List.of("servicio", "tags", "depto");

    @Test
    void toTeamMembers_skipsHeaderShortRowsAndUnknownDepartments() {
        List<List<String>> rows = List.of(
                USERS_HEADER,
                List.of("101", "U01", "ana@lf.es", "Ana García", "Ana", "fi", "TRUE"),
                List.of("102", "", "luis@lf.es", "Luis Pérez", "Luis", "SU"),
                List.of("103", "U03", "short@lf.es"),
                List.of("104", "U04", "x@lf.es", "X", "X", "ZZ", "FALSE"));

        List<TeamMember> members = SheetRowMapper.toTeamMembers(rows);

        assertThat(members).hasSize(2);

        TeamMember ana = members.get(0);
        assertThat(ana.getHubspotTecId()).isEqualTo("101");
        assertThat(ana.getDepartment()).isEqualTo(Department.FI);
        assertThat(ana.isResponsible()).isTrue();

        TeamMember luis = members.get(1);
        assertThat(luis.getSlackId()).isNull();
        assertThat(luis.hasSlackId()).isFalse();
        assertThat(luis.isResponsible()).isFalse();
    }

    @Test
    void toServices_keepsEntryWithUnknownDepartmentUnassigned() {
        List<List<String>> rows = List.of(
                SERVICES_HEADER,
                List.of("ENISA", "financiacion", "SU"),
                List.of("Diseño web", "", "XX"),
                List.of("", "ignored", "FI"),
                List.of("Nómina"));

        List<ServiceEntry> services = SheetRowMapper.toServices(rows);

        assertThat(services).extracting(ServiceEntry::getName)
                .containsExactly("ENISA", "Diseño web", "Nómina");
        assertThat(services.get(0).getDepartment()).isEqualTo(Department.SU);
        assertThat(services.get(0).getTags()).isEqualTo("financiacion");
        assertThat(services.get(1).getDepartment()).isNull();
        assertThat(services.get(2).getDepartment()).isNull();
    }

    @Test
    void emptyRanges_giveEmptyLists() {
        assertThat(SheetRowMapper.toTeamMembers(List.of())).isEmpty();
        assertThat(SheetRowMapper.toServices(List.of(SERVICES_HEADER))).isEmpty();
    }
}
