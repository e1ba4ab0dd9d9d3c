package com.leanfinance.services.onboardings.client;

import com.leanfinance.services.onboardings.constants.Department;
import com.leanfinance.services.onboardings.dto.directory.ServiceEntry;
import com.leanfinance.services.onboardings.dto.directory.TeamMember;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns raw rows of the directory spreadsheet into typed entries.
 * The first row of each range is the header and is skipped; row numbers in
 * the logs are 1-based like in the sheet.
 *
 * usuarios: hubspot_tec_id | slack_id | email | full name | short name | dept | responsible
 * servicios: name | tags | dept
 */
@Slf4j
public final class SheetRowMapper {

    private static final int MEMBER_MIN_COLUMNS = 6;

    private SheetRowMapper() {
    }

    public static List<TeamMember> toTeamMembers(List<List<String>> rows) {
        List<TeamMember> members = new ArrayList<>();
        if (rows == null || rows.isEmpty()) return members;

        for (int i = 1; i < rows.size(); i++) {
            List<String> row = rows.get(i);
            int rowNumber = i + 1;
            if (row == null || row.size() < MEMBER_MIN_COLUMNS) {
                log.warn("Skipping usuarios row {}: only {} columns", rowNumber, row == null ? 0 : row.size());
                continue;
            }

            String deptCode = cell(row, 5);
            if (!Department.isKnownCode(deptCode)) {
                log.warn("Skipping usuarios row {}: unknown department '{}'", rowNumber, deptCode);
                continue;
            }

            members.add(TeamMember.builder()
                    .hubspotTecId(emptyToNull(cell(row, 0)))
                    .slackId(emptyToNull(cell(row, 1)))
                    .email(cell(row, 2))
                    .fullName(cell(row, 3))
                    .shortName(cell(row, 4))
                    .department(Department.fromCode(deptCode))
                    // checkbox column: TRUE / FALSE / empty
                    .responsible("TRUE".equalsIgnoreCase(cell(row, 6)))
                    .build());
        }
        return members;
    }

    public static List<ServiceEntry> toServices(List<List<String>> rows) {
        List<ServiceEntry> services = new ArrayList<>();
        if (rows == null || rows.isEmpty()) return services;

        for (int i = 1; i < rows.size(); i++) {
            List<String> row = rows.get(i);
            String name = row == null ? "" : cell(row, 0);
            if (name.isEmpty()) continue;

            Department department = null;
            String deptCode = cell(row, 2);
            if (!deptCode.isEmpty()) {
                if (Department.isKnownCode(deptCode)) {
                    department = Department.fromCode(deptCode);
                } else {
                    log.warn("servicios row {} ({}): unknown department '{}', left unassigned",
                            i + 1, name, deptCode);
                }
            }

            services.add(ServiceEntry.builder()
                    .name(name)
                    .tags(emptyToNull(cell(row, 1)))
                    .department(department)
                    .build());
        }
        return services;
    }

    private static String cell(List<String> row, int index) {
        if (index >= row.size() || row.get(index) == null) return "";
        return row.get(index).trim();
    }

    private static String emptyToNull(String value) {
        return value.isEmpty() ? null : value;
    }
}
