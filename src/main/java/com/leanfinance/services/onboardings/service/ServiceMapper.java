package com.leanfinance.services.onboardings.service;

import com.leanfinance.services.onboardings.client.GoogleSheetsClient;
import com.leanfinance.services.onboardings.constants.Department;
import com.leanfinance.services.onboardings.dto.directory.ServiceEntry;
import com.leanfinance.services.onboardings.dto.directory.TeamMember;
import com.leanfinance.services.onboardings.exception.DepartmentNotAssignedException;
import com.leanfinance.services.onboardings.exception.ServiceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Service → department mapping and staff lookups, read from the directory
 * spreadsheet. Caching belongs to GoogleSheetsClient; every call reads through it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ServiceMapper {

    private final GoogleSheetsClient sheetsClient;

    /**
     * Exact match on the trimmed, case-folded service name.
     *
     * @throws ServiceNotFoundException       no service with that name
     * @throws DepartmentNotAssignedException the service has no department
     */
    public Department resolveDepartment(String serviceName) {
        String normalized = normalize(serviceName);
        ServiceEntry entry = sheetsClient.fetchServices().stream()
                .filter(s -> normalize(s.getName()).equals(normalized))
                .findFirst()
                .orElseThrow(() -> new ServiceNotFoundException(serviceName));

        if (entry.getDepartment() == null) {
            throw new DepartmentNotAssignedException(serviceName);
        }
        return entry.getDepartment();
    }

    public List<TeamMember> teamMembers(Department department) {
        return sheetsClient.fetchTeamMembers().stream()
                .filter(m -> m.getDepartment() == department)
                .toList();
    }

    /** First member flagged responsible; empty when the sheet names nobody. */
    public Optional<TeamMember> responsible(Department department) {
        Optional<TeamMember> responsible = teamMembers(department).stream()
                .filter(TeamMember::isResponsible)
                .findFirst();
        if (responsible.isEmpty()) {
            log.warn("No responsible configured for department {}", department);
        }
        return responsible;
    }

    /** Trimmed and case-folded: upper then lower, so "ß" and "SS" compare equal. */
    static String normalize(String value) {
        return value == null ? "" : value.strip().toUpperCase(Locale.ROOT).toLowerCase(Locale.ROOT);
    }
}
