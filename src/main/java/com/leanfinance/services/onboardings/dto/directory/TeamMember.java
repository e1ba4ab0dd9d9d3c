package com.leanfinance.services.onboardings.dto.directory;

import com.leanfinance.services.onboardings.constants.Department;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * A row of the "usuarios" sheet.
 */
@Getter
@Builder
@AllArgsConstructor
@ToString
public class TeamMember {

    private final String hubspotTecId;
    private final String slackId;
    private final String email;
    private final String fullName;
    private final String shortName;
    private final Department department;
    private final boolean responsible;

    public boolean hasSlackId() {
        return slackId != null && !slackId.isBlank();
    }

    /** Short name for greetings, full name when no short name is set. */
    public String greetingName() {
        return shortName != null && !shortName.isBlank() ? shortName : fullName;
    }
}
