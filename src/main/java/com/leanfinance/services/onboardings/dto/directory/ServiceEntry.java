package com.leanfinance.services.onboardings.dto.directory;

import com.leanfinance.services.onboardings.constants.Department;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * A row of the "servicios" sheet. Department is null when the sheet leaves it
 * empty or uses an unknown code.
 */
@Getter
@Builder
@AllArgsConstructor
@ToString
public class ServiceEntry {

    private final String name;
    private final String tags;
    private final Department department;
}
