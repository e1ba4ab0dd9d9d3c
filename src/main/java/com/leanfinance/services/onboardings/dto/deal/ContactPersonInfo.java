package com.leanfinance.services.onboardings.dto.deal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@AllArgsConstructor
@ToString
public class ContactPersonInfo {

    private final String hubspotId;
    private final String firstName;
    private final String lastName;
    private final String fullName;
    private final String email;
    private final String phone;
    private final String mobilePhone;
    private final String jobTitle;
    private final String nif;

    /** Full-name property, else first + last name, else email. */
    public String displayName() {
        if (fullName != null && !fullName.isBlank()) {
            return fullName.trim();
        }
        String composed = ((firstName == null ? "" : firstName) + " " + (lastName == null ? "" : lastName)).trim();
        if (!composed.isEmpty()) {
            return composed;
        }
        return email == null ? "" : email;
    }

    public String anyPhone() {
        return phone != null ? phone : mobilePhone;
    }
}
