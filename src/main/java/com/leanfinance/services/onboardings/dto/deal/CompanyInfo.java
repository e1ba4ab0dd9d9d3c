package com.leanfinance.services.onboardings.dto.deal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Company data read from HubSpot. Drive and Holded ids are present once an
 * earlier onboarding wrote them back.
 */
@Getter
@Builder(toBuilder = true)
@AllArgsConstructor
@ToString
public class CompanyInfo {

    private final String hubspotId;
    private final String name;
    private final String nif;
    private final String email;
    private final String phone;
    private final String address;
    private final String city;
    private final String state;
    private final String zip;
    private final String country;
    private final String website;
    private final String domain;
    private final String holdedId;
    private final boolean syncedWithHolded;
    private final String driveFolderId;
    private final String driveFolderUrl;
}
