package com.leanfinance.services.onboardings.dto.crm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * A HubSpot CRM object (deal, company or contact): an id plus the requested
 * properties. HubSpot sends every property value as a string or null.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CrmObject {

    private String id;

    private Map<String, String> properties = new HashMap<>();

    /** Property value, or null when absent or blank. */
    public String property(String name) {
        if (properties == null) return null;
        String value = properties.get(name);
        return value == null || value.isBlank() ? null : value;
    }
}
