package com.leanfinance.services.onboardings.dto.crm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CrmAssociationResponse {

    private List<Association> results = new ArrayList<>();

    /** Associated object ids, in the order HubSpot returned them. */
    public List<String> targetIds() {
        if (results == null) return List.of();
        return results.stream()
                .map(Association::getToObjectId)
                .filter(id -> id != null && !id.isBlank())
                .toList();
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Association {
        private String toObjectId;
    }
}
