package com.leanfinance.services.onboardings.dto.crm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One page of a CRM search. {@code paging.next.after} is the cursor of the
 * next page and is absent on the last one.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CrmSearchResponse {

    private List<CrmObject> results = new ArrayList<>();

    private Paging paging;

    public String nextCursor() {
        if (paging == null || paging.getNext() == null) return null;
        String after = paging.getNext().getAfter();
        return after == null || after.isBlank() ? null : after;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Paging {
        private Next next;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Next {
        private String after;
    }
}
