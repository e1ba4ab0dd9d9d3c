package com.leanfinance.services.onboardings.pipeline;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one step run. A failure carries the error the step declared;
 * unexpected faults are exceptions, not failed results.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class StepResult {

    private final boolean success;
    private final boolean skipped;
    private final Map<String, Object> data;
    private final String error;

    public static StepResult success(Map<String, Object> data) {
        return new StepResult(true, false, Collections.unmodifiableMap(new LinkedHashMap<>(data)), null);
    }

    /** Already done on an earlier run; the payload describes what was found. */
    public static StepResult skipped(Map<String, Object> data) {
        return new StepResult(true, true, Collections.unmodifiableMap(new LinkedHashMap<>(data)), null);
    }

    public static StepResult skipped() {
        return skipped(Map.of());
    }

    public static StepResult failure(String error) {
        return new StepResult(false, false, Map.of(), error);
    }
}
