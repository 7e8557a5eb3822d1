package com.fintech.settlement.recovery;

import lombok.Value;

import java.util.List;

@Value
public class HealthReport {

    boolean healthy;
    List<String> issues;

    public static HealthReport of(List<String> issues) {
        return new HealthReport(issues.isEmpty(), List.copyOf(issues));
    }
}
