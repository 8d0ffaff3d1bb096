package com.oracle.optmcts.core;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionReport {
    private boolean success;
    private String output;        // stdout
    private String error;         // stderr or failure reason
    private boolean timedOut;
    private long executionTimeMs;

    public static ExecutionReport failure(String error) {
        return ExecutionReport.builder()
                .success(false)
                .output("")
                .error(error)
                .build();
    }
}
