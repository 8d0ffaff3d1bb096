package com.oracle.optmcts.model;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SolveRequest {

    @NotBlank(message = "Problem statement cannot be blank")
    private String problem;

    private Double groundTruth; // known optimal objective value, enables early stop

    @Min(value = 1, message = "Iteration budget must be at least 1")
    @Max(value = 100, message = "Iteration budget cannot exceed 100")
    private Integer iterationBudget;

    @DecimalMin(value = "0.0", message = "Re-expansion threshold must be at least 0")
    @DecimalMax(value = "1.0", message = "Re-expansion threshold cannot exceed 1")
    private Double reexpansionThreshold;

    @Builder.Default
    private Boolean verbose = false;
}
