package com.wealthdesk.api.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskProfileUpdateRequest {

    @NotNull(message = "Risk score is required")
    @Min(value = 0, message = "Risk score must be between 0 and 10")
    @Max(value = 10, message = "Risk score must be between 0 and 10")
    private Integer score;

    private String questionnaireVersion;

    /** Advisor recorded as the audit actor; the client id is used when absent. */
    private String updatedBy;
}
