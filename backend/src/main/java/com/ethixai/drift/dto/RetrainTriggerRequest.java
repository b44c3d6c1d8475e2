package com.ethixai.drift.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetrainTriggerRequest {
    @NotBlank
    @Size(max = 2000)
    private String reason;

    @Size(max = 128)
    private String requestedBy;
}
