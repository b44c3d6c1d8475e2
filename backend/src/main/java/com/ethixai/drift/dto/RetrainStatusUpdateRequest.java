package com.ethixai.drift.dto;

import com.ethixai.drift.model.RetrainRequest;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetrainStatusUpdateRequest {
    @NotNull
    private RetrainRequest.Status status;

    @Size(max = 2000)
    private String note;
}
