package com.kreasipositif.wpsprocessor.dto;

import com.kreasipositif.wpsprocessor.submission.SubmissionType;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@Schema(description = "Request to transmit a batch's SIF file through a bank connection")
public class SubmitRequest {

    @NotBlank(message = "batchReference must not be blank")
    @Schema(example = "WPS-2026-00001", requiredMode = Schema.RequiredMode.REQUIRED)
    private String batchReference;

    @NotBlank(message = "connectionId must not be blank")
    @Schema(example = "enbd-rest", requiredMode = Schema.RequiredMode.REQUIRED)
    private String connectionId;

    @Schema(example = "NEW", defaultValue = "NEW")
    private SubmissionType type = SubmissionType.NEW;
}
