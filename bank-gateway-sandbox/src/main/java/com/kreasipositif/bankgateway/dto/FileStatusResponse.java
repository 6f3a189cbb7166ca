package com.kreasipositif.bankgateway.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
@Schema(description = "Settlement status of an uploaded file")
public class FileStatusResponse {

    @Schema(example = "GW-000001")
    private final String reference;

    @Schema(allowableValues = {"PROCESSING", "SUCCESS", "REJECTED"}, example = "SUCCESS")
    private final String status;

    @Schema(example = "000")
    private final String code;

    @Schema(example = "Salaries credited")
    private final String message;
}
