package com.kreasipositif.bankgateway.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Getter;

/**
 * Immediate answer to an upload. HTTP 200 when accepted, 422 with {@code accepted=false} otherwise.
 */
@Getter
@Builder
@Schema(description = "Result of a SIF upload")
public class FileSubmissionResponse {

    @Schema(description = "The file passed the channel's structural checks", example = "true")
    private final boolean accepted;

    @Schema(description = "Bank reference for status polling, present when accepted", example = "GW-000001")
    private final String reference;

    @Schema(description = "000 when accepted, E1xx otherwise", example = "000")
    private final String code;

    @Schema(example = "File received for processing")
    private final String message;
}
