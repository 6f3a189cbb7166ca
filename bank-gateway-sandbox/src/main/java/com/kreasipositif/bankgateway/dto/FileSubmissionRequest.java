package com.kreasipositif.bankgateway.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Upload of one SIF file.
 */
@Getter
@Setter
@NoArgsConstructor
@Schema(description = "SIF file upload")
public class FileSubmissionRequest {

    @NotBlank(message = "employerId must not be blank")
    @Schema(description = "MOHRE establishment ID", example = "1000012345", requiredMode = Schema.RequiredMode.REQUIRED)
    private String employerId;

    @Schema(description = "Routing code of the employer's bank", example = "302620122")
    private String routingCode;

    @NotBlank(message = "fileName must not be blank")
    @Schema(example = "WPS_1000012345_202609.SIF", requiredMode = Schema.RequiredMode.REQUIRED)
    private String fileName;

    @Schema(description = "NEW or RESUBMISSION", example = "NEW")
    private String submissionType = "NEW";

    @NotBlank(message = "content must not be blank")
    @Schema(description = "Base64 of the SIF bytes", requiredMode = Schema.RequiredMode.REQUIRED)
    private String content;

    @NotBlank(message = "sha256 must not be blank")
    @Pattern(regexp = "^[0-9a-fA-F]{64}$", message = "sha256 must be 64 hex characters")
    @Schema(description = "Hex SHA-256 of the decoded content", requiredMode = Schema.RequiredMode.REQUIRED)
    private String sha256;

    @NotNull(message = "size is required")
    @Schema(description = "Decoded content length in bytes", example = "391", requiredMode = Schema.RequiredMode.REQUIRED)
    private Integer size;
}
