package com.kreasipositif.wpsprocessor.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@Schema(description = "Outcome of a file uploaded by hand on a bank portal")
public class ManualConfirmationRequest {

    @NotNull(message = "accepted is required")
    private Boolean accepted;

    @Schema(description = "Reference shown by the bank portal", example = "ENBD-778812")
    private String bankReference;

    private String message;
}
