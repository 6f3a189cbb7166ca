package com.kreasipositif.wpsprocessor.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@NoArgsConstructor
@Schema(description = "Complete replacement of a batch's lines")
public class ReplaceLinesRequest {

    @Valid
    @NotNull(message = "lines is required")
    private List<WpsLineRequest> lines = new ArrayList<>();
}
