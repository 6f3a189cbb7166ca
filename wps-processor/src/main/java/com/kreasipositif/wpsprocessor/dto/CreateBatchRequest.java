package com.kreasipositif.wpsprocessor.dto;

import com.kreasipositif.wpsprocessor.domain.FileType;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@NoArgsConstructor
@Schema(description = "Request to open a WPS batch for one employer and salary month")
public class CreateBatchRequest {

    @NotBlank(message = "companyId must not be blank")
    @Schema(example = "TAZ-001", requiredMode = Schema.RequiredMode.REQUIRED)
    private String companyId;

    @Schema(description = "MOHRE establishment ID", example = "1000012345")
    private String employerId;

    @Schema(description = "WPS routing code of the employer's bank", example = "302620122")
    private String employerBankCode;

    @Schema(description = "Employer account number or IBAN", example = "AE070331234567890123456")
    private String employerAccount;

    @NotNull(message = "month is required")
    @Min(value = 1, message = "month must be between 1 and 12")
    @Max(value = 12, message = "month must be between 1 and 12")
    @Schema(example = "9", requiredMode = Schema.RequiredMode.REQUIRED)
    private Integer month;

    @NotNull(message = "year is required")
    @Min(value = 1000, message = "year must have four digits")
    @Max(value = 9999, message = "year must have four digits")
    @Schema(example = "2026", requiredMode = Schema.RequiredMode.REQUIRED)
    private Integer year;

    @Schema(example = "2026-09-28")
    private LocalDate salaryDate;

    @Schema(example = "SIF")
    private FileType fileType;

    @Valid
    @Schema(description = "Lines entered by hand; leave empty and call /assemble to build them from payroll")
    private List<WpsLineRequest> lines = new ArrayList<>();
}
