package com.kreasipositif.wpsprocessor.dto;

import com.kreasipositif.wpsprocessor.domain.BatchState;
import com.kreasipositif.wpsprocessor.domain.FileType;
import com.kreasipositif.wpsprocessor.domain.WpsBatch;
import com.kreasipositif.wpsprocessor.domain.WpsLine;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

@Getter
@Builder
@Schema(description = "WPS batch with its derived totals")
public class BatchResponse {

    @Schema(example = "WPS-2026-00001")
    private final String reference;
    private final String companyId;
    private final String employerId;
    private final String employerBankCode;
    private final String employerAccount;

    @Schema(description = "Salary period as YYYY-MM", example = "2026-09")
    private final String period;
    private final LocalDate salaryDate;
    private final FileType fileType;
    private final BatchState state;
    private final int employeeCount;
    private final BigDecimal totalNetSalary;
    private final String sifFileName;
    private final String createdBy;
    private final Instant createdAt;
    private final Instant generatedAt;
    private final Instant submittedAt;
    private final Instant processedAt;
    private final List<WpsLine> lines;

    public static BatchResponse from(WpsBatch batch) {
        return BatchResponse.builder()
                .reference(batch.getReference())
                .companyId(batch.getCompanyId())
                .employerId(batch.getEmployerId())
                .employerBankCode(batch.getEmployerBankCode())
                .employerAccount(batch.getEmployerAccount())
                .period(batch.getPeriod().toString())
                .salaryDate(batch.getSalaryDate())
                .fileType(batch.getFileType())
                .state(batch.getState())
                .employeeCount(batch.employeeCount())
                .totalNetSalary(batch.totalNetSalary())
                .sifFileName(batch.getSifFileName())
                .createdBy(batch.getCreatedBy())
                .createdAt(batch.getCreatedAt())
                .generatedAt(batch.getGeneratedAt())
                .submittedAt(batch.getSubmittedAt())
                .processedAt(batch.getProcessedAt())
                .lines(batch.getLines())
                .build();
    }
}
