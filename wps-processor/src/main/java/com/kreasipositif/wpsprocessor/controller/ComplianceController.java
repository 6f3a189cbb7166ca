package com.kreasipositif.wpsprocessor.controller;

import com.kreasipositif.wpsprocessor.compliance.ComplianceRecord;
import com.kreasipositif.wpsprocessor.compliance.ComplianceService;
import com.kreasipositif.wpsprocessor.domain.SalaryPeriod;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/wps/compliance")
@RequiredArgsConstructor
@Tag(name = "Compliance", description = "Monthly WPS compliance records written on successful submissions")
public class ComplianceController {

    private final ComplianceService complianceService;

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "List compliance records",
            description = "Filter by company and, when both month and year are given, by salary period.")
    public ResponseEntity<List<ComplianceRecord>> list(
            @Parameter(example = "TAZ-001") @RequestParam(value = "companyId", required = false) String companyId,
            @Parameter(example = "9") @RequestParam(value = "month", required = false) Integer month,
            @Parameter(example = "2026") @RequestParam(value = "year", required = false) Integer year) {
        SalaryPeriod period = month != null && year != null ? new SalaryPeriod(month, year) : null;
        return ResponseEntity.ok(complianceService.find(companyId, period));
    }
}
