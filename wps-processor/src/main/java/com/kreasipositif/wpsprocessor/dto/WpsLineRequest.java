package com.kreasipositif.wpsprocessor.dto;

import com.kreasipositif.wpsprocessor.domain.WpsLine;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;

/**
 * One salary line as entered by hand. Blank amounts count as zero; when {@code netSalary} is
 * omitted it is computed as gross minus deductions.
 */
@Getter
@Setter
@NoArgsConstructor
@Schema(description = "Employee salary line")
public class WpsLineRequest {

    @NotBlank(message = "employeeRef must not be blank")
    @Schema(example = "EMP-0001", requiredMode = Schema.RequiredMode.REQUIRED)
    private String employeeRef;

    @Schema(example = "Ahmed Al Mansouri")
    private String employeeName;

    @Schema(example = "784-1985-1234567-1")
    private String emiratesId;

    @Schema(example = "LC-100234")
    private String labourCardNo;

    @Schema(description = "WPS routing code of the employee's bank", example = "302620122")
    private String bankCode;

    private String accountNumber;

    @Schema(example = "AE070331234567890123456")
    private String iban;

    @Schema(example = "30")
    private Integer daysWorked;

    private BigDecimal basicSalary;
    private BigDecimal housingAllowance;
    private BigDecimal transportAllowance;
    private BigDecimal otherAllowance;
    private BigDecimal overtime;
    private BigDecimal leaveSalary;
    private BigDecimal deductions;
    private BigDecimal netSalary;

    public WpsLine toLine() {
        WpsLine line = WpsLine.builder()
                .employeeRef(employeeRef)
                .employeeName(employeeName)
                .emiratesId(WpsLine.normalizeEmiratesId(emiratesId))
                .labourCardNo(labourCardNo)
                .bankCode(bankCode)
                .accountNumber(accountNumber)
                .iban(iban)
                .daysWorked(daysWorked == null ? 30 : daysWorked)
                .basicSalary(nz(basicSalary))
                .housingAllowance(nz(housingAllowance))
                .transportAllowance(nz(transportAllowance))
                .otherAllowance(nz(otherAllowance))
                .overtime(nz(overtime))
                .leaveSalary(nz(leaveSalary))
                .deductions(nz(deductions))
                .build();
        line.setNetSalary(netSalary != null ? netSalary : line.expectedNetSalary());
        return line;
    }

    private static BigDecimal nz(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }
}
