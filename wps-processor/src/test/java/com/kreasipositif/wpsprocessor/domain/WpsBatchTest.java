package com.kreasipositif.wpsprocessor.domain;

import com.kreasipositif.wpsprocessor.exception.InvalidStateTransitionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WpsBatchTest {

    private static final byte[] FILE = "EDR...\n".getBytes(StandardCharsets.US_ASCII);

    @Test
    @DisplayName("Totals are derived from the current lines")
    void totals_followLines() {
        WpsBatch batch = batch();
        batch.replaceLines(List.of(line("EMP-1", "1000.50"), line("EMP-2", "2000.25")));

        assertThat(batch.employeeCount()).isEqualTo(2);
        assertThat(batch.totalNetSalary()).isEqualByComparingTo("3000.75");

        batch.replaceLines(List.of(line("EMP-1", "10")));

        assertThat(batch.employeeCount()).isEqualTo(1);
        assertThat(batch.totalNetSalary()).isEqualByComparingTo("10");
    }

    @Test
    @DisplayName("Happy path DRAFT → GENERATED → SUBMITTED → PROCESSED, then frozen")
    void lifecycle_happyPath() {
        WpsBatch batch = batch();
        batch.markGenerated("WPS_1_202609.SIF", FILE);
        batch.markSubmitted();
        batch.markProcessed();

        assertThat(batch.getState()).isEqualTo(BatchState.PROCESSED);
        assertThat(batch.isLocked()).isTrue();
        assertThatThrownBy(() -> batch.replaceLines(List.of()))
                .isInstanceOf(InvalidStateTransitionException.class);
        assertThatThrownBy(batch::cancel).isInstanceOf(InvalidStateTransitionException.class);
    }

    @Test
    @DisplayName("Editing a generated batch discards the file and returns it to DRAFT")
    void editGenerated_returnsToDraft() {
        WpsBatch batch = batch();
        batch.markGenerated("WPS_1_202609.SIF", FILE);

        batch.replaceLines(List.of(line("EMP-1", "100")));

        assertThat(batch.getState()).isEqualTo(BatchState.DRAFT);
        assertThat(batch.hasGeneratedFile()).isFalse();
        assertThat(batch.getSifFileName()).isNull();
    }

    @Test
    @DisplayName("Lines of a submitted batch cannot be edited")
    void editSubmitted_isRefused() {
        WpsBatch batch = batch();
        batch.markGenerated("WPS_1_202609.SIF", FILE);
        batch.markSubmitted();

        assertThatThrownBy(() -> batch.replaceLines(List.of()))
                .isInstanceOf(InvalidStateTransitionException.class)
                .hasMessageContaining("SUBMITTED");
    }

    @Test
    @DisplayName("A rejected batch can be reset to DRAFT; a draft one cannot")
    void reset_onlyFromRejectedOrCancelled() {
        WpsBatch batch = batch();
        assertThatThrownBy(batch::resetToDraft).isInstanceOf(InvalidStateTransitionException.class);

        batch.markGenerated("WPS_1_202609.SIF", FILE);
        batch.markSubmitted();
        batch.markRejected();
        batch.resetToDraft();

        assertThat(batch.getState()).isEqualTo(BatchState.DRAFT);
        assertThat(batch.getSubmittedAt()).isNull();
    }

    @Test
    @DisplayName("The stored file is a defensive copy")
    void sifContent_isCopied() {
        WpsBatch batch = batch();
        byte[] content = FILE.clone();
        batch.markGenerated("WPS_1_202609.SIF", content);
        content[0] = 'X';

        assertThat(batch.getSifContent()).isEqualTo(FILE);
    }

    @Test
    @DisplayName("Lines are copied in and out, so edits bypassing replaceLines have no effect")
    void lines_areCopied() {
        WpsBatch batch = batch();
        batch.markGenerated("WPS_1_202609.SIF", FILE);
        WpsLine supplied = line("EMP-1", "6750.00");
        batch.replaceLines(List.of(supplied));
        batch.markGenerated("WPS_1_202609.SIF", FILE);

        supplied.setNetSalary(new BigDecimal("1.00"));
        batch.getLines().get(0).setNetSalary(new BigDecimal("2.00"));
        batch.getLines().get(0).setEmployeeRef("EMP-X");

        assertThat(batch.totalNetSalary()).isEqualByComparingTo("6750.00");
        assertThat(batch.getLines()).singleElement()
                .satisfies(l -> assertThat(l.getEmployeeRef()).isEqualTo("EMP-1"));
        assertThat(batch.getState()).isEqualTo(BatchState.GENERATED);
        assertThat(batch.hasGeneratedFile()).isTrue();
    }

    @Test
    @DisplayName("Salary period: deadline is the 15th of the following month")
    void period_deadline() {
        assertThat(new SalaryPeriod(12, 2026).submissionDeadline()).isEqualTo(LocalDate.of(2027, 1, 15));
        assertThat(new SalaryPeriod(9, 2026).toString()).isEqualTo("2026-09");
        assertThatThrownBy(() -> new SalaryPeriod(13, 2026)).isInstanceOf(IllegalArgumentException.class);
    }

    private static WpsBatch batch() {
        return WpsBatch.builder()
                .reference("WPS-2026-00001")
                .companyId("TAZ-001")
                .employerId("1")
                .employerAccount("1")
                .period(new SalaryPeriod(9, 2026))
                .salaryDate(LocalDate.of(2026, 9, 28))
                .build();
    }

    private static WpsLine line(String ref, String net) {
        return WpsLine.builder().employeeRef(ref).netSalary(new BigDecimal(net)).build();
    }
}
