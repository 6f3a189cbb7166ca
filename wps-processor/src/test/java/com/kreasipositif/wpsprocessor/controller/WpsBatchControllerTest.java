package com.kreasipositif.wpsprocessor.controller;

import com.kreasipositif.wpsprocessor.domain.SalaryPeriod;
import com.kreasipositif.wpsprocessor.domain.WpsBatch;
import com.kreasipositif.wpsprocessor.exception.BatchNotFoundException;
import com.kreasipositif.wpsprocessor.exception.NoEligibleEmployeesException;
import com.kreasipositif.wpsprocessor.exception.ValidationBlockedException;
import com.kreasipositif.wpsprocessor.service.WpsBatchService;
import com.kreasipositif.wpsprocessor.validation.ValidationResult;
import com.kreasipositif.wpsprocessor.validation.ValidationStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDate;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anySet;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Web layer of {@link WpsBatchController} together with {@link GlobalExceptionHandler}.
 */
@WebMvcTest(WpsBatchController.class)
class WpsBatchControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private WpsBatchService batchService;

    // ─── Create ───────────────────────────────────────────────────────────────

    @Test
    @DisplayName("201: batch created with the actor from X-Actor")
    void create_returnsCreatedBatch() throws Exception {
        when(batchService.create(any(), eq("hr-officer"))).thenReturn(batch());

        mockMvc.perform(post("/api/v1/wps/batches")
                        .header(WpsBatchController.ACTOR_HEADER, "hr-officer")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"companyId": "TAZ-001", "month": 9, "year": 2026}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.reference").value("WPS-2026-00001"))
                .andExpect(jsonPath("$.period").value("2026-09"))
                .andExpect(jsonPath("$.state").value("DRAFT"));
    }

    @Test
    @DisplayName("400: month outside 1..12 is rejected before reaching the service")
    void create_invalidMonth_isBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/wps/batches")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"companyId": "TAZ-001", "month": 13, "year": 2026}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.message").value("month: month must be between 1 and 12"));

        verifyNoInteractions(batchService);
    }

    // ─── Error mapping ────────────────────────────────────────────────────────

    @Test
    @DisplayName("404: unknown batch reference")
    void get_unknownBatch_isNotFound() throws Exception {
        when(batchService.get("WPS-2026-99999"))
                .thenThrow(new BatchNotFoundException("Batch WPS-2026-99999 not found"));

        mockMvc.perform(get("/api/v1/wps/batches/WPS-2026-99999"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }

    @Test
    @DisplayName("422: assemble with nobody eligible; an empty body means the whole company")
    void assemble_noEligibleEmployees_isUnprocessable() throws Exception {
        when(batchService.assemble(eq("WPS-2026-00001"), anySet()))
                .thenThrow(new NoEligibleEmployeesException("No employee of TAZ-001 has an active contract"));

        mockMvc.perform(post("/api/v1/wps/batches/WPS-2026-00001/assemble"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("NO_ELIGIBLE_EMPLOYEES"));
    }

    @Test
    @DisplayName("422: generation blocked by validation carries the full result")
    void generate_blocked_returnsValidationResult() throws Exception {
        ValidationResult result = new ValidationResult("WPS-2026-00001", 10, 8, 2, 0, 0,
                ValidationStatus.INVALID, false, List.of());
        when(batchService.generateSif("WPS-2026-00001", "api"))
                .thenThrow(new ValidationBlockedException("WPS-2026-00001", result));

        mockMvc.perform(post("/api/v1/wps/batches/WPS-2026-00001/generate"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("VALIDATION_BLOCKED"))
                .andExpect(jsonPath("$.result.failedErrorCount").value(2))
                .andExpect(jsonPath("$.result.canSubmit").value(false));

        verify(batchService).generateSif("WPS-2026-00001", "api");
    }

    // ─── Download ─────────────────────────────────────────────────────────────

    @Test
    @DisplayName("409: download before any file was generated")
    void downloadSif_withoutFile_isConflict() throws Exception {
        when(batchService.get("WPS-2026-00001")).thenReturn(batch());

        mockMvc.perform(get("/api/v1/wps/batches/WPS-2026-00001/sif"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("INVALID_STATE"));
    }

    @Test
    @DisplayName("200: generated file is served as an attachment named after the SIF file")
    void downloadSif_servesAttachment() throws Exception {
        WpsBatch batch = batch();
        batch.markGenerated("WPS_1000012345_202609.SIF", "EDR...\n".getBytes());
        when(batchService.get("WPS-2026-00001")).thenReturn(batch);

        mockMvc.perform(get("/api/v1/wps/batches/WPS-2026-00001/sif"))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Disposition",
                        "attachment; filename=\"WPS_1000012345_202609.SIF\""));
    }

    private static WpsBatch batch() {
        return WpsBatch.builder()
                .reference("WPS-2026-00001")
                .companyId("TAZ-001")
                .employerId("1000012345")
                .employerAccount("AE070260001012345678901")
                .period(new SalaryPeriod(9, 2026))
                .salaryDate(LocalDate.of(2026, 9, 28))
                .createdBy("hr-officer")
                .build();
    }
}
