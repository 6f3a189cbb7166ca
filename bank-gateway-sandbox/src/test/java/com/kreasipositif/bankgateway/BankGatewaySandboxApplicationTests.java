package com.kreasipositif.bankgateway;

import com.kreasipositif.bankgateway.dto.FileStatusResponse;
import com.kreasipositif.bankgateway.dto.FileSubmissionRequest;
import com.kreasipositif.bankgateway.dto.FileSubmissionResponse;
import com.kreasipositif.bankgateway.service.SalaryFileService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpStatus;
import org.springframework.test.context.TestPropertySource;
import org.springframework.web.server.ResponseStatusException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Base64;
import java.util.HexFormat;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Integration tests for {@link SalaryFileService}.
 * Latency is set to 0 ms via test properties to keep the suite fast.
 */
@SpringBootTest
@TestPropertySource(properties = {
        "sandbox.latency-ms=0",
        "sandbox.settle-after-polls=1",
        "sandbox.api-keys=test-key",
        "sandbox.blocked-employers=1000099999"
})
class BankGatewaySandboxApplicationTests {

    private static final String KEY = "test-key";

    @Autowired
    private SalaryFileService service;

    // ─── Receipt ──────────────────────────────────────────────────────────────

    @Test
    void wellFormedFileIsAccepted() throws Exception {
        var res = service.receive(KEY, request("1000012345", sif("1000012345", 1_000_000L, 550_000L), "NEW"));

        assertThat(res.isAccepted()).isTrue();
        assertThat(res.getReference()).matches("GW-\\d{6}");
        assertThat(res.getCode()).isEqualTo(SalaryFileService.CODE_OK);
    }

    @Test
    void unknownApiKeyIsUnauthorized() throws Exception {
        var req = request("1000012345", sif("1000012345", 100L), "NEW");

        assertThatThrownBy(() -> service.receive("wrong", req))
                .isInstanceOfSatisfying(ResponseStatusException.class,
                        e -> assertThat(e.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED));
    }

    @Test
    void hashMismatchIsRejected() throws Exception {
        var req = request("1000012345", sif("1000012345", 200L), "NEW");
        req.setSha256("0".repeat(64));

        var res = service.receive(KEY, req);

        assertThat(res.isAccepted()).isFalse();
        assertThat(res.getCode()).isEqualTo(SalaryFileService.CODE_INTEGRITY);
        assertThat(res.getReference()).isNull();
    }

    @Test
    void sizeMismatchIsRejected() throws Exception {
        var req = request("1000012345", sif("1000012345", 300L), "NEW");
        req.setSize(req.getSize() + 1);

        assertThat(service.receive(KEY, req).getCode()).isEqualTo(SalaryFileService.CODE_INTEGRITY);
    }

    @Test
    void invalidBase64IsRejected() throws Exception {
        var req = request("1000012345", sif("1000012345", 400L), "NEW");
        req.setContent("not base64 !!");

        assertThat(service.receive(KEY, req).getCode()).isEqualTo(SalaryFileService.CODE_MALFORMED);
    }

    @Test
    void wrongTotalIsRejected() throws Exception {
        String content = sif("1000012345", 500L).replace(
                "%015d".formatted(500L) + "AED\n", "%015d".formatted(501L) + "AED\n");

        var res = service.receive(KEY, request("1000012345", content, "NEW"));

        assertThat(res.getCode()).isEqualTo(SalaryFileService.CODE_STRUCTURE);
        assertThat(res.getMessage()).contains("EDR total");
    }

    @Test
    void truncatedDetailRecordIsRejected() throws Exception {
        String content = sif("1000012345", 600L);
        content = content.substring(0, content.length() - 5) + "\n";

        var res = service.receive(KEY, request("1000012345", content, "NEW"));

        assertThat(res.getCode()).isEqualTo(SalaryFileService.CODE_STRUCTURE);
        assertThat(res.getMessage()).contains("150-byte SDR");
    }

    @Test
    void employerMismatchIsRejected() throws Exception {
        var res = service.receive(KEY, request("1000054321", sif("1000012345", 700L), "NEW"));

        assertThat(res.getCode()).isEqualTo(SalaryFileService.CODE_EMPLOYER_MISMATCH);
    }

    @Test
    void sameFileTwiceIsRejectedUnlessResubmission() throws Exception {
        String content = sif("1000012345", 800L);
        assertThat(service.receive(KEY, request("1000012345", content, "NEW")).isAccepted()).isTrue();

        assertThat(service.receive(KEY, request("1000012345", content, "NEW")).getCode())
                .isEqualTo(SalaryFileService.CODE_DUPLICATE);
        assertThat(service.receive(KEY, request("1000012345", content, "RESUBMISSION")).isAccepted())
                .isTrue();
    }

    // ─── Settlement ───────────────────────────────────────────────────────────

    @Test
    void fileSettlesAfterConfiguredPolls() throws Exception {
        String reference = service.receive(KEY, request("1000012345", sif("1000012345", 900L), "NEW")).getReference();

        FileStatusResponse first = service.status(KEY, reference);
        FileStatusResponse second = service.status(KEY, reference);

        assertThat(first.getStatus()).isEqualTo("PROCESSING");
        assertThat(second.getStatus()).isEqualTo("SUCCESS");
        assertThat(second.getCode()).isEqualTo(SalaryFileService.CODE_OK);
        assertThat(second.getReference()).isEqualTo(reference);
    }

    @Test
    void blockedEmployerIsRejectedAtSettlement() throws Exception {
        String reference = service.receive(KEY, request("1000099999", sif("1000099999", 1_000L), "NEW")).getReference();

        service.status(KEY, reference);
        FileStatusResponse settled = service.status(KEY, reference);

        assertThat(settled.getStatus()).isEqualTo("REJECTED");
        assertThat(settled.getCode()).isEqualTo(SalaryFileService.CODE_EMPLOYER_BLOCKED);
    }

    @Test
    void unknownReferenceIsNotFound() {
        assertThatThrownBy(() -> service.status(KEY, "GW-999999"))
                .isInstanceOfSatisfying(ResponseStatusException.class,
                        e -> assertThat(e.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND));
    }

    // ─── Helpers ──────────────────────────────────────────────────────────────

    /** Builds an EDR plus one SDR per net amount (in fils); every record ends with a newline. */
    static String sif(String employerId, long... netFils) {
        long total = 0;
        StringBuilder details = new StringBuilder();
        for (int i = 0; i < netFils.length; i++) {
            total += netFils[i];
            details.append("SDR")
                    .append("%-15s".formatted("784-1990-00000" + i))
                    .append("302620122")
                    .append("%-34s".formatted("AE07026000101234567890" + i))
                    .append("20260928")
                    .append("M")
                    .append("30")
                    .append("%015d".formatted(netFils[i]))
                    .append("%015d".formatted(netFils[i]))
                    .append("%015d".formatted(0))
                    .append("%015d".formatted(0))
                    .append("%015d".formatted(0))
                    .append("AED\n");
        }
        String edr = "EDR"
                + "%-15s".formatted(employerId)
                + "302620122"
                + "%-34s".formatted("AE070260001012345678901")
                + "09" + "2026"
                + "%06d".formatted(netFils.length)
                + "%015d".formatted(total)
                + "AED\n";
        return edr + details;
    }

    static FileSubmissionRequest request(String employerId, String sif, String type) throws Exception {
        byte[] bytes = sif.getBytes(StandardCharsets.US_ASCII);
        var req = new FileSubmissionRequest();
        req.setEmployerId(employerId);
        req.setRoutingCode("302620122");
        req.setFileName("WPS_%s_202609.SIF".formatted(employerId));
        req.setSubmissionType(type);
        req.setContent(Base64.getEncoder().encodeToString(bytes));
        req.setSha256(HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(bytes)));
        req.setSize(bytes.length);
        return req;
    }
}
