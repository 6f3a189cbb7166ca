package com.kreasipositif.bankgateway.service;

import com.kreasipositif.bankgateway.config.SandboxProperties;
import com.kreasipositif.bankgateway.dto.FileStatusResponse;
import com.kreasipositif.bankgateway.dto.FileSubmissionRequest;
import com.kreasipositif.bankgateway.dto.FileSubmissionResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.HexFormat;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Simulated bank side of the WPS host-to-host channel.
 *
 * <p>An upload is checked the way a bank's intake would check it: payload hash and size,
 * then the SIF structure (one 91-byte EDR followed by 150-byte SDRs, the EDR record count and
 * total matching the detail lines, the EDR employer matching the uploader). Accepted files get a
 * {@code GW-nnnnnn} reference and settle after {@code sandbox.settle-after-polls} status calls.
 *
 * <p>Every call applies {@code sandbox.latency-ms} of blocking delay.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SalaryFileService {

    public static final String CODE_OK = "000";
    public static final String CODE_MALFORMED = "E100";
    public static final String CODE_INTEGRITY = "E101";
    public static final String CODE_STRUCTURE = "E102";
    public static final String CODE_EMPLOYER_MISMATCH = "E103";
    public static final String CODE_DUPLICATE = "E104";
    public static final String CODE_EMPLOYER_BLOCKED = "E204";

    static final int EDR_LENGTH = 91;
    static final int SDR_LENGTH = 150;

    private final SandboxProperties properties;

    private final AtomicInteger sequence = new AtomicInteger();
    private final Map<String, ReceivedFile> files = new ConcurrentHashMap<>();

    // ─── Public API ──────────────────────────────────────────────────────────────

    /**
     * Verifies the API key and runs the intake checks.
     *
     * @throws ResponseStatusException 401 when the key is not configured
     */
    public FileSubmissionResponse receive(String apiKey, FileSubmissionRequest request) {
        authenticate(apiKey);
        applyLatency();

        byte[] content;
        try {
            content = Base64.getDecoder().decode(request.getContent());
        } catch (IllegalArgumentException e) {
            return rejected(request, CODE_MALFORMED, "Content is not valid base64");
        }
        if (request.getSize() != content.length) {
            return rejected(request, CODE_INTEGRITY,
                    "Declared size %d does not match %d received bytes".formatted(request.getSize(), content.length));
        }
        if (!sha256(content).equalsIgnoreCase(request.getSha256())) {
            return rejected(request, CODE_INTEGRITY, "SHA-256 does not match the received content");
        }

        Rejection structureError = checkStructure(new String(content, StandardCharsets.US_ASCII), request.getEmployerId());
        if (structureError != null) {
            return rejected(request, structureError.code(), structureError.message());
        }

        boolean duplicate = !"RESUBMISSION".equalsIgnoreCase(request.getSubmissionType())
                && files.values().stream().anyMatch(f -> f.sha256().equalsIgnoreCase(request.getSha256()));
        if (duplicate) {
            return rejected(request, CODE_DUPLICATE, "File was already received; submit it as RESUBMISSION");
        }

        String reference = "GW-%06d".formatted(sequence.incrementAndGet());
        files.put(reference, new ReceivedFile(reference, request.getEmployerId(), request.getFileName(),
                request.getSha256().toLowerCase(), new AtomicInteger()));
        log.info("Received {} from employer {} as {} ({} bytes)",
                request.getFileName(), request.getEmployerId(), reference, content.length);
        return FileSubmissionResponse.builder()
                .accepted(true)
                .reference(reference)
                .code(CODE_OK)
                .message("File received for processing")
                .build();
    }

    /**
     * Reports PROCESSING until the file has been polled {@code settle-after-polls} times, then
     * SUCCESS, or REJECTED when the employer is on the blocked list.
     *
     * @throws ResponseStatusException 404 for an unknown reference
     */
    public FileStatusResponse status(String apiKey, String reference) {
        authenticate(apiKey);
        applyLatency();

        ReceivedFile file = files.get(reference);
        if (file == null) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown file reference " + reference);
        }
        int polls = file.polls().incrementAndGet();
        if (polls <= properties.getSettleAfterPolls()) {
            return statusOf(file, "PROCESSING", null, "File is being processed");
        }
        if (properties.getBlockedEmployers().contains(file.employerId())) {
            return statusOf(file, "REJECTED", CODE_EMPLOYER_BLOCKED, "Employer account is blocked");
        }
        return statusOf(file, "SUCCESS", CODE_OK, "Salaries credited");
    }

    public void health(String apiKey) {
        authenticate(apiKey);
    }

    // ─── Internal helpers ────────────────────────────────────────────────────────

    /**
     * @return {@code null} when the content is a well-formed SIF file for {@code employerId}
     */
    static Rejection checkStructure(String text, String employerId) {
        String[] records = text.split("\n");
        if (records.length < 2) {
            return structural("File must contain an EDR record followed by at least one SDR record");
        }
        String edr = stripCarriageReturn(records[0]);
        if (edr.length() != EDR_LENGTH || !edr.startsWith("EDR")) {
            return structural("First record must be a %d-byte EDR".formatted(EDR_LENGTH));
        }
        long totalFils = 0;
        for (int i = 1; i < records.length; i++) {
            String sdr = stripCarriageReturn(records[i]);
            if (sdr.length() != SDR_LENGTH || !sdr.startsWith("SDR")) {
                return structural("Record %d must be a %d-byte SDR".formatted(i + 1, SDR_LENGTH));
            }
            Long net = parseNumber(sdr.substring(72, 87));
            if (net == null) {
                return structural("Record %d has a non-numeric net salary".formatted(i + 1));
            }
            totalFils += net;
        }
        Long recordCount = parseNumber(edr.substring(67, 73));
        if (recordCount == null || recordCount != records.length - 1) {
            return structural("EDR record count %s does not match %d SDR record(s)"
                    .formatted(edr.substring(67, 73), records.length - 1));
        }
        Long total = parseNumber(edr.substring(73, 88));
        if (total == null || total != totalFils) {
            return structural("EDR total %s does not match the sum of net salaries".formatted(edr.substring(73, 88)));
        }
        if (!edr.substring(3, 18).trim().equals(employerId)) {
            return new Rejection(CODE_EMPLOYER_MISMATCH,
                    "EDR employer %s does not match uploader %s".formatted(edr.substring(3, 18).trim(), employerId));
        }
        return null;
    }

    private static Rejection structural(String message) {
        return new Rejection(CODE_STRUCTURE, message);
    }

    private void authenticate(String apiKey) {
        if (apiKey == null || !properties.getApiKeys().contains(apiKey)) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Missing or unknown X-API-Key");
        }
    }

    private FileSubmissionResponse rejected(FileSubmissionRequest request, String code, String message) {
        log.info("Rejected {} from employer {}: {} {}", request.getFileName(), request.getEmployerId(), code, message);
        return FileSubmissionResponse.builder()
                .accepted(false)
                .code(code)
                .message(message)
                .build();
    }

    private static FileStatusResponse statusOf(ReceivedFile file, String status, String code, String message) {
        return FileStatusResponse.builder()
                .reference(file.reference())
                .status(status)
                .code(code)
                .message(message)
                .build();
    }

    private static Long parseNumber(String digits) {
        String trimmed = digits.trim();
        if (trimmed.isEmpty() || !trimmed.chars().allMatch(Character::isDigit)) {
            return null;
        }
        return Long.parseLong(trimmed);
    }

    private static String stripCarriageReturn(String record) {
        return record.endsWith("\r") ? record.substring(0, record.length() - 1) : record;
    }

    static String sha256(byte[] content) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(content));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    private void applyLatency() {
        long latencyMs = properties.getLatencyMs();
        if (latencyMs <= 0) return;
        try {
            log.trace("Applying simulated latency of {} ms", latencyMs);
            Thread.sleep(latencyMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Latency simulation interrupted", e);
        }
    }

    record Rejection(String code, String message) {}

    private record ReceivedFile(String reference, String employerId, String fileName, String sha256,
                                AtomicInteger polls) {}
}
