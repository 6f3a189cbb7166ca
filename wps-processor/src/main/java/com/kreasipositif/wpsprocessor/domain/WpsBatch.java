package com.kreasipositif.wpsprocessor.domain;

import com.kreasipositif.wpsprocessor.exception.InvalidStateTransitionException;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * One monthly WPS salary submission for one employer.
 *
 * <p>Totals (record count, total net salary) are always derived from the current lines.
 * Line edits are only accepted while the batch is DRAFT or GENERATED; editing a generated
 * batch discards its file and returns it to DRAFT. Once PROCESSED the batch is frozen.
 *
 * <pre>
 *  DRAFT ─► GENERATED ─► SUBMITTED ─► PROCESSED
 *                                 └─► REJECTED ─► DRAFT (reset)
 *  any state except PROCESSED ─► CANCELLED ─► DRAFT (reset)
 * </pre>
 */
@Getter
public class WpsBatch {

    private final String reference;
    private final String companyId;
    private final String employerId;
    private final String employerBankCode;
    private final String employerAccount;
    private final SalaryPeriod period;
    private final LocalDate salaryDate;
    private final FileType fileType;
    private final String createdBy;
    private final Instant createdAt;

    private final List<WpsLine> lines = new ArrayList<>();
    private BatchState state = BatchState.DRAFT;
    private String sifFileName;
    private byte[] sifContent;
    private Instant generatedAt;
    private Instant submittedAt;
    private Instant processedAt;

    @Builder
    private WpsBatch(String reference, String companyId, String employerId, String employerBankCode,
                     String employerAccount, SalaryPeriod period, LocalDate salaryDate, FileType fileType,
                     String createdBy, List<WpsLine> lines) {
        this.reference = reference;
        this.companyId = companyId;
        this.employerId = employerId;
        this.employerBankCode = employerBankCode;
        this.employerAccount = employerAccount;
        this.period = period;
        this.salaryDate = salaryDate;
        this.fileType = fileType == null ? FileType.SIF : fileType;
        this.createdBy = createdBy;
        this.createdAt = Instant.now();
        if (lines != null) {
            this.lines.addAll(copyOf(lines));
        }
    }

    // ─── Derived totals ──────────────────────────────────────────────────────

    public synchronized BatchState getState() {
        return state;
    }

    public synchronized List<WpsLine> getLines() {
        return copyOf(lines);
    }

    public synchronized int employeeCount() {
        return lines.size();
    }

    public synchronized BigDecimal totalNetSalary() {
        return lines.stream()
                .map(WpsLine::getNetSalary)
                .filter(v -> v != null)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public synchronized boolean isLocked() {
        return state == BatchState.PROCESSED;
    }

    public synchronized boolean hasGeneratedFile() {
        return state != BatchState.DRAFT && sifContent != null;
    }

    public synchronized byte[] getSifContent() {
        return sifContent == null ? null : sifContent.clone();
    }

    // ─── Mutations ───────────────────────────────────────────────────────────

    /** Replaces every line; used by assembly (idempotent rebuild) and manual edits. */
    public synchronized void replaceLines(List<WpsLine> newLines) {
        requireState("edit lines of", Set.of(BatchState.DRAFT, BatchState.GENERATED));
        lines.clear();
        lines.addAll(copyOf(newLines));
        clearGeneratedFile();
        state = BatchState.DRAFT;
    }

    public synchronized void markGenerated(String fileName, byte[] content) {
        requireState("generate", Set.of(BatchState.DRAFT, BatchState.GENERATED));
        this.sifFileName = fileName;
        this.sifContent = content.clone();
        this.generatedAt = Instant.now();
        this.state = BatchState.GENERATED;
    }

    /** Idempotent while already SUBMITTED, so a correction can follow an accepted file. */
    public synchronized void markSubmitted() {
        requireState("submit", Set.of(BatchState.GENERATED, BatchState.SUBMITTED));
        this.submittedAt = Instant.now();
        this.state = BatchState.SUBMITTED;
    }

    public synchronized void markProcessed() {
        requireState("process", Set.of(BatchState.SUBMITTED));
        this.processedAt = Instant.now();
        this.state = BatchState.PROCESSED;
    }

    public synchronized void markRejected() {
        requireState("reject", Set.of(BatchState.SUBMITTED));
        this.state = BatchState.REJECTED;
    }

    public synchronized void cancel() {
        if (state == BatchState.PROCESSED) {
            throw new InvalidStateTransitionException("Processed batch %s cannot be cancelled".formatted(reference));
        }
        this.state = BatchState.CANCELLED;
    }

    public synchronized void resetToDraft() {
        requireState("reset", Set.of(BatchState.CANCELLED, BatchState.REJECTED));
        clearGeneratedFile();
        this.submittedAt = null;
        this.state = BatchState.DRAFT;
    }

    private void clearGeneratedFile() {
        this.sifFileName = null;
        this.sifContent = null;
        this.generatedAt = null;
    }

    private void requireState(String action, Set<BatchState> allowed) {
        if (!allowed.contains(state)) {
            throw new InvalidStateTransitionException(
                    "Cannot %s batch %s in state %s (allowed: %s)".formatted(action, reference, state, allowed));
        }
    }

    // Lines are mutable beans; the batch never shares its own instances.
    private static List<WpsLine> copyOf(List<WpsLine> source) {
        return source.stream().map(line -> line.toBuilder().build()).toList();
    }
}
