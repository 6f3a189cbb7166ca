package com.kreasipositif.wpsprocessor.service;

import com.kreasipositif.wpsprocessor.assembly.LineAssembler;
import com.kreasipositif.wpsprocessor.domain.EmployerScope;
import com.kreasipositif.wpsprocessor.domain.SalaryPeriod;
import com.kreasipositif.wpsprocessor.domain.WpsBatch;
import com.kreasipositif.wpsprocessor.domain.WpsLine;
import com.kreasipositif.wpsprocessor.dto.CreateBatchRequest;
import com.kreasipositif.wpsprocessor.dto.WpsLineRequest;
import com.kreasipositif.wpsprocessor.exception.ValidationBlockedException;
import com.kreasipositif.wpsprocessor.repository.ReferenceGenerator;
import com.kreasipositif.wpsprocessor.repository.SubmissionRepository;
import com.kreasipositif.wpsprocessor.repository.WpsBatchRepository;
import com.kreasipositif.wpsprocessor.sif.SifCodec;
import com.kreasipositif.wpsprocessor.submission.Submission;
import com.kreasipositif.wpsprocessor.validation.BatchValidationService;
import com.kreasipositif.wpsprocessor.validation.ValidationRecord;
import com.kreasipositif.wpsprocessor.validation.ValidationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;

/**
 * Batch lifecycle operations: creation, line maintenance, assembly, validation, SIF generation,
 * cancel (with the batch's open submissions) and reset.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WpsBatchService {

    private final WpsBatchRepository repository;
    private final ReferenceGenerator references;
    private final LineAssembler lineAssembler;
    private final BatchValidationService validationService;
    private final SifCodec sifCodec;
    private final SubmissionRepository submissions;

    public WpsBatch create(CreateBatchRequest request, String actor) {
        WpsBatch batch = WpsBatch.builder()
                .reference(references.next(ReferenceGenerator.BATCH))
                .companyId(request.getCompanyId())
                .employerId(request.getEmployerId())
                .employerBankCode(request.getEmployerBankCode())
                .employerAccount(request.getEmployerAccount())
                .period(new SalaryPeriod(request.getMonth(), request.getYear()))
                .salaryDate(request.getSalaryDate())
                .fileType(request.getFileType())
                .createdBy(actor)
                .lines(toLines(request.getLines()))
                .build();
        repository.save(batch);
        log.info("Batch {} created by {} for company {} period {} with {} line(s)",
                batch.getReference(), actor, batch.getCompanyId(), batch.getPeriod(), batch.employeeCount());
        return batch;
    }

    public WpsBatch get(String reference) {
        return repository.require(reference);
    }

    /**
     * @param companyId optional filter
     */
    public List<WpsBatch> list(String companyId) {
        return companyId == null || companyId.isBlank() ? repository.findAll() : repository.findByCompany(companyId);
    }

    public WpsBatch replaceLines(String reference, List<WpsLineRequest> lines) {
        WpsBatch batch = repository.require(reference);
        batch.replaceLines(toLines(lines));
        log.info("Batch {} lines replaced: {} line(s)", reference, batch.employeeCount());
        return batch;
    }

    /**
     * Rebuilds every line from the payroll register. Running it twice yields the same lines.
     *
     * @param employeeRefs optional subset; empty assembles the whole workforce
     */
    public WpsBatch assemble(String reference, Set<String> employeeRefs) {
        WpsBatch batch = repository.require(reference);
        List<WpsLine> lines = lineAssembler.assemble(
                new EmployerScope(batch.getCompanyId(), batch.getPeriod(), employeeRefs));
        batch.replaceLines(lines);
        return batch;
    }

    public ValidationResult validate(String reference, String actor) {
        return validationService.validate(repository.require(reference), actor);
    }

    public List<ValidationRecord> validationHistory(String reference) {
        repository.require(reference);
        return validationService.history(reference);
    }

    /**
     * Validates and, when nothing blocks, encodes the SIF file onto the batch.
     *
     * @throws ValidationBlockedException when an ERROR-severity rule fails
     */
    public WpsBatch generateSif(String reference, String actor) {
        WpsBatch batch = repository.require(reference);
        ValidationResult result = validationService.validate(batch, actor);
        if (!result.canSubmit()) {
            throw new ValidationBlockedException(reference, result);
        }
        return encode(batch);
    }

    /** Encodes without validating; for callers that have just validated the batch themselves. */
    public WpsBatch encode(WpsBatch batch) {
        byte[] content = sifCodec.encode(batch);
        String fileName = sifCodec.fileName(batch);
        batch.markGenerated(fileName, content);
        log.info("Batch {} generated {} ({} bytes, {} record(s))",
                batch.getReference(), fileName, content.length, batch.employeeCount());
        return batch;
    }

    public WpsBatch cancel(String reference, String actor) {
        WpsBatch batch = repository.require(reference);
        batch.cancel();
        for (Submission submission : submissions.findByBatch(reference)) {
            if (submission.cancelIfOpen()) {
                log.info("Submission {} of batch {} cancelled with it", submission.getReference(), reference);
            }
        }
        log.info("Batch {} cancelled by {}", reference, actor);
        return batch;
    }

    public WpsBatch resetToDraft(String reference, String actor) {
        WpsBatch batch = repository.require(reference);
        batch.resetToDraft();
        log.info("Batch {} reset to draft by {}", reference, actor);
        return batch;
    }

    private static List<WpsLine> toLines(List<WpsLineRequest> requests) {
        return requests == null ? List.of() : requests.stream().map(WpsLineRequest::toLine).toList();
    }
}
