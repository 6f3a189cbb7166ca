package com.kreasipositif.wpsprocessor.controller;

import com.kreasipositif.wpsprocessor.domain.WpsBatch;
import com.kreasipositif.wpsprocessor.dto.AssembleRequest;
import com.kreasipositif.wpsprocessor.dto.BatchResponse;
import com.kreasipositif.wpsprocessor.dto.CreateBatchRequest;
import com.kreasipositif.wpsprocessor.dto.ReplaceLinesRequest;
import com.kreasipositif.wpsprocessor.exception.InvalidStateTransitionException;
import com.kreasipositif.wpsprocessor.service.WpsBatchService;
import com.kreasipositif.wpsprocessor.validation.ValidationRecord;
import com.kreasipositif.wpsprocessor.validation.ValidationResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for WPS batches: lines, validation and SIF file generation.
 */
@RestController
@RequestMapping("/api/v1/wps/batches")
@RequiredArgsConstructor
@Tag(name = "WPS Batches", description = "Create batches, build their lines, validate them and generate SIF files")
public class WpsBatchController {

    static final String ACTOR_HEADER = "X-Actor";
    static final String DEFAULT_ACTOR = "api";

    private final WpsBatchService batchService;

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Create a batch",
            description = "Opens a DRAFT batch for one employer and salary month, optionally with lines entered by hand.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Batch created",
                    content = @Content(schema = @Schema(implementation = BatchResponse.class))),
            @ApiResponse(responseCode = "400", description = "Missing company, invalid month or year")
    })
    public ResponseEntity<BatchResponse> create(
            @Valid @RequestBody CreateBatchRequest request,
            @RequestHeader(value = ACTOR_HEADER, defaultValue = DEFAULT_ACTOR) String actor) {
        return ResponseEntity.status(HttpStatus.CREATED).body(BatchResponse.from(batchService.create(request, actor)));
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "List batches", description = "All batches, oldest first, optionally for one company.")
    public ResponseEntity<List<BatchResponse>> list(
            @Parameter(description = "Company filter", example = "TAZ-001")
            @RequestParam(value = "companyId", required = false) String companyId) {
        return ResponseEntity.ok(batchService.list(companyId).stream().map(BatchResponse::from).toList());
    }

    @GetMapping(value = "/{reference}", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Get a batch")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Batch found"),
            @ApiResponse(responseCode = "404", description = "Unknown batch reference")
    })
    public ResponseEntity<BatchResponse> get(@PathVariable("reference") String reference) {
        return ResponseEntity.ok(BatchResponse.from(batchService.get(reference)));
    }

    @PutMapping(value = "/{reference}/lines", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Replace all lines",
            description = "Allowed while DRAFT or GENERATED. Editing a generated batch discards its SIF file.")
    public ResponseEntity<BatchResponse> replaceLines(@PathVariable("reference") String reference,
                                                      @Valid @RequestBody ReplaceLinesRequest request) {
        return ResponseEntity.ok(BatchResponse.from(batchService.replaceLines(reference, request.getLines())));
    }

    @PostMapping(value = "/{reference}/assemble", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Build lines from payroll",
            description = """
                    Discards the current lines and builds one line per employee with an active contract,
                    taking bank details from the employee's salary account and amounts from the payroll register.
                    Running it again yields the same lines.
                    """)
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Lines rebuilt"),
            @ApiResponse(responseCode = "422", description = "No eligible employee in scope")
    })
    public ResponseEntity<BatchResponse> assemble(@PathVariable("reference") String reference,
                                                  @RequestBody(required = false) AssembleRequest request) {
        AssembleRequest scope = request == null ? new AssembleRequest() : request;
        return ResponseEntity.ok(BatchResponse.from(batchService.assemble(reference, scope.getEmployeeRefs())));
    }

    @PostMapping(value = "/{reference}/validate", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Validate a batch",
            description = "Runs every active rule. The result is kept in the batch's validation history.")
    public ResponseEntity<ValidationResult> validate(
            @PathVariable("reference") String reference,
            @RequestHeader(value = ACTOR_HEADER, defaultValue = DEFAULT_ACTOR) String actor) {
        return ResponseEntity.ok(batchService.validate(reference, actor));
    }

    @GetMapping(value = "/{reference}/validations", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Validation history", description = "Every validation run of the batch, oldest first.")
    public ResponseEntity<List<ValidationRecord>> validationHistory(@PathVariable("reference") String reference) {
        return ResponseEntity.ok(batchService.validationHistory(reference));
    }

    @PostMapping(value = "/{reference}/generate", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Generate the SIF file",
            description = "Validates the batch and, when no ERROR rule fails, encodes its SIF file.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "File generated; batch is GENERATED"),
            @ApiResponse(responseCode = "400", description = "A value cannot be encoded in its SIF field"),
            @ApiResponse(responseCode = "422", description = "Validation blocked generation")
    })
    public ResponseEntity<BatchResponse> generate(
            @PathVariable("reference") String reference,
            @RequestHeader(value = ACTOR_HEADER, defaultValue = DEFAULT_ACTOR) String actor) {
        return ResponseEntity.ok(BatchResponse.from(batchService.generateSif(reference, actor)));
    }

    @GetMapping(value = "/{reference}/sif", produces = MediaType.TEXT_PLAIN_VALUE)
    @Operation(summary = "Download the SIF file")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "US-ASCII SIF content"),
            @ApiResponse(responseCode = "409", description = "No file generated yet")
    })
    public ResponseEntity<byte[]> downloadSif(@PathVariable("reference") String reference) {
        WpsBatch batch = batchService.get(reference);
        byte[] content = batch.getSifContent();
        if (!batch.hasGeneratedFile() || content == null) {
            throw new InvalidStateTransitionException("Batch %s has no generated SIF file".formatted(reference));
        }
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(batch.getSifFileName()).build().toString())
                .contentType(MediaType.TEXT_PLAIN)
                .body(content);
    }

    @PostMapping(value = "/{reference}/cancel", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Cancel a batch", description = "Allowed in any state except PROCESSED.")
    public ResponseEntity<BatchResponse> cancel(
            @PathVariable("reference") String reference,
            @RequestHeader(value = ACTOR_HEADER, defaultValue = DEFAULT_ACTOR) String actor) {
        return ResponseEntity.ok(BatchResponse.from(batchService.cancel(reference, actor)));
    }

    @PostMapping(value = "/{reference}/reset", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Reset to draft", description = "From CANCELLED or REJECTED; clears the generated file.")
    public ResponseEntity<BatchResponse> reset(
            @PathVariable("reference") String reference,
            @RequestHeader(value = ACTOR_HEADER, defaultValue = DEFAULT_ACTOR) String actor) {
        return ResponseEntity.ok(BatchResponse.from(batchService.resetToDraft(reference, actor)));
    }
}
