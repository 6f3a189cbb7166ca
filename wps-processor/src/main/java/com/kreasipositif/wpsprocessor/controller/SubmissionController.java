package com.kreasipositif.wpsprocessor.controller;

import com.kreasipositif.wpsprocessor.dto.ManualConfirmationRequest;
import com.kreasipositif.wpsprocessor.dto.SubmissionResponse;
import com.kreasipositif.wpsprocessor.dto.SubmitRequest;
import com.kreasipositif.wpsprocessor.repository.SubmissionRepository;
import com.kreasipositif.wpsprocessor.submission.SubmissionOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

import static com.kreasipositif.wpsprocessor.controller.WpsBatchController.ACTOR_HEADER;
import static com.kreasipositif.wpsprocessor.controller.WpsBatchController.DEFAULT_ACTOR;

/**
 * REST controller for bank submissions.
 */
@RestController
@RequestMapping("/api/v1/wps/submissions")
@RequiredArgsConstructor
@Tag(name = "Submissions", description = "Transmit SIF files to banks and follow them until the bank settles")
public class SubmissionController {

    private final SubmissionOrchestrator orchestrator;
    private final SubmissionRepository submissions;

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "Submit a batch",
            description = """
                    Re-validates the batch, encodes (or reuses) its SIF file and transmits it through the connection.
                    
                    - `PROCESSING` — the bank accepted the file; poll `/check-status`
                    - `DRAFT` — the attempt failed and retries remain; see `lastError` and call `/retry`
                    """)
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Submission recorded",
                    content = @Content(schema = @Schema(implementation = SubmissionResponse.class))),
            @ApiResponse(responseCode = "409", description = "Connection not active, duplicate submission or batch state"),
            @ApiResponse(responseCode = "422", description = "Validation blocked the submission"),
            @ApiResponse(responseCode = "502", description = "Attempt failed and no retry is left")
    })
    public ResponseEntity<SubmissionResponse> submit(
            @Valid @RequestBody SubmitRequest request,
            @RequestHeader(value = ACTOR_HEADER, defaultValue = DEFAULT_ACTOR) String actor) {
        return ResponseEntity.status(HttpStatus.CREATED).body(SubmissionResponse.from(
                orchestrator.submit(request.getBatchReference(), request.getConnectionId(), request.getType(), actor)));
    }

    @GetMapping(value = "/{reference}", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Get a submission")
    public ResponseEntity<SubmissionResponse> get(@PathVariable("reference") String reference) {
        return ResponseEntity.ok(SubmissionResponse.from(submissions.require(reference)));
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "List a batch's submissions")
    public ResponseEntity<List<SubmissionResponse>> listByBatch(
            @Parameter(description = "Batch reference", example = "WPS-2026-00001", required = true)
            @RequestParam("batchReference") String batchReference) {
        return ResponseEntity.ok(submissions.findByBatch(batchReference).stream().map(SubmissionResponse::from).toList());
    }

    @PostMapping(value = "/{reference}/retry", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Retry a submission", description = "Same payload; only while retries remain.")
    public ResponseEntity<SubmissionResponse> retry(
            @PathVariable("reference") String reference,
            @RequestHeader(value = ACTOR_HEADER, defaultValue = DEFAULT_ACTOR) String actor) {
        return ResponseEntity.ok(SubmissionResponse.from(orchestrator.retry(reference, actor)));
    }

    @PostMapping(value = "/{reference}/check-status", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Ask the bank for the processing outcome",
            description = "Idempotent. A failing status call leaves the submission PROCESSING.")
    public ResponseEntity<SubmissionResponse> checkStatus(@PathVariable("reference") String reference) {
        return ResponseEntity.ok(SubmissionResponse.from(orchestrator.checkStatus(reference)));
    }

    @PostMapping(value = "/{reference}/cancel", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Cancel a submission", description = "Any non-terminal state; effective immediately.")
    public ResponseEntity<SubmissionResponse> cancel(
            @PathVariable("reference") String reference,
            @RequestHeader(value = ACTOR_HEADER, defaultValue = DEFAULT_ACTOR) String actor) {
        return ResponseEntity.ok(SubmissionResponse.from(orchestrator.cancel(reference, actor)));
    }

    @PostMapping(value = "/{reference}/manual-confirmation", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Confirm a manual portal upload")
    public ResponseEntity<SubmissionResponse> confirmManual(
            @PathVariable("reference") String reference,
            @Valid @RequestBody ManualConfirmationRequest request,
            @RequestHeader(value = ACTOR_HEADER, defaultValue = DEFAULT_ACTOR) String actor) {
        return ResponseEntity.ok(SubmissionResponse.from(orchestrator.confirmManual(
                reference, request.getAccepted(), request.getBankReference(), request.getMessage(), actor)));
    }
}
