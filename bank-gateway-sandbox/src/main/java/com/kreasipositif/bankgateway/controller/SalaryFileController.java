package com.kreasipositif.bankgateway.controller;

import com.kreasipositif.bankgateway.dto.FileStatusResponse;
import com.kreasipositif.bankgateway.dto.FileSubmissionRequest;
import com.kreasipositif.bankgateway.dto.FileSubmissionResponse;
import com.kreasipositif.bankgateway.service.SalaryFileService;
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
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST controller for the simulated bank WPS channel.
 *
 * <p>Every endpoint requires a configured API key in {@code X-API-Key} and applies the
 * configured latency (default 200 ms).
 */
@RestController
@RequestMapping("/api/v1/wps")
@RequiredArgsConstructor
@Tag(
        name = "WPS Files",
        description = """
                Host-to-host salary file channel. Files are checked on receipt and settle
                after a configurable number of status polls.
                """
)
public class SalaryFileController {

    static final String API_KEY_HEADER = "X-API-Key";

    private final SalaryFileService salaryFileService;

    @PostMapping(
            value = "/files",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE
    )
    @Operation(
            summary = "Upload a SIF file",
            description = """
                    Receives a base64-encoded SIF file with its SHA-256 and size.

                    Rejection codes (HTTP 422):
                    - `E100` — content is not base64
                    - `E101` — size or hash does not match the content
                    - `E102` — SIF structure, record count or total is wrong
                    - `E103` — EDR employer differs from the uploader
                    - `E104` — same file already received as NEW
                    """
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "File accepted; poll the returned reference",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON_VALUE,
                            schema = @Schema(implementation = FileSubmissionResponse.class)
                    )
            ),
            @ApiResponse(
                    responseCode = "422",
                    description = "File rejected on receipt",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON_VALUE,
                            schema = @Schema(implementation = FileSubmissionResponse.class)
                    )
            ),
            @ApiResponse(responseCode = "400", description = "Required fields missing"),
            @ApiResponse(responseCode = "401", description = "Missing or unknown API key")
    })
    public ResponseEntity<FileSubmissionResponse> upload(
            @Parameter(description = "Channel API key") @RequestHeader(value = API_KEY_HEADER, required = false) String apiKey,
            @Valid @RequestBody FileSubmissionRequest request) {
        FileSubmissionResponse response = salaryFileService.receive(apiKey, request);
        return ResponseEntity
                .status(response.isAccepted() ? HttpStatus.OK : HttpStatus.UNPROCESSABLE_ENTITY)
                .body(response);
    }

    @GetMapping(value = "/files/{reference}/status", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "Settlement status of an uploaded file",
            description = "Returns `PROCESSING`, then `SUCCESS` or `REJECTED` once the file has settled."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Current status"),
            @ApiResponse(responseCode = "401", description = "Missing or unknown API key"),
            @ApiResponse(responseCode = "404", description = "Unknown reference")
    })
    public FileStatusResponse status(
            @RequestHeader(value = API_KEY_HEADER, required = false) String apiKey,
            @PathVariable String reference) {
        return salaryFileService.status(apiKey, reference);
    }

    @GetMapping(value = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Connection test", description = "Succeeds when the API key is accepted.")
    public Map<String, String> health(@RequestHeader(value = API_KEY_HEADER, required = false) String apiKey) {
        salaryFileService.health(apiKey);
        return Map.of("status", "UP");
    }
}
