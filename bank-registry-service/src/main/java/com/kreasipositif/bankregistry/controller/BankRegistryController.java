package com.kreasipositif.bankregistry.controller;

import com.kreasipositif.bankregistry.dto.BankResponse;
import com.kreasipositif.bankregistry.dto.RoutingCodeValidationResponse;
import com.kreasipositif.bankregistry.service.BankRegistryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller exposing the WPS agent directory.
 */
@RestController
@RequestMapping("/api/v1/registry/banks")
@RequiredArgsConstructor
@Tag(name = "Bank Registry", description = "Look up UAE banks and exchange houses registered as WPS agents")
public class BankRegistryController {

    private final BankRegistryService bankRegistryService;

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "List WPS agents")
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Registered agents",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON_VALUE,
                            array = @ArraySchema(schema = @Schema(implementation = BankResponse.class))
                    )
            )
    })
    public ResponseEntity<List<BankResponse>> getAllBanks(
            @Parameter(description = "Only agents that currently accept WPS files")
            @RequestParam(value = "wpsEnabled", defaultValue = "false") boolean wpsEnabledOnly) {
        return ResponseEntity.ok(bankRegistryService.getAllBanks(wpsEnabledOnly));
    }

    @GetMapping(value = "/{code}", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Get an agent by short code")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Agent found",
                    content = @Content(schema = @Schema(implementation = BankResponse.class))),
            @ApiResponse(responseCode = "404", description = "Unknown code")
    })
    public ResponseEntity<BankResponse> getBank(
            @Parameter(name = "code", description = "Short bank code (case-insensitive)", example = "ENBD", required = true)
            @PathVariable("code") String code) {
        return ResponseEntity.of(bankRegistryService.findByCode(code));
    }

    @GetMapping(value = "/routing-codes/{routingCode}", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Get an agent by WPS routing code")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Agent found",
                    content = @Content(schema = @Schema(implementation = BankResponse.class))),
            @ApiResponse(responseCode = "404", description = "Unknown routing code")
    })
    public ResponseEntity<BankResponse> getByRoutingCode(
            @Parameter(name = "routingCode", example = "302620122", required = true)
            @PathVariable("routingCode") String routingCode) {
        return ResponseEntity.of(bankRegistryService.findByRoutingCode(routingCode));
    }

    @GetMapping(value = "/routing-codes/{routingCode}/validate", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "Validate a WPS routing code",
            description = "A routing code is valid when it is registered and the agent is WPS-enabled."
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Validation result returned (valid or invalid)",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON_VALUE,
                            schema = @Schema(implementation = RoutingCodeValidationResponse.class)
                    )
            )
    })
    public ResponseEntity<RoutingCodeValidationResponse> validateRoutingCode(
            @Parameter(name = "routingCode", description = "Nine-digit routing code", example = "302620122", required = true)
            @PathVariable("routingCode") String routingCode) {
        return ResponseEntity.ok(bankRegistryService.validateRoutingCode(routingCode));
    }

    @GetMapping(value = "/swift/{bic}", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Resolve a SWIFT/BIC code to its agent and routing code")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Agent found",
                    content = @Content(schema = @Schema(implementation = BankResponse.class))),
            @ApiResponse(responseCode = "404", description = "No agent with that SWIFT code")
    })
    public ResponseEntity<BankResponse> getBySwiftCode(
            @Parameter(name = "bic", description = "8 or 11 character BIC", example = "NBADAEAA", required = true)
            @PathVariable("bic") String bic) {
        return ResponseEntity.of(bankRegistryService.findBySwiftCode(bic));
    }
}
