package com.kreasipositif.wpsprocessor.controller;

import com.kreasipositif.wpsprocessor.dto.BankConnectionRequest;
import com.kreasipositif.wpsprocessor.dto.BankConnectionResponse;
import com.kreasipositif.wpsprocessor.service.BankConnectionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/wps/connections")
@RequiredArgsConstructor
@Tag(name = "Bank Connections", description = "Configure, test, activate and suspend bank submission channels")
public class BankConnectionController {

    private final BankConnectionService connectionService;

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "List connections")
    public ResponseEntity<List<BankConnectionResponse>> list() {
        return ResponseEntity.ok(connectionService.list().stream().map(BankConnectionResponse::from).toList());
    }

    @GetMapping(value = "/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Get a connection")
    public ResponseEntity<BankConnectionResponse> get(@PathVariable("id") String id) {
        return ResponseEntity.ok(BankConnectionResponse.from(connectionService.get(id)));
    }

    @PutMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Create or replace a connection", description = "The saved connection is in DRAFT.")
    public ResponseEntity<BankConnectionResponse> save(@Valid @RequestBody BankConnectionRequest request) {
        return ResponseEntity.ok(BankConnectionResponse.from(connectionService.save(request.toConnection())));
    }

    @PostMapping(value = "/{id}/test", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Test a connection", description = "Checks reachability; the result is stored on the connection.")
    public ResponseEntity<BankConnectionResponse> test(@PathVariable("id") String id) {
        return ResponseEntity.ok(BankConnectionResponse.from(connectionService.test(id)));
    }

    @PostMapping(value = "/{id}/activate", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Activate a connection",
            description = "Refused (409) while the protocol's endpoint or credentials are missing.")
    public ResponseEntity<BankConnectionResponse> activate(@PathVariable("id") String id) {
        return ResponseEntity.ok(BankConnectionResponse.from(connectionService.activate(id)));
    }

    @PostMapping(value = "/{id}/suspend", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Suspend a connection")
    public ResponseEntity<BankConnectionResponse> suspend(@PathVariable("id") String id) {
        return ResponseEntity.ok(BankConnectionResponse.from(connectionService.suspend(id)));
    }
}
