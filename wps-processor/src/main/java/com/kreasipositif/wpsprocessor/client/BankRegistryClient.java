package com.kreasipositif.wpsprocessor.client;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.Optional;

/**
 * REST client for the bank-registry-service (port 8081).
 *
 * <p>Provides the two lookups the pipeline needs:
 * <ul>
 *   <li>Validate a WPS routing code (agent ID) against the registry.</li>
 *   <li>Resolve a bank's SWIFT/BIC code to its WPS routing code.</li>
 * </ul>
 * Both degrade to a negative answer when the registry cannot be reached.
 */
@Slf4j
@Component
public class BankRegistryClient {

    private final RestClient restClient;

    public BankRegistryClient(
            RestClient.Builder builder,
            @Value("${downstream.bank-registry-service.base-url}") String baseUrl) {
        this.restClient = builder.baseUrl(baseUrl).build();
    }

    // ─── Routing-code validation ─────────────────────────────────────────────

    /**
     * Calls {@code GET /api/v1/registry/banks/routing-codes/{code}/validate}.
     *
     * @return {@code true} if the registry knows the routing code and the bank is WPS-enabled
     */
    public boolean isRoutingCodeValid(String routingCode) {
        try {
            RoutingCodeValidationResponse response = restClient.get()
                    .uri("/api/v1/registry/banks/routing-codes/{code}/validate", routingCode)
                    .retrieve()
                    .body(RoutingCodeValidationResponse.class);
            return response != null && Boolean.TRUE.equals(response.valid());
        } catch (RestClientException e) {
            log.warn("Routing-code validation call failed for code='{}': {}", routingCode, e.getMessage());
            return false;
        }
    }

    // ─── SWIFT lookup ────────────────────────────────────────────────────────

    /**
     * Calls {@code GET /api/v1/registry/banks/swift/{bic}}.
     *
     * @return the registry entry, or empty when unknown or the registry is unreachable
     */
    public Optional<BankEntry> findBySwiftCode(String swiftCode) {
        try {
            return Optional.ofNullable(restClient.get()
                    .uri("/api/v1/registry/banks/swift/{bic}", swiftCode)
                    .retrieve()
                    .body(BankEntry.class));
        } catch (HttpClientErrorException.NotFound e) {
            log.debug("SWIFT code '{}' not in registry", swiftCode);
            return Optional.empty();
        } catch (RestClientException e) {
            log.warn("SWIFT lookup failed for bic='{}': {}", swiftCode, e.getMessage());
            return Optional.empty();
        }
    }

    // ─── Response records ────────────────────────────────────────────────────

    public record RoutingCodeValidationResponse(String routingCode, Boolean valid, String bankName) {}

    public record BankEntry(String code, String name, String routingCode, String swiftCode,
                            String bankType, Boolean wpsEnabled) {}
}
