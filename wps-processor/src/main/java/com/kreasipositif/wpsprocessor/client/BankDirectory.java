package com.kreasipositif.wpsprocessor.client;

import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadFullException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cached, bulkhead-guarded view over {@link BankRegistryClient}.
 *
 * <p>Calls run inline on the caller's thread through the {@code bankRegistryBulkhead} semaphore,
 * so parallel line validation cannot flood the registry. Only positive answers are cached; a
 * negative answer may come from an unreachable registry and is asked again next time.
 */
@Slf4j
@Component
public class BankDirectory {

    private final BankRegistryClient client;
    private final Bulkhead bulkhead;

    private final Map<String, Boolean> knownRoutingCodes = new ConcurrentHashMap<>();
    private final Map<String, String> routingBySwift = new ConcurrentHashMap<>();

    public BankDirectory(BankRegistryClient client, @Qualifier("bankRegistryBulkhead") Bulkhead bulkhead) {
        this.client = client;
        this.bulkhead = bulkhead;
    }

    public boolean isKnownRoutingCode(String routingCode) {
        if (routingCode == null || routingCode.isBlank()) {
            return false;
        }
        if (knownRoutingCodes.containsKey(routingCode)) {
            return true;
        }
        try {
            boolean valid = Bulkhead.decorateSupplier(bulkhead, () -> client.isRoutingCodeValid(routingCode)).get();
            if (valid) {
                knownRoutingCodes.put(routingCode, Boolean.TRUE);
            }
            return valid;
        } catch (BulkheadFullException e) {
            log.warn("Bulkhead full while validating routing code '{}': {}", routingCode, e.getMessage());
            return false;
        }
    }

    /**
     * @return the WPS routing code registered for a SWIFT/BIC code
     */
    public Optional<String> routingCodeForSwift(String swiftCode) {
        if (swiftCode == null || swiftCode.isBlank()) {
            return Optional.empty();
        }
        String cached = routingBySwift.get(swiftCode);
        if (cached != null) {
            return Optional.of(cached);
        }
        try {
            Optional<String> routing = Bulkhead.decorateSupplier(bulkhead, () -> client.findBySwiftCode(swiftCode)).get()
                    .filter(e -> !Boolean.FALSE.equals(e.wpsEnabled()))
                    .map(BankRegistryClient.BankEntry::routingCode)
                    .filter(code -> !code.isBlank());
            routing.ifPresent(code -> {
                routingBySwift.put(swiftCode, code);
                knownRoutingCodes.put(code, Boolean.TRUE);
            });
            return routing;
        } catch (BulkheadFullException e) {
            log.warn("Bulkhead full while resolving SWIFT code '{}': {}", swiftCode, e.getMessage());
            return Optional.empty();
        }
    }
}
