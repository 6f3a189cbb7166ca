package com.kreasipositif.bankregistry.service;

import com.kreasipositif.bankregistry.config.BankRegistryProperties;
import com.kreasipositif.bankregistry.config.BankRegistryProperties.BankEntry;
import com.kreasipositif.bankregistry.dto.BankResponse;
import com.kreasipositif.bankregistry.dto.RoutingCodeValidationResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Service layer for WPS agent lookups.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BankRegistryService {

    private static final int BIC_INSTITUTION_LENGTH = 8;

    private final BankRegistryProperties properties;

    /**
     * @param wpsEnabledOnly when {@code true}, agents that stopped accepting WPS files are left out
     */
    public List<BankResponse> getAllBanks(boolean wpsEnabledOnly) {
        return properties.getBanks().stream()
                .filter(e -> !wpsEnabledOnly || e.isWpsEnabled())
                .map(BankRegistryService::toResponse)
                .toList();
    }

    public Optional<BankResponse> findByCode(String code) {
        return properties.getBanks().stream()
                .filter(e -> e.getCode().equalsIgnoreCase(code))
                .findFirst()
                .map(BankRegistryService::toResponse);
    }

    public Optional<BankResponse> findByRoutingCode(String routingCode) {
        return find(routingCode).map(BankRegistryService::toResponse);
    }

    /**
     * Looks a bank up by SWIFT/BIC. An 11-character BIC matches on its 8-character institution
     * and location part, so branch codes resolve to the bank.
     */
    public Optional<BankResponse> findBySwiftCode(String swiftCode) {
        if (swiftCode == null || swiftCode.length() < BIC_INSTITUTION_LENGTH) {
            return Optional.empty();
        }
        String institution = swiftCode.substring(0, BIC_INSTITUTION_LENGTH);
        return properties.getBanks().stream()
                .filter(e -> e.getSwiftCode() != null && e.getSwiftCode().equalsIgnoreCase(institution))
                .findFirst()
                .map(BankRegistryService::toResponse);
    }

    /**
     * A routing code is valid when it is registered and the agent is WPS-enabled.
     */
    public RoutingCodeValidationResponse validateRoutingCode(String routingCode) {
        Optional<BankEntry> found = find(routingCode);
        boolean valid = found.map(BankEntry::isWpsEnabled).orElse(false);
        if (!valid) {
            log.debug("Routing code '{}' rejected ({})", routingCode, found.isPresent() ? "WPS disabled" : "unknown");
        }
        return RoutingCodeValidationResponse.builder()
                .routingCode(routingCode)
                .valid(valid)
                .bankName(found.map(BankEntry::getName).orElse(null))
                .build();
    }

    private Optional<BankEntry> find(String routingCode) {
        String code = routingCode == null ? "" : routingCode.trim();
        return properties.getBanks().stream()
                .filter(e -> code.equals(e.getRoutingCode()))
                .findFirst();
    }

    private static BankResponse toResponse(BankEntry entry) {
        return BankResponse.builder()
                .code(entry.getCode())
                .name(entry.getName())
                .routingCode(entry.getRoutingCode())
                .swiftCode(entry.getSwiftCode())
                .bankType(entry.getBankType())
                .wpsEnabled(entry.isWpsEnabled())
                .build();
    }
}
