package com.kreasipositif.bankregistry.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Binds the {@code bank-registry} section from application.yml.
 * Holds the UAE banks and exchange houses that can act as WPS agents.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "bank-registry")
public class BankRegistryProperties {

    private List<BankEntry> banks = new ArrayList<>();

    @Getter
    @Setter
    public static class BankEntry {
        /** Short code (e.g. "ENBD", "FAB"). */
        private String code;
        /** Human-readable bank name. */
        private String name;
        /** Nine-digit WPS routing (agent) code used in SIF files. */
        private String routingCode;
        /** SWIFT/BIC, 8 characters; empty for agents without one. */
        private String swiftCode;
        /** BANK or EXCHANGE_HOUSE. */
        private String bankType = "BANK";
        /** Whether the agent currently accepts WPS salary files. */
        private boolean wpsEnabled = true;
    }
}
