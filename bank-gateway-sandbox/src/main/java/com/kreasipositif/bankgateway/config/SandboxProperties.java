package com.kreasipositif.bankgateway.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Binds the {@code sandbox} section from application.yml.
 * <p>
 * Controls how the simulated bank channel answers: latency, accepted API keys, how many status
 * polls a file stays PROCESSING, and which employers the bank rejects at settlement.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "sandbox")
public class SandboxProperties {

    /**
     * Artificial delay in milliseconds applied to every upload and status call. Default: 200 ms.
     */
    private long latencyMs = 200;

    /** API keys accepted in the {@code X-API-Key} header. */
    private List<String> apiKeys = new ArrayList<>();

    /** Status polls answered PROCESSING before a file settles. */
    private int settleAfterPolls = 2;

    /** Employer IDs whose files are rejected at settlement (e.g. blocked employer accounts). */
    private List<String> blockedEmployers = new ArrayList<>();
}
