package com.kreasipositif.wpsprocessor.config;

import com.kreasipositif.wpsprocessor.submission.BankProtocol;
import com.kreasipositif.wpsprocessor.validation.ValidationRuleDefinition;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Binds the {@code wps} section from application.yml.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "wps")
public class WpsProperties {

    /** Directory the SIF generation job writes files to. */
    private String outputDir = System.getProperty("java.io.tmpdir") + "/wps-output";

    /** Payroll register read by the line assembler. */
    private String payrollRegister = "classpath:data/payroll-register.csv";

    private Validation validation = new Validation();

    private Submission submission = new Submission();

    /** Static lookup collections for REFERENCE rules, keyed by collection name. */
    private Map<String, List<String>> referenceData = new LinkedHashMap<>();

    /** Bank connections seeded at start-up. */
    private List<ConnectionEntry> connections = new ArrayList<>();

    @Getter
    @Setter
    public static class Validation {
        /** Worker threads used for line-level rules. */
        private int parallelism = 4;
        private List<ValidationRuleDefinition> rules = new ArrayList<>();
    }

    @Getter
    @Setter
    public static class Submission {
        /** Attempts allowed before a submission becomes FAILED. */
        private int maxRetries = 3;
        /** Upper bound on one connector call; exceeding it counts as a failed attempt. */
        private Duration transmitTimeout = Duration.ofSeconds(30);
        /** Poll PROCESSING submissions for bank status. */
        private boolean statusPollingEnabled = true;
        private Duration statusPollInterval = Duration.ofMinutes(1);
        /** Re-attempt DRAFT submissions (failed attempts with budget left) on the poll cycle. */
        private boolean autoRetryEnabled = false;
    }

    @Getter
    @Setter
    public static class ConnectionEntry {
        private String id;
        private String name;
        private BankProtocol protocol;
        private String endpoint;
        private String employerId;
        private String routingCode;
        private String apiKey;
        private String username;
        private String password;
        private String privateKeyPath;
        private String knownHostsPath;
        private String uploadPath;
        private String downloadPath;
        /** Activate right after seeding when the credentials allow it. */
        private boolean active;
    }
}
