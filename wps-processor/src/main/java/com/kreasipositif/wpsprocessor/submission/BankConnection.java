package com.kreasipositif.wpsprocessor.submission;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration of one bank's WPS submission channel. Immutable: state changes produce a new
 * instance, so a submission in flight keeps the exact settings it started with.
 *
 * @param employerId  employer's MOHRE establishment ID as registered with this bank
 * @param routingCode the bank's WPS routing (agent) code
 */
public record BankConnection(
        String id,
        String name,
        BankProtocol protocol,
        String endpoint,
        String employerId,
        String routingCode,
        ConnectionCredentials credentials,
        ConnectionState state,
        ConnectionTestResult lastTest) {

    public BankConnection {
        credentials = credentials == null ? ConnectionCredentials.none() : credentials;
        state = state == null ? ConnectionState.DRAFT : state;
    }

    public boolean isActive() {
        return state == ConnectionState.ACTIVE;
    }

    public BankConnection withState(ConnectionState newState) {
        return new BankConnection(id, name, protocol, endpoint, employerId, routingCode, credentials, newState, lastTest);
    }

    public BankConnection withTestResult(ConnectionTestResult result) {
        return new BankConnection(id, name, protocol, endpoint, employerId, routingCode, credentials, state, result);
    }

    /**
     * Settings that must be present before the connection may become ACTIVE.
     *
     * @return names of the missing settings, empty when activation is allowed
     */
    public List<String> missingActivationSettings() {
        List<String> missing = new ArrayList<>();
        if (!ConnectionCredentials.hasText(endpoint)) {
            missing.add("endpoint");
        }
        if (protocol == null) {
            missing.add("protocol");
            return missing;
        }
        switch (protocol) {
            case REST -> {
                if (!credentials.hasApiKey()) {
                    missing.add("apiKey");
                }
            }
            case SOAP -> {
                if (!credentials.hasUsername()) {
                    missing.add("username");
                }
                if (!credentials.hasPassword()) {
                    missing.add("password");
                }
            }
            case SFTP -> {
                if (!credentials.hasUsername()) {
                    missing.add("username");
                }
                if (!credentials.hasPassword() && !credentials.hasPrivateKey()) {
                    missing.add("password or privateKeyPath");
                }
                if (!ConnectionCredentials.hasText(credentials.uploadPath())) {
                    missing.add("uploadPath");
                }
            }
            case MANUAL_PORTAL -> {
                // portal URL in endpoint is enough
            }
        }
        return missing;
    }
}
