package com.kreasipositif.wpsprocessor.service;

import com.kreasipositif.wpsprocessor.config.WpsProperties;
import com.kreasipositif.wpsprocessor.config.WpsProperties.ConnectionEntry;
import com.kreasipositif.wpsprocessor.exception.InvalidStateTransitionException;
import com.kreasipositif.wpsprocessor.repository.BankConnectionRepository;
import com.kreasipositif.wpsprocessor.submission.BankConnection;
import com.kreasipositif.wpsprocessor.submission.ConnectionCredentials;
import com.kreasipositif.wpsprocessor.submission.ConnectionState;
import com.kreasipositif.wpsprocessor.submission.ConnectionTestResult;
import com.kreasipositif.wpsprocessor.submission.connector.BankConnectorRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Bank connection lifecycle.
 *
 * <pre>
 *  DRAFT ─► TESTING ─► (test result recorded) ─► DRAFT | ACTIVE (if it was active)
 *  DRAFT | SUSPENDED ─► ACTIVE   only with protocol-appropriate endpoint and credentials
 *  ACTIVE ─► SUSPENDED
 * </pre>
 * Connections listed under {@code wps.connections} are loaded at start-up.
 */
@Slf4j
@Service
public class BankConnectionService {

    private final BankConnectionRepository repository;
    private final BankConnectorRegistry connectors;

    public BankConnectionService(BankConnectionRepository repository, BankConnectorRegistry connectors,
                                 WpsProperties properties) {
        this.repository = repository;
        this.connectors = connectors;
        properties.getConnections().forEach(this::seed);
    }

    public List<BankConnection> list() {
        return repository.findAll();
    }

    public BankConnection get(String id) {
        return repository.require(id);
    }

    /** Creates or replaces a connection. The stored value always starts over in DRAFT. */
    public BankConnection save(BankConnection connection) {
        BankConnection draft = connection.withState(ConnectionState.DRAFT);
        repository.save(draft);
        log.info("Bank connection {} ({}, {}) saved as DRAFT", draft.id(), draft.protocol(), draft.endpoint());
        return draft;
    }

    public BankConnection test(String id) {
        BankConnection connection = repository.require(id);
        ConnectionState before = connection.state();
        repository.save(connection.withState(ConnectionState.TESTING));
        ConnectionTestResult result;
        try {
            result = connectors.forProtocol(connection.protocol()).test(connection);
        } catch (RuntimeException e) {
            log.error("Connection test for {} raised unexpectedly", id, e);
            result = ConnectionTestResult.failed(e.getMessage());
        }
        ConnectionState after = before == ConnectionState.TESTING ? ConnectionState.DRAFT : before;
        BankConnection tested = connection.withState(after).withTestResult(result);
        repository.save(tested);
        log.info("Connection test for {}: {} ({})", id, result.success() ? "OK" : "FAILED", result.message());
        return tested;
    }

    public BankConnection activate(String id) {
        BankConnection connection = repository.require(id);
        if (connection.isActive()) {
            return connection;
        }
        List<String> missing = connection.missingActivationSettings();
        if (!missing.isEmpty()) {
            throw new InvalidStateTransitionException(
                    "Connection %s cannot be activated; missing %s".formatted(id, String.join(", ", missing)));
        }
        BankConnection active = repository.save(connection.withState(ConnectionState.ACTIVE));
        log.info("Bank connection {} activated", id);
        return active;
    }

    public BankConnection suspend(String id) {
        BankConnection connection = repository.require(id);
        if (connection.state() != ConnectionState.ACTIVE) {
            throw new InvalidStateTransitionException(
                    "Only an ACTIVE connection can be suspended; %s is %s".formatted(id, connection.state()));
        }
        BankConnection suspended = repository.save(connection.withState(ConnectionState.SUSPENDED));
        log.info("Bank connection {} suspended", id);
        return suspended;
    }

    private void seed(ConnectionEntry entry) {
        BankConnection connection = save(new BankConnection(
                entry.getId(), entry.getName(), entry.getProtocol(), entry.getEndpoint(),
                entry.getEmployerId(), entry.getRoutingCode(),
                new ConnectionCredentials(entry.getApiKey(), entry.getUsername(), entry.getPassword(),
                        entry.getPrivateKeyPath(), entry.getKnownHostsPath(),
                        entry.getUploadPath(), entry.getDownloadPath()),
                ConnectionState.DRAFT, null));
        if (entry.isActive()) {
            if (connection.missingActivationSettings().isEmpty()) {
                activate(connection.id());
            } else {
                log.warn("Configured connection {} left in DRAFT; missing {}",
                        connection.id(), connection.missingActivationSettings());
            }
        }
    }
}
