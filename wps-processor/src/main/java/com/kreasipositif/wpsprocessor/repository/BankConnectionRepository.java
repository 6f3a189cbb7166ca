package com.kreasipositif.wpsprocessor.repository;

import com.kreasipositif.wpsprocessor.exception.ConnectionNotFoundException;
import com.kreasipositif.wpsprocessor.submission.BankConnection;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Connections are immutable values; an update replaces the stored instance.
 */
@Repository
public class BankConnectionRepository {

    private final Map<String, BankConnection> connections = new ConcurrentHashMap<>();

    public BankConnection save(BankConnection connection) {
        connections.put(connection.id(), connection);
        return connection;
    }

    public Optional<BankConnection> findById(String id) {
        return Optional.ofNullable(connections.get(id));
    }

    public BankConnection require(String id) {
        return findById(id).orElseThrow(() -> new ConnectionNotFoundException("Bank connection not found: " + id));
    }

    public List<BankConnection> findAll() {
        return connections.values().stream()
                .sorted(Comparator.comparing(BankConnection::id))
                .toList();
    }
}
