package com.kreasipositif.wpsprocessor.submission.connector;

import com.kreasipositif.wpsprocessor.exception.WpsException;
import com.kreasipositif.wpsprocessor.submission.BankProtocol;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
public class BankConnectorRegistry {

    private final Map<BankProtocol, BankConnector> connectors = new EnumMap<>(BankProtocol.class);

    public BankConnectorRegistry(List<BankConnector> available) {
        for (BankConnector connector : available) {
            BankConnector previous = connectors.put(connector.protocol(), connector);
            if (previous != null) {
                throw new IllegalStateException("Two connectors registered for " + connector.protocol());
            }
        }
        log.info("Bank connectors registered: {}", connectors.keySet());
    }

    public BankConnector forProtocol(BankProtocol protocol) {
        BankConnector connector = connectors.get(protocol);
        if (connector == null) {
            throw new WpsException("No connector available for protocol " + protocol);
        }
        return connector;
    }
}
