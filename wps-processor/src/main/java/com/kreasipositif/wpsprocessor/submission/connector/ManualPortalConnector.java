package com.kreasipositif.wpsprocessor.submission.connector;

import com.kreasipositif.wpsprocessor.submission.BankConnection;
import com.kreasipositif.wpsprocessor.submission.BankProtocol;
import com.kreasipositif.wpsprocessor.submission.ConnectionTestResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Banks without an integration channel. "Transmitting" parks the file for an operator to
 * upload on the bank's portal; the outcome is entered later through manual confirmation.
 */
@Slf4j
@Component
public class ManualPortalConnector implements BankConnector {

    static final String PENDING = "PENDING";

    @Override
    public BankProtocol protocol() {
        return BankProtocol.MANUAL_PORTAL;
    }

    @Override
    public ConnectorResponse transmit(BankConnection connection, TransmitRequest request) {
        log.info("File {} awaits manual upload on {}", request.fileName(), connection.endpoint());
        return ConnectorResponse.accepted("MANUAL-" + request.submissionReference(), PENDING,
                "Upload %s on the bank portal %s and confirm the outcome".formatted(request.fileName(), connection.endpoint()));
    }

    @Override
    public StatusResponse checkStatus(BankConnection connection, String bankReference, String fileName) {
        return StatusResponse.processing("Awaiting manual confirmation");
    }

    @Override
    public ConnectionTestResult test(BankConnection connection) {
        return connection.endpoint() == null || connection.endpoint().isBlank()
                ? ConnectionTestResult.failed("No portal URL configured")
                : ConnectionTestResult.ok("Manual portal " + connection.endpoint());
    }
}
