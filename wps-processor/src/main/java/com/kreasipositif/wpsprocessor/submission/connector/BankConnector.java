package com.kreasipositif.wpsprocessor.submission.connector;

import com.kreasipositif.wpsprocessor.submission.BankConnection;
import com.kreasipositif.wpsprocessor.submission.BankProtocol;
import com.kreasipositif.wpsprocessor.submission.ConnectionTestResult;

/**
 * One bank submission channel.
 *
 * <p>Implementations are stateless; everything they need comes from the {@link BankConnection}
 * passed with each call. Calls block and may be slow; the orchestrator runs them on the
 * connector thread pool under a time limit. A transport failure is reported by throwing
 * {@link com.kreasipositif.wpsprocessor.exception.TransmissionException}; a bank that answers
 * with a refusal is reported as {@link ConnectorResponse#rejected}.
 */
public interface BankConnector {

    BankProtocol protocol();

    ConnectorResponse transmit(BankConnection connection, TransmitRequest request);

    /**
     * @param fileName name the file was transmitted under, for channels that track files by name
     */
    StatusResponse checkStatus(BankConnection connection, String bankReference, String fileName);

    /** Reachability and configuration check. Never throws. */
    ConnectionTestResult test(BankConnection connection);
}
