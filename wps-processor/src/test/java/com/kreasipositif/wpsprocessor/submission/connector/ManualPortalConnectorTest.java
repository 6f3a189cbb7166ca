package com.kreasipositif.wpsprocessor.submission.connector;

import com.kreasipositif.wpsprocessor.submission.BankConnection;
import com.kreasipositif.wpsprocessor.submission.BankProtocol;
import com.kreasipositif.wpsprocessor.submission.ConnectionState;
import com.kreasipositif.wpsprocessor.submission.SubmissionType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ManualPortalConnectorTest {

    private final ManualPortalConnector connector = new ManualPortalConnector();

    @Test
    @DisplayName("Transmission parks the file and waits for manual confirmation")
    void transmit_parksFile() {
        BankConnection portal = new BankConnection("MOHRE-PORTAL", "MOHRE", BankProtocol.MANUAL_PORTAL,
                "https://eservices.mohre.gov.ae", "1000012345", null, null, ConnectionState.ACTIVE, null);

        ConnectorResponse response = connector.transmit(portal,
                new TransmitRequest("SUB-2026-00007", "WPS_1000012345_202609.SIF", new byte[]{1}, "h", SubmissionType.NEW));

        assertThat(response.accepted()).isTrue();
        assertThat(response.bankReference()).isEqualTo("MANUAL-SUB-2026-00007");
        assertThat(response.responseCode()).isEqualTo(ManualPortalConnector.PENDING);
        assertThat(connector.checkStatus(portal, response.bankReference(), "x").status())
                .isEqualTo(BankStatus.PROCESSING);
    }

    @Test
    @DisplayName("Connection test needs a portal URL")
    void test_requiresUrl() {
        BankConnection noUrl = new BankConnection("P", "P", BankProtocol.MANUAL_PORTAL,
                " ", null, null, null, ConnectionState.DRAFT, null);

        assertThat(connector.test(noUrl).success()).isFalse();
    }
}
