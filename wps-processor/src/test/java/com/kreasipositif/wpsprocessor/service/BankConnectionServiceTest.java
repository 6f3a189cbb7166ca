package com.kreasipositif.wpsprocessor.service;

import com.kreasipositif.wpsprocessor.config.WpsProperties;
import com.kreasipositif.wpsprocessor.config.WpsProperties.ConnectionEntry;
import com.kreasipositif.wpsprocessor.exception.InvalidStateTransitionException;
import com.kreasipositif.wpsprocessor.repository.BankConnectionRepository;
import com.kreasipositif.wpsprocessor.submission.BankConnection;
import com.kreasipositif.wpsprocessor.submission.BankProtocol;
import com.kreasipositif.wpsprocessor.submission.ConnectionCredentials;
import com.kreasipositif.wpsprocessor.submission.ConnectionState;
import com.kreasipositif.wpsprocessor.submission.ConnectionTestResult;
import com.kreasipositif.wpsprocessor.submission.connector.BankConnector;
import com.kreasipositif.wpsprocessor.submission.connector.BankConnectorRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BankConnectionServiceTest {

    @Mock private BankConnectorRegistry connectors;
    @Mock private BankConnector connector;

    private final BankConnectionRepository repository = new BankConnectionRepository();
    private BankConnectionService service;

    @BeforeEach
    void setUp() {
        WpsProperties properties = new WpsProperties();
        properties.setConnections(List.of(
                entry("ENBD-REST", BankProtocol.REST, "sandbox-key-001", null, true),
                entry("FAB-SFTP", BankProtocol.SFTP, null, "/inbound/wps", true)));
        service = new BankConnectionService(repository, connectors, properties);
    }

    @Test
    @DisplayName("Configured connections are seeded; active ones only when their settings are complete")
    void seeding_activatesCompleteConnections() {
        assertThat(service.get("ENBD-REST").state()).isEqualTo(ConnectionState.ACTIVE);
        assertThat(service.get("FAB-SFTP").state()).isEqualTo(ConnectionState.DRAFT);
        assertThat(service.list()).hasSize(2);
    }

    @Test
    @DisplayName("Activation lists the missing protocol settings")
    void activate_reportsMissingSettings() {
        assertThatThrownBy(() -> service.activate("FAB-SFTP"))
                .isInstanceOf(InvalidStateTransitionException.class)
                .hasMessageContaining("username")
                .hasMessageContaining("password or privateKeyPath");
    }

    @Test
    @DisplayName("Saving a connection always starts it over in DRAFT")
    void save_resetsToDraft() {
        BankConnection saved = service.save(new BankConnection("ADCB-SOAP", "ADCB", BankProtocol.SOAP,
                "https://h2h.adcb.test/wps", "1000012345", "600310101",
                new ConnectionCredentials(null, "wps", "secret", null, null, null, null),
                ConnectionState.ACTIVE, null));

        assertThat(saved.state()).isEqualTo(ConnectionState.DRAFT);
        assertThat(service.activate("ADCB-SOAP").state()).isEqualTo(ConnectionState.ACTIVE);
    }

    @Test
    @DisplayName("Suspend is only allowed from ACTIVE")
    void suspend_onlyFromActive() {
        assertThat(service.suspend("ENBD-REST").state()).isEqualTo(ConnectionState.SUSPENDED);
        assertThatThrownBy(() -> service.suspend("ENBD-REST"))
                .isInstanceOf(InvalidStateTransitionException.class);
        assertThat(service.activate("ENBD-REST").state()).isEqualTo(ConnectionState.ACTIVE);
    }

    @Test
    @DisplayName("A connection test records its result and keeps the previous state")
    void test_recordsResult() {
        when(connectors.forProtocol(BankProtocol.REST)).thenReturn(connector);
        when(connector.test(any())).thenReturn(ConnectionTestResult.failed("Connection refused"));

        BankConnection tested = service.test("ENBD-REST");

        assertThat(tested.state()).isEqualTo(ConnectionState.ACTIVE);
        assertThat(tested.lastTest().success()).isFalse();
        assertThat(service.get("ENBD-REST").lastTest().message()).isEqualTo("Connection refused");
    }

    @Test
    @DisplayName("A connector that throws during a test yields a failed result")
    void test_connectorThrows() {
        when(connectors.forProtocol(BankProtocol.SFTP)).thenReturn(connector);
        when(connector.test(any())).thenThrow(new IllegalStateException("boom"));

        BankConnection tested = service.test("FAB-SFTP");

        assertThat(tested.state()).isEqualTo(ConnectionState.DRAFT);
        assertThat(tested.lastTest().success()).isFalse();
        assertThat(tested.lastTest().message()).isEqualTo("boom");
    }

    private static ConnectionEntry entry(String id, BankProtocol protocol, String apiKey, String uploadPath, boolean active) {
        ConnectionEntry entry = new ConnectionEntry();
        entry.setId(id);
        entry.setName(id);
        entry.setProtocol(protocol);
        entry.setEndpoint("http://bank.test");
        entry.setEmployerId("1000012345");
        entry.setRoutingCode("302620122");
        entry.setApiKey(apiKey);
        entry.setUploadPath(uploadPath);
        entry.setActive(active);
        return entry;
    }
}
