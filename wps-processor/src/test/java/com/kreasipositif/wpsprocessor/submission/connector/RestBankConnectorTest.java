package com.kreasipositif.wpsprocessor.submission.connector;

import com.kreasipositif.wpsprocessor.exception.TransmissionException;
import com.kreasipositif.wpsprocessor.submission.BankConnection;
import com.kreasipositif.wpsprocessor.submission.BankProtocol;
import com.kreasipositif.wpsprocessor.submission.ConnectionCredentials;
import com.kreasipositif.wpsprocessor.submission.ConnectionState;
import com.kreasipositif.wpsprocessor.submission.ConnectionTestResult;
import com.kreasipositif.wpsprocessor.submission.SubmissionType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class RestBankConnectorTest {

    private static final String ENDPOINT = "http://bank.test";
    private static final byte[] CONTENT = "EDR...\n".getBytes(StandardCharsets.US_ASCII);

    private MockRestServiceServer server;
    private RestBankConnector connector;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        connector = new RestBankConnector(builder);
    }

    @Test
    @DisplayName("Transmit posts the base64 file with hash and API key; acceptance carries the bank reference")
    void transmit_accepted() {
        server.expect(requestTo(ENDPOINT + "/api/v1/wps/files"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header(RestBankConnector.API_KEY_HEADER, "sandbox-key-001"))
                .andExpect(jsonPath("$.employerId").value("1000012345"))
                .andExpect(jsonPath("$.fileName").value("WPS_1000012345_202609.SIF"))
                .andExpect(jsonPath("$.submissionType").value("NEW"))
                .andExpect(jsonPath("$.content").value(Base64.getEncoder().encodeToString(CONTENT)))
                .andExpect(jsonPath("$.sha256").value("abc123"))
                .andExpect(jsonPath("$.size").value(CONTENT.length))
                .andRespond(withSuccess("""
                        {"accepted":true,"reference":"GW-000001","code":"000","message":"Received"}
                        """, MediaType.APPLICATION_JSON));

        ConnectorResponse response = connector.transmit(connection(), request());

        assertThat(response.accepted()).isTrue();
        assertThat(response.bankReference()).isEqualTo("GW-000001");
        assertThat(response.responseCode()).isEqualTo("000");
        server.verify();
    }

    @Test
    @DisplayName("HTTP 422 is a structural rejection, not a transport error")
    void transmit_rejectedWith422() {
        server.expect(requestTo(ENDPOINT + "/api/v1/wps/files"))
                .andRespond(withStatus(HttpStatus.UNPROCESSABLE_ENTITY)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("""
                                {"accepted":false,"code":"E101","message":"SHA-256 mismatch"}
                                """));

        ConnectorResponse response = connector.transmit(connection(), request());

        assertThat(response.accepted()).isFalse();
        assertThat(response.bankReference()).isNull();
        assertThat(response.responseCode()).isEqualTo("E101");
        assertThat(response.responseMessage()).isEqualTo("SHA-256 mismatch");
    }

    @Test
    @DisplayName("Other HTTP errors raise TransmissionException")
    void transmit_serverError() {
        server.expect(requestTo(ENDPOINT + "/api/v1/wps/files")).andRespond(withServerError());

        assertThatThrownBy(() -> connector.transmit(connection(), request()))
                .isInstanceOf(TransmissionException.class)
                .hasMessageContaining("HTTP 500");
    }

    @Test
    @DisplayName("Status words from the bank are mapped to bank statuses")
    void checkStatus_mapsStatusWord() {
        server.expect(requestTo(ENDPOINT + "/api/v1/wps/files/GW-000001/status"))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header(RestBankConnector.API_KEY_HEADER, "sandbox-key-001"))
                .andRespond(withSuccess("""
                        {"reference":"GW-000001","status":"PROCESSED","code":"000","message":"Salaries credited"}
                        """, MediaType.APPLICATION_JSON));

        StatusResponse status = connector.checkStatus(connection(), "GW-000001", "WPS_1000012345_202609.SIF");

        assertThat(status.status()).isEqualTo(BankStatus.SUCCESS);
        assertThat(status.message()).isEqualTo("Salaries credited");
    }

    @Test
    @DisplayName("Connection test reports an unreachable health endpoint without throwing")
    void test_failure() {
        server.expect(requestTo(ENDPOINT + "/api/v1/wps/health")).andRespond(withServerError());

        ConnectionTestResult result = connector.test(connection());

        assertThat(result.success()).isFalse();
        assertThat(result.testedAt()).isNotNull();
    }

    private static BankConnection connection() {
        return new BankConnection("ENBD-REST", "Emirates NBD", BankProtocol.REST, ENDPOINT, "1000012345", "302620122",
                new ConnectionCredentials("sandbox-key-001", null, null, null, null, null, null),
                ConnectionState.ACTIVE, null);
    }

    private static TransmitRequest request() {
        return new TransmitRequest("SUB-2026-00001", "WPS_1000012345_202609.SIF", CONTENT, "abc123", SubmissionType.NEW);
    }
}
