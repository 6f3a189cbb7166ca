package com.kreasipositif.wpsprocessor.submission.connector;

import com.kreasipositif.wpsprocessor.exception.TransmissionException;
import com.kreasipositif.wpsprocessor.submission.BankConnection;
import com.kreasipositif.wpsprocessor.submission.BankProtocol;
import com.kreasipositif.wpsprocessor.submission.ConnectionCredentials;
import com.kreasipositif.wpsprocessor.submission.ConnectionState;
import com.kreasipositif.wpsprocessor.submission.SubmissionType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;
import org.w3c.dom.Document;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class SoapBankConnectorTest {

    private static final String ENDPOINT = "http://bank.test/wps/SalaryFileService";

    private MockRestServiceServer server;
    private SoapBankConnector connector;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        connector = new SoapBankConnector(builder);
    }

    @Test
    @DisplayName("Submit envelope carries escaped credentials and the reply is read regardless of prefix")
    void transmit_accepted() {
        server.expect(requestTo(ENDPOINT))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("SOAPAction", SoapBankConnector.SUBMIT_ACTION))
                .andExpect(content().string(containsString("<wps:Password>p&#38;ss&#60;</wps:Password>")))
                .andExpect(content().string(containsString("<wps:FileName>WPS_1000012345_202609.SIF</wps:FileName>")))
                .andRespond(withSuccess("""
                        <s:Envelope xmlns:s="http://schemas.xmlsoap.org/soap/envelope/" xmlns:b="urn:bank">
                          <s:Body>
                            <b:SubmitSalaryFileResponse>
                              <b:Accepted>true</b:Accepted>
                              <b:Reference>SOAP-77</b:Reference>
                              <b:Code>000</b:Code>
                              <b:Message>Queued</b:Message>
                            </b:SubmitSalaryFileResponse>
                          </s:Body>
                        </s:Envelope>
                        """, MediaType.TEXT_XML));

        ConnectorResponse response = connector.transmit(connection(), request());

        assertThat(response.accepted()).isTrue();
        assertThat(response.bankReference()).isEqualTo("SOAP-77");
        assertThat(response.responseMessage()).isEqualTo("Queued");
        server.verify();
    }

    @Test
    @DisplayName("A SOAP fault is a transmission error carrying the fault string")
    void transmit_fault() {
        server.expect(requestTo(ENDPOINT))
                .andRespond(withStatus(HttpStatus.INTERNAL_SERVER_ERROR)
                        .contentType(MediaType.TEXT_XML)
                        .body("""
                                <soapenv:Envelope xmlns:soapenv="http://schemas.xmlsoap.org/soap/envelope/">
                                  <soapenv:Body>
                                    <soapenv:Fault>
                                      <faultcode>soapenv:Client</faultcode>
                                      <faultstring>Invalid credentials</faultstring>
                                    </soapenv:Fault>
                                  </soapenv:Body>
                                </soapenv:Envelope>
                                """));

        assertThatThrownBy(() -> connector.transmit(connection(), request()))
                .isInstanceOf(TransmissionException.class)
                .hasMessage("SOAP fault: Invalid credentials");
    }

    @Test
    @DisplayName("Status reply maps REJECTED with its code and message")
    void checkStatus_rejected() {
        server.expect(requestTo(ENDPOINT))
                .andExpect(header("SOAPAction", SoapBankConnector.STATUS_ACTION))
                .andRespond(withSuccess("""
                        <Envelope><Body><GetFileStatusResponse>
                          <Status>REJECTED</Status><Code>E204</Code><Message>Account closed</Message>
                        </GetFileStatusResponse></Body></Envelope>
                        """, MediaType.TEXT_XML));

        StatusResponse status = connector.checkStatus(connection(), "SOAP-77", "WPS_1000012345_202609.SIF");

        assertThat(status.status()).isEqualTo(BankStatus.REJECTED);
        assertThat(status.code()).isEqualTo("E204");
    }

    @Test
    @DisplayName("Replies declaring a DOCTYPE are refused")
    void parse_refusesDoctype() {
        String hostile = """
                <?xml version="1.0"?>
                <!DOCTYPE foo [<!ENTITY xxe SYSTEM "file:///etc/passwd">]>
                <Envelope><Body>&xxe;</Body></Envelope>
                """;

        assertThatThrownBy(() -> SoapBankConnector.parse(hostile))
                .isInstanceOf(TransmissionException.class)
                .hasMessageStartingWith("Unreadable SOAP reply");
    }

    @Test
    @DisplayName("Missing elements read as null")
    void text_missingElement() {
        Document document = SoapBankConnector.parse("<Envelope><Body><Code> 000 </Code></Body></Envelope>");

        assertThat(SoapBankConnector.text(document, "Code")).isEqualTo("000");
        assertThat(SoapBankConnector.text(document, "Reference")).isNull();
    }

    private static BankConnection connection() {
        return new BankConnection("ADCB-SOAP", "ADCB", BankProtocol.SOAP, ENDPOINT, "1000012345", "600310101",
                new ConnectionCredentials(null, "wps-user", "p&ss<", null, null, null, null),
                ConnectionState.ACTIVE, null);
    }

    private static TransmitRequest request() {
        return new TransmitRequest("SUB-2026-00001", "WPS_1000012345_202609.SIF",
                "EDR\n".getBytes(StandardCharsets.US_ASCII), "abc123", SubmissionType.NEW);
    }
}
