package com.kreasipositif.wpsprocessor.submission.connector;

import com.kreasipositif.wpsprocessor.exception.TransmissionException;
import com.kreasipositif.wpsprocessor.submission.BankConnection;
import com.kreasipositif.wpsprocessor.submission.BankProtocol;
import com.kreasipositif.wpsprocessor.submission.ConnectionTestResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.util.HtmlUtils;
import org.w3c.dom.Document;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Bank SOAP 1.1 channel. Envelopes are posted as {@code text/xml} with a {@code SOAPAction}
 * header; replies are read by element local name so namespace prefixes do not matter.
 */
@Slf4j
@Component
public class SoapBankConnector implements BankConnector {

    static final String SUBMIT_ACTION = "SubmitSalaryFile";
    static final String STATUS_ACTION = "GetFileStatus";

    private static final MediaType TEXT_XML = MediaType.parseMediaType("text/xml;charset=UTF-8");

    private static final String ENVELOPE = """
            <?xml version="1.0" encoding="UTF-8"?>
            <soapenv:Envelope xmlns:soapenv="http://schemas.xmlsoap.org/soap/envelope/" xmlns:wps="urn:wps:salary-file">
              <soapenv:Header>
                <wps:Credentials>
                  <wps:Username>%s</wps:Username>
                  <wps:Password>%s</wps:Password>
                </wps:Credentials>
              </soapenv:Header>
              <soapenv:Body>
            %s
              </soapenv:Body>
            </soapenv:Envelope>
            """;

    private final RestClient.Builder builder;

    public SoapBankConnector(RestClient.Builder builder) {
        this.builder = builder;
    }

    @Override
    public BankProtocol protocol() {
        return BankProtocol.SOAP;
    }

    @Override
    public ConnectorResponse transmit(BankConnection connection, TransmitRequest request) {
        String body = """
                    <wps:SubmitSalaryFile>
                      <wps:EmployerId>%s</wps:EmployerId>
                      <wps:RoutingCode>%s</wps:RoutingCode>
                      <wps:FileName>%s</wps:FileName>
                      <wps:SubmissionType>%s</wps:SubmissionType>
                      <wps:Sha256>%s</wps:Sha256>
                      <wps:Size>%d</wps:Size>
                      <wps:Content>%s</wps:Content>
                    </wps:SubmitSalaryFile>""".formatted(
                xml(connection.employerId()),
                xml(connection.routingCode()),
                xml(request.fileName()),
                request.type().name(),
                request.sha256(),
                request.size(),
                Base64.getEncoder().encodeToString(request.content()));

        Document reply = call(connection, SUBMIT_ACTION, body);
        boolean accepted = Boolean.parseBoolean(text(reply, "Accepted"));
        String code = text(reply, "Code");
        String message = text(reply, "Message");
        return accepted
                ? ConnectorResponse.accepted(text(reply, "Reference"), code, message)
                : ConnectorResponse.rejected(code, message);
    }

    @Override
    public StatusResponse checkStatus(BankConnection connection, String bankReference, String fileName) {
        String body = """
                    <wps:GetFileStatus>
                      <wps:Reference>%s</wps:Reference>
                    </wps:GetFileStatus>""".formatted(xml(bankReference));
        Document reply = call(connection, STATUS_ACTION, body);
        return new StatusResponse(BankStatus.parse(text(reply, "Status")), text(reply, "Code"), text(reply, "Message"));
    }

    @Override
    public ConnectionTestResult test(BankConnection connection) {
        try {
            client().get()
                    .uri(connection.endpoint() + "?wsdl")
                    .retrieve()
                    .toBodilessEntity();
            return ConnectionTestResult.ok("WSDL reachable at " + connection.endpoint());
        } catch (RestClientException | IllegalArgumentException e) {
            log.warn("SOAP connection test for {} failed: {}", connection.id(), e.getMessage());
            return ConnectionTestResult.failed(e.getMessage());
        }
    }

    // ─── Envelope plumbing ───────────────────────────────────────────────────

    private Document call(BankConnection connection, String action, String body) {
        String envelope = ENVELOPE.formatted(
                xml(connection.credentials().username()),
                xml(connection.credentials().password()),
                body);
        String response;
        try {
            response = client().post()
                    .uri(connection.endpoint())
                    .contentType(TEXT_XML)
                    .header("SOAPAction", action)
                    .body(envelope)
                    .exchange((req, res) -> {
                        // SOAP faults arrive as HTTP 500 with a parsable body
                        String text = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                        if (!res.getStatusCode().is2xxSuccessful() && !text.contains("Fault")) {
                            throw new TransmissionException("SOAP %s returned HTTP %d".formatted(action, res.getStatusCode().value()));
                        }
                        return text;
                    });
        } catch (RestClientException e) {
            log.warn("SOAP {} to {} failed: {}", action, connection.endpoint(), e.getMessage());
            throw new TransmissionException(e.getMessage(), e);
        }
        Document document = parse(response);
        String fault = text(document, "faultstring");
        if (fault != null) {
            throw new TransmissionException("SOAP fault: " + fault);
        }
        return document;
    }

    static Document parse(String xml) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "");
            DocumentBuilder documentBuilder = factory.newDocumentBuilder();
            return documentBuilder.parse(new InputSource(new StringReader(xml)));
        } catch (Exception e) {
            throw new TransmissionException("Unreadable SOAP reply: " + e.getMessage(), e);
        }
    }

    static String text(Document document, String localName) {
        NodeList nodes = document.getElementsByTagNameNS("*", localName);
        if (nodes.getLength() == 0) {
            return null;
        }
        String value = nodes.item(0).getTextContent();
        return value == null ? null : value.trim();
    }

    private RestClient client() {
        return builder.clone().build();
    }

    private static String xml(String value) {
        return value == null ? "" : HtmlUtils.htmlEscapeDecimal(value);
    }
}
