package com.kreasipositif.wpsprocessor.submission.connector;

import com.kreasipositif.wpsprocessor.exception.TransmissionException;
import com.kreasipositif.wpsprocessor.submission.BankConnection;
import com.kreasipositif.wpsprocessor.submission.BankProtocol;
import com.kreasipositif.wpsprocessor.submission.ConnectionTestResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.Base64;

/**
 * Bank REST channel.
 *
 * <ul>
 *   <li>{@code POST {endpoint}/api/v1/wps/files}: base64 SIF content plus hash and metadata;
 *       replies {@code {accepted, reference, code, message}}. HTTP 422 carries the same body for
 *       a structural rejection.</li>
 *   <li>{@code GET {endpoint}/api/v1/wps/files/{reference}/status}</li>
 *   <li>{@code GET {endpoint}/api/v1/wps/health} for connection tests.</li>
 * </ul>
 * Every call carries the connection's API key in {@code X-API-Key}.
 */
@Slf4j
@Component
public class RestBankConnector implements BankConnector {

    static final String API_KEY_HEADER = "X-API-Key";

    private final RestClient.Builder builder;

    public RestBankConnector(RestClient.Builder builder) {
        this.builder = builder;
    }

    @Override
    public BankProtocol protocol() {
        return BankProtocol.REST;
    }

    @Override
    public ConnectorResponse transmit(BankConnection connection, TransmitRequest request) {
        FileSubmissionRequest body = new FileSubmissionRequest(
                connection.employerId(),
                connection.routingCode(),
                request.fileName(),
                request.type().name(),
                Base64.getEncoder().encodeToString(request.content()),
                request.sha256(),
                request.size());
        try {
            return client(connection).post()
                    .uri("/api/v1/wps/files")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .exchange((req, res) -> {
                        int status = res.getStatusCode().value();
                        if (res.getStatusCode().is2xxSuccessful() || status == HttpStatus.UNPROCESSABLE_ENTITY.value()) {
                            FileSubmissionResponse reply = res.bodyTo(FileSubmissionResponse.class);
                            if (reply == null) {
                                throw new TransmissionException("Bank returned HTTP %d with an empty body".formatted(status));
                            }
                            return Boolean.TRUE.equals(reply.accepted())
                                    ? ConnectorResponse.accepted(reply.reference(), reply.code(), reply.message())
                                    : ConnectorResponse.rejected(reply.code(), reply.message());
                        }
                        throw new TransmissionException("Bank returned HTTP %d for %s".formatted(status, request.fileName()));
                    });
        } catch (RestClientException e) {
            log.warn("REST transmission of {} to {} failed: {}", request.fileName(), connection.endpoint(), e.getMessage());
            throw new TransmissionException(e.getMessage(), e);
        }
    }

    @Override
    public StatusResponse checkStatus(BankConnection connection, String bankReference, String fileName) {
        try {
            FileStatusResponse reply = client(connection).get()
                    .uri("/api/v1/wps/files/{reference}/status", bankReference)
                    .retrieve()
                    .body(FileStatusResponse.class);
            if (reply == null) {
                throw new TransmissionException("Empty status reply for " + bankReference);
            }
            return new StatusResponse(BankStatus.parse(reply.status()), reply.code(), reply.message());
        } catch (RestClientException e) {
            throw new TransmissionException("Status check for %s failed: %s".formatted(bankReference, e.getMessage()), e);
        }
    }

    @Override
    public ConnectionTestResult test(BankConnection connection) {
        try {
            client(connection).get()
                    .uri("/api/v1/wps/health")
                    .retrieve()
                    .toBodilessEntity();
            return ConnectionTestResult.ok("Reached " + connection.endpoint());
        } catch (RestClientException | IllegalArgumentException e) {
            log.warn("REST connection test for {} failed: {}", connection.id(), e.getMessage());
            return ConnectionTestResult.failed(e.getMessage());
        }
    }

    private RestClient client(BankConnection connection) {
        return builder.clone()
                .baseUrl(connection.endpoint())
                .defaultHeader(API_KEY_HEADER, connection.credentials().apiKey())
                .build();
    }

    // ─── Request / Response records ──────────────────────────────────────────

    public record FileSubmissionRequest(
            String employerId,
            String routingCode,
            String fileName,
            String submissionType,
            String content,
            String sha256,
            int size) {}

    public record FileSubmissionResponse(Boolean accepted, String reference, String code, String message) {}

    public record FileStatusResponse(String reference, String status, String code, String message) {}
}
