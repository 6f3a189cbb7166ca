package com.kreasipositif.wpsprocessor.dto;

import com.kreasipositif.wpsprocessor.submission.BankConnection;
import com.kreasipositif.wpsprocessor.submission.BankProtocol;
import com.kreasipositif.wpsprocessor.submission.ConnectionState;
import com.kreasipositif.wpsprocessor.submission.ConnectionTestResult;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

/**
 * Connection as shown over the API. Secrets are never returned, only whether they are set.
 */
@Getter
@Builder
@Schema(description = "Bank submission channel")
public class BankConnectionResponse {

    private final String id;
    private final String name;
    private final BankProtocol protocol;
    private final String endpoint;
    private final String employerId;
    private final String routingCode;
    private final ConnectionState state;
    private final boolean apiKeySet;
    private final String username;
    private final boolean passwordSet;
    private final boolean privateKeySet;
    private final String uploadPath;
    private final String downloadPath;
    private final ConnectionTestResult lastTest;

    @Schema(description = "Settings still missing before the connection can be activated")
    private final List<String> missingSettings;

    public static BankConnectionResponse from(BankConnection connection) {
        return BankConnectionResponse.builder()
                .id(connection.id())
                .name(connection.name())
                .protocol(connection.protocol())
                .endpoint(connection.endpoint())
                .employerId(connection.employerId())
                .routingCode(connection.routingCode())
                .state(connection.state())
                .apiKeySet(connection.credentials().hasApiKey())
                .username(connection.credentials().username())
                .passwordSet(connection.credentials().hasPassword())
                .privateKeySet(connection.credentials().hasPrivateKey())
                .uploadPath(connection.credentials().uploadPath())
                .downloadPath(connection.credentials().downloadPath())
                .lastTest(connection.lastTest())
                .missingSettings(connection.missingActivationSettings())
                .build();
    }
}
