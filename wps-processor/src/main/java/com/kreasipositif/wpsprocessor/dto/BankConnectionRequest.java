package com.kreasipositif.wpsprocessor.dto;

import com.kreasipositif.wpsprocessor.submission.BankConnection;
import com.kreasipositif.wpsprocessor.submission.BankProtocol;
import com.kreasipositif.wpsprocessor.submission.ConnectionCredentials;
import com.kreasipositif.wpsprocessor.submission.ConnectionState;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@Schema(description = "Bank connection settings; a new or updated connection starts in DRAFT")
public class BankConnectionRequest {

    @NotBlank(message = "id must not be blank")
    @Schema(example = "enbd-rest", requiredMode = Schema.RequiredMode.REQUIRED)
    private String id;

    @NotBlank(message = "name must not be blank")
    @Schema(example = "Emirates NBD WPS API", requiredMode = Schema.RequiredMode.REQUIRED)
    private String name;

    @NotNull(message = "protocol is required")
    @Schema(example = "REST", requiredMode = Schema.RequiredMode.REQUIRED)
    private BankProtocol protocol;

    @Schema(example = "http://localhost:8082")
    private String endpoint;

    private String employerId;
    private String routingCode;
    private String apiKey;
    private String username;
    private String password;
    private String privateKeyPath;
    private String knownHostsPath;
    private String uploadPath;
    private String downloadPath;

    public BankConnection toConnection() {
        return new BankConnection(id, name, protocol, endpoint, employerId, routingCode,
                new ConnectionCredentials(apiKey, username, password, privateKeyPath, knownHostsPath,
                        uploadPath, downloadPath),
                ConnectionState.DRAFT, null);
    }
}
