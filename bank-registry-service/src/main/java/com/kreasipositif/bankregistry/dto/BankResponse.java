package com.kreasipositif.bankregistry.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Getter;

/**
 * Response payload for a single WPS agent.
 */
@Getter
@Builder
@Schema(description = "A bank or exchange house registered as a WPS agent")
public class BankResponse {

    @Schema(description = "Short bank code", example = "ENBD")
    private final String code;

    @Schema(description = "Full bank name", example = "Emirates NBD")
    private final String name;

    @Schema(description = "Nine-digit WPS routing code", example = "302620122")
    private final String routingCode;

    @Schema(description = "SWIFT/BIC code", example = "EBILAEAD")
    private final String swiftCode;

    @Schema(description = "BANK or EXCHANGE_HOUSE", example = "BANK")
    private final String bankType;

    @Schema(description = "Whether the agent accepts WPS salary files", example = "true")
    private final boolean wpsEnabled;
}
