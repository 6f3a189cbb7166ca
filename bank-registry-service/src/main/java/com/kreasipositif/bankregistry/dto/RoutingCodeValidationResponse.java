package com.kreasipositif.bankregistry.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Getter;

/**
 * Response payload for a routing-code validation check.
 */
@Getter
@Builder
@Schema(description = "Result of a WPS routing code lookup")
public class RoutingCodeValidationResponse {

    @Schema(description = "The routing code that was checked", example = "302620122")
    private final String routingCode;

    @Schema(description = "Known and WPS-enabled", example = "true")
    private final boolean valid;

    @Schema(description = "Bank name, present when the routing code is known", example = "Emirates NBD")
    private final String bankName;
}
