package com.flagship.escrow_engine.contract.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;
import lombok.Value;

/**
 * Free-text reason for dispute, cancellation and deletion. Required or not
 * depending on the operation.
 */
@Value
public class ReasonRequest {

    @Size(max = 1000, message = "Reason must be at most 1000 characters")
    @JsonProperty("reason")
    String reason;
}
