package com.flagship.escrow_engine.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class RefundRequest {

    @NotBlank(message = "Refund reason is required")
    @Size(max = 500, message = "Refund reason must be at most 500 characters")
    @JsonProperty("reason")
    String reason;
}
