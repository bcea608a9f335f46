package com.flagship.escrow_engine.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

@Value
public class CaptureRequest {

    @NotBlank(message = "Order ID is required")
    @JsonProperty("order_id")
    String orderId;
}
