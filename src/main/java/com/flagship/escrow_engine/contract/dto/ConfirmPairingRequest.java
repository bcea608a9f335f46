package com.flagship.escrow_engine.contract.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

@Value
public class ConfirmPairingRequest {

    @NotBlank(message = "Pairing code is required")
    @JsonProperty("code")
    String code;
}
