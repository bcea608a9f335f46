package com.flagship.escrow_engine.contract.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class ExtensionDecisionRequest {

    @NotNull(message = "accept is required")
    @JsonProperty("accept")
    Boolean accept;
}
