package com.flagship.escrow_engine.contract.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.escrow_engine.contract.DisputeResolution;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class ResolveDisputeRequest {

    @NotNull(message = "Resolution is required")
    @JsonProperty("resolution")
    DisputeResolution resolution;

    @Size(max = 1000, message = "Note must be at most 1000 characters")
    @JsonProperty("note")
    String note;
}
