package com.flagship.escrow_engine.job.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.Value;

import java.util.List;

@Value
public class SelectWorkersRequest {

    @NotEmpty(message = "At least one worker is required")
    @JsonProperty("workers")
    List<@Valid WorkerAllocationRequest> workers;
}
