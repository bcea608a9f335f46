package com.flagship.escrow_engine.job.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class WorkerAllocationRequest {

    @NotNull(message = "Worker ID is required")
    @JsonProperty("worker_id")
    UUID workerId;

    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @JsonProperty("amount")
    BigDecimal amount;

    @DecimalMin(value = "0.01", message = "Percentage must be greater than 0")
    @DecimalMax(value = "100", message = "Percentage must be at most 100")
    @JsonProperty("percentage")
    BigDecimal percentage;

    @JsonProperty("escrow_enabled")
    Boolean escrowEnabled;

    @JsonProperty("start_date")
    Instant startDate;

    @JsonProperty("end_date")
    Instant endDate;
}
