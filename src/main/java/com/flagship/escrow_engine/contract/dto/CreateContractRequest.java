package com.flagship.escrow_engine.contract.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class CreateContractRequest {

    @NotNull(message = "Worker ID is required")
    @JsonProperty("worker_id")
    UUID workerId;

    @NotBlank(message = "Title is required")
    @Size(max = 200, message = "Title must be at most 200 characters")
    @JsonProperty("title")
    String title;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @JsonProperty("amount")
    BigDecimal amount;

    @NotBlank(message = "Currency is required")
    @Pattern(regexp = "^[A-Z]{3}$", message = "Currency must be a 3-letter ISO code")
    @JsonProperty("currency")
    String currency;

    @NotNull(message = "Start date is required")
    @JsonProperty("start_date")
    Instant startDate;

    @NotNull(message = "End date is required")
    @JsonProperty("end_date")
    Instant endDate;

    @JsonProperty("escrow_enabled")
    Boolean escrowEnabled;
}
