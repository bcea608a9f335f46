package com.flagship.escrow_engine.contract.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class ExtensionRequest {

    @Min(value = 1, message = "Extension must add at least one day")
    @JsonProperty("days")
    int days;

    /** New total base price in the contract currency; null keeps the price. */
    @DecimalMin(value = "0.01", message = "New price must be greater than 0")
    @JsonProperty("new_price")
    BigDecimal newPrice;
}
