package com.flagship.escrow_engine.referral.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class RegisterReferralRequest {

    @NotBlank(message = "Referral code is required")
    @Size(max = 32, message = "Referral code must be at most 32 characters")
    @JsonProperty("code")
    String code;
}
