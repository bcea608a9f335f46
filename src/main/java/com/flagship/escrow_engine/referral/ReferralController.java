package com.flagship.escrow_engine.referral;

import com.flagship.escrow_engine.referral.dto.ReferralResponse;
import com.flagship.escrow_engine.referral.dto.ReferralStatsResponse;
import com.flagship.escrow_engine.referral.dto.RegisterReferralRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/referrals")
@RequiredArgsConstructor
public class ReferralController {

    private static final String USER_HEADER = "X-User-Id";

    private final ReferralService referralService;

    /**
     * Links the calling (newly registered) member to the owner of the code.
     */
    @PostMapping
    public ResponseEntity<ReferralResponse> register(@RequestHeader(USER_HEADER) UUID actor,
                                                     @Valid @RequestBody RegisterReferralRequest request) {
        Referral referral = referralService.registerReferral(actor, request.getCode());
        return ResponseEntity.status(HttpStatus.CREATED).body(ReferralResponse.from(referral));
    }

    @GetMapping("/codes/{code}")
    public ResponseEntity<ReferralCodeCheck> validateCode(@PathVariable("code") String code) {
        return ResponseEntity.ok(referralService.validateReferralCode(code));
    }

    @GetMapping("/me")
    public ResponseEntity<ReferralStatsResponse> myStats(@RequestHeader(USER_HEADER) UUID actor) {
        return ResponseEntity.ok(ReferralStatsResponse.from(referralService.getReferralStats(actor)));
    }
}
