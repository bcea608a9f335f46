package com.flagship.escrow_engine.consumer;

import com.flagship.escrow_engine.referral.ReferralService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.UUID;

/**
 * Reactions to contract events. Runs inside the transaction opened by
 * {@link IdempotentEventProcessor}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ContractEventHandler {

    private final ReferralService referralService;

    /**
     * A completed contract may be the first one of either party, which
     * completes that party's referral and rewards the referrer.
     */
    public void onContractCompleted(UUID contractId, UUID requesterId, UUID workerId, Instant completedAt) {
        log.debug("Contract {} completed, checking referrals of both parties", contractId);
        referralService.onFirstContractCompleted(requesterId, completedAt)
            .ifPresent(r -> log.info("Referral {} completed by requester {} on contract {}", r.getId(), requesterId, contractId));
        referralService.onFirstContractCompleted(workerId, completedAt)
            .ifPresent(r -> log.info("Referral {} completed by worker {} on contract {}", r.getId(), workerId, contractId));
    }
}
