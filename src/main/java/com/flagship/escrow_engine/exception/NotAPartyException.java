package com.flagship.escrow_engine.exception;

import java.util.UUID;

public class NotAPartyException extends EscrowException {

    public NotAPartyException(UUID userId, UUID contractId) {
        super(ErrorCode.NOT_A_PARTY, "User " + userId + " is not a party to contract " + contractId);
    }
}
