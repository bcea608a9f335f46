package com.flagship.escrow_engine.contract;

public enum ContractParty {
    REQUESTER,
    WORKER
}
