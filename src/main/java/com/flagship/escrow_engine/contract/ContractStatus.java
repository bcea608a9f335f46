package com.flagship.escrow_engine.contract;

/**
 * Contract lifecycle states. Stored as text in contracts.status.
 *
 * DRAFT -> PENDING -> ACCEPTED -> IN_PROGRESS -> WAITING_APPROVAL -> COMPLETED
 * with WAITING_APPROVAL -> DISPUTED -> COMPLETED | CANCELLED, and CANCELLED
 * reachable from every non-terminal state.
 */
public enum ContractStatus {
    DRAFT,
    PENDING,
    ACCEPTED,
    IN_PROGRESS,
    WAITING_APPROVAL,
    COMPLETED,
    CANCELLED,
    DISPUTED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }

    /**
     * Whether the edge this -> target exists. Staying in the same state is not an edge.
     */
    public boolean canTransitionTo(ContractStatus target) {
        if (target == null || target == this) {
            return false;
        }
        return switch (this) {
            case DRAFT -> target == PENDING || target == CANCELLED;
            case PENDING -> target == ACCEPTED || target == CANCELLED;
            case ACCEPTED -> target == IN_PROGRESS || target == CANCELLED;
            case IN_PROGRESS -> target == WAITING_APPROVAL || target == CANCELLED;
            case WAITING_APPROVAL -> target == COMPLETED || target == DISPUTED || target == CANCELLED;
            case DISPUTED -> target == COMPLETED || target == CANCELLED;
            case COMPLETED, CANCELLED -> false;
        };
    }

    /**
     * States from which a party may cancel directly. Later states go through dispute or refund.
     */
    public boolean isDirectlyCancellable() {
        return this == DRAFT || this == PENDING || this == ACCEPTED;
    }
}
