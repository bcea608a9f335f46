package com.flagship.escrow_engine.exception;

/**
 * A state machine guard refused the requested transition.
 * Nothing has been written when this is thrown.
 */
public class InvalidTransitionException extends EscrowException {

    public InvalidTransitionException(String message) {
        super(ErrorCode.INVALID_TRANSITION, message);
    }

    public static InvalidTransitionException of(String aggregate, Object id, Object from, Object to) {
        return new InvalidTransitionException(
            String.format("Cannot move %s %s from %s to %s", aggregate, id, from, to));
    }
}
