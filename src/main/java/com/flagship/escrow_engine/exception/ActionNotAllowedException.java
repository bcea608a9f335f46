package com.flagship.escrow_engine.exception;

/**
 * The caller is a party to the contract but their role may not perform this action.
 */
public class ActionNotAllowedException extends EscrowException {

    public ActionNotAllowedException(String message) {
        super(ErrorCode.ACTION_NOT_ALLOWED, message);
    }
}
