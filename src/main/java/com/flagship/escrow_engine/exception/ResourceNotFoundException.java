package com.flagship.escrow_engine.exception;

public class ResourceNotFoundException extends EscrowException {

    public ResourceNotFoundException(String resource, Object id) {
        super(ErrorCode.NOT_FOUND, resource + " not found: " + id);
    }
}
