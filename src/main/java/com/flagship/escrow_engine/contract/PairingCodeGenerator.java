package com.flagship.escrow_engine.contract;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;

/**
 * Six-digit numeric pairing codes.
 */
@Component
public class PairingCodeGenerator {

    private final SecureRandom random = new SecureRandom();

    public String next() {
        return String.format("%06d", random.nextInt(1_000_000));
    }
}
