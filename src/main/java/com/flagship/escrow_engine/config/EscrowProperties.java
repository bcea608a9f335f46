package com.flagship.escrow_engine.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Contract and automation settings, bound from escrow.contract.* and escrow.automation.*.
 */
@ConfigurationProperties(prefix = "escrow")
@Getter
@Setter
public class EscrowProperties {

    private final ContractSettings contract = new ContractSettings();
    private final Automation automation = new Automation();

    @Getter
    @Setter
    public static class ContractSettings {
        /** Applied extensions allowed per contract. */
        private int maxExtensions = 1;

        private Duration pairingCodeTtl = Duration.ofMinutes(30);
    }

    @Getter
    @Setter
    public static class Automation {
        private boolean enabled = true;

        /** Time after work completion before funds are released without approval. */
        private Duration autoReleaseAfter = Duration.ofDays(7);

        /** Reminder window opens this long after work completion and closes at auto-release. */
        private Duration reminderAfter = Duration.ofDays(5);

        private int maxContractsPerRun = 200;

        private Duration maxRunDuration = Duration.ofMinutes(2);
    }
}
