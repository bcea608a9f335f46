package com.flagship.escrow_engine.commission;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

/**
 * Commission rates, bound from escrow.commission.*.
 */
@ConfigurationProperties(prefix = "escrow.commission")
@Getter
@Setter
public class CommissionProperties {

    /** Platform default rate in percent. */
    private BigDecimal defaultRate = new BigDecimal("5.00");

    private BigDecimal proRate = new BigDecimal("3.00");

    private BigDecimal superProRate = new BigDecimal("2.00");

    private BigDecimal familyRate = new BigDecimal("0.00");

    /** Contracts per calendar month priced at the PRO / SUPER_PRO rate. */
    private int tierMonthlyQuota = 3;

    /** Floor applied to a positive, non-free commission. Zero disables it. */
    private long minimumMinorUnits = 0;
}
