package com.flagship.escrow_engine.job;

import com.flagship.escrow_engine.money.CurrencyCode;
import com.flagship.escrow_engine.money.Money;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * A posted job whose price is the budget shared by its workers' contracts.
 *
 * Rows are owned by the listing layer; this service reads and locks them.
 */
@Entity
@Table(name = "jobs")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class JobEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "requester_id", nullable = false, updatable = false)
    private UUID requesterId;

    @Column(nullable = false)
    private String title;

    @Column(name = "price_minor", nullable = false)
    private long priceMinor;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 3)
    private CurrencyCode currency;

    @Column(name = "max_workers", nullable = false)
    private int maxWorkers;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public static JobEntity create(UUID id, UUID requesterId, String title, Money price, int maxWorkers) {
        return new JobEntity(id, requesterId, title, price.getMinorUnits(), price.getCurrency(),
                maxWorkers, Instant.now());
    }

    public Money getPrice() {
        return Money.of(priceMinor, currency);
    }
}
