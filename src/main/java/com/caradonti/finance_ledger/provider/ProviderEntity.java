package com.caradonti.finance_ledger.provider;

import com.caradonti.finance_ledger.money.MoneyPair;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "providers")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ProviderEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false, length = Provider.MAX_NAME_LENGTH)
    private String name;

    @Column(length = 100)
    private String category;

    @Column(name = "usage_count", nullable = false)
    private long usageCount;

    @Column(name = "total_amount_ars", nullable = false, precision = 19, scale = 2)
    private BigDecimal totalAmountArs;

    @Column(name = "total_amount_usd", nullable = false, precision = 19, scale = 2)
    private BigDecimal totalAmountUsd;

    @Column(name = "last_used_at")
    private Instant lastUsedAt;

    @Column(name = "created_by", nullable = false, updatable = false)
    private String createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Version
    private long version;

    static ProviderEntity fromDomain(Provider provider) {
        ProviderEntity entity = new ProviderEntity();
        entity.id = provider.getId();
        entity.name = provider.getName();
        entity.category = provider.getCategory();
        entity.usageCount = provider.getUsageCount();
        entity.totalAmountArs = provider.getTotalAmountArs();
        entity.totalAmountUsd = provider.getTotalAmountUsd();
        entity.lastUsedAt = provider.getLastUsedAt();
        entity.createdBy = provider.getCreatedBy();
        entity.createdAt = provider.getCreatedAt();
        return entity;
    }

    public Provider toDomain() {
        return new Provider(id, name, category, usageCount, totalAmountArs, totalAmountUsd,
            lastUsedAt, createdBy, createdAt);
    }

    /**
     * One more use of this provider, paid {@code amount}.
     */
    void incrementUsage(MoneyPair amount) {
        this.usageCount++;
        this.totalAmountArs = totalAmountArs.add(amount.getArs());
        this.totalAmountUsd = totalAmountUsd.add(amount.getUsd());
        this.lastUsedAt = Instant.now();
    }

    void decrementUsage(MoneyPair amount) {
        this.usageCount = Math.max(0, usageCount - 1);
        this.totalAmountArs = clampAtZero(totalAmountArs.subtract(amount.getArs()));
        this.totalAmountUsd = clampAtZero(totalAmountUsd.subtract(amount.getUsd()));
    }

    private static BigDecimal clampAtZero(BigDecimal value) {
        return value.signum() < 0 ? BigDecimal.ZERO.setScale(2) : value;
    }
}
