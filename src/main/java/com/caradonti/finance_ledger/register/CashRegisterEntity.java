package com.caradonti.finance_ledger.register;

import com.caradonti.finance_ledger.ledger.LedgerBalance;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Row of the cash_registers table.
 *
 * Holds a snapshot of the balance recomputed on every append. Because every
 * append rewrites this row under {@code @Version}, two concurrent appends to the
 * same register cannot both commit.
 */
@Entity
@Table(name = "cash_registers")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CashRegisterEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "register_type", nullable = false, updatable = false, length = 20)
    private RegisterType type;

    @Column(nullable = false)
    private String name;

    @Column(name = "balance_ars", nullable = false, precision = 19, scale = 2)
    private BigDecimal balanceArs = BigDecimal.ZERO;

    @Column(name = "balance_usd", nullable = false, precision = 19, scale = 2)
    private BigDecimal balanceUsd = BigDecimal.ZERO;

    @Column(name = "entry_count", nullable = false)
    private int entryCount;

    @Column(name = "created_by", nullable = false, updatable = false)
    private String createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private long version;

    static CashRegisterEntity fromDomain(CashRegister register) {
        CashRegisterEntity entity = new CashRegisterEntity();
        entity.id = register.getId();
        entity.type = register.getType();
        entity.name = register.getName();
        entity.createdBy = register.getCreatedBy();
        entity.createdAt = register.getCreatedAt();
        entity.updatedAt = register.getCreatedAt();
        return entity;
    }

    public CashRegister toDomain() {
        return new CashRegister(id, type, name, createdBy, createdAt);
    }

    void applyBalance(LedgerBalance balance) {
        this.balanceArs = balance.getNet().getArs();
        this.balanceUsd = balance.getNet().getUsd();
        this.entryCount = balance.getEntryCount();
        this.updatedAt = Instant.now();
    }
}
