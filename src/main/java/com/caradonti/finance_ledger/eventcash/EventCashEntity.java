package com.caradonti.finance_ledger.eventcash;

import com.caradonti.finance_ledger.ledger.LedgerBalance;
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
import java.time.LocalDate;
import java.util.UUID;

/**
 * Row of the event_cash table: the event, its installment schedule and a
 * snapshot of its ledger balance.
 *
 * Every append rewrites this row under {@code @Version}, so two concurrent
 * appends to the same event cannot both commit.
 */
@Entity
@Table(name = "event_cash")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class EventCashEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(name = "client_name", length = 200)
    private String clientName;

    @Column(name = "event_date")
    private LocalDate eventDate;

    @Column(name = "total_budget", nullable = false, precision = 19, scale = 2)
    private BigDecimal totalBudget;

    @Column(name = "anticipo_received", nullable = false, precision = 19, scale = 2)
    private BigDecimal anticipoReceived;

    @Column(name = "segundo_pago", nullable = false, precision = 19, scale = 2)
    private BigDecimal segundoPago;

    @Column(name = "tercer_pago", nullable = false, precision = 19, scale = 2)
    private BigDecimal tercerPago;

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

    static EventCashEntity fromDomain(EventCash event) {
        EventCashEntity entity = new EventCashEntity();
        entity.id = event.getId();
        entity.name = event.getName();
        entity.clientName = event.getClientName();
        entity.eventDate = event.getEventDate();
        entity.createdBy = event.getCreatedBy();
        entity.createdAt = event.getCreatedAt();
        entity.updatedAt = event.getCreatedAt();
        entity.applyPaymentStatus(event.getPaymentStatus());
        return entity;
    }

    public EventCash toDomain() {
        return new EventCash(id, name, clientName, eventDate,
            new PaymentStatus(totalBudget, anticipoReceived, segundoPago, tercerPago),
            createdBy, createdAt);
    }

    void applyPaymentStatus(PaymentStatus status) {
        this.totalBudget = status.getTotalBudget();
        this.anticipoReceived = status.getAnticipoReceived();
        this.segundoPago = status.getSegundoPago();
        this.tercerPago = status.getTercerPago();
    }

    void applyBalance(LedgerBalance balance) {
        this.balanceArs = balance.getNet().getArs();
        this.balanceUsd = balance.getNet().getUsd();
        this.entryCount = balance.getEntryCount();
        this.updatedAt = Instant.now();
    }
}
