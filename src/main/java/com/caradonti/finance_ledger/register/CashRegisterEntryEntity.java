package com.caradonti.finance_ledger.register;

import com.caradonti.finance_ledger.money.MoneyPair;
import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Row of the cash_register_entries table plus its approvals.
 *
 * Amounts are {@code updatable = false}; only the approval columns change, via
 * {@link #applyApproval}. {@code @Version} makes two concurrent approvals of
 * the same entry conflict instead of one silently overwriting the other.
 */
@Entity
@Table(
    name = "cash_register_entries",
    indexes = {
        @Index(name = "idx_register_entries_register", columnList = "register_id, sequence_number"),
        @Index(name = "idx_register_entries_status", columnList = "approval_status")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CashRegisterEntryEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "register_id", nullable = false, updatable = false)
    private UUID registerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "register_type", nullable = false, updatable = false, length = 20)
    private RegisterType registerType;

    @Column(name = "entry_date", nullable = false, updatable = false)
    private LocalDate entryDate;

    @Column(nullable = false, updatable = false, length = CashRegisterEntry.MAX_DESCRIPTION_LENGTH)
    private String description;

    @Column(updatable = false, length = 100)
    private String application;

    @Column(name = "provider_ref", updatable = false)
    private UUID providerRef;

    @Column(name = "income_ars", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal incomeArs;

    @Column(name = "income_usd", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal incomeUsd;

    @Column(name = "expense_ars", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal expenseArs;

    @Column(name = "expense_usd", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal expenseUsd;

    @Column(name = "sale_sku", updatable = false, length = 64)
    private String saleSku;

    @Column(name = "sale_quantity", updatable = false)
    private Integer saleQuantity;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String notes;

    @Enumerated(EnumType.STRING)
    @Column(name = "approval_requirement", nullable = false, updatable = false, length = 10)
    private ApprovalRequirement requirement;

    @Enumerated(EnumType.STRING)
    @Column(name = "approval_status", nullable = false, length = 10)
    private ApprovalStatus approvalStatus;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "cash_register_entry_approvals", joinColumns = @JoinColumn(name = "entry_id"))
    private List<ApprovalRecord> approvals = new ArrayList<>();

    @Column(name = "rejected_by")
    private String rejectedBy;

    @Column(name = "rejected_at")
    private Instant rejectedAt;

    @Column(name = "rejection_reason", columnDefinition = "TEXT")
    private String rejectionReason;

    @Column(name = "idempotency_key", updatable = false, unique = true)
    private String idempotencyKey;

    @Column(name = "created_by", nullable = false, updatable = false)
    private String createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "sequence_number", insertable = false, updatable = false)
    private Long sequenceNumber;

    @Version
    private long version;

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static CashRegisterEntryEntity fromDomain(CashRegisterEntry entry, String idempotencyKey) {
        CashRegisterEntryEntity entity = new CashRegisterEntryEntity();
        entity.id = entry.getId();
        entity.registerId = entry.getRegisterId();
        entity.registerType = entry.getRegisterType();
        entity.entryDate = entry.getDate();
        entity.description = entry.getDescription();
        entity.application = entry.getApplication();
        entity.providerRef = entry.getProviderRef();
        entity.incomeArs = entry.getIncome().getArs();
        entity.incomeUsd = entry.getIncome().getUsd();
        entity.expenseArs = entry.getExpense().getArs();
        entity.expenseUsd = entry.getExpense().getUsd();
        if (entry.getSaleLine() != null) {
            entity.saleSku = entry.getSaleLine().getSku();
            entity.saleQuantity = entry.getSaleLine().getQuantity();
        }
        entity.notes = entry.getNotes();
        entity.requirement = entry.getRequirement();
        entity.idempotencyKey = idempotencyKey;
        entity.createdBy = entry.getCreatedBy();
        entity.createdAt = entry.getCreatedAt();
        entity.updatedAt = entry.getCreatedAt();
        entity.applyApproval(entry);
        return entity;
    }

    public CashRegisterEntry toDomain() {
        Map<ApproverRole, Approval> byRole = new EnumMap<>(ApproverRole.class);
        for (ApprovalRecord record : approvals) {
            byRole.put(record.getRole(), record.toDomain());
        }
        return new CashRegisterEntry(
            id,
            registerId,
            registerType,
            entryDate,
            description,
            application,
            providerRef,
            MoneyPair.of(incomeArs, incomeUsd),
            MoneyPair.of(expenseArs, expenseUsd),
            saleSku != null ? new SaleLine(saleSku, saleQuantity) : null,
            notes,
            requirement,
            approvalStatus,
            Collections.unmodifiableMap(byRole),
            rejectedBy,
            rejectedAt,
            rejectionReason,
            createdBy,
            createdAt
        );
    }

    /**
     * Copies the approval state of {@code entry}. Approvals are only ever added.
     */
    void applyApproval(CashRegisterEntry entry) {
        this.approvalStatus = entry.getApprovalStatus();
        for (Approval approval : entry.getApprovals().values()) {
            boolean known = approvals.stream().anyMatch(r -> r.getRole() == approval.getRole());
            if (!known) {
                approvals.add(ApprovalRecord.fromDomain(approval));
            }
        }
        this.rejectedBy = entry.getRejectedBy();
        this.rejectedAt = entry.getRejectedAt();
        this.rejectionReason = entry.getRejectionReason();
    }
}
