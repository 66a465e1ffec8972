package com.caradonti.finance_ledger.register;

import com.caradonti.finance_ledger.exception.InvalidAmountException;
import com.caradonti.finance_ledger.exception.InvalidTransitionException;
import com.caradonti.finance_ledger.ledger.Movement;
import com.caradonti.finance_ledger.money.MoneyPair;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.UUID;

/**
 * An income or expense movement in a General, Shop or Deco cash register.
 *
 * Amounts never change after creation. The only mutations are the approval
 * transitions, each of which returns a new instance:
 * - PENDING → APPROVED once the required number of roles have signed off
 * - PENDING → REJECTED on administrative rejection
 * - APPROVED and REJECTED are terminal
 */
@Value
public class CashRegisterEntry implements Movement {

    public static final int MAX_DESCRIPTION_LENGTH = 500;

    UUID id;
    UUID registerId;
    RegisterType registerType;
    LocalDate date;
    String description;
    String application;
    UUID providerRef;
    MoneyPair income;
    MoneyPair expense;
    SaleLine saleLine;
    String notes;
    ApprovalRequirement requirement;
    ApprovalStatus approvalStatus;
    Map<ApproverRole, Approval> approvals;
    String rejectedBy;
    Instant rejectedAt;
    String rejectionReason;
    String createdBy;
    Instant createdAt;

    /**
     * Creates a new entry. Entries that need no approval start APPROVED,
     * everything else starts PENDING.
     */
    public static CashRegisterEntry create(UUID registerId, RegisterType registerType, LocalDate date,
                                           String description, String application, UUID providerRef,
                                           MoneyPair income, MoneyPair expense, SaleLine saleLine,
                                           String notes, ApprovalRequirement requirement, String createdBy) {
        if (registerId == null || registerType == null) {
            throw new IllegalArgumentException("Register is required");
        }
        if (date == null) {
            throw new IllegalArgumentException("Entry date is required");
        }
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("Description is required");
        }
        if (description.trim().length() > MAX_DESCRIPTION_LENGTH) {
            throw new IllegalArgumentException(
                "Description must be at most " + MAX_DESCRIPTION_LENGTH + " characters");
        }
        MoneyPair in = income != null ? income : MoneyPair.ZERO;
        MoneyPair out = expense != null ? expense : MoneyPair.ZERO;
        if (in.isZero() && out.isZero()) {
            throw new InvalidAmountException("Cash entry must carry an income or an expense");
        }
        if (saleLine != null && registerType != RegisterType.SHOP) {
            throw new IllegalArgumentException("Only shop entries can record a sale");
        }

        ApprovalStatus initialStatus = requirement == ApprovalRequirement.NONE
            ? ApprovalStatus.APPROVED
            : ApprovalStatus.PENDING;

        return new CashRegisterEntry(
            UUID.randomUUID(),
            registerId,
            registerType,
            date,
            description.trim(),
            application,
            providerRef,
            in,
            out,
            saleLine,
            notes,
            requirement,
            initialStatus,
            Collections.emptyMap(),
            null,
            null,
            null,
            createdBy,
            Instant.now()
        );
    }

    /**
     * Records a sign-off by {@code role}.
     *
     * Approving an APPROVED entry, or approving twice with the same role, is a
     * no-op and reports {@code changed = false}.
     *
     * @throws InvalidTransitionException if the entry was rejected
     */
    public ApprovalOutcome approve(ApproverRole role, String actor) {
        if (role == null) {
            throw new IllegalArgumentException("Approver role is required");
        }
        if (approvalStatus == ApprovalStatus.APPROVED) {
            return ApprovalOutcome.unchanged(this);
        }
        if (approvalStatus == ApprovalStatus.REJECTED) {
            throw new InvalidTransitionException(
                String.format("Cannot approve entry %s: it was rejected", id));
        }
        if (approvals.containsKey(role)) {
            return ApprovalOutcome.unchanged(this);
        }

        Map<ApproverRole, Approval> updated = new EnumMap<>(ApproverRole.class);
        updated.putAll(approvals);
        updated.put(role, new Approval(role, actor, Instant.now()));

        ApprovalStatus newStatus = updated.size() >= requirement.getRequiredApprovals()
            ? ApprovalStatus.APPROVED
            : ApprovalStatus.PENDING;

        CashRegisterEntry next = new CashRegisterEntry(id, registerId, registerType, date, description,
            application, providerRef, income, expense, saleLine, notes, requirement, newStatus,
            Collections.unmodifiableMap(updated), rejectedBy, rejectedAt, rejectionReason, createdBy, createdAt);
        return new ApprovalOutcome(next, approvalStatus, true);
    }

    /**
     * Rejects a pending entry. Rejecting an already rejected entry is a no-op.
     *
     * @throws InvalidTransitionException if the entry is already approved
     */
    public ApprovalOutcome reject(String actor, String reason) {
        if (approvalStatus == ApprovalStatus.REJECTED) {
            return ApprovalOutcome.unchanged(this);
        }
        if (approvalStatus == ApprovalStatus.APPROVED) {
            throw new InvalidTransitionException(
                String.format("Cannot reject entry %s: it is already approved", id));
        }
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("Rejection reason is required");
        }

        CashRegisterEntry next = new CashRegisterEntry(id, registerId, registerType, date, description,
            application, providerRef, income, expense, saleLine, notes, requirement, ApprovalStatus.REJECTED,
            approvals, actor, Instant.now(), reason, createdBy, createdAt);
        return new ApprovalOutcome(next, approvalStatus, true);
    }

    public boolean isApproved() {
        return approvalStatus == ApprovalStatus.APPROVED;
    }

    public boolean needsApproval() {
        return requirement != ApprovalRequirement.NONE;
    }

    public boolean isApprovedBy(ApproverRole role) {
        return approvals.containsKey(role);
    }
}
