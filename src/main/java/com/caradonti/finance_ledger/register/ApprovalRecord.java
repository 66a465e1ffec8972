package com.caradonti.finance_ledger.register;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One row of cash_register_entry_approvals.
 */
@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ApprovalRecord {

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 20)
    private ApproverRole role;

    @Column(name = "approved_by", nullable = false)
    private String approvedBy;

    @Column(name = "approved_at", nullable = false)
    private Instant approvedAt;

    static ApprovalRecord fromDomain(Approval approval) {
        return new ApprovalRecord(approval.getRole(), approval.getApprovedBy(), approval.getApprovedAt());
    }

    Approval toDomain() {
        return new Approval(role, approvedBy, approvedAt);
    }
}
