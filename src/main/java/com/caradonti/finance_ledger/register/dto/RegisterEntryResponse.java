package com.caradonti.finance_ledger.register.dto;

import com.caradonti.finance_ledger.ledger.dto.AmountsResponse;
import com.caradonti.finance_ledger.register.Approval;
import com.caradonti.finance_ledger.register.ApprovalRequirement;
import com.caradonti.finance_ledger.register.ApprovalStatus;
import com.caradonti.finance_ledger.register.CashRegisterEntry;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@Value
@Builder
public class RegisterEntryResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("register_id")
    UUID registerId;

    @JsonProperty("date")
    LocalDate date;

    @JsonProperty("description")
    String description;

    @JsonProperty("application")
    String application;

    @JsonProperty("provider_id")
    UUID providerId;

    @JsonProperty("income")
    AmountsResponse income;

    @JsonProperty("expense")
    AmountsResponse expense;

    @JsonProperty("sku")
    String sku;

    @JsonProperty("quantity")
    Integer quantity;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("approval_requirement")
    ApprovalRequirement requirement;

    @JsonProperty("approval_status")
    ApprovalStatus approvalStatus;

    @JsonProperty("approvals")
    Map<String, ApprovalView> approvals;

    @JsonProperty("rejected_by")
    String rejectedBy;

    @JsonProperty("rejected_at")
    Instant rejectedAt;

    @JsonProperty("rejection_reason")
    String rejectionReason;

    @JsonProperty("created_by")
    String createdBy;

    @JsonProperty("created_at")
    Instant createdAt;

    @Value
    public static class ApprovalView {

        @JsonProperty("approved_by")
        String approvedBy;

        @JsonProperty("approved_at")
        Instant approvedAt;
    }

    public static RegisterEntryResponse from(CashRegisterEntry entry) {
        Map<String, ApprovalView> approvals = new LinkedHashMap<>();
        for (Approval approval : entry.getApprovals().values()) {
            approvals.put(approval.getRole().name().toLowerCase(),
                new ApprovalView(approval.getApprovedBy(), approval.getApprovedAt()));
        }
        return RegisterEntryResponse.builder()
            .id(entry.getId())
            .registerId(entry.getRegisterId())
            .date(entry.getDate())
            .description(entry.getDescription())
            .application(entry.getApplication())
            .providerId(entry.getProviderRef())
            .income(AmountsResponse.from(entry.getIncome()))
            .expense(AmountsResponse.from(entry.getExpense()))
            .sku(entry.getSaleLine() != null ? entry.getSaleLine().getSku() : null)
            .quantity(entry.getSaleLine() != null ? entry.getSaleLine().getQuantity() : null)
            .notes(entry.getNotes())
            .requirement(entry.getRequirement())
            .approvalStatus(entry.getApprovalStatus())
            .approvals(approvals)
            .rejectedBy(entry.getRejectedBy())
            .rejectedAt(entry.getRejectedAt())
            .rejectionReason(entry.getRejectionReason())
            .createdBy(entry.getCreatedBy())
            .createdAt(entry.getCreatedAt())
            .build();
    }
}
