package com.caradonti.finance_ledger.eventcash.dto;

import com.caradonti.finance_ledger.eventcash.PaymentStatus;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class PaymentStatusResponse {

    @JsonProperty("total_budget")
    BigDecimal totalBudget;

    @JsonProperty("anticipo_received")
    BigDecimal anticipoReceived;

    @JsonProperty("segundo_pago")
    BigDecimal segundoPago;

    @JsonProperty("tercer_pago")
    BigDecimal tercerPago;

    @JsonProperty("total_paid")
    BigDecimal totalPaid;

    @JsonProperty("balance_due")
    BigDecimal balanceDue;

    public static PaymentStatusResponse from(PaymentStatus status) {
        return PaymentStatusResponse.builder()
            .totalBudget(status.getTotalBudget())
            .anticipoReceived(status.getAnticipoReceived())
            .segundoPago(status.getSegundoPago())
            .tercerPago(status.getTercerPago())
            .totalPaid(status.getTotalPaid())
            .balanceDue(status.getBalanceDue())
            .build();
    }
}
