package com.caradonti.finance_ledger.eventcash.dto;

import com.caradonti.finance_ledger.eventcash.EventCash;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class EventResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("name")
    String name;

    @JsonProperty("client_name")
    String clientName;

    @JsonProperty("event_date")
    LocalDate eventDate;

    @JsonProperty("payment_status")
    PaymentStatusResponse paymentStatus;

    @JsonProperty("created_by")
    String createdBy;

    @JsonProperty("created_at")
    Instant createdAt;

    public static EventResponse from(EventCash event) {
        return EventResponse.builder()
            .id(event.getId())
            .name(event.getName())
            .clientName(event.getClientName())
            .eventDate(event.getEventDate())
            .paymentStatus(PaymentStatusResponse.from(event.getPaymentStatus()))
            .createdBy(event.getCreatedBy())
            .createdAt(event.getCreatedAt())
            .build();
    }
}
