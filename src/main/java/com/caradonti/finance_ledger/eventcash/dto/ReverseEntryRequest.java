package com.caradonti.finance_ledger.eventcash.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.time.LocalDate;

/**
 * Optional body of a reversal. Without a date the reversal is dated today.
 */
@Value
public class ReverseEntryRequest {

    @JsonProperty("date")
    LocalDate date;
}
