package com.caradonti.finance_ledger.eventcash;

import com.caradonti.finance_ledger.eventcash.dto.AppendLedgerEntryRequest;
import com.caradonti.finance_ledger.eventcash.dto.AppendLedgerEntryResponse;
import com.caradonti.finance_ledger.eventcash.dto.AssignReferencesRequest;
import com.caradonti.finance_ledger.eventcash.dto.CreateEventRequest;
import com.caradonti.finance_ledger.eventcash.dto.EventResponse;
import com.caradonti.finance_ledger.eventcash.dto.LedgerEntryResponse;
import com.caradonti.finance_ledger.eventcash.dto.PaymentStatusResponse;
import com.caradonti.finance_ledger.eventcash.dto.ReverseEntryRequest;
import com.caradonti.finance_ledger.identity.ActorProvider;
import com.caradonti.finance_ledger.idempotency.IdempotencyScope;
import com.caradonti.finance_ledger.idempotency.IdempotencyService;
import com.caradonti.finance_ledger.ledger.LedgerEntry;
import com.caradonti.finance_ledger.ledger.dto.BalanceResponse;
import com.caradonti.finance_ledger.observability.LedgerMetrics;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * REST endpoints for event cash books.
 *
 * Appends require an Idempotency-Key header; repeating a key returns the entry
 * created by the first request.
 */
@RestController
@RequestMapping("/api/events")
@RequiredArgsConstructor
@Slf4j
public class EventCashController {

    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final EventCashService eventCashService;
    private final IdempotencyService idempotencyService;
    private final ActorProvider actorProvider;
    private final LedgerMetrics ledgerMetrics;

    @PostMapping
    public ResponseEntity<EventResponse> createEvent(@Valid @RequestBody CreateEventRequest request) {
        EventCash event = eventCashService.create(request.getName(), request.getClientName(),
            request.getEventDate(), request.getTotalBudget(), actorProvider.currentActor());
        return ResponseEntity.status(HttpStatus.CREATED).body(EventResponse.from(event));
    }

    @GetMapping
    public ResponseEntity<List<EventResponse>> listEvents() {
        return ResponseEntity.ok(eventCashService.list().stream()
            .map(EventResponse::from)
            .toList());
    }

    @GetMapping("/{eventId}")
    public ResponseEntity<EventResponse> getEvent(@PathVariable("eventId") UUID eventId) {
        return ResponseEntity.ok(EventResponse.from(eventCashService.get(eventId)));
    }

    @PostMapping("/{eventId}/entries")
    public ResponseEntity<AppendLedgerEntryResponse> appendEntry(
            @PathVariable("eventId") UUID eventId,
            @Valid @RequestBody AppendLedgerEntryRequest request,
            @RequestHeader(IDEMPOTENCY_KEY_HEADER) String idempotencyKey) {

        Optional<UUID> existingId = idempotencyService.checkIdempotencyKey(
            IdempotencyScope.EVENT_ENTRY, idempotencyKey);
        if (existingId.isPresent()) {
            ledgerMetrics.recordIdempotencyHit();
            log.info("Idempotency key already used, returning existing event entry {}", existingId.get());
            LedgerEntry existing = eventCashService.getEntry(eventId, existingId.get());
            return ResponseEntity.ok(new AppendLedgerEntryResponse(LedgerEntryResponse.from(existing),
                null, null, null));
        }
        ledgerMetrics.recordIdempotencyMiss();

        EventEntryAppended appended = eventCashService.append(eventId, request.toDraft(), idempotencyKey,
            actorProvider.currentActor());
        idempotencyService.storeIdempotencyKey(IdempotencyScope.EVENT_ENTRY, idempotencyKey,
            appended.getEntry().getId());
        return ResponseEntity.status(HttpStatus.CREATED).body(AppendLedgerEntryResponse.from(appended));
    }

    @GetMapping("/{eventId}/entries")
    public ResponseEntity<List<LedgerEntryResponse>> listEntries(@PathVariable("eventId") UUID eventId) {
        return ResponseEntity.ok(eventCashService.listEntries(eventId).stream()
            .map(LedgerEntryResponse::from)
            .toList());
    }

    @PostMapping("/{eventId}/entries/{entryId}/reversal")
    public ResponseEntity<AppendLedgerEntryResponse> reverseEntry(
            @PathVariable("eventId") UUID eventId,
            @PathVariable("entryId") UUID entryId,
            @RequestBody(required = false) ReverseEntryRequest request) {
        EventEntryAppended reversal = eventCashService.reverse(eventId, entryId,
            request != null ? request.getDate() : null, actorProvider.currentActor());
        return ResponseEntity.status(HttpStatus.CREATED).body(AppendLedgerEntryResponse.from(reversal));
    }

    @PutMapping("/{eventId}/entries/{entryId}/references")
    public ResponseEntity<LedgerEntryResponse> assignReferences(
            @PathVariable("eventId") UUID eventId,
            @PathVariable("entryId") UUID entryId,
            @RequestBody AssignReferencesRequest request) {
        LedgerEntry entry = eventCashService.assignReferences(eventId, entryId,
            request.getProviderId(), request.getCategoryId());
        return ResponseEntity.ok(LedgerEntryResponse.from(entry));
    }

    @GetMapping("/{eventId}/balance")
    public ResponseEntity<BalanceResponse> getBalance(@PathVariable("eventId") UUID eventId) {
        return ResponseEntity.ok(BalanceResponse.from(eventCashService.getBalance(eventId)));
    }

    @GetMapping("/{eventId}/payment-status")
    public ResponseEntity<PaymentStatusResponse> getPaymentStatus(@PathVariable("eventId") UUID eventId) {
        return ResponseEntity.ok(PaymentStatusResponse.from(eventCashService.getPaymentStatus(eventId)));
    }
}
