package com.caradonti.finance_ledger.register;

import com.caradonti.finance_ledger.identity.Actor;
import com.caradonti.finance_ledger.identity.ActorProvider;
import com.caradonti.finance_ledger.idempotency.IdempotencyScope;
import com.caradonti.finance_ledger.idempotency.IdempotencyService;
import com.caradonti.finance_ledger.ledger.DateWindow;
import com.caradonti.finance_ledger.ledger.dto.BalanceResponse;
import com.caradonti.finance_ledger.observability.LedgerMetrics;
import com.caradonti.finance_ledger.register.dto.AppendRegisterEntryRequest;
import com.caradonti.finance_ledger.register.dto.AppendRegisterEntryResponse;
import com.caradonti.finance_ledger.register.dto.ApprovalResponse;
import com.caradonti.finance_ledger.register.dto.ApproveEntryRequest;
import com.caradonti.finance_ledger.register.dto.OpenRegisterRequest;
import com.caradonti.finance_ledger.register.dto.RegisterEntryResponse;
import com.caradonti.finance_ledger.register.dto.RegisterResponse;
import com.caradonti.finance_ledger.register.dto.RegisterSummaryResponse;
import com.caradonti.finance_ledger.register.dto.RejectEntryRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * REST endpoints for General, Shop and Deco cash registers.
 *
 * Appends require an Idempotency-Key header; repeating a key returns the entry
 * created by the first request instead of appending a second one.
 */
@RestController
@RequestMapping("/api/registers")
@RequiredArgsConstructor
@Slf4j
public class CashRegisterController {

    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final CashRegisterService registerService;
    private final IdempotencyService idempotencyService;
    private final ActorProvider actorProvider;
    private final LedgerMetrics ledgerMetrics;

    @PostMapping
    public ResponseEntity<RegisterResponse> openRegister(@Valid @RequestBody OpenRegisterRequest request) {
        CashRegister register = registerService.open(request.getType(), request.getName(),
            actorProvider.currentActor());
        return ResponseEntity.status(HttpStatus.CREATED).body(RegisterResponse.from(register));
    }

    @GetMapping
    public ResponseEntity<List<RegisterResponse>> listRegisters(
            @RequestParam(name = "type", required = false) RegisterType type) {
        return ResponseEntity.ok(registerService.list(type).stream()
            .map(RegisterResponse::from)
            .toList());
    }

    @GetMapping("/{registerId}")
    public ResponseEntity<RegisterResponse> getRegister(@PathVariable("registerId") UUID registerId) {
        return ResponseEntity.ok(RegisterResponse.from(registerService.get(registerId)));
    }

    @GetMapping("/{registerId}/balance")
    public ResponseEntity<BalanceResponse> getBalance(@PathVariable("registerId") UUID registerId) {
        return ResponseEntity.ok(BalanceResponse.from(registerService.getBalance(registerId)));
    }

    @PostMapping("/{registerId}/entries")
    public ResponseEntity<AppendRegisterEntryResponse> appendEntry(
            @PathVariable("registerId") UUID registerId,
            @Valid @RequestBody AppendRegisterEntryRequest request,
            @RequestHeader(IDEMPOTENCY_KEY_HEADER) String idempotencyKey) {

        Optional<UUID> existingId = idempotencyService.checkIdempotencyKey(
            IdempotencyScope.REGISTER_ENTRY, idempotencyKey);
        if (existingId.isPresent()) {
            ledgerMetrics.recordIdempotencyHit();
            log.info("Idempotency key already used, returning existing register entry {}", existingId.get());
            CashRegisterEntry existing = registerService.getEntry(registerId, existingId.get());
            return ResponseEntity.ok(new AppendRegisterEntryResponse(RegisterEntryResponse.from(existing), null));
        }
        ledgerMetrics.recordIdempotencyMiss();

        RegisterEntryAppended appended = registerService.append(registerId, request.toDraft(), idempotencyKey,
            actorProvider.currentActor());
        idempotencyService.storeIdempotencyKey(IdempotencyScope.REGISTER_ENTRY, idempotencyKey,
            appended.getEntry().getId());

        return ResponseEntity.status(HttpStatus.CREATED).body(new AppendRegisterEntryResponse(
            RegisterEntryResponse.from(appended.getEntry()), BalanceResponse.from(appended.getBalance())));
    }

    @GetMapping("/{registerId}/entries")
    public ResponseEntity<List<RegisterEntryResponse>> listEntries(
            @PathVariable("registerId") UUID registerId,
            @RequestParam(name = "status", required = false) ApprovalStatus status) {
        return ResponseEntity.ok(registerService.listEntries(registerId, status).stream()
            .map(RegisterEntryResponse::from)
            .toList());
    }

    @GetMapping("/{registerId}/entries/{entryId}")
    public ResponseEntity<RegisterEntryResponse> getEntry(@PathVariable("registerId") UUID registerId,
                                                          @PathVariable("entryId") UUID entryId) {
        return ResponseEntity.ok(RegisterEntryResponse.from(registerService.getEntry(registerId, entryId)));
    }

    @PostMapping("/{registerId}/entries/{entryId}/approvals")
    public ResponseEntity<ApprovalResponse> approveEntry(@PathVariable("registerId") UUID registerId,
                                                         @PathVariable("entryId") UUID entryId,
                                                         @Valid @RequestBody ApproveEntryRequest request) {
        Actor actor = actorProvider.currentActor();
        ApprovalOutcome outcome = registerService.approve(registerId, entryId,
            ApproverRole.fromValue(request.getRole()), actor);
        return ResponseEntity.ok(ApprovalResponse.from(outcome));
    }

    @PostMapping("/{registerId}/entries/{entryId}/rejection")
    public ResponseEntity<ApprovalResponse> rejectEntry(@PathVariable("registerId") UUID registerId,
                                                        @PathVariable("entryId") UUID entryId,
                                                        @Valid @RequestBody RejectEntryRequest request) {
        ApprovalOutcome outcome = registerService.reject(registerId, entryId, request.getReason(),
            actorProvider.currentActor());
        return ResponseEntity.ok(ApprovalResponse.from(outcome));
    }

    @GetMapping("/{registerId}/summary")
    public ResponseEntity<RegisterSummaryResponse> getSummary(
            @PathVariable("registerId") UUID registerId,
            @RequestParam(name = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(name = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return ResponseEntity.ok(RegisterSummaryResponse.from(registerService.summarize(registerId, DateWindow.of(from, to))));
    }
}
