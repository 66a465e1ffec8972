package com.caradonti.finance_ledger.reconciliation;

import com.caradonti.finance_ledger.identity.ActorProvider;
import com.caradonti.finance_ledger.reconciliation.dto.CashCountResponse;
import com.caradonti.finance_ledger.reconciliation.dto.RecordCashCountRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/cash-counts")
@RequiredArgsConstructor
public class CashCountController {

    private final CashCountService cashCountService;
    private final ActorProvider actorProvider;

    @PostMapping
    public ResponseEntity<CashCountResponse> recordCount(@Valid @RequestBody RecordCashCountRequest request) {
        CashCount count = cashCountService.record(request.toInput(), actorProvider.currentActor());
        return ResponseEntity.status(HttpStatus.CREATED).body(CashCountResponse.from(count));
    }

    @GetMapping("/{countId}")
    public ResponseEntity<CashCountResponse> getCount(@PathVariable("countId") UUID countId) {
        return ResponseEntity.ok(CashCountResponse.from(cashCountService.get(countId)));
    }

    @GetMapping
    public ResponseEntity<List<CashCountResponse>> listCounts(@RequestParam("scope_type") ScopeType scopeType,
                                                              @RequestParam("scope_id") UUID scopeId) {
        return ResponseEntity.ok(cashCountService.listForScope(scopeType, scopeId).stream()
            .map(CashCountResponse::from)
            .toList());
    }

    @GetMapping("/alerts")
    public ResponseEntity<List<CashCountResponse>> listAlerts() {
        return ResponseEntity.ok(cashCountService.listAlerts().stream()
            .map(CashCountResponse::from)
            .toList());
    }
}
