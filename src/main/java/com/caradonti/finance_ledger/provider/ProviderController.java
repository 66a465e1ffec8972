package com.caradonti.finance_ledger.provider;

import com.caradonti.finance_ledger.identity.ActorProvider;
import com.caradonti.finance_ledger.provider.dto.CreateProviderRequest;
import com.caradonti.finance_ledger.provider.dto.ProviderResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/providers")
@RequiredArgsConstructor
public class ProviderController {

    private final ProviderUsageService providerUsageService;
    private final ActorProvider actorProvider;

    @PostMapping
    public ResponseEntity<ProviderResponse> createProvider(@Valid @RequestBody CreateProviderRequest request) {
        Provider provider = providerUsageService.create(request.getName(), request.getCategory(),
            actorProvider.currentActor().getAuditName());
        return ResponseEntity.status(HttpStatus.CREATED).body(ProviderResponse.from(provider));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ProviderResponse> getProvider(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(ProviderResponse.from(providerUsageService.get(id)));
    }

    /**
     * Most used providers first.
     */
    @GetMapping
    public ResponseEntity<List<ProviderResponse>> listProviders() {
        return ResponseEntity.ok(providerUsageService.listByUsage().stream()
            .map(ProviderResponse::from)
            .toList());
    }
}
