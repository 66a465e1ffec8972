package com.caradonti.finance_ledger.provider;

import com.caradonti.finance_ledger.exception.NotFoundException;
import com.caradonti.finance_ledger.money.MoneyPair;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Providers and their usage counters.
 *
 * {@link #recordUsage} and {@link #reverseUsage} join the caller's transaction,
 * so the counters move together with the ledger write that referenced the provider.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProviderUsageService {

    private final ProviderRepository providerRepository;

    @Transactional
    public Provider create(String name, String category, String createdBy) {
        Provider provider = Provider.create(name, category, createdBy);
        providerRepository.save(ProviderEntity.fromDomain(provider));
        log.info("Provider created: id={}, name={}", provider.getId(), provider.getName());
        return provider;
    }

    @Transactional(readOnly = true)
    public Provider get(UUID providerId) {
        return providerRepository.findById(providerId)
            .map(ProviderEntity::toDomain)
            .orElseThrow(() -> new NotFoundException("Provider", providerId));
    }

    @Transactional(readOnly = true)
    public List<Provider> listByUsage() {
        return providerRepository.findAllByOrderByUsageCountDescNameAsc().stream()
            .map(ProviderEntity::toDomain)
            .toList();
    }

    /**
     * Counts one use of the provider for an entry that paid it {@code amount}.
     *
     * @throws NotFoundException if the provider does not exist
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void recordUsage(UUID providerId, MoneyPair amount) {
        ProviderEntity provider = providerRepository.findById(providerId)
            .orElseThrow(() -> new NotFoundException("Provider", providerId));
        provider.incrementUsage(amount);
        providerRepository.save(provider);
        log.debug("Provider usage recorded: providerId={}, usageCount={}", providerId, provider.getUsageCount());
    }

    /**
     * Takes back one use of {@code amount}, for an entry moved to another provider.
     * Counters never drop below zero.
     *
     * @throws NotFoundException if the provider does not exist
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void reverseUsage(UUID providerId, MoneyPair amount) {
        ProviderEntity provider = providerRepository.findById(providerId)
            .orElseThrow(() -> new NotFoundException("Provider", providerId));
        provider.decrementUsage(amount);
        providerRepository.save(provider);
        log.debug("Provider usage reversed: providerId={}, usageCount={}", providerId, provider.getUsageCount());
    }
}
