package com.entity.aggregation.ingest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Tries extraction providers in order and returns the first non-empty answer.
 * A provider that is unavailable is skipped; a provider that throws is logged and skipped.
 * When no provider produces anything the result is empty.
 */
public class ExtractionProviderChain implements EntityExtractionProvider {
    private static final Logger log = LoggerFactory.getLogger(ExtractionProviderChain.class);

    private final List<EntityExtractionProvider> providers;

    public ExtractionProviderChain(List<EntityExtractionProvider> providers) {
        this.providers = List.copyOf(providers);
    }

    public static ExtractionProviderChain of(EntityExtractionProvider... providers) {
        return new ExtractionProviderChain(List.of(providers));
    }

    @Override
    public List<ExtractedEntity> extract(ContentAnalysis analysis) {
        for (EntityExtractionProvider provider : providers) {
            if (!provider.isAvailable()) {
                log.debug("Skipping unavailable provider {}", provider.getProviderName());
                continue;
            }
            try {
                List<ExtractedEntity> extracted = provider.extract(analysis);
                if (extracted != null && !extracted.isEmpty()) {
                    log.debug("Provider {} extracted {} entities from {}",
                            provider.getProviderName(), extracted.size(), analysis.contentId());
                    return List.copyOf(extracted);
                }
            } catch (RuntimeException e) {
                log.warn("Provider {} failed on {}: {}",
                        provider.getProviderName(), analysis.contentId(), e.getMessage(), e);
            }
        }
        return List.of();
    }

    @Override
    public String getProviderName() {
        return "chain" + providers.stream().map(EntityExtractionProvider::getProviderName).toList();
    }

    @Override
    public boolean isAvailable() {
        return providers.stream().anyMatch(EntityExtractionProvider::isAvailable);
    }

    public List<EntityExtractionProvider> getProviders() {
        return providers;
    }
}
