package com.teamstash.backend.modules.provider.application;

import java.util.UUID;

import com.teamstash.backend.modules.provider.infrastructure.persistence.ProviderRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Turns a free-text provider name from an item form into a provider link when the team has a
 * record with exactly that name. Otherwise the trimmed text is kept on the item as is.
 */
@Service
@Transactional(readOnly = true)
public class ProviderResolver {

    private final ProviderRepository providerRepository;

    public ProviderResolver(ProviderRepository providerRepository) {
        this.providerRepository = providerRepository;
    }

    public ProviderResolution resolve(UUID teamId, String manualName) {
        if (manualName == null || manualName.isBlank()) {
            return ProviderResolution.none();
        }
        String name = manualName.trim();
        return providerRepository.findByTeamIdAndName(teamId, name)
                .map(provider -> ProviderResolution.linked(provider.getId()))
                .orElseGet(() -> ProviderResolution.manual(name));
    }
}
