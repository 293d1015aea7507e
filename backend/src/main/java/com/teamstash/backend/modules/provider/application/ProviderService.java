package com.teamstash.backend.modules.provider.application;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.teamstash.backend.global.error.ProblemException;
import com.teamstash.backend.modules.provider.domain.Provider;
import com.teamstash.backend.modules.provider.infrastructure.persistence.ProviderRepository;
import com.teamstash.backend.modules.provider.presentation.dto.ProviderResponse;
import com.teamstash.backend.modules.team.application.TeamRoleAuthorizer;
import com.teamstash.backend.modules.team.domain.ActiveTeam;
import com.teamstash.backend.modules.team.domain.TeamCapability;
import com.teamstash.backend.modules.team.infrastructure.persistence.TeamRepository;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class ProviderService {

    private final ProviderRepository providerRepository;
    private final TeamRepository teamRepository;
    private final TeamRoleAuthorizer authorizer;

    public ProviderService(ProviderRepository providerRepository, TeamRepository teamRepository, TeamRoleAuthorizer authorizer) {
        this.providerRepository = providerRepository;
        this.teamRepository = teamRepository;
        this.authorizer = authorizer;
    }

    @Transactional(readOnly = true)
    public List<ProviderResponse> listProviders(ActiveTeam activeTeam) {
        authorizer.require(activeTeam, TeamCapability.READ_DATA);
        return providerRepository.findAllByTeamId(activeTeam.teamId()).stream()
                .map(ProviderResponse::from)
                .toList();
    }

    public ProviderResponse createProvider(ActiveTeam activeTeam, UUID principalId, String rawName, String rawDescription) {
        authorizer.require(activeTeam, TeamCapability.MUTATE_DATA);
        String name = requireName(rawName, rawDescription);
        String description = trimToNull(rawDescription);
        if (providerRepository.findByTeamIdAndName(activeTeam.teamId(), name).isPresent()) {
            throw nameConflict(name, description);
        }
        Provider provider = new Provider(teamRepository.getReferenceById(activeTeam.teamId()), name, description, principalId);
        try {
            return ProviderResponse.from(providerRepository.saveAndFlush(provider));
        } catch (DataIntegrityViolationException ex) {
            throw nameConflict(name, description);
        }
    }

    public ProviderResponse updateProvider(ActiveTeam activeTeam, UUID providerId, String rawName, String rawDescription) {
        authorizer.require(activeTeam, TeamCapability.MUTATE_DATA);
        Provider provider = findProvider(activeTeam, providerId);
        String name = requireName(rawName, rawDescription);
        String description = trimToNull(rawDescription);
        boolean takenByOther = providerRepository.findByTeamIdAndName(activeTeam.teamId(), name)
                .filter(other -> !other.getId().equals(providerId))
                .isPresent();
        if (takenByOther) {
            throw nameConflict(name, description);
        }
        provider.setName(name);
        provider.setDescription(description);
        try {
            return ProviderResponse.from(providerRepository.saveAndFlush(provider));
        } catch (DataIntegrityViolationException ex) {
            throw nameConflict(name, description);
        }
    }

    /**
     * Items that linked to the provider keep existing; the database clears their link.
     */
    public void deleteProvider(ActiveTeam activeTeam, UUID providerId) {
        authorizer.require(activeTeam, TeamCapability.MUTATE_DATA);
        providerRepository.delete(findProvider(activeTeam, providerId));
    }

    private Provider findProvider(ActiveTeam activeTeam, UUID providerId) {
        return providerRepository.findByIdAndTeamId(providerId, activeTeam.teamId())
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "provider.not_found", "Provider not found."));
    }

    private static String requireName(String rawName, String rawDescription) {
        String name = trimToNull(rawName);
        if (name == null) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "provider.invalid_name", "Provider name is required.")
                    .withRejectedInput(rejected(rawName, rawDescription));
        }
        return name;
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static ProblemException nameConflict(String name, String description) {
        return new ProblemException(HttpStatus.CONFLICT, "provider.name_conflict",
                "A provider with the name \"" + name + "\" already exists.")
                .withRejectedInput(rejected(name, description));
    }

    private static Map<String, Object> rejected(String name, String description) {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("name", name);
        input.put("description", description);
        return input;
    }
}
