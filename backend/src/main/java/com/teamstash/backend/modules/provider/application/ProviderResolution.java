package com.teamstash.backend.modules.provider.application;

import java.util.Optional;
import java.util.UUID;

/**
 * Either a link to an existing provider record or a free-text name to store on the item, never both.
 */
public record ProviderResolution(UUID providerId, String manualName) {

    private static final ProviderResolution NONE = new ProviderResolution(null, null);

    public static ProviderResolution none() {
        return NONE;
    }

    public static ProviderResolution linked(UUID providerId) {
        return new ProviderResolution(providerId, null);
    }

    public static ProviderResolution manual(String manualName) {
        return new ProviderResolution(null, manualName);
    }

    public Optional<UUID> linkedId() {
        return Optional.ofNullable(providerId);
    }

    public Optional<String> manualNameToStore() {
        return Optional.ofNullable(manualName);
    }
}
